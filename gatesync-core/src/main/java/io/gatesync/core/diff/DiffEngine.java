package io.gatesync.core.diff;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.gatesync.core.catalog.VendorCatalog;
import io.gatesync.core.pipeline.DesiredModel;
import io.gatesync.core.pipeline.DesiredState;
import io.gatesync.core.pipeline.ManagedOptionMaps;
import io.gatesync.core.target.Channel;
import io.gatesync.core.target.ManagedOptions;
import io.gatesync.core.target.ModelMeta;
import io.gatesync.core.target.TargetSnapshot;
import io.gatesync.core.target.Vendor;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compares a desired state against a target snapshot. Only resources owned by the managed
 * providers are ever updated away or deleted; channels of other providers, and the models and
 * groups they reference, are left alone.
 */
public final class DiffEngine {
    private static final Logger LOG = LoggerFactory.getLogger(DiffEngine.class);

    public SyncDiff buildSyncDiff(DesiredState desired, TargetSnapshot snapshot) {
        Set<String> managed = desired.managedProviders();
        List<Channel> unmanagedChannels = snapshot.channels().stream()
            .filter(channel -> !channel.taggedBy(managed))
            .toList();
        return new SyncDiff(
            channelOperations(desired, snapshot),
            modelOperations(desired, snapshot, referencedModels(unmanagedChannels)),
            optionOperations(desired, snapshot, unmanagedChannels),
            true
        );
    }

    private List<DiffOperation<Channel>> channelOperations(DesiredState desired, TargetSnapshot snapshot) {
        Set<String> managed = desired.managedProviders();
        Map<String, Channel> existingByName = new LinkedHashMap<>();
        Map<String, Channel> foreignByName = new HashMap<>();
        for (Channel channel : snapshot.channels()) {
            if (channel.taggedBy(managed)) {
                existingByName.put(channel.name(), channel);
            } else {
                foreignByName.put(channel.name(), channel);
            }
        }
        Set<String> desiredNames = new LinkedHashSet<>();

        List<DiffOperation<Channel>> operations = new ArrayList<>();
        for (Channel wanted : desired.channels()) {
            desiredNames.add(wanted.name());
            Channel existing = existingByName.get(wanted.name());
            if (existing == null && foreignByName.containsKey(wanted.name())) {
                Channel foreign = foreignByName.get(wanted.name());
                LOG.warn("[target] Channel {} (id {}) belongs to {}, skipping", wanted.name(), foreign.id(),
                    foreign.tag() == null || foreign.tag().isEmpty() ? "no managed provider" : foreign.tag());
                continue;
            }
            if (existing == null) {
                operations.add(DiffOperation.create(wanted.name(), wanted));
                continue;
            }
            Channel update = wanted.withId(existing.id());
            if (!comparable(existing).equals(comparable(update))) {
                operations.add(DiffOperation.update(wanted.name(), existing, update));
            }
        }
        for (Channel existing : snapshot.channels()) {
            if (existing.taggedBy(managed) && !desiredNames.contains(existing.name())) {
                operations.add(DiffOperation.delete(existing.name(), existing));
            }
        }
        return operations;
    }

    /**
     * The fields a channel is compared on: everything but the id, with the base URL's trailing
     * slash dropped and an empty mapping treated as none.
     */
    static Channel comparable(Channel channel) {
        String baseUrl = channel.baseUrl();
        if (baseUrl != null && baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        String mapping = channel.modelMapping();
        if (mapping != null && (mapping.isBlank() || mapping.equals("{}"))) {
            mapping = null;
        }
        return new Channel(
            null,
            channel.name(),
            channel.type(),
            channel.key(),
            baseUrl,
            channel.models(),
            channel.group(),
            channel.priority(),
            channel.weight(),
            channel.status(),
            channel.tag(),
            channel.remark(),
            mapping
        );
    }

    private List<DiffOperation<ModelMeta>> modelOperations(DesiredState desired, TargetSnapshot snapshot, Set<String> protectedModels) {
        Map<String, Integer> vendorIds = vendorIds(snapshot.vendors());
        Map<String, ModelMeta> existingByName = new HashMap<>();
        snapshot.models().forEach(model -> existingByName.put(model.modelName(), model));

        List<DiffOperation<ModelMeta>> operations = new ArrayList<>();
        for (DesiredModel wanted : desired.models().values()) {
            Integer vendorId = wanted.vendor() == null ? null : vendorIds.get(wanted.vendor().toLowerCase(Locale.ROOT));
            ModelMeta target = new ModelMeta(null, wanted.modelName(), vendorId, wanted.endpoints(), 1, ModelMeta.OWNED);
            ModelMeta existing = existingByName.get(wanted.modelName());
            if (existing == null) {
                operations.add(DiffOperation.create(wanted.modelName(), target));
                continue;
            }
            boolean changed = !Objects.equals(existing.vendorId(), vendorId)
                || !sameEndpoints(existing.endpoints(), wanted.endpoints())
                || !existing.owned()
                || !Objects.equals(existing.status(), 1);
            if (changed) {
                operations.add(DiffOperation.update(wanted.modelName(), existing, target.withId(existing.id())));
            }
        }

        for (ModelMeta existing : snapshot.models()) {
            String name = existing.modelName();
            if (desired.models().containsKey(name) || protectedModels.contains(name)) {
                continue;
            }
            boolean mappingSource = desired.mappingSources().contains(name);
            if ((mappingSource || existing.owned()) && existing.id() != null) {
                operations.add(DiffOperation.delete(name, existing));
            }
        }
        return operations;
    }

    private static boolean sameEndpoints(String existing, String wanted) {
        if (existing == null || wanted == null) {
            return existing == null && wanted == null;
        }
        return OptionValues.normalize(existing).equals(OptionValues.normalize(wanted));
    }

    /**
     * Lowercased vendor name to id. Vendors the target labels differently, such as a localized
     * name, are found through the catalog's aliases.
     */
    static Map<String, Integer> vendorIds(List<Vendor> vendors) {
        Map<String, Integer> ids = new HashMap<>();
        for (Vendor vendor : vendors) {
            ids.put(vendor.name().toLowerCase(Locale.ROOT), (int) vendor.id());
        }
        for (Map.Entry<String, List<String>> entry : VendorCatalog.nameAliases().entrySet()) {
            if (ids.containsKey(entry.getKey())) {
                continue;
            }
            for (String alias : entry.getValue()) {
                String needle = alias.toLowerCase(Locale.ROOT);
                Optional<Vendor> match = vendors.stream()
                    .filter(vendor -> vendor.name().toLowerCase(Locale.ROOT).contains(needle))
                    .findFirst();
                if (match.isPresent()) {
                    ids.put(entry.getKey(), (int) match.get().id());
                    break;
                }
            }
        }
        return ids;
    }

    private List<DiffOperation<String>> optionOperations(DesiredState desired, TargetSnapshot snapshot, List<Channel> unmanagedChannels) {
        Map<String, String> wanted = managedOptionValues(desired.options(), snapshot.options(), unmanagedChannels);
        List<DiffOperation<String>> operations = new ArrayList<>();
        for (Map.Entry<String, String> entry : wanted.entrySet()) {
            String existing = snapshot.options().get(entry.getKey());
            if (existing == null) {
                operations.add(DiffOperation.create(entry.getKey(), entry.getValue()));
            } else if (!OptionValues.normalize(existing).equals(entry.getValue())) {
                operations.add(DiffOperation.update(entry.getKey(), existing, entry.getValue()));
            }
        }
        return operations;
    }

    /**
     * Serialized value of every managed option key. Entries the target holds for groups and
     * models of unmanaged channels survive; everything else is replaced by this run's values.
     */
    static Map<String, String> managedOptionValues(ManagedOptionMaps options, Map<String, String> current, List<Channel> unmanagedChannels) {
        Set<String> unmanagedGroups = new LinkedHashSet<>();
        unmanagedChannels.forEach(channel -> unmanagedGroups.add(channel.group()));
        Set<String> protectedModels = referencedModels(unmanagedChannels);

        ObjectNode groupRatio = mergeProtected(current, ManagedOptions.GROUP_RATIO, unmanagedGroups, OptionValues.numbers(options.groupRatio()));

        Map<String, String> userGroups = new LinkedHashMap<>();
        userGroups.put(ManagedOptions.AUTO_GROUP, ManagedOptions.AUTO_GROUP_LABEL);
        userGroups.putAll(options.userUsableGroups());
        ObjectNode userUsableGroups = mergeProtected(current, ManagedOptions.USER_USABLE_GROUPS, unmanagedGroups, OptionValues.strings(userGroups));

        Set<String> autoGroups = new LinkedHashSet<>();
        for (JsonNode group : OptionValues.array(OptionValues.parse(current.get(ManagedOptions.AUTO_GROUPS)))) {
            if (group.isTextual() && unmanagedGroups.contains(group.asText())) {
                autoGroups.add(group.asText());
            }
        }
        autoGroups.addAll(options.autoGroups());
        List<String> orderedAutoGroups = autoGroups.stream()
            .sorted(Comparator.comparingDouble(group -> ratioOf(groupRatio, group)))
            .toList();

        Map<String, String> values = new LinkedHashMap<>();
        values.put(ManagedOptions.GROUP_RATIO, OptionValues.write(groupRatio));
        values.put(ManagedOptions.USER_USABLE_GROUPS, OptionValues.write(userUsableGroups));
        values.put(ManagedOptions.AUTO_GROUPS, OptionValues.write(OptionValues.stringArray(orderedAutoGroups)));
        values.put(ManagedOptions.DEFAULT_USE_AUTO_GROUP, Boolean.toString(options.defaultUseAutoGroup()));
        values.put(ManagedOptions.MODEL_RATIO, OptionValues.write(
            mergeProtected(current, ManagedOptions.MODEL_RATIO, protectedModels, OptionValues.numbers(options.modelRatio()))));
        values.put(ManagedOptions.COMPLETION_RATIO, OptionValues.write(
            mergeProtected(current, ManagedOptions.COMPLETION_RATIO, protectedModels, OptionValues.numbers(options.completionRatio()))));
        values.put(ManagedOptions.MODEL_PRICE, OptionValues.write(
            mergeProtected(current, ManagedOptions.MODEL_PRICE, protectedModels, OptionValues.numbers(options.modelPrice()))));
        return values;
    }

    private static ObjectNode mergeProtected(Map<String, String> current, String key, Set<String> guard, ObjectNode wanted) {
        ObjectNode existing = OptionValues.object(OptionValues.parse(current.get(key)));
        ObjectNode merged = existing.objectNode();
        existing.fields().forEachRemaining(entry -> {
            if (guard.contains(entry.getKey())) {
                merged.set(entry.getKey(), entry.getValue());
            }
        });
        merged.setAll(wanted);
        return merged;
    }

    private static double ratioOf(ObjectNode groupRatio, String group) {
        JsonNode ratio = groupRatio.get(group);
        return ratio != null && ratio.isNumber() ? ratio.asDouble() : 1.0;
    }

    private static Set<String> referencedModels(List<Channel> channels) {
        Set<String> models = new LinkedHashSet<>();
        channels.forEach(channel -> models.addAll(channel.modelList()));
        return models;
    }
}
