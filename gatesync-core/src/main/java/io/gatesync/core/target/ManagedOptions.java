package io.gatesync.core.target;

import java.util.List;

/**
 * Target option keys whose JSON values this tool owns, in part or entirely.
 */
public final class ManagedOptions {
    public static final String GROUP_RATIO = "GroupRatio";
    public static final String USER_USABLE_GROUPS = "UserUsableGroups";
    public static final String AUTO_GROUPS = "AutoGroups";
    public static final String DEFAULT_USE_AUTO_GROUP = "DefaultUseAutoGroup";
    public static final String MODEL_RATIO = "ModelRatio";
    public static final String COMPLETION_RATIO = "CompletionRatio";
    public static final String MODEL_PRICE = "ModelPrice";

    public static final String AUTO_GROUP = "auto";
    public static final String AUTO_GROUP_LABEL = "Auto (Smart Routing with Failover)";

    public static final List<String> KEYS = List.of(
        GROUP_RATIO,
        USER_USABLE_GROUPS,
        AUTO_GROUPS,
        DEFAULT_USE_AUTO_GROUP,
        MODEL_RATIO,
        COMPLETION_RATIO,
        MODEL_PRICE
    );

    private ManagedOptions() {
    }
}
