package io.gatesync.core.pipeline;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * {@code endpoints} is the serialized endpoint-type to path map, null when unknown.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DesiredModel(String modelName, String vendor, String endpoints) {
}
