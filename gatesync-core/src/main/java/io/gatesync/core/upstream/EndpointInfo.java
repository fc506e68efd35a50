package io.gatesync.core.upstream;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record EndpointInfo(String path, String method) {
}
