package io.gatesync.core.config.model;

/**
 * Declaration order is the pipeline order: aggregators price relative to everything before them.
 */
public enum ProviderKind {
    NEWAPI,
    DIRECT,
    SUB2API
}
