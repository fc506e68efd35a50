package io.gatesync.core.config;

import java.util.List;

/**
 * The configuration file is missing, unreadable or invalid.
 */
public final class ConfigException extends RuntimeException {
    private final List<String> issues;

    public ConfigException(String message) {
        this(message, List.of(), null);
    }

    public ConfigException(String message, Throwable cause) {
        this(message, List.of(), cause);
    }

    public ConfigException(String message, List<String> issues) {
        this(message, issues, null);
    }

    private ConfigException(String message, List<String> issues, Throwable cause) {
        super(issues.isEmpty() ? message : message + System.lineSeparator() + "  " + String.join(System.lineSeparator() + "  ", issues), cause);
        this.issues = List.copyOf(issues);
    }

    public List<String> issues() {
        return issues;
    }
}
