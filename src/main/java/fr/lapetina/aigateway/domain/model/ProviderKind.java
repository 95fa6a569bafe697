package fr.lapetina.aigateway.domain.model;

import java.util.Locale;

/**
 * The closed set of backend families the gateway can talk to.
 */
public enum ProviderKind {
    OPENAI("openai"),
    ANTHROPIC("anthropic"),
    VERTEX("vertex"),
    GROK("grok"),
    COPILOT("copilot");

    private final String wireName;

    ProviderKind(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * Resolves a kind from its configuration name ("openai", "grok", ...) or enum constant name.
     */
    public static ProviderKind fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Provider kind is required");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (ProviderKind kind : values()) {
            if (kind.wireName.equals(normalized)) {
                return kind;
            }
        }
        if (normalized.equals("xai")) {
            return GROK;
        }
        throw new IllegalArgumentException("Unknown provider kind: " + name);
    }
}
