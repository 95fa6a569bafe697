package fr.lapetina.aigateway.infrastructure.cache;

/**
 * Where a cache hit was served from.
 */
public enum CacheTier {
    MEMORY("memory"),
    PERSISTENT("persistent"),
    SIMILARITY("similarity");

    private final String name;

    CacheTier(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
