package fr.lapetina.llmrouter.domain.model;

/**
 * Layers of the response cache, fastest first.
 */
public enum CacheTier {
    LOCAL("memory"),
    SHARED("distributed");

    private final String tag;

    CacheTier(String tag) {
        this.tag = tag;
    }

    /**
     * Returns the name used for this tier in metric tags.
     */
    public String getTag() {
        return tag;
    }
}
