package me.golemcore.orchestrator.domain.model;

/**
 * Priority bucket of a context fragment. The weight is used for ordering and
 * for the combined ranking score.
 */
public enum ContextTier {

    HIGH(3), MEDIUM(2), LOW(1);

    private final int weight;

    ContextTier(int weight) {
        this.weight = weight;
    }

    public int getWeight() {
        return weight;
    }

    public static ContextTier forType(ContextType type) {
        if (type == null) {
            return LOW;
        }
        return switch (type) {
        case CURRENT_FILE, DEPENDENCY -> HIGH;
        case IMPORT -> MEDIUM;
        case OTHER -> LOW;
        };
    }
}
