package eventbus;

/**
 * Event and handler priority. Lower {@linkplain #level() levels} run first.
 */
public enum Priority {
    CRITICAL(1),
    HIGH(2),
    NORMAL(3),
    LOW(4);

    private final int level;

    Priority(int level) {
        this.level = level;
    }

    public int level() {
        return level;
    }

    /**
     * Resolves a priority from its numeric level.
     *
     * @param level 1 (critical) to 4 (low)
     * @return the matching priority
     * @throws IllegalArgumentException if no priority has that level
     */
    public static Priority fromLevel(int level) {
        for (Priority priority : values()) {
            if (priority.level == level) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown priority level: " + level);
    }
}
