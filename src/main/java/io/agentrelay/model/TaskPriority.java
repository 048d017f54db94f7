package io.agentrelay.model;

public enum TaskPriority {
    LOW(1),
    NORMAL(2),
    HIGH(3),
    URGENT(4);

    private final int level;

    TaskPriority(int level) {
        this.level = level;
    }

    public int level() {
        return level;
    }

    public static TaskPriority fromLevel(int level) {
        for (TaskPriority value : values()) {
            if (value.level == level) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown priority level: " + level);
    }

    public static TaskPriority fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return NORMAL;
        }
        for (TaskPriority value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown priority: " + raw);
    }
}
