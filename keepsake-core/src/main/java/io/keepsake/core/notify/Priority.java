package io.keepsake.core.notify;

public enum Priority {
    MIN("min"),
    LOW("low"),
    DEFAULT("default"),
    HIGH("high"),
    MAX("max");

    private final String wireValue;

    Priority(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }
}
