package com.fotofun.eventstore.execution;

/** How a tool should choose the images it works on. */
public enum TargetingMode {
    /** No image to work on. */
    NONE("none"),
    /** The frozen selection, while the user still has something selected. */
    SELECTION("selection"),
    /** Exactly one candidate image, picked without a selection. */
    AUTO_SINGLE("auto-single"),
    /** Every candidate image. */
    ALL("all");

    private final String value;

    TargetingMode(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
