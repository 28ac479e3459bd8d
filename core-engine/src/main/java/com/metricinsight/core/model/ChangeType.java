package com.metricinsight.core.model;

/**
 * Direction of a detected level shift.
 *
 * @since 1.0.0
 */
public enum ChangeType {

    LEVEL_SHIFT_UP("level_shift_up"),
    LEVEL_SHIFT_DOWN("level_shift_down");

    private final String label;

    ChangeType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
