package com.bmsedge.production.model;

/**
 * Known machine status labels. Logs store the label text and operators may
 * enter statuses outside this list.
 */
public enum MachineStatus {
    WORKING("Working"),
    UNDER_OPERATION("Under Operation"),
    NO_ORDER("No Order"),
    OUT_OF_SERVICE("Out of Service"),
    CHANGEOVER("Qalb"),
    STOPPED("Stopped"),
    OTHER("Other");

    private final String label;

    MachineStatus(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public boolean matches(String status) {
        return label.equals(status);
    }

    public static boolean isWorking(String status) {
        return WORKING.matches(status);
    }
}
