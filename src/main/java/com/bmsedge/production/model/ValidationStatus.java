package com.bmsedge.production.model;

public enum ValidationStatus {
    SAFE,
    WARNING,
    ERROR;

    /**
     * Never de-escalates: returns the more severe of the two.
     */
    public ValidationStatus escalate(ValidationStatus other) {
        return other.ordinal() > this.ordinal() ? other : this;
    }
}
