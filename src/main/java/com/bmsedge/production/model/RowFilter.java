package com.bmsedge.production.model;

import java.util.function.Predicate;

/**
 * Filters the operator can apply to staged rows when viewing or bulk-selecting them.
 */
public enum RowFilter {
    ALL(row -> true),
    WARNINGS(row -> row.getValidationStatus() == ValidationStatus.WARNING),
    ERRORS(row -> row.getValidationStatus() == ValidationStatus.ERROR),
    SAFE(StagedReconciliationRow::isSafe),
    MISSING(row -> !row.isHasImportData());

    private final Predicate<StagedReconciliationRow> predicate;

    RowFilter(Predicate<StagedReconciliationRow> predicate) {
        this.predicate = predicate;
    }

    public boolean matches(StagedReconciliationRow row) {
        return predicate.test(row);
    }
}
