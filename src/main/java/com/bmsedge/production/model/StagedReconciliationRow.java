package com.bmsedge.production.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Proposed state change for one machine on the import date, awaiting the
 * operator's decision. Only rows with {@code selected = true} are committed.
 */
@Getter
@Setter
@EqualsAndHashCode
@ToString
public class StagedReconciliationRow {

    private Long machineId;
    private String machineName;

    // Previous day
    private LocalDate previousDate;
    private String previousStatus;
    private String previousClient;
    private String previousFabric;
    private BigDecimal previousRemaining = BigDecimal.ZERO;
    @JsonProperty("isStale")
    private boolean stale;

    // Imported figures
    private boolean hasImportData;
    private LocalDate importDate;
    private BigDecimal importProduction = BigDecimal.ZERO;
    private BigDecimal importScrap = BigDecimal.ZERO;
    private String importClient = "";
    private String importFabric = "";
    private List<String> sourceWorkCenters = new ArrayList<>();
    @JsonProperty("isSplit")
    private boolean split;
    private List<SplitDetail> splitDetails = new ArrayList<>();

    // Forecast
    private BigDecimal newRemaining = BigDecimal.ZERO;
    private String newStatus;
    private String note = "";

    private ValidationStatus validationStatus = ValidationStatus.SAFE;
    private String validationMessage = "";

    private boolean selected;

    public StagedReconciliationRow() {}

    /**
     * Adds a validation finding. The message is appended and the status only escalates.
     */
    public void addFinding(ValidationStatus severity, String message) {
        this.validationStatus = this.validationStatus.escalate(severity);
        if (validationMessage == null || validationMessage.isEmpty()) {
            this.validationMessage = message;
        } else {
            this.validationMessage = validationMessage + " " + message;
        }
    }

    public void setNewRemaining(BigDecimal newRemaining) {
        this.newRemaining = DailyLog.nonNegative(newRemaining);
    }

    public boolean isSafe() {
        return validationStatus == ValidationStatus.SAFE;
    }
}
