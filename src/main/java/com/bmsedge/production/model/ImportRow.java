package com.bmsedge.production.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * One parsed line of the daily production sheet.
 */
@Getter
@EqualsAndHashCode
@ToString
public class ImportRow {

    private final int rowNumber;
    private final String fabricName;
    private final BigDecimal production;
    private final String customer;
    private final BigDecimal scrap;
    private final String workCenter;

    public ImportRow(int rowNumber, String fabricName, BigDecimal production,
                     String customer, BigDecimal scrap, String workCenter) {
        this.rowNumber = rowNumber;
        this.fabricName = fabricName != null ? fabricName : "";
        this.production = production != null ? production : BigDecimal.ZERO;
        this.customer = customer != null ? customer : "";
        this.scrap = scrap != null ? scrap : BigDecimal.ZERO;
        this.workCenter = workCenter != null ? workCenter.trim() : "";
    }

    /**
     * Client name is the first whitespace or hyphen delimited token of the customer text.
     */
    public String getClientName() {
        String trimmed = customer.trim();
        if (trimmed.isEmpty()) {
            return "";
        }
        return trimmed.split("[\\s-]")[0].trim();
    }
}
