package com.bmsedge.production.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One machine's production figures for one calendar day.
 * Remaining quantity is clamped to zero on construction.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class DailyLog {

    private final LocalDate date;
    private final String status;
    private final String fabric;
    private final String client;
    private final BigDecimal dayProduction;
    private final BigDecimal scrap;
    private final BigDecimal remainingMfg;
    private final String reason;

    public DailyLog(LocalDate date, String status, String fabric, String client,
                    BigDecimal dayProduction, BigDecimal scrap, BigDecimal remainingMfg, String reason) {
        if (date == null) {
            throw new IllegalArgumentException("Daily log date is required");
        }
        this.date = date;
        this.status = status;
        this.fabric = fabric != null ? fabric : "";
        this.client = client != null ? client : "";
        this.dayProduction = dayProduction != null ? dayProduction : BigDecimal.ZERO;
        this.scrap = scrap != null ? scrap : BigDecimal.ZERO;
        this.remainingMfg = nonNegative(remainingMfg);
        this.reason = reason != null ? reason : "";
    }

    public static BigDecimal nonNegative(BigDecimal value) {
        if (value == null || value.signum() < 0) {
            return BigDecimal.ZERO;
        }
        return value;
    }
}
