package com.bmsedge.production.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Row of the per-machine log collection embedded in {@link Machine}.
 * Both remaining columns are kept for older readers.
 */
@Getter
@Setter
@Embeddable
public class DailyLogEntry {

    @Column(name = "log_date", nullable = false)
    private LocalDate logDate;

    @Column(name = "status", length = 100)
    private String status;

    @Column(name = "fabric")
    private String fabric;

    @Column(name = "client", length = 100)
    private String client;

    @Column(name = "day_production", precision = 12, scale = 2)
    private BigDecimal dayProduction;

    @Column(name = "scrap", precision = 12, scale = 2)
    private BigDecimal scrap;

    // legacy key
    @Column(name = "remaining", precision = 12, scale = 2)
    private BigDecimal remaining;

    @Column(name = "remaining_mfg", precision = 12, scale = 2)
    private BigDecimal remainingMfg;

    @Column(name = "reason", length = 500)
    private String reason;

    public DailyLogEntry() {}
}
