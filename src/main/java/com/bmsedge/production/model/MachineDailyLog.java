package com.bmsedge.production.model;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Normalized per-date log record, one per (machine, date).
 * Later reconciliations read their previous log from here.
 */
@Getter
@Setter
@Entity
@Table(name = "daily_log_records",
        uniqueConstraints = {
                @UniqueConstraint(
                        name = "uk_daily_log_machine_date",
                        columnNames = {"machine_id", "log_date"}
                )
        },
        indexes = {
                @Index(name = "idx_daily_log_date", columnList = "log_date")
        })
public class MachineDailyLog {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Column(name = "machine_id", nullable = false)
    private Long machineId;

    @NotNull
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

    @Column(name = "remaining", precision = 12, scale = 2)
    private BigDecimal remaining;

    @Column(name = "remaining_mfg", precision = 12, scale = 2)
    private BigDecimal remainingMfg;

    @Column(name = "reason", length = 500)
    private String reason;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public MachineDailyLog() {}

    public MachineDailyLog(Long machineId, LocalDate logDate) {
        this.machineId = machineId;
        this.logDate = logDate;
    }

    @PrePersist
    @PreUpdate
    protected void touch() {
        updatedAt = LocalDateTime.now();
    }
}
