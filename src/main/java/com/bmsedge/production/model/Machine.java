package com.bmsedge.production.model;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Getter
@Setter
@Entity
@Table(name = "machines",
        indexes = {
                @Index(name = "idx_machines_name", columnList = "machine_name"),
                @Index(name = "idx_machines_number", columnList = "machine_number")
        })
public class Machine {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotBlank
    @Size(max = 100)
    @Column(name = "machine_name", nullable = false)
    private String machineName;

    // number painted on the machine, used by some work-center exports
    @Column(name = "machine_number")
    private Integer machineNumber;

    @Size(max = 100)
    @Column(name = "machine_type")
    private String machineType;

    // Current state, refreshed from the most recent log
    @Column(name = "status", length = 100)
    private String status;

    @Column(name = "client", length = 100)
    private String client;

    @Column(name = "fabric")
    private String fabric;

    @Column(name = "remaining_mfg", precision = 12, scale = 2)
    private BigDecimal remainingMfg = BigDecimal.ZERO;

    @Column(name = "last_log_date")
    private LocalDate lastLogDate;

    @ElementCollection(fetch = FetchType.LAZY)
    @CollectionTable(name = "machine_daily_logs", joinColumns = @JoinColumn(name = "machine_id"))
    @OrderColumn(name = "log_index")
    private List<DailyLogEntry> dailyLogs = new ArrayList<>();

    @ElementCollection(fetch = FetchType.LAZY)
    @CollectionTable(name = "machine_work_center_aliases", joinColumns = @JoinColumn(name = "machine_id"))
    @Column(name = "work_center")
    private List<String> workCenterAliases = new ArrayList<>();

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public Machine() {}

    public Machine(String machineName, Integer machineNumber, String machineType) {
        this.machineName = machineName;
        this.machineNumber = machineNumber;
        this.machineType = machineType;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public Optional<DailyLogEntry> findLog(LocalDate date) {
        return dailyLogs.stream()
                .filter(entry -> date.equals(entry.getLogDate()))
                .findFirst();
    }

    /**
     * Replaces the entry for the same date, or appends when there is none.
     */
    public void upsertLog(DailyLogEntry entry) {
        for (int i = 0; i < dailyLogs.size(); i++) {
            if (entry.getLogDate().equals(dailyLogs.get(i).getLogDate())) {
                dailyLogs.set(i, entry);
                return;
            }
        }
        dailyLogs.add(entry);
    }

    public boolean isLatestDate(LocalDate date) {
        return lastLogDate == null || !date.isBefore(lastLogDate);
    }

    public void refreshCurrentState(DailyLog log) {
        this.status = log.getStatus();
        this.client = log.getClient();
        this.fabric = log.getFabric();
        this.remainingMfg = log.getRemainingMfg();
        this.lastLogDate = log.getDate();
    }
}
