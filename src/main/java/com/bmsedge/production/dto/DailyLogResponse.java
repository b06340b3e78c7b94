package com.bmsedge.production.dto;

import com.bmsedge.production.model.DailyLog;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One daily log as served to clients. The remaining quantity is sent under both
 * {@code remainingMfg} and the legacy {@code remaining} key.
 */
@Setter
@Getter
public class DailyLogResponse {
    private LocalDate date;
    private String status;
    private String fabric;
    private String client;
    private BigDecimal dayProduction;
    private BigDecimal scrap;
    private BigDecimal remainingMfg;
    private BigDecimal remaining;
    private String reason;

    public DailyLogResponse() {}

    public DailyLogResponse(DailyLog log) {
        this.date = log.getDate();
        this.status = log.getStatus();
        this.fabric = log.getFabric();
        this.client = log.getClient();
        this.dayProduction = log.getDayProduction();
        this.scrap = log.getScrap();
        this.remainingMfg = log.getRemainingMfg();
        this.remaining = log.getRemainingMfg();
        this.reason = log.getReason();
    }
}
