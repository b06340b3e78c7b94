package com.bmsedge.production.repository;

import com.bmsedge.production.model.DailyLog;
import lombok.Getter;
import lombok.ToString;

/**
 * A daily log to be written for one machine: an upsert into the machine's log
 * collection plus an upsert of the per-date record.
 */
@Getter
@ToString
public class LogWrite {

    public static final int OPERATIONS = 2;

    private final Long machineId;
    private final DailyLog log;

    public LogWrite(Long machineId, DailyLog log) {
        this.machineId = machineId;
        this.log = log;
    }
}
