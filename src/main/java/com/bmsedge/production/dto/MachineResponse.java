package com.bmsedge.production.dto;

import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@Setter
@Getter
public class MachineResponse {
    private Long id;
    private String machineName;
    private Integer machineNumber;
    private String machineType;
    private String status;
    private String client;
    private String fabric;
    private BigDecimal remainingMfg;
    private LocalDate lastLogDate;
    private List<String> workCenterAliases;
    private Integer logCount;

    public MachineResponse() {}
}
