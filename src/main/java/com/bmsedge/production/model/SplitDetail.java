package com.bmsedge.production.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

@Getter
@EqualsAndHashCode
@ToString
public class SplitDetail {

    private final String workCenter;
    private final String client;
    private final String fabric;
    private final BigDecimal production;

    public SplitDetail(String workCenter, String client, String fabric, BigDecimal production) {
        this.workCenter = workCenter;
        this.client = client;
        this.fabric = fabric;
        this.production = production;
    }
}
