package com.bmsedge.production.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

@Getter
@Setter
@EqualsAndHashCode
@ToString
public class FabricProposal {

    private String name;
    private String code;
    private String shortName;
    private boolean create = true;

    public FabricProposal() {}

    public FabricProposal(String name, String code, String shortName) {
        this.name = name;
        this.code = code;
        this.shortName = shortName;
    }
}
