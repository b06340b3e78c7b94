package com.bmsedge.production.dto;

import lombok.Getter;
import lombok.Setter;

import java.util.List;

/**
 * Fabric names approved for creation. When the list is omitted every missing fabric is created.
 */
@Setter
@Getter
public class FabricCreationRequest {

    private List<String> create;

    public FabricCreationRequest() {}

    public FabricCreationRequest(List<String> create) {
        this.create = create;
    }
}
