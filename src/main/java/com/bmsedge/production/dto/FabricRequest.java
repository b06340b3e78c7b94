package com.bmsedge.production.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.Setter;

@Setter
@Getter
public class FabricRequest {

    @NotBlank
    @Size(max = 255)
    private String name;

    public FabricRequest() {}
}
