package com.bmsedge.production.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.Setter;

/**
 * Assigns a work center to a machine. A null machine id clears the mapping.
 */
@Setter
@Getter
public class MappingUpdateRequest {

    @NotBlank(message = "Work center is required")
    @Size(max = 200)
    private String workCenter;

    private Long machineId;

    public MappingUpdateRequest() {}

    public MappingUpdateRequest(String workCenter, Long machineId) {
        this.workCenter = workCenter;
        this.machineId = machineId;
    }
}
