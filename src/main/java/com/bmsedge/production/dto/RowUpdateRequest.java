package com.bmsedge.production.dto;

import com.bmsedge.production.util.BigDecimalDeserializer;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;

/**
 * Operator edits to one staged row. Null fields are left unchanged.
 */
@Setter
@Getter
public class RowUpdateRequest {

    private Boolean selected;

    @JsonDeserialize(using = BigDecimalDeserializer.class)
    private BigDecimal newRemaining;

    @Size(max = 100)
    private String newStatus;

    @Size(max = 500)
    private String note;

    public RowUpdateRequest() {}
}
