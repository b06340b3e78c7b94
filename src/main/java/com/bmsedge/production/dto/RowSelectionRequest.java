package com.bmsedge.production.dto;

import com.bmsedge.production.model.RowFilter;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;

@Setter
@Getter
public class RowSelectionRequest {

    private RowFilter filter = RowFilter.ALL;

    @NotNull(message = "Selected flag is required")
    private Boolean selected;

    public RowSelectionRequest() {}

    public RowSelectionRequest(RowFilter filter, Boolean selected) {
        this.filter = filter;
        this.selected = selected;
    }
}
