package com.bmsedge.production.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * A work-center label seen in the import, the fabrics observed under it and the
 * machine it would be assigned to. Always shown to the operator before reconciliation.
 */
@Getter
@Setter
@EqualsAndHashCode
@ToString
public class WorkCenterProposal {

    private String workCenter;
    private List<String> fabrics = new ArrayList<>();
    private Long machineId;
    private String machineName;
    private ResolutionSource source = ResolutionSource.UNRESOLVED;
    private int rowCount;

    public WorkCenterProposal() {}

    public WorkCenterProposal(String workCenter) {
        this.workCenter = workCenter;
    }

    public boolean isResolved() {
        return machineId != null;
    }
}
