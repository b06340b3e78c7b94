package com.bmsedge.production.dto;

import com.bmsedge.production.model.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Setter
@Getter
public class ImportSessionResponse {
    private String sessionId;
    private LocalDate targetDate;
    private String fileName;
    private ImportSessionStage stage;
    private LocalDateTime createdAt;
    private int totalRows;
    private int skippedRows;
    private List<WorkCenterProposal> workCenters;
    private List<FabricProposal> missingFabrics;
    private List<StagedReconciliationRow> rows;
    private Map<String, Long> summary;

    public ImportSessionResponse() {}

    public static ImportSessionResponse from(ImportSession session, RowFilter filter) {
        ImportSessionResponse response = new ImportSessionResponse();
        response.setSessionId(session.getId());
        response.setTargetDate(session.getTargetDate());
        response.setFileName(session.getFileName());
        response.setStage(session.getStage());
        response.setCreatedAt(session.getCreatedAt());
        response.setTotalRows(session.getRows().size());
        response.setSkippedRows(session.getSkippedRows());
        response.setWorkCenters(session.getWorkCenters());
        response.setMissingFabrics(session.getMissingFabrics());

        RowFilter rowFilter = filter != null ? filter : RowFilter.ALL;
        response.setRows(session.getStagedRows().stream()
                .filter(rowFilter::matches)
                .collect(Collectors.toList()));
        response.setSummary(summarize(session));
        return response;
    }

    private static Map<String, Long> summarize(ImportSession session) {
        List<StagedReconciliationRow> rows = session.getStagedRows();
        Map<String, Long> summary = new LinkedHashMap<>();
        summary.put("machines", (long) rows.size());
        summary.put("safe", rows.stream().filter(RowFilter.SAFE::matches).count());
        summary.put("warnings", rows.stream().filter(RowFilter.WARNINGS::matches).count());
        summary.put("errors", rows.stream().filter(RowFilter.ERRORS::matches).count());
        summary.put("missing", rows.stream().filter(RowFilter.MISSING::matches).count());
        summary.put("selected", rows.stream().filter(StagedReconciliationRow::isSelected).count());
        summary.put("unresolvedWorkCenters", session.getWorkCenters().stream().filter(wc -> !wc.isResolved()).count());
        return summary;
    }
}
