package com.bmsedge.production.service;

import com.bmsedge.production.config.ImportProperties;
import com.bmsedge.production.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Merges imported production figures with each machine's previous log and
 * forecasts the machine's state on the import date. Produces one staged row per
 * machine, including machines that do not appear in the import. Nothing is written.
 */
@Service
public class ReconciliationService {

    private static final Logger logger = LoggerFactory.getLogger(ReconciliationService.class);

    private static final Comparator<StagedReconciliationRow> PRESENTATION_ORDER =
            Comparator.comparing(StagedReconciliationRow::isSafe)
                    .thenComparing(StagedReconciliationRow::getMachineName, String.CASE_INSENSITIVE_ORDER);

    @Autowired
    private ImportProperties importProperties;

    public List<StagedReconciliationRow> reconcile(List<MachineSnapshot> machines,
                                                   List<ImportRow> rows,
                                                   Map<String, Long> mappings,
                                                   List<Fabric> fabrics,
                                                   LocalDate targetDate) {
        Map<Long, List<ImportRow>> rowsByMachine = groupByMachine(rows, mappings);
        Map<String, String> shortNames = fabrics.stream()
                .collect(Collectors.toMap(Fabric::getName, Fabric::getDisplayName, (a, b) -> a));

        List<StagedReconciliationRow> staged = new ArrayList<>();
        for (MachineSnapshot machine : machines) {
            List<ImportRow> machineRows = rowsByMachine.getOrDefault(machine.getId(), Collections.emptyList());
            staged.add(reconcileMachine(machine, machineRows, shortNames, targetDate));
        }

        staged.sort(PRESENTATION_ORDER);

        long flagged = staged.stream().filter(row -> !row.isSafe()).count();
        logger.info("Reconciled {} machines for {}: {} flagged", staged.size(), targetDate, flagged);
        return staged;
    }

    StagedReconciliationRow reconcileMachine(MachineSnapshot machine, List<ImportRow> machineRows,
                                             Map<String, String> shortNames, LocalDate targetDate) {
        StagedReconciliationRow row = new StagedReconciliationRow();
        row.setMachineId(machine.getId());
        row.setMachineName(machine.getName());
        row.setImportDate(targetDate);

        // Previous day
        Optional<DailyLog> previousLog = machine.findPreviousLog(targetDate);
        BigDecimal previousRemaining = previousLog.map(DailyLog::getRemainingMfg).orElse(BigDecimal.ZERO);
        String previousStatus = previousLog.map(DailyLog::getStatus)
                .filter(status -> !status.isBlank())
                .orElse(MachineStatus.STOPPED.getLabel());
        String previousClient = previousLog.map(DailyLog::getClient).orElse("");

        row.setPreviousDate(previousLog.map(DailyLog::getDate).orElse(null));
        row.setPreviousRemaining(previousRemaining);
        row.setPreviousStatus(previousStatus);
        row.setPreviousClient(previousClient);
        row.setPreviousFabric(previousLog.map(DailyLog::getFabric).orElse(""));
        row.setStale(previousLog.isPresent() && !previousLog.get().getDate().equals(targetDate.minusDays(1)));

        // Imported figures
        boolean hasImportData = !machineRows.isEmpty();
        row.setHasImportData(hasImportData);
        if (hasImportData) {
            // A split is a mapping conflict, not merged: the first row is shown and the row is flagged
            ImportRow first = machineRows.get(0);
            row.setImportProduction(first.getProduction());
            row.setImportScrap(first.getScrap());
            row.setImportClient(first.getClientName());
            row.setImportFabric(shortNames.getOrDefault(first.getFabricName(), first.getFabricName()));
            row.setSourceWorkCenters(machineRows.stream()
                    .map(ImportRow::getWorkCenter)
                    .distinct()
                    .collect(Collectors.toList()));

            if (machineRows.size() > 1) {
                row.setSplit(true);
                row.setSplitDetails(machineRows.stream()
                        .map(r -> new SplitDetail(r.getWorkCenter(), r.getClientName(), r.getFabricName(), r.getProduction()))
                        .collect(Collectors.toList()));
            }
        }

        // Forecast
        BigDecimal production = row.getImportProduction();
        BigDecimal netProduction = production.subtract(row.getImportScrap()).max(BigDecimal.ZERO);
        row.setNewRemaining(previousRemaining.subtract(netProduction).max(BigDecimal.ZERO));
        row.setNewStatus(forecastStatus(hasImportData, production, previousStatus));

        validate(row, machine, machineRows.size(), netProduction, targetDate);
        row.setSelected(hasImportData);
        return row;
    }

    private String forecastStatus(boolean hasImportData, BigDecimal production, String previousStatus) {
        if (hasImportData) {
            if (production.signum() > 0) {
                return MachineStatus.WORKING.getLabel();
            }
            if (MachineStatus.isWorking(previousStatus)) {
                return MachineStatus.STOPPED.getLabel();
            }
        }
        return previousStatus;
    }

    private void validate(StagedReconciliationRow row, MachineSnapshot machine, int importRowCount,
                          BigDecimal netProduction, LocalDate targetDate) {
        BigDecimal previousRemaining = row.getPreviousRemaining();

        if (!row.isHasImportData()) {
            if (MachineStatus.isWorking(row.getPreviousStatus())) {
                row.addFinding(ValidationStatus.WARNING, "Missing from import while previously working.");
            }
            return;
        }

        if (previousRemaining.signum() > 0
                && !row.getPreviousClient().isBlank()
                && !row.getImportClient().isBlank()
                && !row.getPreviousClient().equals(row.getImportClient())) {
            row.addFinding(ValidationStatus.WARNING, String.format(
                    "Client changed (%s -> %s) but %s remained unconsumed.",
                    row.getPreviousClient(), row.getImportClient(), format(previousRemaining)));
        }

        if (row.isStale()) {
            row.addFinding(ValidationStatus.WARNING, "Previous data is from " + row.getPreviousDate() + ".");
        }

        if (machine.hasLogOn(targetDate)) {
            row.addFinding(ValidationStatus.WARNING,
                    "Data already exists for " + targetDate + " and will be overwritten.");
        }

        BigDecimal slack = BigDecimal.valueOf(importProperties.getOverproductionSlack());
        if (previousRemaining.signum() > 0 && netProduction.compareTo(previousRemaining.add(slack)) > 0) {
            row.addFinding(ValidationStatus.WARNING, String.format(
                    "Production (%s) exceeds remaining (%s).", format(netProduction), format(previousRemaining)));
        }

        if (row.isSplit()) {
            row.addFinding(ValidationStatus.ERROR, String.format(
                    "Conflict: %d rows map to this machine. Check mappings.", importRowCount));
        }
    }

    private Map<Long, List<ImportRow>> groupByMachine(List<ImportRow> rows, Map<String, Long> mappings) {
        Map<Long, List<ImportRow>> grouped = new LinkedHashMap<>();
        int unresolved = 0;
        for (ImportRow row : rows) {
            Long machineId = mappings.get(row.getWorkCenter());
            if (machineId == null) {
                unresolved++;
                continue;
            }
            grouped.computeIfAbsent(machineId, id -> new ArrayList<>()).add(row);
        }
        if (unresolved > 0) {
            logger.warn("{} import row(s) have an unresolved work center and were left out", unresolved);
        }
        return grouped;
    }

    private static String format(BigDecimal value) {
        return value.stripTrailingZeros().toPlainString();
    }
}
