package com.bmsedge.production.service;

import com.bmsedge.production.config.ImportProperties;
import com.bmsedge.production.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.MockitoAnnotations;
import org.mockito.Spy;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ReconciliationServiceTest {

    @Spy
    private ImportProperties importProperties = new ImportProperties();

    @InjectMocks
    private ReconciliationService reconciliationService;

    private static final LocalDate JAN_1 = LocalDate.of(2024, 1, 1);
    private static final LocalDate JAN_2 = LocalDate.of(2024, 1, 2);

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
    }

    private static DailyLog log(LocalDate date, String status, String client, String remaining) {
        return new DailyLog(date, status, "Cotton", client, BigDecimal.ZERO, BigDecimal.ZERO,
                new BigDecimal(remaining), "");
    }

    private static MachineSnapshot machine(long id, String name, DailyLog... logs) {
        return new MachineSnapshot(id, name, (int) id, "Circular", Collections.emptyList(), Arrays.asList(logs));
    }

    private static ImportRow row(String workCenter, String production, String scrap, String customer) {
        return new ImportRow(2, "Cotton", new BigDecimal(production), customer, new BigDecimal(scrap), workCenter);
    }

    private List<StagedReconciliationRow> reconcile(List<MachineSnapshot> machines, List<ImportRow> rows,
                                                    Map<String, Long> mappings, LocalDate targetDate) {
        return reconciliationService.reconcile(machines, rows, mappings, Collections.emptyList(), targetDate);
    }

    @Test
    @DisplayName("Should forecast remaining and status for a consecutive-day import")
    void testConsecutiveDayForecast() {
        // Arrange
        MachineSnapshot m = machine(1L, "M1", log(JAN_1, "Working", "A", "500"));
        List<ImportRow> rows = List.of(row("WC-1", "200", "10", "A"));

        // Act
        List<StagedReconciliationRow> staged = reconcile(List.of(m), rows, Map.of("WC-1", 1L), JAN_2);

        // Assert
        assertEquals(1, staged.size());
        StagedReconciliationRow result = staged.get(0);
        assertTrue(result.isHasImportData());
        assertEquals(0, new BigDecimal("310").compareTo(result.getNewRemaining()));
        assertEquals("Working", result.getNewStatus());
        assertEquals(ValidationStatus.SAFE, result.getValidationStatus());
        assertEquals("", result.getValidationMessage());
        assertFalse(result.isStale());
        assertTrue(result.isSelected());
        assertEquals(JAN_1, result.getPreviousDate());
        assertEquals(List.of("WC-1"), result.getSourceWorkCenters());
    }

    @Test
    @DisplayName("Should flag stale previous data with its date")
    void testStalePreviousLog() {
        // Arrange
        MachineSnapshot m = machine(1L, "M1", log(JAN_1, "Working", "A", "500"));
        List<ImportRow> rows = List.of(row("WC-1", "200", "10", "A"));

        // Act
        StagedReconciliationRow result = reconcile(List.of(m), rows, Map.of("WC-1", 1L),
                LocalDate.of(2024, 1, 5)).get(0);

        // Assert
        assertTrue(result.isStale());
        assertEquals(ValidationStatus.WARNING, result.getValidationStatus());
        assertTrue(result.getValidationMessage().contains("2024-01-01"));
    }

    @Test
    @DisplayName("Should warn when a previously working machine is missing from the import")
    void testMissingWorkingMachine() {
        // Arrange
        MachineSnapshot m = machine(1L, "M1", log(JAN_1, "Working", "A", "500"));

        // Act
        StagedReconciliationRow result = reconcile(List.of(m), Collections.emptyList(), Map.of(), JAN_2).get(0);

        // Assert
        assertFalse(result.isHasImportData());
        assertEquals(ValidationStatus.WARNING, result.getValidationStatus());
        assertTrue(result.getValidationMessage().toLowerCase().contains("missing from import"));
        assertEquals("Working", result.getNewStatus());
        assertEquals(0, new BigDecimal("500").compareTo(result.getNewRemaining()));
        assertFalse(result.isSelected());
    }

    @Test
    @DisplayName("Should stage one row per machine whether or not it was imported")
    void testOneRowPerMachine() {
        // Arrange
        List<MachineSnapshot> machines = List.of(
                machine(1L, "M1", log(JAN_1, "Working", "A", "100")),
                machine(2L, "M2", log(JAN_1, "No Order", "", "0")),
                machine(3L, "M3"));
        List<ImportRow> rows = List.of(row("WC-1", "50", "0", "A"));

        // Act
        List<StagedReconciliationRow> staged = reconcile(machines, rows, Map.of("WC-1", 1L), JAN_2);

        // Assert
        assertEquals(3, staged.size());
        StagedReconciliationRow m2 = staged.stream().filter(r -> r.getMachineId() == 2L).findFirst().orElseThrow();
        assertEquals("No Order", m2.getNewStatus());
        assertEquals(ValidationStatus.SAFE, m2.getValidationStatus());
        StagedReconciliationRow m3 = staged.stream().filter(r -> r.getMachineId() == 3L).findFirst().orElseThrow();
        assertEquals("Stopped", m3.getPreviousStatus());
        assertNull(m3.getPreviousDate());
        assertFalse(m3.isStale());
    }

    @Test
    @DisplayName("Should show the first row and raise an error when several rows map to one machine")
    void testSplitRun() {
        // Arrange
        MachineSnapshot m = machine(1L, "M1", log(JAN_1, "Working", "A", "500"));
        List<ImportRow> rows = List.of(
                row("WC-1", "100", "0", "A"),
                row("WC-2", "80", "5", "B-Textiles"));
        Map<String, Long> mappings = Map.of("WC-1", 1L, "WC-2", 1L);

        // Act
        StagedReconciliationRow result = reconcile(List.of(m), rows, mappings, JAN_2).get(0);

        // Assert
        assertTrue(result.isSplit());
        assertEquals(ValidationStatus.ERROR, result.getValidationStatus());
        assertTrue(result.getValidationMessage().contains("2 rows map to this machine"));
        assertEquals(0, new BigDecimal("100").compareTo(result.getImportProduction()));
        assertEquals(2, result.getSplitDetails().size());
        assertEquals("B", result.getSplitDetails().get(1).getClient());
        assertEquals(List.of("WC-1", "WC-2"), result.getSourceWorkCenters());
    }

    @Test
    @DisplayName("Should keep the most severe status when several findings apply")
    void testFindingsOnlyEscalate() {
        // Arrange
        MachineSnapshot m = machine(1L, "M1", log(JAN_1, "Working", "A", "500"));
        List<ImportRow> rows = List.of(row("WC-1", "100", "0", "A"), row("WC-2", "80", "0", "A"));

        // Act
        StagedReconciliationRow result = reconcile(List.of(m), rows, Map.of("WC-1", 1L, "WC-2", 1L),
                LocalDate.of(2024, 1, 4)).get(0);

        // Assert
        assertEquals(ValidationStatus.ERROR, result.getValidationStatus());
        assertTrue(result.getValidationMessage().contains("Previous data is from 2024-01-01."));
        assertTrue(result.getValidationMessage().contains("Conflict"));
    }

    @Test
    @DisplayName("Should stop a working machine that reports zero production")
    void testZeroProductionStopsWorkingMachine() {
        // Arrange
        MachineSnapshot m = machine(1L, "M1", log(JAN_1, "Working", "A", "500"));

        // Act
        StagedReconciliationRow result = reconcile(List.of(m), List.of(row("WC-1", "0", "0", "A")),
                Map.of("WC-1", 1L), JAN_2).get(0);

        // Assert
        assertEquals("Stopped", result.getNewStatus());
        assertEquals(0, new BigDecimal("500").compareTo(result.getNewRemaining()));
    }

    @Test
    @DisplayName("Should carry a non-working status through zero production")
    void testZeroProductionKeepsOtherStatus() {
        // Arrange
        MachineSnapshot m = machine(1L, "M1", log(JAN_1, "Out of Service", "", "0"));

        // Act
        StagedReconciliationRow result = reconcile(List.of(m), List.of(row("WC-1", "0", "0", "")),
                Map.of("WC-1", 1L), JAN_2).get(0);

        // Assert
        assertEquals("Out of Service", result.getNewStatus());
    }

    @Test
    @DisplayName("Should never forecast a negative remaining quantity")
    void testRemainingNeverNegative() {
        // Arrange
        MachineSnapshot m = machine(1L, "M1", log(JAN_1, "Working", "A", "20"));
        MachineSnapshot fresh = machine(2L, "M2");
        List<ImportRow> rows = List.of(row("WC-1", "60", "0", "A"), row("WC-2", "30", "50", "A"));

        // Act
        List<StagedReconciliationRow> staged = reconcile(List.of(m, fresh), rows,
                Map.of("WC-1", 1L, "WC-2", 2L), JAN_2);

        // Assert
        for (StagedReconciliationRow result : staged) {
            assertTrue(result.getNewRemaining().signum() >= 0);
        }
    }

    @Test
    @DisplayName("Should warn on overproduction only beyond the configured slack")
    void testOverproductionSlack() {
        // Arrange
        MachineSnapshot within = machine(1L, "A-within", log(JAN_1, "Working", "A", "100"));
        MachineSnapshot beyond = machine(2L, "B-beyond", log(JAN_1, "Working", "A", "100"));
        List<ImportRow> rows = List.of(row("WC-1", "150", "0", "A"), row("WC-2", "151", "0", "A"));

        // Act
        List<StagedReconciliationRow> staged = reconcile(List.of(within, beyond), rows,
                Map.of("WC-1", 1L, "WC-2", 2L), JAN_2);

        // Assert
        StagedReconciliationRow first = staged.stream().filter(r -> r.getMachineId() == 1L).findFirst().orElseThrow();
        StagedReconciliationRow second = staged.stream().filter(r -> r.getMachineId() == 2L).findFirst().orElseThrow();
        assertEquals(ValidationStatus.SAFE, first.getValidationStatus());
        assertEquals(ValidationStatus.WARNING, second.getValidationStatus());
        assertTrue(second.getValidationMessage().contains("Production (151) exceeds remaining (100)."));
    }

    @Test
    @DisplayName("Should use a configured overproduction slack")
    void testConfiguredSlack() {
        // Arrange
        importProperties.setOverproductionSlack(0);
        MachineSnapshot m = machine(1L, "M1", log(JAN_1, "Working", "A", "100"));

        // Act
        StagedReconciliationRow result = reconcile(List.of(m), List.of(row("WC-1", "101", "0", "A")),
                Map.of("WC-1", 1L), JAN_2).get(0);

        // Assert
        assertEquals(ValidationStatus.WARNING, result.getValidationStatus());
    }

    @Test
    @DisplayName("Should warn when the client changes with quantity still remaining")
    void testClientChangeWithRemaining() {
        // Arrange
        MachineSnapshot m = machine(1L, "M1", log(JAN_1, "Working", "A", "40"));

        // Act
        StagedReconciliationRow result = reconcile(List.of(m), List.of(row("WC-1", "10", "0", "B Corp")),
                Map.of("WC-1", 1L), JAN_2).get(0);

        // Assert
        assertEquals(ValidationStatus.WARNING, result.getValidationStatus());
        assertEquals("Client changed (A -> B) but 40 remained unconsumed.", result.getValidationMessage());
    }

    @Test
    @DisplayName("Should warn that an existing log on the import date will be overwritten")
    void testOverwriteWarning() {
        // Arrange
        MachineSnapshot m = machine(1L, "M1",
                log(JAN_1, "Working", "A", "500"),
                log(JAN_2, "Working", "A", "450"));

        // Act
        StagedReconciliationRow result = reconcile(List.of(m), List.of(row("WC-1", "100", "0", "A")),
                Map.of("WC-1", 1L), JAN_2).get(0);

        // Assert
        assertEquals(JAN_1, result.getPreviousDate());
        assertEquals(0, new BigDecimal("400").compareTo(result.getNewRemaining()));
        assertEquals(ValidationStatus.WARNING, result.getValidationStatus());
        assertTrue(result.getValidationMessage().contains("will be overwritten"));
    }

    @Test
    @DisplayName("Should display the fabric short name when the fabric is known")
    void testFabricShortName() {
        // Arrange
        MachineSnapshot m = machine(1L, "M1", log(JAN_1, "Working", "A", "500"));
        List<Fabric> fabrics = List.of(new Fabric("Cotton", "", "CTN"));

        // Act
        StagedReconciliationRow result = reconciliationService.reconcile(List.of(m),
                List.of(row("WC-1", "100", "0", "A")), Map.of("WC-1", 1L), fabrics, JAN_2).get(0);

        // Assert
        assertEquals("CTN", result.getImportFabric());
    }

    @Test
    @DisplayName("Should list flagged rows first, then by machine name ignoring case")
    void testPresentationOrder() {
        // Arrange
        List<MachineSnapshot> machines = new ArrayList<>(List.of(
                machine(1L, "zeta", log(JAN_1, "Working", "A", "10")),
                machine(2L, "Beta"),
                machine(3L, "alpha"),
                machine(4L, "Omega", log(JAN_1, "Working", "A", "10"))));

        // Act
        List<StagedReconciliationRow> staged = reconcile(machines, Collections.emptyList(), Map.of(), JAN_2);

        // Assert
        assertEquals(List.of("Omega", "zeta", "alpha", "Beta"),
                staged.stream().map(StagedReconciliationRow::getMachineName).collect(Collectors.toList()));
    }

    @Test
    @DisplayName("Should produce the same staged rows for the same inputs")
    void testReconcileIsRepeatable() {
        // Arrange
        List<MachineSnapshot> machines = List.of(
                machine(1L, "M1", log(JAN_1, "Working", "A", "500")),
                machine(2L, "M2", log(JAN_1, "Working", "A", "20")));
        List<ImportRow> rows = List.of(row("WC-1", "200", "10", "A"));

        // Act
        List<StagedReconciliationRow> first = reconcile(machines, rows, Map.of("WC-1", 1L), JAN_2);
        List<StagedReconciliationRow> second = reconcile(machines, rows, Map.of("WC-1", 1L), JAN_2);

        // Assert
        assertEquals(first, second);
    }

    @Test
    @DisplayName("Should leave out rows whose work center is unresolved")
    void testUnresolvedRowsIgnored() {
        // Arrange
        MachineSnapshot m = machine(1L, "M1", log(JAN_1, "No Order", "", "0"));

        // Act
        StagedReconciliationRow result = reconcile(List.of(m), List.of(row("UNKNOWN", "100", "0", "A")),
                Map.of(), JAN_2).get(0);

        // Assert
        assertFalse(result.isHasImportData());
        assertEquals(ValidationStatus.SAFE, result.getValidationStatus());
    }
}
