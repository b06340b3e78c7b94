package com.bmsedge.production.service;

import com.bmsedge.production.config.ImportProperties;
import com.bmsedge.production.dto.CommitResult;
import com.bmsedge.production.dto.RowUpdateRequest;
import com.bmsedge.production.exception.BusinessException;
import com.bmsedge.production.exception.CommitFailedException;
import com.bmsedge.production.exception.ResourceNotFoundException;
import com.bmsedge.production.model.*;
import com.bmsedge.production.repository.FabricRepository;
import com.bmsedge.production.repository.ProductionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.mockito.Spy;
import org.springframework.mock.web.MockMultipartFile;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ImportSessionServiceTest {

    @Mock
    private ProductionSheetParser parser;

    @Spy
    private WorkCenterResolver resolver = new WorkCenterResolver();

    @Mock
    private FabricGateService fabricGateService;

    @Mock
    private ReconciliationService reconciliationService;

    @Mock
    private SelectiveCommitService selectiveCommitService;

    @Mock
    private ProductionStore productionStore;

    @Mock
    private FabricRepository fabricRepository;

    @Spy
    private ImportProperties importProperties = new ImportProperties();

    @InjectMocks
    private ImportSessionService importSessionService;

    private MockMultipartFile file;
    private List<StagedReconciliationRow> staged;

    private static final LocalDate TARGET = LocalDate.of(2024, 1, 2);

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);

        file = new MockMultipartFile("file", "production.xlsx",
                "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet", new byte[]{1});

        List<ImportRow> rows = List.of(
                new ImportRow(2, "Jersey", new BigDecimal("100"), "A", BigDecimal.ZERO, "Circular-01"),
                new ImportRow(3, "Rib", new BigDecimal("50"), "B", BigDecimal.ZERO, "WC-9"));
        List<MachineSnapshot> machines = List.of(
                new MachineSnapshot(1L, "Circular-01", 101, "Circular", Collections.emptyList(), Collections.emptyList()),
                new MachineSnapshot(2L, "Flat-02", 102, "Flat", Collections.emptyList(), Collections.emptyList()));

        when(parser.parse(file)).thenReturn(new ProductionSheetParser.ParseResult(rows, 1));
        when(productionStore.loadMachines()).thenReturn(machines);
        when(productionStore.loadWorkCenterMappings()).thenReturn(Map.of());
        when(fabricRepository.findAll()).thenReturn(Collections.emptyList());

        staged = new ArrayList<>();
        staged.add(stagedRow(1L, ValidationStatus.SAFE, true));
        staged.add(stagedRow(2L, ValidationStatus.ERROR, true));
        when(reconciliationService.reconcile(anyList(), anyList(), anyMap(), anyList(), any(LocalDate.class)))
                .thenReturn(staged);
    }

    private static StagedReconciliationRow stagedRow(Long machineId, ValidationStatus status, boolean selected) {
        StagedReconciliationRow row = new StagedReconciliationRow();
        row.setMachineId(machineId);
        row.setMachineName("M" + machineId);
        row.setHasImportData(true);
        row.setValidationStatus(status);
        row.setNewStatus("Working");
        row.setSelected(selected);
        return row;
    }

    private ImportSession stagedSession() {
        ImportSession session = importSessionService.start(file, TARGET);
        importSessionService.updateMapping(session.getId(), "WC-9", 2L);
        when(fabricGateService.findMissingFabrics(anyList())).thenReturn(Collections.emptyList());
        return importSessionService.confirmMappings(session.getId());
    }

    @Test
    @DisplayName("Should start a session with a proposal for every work center")
    void testStart() {
        // Act
        ImportSession session = importSessionService.start(file, TARGET);

        // Assert
        assertEquals(ImportSessionStage.MAPPING_REVIEW, session.getStage());
        assertEquals(2, session.getRows().size());
        assertEquals(1, session.getSkippedRows());
        assertEquals(2, session.getWorkCenters().size());
        assertEquals(ResolutionSource.NAME_MATCH, session.getWorkCenters().get(0).getSource());
        assertFalse(session.getWorkCenters().get(1).isResolved());
        verify(productionStore, never()).saveWorkCenterMappings(anyMap());
    }

    @Test
    @DisplayName("Should reject a second session while one is open")
    void testSingleOpenSession() {
        importSessionService.start(file, TARGET);

        assertThrows(BusinessException.class, () -> importSessionService.start(file, TARGET.plusDays(1)));
    }

    @Test
    @DisplayName("Should allow a new session once the open one has expired")
    void testExpiredSessionReplaced() {
        // Arrange
        ImportSession first = importSessionService.start(file, TARGET);
        first.setLastActivityAt(LocalDateTime.now().minusMinutes(importProperties.getSessionTimeoutMinutes() + 1));

        // Act
        ImportSession second = importSessionService.start(file, TARGET);

        // Assert
        assertNotEquals(first.getId(), second.getId());
        assertEquals(ImportSessionStage.DISCARDED, first.getStage());
        assertThrows(ResourceNotFoundException.class, () -> importSessionService.getSession(first.getId()));
    }

    @Test
    @DisplayName("Should save an operator mapping to the table immediately")
    void testUpdateMapping() {
        // Arrange
        ImportSession session = importSessionService.start(file, TARGET);

        // Act
        importSessionService.updateMapping(session.getId(), "WC-9", 2L);

        // Assert
        verify(productionStore).saveWorkCenterMappings(Map.of("WC-9", 2L));
        WorkCenterProposal proposal = session.getWorkCenters().get(1);
        assertEquals(Long.valueOf(2L), proposal.getMachineId());
        assertEquals("Flat-02", proposal.getMachineName());
        assertEquals(ResolutionSource.OPERATOR, proposal.getSource());
    }

    @Test
    @DisplayName("Should re-resolve a work center by name when its mapping is cleared")
    void testClearMapping() {
        // Arrange
        ImportSession session = importSessionService.start(file, TARGET);
        importSessionService.updateMapping(session.getId(), "Circular-01", 2L);

        // Act
        importSessionService.updateMapping(session.getId(), "Circular-01", null);

        // Assert
        verify(productionStore).deleteWorkCenterMapping("Circular-01");
        assertEquals(Long.valueOf(1L), session.getWorkCenters().get(0).getMachineId());
        assertEquals(ResolutionSource.NAME_MATCH, session.getWorkCenters().get(0).getSource());
    }

    @Test
    @DisplayName("Should reject mappings to unknown machines or work centers")
    void testInvalidMapping() {
        ImportSession session = importSessionService.start(file, TARGET);

        assertThrows(ResourceNotFoundException.class,
                () -> importSessionService.updateMapping(session.getId(), "WC-9", 77L));
        assertThrows(ResourceNotFoundException.class,
                () -> importSessionService.updateMapping(session.getId(), "NOT-IN-FILE", 1L));
    }

    @Test
    @DisplayName("Should persist resolved mappings and stage rows when every fabric is known")
    void testConfirmMappingsStages() {
        // Act
        ImportSession session = stagedSession();

        // Assert
        assertEquals(ImportSessionStage.STAGED, session.getStage());
        assertEquals(2, session.getStagedRows().size());
        verify(productionStore).saveWorkCenterMappings(Map.of("Circular-01", 1L, "WC-9", 2L));
        verify(reconciliationService).reconcile(eq(session.getMachines()), eq(session.getRows()),
                eq(Map.of("Circular-01", 1L, "WC-9", 2L)), anyList(), eq(TARGET));
    }

    @Test
    @DisplayName("Should stop at fabric review when the import has unknown fabrics")
    void testFabricReview() {
        // Arrange
        ImportSession session = importSessionService.start(file, TARGET);
        when(fabricGateService.findMissingFabrics(anyList()))
                .thenReturn(List.of(new FabricProposal("Rib", "", "Rib"), new FabricProposal("Jersey", "", "Jersey")));

        // Act
        importSessionService.confirmMappings(session.getId());

        // Assert
        assertEquals(ImportSessionStage.FABRIC_REVIEW, session.getStage());
        assertEquals(2, session.getMissingFabrics().size());
        verify(reconciliationService, never()).reconcile(anyList(), anyList(), anyMap(), anyList(), any());

        // Act
        importSessionService.resolveFabrics(session.getId(), List.of("Rib", "Unlisted"));

        // Assert
        verify(fabricGateService).createFabrics(List.of("Rib"));
        assertEquals(ImportSessionStage.STAGED, session.getStage());
        assertTrue(session.getMissingFabrics().isEmpty());
    }

    @Test
    @DisplayName("Should create every missing fabric when no list is given")
    void testCreateAllMissingFabrics() {
        ImportSession session = importSessionService.start(file, TARGET);
        when(fabricGateService.findMissingFabrics(anyList()))
                .thenReturn(List.of(new FabricProposal("Rib", "", "Rib")));
        importSessionService.confirmMappings(session.getId());

        importSessionService.resolveFabrics(session.getId(), null);

        verify(fabricGateService).createFabrics(List.of("Rib"));
    }

    @Test
    @DisplayName("Should reject row edits before reconciliation")
    void testRowEditRequiresStagedSession() {
        ImportSession session = importSessionService.start(file, TARGET);

        assertThrows(BusinessException.class,
                () -> importSessionService.updateRow(session.getId(), 1L, new RowUpdateRequest()));
        assertThrows(BusinessException.class, () -> importSessionService.apply(session.getId()));
    }

    @Test
    @DisplayName("Should apply operator edits to a staged row")
    void testUpdateRow() {
        // Arrange
        ImportSession session = stagedSession();
        RowUpdateRequest request = new RowUpdateRequest();
        request.setSelected(false);
        request.setNewRemaining(new BigDecimal("-5"));
        request.setNewStatus("Qalb");
        request.setNote("changeover");

        // Act
        StagedReconciliationRow row = importSessionService.updateRow(session.getId(), 1L, request);

        // Assert
        assertFalse(row.isSelected());
        assertEquals(0, BigDecimal.ZERO.compareTo(row.getNewRemaining()));
        assertEquals("Qalb", row.getNewStatus());
        assertEquals("changeover", row.getNote());
    }

    @Test
    @DisplayName("Should bulk select rows matching a filter")
    void testSelectRows() {
        ImportSession session = stagedSession();

        int changed = importSessionService.selectRows(session.getId(), RowFilter.ERRORS, false);

        assertEquals(1, changed);
        assertTrue(session.findStagedRow(1L).orElseThrow().isSelected());
        assertFalse(session.findStagedRow(2L).orElseThrow().isSelected());
    }

    @Test
    @DisplayName("Should commit and close the session")
    void testApply() {
        // Arrange
        ImportSession session = stagedSession();
        when(selectiveCommitService.commit(TARGET, staged)).thenReturn(new CommitResult(TARGET, 2, 2, 1));

        // Act
        CommitResult result = importSessionService.apply(session.getId());

        // Assert
        assertEquals(2, result.getMachinesUpdated());
        assertEquals(ImportSessionStage.APPLIED, session.getStage());
        assertThrows(ResourceNotFoundException.class, () -> importSessionService.getSession(session.getId()));
    }

    @Test
    @DisplayName("Should close the session when the commit fails")
    void testApplyFailure() {
        // Arrange
        ImportSession session = stagedSession();
        when(selectiveCommitService.commit(TARGET, staged))
                .thenThrow(new CommitFailedException(0, 1, 0, new IllegalStateException("down")));

        // Act & Assert
        assertThrows(CommitFailedException.class, () -> importSessionService.apply(session.getId()));
        assertEquals(ImportSessionStage.DISCARDED, session.getStage());
        assertDoesNotThrow(() -> importSessionService.start(file, TARGET));
    }

    @Test
    @DisplayName("Should keep the session open when nothing is selected")
    void testApplyNothingSelected() {
        ImportSession session = stagedSession();
        importSessionService.selectRows(session.getId(), RowFilter.ALL, false);

        assertThrows(BusinessException.class, () -> importSessionService.apply(session.getId()));
        assertEquals(ImportSessionStage.STAGED, session.getStage());
        verify(selectiveCommitService, never()).commit(any(), anyList());
    }

    @Test
    @DisplayName("Should discard without writing logs")
    void testDiscard() {
        ImportSession session = stagedSession();

        importSessionService.discard(session.getId());

        assertEquals(ImportSessionStage.DISCARDED, session.getStage());
        verify(selectiveCommitService, never()).commit(any(), anyList());
        verify(productionStore, never()).commit(any());
    }

    @Test
    @DisplayName("Should drop an idle session on the expiry sweep")
    void testExpirySweep() {
        ImportSession session = importSessionService.start(file, TARGET);
        session.setLastActivityAt(LocalDateTime.now().minusHours(2));

        importSessionService.expireIdleSessions();

        assertEquals(ImportSessionStage.DISCARDED, session.getStage());
    }

    @Test
    @DisplayName("Should send a staged session back to mapping review when a mapping changes")
    void testRemapAfterStaging() {
        ImportSession session = stagedSession();

        importSessionService.updateMapping(session.getId(), "WC-9", 1L);

        assertEquals(ImportSessionStage.MAPPING_REVIEW, session.getStage());
        assertTrue(session.getStagedRows().isEmpty());
    }
}
