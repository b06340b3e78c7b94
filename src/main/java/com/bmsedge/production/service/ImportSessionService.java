package com.bmsedge.production.service;

import com.bmsedge.production.config.ImportProperties;
import com.bmsedge.production.dto.CommitResult;
import com.bmsedge.production.dto.RowUpdateRequest;
import com.bmsedge.production.exception.BusinessException;
import com.bmsedge.production.exception.ResourceNotFoundException;
import com.bmsedge.production.model.*;
import com.bmsedge.production.repository.FabricRepository;
import com.bmsedge.production.repository.ProductionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Drives one daily import from upload to commit:
 * mapping review, fabric review, staged reconciliation, then apply or discard.
 * At most one session is open at a time; an idle session expires after the
 * configured timeout and is dropped without writing anything.
 */
@Service
public class ImportSessionService {

    private static final Logger logger = LoggerFactory.getLogger(ImportSessionService.class);

    @Autowired
    private ProductionSheetParser parser;

    @Autowired
    private WorkCenterResolver resolver;

    @Autowired
    private FabricGateService fabricGateService;

    @Autowired
    private ReconciliationService reconciliationService;

    @Autowired
    private SelectiveCommitService selectiveCommitService;

    @Autowired
    private ProductionStore productionStore;

    @Autowired
    private FabricRepository fabricRepository;

    @Autowired
    private ImportProperties importProperties;

    private ImportSession activeSession;

    public synchronized ImportSession start(MultipartFile file, LocalDate targetDate) {
        if (targetDate == null) {
            throw new BusinessException("Target date is required");
        }
        dropIfExpired(LocalDateTime.now());
        if (activeSession != null) {
            throw new BusinessException("Import session " + activeSession.getId()
                    + " for " + activeSession.getTargetDate() + " is still open. Apply or discard it first.");
        }

        ProductionSheetParser.ParseResult parsed = parser.parse(file);
        if (parsed.getRows().isEmpty()) {
            throw new BusinessException("The file contains no rows with a work center");
        }

        List<MachineSnapshot> machines = productionStore.loadMachines();
        Map<String, Long> mappings = productionStore.loadWorkCenterMappings();

        ImportSession session = new ImportSession(targetDate, file.getOriginalFilename(),
                parsed.getRows(), parsed.getSkippedRows(), machines, mappings);
        session.setWorkCenters(resolver.propose(session.getRows(), machines, mappings));

        activeSession = session;
        logger.info("Started import session {} for {} from '{}': {} rows, {} skipped",
                session.getId(), targetDate, session.getFileName(), session.getRows().size(), session.getSkippedRows());
        return session;
    }

    public synchronized ImportSession getSession(String sessionId) {
        ImportSession session = findOpenSession(sessionId);
        session.touch();
        return session;
    }

    /**
     * Assigns or clears one work center. The mapping table is updated right away;
     * if the session had already moved past mapping review it goes back to it.
     */
    public synchronized ImportSession updateMapping(String sessionId, String workCenter, Long machineId) {
        ImportSession session = getSession(sessionId);
        WorkCenterProposal proposal = session.getWorkCenters().stream()
                .filter(wc -> wc.getWorkCenter().equals(workCenter))
                .findFirst()
                .orElseThrow(() -> new ResourceNotFoundException(
                        "Work center '" + workCenter + "' does not appear in this import"));

        if (machineId == null) {
            productionStore.deleteWorkCenterMapping(workCenter);
            session.getMappings().remove(workCenter);
            WorkCenterProposal reresolved = resolver.resolve(workCenter, session.getMachines(), session.getMappings());
            proposal.setMachineId(reresolved.getMachineId());
            proposal.setMachineName(reresolved.getMachineName());
            proposal.setSource(reresolved.getSource());
            logger.info("Cleared mapping for work center '{}'", workCenter);
        } else {
            MachineSnapshot machine = session.findMachine(machineId)
                    .orElseThrow(() -> new ResourceNotFoundException("Machine not found with id: " + machineId));
            productionStore.saveWorkCenterMappings(Map.of(workCenter, machineId));
            session.getMappings().put(workCenter, machineId);
            proposal.setMachineId(machineId);
            proposal.setMachineName(machine.getName());
            proposal.setSource(ResolutionSource.OPERATOR);
            logger.info("Mapped work center '{}' to machine {} ({})", workCenter, machineId, machine.getName());
        }

        if (session.getStage() != ImportSessionStage.MAPPING_REVIEW) {
            session.setStage(ImportSessionStage.MAPPING_REVIEW);
            session.setStagedRows(new ArrayList<>());
            session.setMissingFabrics(new ArrayList<>());
        }
        return session;
    }

    /**
     * Persists every resolved mapping, then checks fabrics. Reconciles straight away
     * when all fabrics are known.
     */
    public synchronized ImportSession confirmMappings(String sessionId) {
        ImportSession session = getSession(sessionId);
        requireStage(session, ImportSessionStage.MAPPING_REVIEW);

        Map<String, Long> resolved = resolver.toMappings(session.getWorkCenters());
        if (!resolved.isEmpty()) {
            productionStore.saveWorkCenterMappings(resolved);
            session.getMappings().putAll(resolved);
        }

        List<FabricProposal> missing = fabricGateService.findMissingFabrics(session.getRows());
        if (missing.isEmpty()) {
            stage(session);
        } else {
            session.setMissingFabrics(missing);
            session.setStage(ImportSessionStage.FABRIC_REVIEW);
        }
        return session;
    }

    /**
     * Creates the approved fabrics (all missing ones when {@code approvedNames} is null)
     * and reconciles. Fabrics the operator leaves out stay unknown and are shown by their raw name.
     */
    public synchronized ImportSession resolveFabrics(String sessionId, Collection<String> approvedNames) {
        ImportSession session = getSession(sessionId);
        requireStage(session, ImportSessionStage.FABRIC_REVIEW);

        List<String> missingNames = session.getMissingFabrics().stream()
                .map(FabricProposal::getName)
                .collect(Collectors.toList());
        List<String> toCreate = approvedNames == null
                ? missingNames
                : approvedNames.stream().filter(missingNames::contains).collect(Collectors.toList());

        fabricGateService.createFabrics(toCreate);
        session.setMissingFabrics(new ArrayList<>());
        stage(session);
        return session;
    }

    public synchronized StagedReconciliationRow updateRow(String sessionId, Long machineId, RowUpdateRequest request) {
        ImportSession session = getSession(sessionId);
        requireStage(session, ImportSessionStage.STAGED);

        StagedReconciliationRow row = session.findStagedRow(machineId)
                .orElseThrow(() -> new ResourceNotFoundException("No staged row for machine " + machineId));

        if (request.getSelected() != null) {
            row.setSelected(request.getSelected());
        }
        if (request.getNewRemaining() != null) {
            row.setNewRemaining(request.getNewRemaining());
        }
        if (request.getNewStatus() != null && !request.getNewStatus().isBlank()) {
            row.setNewStatus(request.getNewStatus().trim());
        }
        if (request.getNote() != null) {
            row.setNote(request.getNote());
        }
        return row;
    }

    /**
     * Sets the selection flag on every staged row matching the filter.
     *
     * @return number of rows changed
     */
    public synchronized int selectRows(String sessionId, RowFilter filter, boolean selected) {
        ImportSession session = getSession(sessionId);
        requireStage(session, ImportSessionStage.STAGED);

        RowFilter rowFilter = filter != null ? filter : RowFilter.ALL;
        int changed = 0;
        for (StagedReconciliationRow row : session.getStagedRows()) {
            if (rowFilter.matches(row) && row.isSelected() != selected) {
                row.setSelected(selected);
                changed++;
            }
        }
        return changed;
    }

    /**
     * Commits the selected rows. The session is closed whether the commit succeeds or not;
     * after a failure the operator starts a new import.
     */
    public synchronized CommitResult apply(String sessionId) {
        ImportSession session = getSession(sessionId);
        requireStage(session, ImportSessionStage.STAGED);

        if (session.getStagedRows().stream().noneMatch(StagedReconciliationRow::isSelected)) {
            throw new BusinessException("No rows selected for import");
        }

        try {
            CommitResult result = selectiveCommitService.commit(session.getTargetDate(), session.getStagedRows());
            close(session, ImportSessionStage.APPLIED);
            return result;
        } catch (RuntimeException e) {
            close(session, ImportSessionStage.DISCARDED);
            throw e;
        }
    }

    public synchronized void discard(String sessionId) {
        ImportSession session = findOpenSession(sessionId);
        close(session, ImportSessionStage.DISCARDED);
    }

    @Scheduled(fixedDelayString = "${production.import.session-sweep-interval-ms:60000}")
    public synchronized void expireIdleSessions() {
        dropIfExpired(LocalDateTime.now());
    }

    void dropIfExpired(LocalDateTime now) {
        if (activeSession != null && activeSession.isExpired(now, importProperties.getSessionTimeoutMinutes())) {
            logger.warn("Import session {} for {} expired after {} minutes of inactivity",
                    activeSession.getId(), activeSession.getTargetDate(), importProperties.getSessionTimeoutMinutes());
            close(activeSession, ImportSessionStage.DISCARDED);
        }
    }

    private void stage(ImportSession session) {
        Map<String, Long> mappings = resolver.toMappings(session.getWorkCenters());
        List<StagedReconciliationRow> rows = reconciliationService.reconcile(
                session.getMachines(), session.getRows(), mappings, fabricRepository.findAll(), session.getTargetDate());
        session.setStagedRows(rows);
        session.setStage(ImportSessionStage.STAGED);
    }

    private ImportSession findOpenSession(String sessionId) {
        if (activeSession == null || !activeSession.getId().equals(sessionId)) {
            throw new ResourceNotFoundException("Import session not found or already closed: " + sessionId);
        }
        return activeSession;
    }

    private void close(ImportSession session, ImportSessionStage finalStage) {
        session.setStage(finalStage);
        if (activeSession == session) {
            activeSession = null;
        }
        logger.info("Import session {} closed as {}", session.getId(), finalStage);
    }

    private static void requireStage(ImportSession session, ImportSessionStage... allowed) {
        if (Arrays.asList(allowed).contains(session.getStage())) {
            return;
        }
        throw new BusinessException("Import session is in stage " + session.getStage()
                + "; expected " + Arrays.toString(allowed));
    }
}
