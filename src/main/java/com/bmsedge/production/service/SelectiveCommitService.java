package com.bmsedge.production.service;

import com.bmsedge.production.config.ImportProperties;
import com.bmsedge.production.dto.CommitResult;
import com.bmsedge.production.exception.BusinessException;
import com.bmsedge.production.exception.CommitFailedException;
import com.bmsedge.production.model.DailyLog;
import com.bmsedge.production.model.StagedReconciliationRow;
import com.bmsedge.production.repository.LogWrite;
import com.bmsedge.production.repository.ProductionStore;
import com.bmsedge.production.repository.WriteBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Writes the operator-selected staged rows to the store in sequential atomic batches.
 * There is no rollback across batches: a failure leaves earlier batches committed
 * and is reported as such.
 */
@Service
public class SelectiveCommitService {

    private static final Logger logger = LoggerFactory.getLogger(SelectiveCommitService.class);

    @Autowired
    private ProductionStore productionStore;

    @Autowired
    private ImportProperties importProperties;

    public CommitResult commit(LocalDate targetDate, List<StagedReconciliationRow> rows) {
        List<LogWrite> writes = rows.stream()
                .filter(StagedReconciliationRow::isSelected)
                .map(row -> new LogWrite(row.getMachineId(), toDailyLog(row, targetDate)))
                .collect(Collectors.toList());

        if (writes.isEmpty()) {
            throw new BusinessException("No rows selected for import");
        }

        return commitWrites(targetDate, writes);
    }

    public CommitResult commitWrites(LocalDate targetDate, List<LogWrite> writes) {
        List<WriteBatch> batches = WriteBatch.partition(writes, importProperties.getMaxBatchOperations());
        logger.info("Committing {} log(s) for {} in {} batch(es)", writes.size(), targetDate, batches.size());

        int machinesUpdated = 0;
        for (int i = 0; i < batches.size(); i++) {
            WriteBatch batch = batches.get(i);
            try {
                machinesUpdated += productionStore.commit(batch);
                logger.debug("Batch {}/{} committed ({} operations)", i + 1, batches.size(), batch.operationCount());
            } catch (RuntimeException e) {
                throw new CommitFailedException(i, batches.size(), machinesUpdated, e);
            }
        }

        logger.info("Committed logs for {} machine(s) on {}", machinesUpdated, targetDate);
        return new CommitResult(targetDate, writes.size(), machinesUpdated, batches.size());
    }

    static DailyLog toDailyLog(StagedReconciliationRow row, LocalDate targetDate) {
        return new DailyLog(
                targetDate,
                row.getNewStatus(),
                row.getImportFabric(),
                row.getImportClient(),
                row.getImportProduction(),
                row.getImportScrap(),
                row.getNewRemaining(),
                row.getNote()
        );
    }
}
