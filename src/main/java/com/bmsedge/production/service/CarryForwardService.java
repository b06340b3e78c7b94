package com.bmsedge.production.service;

import com.bmsedge.production.dto.CommitResult;
import com.bmsedge.production.exception.BusinessException;
import com.bmsedge.production.model.DailyLog;
import com.bmsedge.production.model.MachineSnapshot;
import com.bmsedge.production.repository.LogWrite;
import com.bmsedge.production.repository.ProductionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Starts a new day from a previous day's logs: every machine logged on the source
 * date gets a target-date log with zero production and the same status, client,
 * fabric and remaining quantity.
 */
@Service
public class CarryForwardService {

    private static final Logger logger = LoggerFactory.getLogger(CarryForwardService.class);

    @Autowired
    private ProductionStore productionStore;

    @Autowired
    private SelectiveCommitService selectiveCommitService;

    public CommitResult carryForward(LocalDate targetDate, LocalDate sourceDate) {
        if (targetDate == null) {
            throw new BusinessException("Target date is required");
        }
        LocalDate source = sourceDate != null ? sourceDate : targetDate.minusDays(1);
        if (!source.isBefore(targetDate)) {
            throw new BusinessException("Source date " + source + " must be before target date " + targetDate);
        }

        List<LogWrite> writes = new ArrayList<>();
        for (MachineSnapshot machine : productionStore.loadMachines()) {
            Optional<DailyLog> sourceLog = machine.findLog(source);
            sourceLog.ifPresent(log -> writes.add(new LogWrite(machine.getId(), new DailyLog(
                    targetDate,
                    log.getStatus(),
                    log.getFabric(),
                    log.getClient(),
                    BigDecimal.ZERO,
                    BigDecimal.ZERO,
                    log.getRemainingMfg(),
                    ""
            ))));
        }

        if (writes.isEmpty()) {
            logger.info("No machine has a log on {}, nothing to carry forward", source);
            return new CommitResult(targetDate, 0, 0, 0);
        }

        logger.info("Carrying forward {} machine log(s) from {} to {}", writes.size(), source, targetDate);
        return selectiveCommitService.commitWrites(targetDate, writes);
    }
}
