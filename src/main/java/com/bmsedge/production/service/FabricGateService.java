package com.bmsedge.production.service;

import com.bmsedge.production.model.Fabric;
import com.bmsedge.production.model.FabricProposal;
import com.bmsedge.production.model.ImportRow;
import com.bmsedge.production.repository.FabricRepository;
import com.bmsedge.production.util.FabricNameParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Finds fabric names in an import that are not in the fabric master and creates
 * the ones the operator approves. Must run before reconciliation, which looks up
 * short names in the master.
 */
@Service
public class FabricGateService {

    private static final Logger logger = LoggerFactory.getLogger(FabricGateService.class);

    @Autowired
    private FabricRepository fabricRepository;

    @Autowired
    private FabricService fabricService;

    @Transactional(readOnly = true)
    public List<FabricProposal> findMissingFabrics(List<ImportRow> rows) {
        return findMissingFabrics(rows, fabricRepository.findAll());
    }

    public List<FabricProposal> findMissingFabrics(List<ImportRow> rows, List<Fabric> knownFabrics) {
        Set<String> known = knownFabrics.stream()
                .map(Fabric::getName)
                .collect(Collectors.toSet());

        Set<String> missing = new LinkedHashSet<>();
        for (ImportRow row : rows) {
            String name = row.getFabricName();
            if (!name.isBlank() && !known.contains(name)) {
                missing.add(name);
            }
        }

        List<FabricProposal> proposals = new ArrayList<>();
        for (String name : missing) {
            FabricNameParser.ParsedName parsed = FabricNameParser.parse(name);
            proposals.add(new FabricProposal(name, parsed.getCode(), parsed.getShortName()));
        }

        if (!proposals.isEmpty()) {
            logger.info("Import references {} unknown fabric(s)", proposals.size());
        }
        return proposals;
    }

    /**
     * Creates the approved fabrics. Names that already exist are left alone.
     *
     * @return the fabrics created
     */
    @Transactional
    public List<Fabric> createFabrics(Collection<String> approvedNames) {
        List<Fabric> created = new ArrayList<>();
        for (String name : new LinkedHashSet<>(approvedNames)) {
            if (name == null || name.isBlank() || fabricRepository.existsByName(name)) {
                continue;
            }
            created.add(fabricService.createFabric(name));
        }

        if (!created.isEmpty()) {
            logger.info("Added {} new fabric(s) from import", created.size());
        }
        return created;
    }
}
