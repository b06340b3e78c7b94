package com.bmsedge.production.service;

import com.bmsedge.production.model.ImportRow;
import com.bmsedge.production.model.MachineSnapshot;
import com.bmsedge.production.model.ResolutionSource;
import com.bmsedge.production.model.WorkCenterProposal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Resolves work-center labels from the production export to machines.
 * The mapping table always wins, then an exact case-insensitive match on the
 * machine's name, number, id or a known alias. Anything else stays unresolved.
 */
@Service
public class WorkCenterResolver {

    private static final Logger logger = LoggerFactory.getLogger(WorkCenterResolver.class);

    public WorkCenterProposal resolve(String workCenter, List<MachineSnapshot> machines, Map<String, Long> mappings) {
        WorkCenterProposal proposal = new WorkCenterProposal(workCenter);

        Long mappedId = mappings.get(workCenter);
        if (mappedId != null) {
            proposal.setMachineId(mappedId);
            proposal.setSource(ResolutionSource.MAPPING_TABLE);
            findById(machines, mappedId).ifPresentOrElse(
                    machine -> proposal.setMachineName(machine.getName()),
                    () -> logger.warn("Work center '{}' is mapped to unknown machine {}", workCenter, mappedId));
            return proposal;
        }

        matchByName(workCenter, machines).ifPresent(machine -> {
            proposal.setMachineId(machine.getId());
            proposal.setMachineName(machine.getName());
            proposal.setSource(ResolutionSource.NAME_MATCH);
        });
        return proposal;
    }

    /**
     * Every distinct work center in the import, in first-seen order, with the fabrics seen under it.
     */
    public List<WorkCenterProposal> propose(List<ImportRow> rows, List<MachineSnapshot> machines,
                                            Map<String, Long> mappings) {
        Map<String, WorkCenterProposal> proposals = new LinkedHashMap<>();
        Map<String, Set<String>> fabrics = new HashMap<>();

        for (ImportRow row : rows) {
            String workCenter = row.getWorkCenter();
            WorkCenterProposal proposal = proposals.computeIfAbsent(workCenter,
                    label -> resolve(label, machines, mappings));
            proposal.setRowCount(proposal.getRowCount() + 1);
            if (!row.getFabricName().isBlank()) {
                fabrics.computeIfAbsent(workCenter, label -> new LinkedHashSet<>()).add(row.getFabricName());
            }
        }

        proposals.forEach((label, proposal) ->
                proposal.setFabrics(new ArrayList<>(fabrics.getOrDefault(label, Collections.emptySet()))));

        long unresolved = proposals.values().stream().filter(p -> !p.isResolved()).count();
        logger.info("Resolved {} of {} work centers", proposals.size() - unresolved, proposals.size());
        return new ArrayList<>(proposals.values());
    }

    /**
     * Label to machine id for every resolved proposal.
     */
    public Map<String, Long> toMappings(List<WorkCenterProposal> proposals) {
        Map<String, Long> resolved = new LinkedHashMap<>();
        for (WorkCenterProposal proposal : proposals) {
            if (proposal.isResolved()) {
                resolved.put(proposal.getWorkCenter(), proposal.getMachineId());
            }
        }
        return resolved;
    }

    Optional<MachineSnapshot> matchByName(String workCenter, List<MachineSnapshot> machines) {
        String label = workCenter.trim();
        if (label.isEmpty()) {
            return Optional.empty();
        }
        for (MachineSnapshot machine : machines) {
            if (machine.getName().equalsIgnoreCase(label)
                    || (machine.getMachineNumber() != null && machine.getMachineNumber().toString().equals(label))
                    || machine.getId().toString().equals(label)
                    || machine.getWorkCenterAliases().stream().anyMatch(alias -> alias.equalsIgnoreCase(label))) {
                return Optional.of(machine);
            }
        }
        return Optional.empty();
    }

    private Optional<MachineSnapshot> findById(List<MachineSnapshot> machines, Long id) {
        return machines.stream().filter(machine -> machine.getId().equals(id)).findFirst();
    }
}
