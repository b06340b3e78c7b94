package com.bmsedge.production.repository;

import com.bmsedge.production.model.MachineSnapshot;

import java.util.List;
import java.util.Map;

/**
 * What the import pipeline needs from persistence.
 */
public interface ProductionStore {

    /**
     * All machines with their full log history.
     */
    List<MachineSnapshot> loadMachines();

    /**
     * The whole work-center mapping table, label to machine id.
     */
    Map<String, Long> loadWorkCenterMappings();

    void saveWorkCenterMappings(Map<String, Long> mappings);

    void deleteWorkCenterMapping(String workCenter);

    /**
     * Applies every write in the batch atomically.
     *
     * @return number of machines updated; machines that no longer exist are skipped
     */
    int commit(WriteBatch batch);
}
