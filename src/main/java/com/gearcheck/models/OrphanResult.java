package com.gearcheck.models;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.List;

/**
 * An inventory entry no script reference covers, with the sources that were searched.
 */
public final class OrphanResult {
    private final InventoryEntry entry;
    private final List<String> checkedSources;

    public OrphanResult(InventoryEntry entry, List<String> checkedSources) {
        this.entry = entry;
        this.checkedSources = checkedSources != null
            ? Collections.unmodifiableList(checkedSources)
            : Collections.emptyList();
    }

    public InventoryEntry getEntry() {
        return entry;
    }

    /** Script sources that were searched without finding this item. */
    @JsonIgnore
    public List<String> getCheckedSources() {
        return checkedSources;
    }

    /**
     * Identifier a checklist uses to address this orphan: container, item name and raw augments.
     */
    public String getKey() {
        return entry.getContainerName() + ":" + entry.getName() + ":" + entry.getAugmentText();
    }
}
