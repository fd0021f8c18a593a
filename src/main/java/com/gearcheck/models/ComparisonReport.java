package com.gearcheck.models;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of one comparison run: the orphan list in inventory order plus the counts around it.
 */
public final class ComparisonReport {
    private final List<OrphanResult> orphans;
    private final List<String> scriptSources;
    private final List<String> failedSources;
    private final String inventorySource;
    private final int referenceCount;
    private final int augmentedReferenceCount;
    private final int entryCount;
    private final int augmentedEntryCount;

    public ComparisonReport(List<OrphanResult> orphans, List<String> scriptSources, List<String> failedSources,
                            String inventorySource, int referenceCount, int augmentedReferenceCount,
                            int entryCount, int augmentedEntryCount) {
        this.orphans = Collections.unmodifiableList(orphans);
        this.scriptSources = Collections.unmodifiableList(scriptSources);
        this.failedSources = Collections.unmodifiableList(failedSources);
        this.inventorySource = inventorySource;
        this.referenceCount = referenceCount;
        this.augmentedReferenceCount = augmentedReferenceCount;
        this.entryCount = entryCount;
        this.augmentedEntryCount = augmentedEntryCount;
    }

    public List<OrphanResult> getOrphans() { return orphans; }

    public List<String> getScriptSources() { return scriptSources; }

    public List<String> getFailedSources() { return failedSources; }

    public String getInventorySource() { return inventorySource; }

    public int getReferenceCount() { return referenceCount; }

    public int getAugmentedReferenceCount() { return augmentedReferenceCount; }

    public int getEntryCount() { return entryCount; }

    public int getAugmentedEntryCount() { return augmentedEntryCount; }

    public int getOrphanCount() { return orphans.size(); }
}
