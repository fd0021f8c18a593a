package com.gearcheck;

import com.gearcheck.inventory.InventoryLoader;
import com.gearcheck.matching.ExtractionBatch;
import com.gearcheck.matching.MatchEngine;
import com.gearcheck.matching.ScriptSources;
import com.gearcheck.models.ComparisonReport;
import com.gearcheck.models.InventoryEntry;
import com.gearcheck.models.OrphanResult;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * One comparison run: discover scripts, extract references, load inventory, find orphans.
 */
public class ComparisonService {

    private final ScriptSources scriptSources;
    private final InventoryLoader inventoryLoader;
    private final MatchEngine matchEngine;

    public ComparisonService(ScriptSources scriptSources, InventoryLoader inventoryLoader, MatchEngine matchEngine) {
        this.scriptSources = scriptSources;
        this.inventoryLoader = inventoryLoader;
        this.matchEngine = matchEngine;
    }

    /**
     * @throws IOException if the scripts path does not exist or cannot be listed
     * @throws com.gearcheck.inventory.InventoryLoadException if the inventory is unreadable or malformed
     */
    public ComparisonReport run(Path scriptsPath, Path inventoryPath, boolean equippableOnly) throws IOException {
        AppLogger logger = AppLogger.get();

        List<Path> files = ScriptSources.discover(scriptsPath);
        ExtractionBatch batch = scriptSources.readAll(files);
        if (logger != null) {
            logger.info("Found " + batch.getReferences().size() + " unique items ("
                + batch.augmentedReferenceCount() + " with augments) in "
                + batch.getSources().size() + " script file(s)");
            if (!batch.getFailures().isEmpty()) {
                logger.warn(batch.getFailures().size() + " script file(s) could not be read: " + batch.getFailedSources());
            }
        }

        List<InventoryEntry> entries = inventoryLoader.load(inventoryPath, equippableOnly);
        int augmentedEntries = 0;
        for (InventoryEntry entry : entries) {
            if (entry.hasAugments()) {
                augmentedEntries++;
            }
        }
        if (logger != null) {
            logger.info("Found " + entries.size() + (equippableOnly ? " equippable" : "")
                + " items (" + augmentedEntries + " with augments) in " + inventoryPath.getFileName());
        }

        List<InventoryEntry> orphans = matchEngine.findOrphans(entries, batch.getReferences());
        List<String> sources = batch.getSources();
        List<OrphanResult> results = new ArrayList<>();
        for (InventoryEntry orphan : orphans) {
            results.add(new OrphanResult(orphan, sources));
        }
        if (logger != null) {
            logger.info("Found " + results.size() + " orphaned items");
        }

        return new ComparisonReport(
            results,
            sources,
            batch.getFailedSources(),
            String.valueOf(inventoryPath.getFileName()),
            batch.getReferences().size(),
            batch.augmentedReferenceCount(),
            entries.size(),
            augmentedEntries
        );
    }
}
