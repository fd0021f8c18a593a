package com.gearcheck.matching;

import com.gearcheck.models.InventoryEntry;
import com.gearcheck.models.Reference;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Decides whether inventory entries are used by any script reference.
 *
 * A reference covers an entry when its lower-cased name equals the entry's name or log name,
 * and either it carries no augment text or its normalized augments are a subset of the entry's.
 * Augments compare as literal strings; no numeric reasoning is done on values.
 */
public class MatchEngine {

    public boolean isCovered(InventoryEntry entry, Collection<Reference> references) {
        if (entry == null || references == null || references.isEmpty()) {
            return false;
        }
        String nameKey = entry.nameKey();
        String logNameKey = entry.hasLogName() ? entry.logNameKey() : null;
        Set<String> entryAugments = null;
        for (Reference reference : references) {
            String refKey = reference.nameKey();
            if (!refKey.equals(nameKey) && (logNameKey == null || !refKey.equals(logNameKey))) {
                continue;
            }
            if (!reference.hasAugments()) {
                return true;
            }
            if (entryAugments == null) {
                entryAugments = entry.normalizedAugments();
            }
            if (entryAugments.containsAll(reference.normalizedAugments())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Entries no reference covers, in input order.
     */
    public List<InventoryEntry> findOrphans(List<InventoryEntry> entries, Collection<Reference> references) {
        if (entries == null || entries.isEmpty()) {
            return Collections.emptyList();
        }
        Map<String, List<Reference>> byName = indexByName(references);
        List<InventoryEntry> orphans = new ArrayList<>();
        for (InventoryEntry entry : entries) {
            if (!isCovered(entry, candidatesFor(entry, byName))) {
                orphans.add(entry);
            }
        }
        return orphans;
    }

    private Map<String, List<Reference>> indexByName(Collection<Reference> references) {
        Map<String, List<Reference>> byName = new HashMap<>();
        if (references == null) {
            return byName;
        }
        for (Reference reference : references) {
            byName.computeIfAbsent(reference.nameKey(), k -> new ArrayList<>()).add(reference);
        }
        return byName;
    }

    private List<Reference> candidatesFor(InventoryEntry entry, Map<String, List<Reference>> byName) {
        List<Reference> byPrimary = byName.getOrDefault(entry.nameKey(), Collections.emptyList());
        if (!entry.hasLogName()) {
            return byPrimary;
        }
        List<Reference> byLog = byName.getOrDefault(entry.logNameKey(), Collections.emptyList());
        if (byLog.isEmpty() || byLog == byPrimary) {
            return byPrimary;
        }
        List<Reference> combined = new ArrayList<>(byPrimary);
        combined.addAll(byLog);
        return combined;
    }
}
