package com.gearcheck.matching;

import com.gearcheck.models.Reference;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Merged outcome of extracting several script sources. Failed sources are recorded and skipped.
 */
public class ExtractionBatch {
    private final Set<Reference> references = new LinkedHashSet<>();
    private final Map<String, Set<Reference>> referencesBySource = new LinkedHashMap<>();
    private final List<ExtractionResult> failures = new ArrayList<>();

    public void add(ExtractionResult result) {
        if (result.isFailed()) {
            failures.add(result);
            return;
        }
        references.addAll(result.getReferences());
        referencesBySource.put(result.getSource(), result.getReferences());
    }

    public Set<Reference> getReferences() {
        return Collections.unmodifiableSet(references);
    }

    public Map<String, Set<Reference>> getReferencesBySource() {
        return Collections.unmodifiableMap(referencesBySource);
    }

    public List<String> getSources() {
        return new ArrayList<>(referencesBySource.keySet());
    }

    public List<ExtractionResult> getFailures() {
        return Collections.unmodifiableList(failures);
    }

    public List<String> getFailedSources() {
        List<String> names = new ArrayList<>();
        for (ExtractionResult failure : failures) {
            names.add(failure.getSource());
        }
        return names;
    }

    public int augmentedReferenceCount() {
        int count = 0;
        for (Reference reference : references) {
            if (reference.hasAugments()) {
                count++;
            }
        }
        return count;
    }
}
