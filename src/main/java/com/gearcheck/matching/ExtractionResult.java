package com.gearcheck.matching;

import com.gearcheck.models.Reference;

import java.util.Collections;
import java.util.Set;

/**
 * References found in one script source, or the reason the source could not be read.
 * A readable source with no recognizable patterns is a success with an empty set.
 */
public class ExtractionResult {
    public static final String ERR_UNREADABLE = "script_unreadable";

    private final String source;
    private final Set<Reference> references;
    private final String errorCode;
    private final String errorDetail;

    private ExtractionResult(String source, Set<Reference> references, String errorCode, String errorDetail) {
        this.source = source;
        this.references = references != null ? Collections.unmodifiableSet(references) : Collections.emptySet();
        this.errorCode = errorCode;
        this.errorDetail = errorDetail;
    }

    public static ExtractionResult of(String source, Set<Reference> references) {
        return new ExtractionResult(source, references, null, null);
    }

    public static ExtractionResult unreadable(String source, String detail) {
        return new ExtractionResult(source, null, ERR_UNREADABLE, detail);
    }

    public String getSource() {
        return source;
    }

    public Set<Reference> getReferences() {
        return references;
    }

    public boolean isFailed() {
        return errorCode != null;
    }

    /** True when the source was read but held no references. */
    public boolean isEmpty() {
        return !isFailed() && references.isEmpty();
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getErrorDetail() {
        return errorDetail;
    }
}
