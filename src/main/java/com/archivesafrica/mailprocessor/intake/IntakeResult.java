package com.archivesafrica.mailprocessor.intake;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of staging a batch of attachments: which staged file belongs to which sender,
 * in the order the files were written.
 */
public final class IntakeResult {

    private final Map<Path, String> staged;
    private final int rejected;

    public IntakeResult(Map<Path, String> staged, int rejected) {
        this.staged = Collections.unmodifiableMap(new LinkedHashMap<>(staged));
        this.rejected = rejected;
    }

    public static IntakeResult empty() {
        return new IntakeResult(Collections.emptyMap(), 0);
    }

    /**
     * @return staged file path → sender address
     */
    public Map<Path, String> getStaged() {
        return staged;
    }

    public int getWrittenCount() {
        return staged.size();
    }

    public int getRejectedCount() {
        return rejected;
    }

    public IntakeResult merge(IntakeResult other) {
        Map<Path, String> combined = new LinkedHashMap<>(staged);
        combined.putAll(other.staged);
        return new IntakeResult(combined, rejected + other.rejected);
    }
}
