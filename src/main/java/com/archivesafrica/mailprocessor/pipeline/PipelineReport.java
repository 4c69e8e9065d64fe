package com.archivesafrica.mailprocessor.pipeline;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-file outcomes of one pass over the staging directory, in processing order.
 */
public final class PipelineReport {

    private final Map<Path, FileOutcome> outcomes = new LinkedHashMap<>();

    void record(Path file, FileOutcome outcome) {
        outcomes.put(file, outcome);
    }

    public Map<Path, FileOutcome> getOutcomes() {
        return Collections.unmodifiableMap(outcomes);
    }

    public FileOutcome outcomeOf(Path file) {
        return outcomes.get(file);
    }

    public int getProcessedCount() {
        return outcomes.size();
    }

    public long getSuccessCount() {
        return outcomes.values().stream().filter(FileOutcome::isSuccess).count();
    }

    public long getErrorCount() {
        return outcomes.size() - getSuccessCount();
    }

    @Override
    public String toString() {
        return "processed=" + getProcessedCount() + ", success=" + getSuccessCount() + ", error=" + getErrorCount();
    }
}
