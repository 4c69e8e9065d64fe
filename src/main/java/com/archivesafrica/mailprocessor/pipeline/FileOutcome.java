package com.archivesafrica.mailprocessor.pipeline;

/**
 * Where a staged file ended up after one processing attempt.
 */
public enum FileOutcome {
    /** Documents written, file moved to the success directory. */
    SUCCESS_ROUTED(true),
    /** Required fields missing; file moved to error and the sender told which. */
    INVALID(false),
    /** Workbook unreadable or laid out wrongly; file moved to error. */
    MALFORMED(false),
    /** Unexpected failure while building or routing; file moved to error. */
    FAILED(false),
    /** No sender owns the file; moved to error. */
    UNOWNED(false),
    /** Not a spreadsheet extension we process; moved to error. */
    UNSUPPORTED(false);

    private final boolean success;

    FileOutcome(boolean success) {
        this.success = success;
    }

    public boolean isSuccess() {
        return success;
    }
}
