package com.archivesafrica.mailprocessor.exception;

/**
 * A staged attachment could not be carried from intake to a routed file: the registry
 * counter was not persisted, the workbook was unreadable, or a document was not built.
 * Caught per file by the orchestrator, which sends that file to the error directory.
 */
public class ProcessingException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ProcessingException(String message) {
        super(message);
    }

    /**
     * @param cause the I/O or library failure that stopped the file
     */
    public ProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
