package com.archivesafrica.mailprocessor.exception;

/**
 * Thrown when a staged workbook cannot be read, has no primary sheet, or its labels
 * cannot be turned into a record (blank, duplicate or unusable labels).
 */
public class MalformedSpreadsheetException extends ProcessingException {

    private static final long serialVersionUID = 1L;

    public MalformedSpreadsheetException(String message) {
        super(message);
    }

    public MalformedSpreadsheetException(String message, Throwable cause) {
        super(message, cause);
    }
}
