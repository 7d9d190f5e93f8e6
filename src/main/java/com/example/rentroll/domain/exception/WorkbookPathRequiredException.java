package com.example.rentroll.domain.exception;

/**
 * Raised when a caller attempts to process a null {@link java.nio.file.Path}.
 */
public class WorkbookPathRequiredException extends DomainException {

    public WorkbookPathRequiredException() {
        super("Workbook path is required.");
    }
}
