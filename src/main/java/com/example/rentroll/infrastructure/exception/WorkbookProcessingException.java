package com.example.rentroll.infrastructure.exception;

/**
 * Signals issues while reading or writing a workbook with Apache POI.
 */
public class WorkbookProcessingException extends InfrastructureException {
	/**
	 * @param message description shared with the application layer
	 * @param cause   low-level POI or IO exception
	 */
    public WorkbookProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
