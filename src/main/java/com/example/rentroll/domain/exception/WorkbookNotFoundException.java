package com.example.rentroll.domain.exception;

/**
 * Raised when a referenced workbook path does not exist on disk.
 */
public class WorkbookNotFoundException extends DomainException {

	/**
	 * @param path absolute or relative path that could not be resolved
	 */
    public WorkbookNotFoundException(String path) {
        super("Workbook not found: " + path);
    }
}
