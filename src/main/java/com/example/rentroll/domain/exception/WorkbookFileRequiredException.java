package com.example.rentroll.domain.exception;

/**
 * Raised when the client attempts to run an upload flow without providing a workbook.
 * This is a domain-layer guard that protects downstream parsing logic from null inputs.
 */
public class WorkbookFileRequiredException extends DomainException {

	/**
	 * Creates the exception with a user-friendly explanation.
	 */
    public WorkbookFileRequiredException() {
        super("Please choose a Rent Roll or Affordable Rent Roll Excel file to upload.");
    }
}
