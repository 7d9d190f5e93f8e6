package com.example.rentroll.domain.exception;

/**
 * Raised when the uploaded file does not look like an .xlsx workbook.
 */
public class UnsupportedWorkbookFormatException extends DomainException {

	/**
	 * Creates the exception and mentions the offending file so the user can react.
	 *
	 * @param fileName original file name supplied by the client
	 */
    public UnsupportedWorkbookFormatException(String fileName) {
        super("Only .xlsx uploads are supported" + (fileName != null ? ": " + fileName : "."));
    }
}
