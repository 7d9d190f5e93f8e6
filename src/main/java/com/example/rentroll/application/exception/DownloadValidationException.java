package com.example.rentroll.application.exception;

/**
 * Thrown when a processed workbook download is requested but nothing is available to send.
 */
public class DownloadValidationException extends UseCaseValidationException {

	/**
	 * @param message validation message suitable for display
	 */
    public DownloadValidationException(String message) {
        super(message);
    }
}
