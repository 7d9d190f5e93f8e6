package com.example.rentroll.domain.exception;

/**
 * Raised when a required column cannot be located in the rent roll header region.
 * Aborts the whole run; no partial workbook is produced.
 */
public class StructureDetectionException extends DomainException {

    private final String field;

	/**
	 * Creates the exception for the missing field.
	 *
	 * @param field   logical field that could not be located ({@code unit} or {@code code})
	 * @param message user-facing explanation
	 */
    public StructureDetectionException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
