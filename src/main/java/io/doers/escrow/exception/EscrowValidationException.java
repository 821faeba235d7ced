package io.doers.escrow.exception;

/**
 * Input rejected before any state was touched (bad amounts, bad percentages, unknown ids).
 */
public class EscrowValidationException extends RuntimeException {

    private final String fieldName;
    private final Object fieldValue;

    public EscrowValidationException(String message) {
        this(message, null, null);
    }

    public EscrowValidationException(String message, String fieldName, Object fieldValue) {
        super(message);
        this.fieldName = fieldName;
        this.fieldValue = fieldValue;
    }

    public String getFieldName() {
        return fieldName;
    }

    public Object getFieldValue() {
        return fieldValue;
    }
}
