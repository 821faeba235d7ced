package io.doers.escrow.exception;

import java.util.UUID;

/**
 * The payment gateway could not be reached or returned an unusable answer.
 * No local state was changed, so the operation can be retried.
 */
public class PaymentGatewayException extends RuntimeException {

    public static final String USER_MESSAGE = "payment could not be processed, try again";

    private final UUID paymentId;
    private final String operation;

    public PaymentGatewayException(String message, UUID paymentId, String operation) {
        super(message);
        this.paymentId = paymentId;
        this.operation = operation;
    }

    public PaymentGatewayException(String message, UUID paymentId, String operation, Throwable cause) {
        super(message, cause);
        this.paymentId = paymentId;
        this.operation = operation;
    }

    public UUID getPaymentId() {
        return paymentId;
    }

    public String getOperation() {
        return operation;
    }
}
