package io.doers.escrow.exception;

/**
 * The gateway definitively refused to capture an order (insufficient funds, instrument
 * declined, order voided). Unlike {@link PaymentGatewayException} this is not retryable.
 */
public class CaptureDeclinedException extends RuntimeException {

    private final String gatewayOrderId;
    private final String declineCode;

    public CaptureDeclinedException(String gatewayOrderId, String declineCode) {
        super("capture declined: orderId=" + gatewayOrderId + " code=" + declineCode);
        this.gatewayOrderId = gatewayOrderId;
        this.declineCode = declineCode;
    }

    public String getGatewayOrderId() {
        return gatewayOrderId;
    }

    public String getDeclineCode() {
        return declineCode;
    }
}
