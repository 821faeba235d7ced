package io.doers.escrow.escrow;

import lombok.Data;

/**
 * Payment gateway notification as delivered to the webhook endpoint.
 * {@code eventId} is the gateway's transaction/event id and is the dedupe key.
 */
@Data
public class GatewayWebhookEvent {

	public static final String CAPTURE_COMPLETED = "PAYMENT.CAPTURE.COMPLETED";
	public static final String CAPTURE_DENIED = "PAYMENT.CAPTURE.DENIED";
	public static final String ORDER_APPROVED = "CHECKOUT.ORDER.APPROVED";

	private String eventId;
	private String eventType;
	private String orderId;
	private String captureId;
	private String reason;
}
