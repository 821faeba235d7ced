package io.doers.escrow.gateway;

import io.doers.escrow.exception.CaptureDeclinedException;
import io.doers.escrow.exception.PaymentGatewayException;

import java.math.BigDecimal;

public interface PaymentGatewayClient {

	GatewayResult createOrder(BigDecimal amount, String currency, String description);

	/**
	 * @throws CaptureDeclinedException when the gateway refuses the capture
	 * @throws PaymentGatewayException when the gateway is unreachable or answers unexpectedly
	 */
	GatewayResult captureOrder(String orderId);

	/**
	 * @param amount amount to refund, or null for the full captured amount
	 */
	GatewayResult refund(String captureId, BigDecimal amount);

	String name();
}
