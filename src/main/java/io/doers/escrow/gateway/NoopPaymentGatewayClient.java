package io.doers.escrow.gateway;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Gateway stand-in for local runs: every call succeeds with a generated reference.
 */
@Service
public class NoopPaymentGatewayClient implements PaymentGatewayClient {

	private static final Logger log = LoggerFactory.getLogger(NoopPaymentGatewayClient.class);

	@Override
	public GatewayResult createOrder(BigDecimal amount, String currency, String description) {
		String orderId = "NOOP-ORDER-" + UUID.randomUUID();
		log.debug("NOOP createOrder: orderId={} amount={} currency={}", orderId, amount, currency);
		return GatewayResult.ok(orderId, "CREATED");
	}

	@Override
	public GatewayResult captureOrder(String orderId) {
		log.debug("NOOP captureOrder: orderId={}", orderId);
		return GatewayResult.ok("NOOP-CAPTURE-" + orderId, "COMPLETED");
	}

	@Override
	public GatewayResult refund(String captureId, BigDecimal amount) {
		log.debug("NOOP refund: captureId={} amount={}", captureId, amount);
		return GatewayResult.ok("NOOP-REFUND-" + UUID.randomUUID(), "COMPLETED");
	}

	@Override
	public String name() {
		return "NOOP";
	}
}
