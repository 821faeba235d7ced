package io.doers.escrow.gateway;

import io.doers.escrow.config.EscrowProperties;
import io.doers.escrow.exception.CaptureDeclinedException;
import io.doers.escrow.exception.PaymentGatewayException;
import io.doers.escrow.metrics.EscrowMetrics;
import io.doers.escrow.ratelimit.EscrowRateLimiter;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

/**
 * REST gateway client. Server errors and I/O failures are retried by Resilience4j and
 * count towards the circuit breaker; capture declines are neither (see application.yml).
 */
@Service
public class HttpPaymentGatewayClient implements PaymentGatewayClient {

	private static final Logger log = LoggerFactory.getLogger(HttpPaymentGatewayClient.class);

	private final EscrowProperties props;
	private final RestTemplate rt;
	private final EscrowRateLimiter rateLimiter;
	private final EscrowMetrics metrics;

	public HttpPaymentGatewayClient(EscrowProperties props, RestTemplate restTemplate, EscrowRateLimiter rateLimiter,
			EscrowMetrics metrics) {
		this.props = props;
		this.rt = restTemplate;
		this.rateLimiter = rateLimiter;
		this.metrics = metrics;
	}

	@Override
	@Retry(name = "paymentGateway")
	@CircuitBreaker(name = "paymentGateway", fallbackMethod = "createOrderFallback")
	public GatewayResult createOrder(BigDecimal amount, String currency, String description) {
		EscrowProperties.Gateway.Http http = props.getGateway().getHttp();
		Map<String, Object> req = new HashMap<>();
		req.put("amount", amount.toPlainString());
		req.put("currency", currency);
		req.put("description", description);
		Map<String, Object> resp = postJson("create-order", http.getBaseUrl() + http.getCreateOrderPath(), req);

		Object orderId = resp.get("id");
		if (orderId == null) {
			log.warn("createOrder failed (missing id): response={}", resp);
			return GatewayResult.fail("CREATE_ORDER_FAILED: missing id");
		}
		return GatewayResult.ok(String.valueOf(orderId), String.valueOf(resp.getOrDefault("status", "CREATED")));
	}

	@Override
	@Retry(name = "paymentGateway")
	@CircuitBreaker(name = "paymentGateway", fallbackMethod = "captureFallback")
	public GatewayResult captureOrder(String orderId) {
		EscrowProperties.Gateway.Http http = props.getGateway().getHttp();
		String url = http.getBaseUrl() + http.getCaptureOrderPath().replace("{orderId}", orderId);
		Map<String, Object> resp;
		try {
			resp = postJson("capture-order", url, Map.of("orderId", orderId));
		} catch (HttpClientErrorException e) {
			if (e.getStatusCode().value() == HttpStatus.UNPROCESSABLE_ENTITY.value()
					|| e.getStatusCode().value() == HttpStatus.PAYMENT_REQUIRED.value()) {
				throw new CaptureDeclinedException(orderId, "HTTP_" + e.getStatusCode().value());
			}
			throw e;
		}

		// status returned by capture is: COMPLETED | PENDING | DECLINED | FAILED
		String status = String.valueOf(resp.getOrDefault("status", "UNKNOWN"));
		if ("DECLINED".equalsIgnoreCase(status) || "FAILED".equalsIgnoreCase(status)) {
			throw new CaptureDeclinedException(orderId, String.valueOf(resp.getOrDefault("declineCode", status)));
		}
		Object captureId = resp.get("captureId");
		if (captureId == null || !"COMPLETED".equalsIgnoreCase(status)) {
			log.warn("captureOrder unexpected response: orderId={} response={}", orderId, resp);
			throw new PaymentGatewayException("UNSUPPORTED_CAPTURE_STATUS:" + status, null, "capture");
		}
		return GatewayResult.ok(String.valueOf(captureId), status);
	}

	@Override
	@Retry(name = "paymentGateway")
	@CircuitBreaker(name = "paymentGateway", fallbackMethod = "refundFallback")
	public GatewayResult refund(String captureId, BigDecimal amount) {
		EscrowProperties.Gateway.Http http = props.getGateway().getHttp();
		String url = http.getBaseUrl() + http.getRefundPath().replace("{captureId}", captureId);
		Map<String, Object> req = new HashMap<>();
		req.put("captureId", captureId);
		if (amount != null) {
			req.put("amount", amount.toPlainString());
		}
		Map<String, Object> resp = postJson("refund", url, req);

		String status = String.valueOf(resp.getOrDefault("status", "UNKNOWN"));
		Object refundId = resp.get("id");
		if (refundId == null || "FAILED".equalsIgnoreCase(status) || "DENIED".equalsIgnoreCase(status)) {
			log.warn("refund rejected: captureId={} response={}", captureId, resp);
			return GatewayResult.fail("REFUND_REJECTED:" + status);
		}
		return GatewayResult.ok(String.valueOf(refundId), status);
	}

	@Override
	public String name() {
		return "HTTP";
	}

	public GatewayResult createOrderFallback(BigDecimal amount, String currency, String description, Throwable throwable) {
		throw unavailable("create-order", throwable);
	}

	public GatewayResult captureFallback(String orderId, Throwable throwable) {
		if (throwable instanceof CaptureDeclinedException) {
			throw (CaptureDeclinedException) throwable;
		}
		throw unavailable("capture", throwable);
	}

	public GatewayResult refundFallback(String captureId, BigDecimal amount, Throwable throwable) {
		throw unavailable("refund", throwable);
	}

	private PaymentGatewayException unavailable(String operation, Throwable throwable) {
		if (throwable instanceof PaymentGatewayException) {
			return (PaymentGatewayException) throwable;
		}
		log.warn("Gateway fallback triggered: operation={} error={}", operation,
			throwable != null ? throwable.getMessage() : "Unknown error");
		return new PaymentGatewayException("GATEWAY_UNAVAILABLE: " +
			(throwable != null ? throwable.getMessage() : "Service unavailable"), null, operation, throwable);
	}

	private Map<String, Object> postJson(String callName, String url, Map<String, Object> body) {
		if (!rateLimiter.tryConsumeGateway()) {
			throw new PaymentGatewayException("RATE_LIMIT_EXCEEDED", null, callName);
		}
		log.info("HttpPaymentGatewayClient {} REQ: url={} body={}", callName, url, body);

		HttpHeaders headers = new HttpHeaders();
		headers.setContentType(MediaType.APPLICATION_JSON);
		HttpEntity<Map<String, Object>> req = new HttpEntity<>(body, headers);

		var timer = metrics.startTimer();
		try {
			ResponseEntity<Map<String, Object>> resp = rt.exchange(url, HttpMethod.POST, req,
				new ParameterizedTypeReference<Map<String, Object>>() {});
			Map<String, Object> respBody = resp.getBody();
			log.info("HttpPaymentGatewayClient {} RESP: url={} statusCode={} body={}",
				callName, url, resp.getStatusCode().value(), respBody);

			if (!resp.getStatusCode().is2xxSuccessful() || respBody == null) {
				throw new IllegalStateException("POST failed " + resp.getStatusCode() + " url=" + url);
			}
			return respBody;
		} finally {
			metrics.recordGatewayCallTime(timer);
		}
	}
}
