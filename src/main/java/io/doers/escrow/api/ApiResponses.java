package io.doers.escrow.api;

import io.doers.escrow.exception.CaptureDeclinedException;
import io.doers.escrow.exception.EscrowPreconditionException;
import io.doers.escrow.exception.EscrowValidationException;
import io.doers.escrow.exception.PaymentGatewayException;
import org.slf4j.Logger;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Shared error bodies and caller resolution for the escrow controllers.
 *
 * validation 400, precondition 409, capture declined 402, gateway failure 502.
 * Gateway details stay in the server log; callers only see the retry message.
 */
final class ApiResponses {

    static final String USER_HEADER = "X-User-Id";

    private ApiResponses() {
    }

    static ResponseEntity<Map<String, Object>> error(Logger log, String operation, RuntimeException e) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (e instanceof EscrowValidationException) {
            EscrowValidationException ve = (EscrowValidationException) e;
            log.warn("Rejected {}: {}", operation, ve.getMessage());
            body.put("error", ve.getMessage());
            if (ve.getFieldName() != null) {
                body.put("field", ve.getFieldName());
            }
            return ResponseEntity.badRequest().body(body);
        }
        if (e instanceof EscrowPreconditionException) {
            EscrowPreconditionException pe = (EscrowPreconditionException) e;
            log.warn("Precondition failed for {}: {} state={}", operation, pe.getMessage(), pe.getCurrentState());
            body.put("error", pe.getMessage());
            body.put("currentState", pe.getCurrentState());
            return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
        }
        if (e instanceof CaptureDeclinedException) {
            CaptureDeclinedException de = (CaptureDeclinedException) e;
            log.warn("Capture declined during {}: orderId={} code={}", operation, de.getGatewayOrderId(),
                de.getDeclineCode());
            body.put("error", PaymentGatewayException.USER_MESSAGE);
            body.put("declineCode", de.getDeclineCode());
            return ResponseEntity.status(HttpStatus.PAYMENT_REQUIRED).body(body);
        }
        if (e instanceof PaymentGatewayException) {
            log.error("Gateway failure during {}", operation, e);
            body.put("error", PaymentGatewayException.USER_MESSAGE);
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body);
        }
        log.error("Unexpected failure during {}", operation, e);
        body.put("error", "internal error");
        String correlationId = MDC.get("correlationId");
        if (correlationId != null) {
            body.put("correlationId", correlationId);
        }
        return ResponseEntity.internalServerError().body(body);
    }

    static ResponseEntity<Map<String, Object>> badRequest(String message) {
        return ResponseEntity.badRequest().body(Map.of("error", message));
    }

    static ResponseEntity<Map<String, Object>> rateLimited() {
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).body(Map.of(
            "error", "Rate limit exceeded. Maximum 100 admin requests per minute.",
            "retryAfter", "1 minute"));
    }

    /**
     * Caller id: the JWT subject when a token was presented, else the X-User-Id header.
     */
    static UUID actor(String headerValue) {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth instanceof JwtAuthenticationToken) {
            return parseUuid(auth.getName(), "sub");
        }
        if (headerValue == null || headerValue.isBlank()) {
            throw new EscrowValidationException("caller id is required", USER_HEADER, null);
        }
        return parseUuid(headerValue, USER_HEADER);
    }

    static UUID parseUuid(String value, String field) {
        try {
            return UUID.fromString(value.trim());
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new EscrowValidationException("invalid " + field + ": " + value, field, value);
        }
    }
}
