package io.doers.escrow.util;

import org.slf4j.Logger;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC helpers so every log line of one command or sweep item carries its ids.
 */
public class LoggingUtils {

    private static final String CORRELATION_ID_KEY = "correlationId";
    private static final String CONTRACT_ID_KEY = "contractId";
    private static final String PAYMENT_ID_KEY = "paymentId";
    private static final String TICK_KEY = "tickName";

    private LoggingUtils() {
    }

    public static void setCorrelationId(String correlationId) {
        if (correlationId != null) {
            MDC.put(CORRELATION_ID_KEY, correlationId);
        }
    }

    public static void setContractId(UUID contractId) {
        if (contractId != null) {
            MDC.put(CONTRACT_ID_KEY, contractId.toString());
        }
    }

    public static void setPaymentId(UUID paymentId) {
        if (paymentId != null) {
            MDC.put(PAYMENT_ID_KEY, paymentId.toString());
        }
    }

    public static void setTickName(String tickName) {
        if (tickName != null) {
            MDC.put(TICK_KEY, tickName);
        }
    }

    public static void clearContractId() {
        MDC.remove(CONTRACT_ID_KEY);
    }

    public static void clearContext() {
        MDC.clear();
    }

    public static void logError(Logger logger, String message, UUID contractId, String operation, Throwable error) {
        setContractId(contractId);
        logger.error("{} contractId={} operation={}", message, contractId, operation, error);
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }
}
