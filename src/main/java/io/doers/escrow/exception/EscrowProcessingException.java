package io.doers.escrow.exception;

import java.util.UUID;

/**
 * Failure while processing one contract inside a scheduled sweep.
 * Includes context information for the dead letter queue.
 */
public class EscrowProcessingException extends RuntimeException {

    private final UUID contractId;
    private final String operation;

    public EscrowProcessingException(String message, UUID contractId, String operation, Throwable cause) {
        super(message, cause);
        this.contractId = contractId;
        this.operation = operation;
    }

    public UUID getContractId() {
        return contractId;
    }

    public String getOperation() {
        return operation;
    }

    @Override
    public String toString() {
        return String.format("EscrowProcessingException{contractId=%s, operation='%s', message='%s'}",
                contractId, operation, getMessage());
    }
}
