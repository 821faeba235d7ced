package io.doers.escrow.exception;

import java.util.UUID;

/**
 * The target row is not in the state the operation requires, usually because another
 * actor already processed it. Schedulers and webhooks treat this as a no-op; admin
 * actions surface it to the caller.
 */
public class EscrowPreconditionException extends RuntimeException {

    private final UUID entityId;
    private final String currentState;

    public EscrowPreconditionException(String message, UUID entityId, String currentState) {
        super(message);
        this.entityId = entityId;
        this.currentState = currentState;
    }

    public static EscrowPreconditionException alreadyReleased(UUID paymentId, String currentState) {
        return new EscrowPreconditionException("already released", paymentId, currentState);
    }

    public static EscrowPreconditionException alreadyProcessed(UUID entityId, String currentState) {
        return new EscrowPreconditionException("already processed", entityId, currentState);
    }

    public UUID getEntityId() {
        return entityId;
    }

    public String getCurrentState() {
        return currentState;
    }

    @Override
    public String toString() {
        return String.format("EscrowPreconditionException{entityId=%s, currentState='%s', message='%s'}",
                entityId, currentState, getMessage());
    }
}
