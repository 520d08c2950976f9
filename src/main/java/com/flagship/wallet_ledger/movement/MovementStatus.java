package com.flagship.wallet_ledger.movement;

import com.flagship.wallet_ledger.error.LedgerErrorCode;
import com.flagship.wallet_ledger.error.LedgerException;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle of a movement.
 *
 * <pre>
 *   PENDING -> COMPLETED
 *   PENDING -> FAILED
 *   PENDING -> CANCELLED
 * </pre>
 *
 * Terminal states are final: no transition out of them, not even to the same
 * state. A repeated notification for a settled movement is an error the caller
 * has to see, not a no-op.
 */
public enum MovementStatus {
    /**
     * Created, waiting for the provider, gateway or an operator.
     */
    PENDING,

    /**
     * Settled. Terminal.
     */
    COMPLETED,

    /**
     * Rejected by the provider or gateway. Terminal.
     */
    FAILED,

    /**
     * Abandoned, or reported with a status we do not recognise. Terminal.
     */
    CANCELLED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this != PENDING;
    }

    public boolean canTransitionTo(MovementStatus target) {
        return this == PENDING && target != null && target.isTerminal();
    }

    /**
     * Validates a transition and returns the target state.
     *
     * @param movement description used in the error message, e.g. "deposit 1f2e..."
     * @throws LedgerException {@link LedgerErrorCode#INVALID_STATE} if the transition is not allowed
     */
    public MovementStatus transitionTo(MovementStatus target, String movement) {
        if (!canTransitionTo(target)) {
            throw LedgerException.of(LedgerErrorCode.INVALID_STATE,
                "Cannot move %s from %s to %s", movement, this, target);
        }
        return target;
    }

    /**
     * Maps a payment gateway's deposit callback status onto an internal state.
     *
     * <ul>
     *   <li>{@code success}, {@code completed} -> {@link #COMPLETED}</li>
     *   <li>{@code failed} -> {@link #FAILED}</li>
     *   <li>anything else, {@code pending} and null included -> {@link #CANCELLED}</li>
     * </ul>
     *
     * A callback always settles the deposit.
     */
    public static MovementStatus fromGatewayCallback(String callbackStatus) {
        MovementStatus status = fromExternal(callbackStatus);
        return status == PENDING ? CANCELLED : status;
    }

    /**
     * Maps the status vocabulary of product providers and operators onto
     * internal states.
     *
     * <ul>
     *   <li>{@code success}, {@code completed} -> {@link #COMPLETED}</li>
     *   <li>{@code failed} -> {@link #FAILED}</li>
     *   <li>{@code pending} -> {@link #PENDING} (never a valid transition target)</li>
     *   <li>anything else, including null -> {@link #CANCELLED}</li>
     * </ul>
     *
     * Unknown strings never reach the database.
     */
    public static MovementStatus fromExternal(String externalStatus) {
        if (externalStatus == null) {
            return CANCELLED;
        }
        return switch (externalStatus.trim().toLowerCase(Locale.ROOT)) {
            case "success", "completed" -> COMPLETED;
            case "failed" -> FAILED;
            case "pending" -> PENDING;
            default -> CANCELLED;
        };
    }
}
