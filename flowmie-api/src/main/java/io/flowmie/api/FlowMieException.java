package io.flowmie.api;

/**
 * Base type for every failure raised by the flowmie engine.
 *
 * All failures are deterministic given identical inputs. Retrying without
 * changing the inputs is never useful, so nothing in the engine retries.
 */
public class FlowMieException extends RuntimeException {

    public FlowMieException(String message) {
        super(message);
    }

    public FlowMieException(String message, Throwable cause) {
        super(message, cause);
    }
}
