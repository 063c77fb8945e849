package com.agentmesh.core.hub;

/**
 * Outcome of delivering one message to one endpoint.
 *
 * @param endpointId recipient
 * @param success    whether the handler returned normally
 * @param result     handler return value (nullable)
 * @param error      failure description when {@code success} is false
 */
public record DeliveryResult(
    String endpointId,
    boolean success,
    Object result,
    String error
) {

    public static DeliveryResult success(String endpointId, Object result) {
        return new DeliveryResult(endpointId, true, result, null);
    }

    public static DeliveryResult failure(String endpointId, Throwable cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new DeliveryResult(endpointId, false, null, message);
    }
}
