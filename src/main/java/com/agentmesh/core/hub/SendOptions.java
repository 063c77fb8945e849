package com.agentmesh.core.hub;

import java.util.function.Consumer;

/**
 * Options for {@link MessageHub#send}.
 *
 * @param blocking when true the call returns only after every recipient settled
 * @param callback invoked once per delivery as it settles (nullable)
 */
public record SendOptions(boolean blocking, Consumer<DeliveryResult> callback) {

    public static SendOptions blockingSend() {
        return new SendOptions(true, null);
    }

    public static SendOptions fireAndForget() {
        return new SendOptions(false, null);
    }

    public SendOptions withCallback(Consumer<DeliveryResult> newCallback) {
        return new SendOptions(blocking, newCallback);
    }
}
