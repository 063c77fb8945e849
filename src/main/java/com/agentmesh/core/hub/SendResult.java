package com.agentmesh.core.hub;

import java.util.List;
import java.util.Optional;

/**
 * Aggregated outcome of {@link MessageHub#send}. A result with no recipients is not an error.
 */
public record SendResult(
    String messageId,
    List<String> recipients,
    List<DeliveryResult> deliveries
) {

    public SendResult {
        recipients = List.copyOf(recipients);
        deliveries = List.copyOf(deliveries);
    }

    public static SendResult noRecipients(String messageId) {
        return new SendResult(messageId, List.of(), List.of());
    }

    public boolean hasRecipients() {
        return !recipients.isEmpty();
    }

    public boolean success() {
        return deliveries.stream().allMatch(DeliveryResult::success);
    }

    public Optional<DeliveryResult> firstFailure() {
        return deliveries.stream().filter(d -> !d.success()).findFirst();
    }

    /**
     * Return value of the single recipient of a targeted send, or empty.
     */
    public Optional<Object> singleResult() {
        if (deliveries.size() != 1 || !deliveries.get(0).success()) {
            return Optional.empty();
        }
        return Optional.ofNullable(deliveries.get(0).result());
    }
}
