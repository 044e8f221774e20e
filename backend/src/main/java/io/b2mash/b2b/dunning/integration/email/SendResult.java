package io.b2mash.b2b.dunning.integration.email;

/**
 * Outcome of a send attempt.
 *
 * @param success true only if the provider accepted the message for delivery
 * @param providerMessageId provider-side message id, null on failure
 * @param errorMessage failure description, null on success
 */
public record SendResult(boolean success, String providerMessageId, String errorMessage) {}
