package io.b2mash.b2b.dunning.integration.email;

import java.util.Map;
import java.util.Objects;

/**
 * Provider-agnostic email payload. Contains the recipient, subject, body (HTML and plain text), and
 * optional metadata for tracking.
 */
public record EmailMessage(
    String to,
    String subject,
    String htmlBody,
    String plainTextBody,
    String replyTo,
    Map<String, String> metadata) {

  /** Validates required fields. */
  public EmailMessage {
    Objects.requireNonNull(to, "to");
    Objects.requireNonNull(subject, "subject");
    metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
  }

  /**
   * Builds an EmailMessage tagged with the entity it relates to.
   *
   * @param referenceType the type of entity this email relates to (e.g., "DUNNING_NOTICE")
   * @param referenceId the ID of the referenced entity
   */
  public static EmailMessage withTracking(
      String to,
      String subject,
      String htmlBody,
      String plainTextBody,
      String replyTo,
      String referenceType,
      String referenceId) {
    Objects.requireNonNull(referenceType, "referenceType");
    Objects.requireNonNull(referenceId, "referenceId");
    return new EmailMessage(
        to,
        subject,
        htmlBody,
        plainTextBody,
        replyTo,
        Map.of("referenceType", referenceType, "referenceId", referenceId));
  }
}
