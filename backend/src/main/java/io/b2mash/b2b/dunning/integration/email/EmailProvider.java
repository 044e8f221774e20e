package io.b2mash.b2b.dunning.integration.email;

/** Port for sending emails via an external provider. */
public interface EmailProvider {

  /** Provider identifier (e.g., "smtp", "noop"). */
  String providerId();

  /** Send an email message. */
  SendResult sendEmail(EmailMessage message);
}
