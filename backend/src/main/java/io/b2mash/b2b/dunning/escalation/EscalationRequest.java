package io.b2mash.b2b.dunning.escalation;

import java.util.Objects;

/**
 * Escalation command.
 *
 * @param invoiceId invoice to escalate
 * @param expectedCurrentLevel level the caller last observed; when set, the escalation only
 *     proceeds if the stored level still matches (null advances from whatever is stored)
 * @param onConflict behaviour when another escalation won the race
 */
public record EscalationRequest(
    String invoiceId, Integer expectedCurrentLevel, ConflictStrategy onConflict) {

  public EscalationRequest {
    Objects.requireNonNull(invoiceId, "invoiceId must not be null");
    onConflict = onConflict != null ? onConflict : ConflictStrategy.FAIL;
  }

  /** Advance one level from the stored state, failing on conflict. */
  public static EscalationRequest advance(String invoiceId) {
    return new EscalationRequest(invoiceId, null, ConflictStrategy.FAIL);
  }
}
