package io.b2mash.b2b.dunning.escalation;

/** What a losing escalation reports when another escalation of the same invoice won the race. */
public enum ConflictStrategy {
  /** Surface {@link io.b2mash.b2b.dunning.exception.ConcurrentEscalationException}. */
  FAIL,

  /** Return the notice the winner created at the contested level. */
  RETURN_EXISTING
}
