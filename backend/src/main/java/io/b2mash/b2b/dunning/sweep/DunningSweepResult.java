package io.b2mash.b2b.dunning.sweep;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/** Per-invoice outcomes of one sweep, in processing order. */
public record DunningSweepResult(
    LocalDate asOf, Instant startedAt, Instant finishedAt, List<EscalationOutcome> outcomes) {

  public DunningSweepResult {
    outcomes = List.copyOf(outcomes);
  }

  public long escalated() {
    return count(EscalationOutcome.Type.ESCALATED);
  }

  public long failed() {
    return count(EscalationOutcome.Type.FAILED);
  }

  public long skipped() {
    return count(EscalationOutcome.Type.SKIPPED);
  }

  private long count(EscalationOutcome.Type type) {
    return outcomes.stream().filter(o -> o.type() == type).count();
  }
}
