package io.b2mash.b2b.dunning.sweep.dto;

import io.b2mash.b2b.dunning.sweep.DunningSweepResult;
import io.b2mash.b2b.dunning.sweep.EscalationOutcome;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

public record DunningSweepResponse(
    LocalDate asOf,
    Instant startedAt,
    Instant finishedAt,
    long escalated,
    long failed,
    long skipped,
    List<EscalationOutcome> outcomes) {

  public static DunningSweepResponse from(DunningSweepResult result) {
    return new DunningSweepResponse(
        result.asOf(),
        result.startedAt(),
        result.finishedAt(),
        result.escalated(),
        result.failed(),
        result.skipped(),
        result.outcomes());
  }
}
