package io.b2mash.b2b.dunning.sweep;

import io.b2mash.b2b.dunning.escalation.ConflictStrategy;
import io.b2mash.b2b.dunning.escalation.DunningEscalationService;
import io.b2mash.b2b.dunning.escalation.EscalationRequest;
import io.b2mash.b2b.dunning.escalation.OverdueDetector;
import io.b2mash.b2b.dunning.escalation.OverdueInvoiceView;
import io.b2mash.b2b.dunning.exception.DunningException;
import io.b2mash.b2b.dunning.exception.SweepDateInFutureException;
import io.b2mash.b2b.dunning.policy.DunningLevel;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Batch escalation of overdue invoices. Each invoice is escalated in its own transaction through
 * the engine; one invoice's failure is recorded and never aborts the sweep.
 *
 * <p>The sweep passes the level it observed as the expected level, so an invoice escalated
 * concurrently (by an operator or an overlapping sweep) is not pushed a second step.
 */
@Service
public class DunningSweepService {

  private static final Logger log = LoggerFactory.getLogger(DunningSweepService.class);

  private final OverdueDetector overdueDetector;
  private final DunningEscalationService escalationService;
  private final DunningSweepProperties properties;
  private final Clock clock;

  public DunningSweepService(
      OverdueDetector overdueDetector,
      DunningEscalationService escalationService,
      DunningSweepProperties properties,
      Clock clock) {
    this.overdueDetector = overdueDetector;
    this.escalationService = escalationService;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Sweeps all invoices overdue as of {@code asOf}.
   *
   * @throws SweepDateInFutureException if {@code asOf} lies after today
   * @throws io.b2mash.b2b.dunning.exception.SourceUnavailableException if the overdue list itself
   *     cannot be read
   */
  public DunningSweepResult sweep(LocalDate asOf) {
    Instant startedAt = clock.instant();
    LocalDate today = LocalDate.ofInstant(startedAt, clock.getZone());
    if (asOf.isAfter(today)) {
      throw new SweepDateInFutureException(asOf, today);
    }
    Instant deadline =
        properties.maxDuration() != null ? startedAt.plus(properties.maxDuration()) : null;
    List<OverdueInvoiceView> overdue = overdueDetector.findOverdue(asOf);
    var outcomes = new ArrayList<EscalationOutcome>(overdue.size());

    for (int i = 0; i < overdue.size(); i++) {
      SkipReason stop = stopReason(deadline);
      if (stop != null) {
        log.warn(
            "Dunning sweep for {} stopped ({}), {} invoices left unprocessed",
            asOf,
            stop,
            overdue.size() - i);
        for (var remaining : overdue.subList(i, overdue.size())) {
          outcomes.add(EscalationOutcome.skipped(remaining.invoiceId(), stop));
        }
        break;
      }
      outcomes.add(process(overdue.get(i), asOf));
    }

    var result = new DunningSweepResult(asOf, startedAt, clock.instant(), outcomes);
    log.info(
        "Dunning sweep for {} completed: {} escalated, {} failed, {} skipped",
        asOf,
        result.escalated(),
        result.failed(),
        result.skipped());
    return result;
  }

  private EscalationOutcome process(OverdueInvoiceView view, LocalDate asOf) {
    SkipReason skip = skipReason(view, asOf);
    if (skip != null) {
      return EscalationOutcome.skipped(view.invoiceId(), skip);
    }
    try {
      var notice =
          escalationService.escalate(
              new EscalationRequest(
                  view.invoiceId(), view.currentLevel(), ConflictStrategy.RETURN_EXISTING));
      return EscalationOutcome.escalated(view.invoiceId(), notice);
    } catch (DunningException e) {
      log.warn(
          "Dunning sweep could not escalate invoice {}: {} {}",
          view.invoiceId(),
          e.getCode(),
          e.getBody().getDetail());
      return EscalationOutcome.failed(view.invoiceId(), e.getCode(), e.getBody().getDetail());
    } catch (RuntimeException e) {
      log.error("Dunning sweep failed on invoice {}", view.invoiceId(), e);
      return EscalationOutcome.failed(view.invoiceId(), null, e.getMessage());
    }
  }

  SkipReason skipReason(OverdueInvoiceView view, LocalDate asOf) {
    if (view.currentLevel() >= DunningLevel.FINAL_DUNNING_NOTICE.number()) {
      return SkipReason.FINAL_LEVEL_REACHED;
    }
    if (view.currentLevel() == DunningLevel.NONE) {
      return view.daysOverdue() < properties.firstReminderAfterDays()
          ? SkipReason.GRACE_PERIOD
          : null;
    }
    if (view.lastNoticeAt() != null) {
      LocalDate lastNoticeDate = LocalDate.ofInstant(view.lastNoticeAt(), clock.getZone());
      if (ChronoUnit.DAYS.between(lastNoticeDate, asOf) < properties.minDaysBetweenNotices()) {
        return SkipReason.TOO_SOON_SINCE_LAST_NOTICE;
      }
    }
    return null;
  }

  private SkipReason stopReason(Instant deadline) {
    if (Thread.currentThread().isInterrupted()) {
      return SkipReason.CANCELLED;
    }
    if (deadline != null && clock.instant().isAfter(deadline)) {
      return SkipReason.DEADLINE_EXCEEDED;
    }
    return null;
  }
}
