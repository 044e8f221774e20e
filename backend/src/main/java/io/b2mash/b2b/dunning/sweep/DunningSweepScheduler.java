package io.b2mash.b2b.dunning.sweep;

import java.time.Clock;
import java.time.LocalDate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs the dunning sweep on {@code dunning.sweep.cron}. Registered only when {@code
 * dunning.sweep.enabled=true}. A failed sweep is logged and retried on the next tick.
 */
@Component
@ConditionalOnProperty(name = "dunning.sweep.enabled", havingValue = "true")
public class DunningSweepScheduler {

  private static final Logger log = LoggerFactory.getLogger(DunningSweepScheduler.class);

  private final DunningSweepService sweepService;
  private final Clock clock;

  public DunningSweepScheduler(DunningSweepService sweepService, Clock clock) {
    this.sweepService = sweepService;
    this.clock = clock;
  }

  @Scheduled(cron = "${dunning.sweep.cron}", zone = "${dunning.clock.zone:Europe/Berlin}")
  public void runSweep() {
    var today = LocalDate.now(clock);
    log.info("Dunning sweep started for {}", today);
    try {
      var result = sweepService.sweep(today);
      long retryable = result.outcomes().stream().filter(EscalationOutcome::isRetryable).count();
      if (retryable > 0) {
        log.warn("Dunning sweep for {} left {} retryable failures", today, retryable);
      }
    } catch (Exception e) {
      log.error("Dunning sweep for {} failed", today, e);
    }
  }
}
