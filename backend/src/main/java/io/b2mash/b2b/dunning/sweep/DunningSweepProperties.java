package io.b2mash.b2b.dunning.sweep;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration of the periodic dunning sweep.
 *
 * @param enabled whether {@link DunningSweepScheduler} is registered
 * @param cron schedule of the sweep
 * @param maxDuration wall-clock budget of one sweep; remaining invoices are skipped
 * @param firstReminderAfterDays days overdue before the first reminder is issued
 * @param minDaysBetweenNotices days between a notice and the next escalation
 */
@ConfigurationProperties(prefix = "dunning.sweep")
public record DunningSweepProperties(
    boolean enabled,
    String cron,
    Duration maxDuration,
    int firstReminderAfterDays,
    int minDaysBetweenNotices) {}
