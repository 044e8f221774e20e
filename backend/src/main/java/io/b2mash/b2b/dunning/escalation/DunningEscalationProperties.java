package io.b2mash.b2b.dunning.escalation;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param transactionTimeout deadline of one escalation transaction; on expiry nothing is committed
 */
@ConfigurationProperties(prefix = "dunning.escalation")
public record DunningEscalationProperties(Duration transactionTimeout) {

  public DunningEscalationProperties {
    if (transactionTimeout != null
        && (transactionTimeout.isNegative() || transactionTimeout.isZero())) {
      throw new IllegalArgumentException(
          "dunning.escalation.transaction-timeout must be positive, was " + transactionTimeout);
    }
  }

  /**
   * Timeout in whole seconds as transaction managers expect it, rounded up so that a sub-second
   * deadline never becomes zero.
   *
   * @return the timeout, or -1 (the transaction manager default) when none is configured
   */
  public int transactionTimeoutSeconds() {
    if (transactionTimeout == null) {
      return -1;
    }
    long seconds = transactionTimeout.toSeconds();
    if (transactionTimeout.toNanosPart() > 0) {
      seconds++;
    }
    return (int) Math.min(seconds, Integer.MAX_VALUE);
  }
}
