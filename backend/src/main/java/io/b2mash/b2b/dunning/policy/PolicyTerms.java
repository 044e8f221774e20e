package io.b2mash.b2b.dunning.policy;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Fee and interest applying to one escalation level.
 *
 * @param level the level these terms belong to
 * @param label notice title shown to the buyer (e.g. "1. Mahnung")
 * @param fee flat dunning fee
 * @param interestRate interest as a fraction of the gross amount (0.05 for 5 %)
 */
public record PolicyTerms(
    DunningLevel level, String label, BigDecimal fee, BigDecimal interestRate) {

  public PolicyTerms {
    Objects.requireNonNull(level, "level must not be null");
    Objects.requireNonNull(label, "label must not be null");
    Objects.requireNonNull(fee, "fee must not be null");
    Objects.requireNonNull(interestRate, "interestRate must not be null");
    if (fee.signum() < 0 || interestRate.signum() < 0) {
      throw new IllegalArgumentException("Fee and interest rate must not be negative for " + level);
    }
  }

  public boolean isTerminal() {
    return level.isTerminal();
  }

  /** Interest on {@code grossAmount}, rounded half-up to {@code scale} fraction digits. */
  public BigDecimal interestOn(BigDecimal grossAmount, int scale) {
    return grossAmount.multiply(interestRate).setScale(scale, RoundingMode.HALF_UP);
  }

  public BigDecimal feeAtScale(int scale) {
    return fee.setScale(scale, RoundingMode.HALF_UP);
  }
}
