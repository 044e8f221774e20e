package io.b2mash.b2b.dunning.policy;

import java.util.Optional;

/**
 * Closed ladder of escalation levels. A case without notices sits at level 0, which has no
 * constant here.
 */
public enum DunningLevel {
  /** Zahlungserinnerung. */
  PAYMENT_REMINDER(1),

  /** 1. Mahnung. */
  FIRST_DUNNING_NOTICE(2),

  /** 2. Mahnung, the last step before legal action. */
  FINAL_DUNNING_NOTICE(3);

  public static final int NONE = 0;

  private final int number;

  DunningLevel(int number) {
    this.number = number;
  }

  public int number() {
    return number;
  }

  public boolean isTerminal() {
    return this == FINAL_DUNNING_NOTICE;
  }

  /**
   * Resolves a level number.
   *
   * @throws IllegalArgumentException if {@code number} is outside 1..3
   */
  public static DunningLevel of(int number) {
    return switch (number) {
      case 1 -> PAYMENT_REMINDER;
      case 2 -> FIRST_DUNNING_NOTICE;
      case 3 -> FINAL_DUNNING_NOTICE;
      default -> throw new IllegalArgumentException("No dunning level " + number);
    };
  }

  /** The level that follows {@code currentLevel}, or empty once the ladder is exhausted. */
  public static Optional<DunningLevel> after(int currentLevel) {
    if (currentLevel < NONE) {
      throw new IllegalArgumentException("Negative dunning level " + currentLevel);
    }
    int next = currentLevel + 1;
    return next > FINAL_DUNNING_NOTICE.number ? Optional.empty() : Optional.of(of(next));
  }
}
