package io.b2mash.b2b.dunning.notice;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.b2b.dunning.DunningFixtures;
import io.b2mash.b2b.dunning.exception.MaxLevelReachedException;
import io.b2mash.b2b.dunning.policy.DunningLevel;
import io.b2mash.b2b.dunning.policy.EscalationPolicy;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class DunningCaseTest {

  private final EscalationPolicy policy = DunningFixtures.defaultPolicy();

  private DunningNotice notice(String invoiceId, DunningLevel level) {
    return DunningNotice.issue(
        DunningFixtures.overdueInvoice(invoiceId, "100.00"),
        policy.termsFor(level),
        Instant.parse("2026-01-15T09:00:00Z"),
        DunningFixtures.ZONE);
  }

  @Test
  void empty_startsAtLevelZero() {
    var dunningCase = DunningCase.empty("INV-1");

    assertThat(dunningCase.currentLevel()).isZero();
    assertThat(dunningCase.latestNotice()).isEmpty();
    assertThat(dunningCase.nextLevel()).isEqualTo(DunningLevel.PAYMENT_REMINDER);
  }

  @Test
  void of_ordersHistoryByLevelAndDerivesCurrentLevel() {
    var second = notice("INV-1", DunningLevel.FIRST_DUNNING_NOTICE);
    var first = notice("INV-1", DunningLevel.PAYMENT_REMINDER);

    var dunningCase = DunningCase.of("INV-1", List.of(second, first));

    assertThat(dunningCase.notices()).containsExactly(first, second);
    assertThat(dunningCase.currentLevel()).isEqualTo(2);
    assertThat(dunningCase.latestNotice()).contains(second);
    assertThat(dunningCase.noticeAt(1)).contains(first);
    assertThat(dunningCase.nextLevel()).isEqualTo(DunningLevel.FINAL_DUNNING_NOTICE);
  }

  @Test
  void nextLevel_throwsAtFinalLevel() {
    var dunningCase =
        DunningCase.of(
            "INV-1",
            List.of(
                notice("INV-1", DunningLevel.PAYMENT_REMINDER),
                notice("INV-1", DunningLevel.FIRST_DUNNING_NOTICE),
                notice("INV-1", DunningLevel.FINAL_DUNNING_NOTICE)));

    assertThat(dunningCase.isAtFinalLevel()).isTrue();
    assertThatThrownBy(dunningCase::nextLevel).isInstanceOf(MaxLevelReachedException.class);
  }

  @Test
  void of_rejectsNoticeOfAnotherInvoice() {
    var foreign = notice("INV-2", DunningLevel.PAYMENT_REMINDER);

    assertThatThrownBy(() -> DunningCase.of("INV-1", List.of(foreign)))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
