package io.b2mash.b2b.dunning.policy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class DunningLevelTest {

  @Test
  void after_walksTheLadderOneStepAtATime() {
    assertThat(DunningLevel.after(DunningLevel.NONE)).contains(DunningLevel.PAYMENT_REMINDER);
    assertThat(DunningLevel.after(1)).contains(DunningLevel.FIRST_DUNNING_NOTICE);
    assertThat(DunningLevel.after(2)).contains(DunningLevel.FINAL_DUNNING_NOTICE);
  }

  @Test
  void after_isEmptyOnceFinalLevelIssued() {
    assertThat(DunningLevel.after(3)).isEmpty();
  }

  @Test
  void after_rejectsNegativeLevel() {
    assertThatThrownBy(() -> DunningLevel.after(-1)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void of_rejectsUnknownNumber() {
    assertThatThrownBy(() -> DunningLevel.of(0)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> DunningLevel.of(4)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void onlyFinalLevelIsTerminal() {
    assertThat(DunningLevel.PAYMENT_REMINDER.isTerminal()).isFalse();
    assertThat(DunningLevel.FIRST_DUNNING_NOTICE.isTerminal()).isFalse();
    assertThat(DunningLevel.FINAL_DUNNING_NOTICE.isTerminal()).isTrue();
  }
}
