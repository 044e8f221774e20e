package io.b2mash.b2b.dunning.delivery;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.b2b.dunning.DunningFixtures;
import io.b2mash.b2b.dunning.notice.DunningNotice;
import io.b2mash.b2b.dunning.policy.DunningLevel;
import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class DunningEmailRendererTest {

  private final DunningEmailRenderer renderer = new DunningEmailRenderer();

  @Test
  void render_fillsSubjectAndAmounts() {
    var invoice = DunningFixtures.overdueInvoice("2026-001", "1500.00");
    var notice =
        DunningNotice.issue(
            invoice,
            DunningFixtures.defaultPolicy().termsFor(DunningLevel.FIRST_DUNNING_NOTICE),
            DunningFixtures.clockAt(DunningFixtures.TODAY).instant(),
            DunningFixtures.ZONE);

    var email = renderer.render(notice, invoice);

    assertThat(email.subject()).isEqualTo("1. Mahnung zu Rechnung RE-2026-001");
    assertThat(email.htmlBody())
        .contains("1.500,00 EUR")
        .contains("10,00 EUR")
        .contains("75,00 EUR")
        .contains("1.585,00 EUR")
        .contains(notice.getNoticeNumber())
        .contains("01.01.2026");
    assertThat(email.plainTextBody()).doesNotContain("<").contains("Muster GmbH");
  }

  @Test
  void render_finalNoticeUsesFinalWording() {
    var invoice = DunningFixtures.overdueInvoice("2026-002", "100.00");
    var notice =
        DunningNotice.issue(
            invoice,
            DunningFixtures.defaultPolicy().termsFor(DunningLevel.FINAL_DUNNING_NOTICE),
            DunningFixtures.clockAt(DunningFixtures.TODAY).instant(),
            DunningFixtures.ZONE);

    var email = renderer.render(notice, invoice);

    assertThat(email.htmlBody()).contains("letzte Mahnung");
  }

  @Test
  void money_usesGermanSeparators() {
    assertThat(DunningEmailRenderer.money(new BigDecimal("1234.50"), "EUR"))
        .isEqualTo("1.234,50 EUR");
  }

  @Test
  void toPlainText_stripsMarkup() {
    var text = renderer.toPlainText("<p>Hallo&nbsp;<strong>Welt</strong></p><p>A &amp; B</p>");

    assertThat(text).isEqualTo("Hallo Welt\n\nA & B");
  }
}
