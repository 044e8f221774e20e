package io.b2mash.b2b.dunning.notice;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.b2b.dunning.DunningFixtures;
import io.b2mash.b2b.dunning.exception.InvalidTransitionException;
import io.b2mash.b2b.dunning.invoice.InvoiceSnapshot;
import io.b2mash.b2b.dunning.invoice.PaymentStatus;
import io.b2mash.b2b.dunning.policy.DunningLevel;
import io.b2mash.b2b.dunning.policy.EscalationPolicy;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class DunningNoticeTest {

  private static final Instant CREATED_AT =
      DunningFixtures.clockAt(DunningFixtures.TODAY).instant();

  private final EscalationPolicy policy = DunningFixtures.defaultPolicy();

  private DunningNotice issue(InvoiceSnapshot invoice, DunningLevel level) {
    return DunningNotice.issue(invoice, policy.termsFor(level), CREATED_AT, DunningFixtures.ZONE);
  }

  @Test
  void issue_snapshotsAmountsAndStartsCreated() {
    var notice =
        issue(DunningFixtures.overdueInvoice("INV-1", "500.00"), DunningLevel.FIRST_DUNNING_NOTICE);

    assertThat(notice.getId()).isNotNull();
    assertThat(notice.getInvoiceId()).isEqualTo("INV-1");
    assertThat(notice.getLevel()).isEqualTo(DunningLevel.FIRST_DUNNING_NOTICE);
    assertThat(notice.getLabel()).isEqualTo("1. Mahnung");
    assertThat(notice.getGrossAmount()).isEqualTo(new BigDecimal("500.00"));
    assertThat(notice.getFee()).isEqualTo(new BigDecimal("10.00"));
    assertThat(notice.getInterest()).isEqualTo(new BigDecimal("25.00"));
    assertThat(notice.getTotalDue()).isEqualTo(new BigDecimal("535.00"));
    assertThat(notice.getStatus()).isEqualTo(DunningNoticeStatus.CREATED);
    assertThat(notice.getCreatedAt()).isEqualTo(CREATED_AT);
    assertThat(notice.getSentAt()).isNull();
    assertThat(notice.getResolvedAt()).isNull();
  }

  @Test
  void issue_totalDueEqualsGrossPlusFeePlusInterest() {
    var invoice = DunningFixtures.overdueInvoice("INV-1", "1234.56");
    var notice = issue(invoice, DunningLevel.FINAL_DUNNING_NOTICE);

    var expected = notice.getGrossAmount().add(notice.getFee()).add(notice.getInterest());
    assertThat(notice.getTotalDue()).isEqualByComparingTo(expected);
    // 1234.56 * 0.08 = 98.7648
    assertThat(notice.getInterest()).isEqualTo(new BigDecimal("98.76"));
  }

  @Test
  void issue_noticeNumberCarriesCreationDate() {
    var notice =
        issue(DunningFixtures.overdueInvoice("INV-1", "100.00"), DunningLevel.PAYMENT_REMINDER);

    assertThat(notice.getNoticeNumber()).matches("MAH-20260115-[0-9a-f]{8}");
  }

  @Test
  void issue_roundsToCurrencyWithoutMinorUnit() {
    var yenInvoice =
        new InvoiceSnapshot(
            "INV-JPY",
            null,
            null,
            null,
            null,
            null,
            new BigDecimal("10001"),
            "JPY",
            LocalDate.of(2026, 1, 1),
            PaymentStatus.UNPAID);

    var notice = issue(yenInvoice, DunningLevel.FIRST_DUNNING_NOTICE);

    // 10001 * 0.05 = 500.05
    assertThat(notice.getInterest()).isEqualTo(new BigDecimal("500"));
    assertThat(notice.getFee()).isEqualTo(new BigDecimal("10"));
  }

  @Test
  void issue_keepsThreeDecimalsForCurrencyWithFilsMinorUnit() {
    var dinarInvoice =
        new InvoiceSnapshot(
            "INV-KWD",
            null,
            null,
            null,
            null,
            null,
            new BigDecimal("10.05"),
            "KWD",
            LocalDate.of(2026, 1, 1),
            PaymentStatus.UNPAID);

    var notice = issue(dinarInvoice, DunningLevel.FIRST_DUNNING_NOTICE);

    // 10.050 * 0.05 = 0.5025
    assertThat(notice.getGrossAmount()).isEqualTo(new BigDecimal("10.050"));
    assertThat(notice.getFee()).isEqualTo(new BigDecimal("10.000"));
    assertThat(notice.getInterest()).isEqualTo(new BigDecimal("0.503"));
    assertThat(notice.getTotalDue()).isEqualTo(new BigDecimal("20.553"));
  }

  @Test
  void currencyScale_fallsBackToTwoForUnknownCodes() {
    assertThat(DunningNotice.currencyScale("EUR")).isEqualTo(2);
    assertThat(DunningNotice.currencyScale("JPY")).isZero();
    assertThat(DunningNotice.currencyScale("XYZ")).isEqualTo(2);
    assertThat(DunningNotice.currencyScale(null)).isEqualTo(2);
  }

  @Test
  void markSent_thenPaid() {
    var notice =
        issue(DunningFixtures.overdueInvoice("INV-1", "100.00"), DunningLevel.PAYMENT_REMINDER);
    var sentAt = CREATED_AT.plusSeconds(60);
    var paidAt = CREATED_AT.plusSeconds(3600);

    notice.markSent(sentAt);
    boolean changed = notice.markPaid(paidAt);

    assertThat(changed).isTrue();
    assertThat(notice.getStatus()).isEqualTo(DunningNoticeStatus.PAID);
    assertThat(notice.getSentAt()).isEqualTo(sentAt);
    assertThat(notice.getResolvedAt()).isEqualTo(paidAt);
  }

  @Test
  void markSent_rejectedOnceSent() {
    var notice =
        issue(DunningFixtures.overdueInvoice("INV-1", "100.00"), DunningLevel.PAYMENT_REMINDER);
    notice.markSent(CREATED_AT);

    assertThatThrownBy(() -> notice.markSent(CREATED_AT))
        .isInstanceOf(InvalidTransitionException.class);
  }

  @Test
  void markPaid_secondCallIsNoOp() {
    var notice =
        issue(DunningFixtures.overdueInvoice("INV-1", "100.00"), DunningLevel.PAYMENT_REMINDER);
    notice.markPaid(CREATED_AT);

    boolean changed = notice.markPaid(CREATED_AT.plusSeconds(10));

    assertThat(changed).isFalse();
    assertThat(notice.getResolvedAt()).isEqualTo(CREATED_AT);
  }

  @Test
  void markCancelled_rejectedOnPaidNotice() {
    var notice =
        issue(DunningFixtures.overdueInvoice("INV-1", "100.00"), DunningLevel.PAYMENT_REMINDER);
    notice.markPaid(CREATED_AT);

    assertThatThrownBy(() -> notice.markCancelled(CREATED_AT))
        .isInstanceOf(InvalidTransitionException.class);
    assertThat(notice.getStatus()).isEqualTo(DunningNoticeStatus.PAID);
  }

  @Test
  void markSent_rejectedOnCancelledNotice() {
    var notice =
        issue(DunningFixtures.overdueInvoice("INV-1", "100.00"), DunningLevel.PAYMENT_REMINDER);
    notice.markCancelled(CREATED_AT);

    assertThatThrownBy(() -> notice.markSent(CREATED_AT))
        .isInstanceOf(InvalidTransitionException.class);
  }
}
