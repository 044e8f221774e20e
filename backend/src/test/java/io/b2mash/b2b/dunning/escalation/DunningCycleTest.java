package io.b2mash.b2b.dunning.escalation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

import io.b2mash.b2b.dunning.DunningFixtures;
import io.b2mash.b2b.dunning.exception.InvoiceAlreadySettledException;
import io.b2mash.b2b.dunning.invoice.InMemoryInvoiceQueryPort;
import io.b2mash.b2b.dunning.invoice.PaymentStatus;
import io.b2mash.b2b.dunning.notice.DunningNoticeService;
import io.b2mash.b2b.dunning.notice.DunningNoticeStatus;
import io.b2mash.b2b.dunning.notice.InMemoryDunningCaseStore;
import io.b2mash.b2b.dunning.policy.DunningLevel;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.transaction.PlatformTransactionManager;

/** Detection, escalation and notice resolution wired over in-memory invoices and notices. */
class DunningCycleTest {

  private static final LocalDate DUE_DATE = LocalDate.of(2026, 1, 1);

  private InMemoryInvoiceQueryPort invoices;
  private OverdueDetector overdueDetector;
  private DunningEscalationService escalationService;
  private DunningNoticeService noticeService;

  @BeforeEach
  void setUp() {
    Clock clock = DunningFixtures.clockAt(DunningFixtures.TODAY);
    invoices = new InMemoryInvoiceQueryPort();
    var caseStore = new InMemoryDunningCaseStore();
    overdueDetector = new OverdueDetector(invoices, caseStore, clock);
    escalationService =
        new DunningEscalationService(
            invoices,
            caseStore,
            DunningFixtures.defaultPolicy(),
            mock(ApplicationEventPublisher.class),
            clock,
            mock(PlatformTransactionManager.class),
            new DunningEscalationProperties(Duration.ofSeconds(10)));
    noticeService = new DunningNoticeService(caseStore, invoices, clock);
  }

  @Test
  void unpaidInvoiceIsRemindedEscalatedAndClosedAfterPayment() {
    invoices.put(DunningFixtures.invoice("INV-1", "500.00", DUE_DATE, PaymentStatus.UNPAID));

    var overdue = overdueDetector.findOverdue(DunningFixtures.TODAY);
    assertThat(overdue).hasSize(1);
    assertThat(overdue.get(0).invoiceId()).isEqualTo("INV-1");
    assertThat(overdue.get(0).daysOverdue()).isEqualTo(14);
    assertThat(overdue.get(0).currentLevel()).isZero();

    var reminder = escalationService.escalate("INV-1");
    assertThat(reminder.getLevel()).isEqualTo(DunningLevel.PAYMENT_REMINDER);
    assertThat(reminder.getFee()).isEqualTo(new BigDecimal("5.00"));
    assertThat(reminder.getTotalDue()).isEqualTo(new BigDecimal("505.00"));
    assertThat(reminder.getStatus()).isEqualTo(DunningNoticeStatus.CREATED);

    assertThat(noticeService.markSent(reminder.getId()).getStatus())
        .isEqualTo(DunningNoticeStatus.SENT);

    var firstNotice = escalationService.escalate("INV-1");
    assertThat(firstNotice.getLevel()).isEqualTo(DunningLevel.FIRST_DUNNING_NOTICE);
    assertThat(firstNotice.getFee()).isEqualTo(new BigDecimal("10.00"));
    assertThat(firstNotice.getInterest()).isEqualTo(new BigDecimal("25.00"));
    assertThat(firstNotice.getTotalDue()).isEqualTo(new BigDecimal("535.00"));

    var paid = noticeService.markPaid(firstNotice.getId());
    assertThat(paid.getStatus()).isEqualTo(DunningNoticeStatus.PAID);
    assertThat(paid.getStatus().isTerminal()).isTrue();

    invoices.put(DunningFixtures.invoice("INV-1", "500.00", DUE_DATE, PaymentStatus.PAID));

    assertThatThrownBy(() -> escalationService.escalate("INV-1"))
        .isInstanceOf(InvoiceAlreadySettledException.class);
    assertThat(noticeService.listNotices("INV-1"))
        .extracting(n -> n.getLevel().number())
        .containsExactly(1, 2);
    assertThat(overdueDetector.findOverdue(DunningFixtures.TODAY)).isEmpty();
  }
}
