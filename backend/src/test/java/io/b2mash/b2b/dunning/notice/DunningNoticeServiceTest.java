package io.b2mash.b2b.dunning.notice;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.b2b.dunning.DunningFixtures;
import io.b2mash.b2b.dunning.exception.DunningNoticeNotFoundException;
import io.b2mash.b2b.dunning.exception.InvalidTransitionException;
import io.b2mash.b2b.dunning.exception.InvoiceNotFoundException;
import io.b2mash.b2b.dunning.invoice.InvoiceQueryPort;
import io.b2mash.b2b.dunning.policy.DunningLevel;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DunningNoticeServiceTest {

  private static final Clock CLOCK = DunningFixtures.clockAt(DunningFixtures.TODAY);

  @Mock private DunningCaseStore caseStore;
  @Mock private InvoiceQueryPort invoiceQueryPort;

  private DunningNoticeService service;
  private DunningNotice notice;

  @BeforeEach
  void setUp() {
    service = new DunningNoticeService(caseStore, invoiceQueryPort, CLOCK);
    notice =
        DunningNotice.issue(
            DunningFixtures.overdueInvoice("INV-1", "500.00"),
            DunningFixtures.defaultPolicy().termsFor(DunningLevel.PAYMENT_REMINDER),
            CLOCK.instant(),
            DunningFixtures.ZONE);
  }

  @Test
  void markSent_recordsDeliveryTime() {
    when(caseStore.findNotice(notice.getId())).thenReturn(Optional.of(notice));
    when(caseStore.update(notice)).thenReturn(notice);

    var result = service.markSent(notice.getId());

    assertThat(result.getStatus()).isEqualTo(DunningNoticeStatus.SENT);
    assertThat(result.getSentAt()).isEqualTo(CLOCK.instant());
  }

  @Test
  void markSent_rejectsAlreadySentNotice() {
    notice.markSent(CLOCK.instant());
    when(caseStore.findNotice(notice.getId())).thenReturn(Optional.of(notice));

    assertThatThrownBy(() -> service.markSent(notice.getId()))
        .isInstanceOf(InvalidTransitionException.class);
    verify(caseStore, never()).update(any());
  }

  @Test
  void markPaid_repeatedCallDoesNotWrite() {
    notice.markPaid(CLOCK.instant());
    when(caseStore.findNotice(notice.getId())).thenReturn(Optional.of(notice));

    var result = service.markPaid(notice.getId());

    assertThat(result.getStatus()).isEqualTo(DunningNoticeStatus.PAID);
    verify(caseStore, never()).update(any());
  }

  @Test
  void markCancelled_fromSent() {
    notice.markSent(CLOCK.instant());
    when(caseStore.findNotice(notice.getId())).thenReturn(Optional.of(notice));
    when(caseStore.update(notice)).thenReturn(notice);

    var result = service.markCancelled(notice.getId());

    assertThat(result.getStatus()).isEqualTo(DunningNoticeStatus.CANCELLED);
    assertThat(result.getResolvedAt()).isEqualTo(CLOCK.instant());
  }

  @Test
  void markCancelled_rejectsPaidNotice() {
    notice.markPaid(CLOCK.instant());
    when(caseStore.findNotice(notice.getId())).thenReturn(Optional.of(notice));

    assertThatThrownBy(() -> service.markCancelled(notice.getId()))
        .isInstanceOf(InvalidTransitionException.class);
  }

  @Test
  void getNotice_unknownIdThrowsNotFound() {
    var unknown = UUID.randomUUID();
    when(caseStore.findNotice(unknown)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.getNotice(unknown))
        .isInstanceOf(DunningNoticeNotFoundException.class);
  }

  @Test
  void listNotices_unknownInvoiceThrowsNotFound() {
    when(invoiceQueryPort.get("INV-X")).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.listNotices("INV-X"))
        .isInstanceOf(InvoiceNotFoundException.class);
  }

  @Test
  void listNotices_invoiceWithoutNoticesIsEmpty() {
    when(invoiceQueryPort.get("INV-1"))
        .thenReturn(Optional.of(DunningFixtures.overdueInvoice("INV-1", "500.00")));
    when(caseStore.load("INV-1")).thenReturn(DunningCase.of("INV-1", List.of()));

    assertThat(service.listNotices("INV-1")).isEmpty();
  }
}
