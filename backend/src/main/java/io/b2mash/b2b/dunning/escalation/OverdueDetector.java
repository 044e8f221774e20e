package io.b2mash.b2b.dunning.escalation;

import io.b2mash.b2b.dunning.invoice.InvoiceQueryPort;
import io.b2mash.b2b.dunning.invoice.InvoiceSnapshot;
import io.b2mash.b2b.dunning.notice.DunningCase;
import io.b2mash.b2b.dunning.notice.DunningCaseStore;
import io.b2mash.b2b.dunning.notice.DunningNotice;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Lists invoices eligible for dunning: open (unpaid, partial, overdue) and due strictly before the
 * evaluation date. Read-only; an invoice due today is not overdue.
 */
@Service
public class OverdueDetector {

  private static final Logger log = LoggerFactory.getLogger(OverdueDetector.class);

  private static final Comparator<OverdueInvoiceView> MOST_OVERDUE_FIRST =
      Comparator.comparingLong(OverdueInvoiceView::daysOverdue)
          .reversed()
          .thenComparing(OverdueInvoiceView::invoiceId);

  private final InvoiceQueryPort invoiceQueryPort;
  private final DunningCaseStore caseStore;
  private final Clock clock;

  public OverdueDetector(
      InvoiceQueryPort invoiceQueryPort, DunningCaseStore caseStore, Clock clock) {
    this.invoiceQueryPort = invoiceQueryPort;
    this.caseStore = caseStore;
    this.clock = clock;
  }

  public List<OverdueInvoiceView> findOverdue() {
    return findOverdue(LocalDate.now(clock));
  }

  /**
   * @param asOf evaluation date
   * @return overdue invoices, most overdue first
   * @throws io.b2mash.b2b.dunning.exception.SourceUnavailableException if invoices cannot be read
   */
  public List<OverdueInvoiceView> findOverdue(LocalDate asOf) {
    var candidates =
        invoiceQueryPort.listOverdue(asOf).stream().filter(i -> i.isOverdueOn(asOf)).toList();
    var cases = caseStore.loadAll(candidates.stream().map(InvoiceSnapshot::invoiceId).toList());

    var views =
        candidates.stream()
            .map(invoice -> toView(invoice, cases.get(invoice.invoiceId()), asOf))
            .sorted(MOST_OVERDUE_FIRST)
            .toList();
    log.debug("Found {} overdue invoices as of {}", views.size(), asOf);
    return views;
  }

  private static OverdueInvoiceView toView(
      InvoiceSnapshot invoice, DunningCase dunningCase, LocalDate asOf) {
    var effectiveCase = dunningCase != null ? dunningCase : DunningCase.empty(invoice.invoiceId());
    return new OverdueInvoiceView(
        invoice.invoiceId(),
        invoice.invoiceNumber(),
        invoice.buyerName(),
        invoice.grossAmount(),
        invoice.currency(),
        invoice.dueDate(),
        invoice.daysOverdue(asOf),
        effectiveCase.currentLevel(),
        effectiveCase.latestNotice().map(DunningNotice::getCreatedAt).orElse(null));
  }
}
