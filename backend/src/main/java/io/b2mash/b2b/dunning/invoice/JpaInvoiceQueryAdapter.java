package io.b2mash.b2b.dunning.invoice;

import io.b2mash.b2b.dunning.exception.SourceUnavailableException;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;

/**
 * {@link InvoiceQueryPort} over the shared {@code invoices} table. Joins the caller's transaction
 * when one is active, so an escalation reads the invoice and appends the notice in one unit.
 */
@Component
public class JpaInvoiceQueryAdapter implements InvoiceQueryPort {

  private static final Logger log = LoggerFactory.getLogger(JpaInvoiceQueryAdapter.class);

  private final InvoiceRecordRepository invoiceRecordRepository;

  public JpaInvoiceQueryAdapter(InvoiceRecordRepository invoiceRecordRepository) {
    this.invoiceRecordRepository = invoiceRecordRepository;
  }

  @Override
  public Optional<InvoiceSnapshot> get(String invoiceId) {
    return query(
        "Invoice " + invoiceId + " could not be loaded.",
        () -> invoiceRecordRepository.findById(invoiceId).map(InvoiceRecord::toSnapshot));
  }

  @Override
  public List<InvoiceSnapshot> listOverdue(LocalDate asOf) {
    return query(
        "Overdue invoices could not be listed.",
        () ->
            invoiceRecordRepository.findOpenDueBefore(PaymentStatus.OPEN, asOf).stream()
                .map(InvoiceRecord::toSnapshot)
                .toList());
  }

  private <T> T query(String failureDetail, Supplier<T> call) {
    try {
      return call.get();
    } catch (TransientDataAccessException
        | RecoverableDataAccessException
        | DataAccessResourceFailureException
        | CannotCreateTransactionException e) {
      log.warn("Invoice source unavailable: {}", e.getMessage());
      throw new SourceUnavailableException(failureDetail, e);
    }
  }
}
