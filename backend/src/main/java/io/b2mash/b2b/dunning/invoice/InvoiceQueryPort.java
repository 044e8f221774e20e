package io.b2mash.b2b.dunning.invoice;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Read-only access to invoices owned by the invoicing subsystem. Implementations report an
 * unreachable source as {@link io.b2mash.b2b.dunning.exception.SourceUnavailableException}.
 */
public interface InvoiceQueryPort {

  Optional<InvoiceSnapshot> get(String invoiceId);

  /** Open invoices (unpaid, partial, overdue) whose due date lies before {@code asOf}. */
  List<InvoiceSnapshot> listOverdue(LocalDate asOf);
}
