package io.b2mash.b2b.dunning.invoice;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface InvoiceRecordRepository extends JpaRepository<InvoiceRecord, String> {

  @Query(
      """
      SELECT i FROM InvoiceRecord i
      WHERE i.paymentStatus IN :statuses AND i.dueDate < :asOf
      ORDER BY i.dueDate ASC, i.invoiceId ASC
      """)
  List<InvoiceRecord> findOpenDueBefore(
      @Param("statuses") Collection<PaymentStatus> statuses, @Param("asOf") LocalDate asOf);
}
