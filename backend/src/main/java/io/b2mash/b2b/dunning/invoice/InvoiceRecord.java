package io.b2mash.b2b.dunning.invoice;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDate;
import org.hibernate.annotations.Immutable;

/**
 * JPA mapping of the invoicing subsystem's {@code invoices} table. Mapped immutable: the dunning
 * engine never writes invoices.
 */
@Entity
@Immutable
@Table(name = "invoices")
public class InvoiceRecord {

  @Id
  @Column(name = "invoice_id", length = 64)
  private String invoiceId;

  @Column(name = "invoice_number", length = 100)
  private String invoiceNumber;

  @Column(name = "buyer_name", length = 255)
  private String buyerName;

  @Column(name = "buyer_address", columnDefinition = "TEXT")
  private String buyerAddress;

  @Column(name = "buyer_endpoint_id", length = 200)
  private String buyerEndpointId;

  @Column(name = "buyer_endpoint_scheme", length = 10)
  private String buyerEndpointScheme;

  @Column(name = "gross_amount")
  private BigDecimal grossAmount;

  @Column(name = "currency", nullable = false, length = 3)
  private String currency;

  @Column(name = "due_date")
  private LocalDate dueDate;

  @Enumerated(EnumType.STRING)
  @Column(name = "payment_status", nullable = false, length = 20)
  private PaymentStatus paymentStatus;

  protected InvoiceRecord() {}

  public InvoiceSnapshot toSnapshot() {
    return new InvoiceSnapshot(
        invoiceId,
        invoiceNumber,
        buyerName,
        buyerAddress,
        buyerEndpointId,
        buyerEndpointScheme,
        grossAmount,
        currency,
        dueDate,
        paymentStatus);
  }
}
