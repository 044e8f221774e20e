package io.b2mash.b2b.dunning.exception;

import java.time.LocalDate;
import org.springframework.http.HttpStatus;

public class InvoiceNotOverdueException extends DunningException {

  public InvoiceNotOverdueException(String invoiceId, LocalDate dueDate) {
    super(
        HttpStatus.BAD_REQUEST,
        DunningErrorCode.INVOICE_NOT_OVERDUE,
        "Invoice not overdue",
        "Invoice " + invoiceId + " is due on " + dueDate + " and is not overdue yet.");
  }
}
