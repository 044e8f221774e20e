package io.b2mash.b2b.dunning.exception;

import org.springframework.http.HttpStatus;

public class InvoiceNotFoundException extends DunningException {

  public InvoiceNotFoundException(String invoiceId) {
    super(
        HttpStatus.NOT_FOUND,
        DunningErrorCode.INVOICE_NOT_FOUND,
        "Invoice not found",
        "No invoice found with id " + invoiceId);
  }
}
