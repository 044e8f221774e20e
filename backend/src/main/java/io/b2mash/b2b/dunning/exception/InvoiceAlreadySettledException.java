package io.b2mash.b2b.dunning.exception;

import org.springframework.http.HttpStatus;

public class InvoiceAlreadySettledException extends DunningException {

  public InvoiceAlreadySettledException(String invoiceId, String paymentStatus) {
    super(
        HttpStatus.BAD_REQUEST,
        DunningErrorCode.INVOICE_ALREADY_SETTLED,
        "Invoice already " + paymentStatus.toLowerCase(),
        "Invoice " + invoiceId + " is " + paymentStatus + " and cannot be escalated.");
  }
}
