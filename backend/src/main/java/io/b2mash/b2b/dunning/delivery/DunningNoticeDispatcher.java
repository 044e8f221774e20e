package io.b2mash.b2b.dunning.delivery;

import io.b2mash.b2b.dunning.event.DunningNoticeCreatedEvent;
import io.b2mash.b2b.dunning.integration.email.EmailMessage;
import io.b2mash.b2b.dunning.integration.email.EmailProvider;
import io.b2mash.b2b.dunning.invoice.InvoiceQueryPort;
import io.b2mash.b2b.dunning.notice.DunningNoticeService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Emails newly created notices to the buyer and confirms delivery through {@link
 * DunningNoticeService#markSent}. Runs after the escalation committed, so reads and the status
 * update use their own transactions; a delivery failure leaves the notice CREATED and never affects
 * the escalation.
 */
@Component
@ConditionalOnProperty(
    name = "dunning.delivery.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class DunningNoticeDispatcher {

  private static final Logger log = LoggerFactory.getLogger(DunningNoticeDispatcher.class);

  private final InvoiceQueryPort invoiceQueryPort;
  private final DunningNoticeService noticeService;
  private final DunningEmailRenderer emailRenderer;
  private final EmailProvider emailProvider;
  private final DunningDeliveryProperties properties;
  private final TransactionTemplate readTransaction;
  private final TransactionTemplate confirmTransaction;

  public DunningNoticeDispatcher(
      InvoiceQueryPort invoiceQueryPort,
      DunningNoticeService noticeService,
      DunningEmailRenderer emailRenderer,
      EmailProvider emailProvider,
      DunningDeliveryProperties properties,
      PlatformTransactionManager transactionManager) {
    this.invoiceQueryPort = invoiceQueryPort;
    this.noticeService = noticeService;
    this.emailRenderer = emailRenderer;
    this.emailProvider = emailProvider;
    this.properties = properties;
    this.readTransaction = new TransactionTemplate(transactionManager);
    this.readTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    this.readTransaction.setReadOnly(true);
    this.confirmTransaction = new TransactionTemplate(transactionManager);
    this.confirmTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onNoticeCreated(DunningNoticeCreatedEvent event) {
    try {
      deliver(event);
    } catch (Exception e) {
      log.error("Failed to deliver dunning notice {}", event.noticeNumber(), e);
    }
  }

  /**
   * @return true if the email was accepted and the notice marked sent
   */
  boolean deliver(DunningNoticeCreatedEvent event) {
    var invoice =
        readTransaction.execute(tx -> invoiceQueryPort.get(event.invoiceId()).orElse(null));
    if (invoice == null) {
      log.warn(
          "Invoice {} not found for dunning notice {}", event.invoiceId(), event.noticeNumber());
      return false;
    }

    var recipient = BuyerEmailResolver.resolve(invoice);
    if (recipient.isEmpty()) {
      log.info(
          "No buyer email found for invoice {}, dunning notice {} stays CREATED",
          event.invoiceId(),
          event.noticeNumber());
      return false;
    }

    var notice = readTransaction.execute(tx -> noticeService.getNotice(event.noticeId()));
    var rendered = emailRenderer.render(notice, invoice);
    var message =
        EmailMessage.withTracking(
            recipient.get(),
            rendered.subject(),
            rendered.htmlBody(),
            rendered.plainTextBody(),
            properties.replyTo(),
            "DUNNING_NOTICE",
            notice.getId().toString());

    var result = emailProvider.sendEmail(message);
    if (!result.success()) {
      log.warn(
          "Dunning notice {} not delivered via {}: {}",
          event.noticeNumber(),
          emailProvider.providerId(),
          result.errorMessage());
      return false;
    }

    confirmTransaction.executeWithoutResult(tx -> noticeService.markSent(event.noticeId()));
    log.info(
        "Dunning notice {} emailed to {} via {}",
        event.noticeNumber(),
        recipient.get(),
        emailProvider.providerId());
    return true;
  }
}
