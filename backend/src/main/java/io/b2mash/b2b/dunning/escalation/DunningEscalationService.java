package io.b2mash.b2b.dunning.escalation;

import io.b2mash.b2b.dunning.event.DunningNoticeCreatedEvent;
import io.b2mash.b2b.dunning.exception.ConcurrentEscalationException;
import io.b2mash.b2b.dunning.exception.InvoiceAlreadySettledException;
import io.b2mash.b2b.dunning.exception.InvoiceNotFoundException;
import io.b2mash.b2b.dunning.exception.InvoiceNotOverdueException;
import io.b2mash.b2b.dunning.exception.PersistenceTimeoutException;
import io.b2mash.b2b.dunning.exception.SourceUnavailableException;
import io.b2mash.b2b.dunning.invoice.InvoiceQueryPort;
import io.b2mash.b2b.dunning.notice.DunningCaseStore;
import io.b2mash.b2b.dunning.notice.DunningNotice;
import io.b2mash.b2b.dunning.policy.EscalationPolicy;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Issues the next dunning notice for an overdue invoice. Each call advances exactly one level,
 * regardless of how long the invoice has been overdue; the final level is never exceeded.
 *
 * <p>The invoice read, the level check and the notice insert run in one transaction bounded by
 * {@code dunning.escalation.transaction-timeout}. Racing escalations of the same invoice are
 * serialized by {@link DunningCaseStore#append}: one commits, the others get {@link
 * ConcurrentEscalationException} or, with {@link ConflictStrategy#RETURN_EXISTING}, the winner's
 * notice. The engine never retries by itself.
 *
 * <p>Nothing is delivered here. A {@link DunningNoticeCreatedEvent} is published for delivery
 * collaborators, which see it only after commit.
 */
@Service
public class DunningEscalationService {

  private static final Logger log = LoggerFactory.getLogger(DunningEscalationService.class);

  private final InvoiceQueryPort invoiceQueryPort;
  private final DunningCaseStore caseStore;
  private final EscalationPolicy escalationPolicy;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;
  private final TransactionTemplate escalationTransaction;
  private final TransactionTemplate readTransaction;

  public DunningEscalationService(
      InvoiceQueryPort invoiceQueryPort,
      DunningCaseStore caseStore,
      EscalationPolicy escalationPolicy,
      ApplicationEventPublisher eventPublisher,
      Clock clock,
      PlatformTransactionManager transactionManager,
      DunningEscalationProperties properties) {
    this.invoiceQueryPort = invoiceQueryPort;
    this.caseStore = caseStore;
    this.escalationPolicy = escalationPolicy;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
    this.escalationTransaction = new TransactionTemplate(transactionManager);
    this.escalationTransaction.setTimeout(properties.transactionTimeoutSeconds());
    this.readTransaction = new TransactionTemplate(transactionManager);
    this.readTransaction.setReadOnly(true);
  }

  /** Advances the invoice one level, failing on a concurrent escalation. */
  public DunningNotice escalate(String invoiceId) {
    return escalate(EscalationRequest.advance(invoiceId));
  }

  /**
   * Issues the next notice for {@code request.invoiceId()}.
   *
   * @return the notice created by this call, or the concurrent winner's notice under {@link
   *     ConflictStrategy#RETURN_EXISTING}
   * @throws InvoiceNotFoundException if the invoice does not exist
   * @throws InvoiceAlreadySettledException if the invoice is paid or cancelled
   * @throws InvoiceNotOverdueException if the invoice is not yet past its due date
   * @throws io.b2mash.b2b.dunning.exception.MaxLevelReachedException if the final level was issued
   * @throws ConcurrentEscalationException if another escalation changed the case first
   * @throws PersistenceTimeoutException if the transaction deadline expired (rolled back)
   * @throws SourceUnavailableException if invoices or the notice store cannot be reached
   */
  public DunningNotice escalate(EscalationRequest request) {
    try {
      return escalationTransaction.execute(tx -> escalateInTransaction(request));
    } catch (ConcurrentEscalationException e) {
      if (request.onConflict() == ConflictStrategy.RETURN_EXISTING) {
        Optional<DunningNotice> winner = findWinner(request.invoiceId(), e.getAttemptedLevel());
        if (winner.isPresent()) {
          log.info(
              "Escalation of invoice {} lost the race for level {}, returning notice {}",
              request.invoiceId(),
              e.getAttemptedLevel(),
              winner.get().getNoticeNumber());
          return winner.get();
        }
      }
      throw e;
    } catch (TransactionTimedOutException | QueryTimeoutException e) {
      log.warn("Escalation of invoice {} timed out and was rolled back", request.invoiceId());
      throw new PersistenceTimeoutException(request.invoiceId(), e);
    } catch (CannotCreateTransactionException e) {
      throw new SourceUnavailableException("Dunning store is not reachable.", e);
    } catch (TransientDataAccessException
        | DataAccessResourceFailureException
        | RecoverableDataAccessException e) {
      throw storeFailure(request.invoiceId(), e);
    }
  }

  private DunningNotice escalateInTransaction(EscalationRequest request) {
    String invoiceId = request.invoiceId();
    var invoice =
        invoiceQueryPort.get(invoiceId).orElseThrow(() -> new InvoiceNotFoundException(invoiceId));

    if (invoice.paymentStatus().isSettled()) {
      throw new InvoiceAlreadySettledException(invoiceId, invoice.paymentStatus().name());
    }
    LocalDate today = LocalDate.now(clock);
    if (!invoice.isOverdueOn(today)) {
      throw new InvoiceNotOverdueException(invoiceId, invoice.dueDate());
    }

    var dunningCase = caseStore.load(invoiceId);
    Integer expected = request.expectedCurrentLevel();
    if (expected != null && expected != dunningCase.currentLevel()) {
      log.warn(
          "Escalation of invoice {} expected level {}, found {}",
          invoiceId,
          expected,
          dunningCase.currentLevel());
      throw new ConcurrentEscalationException(invoiceId, expected + 1);
    }

    var nextLevel = dunningCase.nextLevel();
    var terms = escalationPolicy.termsFor(nextLevel);
    var notice = DunningNotice.issue(invoice, terms, Instant.now(clock), clock.getZone());
    var saved = caseStore.append(dunningCase, notice);

    eventPublisher.publishEvent(
        new DunningNoticeCreatedEvent(
            saved.getId(),
            saved.getNoticeNumber(),
            invoiceId,
            nextLevel.number(),
            saved.getCreatedAt()));

    log.info(
        "Dunning notice {} (level {}, {}) created for invoice {}: fee={}, interest={}, totalDue={}",
        saved.getNoticeNumber(),
        nextLevel.number(),
        terms.label(),
        invoiceId,
        saved.getFee(),
        saved.getInterest(),
        saved.getTotalDue());
    return saved;
  }

  private Optional<DunningNotice> findWinner(String invoiceId, int level) {
    try {
      var winner = readTransaction.execute(tx -> caseStore.load(invoiceId).noticeAt(level));
      return winner != null ? winner : Optional.empty();
    } catch (CannotCreateTransactionException
        | TransientDataAccessException
        | DataAccessResourceFailureException
        | RecoverableDataAccessException e) {
      throw storeFailure(invoiceId, e);
    }
  }

  private static SourceUnavailableException storeFailure(String invoiceId, RuntimeException e) {
    log.warn("Escalation of invoice {} failed on the data store: {}", invoiceId, e.getMessage());
    return new SourceUnavailableException(
        "Data store failed while escalating invoice " + invoiceId + ".", e);
  }
}
