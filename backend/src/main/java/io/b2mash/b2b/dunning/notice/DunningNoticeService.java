package io.b2mash.b2b.dunning.notice;

import io.b2mash.b2b.dunning.exception.DunningNoticeNotFoundException;
import io.b2mash.b2b.dunning.exception.InvoiceNotFoundException;
import io.b2mash.b2b.dunning.invoice.InvoiceQueryPort;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Reads notices and drives their status transitions. Every command returns the notice as stored
 * after the command, so callers never need a separate re-read. Transitions never touch the case
 * level.
 */
@Service
public class DunningNoticeService {

  private static final Logger log = LoggerFactory.getLogger(DunningNoticeService.class);

  private final DunningCaseStore caseStore;
  private final InvoiceQueryPort invoiceQueryPort;
  private final Clock clock;

  public DunningNoticeService(
      DunningCaseStore caseStore, InvoiceQueryPort invoiceQueryPort, Clock clock) {
    this.caseStore = caseStore;
    this.invoiceQueryPort = invoiceQueryPort;
    this.clock = clock;
  }

  /**
   * Lists the notices of an invoice ordered by level.
   *
   * @throws InvoiceNotFoundException if the invoice does not exist
   */
  @Transactional(readOnly = true)
  public List<DunningNotice> listNotices(String invoiceId) {
    if (invoiceQueryPort.get(invoiceId).isEmpty()) {
      throw new InvoiceNotFoundException(invoiceId);
    }
    return caseStore.load(invoiceId).notices();
  }

  @Transactional(readOnly = true)
  public DunningNotice getNotice(UUID noticeId) {
    return caseStore
        .findNotice(noticeId)
        .orElseThrow(() -> new DunningNoticeNotFoundException(noticeId));
  }

  /** Confirms delivery of a CREATED notice. */
  @Transactional
  public DunningNotice markSent(UUID noticeId) {
    var notice = getNotice(noticeId);
    notice.markSent(Instant.now(clock));
    var saved = caseStore.update(notice);
    log.info("Dunning notice {} marked sent", notice.getNoticeNumber());
    return saved;
  }

  /** Marks a notice paid; repeating the call on a paid notice changes nothing. */
  @Transactional
  public DunningNotice markPaid(UUID noticeId) {
    var notice = getNotice(noticeId);
    if (!notice.markPaid(Instant.now(clock))) {
      log.debug("Dunning notice {} already paid", notice.getNoticeNumber());
      return notice;
    }
    var saved = caseStore.update(notice);
    log.info("Dunning notice {} marked paid", notice.getNoticeNumber());
    return saved;
  }

  /** Cancels a notice; repeating the call on a cancelled notice changes nothing. */
  @Transactional
  public DunningNotice markCancelled(UUID noticeId) {
    var notice = getNotice(noticeId);
    if (!notice.markCancelled(Instant.now(clock))) {
      log.debug("Dunning notice {} already cancelled", notice.getNoticeNumber());
      return notice;
    }
    var saved = caseStore.update(notice);
    log.info("Dunning notice {} cancelled", notice.getNoticeNumber());
    return saved;
  }
}
