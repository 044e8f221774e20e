package io.b2mash.b2b.dunning.notice;

import io.b2mash.b2b.dunning.exception.ConcurrentEscalationException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

/**
 * {@link DunningCaseStore} over the {@code dunning_notices} table. The unique constraint on
 * (invoice_id, level) is the final arbiter between racing escalations; the level re-check before
 * the insert only fails fast.
 */
@Component
public class JpaDunningCaseStore implements DunningCaseStore {

  private static final Logger log = LoggerFactory.getLogger(JpaDunningCaseStore.class);

  static final String NOTICE_NUMBER_CONSTRAINT = "uq_dunning_notices_notice_number";

  /** Invoice ids per IN query; PostgreSQL caps a statement at 32767 bind parameters. */
  static final int LOAD_BATCH_SIZE = 1000;

  private final DunningNoticeRepository noticeRepository;

  public JpaDunningCaseStore(DunningNoticeRepository noticeRepository) {
    this.noticeRepository = noticeRepository;
  }

  @Override
  public DunningCase load(String invoiceId) {
    return DunningCase.of(invoiceId, noticeRepository.findByInvoiceIdOrderByLevelAsc(invoiceId));
  }

  @Override
  public Map<String, DunningCase> loadAll(Collection<String> invoiceIds) {
    if (invoiceIds.isEmpty()) {
      return Map.of();
    }
    List<String> ids = List.copyOf(invoiceIds);
    Map<String, List<DunningNotice>> byInvoice = new HashMap<>();
    for (int from = 0; from < ids.size(); from += LOAD_BATCH_SIZE) {
      List<String> batch = ids.subList(from, Math.min(from + LOAD_BATCH_SIZE, ids.size()));
      for (DunningNotice notice : noticeRepository.findByInvoiceIdIn(batch)) {
        byInvoice.computeIfAbsent(notice.getInvoiceId(), k -> new ArrayList<>()).add(notice);
      }
    }
    var cases = new LinkedHashMap<String, DunningCase>();
    for (String invoiceId : invoiceIds) {
      cases.put(invoiceId, DunningCase.of(invoiceId, byInvoice.getOrDefault(invoiceId, List.of())));
    }
    return cases;
  }

  @Override
  public DunningNotice append(DunningCase expected, DunningNotice notice) {
    String invoiceId = expected.invoiceId();
    int attemptedLevel = notice.getLevel().number();
    if (!invoiceId.equals(notice.getInvoiceId()) || attemptedLevel != expected.currentLevel() + 1) {
      throw new IllegalArgumentException(
          "Notice level " + attemptedLevel + " does not follow level " + expected.currentLevel());
    }

    int storedLevel = load(invoiceId).currentLevel();
    if (storedLevel != expected.currentLevel()) {
      log.warn(
          "Escalation conflict for invoice {}: expected level {}, found {}",
          invoiceId,
          expected.currentLevel(),
          storedLevel);
      throw new ConcurrentEscalationException(invoiceId, attemptedLevel);
    }

    try {
      return noticeRepository.saveAndFlush(notice);
    } catch (DataIntegrityViolationException e) {
      if (violates(e, NOTICE_NUMBER_CONSTRAINT)) {
        throw e;
      }
      log.warn(
          "Escalation conflict for invoice {}: level {} was inserted concurrently",
          invoiceId,
          attemptedLevel);
      throw new ConcurrentEscalationException(invoiceId, attemptedLevel, e);
    }
  }

  @Override
  public Optional<DunningNotice> findNotice(UUID noticeId) {
    return noticeRepository.findById(noticeId);
  }

  @Override
  public DunningNotice update(DunningNotice notice) {
    return noticeRepository.saveAndFlush(notice);
  }

  private static boolean violates(DataIntegrityViolationException e, String constraintName) {
    String message = e.getMostSpecificCause().getMessage();
    return message != null && message.contains(constraintName);
  }
}
