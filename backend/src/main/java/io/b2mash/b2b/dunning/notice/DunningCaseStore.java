package io.b2mash.b2b.dunning.notice;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence port for dunning cases. The only writer of notices; guarantees at most one notice per
 * (invoice, level).
 */
public interface DunningCaseStore {

  /** Loads the case of {@code invoiceId}; an invoice without notices yields an empty case. */
  DunningCase load(String invoiceId);

  /** Loads cases for several invoices at once. Every requested id is present in the result. */
  Map<String, DunningCase> loadAll(Collection<String> invoiceIds);

  /**
   * Appends {@code notice} to the case, provided the stored level still equals {@code
   * expected.currentLevel()}. Compare-and-swap: either the notice is committed with the caller's
   * transaction or nothing is written.
   *
   * @throws io.b2mash.b2b.dunning.exception.ConcurrentEscalationException if another escalation
   *     changed the case since {@code expected} was read
   */
  DunningNotice append(DunningCase expected, DunningNotice notice);

  Optional<DunningNotice> findNotice(UUID noticeId);

  /** Persists a status transition of an existing notice. */
  DunningNotice update(DunningNotice notice);
}
