package io.b2mash.b2b.dunning.notice;

import io.b2mash.b2b.dunning.exception.MaxLevelReachedException;
import io.b2mash.b2b.dunning.policy.DunningLevel;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Escalation state of one invoice, reconstructed from its notice history. The history is the
 * source of truth: {@link #currentLevel()} is the highest level issued, 0 before the first notice.
 */
public final class DunningCase {

  private final String invoiceId;
  private final List<DunningNotice> notices;

  private DunningCase(String invoiceId, List<DunningNotice> notices) {
    this.invoiceId = invoiceId;
    this.notices = notices;
  }

  /** A case with no notices yet. Nothing is stored until the first escalation. */
  public static DunningCase empty(String invoiceId) {
    Objects.requireNonNull(invoiceId, "invoiceId must not be null");
    return new DunningCase(invoiceId, List.of());
  }

  public static DunningCase of(String invoiceId, Collection<DunningNotice> notices) {
    Objects.requireNonNull(invoiceId, "invoiceId must not be null");
    for (DunningNotice notice : notices) {
      if (!invoiceId.equals(notice.getInvoiceId())) {
        throw new IllegalArgumentException(
            "Notice " + notice.getId() + " belongs to invoice " + notice.getInvoiceId());
      }
    }
    var ordered =
        notices.stream().sorted(Comparator.comparingInt(n -> n.getLevel().number())).toList();
    return new DunningCase(invoiceId, ordered);
  }

  public String invoiceId() {
    return invoiceId;
  }

  /** Notices ordered by level. */
  public List<DunningNotice> notices() {
    return notices;
  }

  public int currentLevel() {
    return latestNotice().map(n -> n.getLevel().number()).orElse(DunningLevel.NONE);
  }

  public boolean isAtFinalLevel() {
    return currentLevel() == DunningLevel.FINAL_DUNNING_NOTICE.number();
  }

  public Optional<DunningNotice> latestNotice() {
    return notices.isEmpty() ? Optional.empty() : Optional.of(notices.get(notices.size() - 1));
  }

  public Optional<DunningNotice> noticeAt(int level) {
    return notices.stream().filter(n -> n.getLevel().number() == level).findFirst();
  }

  /**
   * The level the next escalation would issue.
   *
   * @throws MaxLevelReachedException once the final level has been issued
   */
  public DunningLevel nextLevel() {
    return DunningLevel.after(currentLevel())
        .orElseThrow(() -> new MaxLevelReachedException(invoiceId, currentLevel()));
  }
}
