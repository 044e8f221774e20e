package io.b2mash.b2b.dunning.notice;

import io.b2mash.b2b.dunning.exception.InvalidTransitionException;
import io.b2mash.b2b.dunning.invoice.InvoiceSnapshot;
import io.b2mash.b2b.dunning.policy.DunningLevel;
import io.b2mash.b2b.dunning.policy.PolicyTerms;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Currency;
import java.util.Objects;
import java.util.UUID;

/**
 * One dunning notice (Mahnung) issued for an invoice at a given escalation level.
 *
 * <p>Amounts are a snapshot taken at creation: {@code totalDue = grossAmount + fee + interest} is
 * never recomputed. Only the status moves afterwards: CREATED → SENT → PAID | CANCELLED, with
 * CREATED → PAID | CANCELLED also allowed. Terminal notices are immutable.
 */
@Entity
@Table(name = "dunning_notices")
public class DunningNotice {

  private static final DateTimeFormatter NUMBER_DATE = DateTimeFormatter.BASIC_ISO_DATE;
  private static final int DEFAULT_CURRENCY_SCALE = 2;

  @Id private UUID id;

  @Column(name = "notice_number", nullable = false, updatable = false, length = 30)
  private String noticeNumber;

  @Column(name = "invoice_id", nullable = false, updatable = false, length = 64)
  private String invoiceId;

  @Convert(converter = DunningLevelConverter.class)
  @Column(name = "level", nullable = false, updatable = false)
  private DunningLevel level;

  @Column(name = "label", nullable = false, updatable = false, length = 100)
  private String label;

  @Column(name = "currency", nullable = false, updatable = false, length = 3)
  private String currency;

  @Column(name = "gross_amount", nullable = false, updatable = false)
  private BigDecimal grossAmount;

  @Column(name = "fee", nullable = false, updatable = false)
  private BigDecimal fee;

  @Column(name = "interest", nullable = false, updatable = false)
  private BigDecimal interest;

  @Column(name = "total_due", nullable = false, updatable = false)
  private BigDecimal totalDue;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private DunningNoticeStatus status;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "sent_at")
  private Instant sentAt;

  @Column(name = "resolved_at")
  private Instant resolvedAt;

  @Version private Long version;

  /** JPA-required no-arg constructor. */
  protected DunningNotice() {}

  private DunningNotice(
      String invoiceId,
      DunningLevel level,
      String label,
      String currency,
      BigDecimal grossAmount,
      BigDecimal fee,
      BigDecimal interest,
      Instant createdAt,
      ZoneId zone) {
    this.id = UUID.randomUUID();
    this.invoiceId = Objects.requireNonNull(invoiceId, "invoiceId must not be null");
    this.level = Objects.requireNonNull(level, "level must not be null");
    this.label = label;
    this.currency = currency;
    this.grossAmount = grossAmount;
    this.fee = fee;
    this.interest = interest;
    this.totalDue = grossAmount.add(fee).add(interest);
    this.status = DunningNoticeStatus.CREATED;
    this.createdAt = Objects.requireNonNull(createdAt, "createdAt must not be null");
    this.noticeNumber = formatNoticeNumber(LocalDate.ofInstant(createdAt, zone), id);
  }

  /**
   * Issues a new notice for {@code invoice} at the level described by {@code terms}. Fee and
   * interest are rounded half-up to the minor unit of the invoice currency.
   *
   * @param invoice the overdue invoice
   * @param terms policy terms of the level being issued
   * @param createdAt creation timestamp
   * @param zone business zone used for the date part of the notice number
   */
  public static DunningNotice issue(
      InvoiceSnapshot invoice, PolicyTerms terms, Instant createdAt, ZoneId zone) {
    int scale = currencyScale(invoice.currency());
    BigDecimal gross = invoice.grossAmount().setScale(scale, RoundingMode.HALF_UP);
    return new DunningNotice(
        invoice.invoiceId(),
        terms.level(),
        terms.label(),
        invoice.currency(),
        gross,
        terms.feeAtScale(scale),
        terms.interestOn(gross, scale),
        createdAt,
        zone);
  }

  /**
   * Records confirmed delivery. Legal only from CREATED.
   *
   * @throws InvalidTransitionException from any other status
   */
  public void markSent(Instant sentAt) {
    if (status != DunningNoticeStatus.CREATED) {
      throw new InvalidTransitionException(id, status.name(), DunningNoticeStatus.SENT.name());
    }
    this.status = DunningNoticeStatus.SENT;
    this.sentAt = sentAt;
  }

  /**
   * Marks the notice paid. Legal from CREATED or SENT; a second call is a no-op.
   *
   * @return true if the status changed
   * @throws InvalidTransitionException if the notice was cancelled
   */
  public boolean markPaid(Instant resolvedAt) {
    return resolve(DunningNoticeStatus.PAID, resolvedAt);
  }

  /**
   * Cancels the notice. Legal from CREATED or SENT; a second call is a no-op.
   *
   * @return true if the status changed
   * @throws InvalidTransitionException if the notice was paid
   */
  public boolean markCancelled(Instant resolvedAt) {
    return resolve(DunningNoticeStatus.CANCELLED, resolvedAt);
  }

  private boolean resolve(DunningNoticeStatus target, Instant resolvedAt) {
    if (status == target) {
      return false;
    }
    if (!status.canTransitionTo(target)) {
      throw new InvalidTransitionException(id, status.name(), target.name());
    }
    this.status = target;
    this.resolvedAt = resolvedAt;
    return true;
  }

  static int currencyScale(String currencyCode) {
    if (currencyCode == null) {
      return DEFAULT_CURRENCY_SCALE;
    }
    try {
      int digits = Currency.getInstance(currencyCode).getDefaultFractionDigits();
      return digits < 0 ? DEFAULT_CURRENCY_SCALE : digits;
    } catch (IllegalArgumentException e) {
      return DEFAULT_CURRENCY_SCALE;
    }
  }

  private static String formatNoticeNumber(LocalDate date, UUID id) {
    return "MAH-" + NUMBER_DATE.format(date) + "-" + id.toString().replace("-", "").substring(0, 8);
  }

  public UUID getId() {
    return id;
  }

  public String getNoticeNumber() {
    return noticeNumber;
  }

  public String getInvoiceId() {
    return invoiceId;
  }

  public DunningLevel getLevel() {
    return level;
  }

  public String getLabel() {
    return label;
  }

  public String getCurrency() {
    return currency;
  }

  public BigDecimal getGrossAmount() {
    return grossAmount;
  }

  public BigDecimal getFee() {
    return fee;
  }

  public BigDecimal getInterest() {
    return interest;
  }

  public BigDecimal getTotalDue() {
    return totalDue;
  }

  public DunningNoticeStatus getStatus() {
    return status;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getSentAt() {
    return sentAt;
  }

  public Instant getResolvedAt() {
    return resolvedAt;
  }
}
