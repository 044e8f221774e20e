package io.b2mash.b2b.dunning.escalation;

import io.b2mash.b2b.dunning.escalation.dto.OverdueInvoiceResponse;
import io.b2mash.b2b.dunning.notice.DunningNoticeService;
import io.b2mash.b2b.dunning.notice.dto.DunningNoticeResponse;
import io.b2mash.b2b.dunning.sweep.DunningSweepService;
import io.b2mash.b2b.dunning.sweep.dto.DunningSweepResponse;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.net.URI;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints of the dunning process: overdue listing, escalation, notice history and notice
 * status changes. Errors are rendered as problem details by the global exception handler.
 */
@RestController
@RequestMapping("/api/dunning")
public class DunningController {

  private final OverdueDetector overdueDetector;
  private final DunningEscalationService escalationService;
  private final DunningNoticeService noticeService;
  private final DunningSweepService sweepService;
  private final Clock clock;

  public DunningController(
      OverdueDetector overdueDetector,
      DunningEscalationService escalationService,
      DunningNoticeService noticeService,
      DunningSweepService sweepService,
      Clock clock) {
    this.overdueDetector = overdueDetector;
    this.escalationService = escalationService;
    this.noticeService = noticeService;
    this.sweepService = sweepService;
    this.clock = clock;
  }

  /**
   * Lists open invoices past their due date, most overdue first.
   *
   * @param asOf reference date, defaults to today
   */
  @GetMapping("/overdue")
  public ResponseEntity<List<OverdueInvoiceResponse>> listOverdue(
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate asOf) {
    var views = overdueDetector.findOverdue(asOf != null ? asOf : LocalDate.now(clock));
    return ResponseEntity.ok(views.stream().map(OverdueInvoiceResponse::from).toList());
  }

  @GetMapping("/invoices/{invoiceId}/notices")
  public ResponseEntity<List<DunningNoticeResponse>> listNotices(@PathVariable String invoiceId) {
    var notices = noticeService.listNotices(invoiceId);
    return ResponseEntity.ok(notices.stream().map(DunningNoticeResponse::from).toList());
  }

  /**
   * Issues the next notice for an invoice.
   *
   * @param expectedLevel current level the caller observed; the escalation is rejected with 409 if
   *     the stored level differs
   * @param onConflict FAIL (default) or RETURN_EXISTING to receive the notice a concurrent caller
   *     created for the same level
   * @return 201 Created with the new notice
   */
  @PostMapping("/invoices/{invoiceId}/notices")
  public ResponseEntity<DunningNoticeResponse> escalate(
      @PathVariable String invoiceId,
      @RequestParam(required = false) @Min(0) @Max(3) Integer expectedLevel,
      @RequestParam(required = false) ConflictStrategy onConflict) {
    var notice =
        escalationService.escalate(new EscalationRequest(invoiceId, expectedLevel, onConflict));
    return ResponseEntity.created(URI.create("/api/dunning/notices/" + notice.getId()))
        .body(DunningNoticeResponse.from(notice));
  }

  @GetMapping("/notices/{noticeId}")
  public ResponseEntity<DunningNoticeResponse> getNotice(@PathVariable UUID noticeId) {
    return ResponseEntity.ok(DunningNoticeResponse.from(noticeService.getNotice(noticeId)));
  }

  @PostMapping("/notices/{noticeId}/sent")
  public ResponseEntity<DunningNoticeResponse> markSent(@PathVariable UUID noticeId) {
    return ResponseEntity.ok(DunningNoticeResponse.from(noticeService.markSent(noticeId)));
  }

  @PostMapping("/notices/{noticeId}/paid")
  public ResponseEntity<DunningNoticeResponse> markPaid(@PathVariable UUID noticeId) {
    return ResponseEntity.ok(DunningNoticeResponse.from(noticeService.markPaid(noticeId)));
  }

  @PostMapping("/notices/{noticeId}/cancelled")
  public ResponseEntity<DunningNoticeResponse> markCancelled(@PathVariable UUID noticeId) {
    return ResponseEntity.ok(DunningNoticeResponse.from(noticeService.markCancelled(noticeId)));
  }

  /** Runs a dunning sweep on demand. */
  @PostMapping("/sweep")
  public ResponseEntity<DunningSweepResponse> sweep(
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate asOf) {
    var result = sweepService.sweep(asOf != null ? asOf : LocalDate.now(clock));
    return ResponseEntity.ok(DunningSweepResponse.from(result));
  }
}
