package io.b2mash.b2b.dunning.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Published inside the escalation transaction once a notice has been appended. Carries ids only,
 * no entity references, so listeners running after commit never touch a closed persistence context.
 */
public record DunningNoticeCreatedEvent(
    UUID noticeId, String noticeNumber, String invoiceId, int level, Instant occurredAt) {}
