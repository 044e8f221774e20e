package io.b2mash.b2b.dunning.notice;

import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface DunningNoticeRepository extends JpaRepository<DunningNotice, UUID> {

  List<DunningNotice> findByInvoiceIdOrderByLevelAsc(String invoiceId);

  List<DunningNotice> findByInvoiceIdIn(Collection<String> invoiceIds);
}
