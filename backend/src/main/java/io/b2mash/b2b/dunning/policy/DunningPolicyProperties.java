package io.b2mash.b2b.dunning.policy;

import java.math.BigDecimal;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Fee/interest table bound from {@code dunning.policy}.
 *
 * @param levels terms per level; every level of {@link DunningLevel} must be present
 */
@ConfigurationProperties(prefix = "dunning.policy")
public record DunningPolicyProperties(Map<DunningLevel, LevelTerms> levels) {

  /**
   * @param label notice title
   * @param fee flat fee in the invoice currency
   * @param interestRatePercent interest in percent of the gross amount
   */
  public record LevelTerms(String label, BigDecimal fee, BigDecimal interestRatePercent) {}
}
