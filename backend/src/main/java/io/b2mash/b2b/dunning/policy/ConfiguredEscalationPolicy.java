package io.b2mash.b2b.dunning.policy;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.EnumMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link EscalationPolicy} backed by the {@code dunning.policy.levels} table. The table is
 * validated once at startup; an incomplete table fails the context.
 */
@Component
public class ConfiguredEscalationPolicy implements EscalationPolicy {

  private static final Logger log = LoggerFactory.getLogger(ConfiguredEscalationPolicy.class);

  private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

  private final Map<DunningLevel, PolicyTerms> terms;

  public ConfiguredEscalationPolicy(DunningPolicyProperties properties) {
    this.terms = buildTable(properties);
    terms
        .values()
        .forEach(
            t ->
                log.info(
                    "Dunning policy level {} '{}': fee={}, interestRate={}",
                    t.level().number(),
                    t.label(),
                    t.fee(),
                    t.interestRate()));
  }

  @Override
  public PolicyTerms termsFor(DunningLevel level) {
    return terms.get(level);
  }

  private static Map<DunningLevel, PolicyTerms> buildTable(DunningPolicyProperties properties) {
    if (properties == null || properties.levels() == null) {
      throw new IllegalStateException("dunning.policy.levels is not configured");
    }
    var table = new EnumMap<DunningLevel, PolicyTerms>(DunningLevel.class);
    for (DunningLevel level : DunningLevel.values()) {
      var configured = properties.levels().get(level);
      if (configured == null
          || configured.label() == null
          || configured.fee() == null
          || configured.interestRatePercent() == null) {
        throw new IllegalStateException(
            "dunning.policy.levels." + level.name() + " is missing or incomplete");
      }
      table.put(
          level,
          new PolicyTerms(
              level,
              configured.label(),
              configured.fee(),
              configured.interestRatePercent().divide(HUNDRED, MathContext.DECIMAL64)));
    }
    return Map.copyOf(table);
  }
}
