package io.b2mash.b2b.dunning.policy;

/**
 * Maps an escalation level to its fee and interest. Implementations are pure lookups so a
 * jurisdiction can be swapped without touching the engine.
 */
public interface EscalationPolicy {

  PolicyTerms termsFor(DunningLevel level);
}
