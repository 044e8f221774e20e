package io.b2mash.b2b.dunning.delivery;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param enabled whether created notices are emailed to the buyer
 * @param senderAddress From address of dunning emails
 * @param replyTo Reply-To address, may be null
 */
@ConfigurationProperties(prefix = "dunning.delivery")
public record DunningDeliveryProperties(boolean enabled, String senderAddress, String replyTo) {}
