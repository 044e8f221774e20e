package io.b2mash.b2b.dunning.delivery;

import io.b2mash.b2b.dunning.invoice.InvoiceSnapshot;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Finds the buyer's email address on an invoice. The electronic address (BT-49) wins when its
 * scheme is email ("EM") or unset; otherwise the first address-like token in the postal address.
 */
public final class BuyerEmailResolver {

  private static final Set<String> EMAIL_SCHEMES = Set.of("EM", "em");
  private static final Pattern EMAIL = Pattern.compile("[\\w.+-]+@[\\w-]+\\.[\\w.-]+");

  private BuyerEmailResolver() {}

  public static Optional<String> resolve(InvoiceSnapshot invoice) {
    String endpoint = invoice.buyerEndpointId();
    String scheme = invoice.buyerEndpointScheme();
    if (endpoint != null && (scheme == null || EMAIL_SCHEMES.contains(scheme))) {
      String trimmed = endpoint.strip();
      if (trimmed.contains("@")) {
        return Optional.of(trimmed);
      }
    }
    if (invoice.buyerAddress() != null) {
      var matcher = EMAIL.matcher(invoice.buyerAddress());
      if (matcher.find()) {
        return Optional.of(matcher.group());
      }
    }
    return Optional.empty();
  }
}
