package io.b2mash.tender.offer;

import java.util.Objects;

/** Composite identity of an offer: at most one offer per provider per tender. */
public record OfferKey(long tenderId, String provider) {

  public OfferKey {
    Objects.requireNonNull(provider, "provider must not be null");
  }
}
