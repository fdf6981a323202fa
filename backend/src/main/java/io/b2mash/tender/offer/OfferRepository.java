package io.b2mash.tender.offer;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Repository;

/** Append-only offer store keyed by (tender, provider). Offers are never removed. */
@Repository
public class OfferRepository {

  private final Map<OfferKey, Offer> offers = new ConcurrentHashMap<>();

  public Optional<Offer> findById(OfferKey key) {
    return Optional.ofNullable(offers.get(key));
  }

  public boolean existsById(OfferKey key) {
    return offers.containsKey(key);
  }

  /** Stores a new offer. Throws if an offer with the same key already exists. */
  public Offer insert(Offer offer) {
    var previous = offers.putIfAbsent(offer.getKey(), offer);
    if (previous != null) {
      throw new IllegalStateException("offer " + offer.getKey() + " already stored");
    }
    return offer;
  }

  /** Looks up an offer that the participant list guarantees exists. */
  public Offer getRequired(OfferKey key) {
    var offer = offers.get(key);
    if (offer == null) {
      throw new IllegalStateException("participant without offer: " + key);
    }
    return offer;
  }
}
