package io.b2mash.tender.offer;

import io.b2mash.tender.accesscontrol.AccessPolicy;
import io.b2mash.tender.accesscontrol.TenderOperation;
import io.b2mash.tender.audit.AuditEventBuilder;
import io.b2mash.tender.audit.AuditService;
import io.b2mash.tender.exception.DeadlineViolationException;
import io.b2mash.tender.exception.InvalidInputException;
import io.b2mash.tender.exception.InvalidStateException;
import io.b2mash.tender.exception.ResourceConflictException;
import io.b2mash.tender.exception.ResourceNotFoundException;
import io.b2mash.tender.security.CallerIdentities;
import io.b2mash.tender.tender.Tender;
import io.b2mash.tender.tender.TenderLocks;
import io.b2mash.tender.tender.TenderRepository;
import io.b2mash.tender.tender.TenderStatus;
import io.b2mash.tender.winner.ScoreCalculator;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Accepts sealed offers while a tender is open and exposes them for evaluation and ranking. */
@Service
public class OfferService {

  private static final Logger log = LoggerFactory.getLogger(OfferService.class);

  private final TenderRepository tenderRepository;
  private final OfferRepository offerRepository;
  private final TenderLocks tenderLocks;
  private final AccessPolicy accessPolicy;
  private final AuditService auditService;
  private final Clock clock;

  public OfferService(
      TenderRepository tenderRepository,
      OfferRepository offerRepository,
      TenderLocks tenderLocks,
      AccessPolicy accessPolicy,
      AuditService auditService,
      Clock clock) {
    this.tenderRepository = tenderRepository;
    this.offerRepository = offerRepository;
    this.tenderLocks = tenderLocks;
    this.accessPolicy = accessPolicy;
    this.auditService = auditService;
    this.clock = clock;
  }

  /**
   * Stores the caller's offer and appends the caller to the tender's participants. Both writes
   * happen under the tender's write lock after every check has passed.
   */
  public OfferSnapshot submitOffer(
      String caller, long tenderId, long price, String documentationReference) {
    accessPolicy.authorize(caller, TenderOperation.SUBMIT_OFFER);
    var tender = findTender(tenderId);

    var snapshot =
        tenderLocks.write(
            tenderId,
            () -> {
              Instant now = clock.instant();
              if (!tender.isAcceptingOffers(now)) {
                if (tender.getStatus() != TenderStatus.OPEN) {
                  throw new InvalidStateException(
                      "Tender not open",
                      "Tender " + tenderId + " is " + tender.getStatus() + " and accepts no offers");
                }
                throw new DeadlineViolationException(
                    "Offer period of tender " + tenderId + " has ended", tender.getDeadline());
              }
              validateOffer(tender, price, documentationReference);
              var key = new OfferKey(tenderId, caller);
              if (offerRepository.existsById(key)) {
                throw new ResourceConflictException(
                    "Offer already submitted",
                    "Provider " + caller + " already submitted an offer on tender " + tenderId);
              }

              var offer =
                  offerRepository.insert(
                      new Offer(tenderId, caller, price, documentationReference.trim(), now));
              tender.addParticipant(caller);
              auditService.log(
                  AuditEventBuilder.builder()
                      .eventType("offer.submitted")
                      .entityType("offer")
                      .entityId(tenderId + "/" + caller)
                      .actorId(caller)
                      .details(
                          Map.of(
                              "tender_id", tenderId,
                              "price", price,
                              "documentation_reference", offer.getDocumentationReference()))
                      .build());
              return OfferSnapshot.of(offer);
            });

    log.info("Provider {} submitted offer on tender {} (price={})", caller, tenderId, price);
    return snapshot;
  }

  public OfferSnapshot getOffer(long tenderId, String providerIdentity) {
    String provider = CallerIdentities.require(providerIdentity, "provider");
    findTender(tenderId);
    return tenderLocks.read(
        tenderId,
        () ->
            offerRepository
                .findById(new OfferKey(tenderId, provider))
                .map(OfferSnapshot::of)
                .orElseThrow(
                    () ->
                        ResourceNotFoundException.withDetail(
                            "Offer not found",
                            "No offer from " + provider + " on tender " + tenderId)));
  }

  /**
   * All offers of a tender in participant order. Combined scores use the tender's weights and are 0
   * for offers not yet evaluated.
   */
  public TenderOffers getOffers(long tenderId) {
    var tender = findTender(tenderId);
    return tenderLocks.read(
        tenderId,
        () -> {
          var participants = tender.getParticipants();
          if (participants.isEmpty()) {
            return TenderOffers.empty(tenderId);
          }
          var prices = new ArrayList<Long>(participants.size());
          var qualityScores = new ArrayList<Integer>(participants.size());
          var combinedScores = new ArrayList<Integer>(participants.size());
          for (String provider : participants) {
            var offer = offerRepository.getRequired(new OfferKey(tenderId, provider));
            prices.add(offer.getPrice());
            qualityScores.add(offer.getQualityScore());
            combinedScores.add(
                offer.isEvaluated()
                    ? ScoreCalculator.combinedScore(
                        tender.getMaxPrice(),
                        offer.getPrice(),
                        offer.getQualityScore(),
                        tender.getWeightPrice(),
                        tender.getWeightQuality())
                    : 0);
          }
          return new TenderOffers(tenderId, participants, prices, qualityScores, combinedScores);
        });
  }

  public List<String> getParticipants(long tenderId) {
    var tender = findTender(tenderId);
    return tenderLocks.read(tenderId, tender::getParticipants);
  }

  private Tender findTender(long tenderId) {
    return tenderRepository
        .findById(tenderId)
        .orElseThrow(() -> new ResourceNotFoundException("Tender", tenderId));
  }

  private static void validateOffer(Tender tender, long price, String documentationReference) {
    if (price <= 0) {
      throw new InvalidInputException("Invalid offer", "price must be positive");
    }
    if (price > tender.getMaxPrice()) {
      throw new InvalidInputException(
          "Invalid offer",
          "price " + price + " exceeds the tender's maximum price " + tender.getMaxPrice());
    }
    if (documentationReference == null || documentationReference.isBlank()) {
      throw new InvalidInputException("Invalid offer", "documentationReference must not be blank");
    }
  }
}
