package io.b2mash.tender.evaluation;

import io.b2mash.tender.accesscontrol.AccessPolicy;
import io.b2mash.tender.accesscontrol.TenderOperation;
import io.b2mash.tender.audit.AuditEventBuilder;
import io.b2mash.tender.audit.AuditService;
import io.b2mash.tender.exception.InvalidInputException;
import io.b2mash.tender.exception.InvalidStateException;
import io.b2mash.tender.exception.ResourceNotFoundException;
import io.b2mash.tender.offer.Offer;
import io.b2mash.tender.offer.OfferKey;
import io.b2mash.tender.offer.OfferRepository;
import io.b2mash.tender.offer.OfferSnapshot;
import io.b2mash.tender.security.CallerIdentities;
import io.b2mash.tender.tender.TenderLocks;
import io.b2mash.tender.tender.TenderRepository;
import io.b2mash.tender.tender.TenderStatus;
import java.time.Clock;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class EvaluationService {

  private static final Logger log = LoggerFactory.getLogger(EvaluationService.class);

  private final TenderRepository tenderRepository;
  private final OfferRepository offerRepository;
  private final TenderLocks tenderLocks;
  private final AccessPolicy accessPolicy;
  private final AuditService auditService;
  private final Clock clock;

  public EvaluationService(
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

  /** Scores one offer on a closed tender. Each offer can be scored once. */
  public OfferSnapshot evaluateOffer(
      String caller, long tenderId, String providerIdentity, int qualityScore) {
    accessPolicy.authorize(caller, TenderOperation.EVALUATE_OFFER);
    String provider = CallerIdentities.require(providerIdentity, "provider");
    var tender =
        tenderRepository
            .findById(tenderId)
            .orElseThrow(() -> new ResourceNotFoundException("Tender", tenderId));

    var snapshot =
        tenderLocks.write(
            tenderId,
            () -> {
              if (tender.getStatus() != TenderStatus.CLOSED) {
                throw new InvalidStateException(
                    "Tender not closed",
                    "Offers on tender "
                        + tenderId
                        + " can only be evaluated while CLOSED, status is "
                        + tender.getStatus());
              }
              if (qualityScore < 0 || qualityScore > Offer.MAX_QUALITY_SCORE) {
                throw new InvalidInputException(
                    "Invalid quality score",
                    "qualityScore must be between 0 and "
                        + Offer.MAX_QUALITY_SCORE
                        + ", got "
                        + qualityScore);
              }
              var offer =
                  offerRepository
                      .findById(new OfferKey(tenderId, provider))
                      .orElseThrow(
                          () ->
                              ResourceNotFoundException.withDetail(
                                  "Offer not found",
                                  "No offer from " + provider + " on tender " + tenderId));
              offer.recordEvaluation(qualityScore, caller, clock.instant());
              auditService.log(
                  AuditEventBuilder.builder()
                      .eventType("offer.evaluated")
                      .entityType("offer")
                      .entityId(tenderId + "/" + provider)
                      .actorId(caller)
                      .details(Map.of("tender_id", tenderId, "quality_score", qualityScore))
                      .build());
              return OfferSnapshot.of(offer);
            });

    log.info(
        "Evaluator {} scored offer from {} on tender {}: {}",
        caller,
        provider,
        tenderId,
        qualityScore);
    return snapshot;
  }
}
