package io.b2mash.tender.winner;

import io.b2mash.tender.accesscontrol.AccessPolicy;
import io.b2mash.tender.accesscontrol.TenderOperation;
import io.b2mash.tender.audit.AuditEventBuilder;
import io.b2mash.tender.audit.AuditService;
import io.b2mash.tender.exception.InvalidStateException;
import io.b2mash.tender.exception.ResourceConflictException;
import io.b2mash.tender.exception.ResourceNotFoundException;
import io.b2mash.tender.offer.OfferKey;
import io.b2mash.tender.offer.OfferRepository;
import io.b2mash.tender.tender.Tender;
import io.b2mash.tender.tender.TenderLocks;
import io.b2mash.tender.tender.TenderRepository;
import io.b2mash.tender.tender.TenderStatus;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Ranks the offers of an evaluated tender and commits the winner.
 *
 * <p>Participants are scanned in submission order and the leader changes only on a strictly
 * greater combined score, so ties go to the earliest submission. The result is committed once;
 * a finalized tender rejects further calculation.
 */
@Service
public class WinnerSelectionService {

  private static final Logger log = LoggerFactory.getLogger(WinnerSelectionService.class);

  private final TenderRepository tenderRepository;
  private final OfferRepository offerRepository;
  private final TenderLocks tenderLocks;
  private final AccessPolicy accessPolicy;
  private final AuditService auditService;
  private final Clock clock;

  public WinnerSelectionService(
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

  public WinnerSelection calculateWinner(String caller, long tenderId) {
    accessPolicy.authorize(caller, TenderOperation.CALCULATE_WINNER);
    var tender =
        tenderRepository
            .findById(tenderId)
            .orElseThrow(() -> new ResourceNotFoundException("Tender", tenderId));

    var selection =
        tenderLocks.write(
            tenderId,
            () -> {
              if (tender.hasWinner() || tender.getStatus() == TenderStatus.FINALIZED) {
                throw new ResourceConflictException(
                    "Winner already calculated",
                    "Tender " + tenderId + " already has winner " + tender.getWinner());
              }
              if (tender.getStatus() != TenderStatus.EVALUATED) {
                throw new InvalidStateException(
                    "Tender not evaluated",
                    "Cannot calculate the winner of tender "
                        + tenderId
                        + " in status "
                        + tender.getStatus());
              }
              var result = rank(tender);
              if (result.winner() == null) {
                throw new InvalidStateException(
                    "No valid winner", "Tender " + tenderId + " has no offers to rank");
              }
              tender.markFinalized(result.winner(), clock.instant());
              var auditDetails = new LinkedHashMap<String, Object>();
              auditDetails.put("winner", result.winner());
              auditDetails.put("winning_score", result.winningScore());
              auditDetails.put("participant_count", result.scoredOffers().size());
              auditService.log(
                  AuditEventBuilder.builder()
                      .eventType("tender.finalized")
                      .entityType("tender")
                      .entityId(tenderId)
                      .actorId(caller)
                      .details(auditDetails)
                      .build());
              return result;
            });

    log.info(
        "Tender {} finalized: winner {} with combined score {}",
        tenderId,
        selection.winner(),
        selection.winningScore());
    return selection;
  }

  /** Scores every participant; {@code winner} is null only when there are no participants. */
  private WinnerSelection rank(Tender tender) {
    List<ScoredOffer> scored = new ArrayList<>();
    String leader = null;
    int bestScore = 0;
    for (String provider : tender.getParticipants()) {
      var offer = offerRepository.getRequired(new OfferKey(tender.getId(), provider));
      int priceScore = ScoreCalculator.priceScore(tender.getMaxPrice(), offer.getPrice());
      int combined =
          ScoreCalculator.combinedScore(
              priceScore,
              offer.getQualityScore(),
              tender.getWeightPrice(),
              tender.getWeightQuality());
      scored.add(
          new ScoredOffer(provider, offer.getPrice(), priceScore, offer.getQualityScore(), combined));
      if (leader == null || combined > bestScore) {
        bestScore = combined;
        leader = provider;
      }
    }
    return new WinnerSelection(tender.getId(), leader, bestScore, scored);
  }
}
