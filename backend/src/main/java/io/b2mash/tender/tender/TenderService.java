package io.b2mash.tender.tender;

import io.b2mash.tender.accesscontrol.AccessPolicy;
import io.b2mash.tender.accesscontrol.TenderOperation;
import io.b2mash.tender.audit.AuditEventBuilder;
import io.b2mash.tender.audit.AuditService;
import io.b2mash.tender.exception.DeadlineViolationException;
import io.b2mash.tender.exception.InvalidInputException;
import io.b2mash.tender.exception.InvalidStateException;
import io.b2mash.tender.exception.ResourceNotFoundException;
import io.b2mash.tender.offer.OfferKey;
import io.b2mash.tender.offer.OfferRepository;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Creates tenders and drives the authority-controlled phase transitions OPEN → CLOSED →
 * EVALUATED. Winner selection lives in {@link io.b2mash.tender.winner.WinnerSelectionService}.
 */
@Service
public class TenderService {

  private static final Logger log = LoggerFactory.getLogger(TenderService.class);

  private final TenderRepository tenderRepository;
  private final OfferRepository offerRepository;
  private final TenderLocks tenderLocks;
  private final AccessPolicy accessPolicy;
  private final AuditService auditService;
  private final Clock clock;

  public TenderService(
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

  // --- createTender ---

  public TenderSnapshot createTender(
      String caller,
      String description,
      long maxPrice,
      long deadlineDays,
      int weightPrice,
      int weightQuality) {
    accessPolicy.authorize(caller, TenderOperation.CREATE_TENDER);
    validateTerms(description, maxPrice, deadlineDays, weightPrice, weightQuality);

    Instant now = clock.instant();
    Instant deadline = deadlineFrom(now, deadlineDays);
    String trimmedDescription = description.trim();

    var auditDetails = new LinkedHashMap<String, Object>();
    auditDetails.put("description", trimmedDescription);
    auditDetails.put("max_price", maxPrice);
    auditDetails.put("deadline", deadline.toString());
    auditDetails.put("weight_price", weightPrice);
    auditDetails.put("weight_quality", weightQuality);

    // Logged inside create so the event precedes any event on the new tender.
    var tender =
        tenderRepository.create(
            id -> {
              var created =
                  new Tender(
                      id,
                      caller,
                      trimmedDescription,
                      maxPrice,
                      deadline,
                      weightPrice,
                      weightQuality,
                      now);
              auditService.log(
                  AuditEventBuilder.builder()
                      .eventType("tender.created")
                      .entityType("tender")
                      .entityId(id)
                      .actorId(caller)
                      .details(auditDetails)
                      .build());
              return created;
            });
    var snapshot = tenderLocks.read(tender.getId(), () -> TenderSnapshot.of(tender));

    log.info(
        "Created tender {} (maxPrice={}, deadline={}, weights={}/{})",
        snapshot.id(),
        maxPrice,
        deadline,
        weightPrice,
        weightQuality);
    return snapshot;
  }

  // --- closeOfferPeriod ---

  public TenderSnapshot closeOfferPeriod(String caller, long tenderId) {
    accessPolicy.authorize(caller, TenderOperation.CLOSE_OFFER_PERIOD);
    var tender = findTender(tenderId);

    var snapshot =
        tenderLocks.write(
            tenderId,
            () -> {
              Instant now = clock.instant();
              requireStatus(tender, TenderStatus.OPEN, "close the offer period of");
              if (!tender.isDeadlinePassed(now)) {
                throw new DeadlineViolationException(
                    "Offer period of tender " + tenderId + " has not ended yet",
                    tender.getDeadline());
              }
              if (tender.getParticipantCount() == 0) {
                throw new InvalidInputException(
                    "No offers", "Tender " + tenderId + " has no offers to close on");
              }
              tender.markClosed(now);
              auditService.log(
                  AuditEventBuilder.builder()
                      .eventType("tender.closed")
                      .entityType("tender")
                      .entityId(tenderId)
                      .actorId(caller)
                      .details(Map.of("participant_count", tender.getParticipantCount()))
                      .build());
              return TenderSnapshot.of(tender);
            });

    log.info("Closed offer period of tender {} with {} offers", tenderId, snapshot.participantCount());
    return snapshot;
  }

  // --- markAsEvaluated ---

  public TenderSnapshot markAsEvaluated(String caller, long tenderId) {
    accessPolicy.authorize(caller, TenderOperation.MARK_AS_EVALUATED);
    var tender = findTender(tenderId);

    var snapshot =
        tenderLocks.write(
            tenderId,
            () -> {
              requireStatus(tender, TenderStatus.CLOSED, "mark as evaluated");
              List<String> participants = tender.getParticipants();
              if (participants.isEmpty()) {
                throw new InvalidInputException(
                    "No offers", "Tender " + tenderId + " has no offers to evaluate");
              }
              for (String provider : participants) {
                var offer = offerRepository.getRequired(new OfferKey(tenderId, provider));
                if (!offer.isEvaluated()) {
                  throw new InvalidInputException(
                      "Not all offers are evaluated",
                      "Offer from " + provider + " on tender " + tenderId + " is not evaluated");
                }
              }
              tender.markEvaluated(clock.instant());
              auditService.log(
                  AuditEventBuilder.builder()
                      .eventType("tender.evaluated")
                      .entityType("tender")
                      .entityId(tenderId)
                      .actorId(caller)
                      .details(Map.of("participant_count", participants.size()))
                      .build());
              return TenderSnapshot.of(tender);
            });

    log.info("Tender {} marked as evaluated", tenderId);
    return snapshot;
  }

  // --- Reads ---

  public TenderSnapshot getTender(long tenderId) {
    var tender = findTender(tenderId);
    return tenderLocks.read(tenderId, () -> TenderSnapshot.of(tender));
  }

  public List<TenderSnapshot> listTenders() {
    return tenderRepository.findAll().stream()
        .map(tender -> tenderLocks.read(tender.getId(), () -> TenderSnapshot.of(tender)))
        .toList();
  }

  public long tenderCount() {
    return tenderRepository.count();
  }

  // --- Helpers ---

  private Tender findTender(long tenderId) {
    return tenderRepository
        .findById(tenderId)
        .orElseThrow(() -> new ResourceNotFoundException("Tender", tenderId));
  }

  private static void requireStatus(Tender tender, TenderStatus required, String action) {
    if (tender.getStatus() != required) {
      throw new InvalidStateException(
          "Invalid tender state",
          "Cannot "
              + action
              + " tender "
              + tender.getId()
              + " in status "
              + tender.getStatus()
              + "; expected "
              + required);
    }
  }

  private static Instant deadlineFrom(Instant now, long deadlineDays) {
    try {
      return now.plus(Duration.ofDays(deadlineDays));
    } catch (ArithmeticException | DateTimeException e) {
      throw new InvalidInputException(
          "Invalid tender", "deadlineDays " + deadlineDays + " is too large");
    }
  }

  private static void validateTerms(
      String description, long maxPrice, long deadlineDays, int weightPrice, int weightQuality) {
    if (description == null || description.isBlank()) {
      throw new InvalidInputException("Invalid tender", "description must not be blank");
    }
    if (maxPrice <= 0) {
      throw new InvalidInputException("Invalid tender", "maxPrice must be positive");
    }
    if (deadlineDays <= 0) {
      throw new InvalidInputException("Invalid tender", "deadlineDays must be positive");
    }
    if (weightPrice < 0
        || weightPrice > Tender.WEIGHT_TOTAL
        || weightQuality < 0
        || weightQuality > Tender.WEIGHT_TOTAL) {
      throw new InvalidInputException("Invalid weights", "weights must each be between 0 and 100");
    }
    if (weightPrice + weightQuality != Tender.WEIGHT_TOTAL) {
      throw new InvalidInputException(
          "Invalid weights",
          "weightPrice + weightQuality must equal 100, got " + (weightPrice + weightQuality));
    }
  }
}
