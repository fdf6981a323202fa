package io.b2mash.tender.testutil;

import static org.mockito.Mockito.mock;

import io.b2mash.tender.accesscontrol.AccessControlProperties;
import io.b2mash.tender.accesscontrol.AccessControlService;
import io.b2mash.tender.accesscontrol.AccessPolicy;
import io.b2mash.tender.accesscontrol.AccessRegistry;
import io.b2mash.tender.audit.AuditService;
import io.b2mash.tender.evaluation.EvaluationService;
import io.b2mash.tender.offer.OfferRepository;
import io.b2mash.tender.offer.OfferService;
import io.b2mash.tender.tender.TenderLocks;
import io.b2mash.tender.tender.TenderRepository;
import io.b2mash.tender.tender.TenderService;
import io.b2mash.tender.winner.WinnerSelectionService;
import java.time.Duration;
import java.util.List;

/**
 * Wires the tender services over fresh in-memory stores, a {@link MutableClock} and, unless one
 * is supplied, a mocked {@link AuditService}. One harness per test keeps state isolated without a Spring context.
 */
public class TenderTestHarness {

  public static final String AUTHORITY = "authority";
  public static final String EVALUATOR = "evaluator-1";

  public final MutableClock clock = new MutableClock(TestClockConfiguration.START);
  public final AuditService auditService;
  public final AccessRegistry accessRegistry =
      new AccessRegistry(new AccessControlProperties(AUTHORITY, List.of(EVALUATOR)));
  public final AccessPolicy accessPolicy = new AccessPolicy(accessRegistry);
  public final TenderRepository tenderRepository = new TenderRepository();
  public final OfferRepository offerRepository = new OfferRepository();
  public final TenderLocks tenderLocks = new TenderLocks();

  public final AccessControlService accessControlService;
  public final TenderService tenderService;
  public final OfferService offerService;
  public final EvaluationService evaluationService;
  public final WinnerSelectionService winnerSelectionService;

  public TenderTestHarness() {
    this(mock(AuditService.class));
  }

  /** Uses {@code auditService} in place of the mock, e.g. to read the recorded trail back. */
  public TenderTestHarness(AuditService auditService) {
    this.auditService = auditService;
    this.accessControlService = new AccessControlService(accessRegistry, accessPolicy, auditService);
    this.tenderService =
        new TenderService(
            tenderRepository, offerRepository, tenderLocks, accessPolicy, auditService, clock);
    this.offerService =
        new OfferService(
            tenderRepository, offerRepository, tenderLocks, accessPolicy, auditService, clock);
    this.evaluationService =
        new EvaluationService(
            tenderRepository, offerRepository, tenderLocks, accessPolicy, auditService, clock);
    this.winnerSelectionService =
        new WinnerSelectionService(
            tenderRepository, offerRepository, tenderLocks, accessPolicy, auditService, clock);
  }

  /** Creates a tender with a 7-day offer period. */
  public long openTender(long maxPrice, int weightPrice, int weightQuality) {
    return tenderService
        .createTender(AUTHORITY, "Road resurfacing", maxPrice, 7, weightPrice, weightQuality)
        .id();
  }

  /** Moves the clock past every deadline created so far and closes the tender. */
  public void close(long tenderId) {
    clock.advance(Duration.ofDays(8));
    tenderService.closeOfferPeriod(AUTHORITY, tenderId);
  }

  public void evaluate(long tenderId, String provider, int qualityScore) {
    evaluationService.evaluateOffer(EVALUATOR, tenderId, provider, qualityScore);
  }
}
