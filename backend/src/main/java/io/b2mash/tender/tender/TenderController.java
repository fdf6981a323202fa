package io.b2mash.tender.tender;

import io.b2mash.tender.context.RequestScopes;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class TenderController {

  private final TenderService tenderService;

  public TenderController(TenderService tenderService) {
    this.tenderService = tenderService;
  }

  @PostMapping("/api/tenders")
  public ResponseEntity<TenderResponse> createTender(
      @Valid @RequestBody CreateTenderRequest request) {
    var tender =
        tenderService.createTender(
            RequestScopes.requireCaller(),
            request.description(),
            request.maxPrice(),
            request.deadlineDays(),
            request.weightPrice(),
            request.weightQuality());
    return ResponseEntity.created(URI.create("/api/tenders/" + tender.id()))
        .body(TenderResponse.from(tender));
  }

  @GetMapping("/api/tenders")
  public ResponseEntity<List<TenderResponse>> listTenders() {
    return ResponseEntity.ok(
        tenderService.listTenders().stream().map(TenderResponse::from).toList());
  }

  @GetMapping("/api/tenders/count")
  public ResponseEntity<TenderCountResponse> tenderCount() {
    return ResponseEntity.ok(new TenderCountResponse(tenderService.tenderCount()));
  }

  @GetMapping("/api/tenders/{id}")
  public ResponseEntity<TenderResponse> getTender(@PathVariable long id) {
    return ResponseEntity.ok(TenderResponse.from(tenderService.getTender(id)));
  }

  @PostMapping("/api/tenders/{id}/close")
  public ResponseEntity<TenderResponse> closeOfferPeriod(@PathVariable long id) {
    var tender = tenderService.closeOfferPeriod(RequestScopes.requireCaller(), id);
    return ResponseEntity.ok(TenderResponse.from(tender));
  }

  @PostMapping("/api/tenders/{id}/mark-evaluated")
  public ResponseEntity<TenderResponse> markAsEvaluated(@PathVariable long id) {
    var tender = tenderService.markAsEvaluated(RequestScopes.requireCaller(), id);
    return ResponseEntity.ok(TenderResponse.from(tender));
  }

  // --- DTOs ---

  /** Range checks run in the service, after the caller is authorized. */
  public record CreateTenderRequest(
      @NotNull(message = "description is required") String description,
      @NotNull(message = "maxPrice is required") Long maxPrice,
      @NotNull(message = "deadlineDays is required") Long deadlineDays,
      @NotNull(message = "weightPrice is required") Integer weightPrice,
      @NotNull(message = "weightQuality is required") Integer weightQuality) {}

  public record TenderCountResponse(long count) {}

  public record TenderResponse(
      long id,
      String creator,
      String description,
      long maxPrice,
      Instant deadline,
      int weightPrice,
      int weightQuality,
      TenderStatus status,
      String winner,
      int participantCount,
      Instant createdAt,
      Instant closedAt,
      Instant evaluatedAt,
      Instant finalizedAt) {

    public static TenderResponse from(TenderSnapshot tender) {
      return new TenderResponse(
          tender.id(),
          tender.creator(),
          tender.description(),
          tender.maxPrice(),
          tender.deadline(),
          tender.weightPrice(),
          tender.weightQuality(),
          tender.status(),
          tender.winner(),
          tender.participantCount(),
          tender.createdAt(),
          tender.closedAt(),
          tender.evaluatedAt(),
          tender.finalizedAt());
    }
  }
}
