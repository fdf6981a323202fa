package io.b2mash.tender.offer;

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
public class OfferController {

  private final OfferService offerService;

  public OfferController(OfferService offerService) {
    this.offerService = offerService;
  }

  @PostMapping("/api/tenders/{tenderId}/offers")
  public ResponseEntity<OfferResponse> submitOffer(
      @PathVariable long tenderId, @Valid @RequestBody SubmitOfferRequest request) {
    var offer =
        offerService.submitOffer(
            RequestScopes.requireCaller(),
            tenderId,
            request.price(),
            request.documentationReference());
    return ResponseEntity.created(
            URI.create("/api/tenders/" + tenderId + "/offers/" + offer.provider()))
        .body(OfferResponse.from(offer));
  }

  @GetMapping("/api/tenders/{tenderId}/offers")
  public ResponseEntity<TenderOffers> getOffers(@PathVariable long tenderId) {
    return ResponseEntity.ok(offerService.getOffers(tenderId));
  }

  @GetMapping("/api/tenders/{tenderId}/offers/{provider}")
  public ResponseEntity<OfferResponse> getOffer(
      @PathVariable long tenderId, @PathVariable String provider) {
    return ResponseEntity.ok(OfferResponse.from(offerService.getOffer(tenderId, provider)));
  }

  @GetMapping("/api/tenders/{tenderId}/participants")
  public ResponseEntity<List<String>> getParticipants(@PathVariable long tenderId) {
    return ResponseEntity.ok(offerService.getParticipants(tenderId));
  }

  // --- DTOs ---

  public record SubmitOfferRequest(
      @NotNull(message = "price is required") Long price,
      @NotNull(message = "documentationReference is required") String documentationReference) {}

  public record OfferResponse(
      long tenderId,
      String provider,
      long price,
      String documentationReference,
      int qualityScore,
      boolean evaluated,
      Instant submittedAt,
      String evaluatedBy,
      Instant evaluatedAt) {

    public static OfferResponse from(OfferSnapshot offer) {
      return new OfferResponse(
          offer.tenderId(),
          offer.provider(),
          offer.price(),
          offer.documentationReference(),
          offer.qualityScore(),
          offer.evaluated(),
          offer.submittedAt(),
          offer.evaluatedBy(),
          offer.evaluatedAt());
    }
  }
}
