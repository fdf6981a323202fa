package io.b2mash.tender.evaluation;

import io.b2mash.tender.context.RequestScopes;
import io.b2mash.tender.offer.OfferController.OfferResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class EvaluationController {

  private final EvaluationService evaluationService;

  public EvaluationController(EvaluationService evaluationService) {
    this.evaluationService = evaluationService;
  }

  @PostMapping("/api/tenders/{tenderId}/offers/{provider}/evaluation")
  public ResponseEntity<OfferResponse> evaluateOffer(
      @PathVariable long tenderId,
      @PathVariable String provider,
      @Valid @RequestBody EvaluateOfferRequest request) {
    var offer =
        evaluationService.evaluateOffer(
            RequestScopes.requireCaller(), tenderId, provider, request.qualityScore());
    return ResponseEntity.ok(OfferResponse.from(offer));
  }

  public record EvaluateOfferRequest(
      @NotNull(message = "qualityScore is required") Integer qualityScore) {}
}
