package io.b2mash.tender.accesscontrol;

import io.b2mash.tender.context.RequestScopes;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.net.URI;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AccessControlController {

  private final AccessControl accessControl;

  public AccessControlController(AccessControl accessControl) {
    this.accessControl = accessControl;
  }

  // --- Evaluators ---

  @PostMapping("/api/evaluators")
  public ResponseEntity<EvaluatorResponse> addEvaluator(
      @Valid @RequestBody AddEvaluatorRequest request) {
    accessControl.addEvaluator(RequestScopes.requireCaller(), request.address());
    var address = request.address().trim();
    return ResponseEntity.created(URI.create("/api/evaluators/" + address))
        .body(new EvaluatorResponse(address, true));
  }

  @DeleteMapping("/api/evaluators/{address}")
  public ResponseEntity<Void> removeEvaluator(@PathVariable String address) {
    accessControl.removeEvaluator(RequestScopes.requireCaller(), address);
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/api/evaluators")
  public ResponseEntity<List<String>> listEvaluators() {
    return ResponseEntity.ok(accessControl.listEvaluators());
  }

  @GetMapping("/api/evaluators/{address}")
  public ResponseEntity<EvaluatorResponse> isEvaluator(@PathVariable String address) {
    return ResponseEntity.ok(new EvaluatorResponse(address, accessControl.isEvaluator(address)));
  }

  // --- Authority ---

  @GetMapping("/api/authority")
  public ResponseEntity<AuthorityResponse> currentAuthority() {
    return ResponseEntity.ok(new AuthorityResponse(accessControl.currentAuthority().orElse(null)));
  }

  @PutMapping("/api/authority")
  public ResponseEntity<AuthorityResponse> transferAuthority(
      @Valid @RequestBody TransferAuthorityRequest request) {
    accessControl.transferAuthority(RequestScopes.requireCaller(), request.newAuthority());
    return ResponseEntity.ok(new AuthorityResponse(accessControl.currentAuthority().orElse(null)));
  }

  @DeleteMapping("/api/authority")
  public ResponseEntity<Void> renounceAuthority() {
    accessControl.renounceAuthority(RequestScopes.requireCaller());
    return ResponseEntity.noContent().build();
  }

  // --- DTOs ---

  public record AddEvaluatorRequest(@NotBlank(message = "address is required") String address) {}

  public record TransferAuthorityRequest(
      @NotBlank(message = "newAuthority is required") String newAuthority) {}

  public record EvaluatorResponse(String address, boolean evaluator) {}

  public record AuthorityResponse(String authority) {}
}
