package io.b2mash.tender.winner;

import io.b2mash.tender.context.RequestScopes;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class WinnerController {

  private final WinnerSelectionService winnerSelectionService;

  public WinnerController(WinnerSelectionService winnerSelectionService) {
    this.winnerSelectionService = winnerSelectionService;
  }

  @PostMapping("/api/tenders/{tenderId}/winner")
  public ResponseEntity<WinnerSelection> calculateWinner(@PathVariable long tenderId) {
    return ResponseEntity.ok(
        winnerSelectionService.calculateWinner(RequestScopes.requireCaller(), tenderId));
  }
}
