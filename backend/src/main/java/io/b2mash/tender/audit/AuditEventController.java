package io.b2mash.tender.audit;

import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AuditEventController {

  private final AuditService auditService;

  public AuditEventController(AuditService auditService) {
    this.auditService = auditService;
  }

  @GetMapping("/api/audit-events")
  public ResponseEntity<List<AuditEvent>> listEvents(
      @RequestParam(required = false) String entityType,
      @RequestParam(required = false) String entityId,
      @RequestParam(required = false) String actorId,
      @RequestParam(required = false) String eventType) {
    var filter = new AuditEventFilter(entityType, entityId, actorId, eventType);
    return ResponseEntity.ok(auditService.findEvents(filter));
  }
}
