package io.b2mash.tender.accesscontrol;

import io.b2mash.tender.audit.AuditEventBuilder;
import io.b2mash.tender.audit.AuditService;
import io.b2mash.tender.exception.ForbiddenException;
import io.b2mash.tender.exception.ResourceConflictException;
import io.b2mash.tender.exception.ResourceNotFoundException;
import io.b2mash.tender.security.CallerIdentities;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class AccessControlService implements AccessControl {

  private static final Logger log = LoggerFactory.getLogger(AccessControlService.class);

  private final AccessRegistry registry;
  private final AccessPolicy accessPolicy;
  private final AuditService auditService;

  public AccessControlService(
      AccessRegistry registry, AccessPolicy accessPolicy, AuditService auditService) {
    this.registry = registry;
    this.accessPolicy = accessPolicy;
    this.auditService = auditService;
  }

  @Override
  public Optional<String> currentAuthority() {
    return registry.currentAuthority();
  }

  @Override
  public void transferAuthority(String caller, String newAuthority) {
    accessPolicy.authorize(caller, TenderOperation.TRANSFER_AUTHORITY);
    String target = CallerIdentities.require(newAuthority, "newAuthority");

    if (!registry.replaceAuthority(caller, target)) {
      throw new ForbiddenException(
          "Unauthorized", "Authority changed concurrently; caller is no longer the authority");
    }

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("authority.transferred")
            .entityType("authority")
            .entityId(target)
            .actorId(caller)
            .details(Map.of("previous_authority", caller, "new_authority", target))
            .build());
    log.info("Authority transferred from {} to {}", caller, target);
  }

  @Override
  public void renounceAuthority(String caller) {
    accessPolicy.authorize(caller, TenderOperation.RENOUNCE_AUTHORITY);

    if (!registry.replaceAuthority(caller, null)) {
      throw new ForbiddenException(
          "Unauthorized", "Authority changed concurrently; caller is no longer the authority");
    }

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("authority.renounced")
            .entityType("authority")
            .entityId(caller)
            .actorId(caller)
            .details(Map.of("previous_authority", caller))
            .build());
    log.warn("Authority {} renounced; no identity can drive tender lifecycles now", caller);
  }

  @Override
  public boolean isEvaluator(String identity) {
    return registry.isEvaluator(CallerIdentities.normalizeOrNull(identity));
  }

  @Override
  public List<String> listEvaluators() {
    return registry.listEvaluators();
  }

  @Override
  public void addEvaluator(String caller, String evaluator) {
    accessPolicy.authorize(caller, TenderOperation.ADD_EVALUATOR);
    String identity = CallerIdentities.require(evaluator, "evaluator");

    if (!registry.addEvaluator(identity)) {
      throw new ResourceConflictException(
          "Evaluator already exists", "Identity " + identity + " is already an evaluator");
    }

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("evaluator.added")
            .entityType("evaluator")
            .entityId(identity)
            .actorId(caller)
            .build());
    log.info("Added evaluator {}", identity);
  }

  @Override
  public void removeEvaluator(String caller, String evaluator) {
    accessPolicy.authorize(caller, TenderOperation.REMOVE_EVALUATOR);
    String identity = CallerIdentities.require(evaluator, "evaluator");

    if (!registry.removeEvaluator(identity)) {
      throw new ResourceNotFoundException("Evaluator", identity);
    }

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("evaluator.removed")
            .entityType("evaluator")
            .entityId(identity)
            .actorId(caller)
            .build());
    log.info("Removed evaluator {}", identity);
  }
}
