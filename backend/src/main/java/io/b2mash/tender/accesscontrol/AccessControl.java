package io.b2mash.tender.accesscontrol;

import java.util.List;
import java.util.Optional;

/**
 * Role and ownership primitive of the tender workflow: one authority identity and a settable
 * evaluator set. Mutations are themselves authority-gated.
 */
public interface AccessControl {

  Optional<String> currentAuthority();

  /**
   * Hands the authority role to {@code newAuthority}.
   *
   * @throws io.b2mash.tender.exception.ForbiddenException if {@code caller} is not the authority
   * @throws io.b2mash.tender.exception.InvalidInputException if {@code newAuthority} is blank
   */
  void transferAuthority(String caller, String newAuthority);

  /** Leaves the service without an authority. Every authority-gated call fails afterwards. */
  void renounceAuthority(String caller);

  boolean isEvaluator(String identity);

  List<String> listEvaluators();

  void addEvaluator(String caller, String evaluator);

  void removeEvaluator(String caller, String evaluator);
}
