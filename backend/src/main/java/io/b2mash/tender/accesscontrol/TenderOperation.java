package io.b2mash.tender.accesscontrol;

/** Every mutating entry point of the tender workflow, with the role it requires. */
public enum TenderOperation {
  ADD_EVALUATOR(CallerRole.AUTHORITY, "add evaluators"),
  REMOVE_EVALUATOR(CallerRole.AUTHORITY, "remove evaluators"),
  TRANSFER_AUTHORITY(CallerRole.AUTHORITY, "transfer authority"),
  RENOUNCE_AUTHORITY(CallerRole.AUTHORITY, "renounce authority"),
  CREATE_TENDER(CallerRole.AUTHORITY, "create tenders"),
  CLOSE_OFFER_PERIOD(CallerRole.AUTHORITY, "close offer periods"),
  MARK_AS_EVALUATED(CallerRole.AUTHORITY, "mark tenders as evaluated"),
  CALCULATE_WINNER(CallerRole.AUTHORITY, "calculate winners"),
  SUBMIT_OFFER(CallerRole.ANY, "submit offers"),
  EVALUATE_OFFER(CallerRole.EVALUATOR, "evaluate offers");

  private final CallerRole requiredRole;
  private final String action;

  TenderOperation(CallerRole requiredRole, String action) {
    this.requiredRole = requiredRole;
    this.action = action;
  }

  public CallerRole requiredRole() {
    return requiredRole;
  }

  public String action() {
    return action;
  }
}
