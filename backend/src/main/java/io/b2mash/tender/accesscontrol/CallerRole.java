package io.b2mash.tender.accesscontrol;

/** Role a caller must hold to invoke a {@link TenderOperation}. */
public enum CallerRole {
  /** The single identity that creates tenders and drives lifecycle transitions. */
  AUTHORITY,

  /** Any identity in the evaluator set. */
  EVALUATOR,

  /** Any authenticated identity. */
  ANY
}
