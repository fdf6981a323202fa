package io.b2mash.tender.tender;

/** Lifecycle status of a tender. Transitions only move forward. */
public enum TenderStatus {
  /** Accepting offers until the deadline. */
  OPEN,

  /** Offer period closed; evaluators score offers. */
  CLOSED,

  /** Every offer has a quality score. */
  EVALUATED,

  /** Winner committed. Terminal. */
  FINALIZED
}
