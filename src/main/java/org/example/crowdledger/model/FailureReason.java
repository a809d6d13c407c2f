package org.example.crowdledger.model;

/**
 * Named reasons a ledger operation or workflow can fail.
 *
 * <p>Every reason aborts the whole workflow with no state change. The CLI prints the constant name
 * so users can tell failures apart.
 */
public enum FailureReason {
  /** The identifier's index is outside its type's collection. */
  NOT_FOUND,

  /** Not enough votes to evaluate the elimination test. */
  QUORUM_NOT_MET,

  /** The account already owns a username, or the name is taken. */
  ALREADY_REGISTERED,

  INVALID_USERNAME,

  /** Caller is not the record owner or not the administrator. */
  UNAUTHORIZED,

  INSUFFICIENT_BALANCE,

  INSUFFICIENT_ALLOWANCE,

  /** The platform account holds no collected fees. */
  NOTHING_TO_WITHDRAW,

  /** No positive net likes left to convert into rewards. */
  NO_LIKES_TO_HARVEST,

  /** A reward or fee was requested while the active-user count is zero. */
  DIVISION_BY_ZERO,

  /** Deletion requested but the crowd has not disapproved the content. */
  NOT_ELIGIBLE_FOR_DELETION,

  /** Harvest refused because the content currently qualifies for elimination. */
  ELIMINATION_PENDING
}
