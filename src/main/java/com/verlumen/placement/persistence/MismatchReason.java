package com.verlumen.placement.persistence;

/** Why a resident was placed outside their declared choices. */
public enum MismatchReason {
  CAPACITY_FULL,
  LOW_FITNESS,
  CONSTRAINT_VIOLATION,
  /** The assigned hospital was not among the resident's choices. */
  NO_PREFERENCE
}
