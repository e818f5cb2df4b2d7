package com.verlumen.placement.optimization;

/** Why the generation loop stopped. */
public enum TerminationReason {
  GENERATION_LIMIT,
  CONVERGED,
  CANCELLED
}
