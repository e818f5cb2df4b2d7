package com.verlumen.placement.model;

import static com.google.common.base.Preconditions.checkArgument;

/** A resident's ranked hospital preference for one fiscal year. */
public record HospitalChoice(int residentId, int fiscalYear, int rank, int hospitalId) {
  public static final int MIN_RANK = 1;
  public static final int MAX_RANK = 3;

  public HospitalChoice {
    checkArgument(
        rank >= MIN_RANK && rank <= MAX_RANK,
        "Rank must be between %s and %s: %s",
        MIN_RANK,
        MAX_RANK,
        rank);
  }
}
