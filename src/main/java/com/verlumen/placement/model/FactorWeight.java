package com.verlumen.placement.model;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * How much a resident cares about a staff-preference factor. Weights of one resident are meant
 * to add up to 100 but that is not enforced here.
 */
public record FactorWeight(int residentId, int fiscalYear, int factorId, double weight) {
  public FactorWeight {
    checkArgument(weight >= 0, "Weight cannot be negative: %s", weight);
  }
}
