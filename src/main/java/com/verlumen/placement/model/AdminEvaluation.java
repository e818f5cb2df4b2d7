package com.verlumen.placement.model;

import static com.google.common.base.Preconditions.checkArgument;

/** The department's evaluation of a resident on one admin-evaluation factor, in [0, 1]. */
public record AdminEvaluation(int residentId, int fiscalYear, int factorId, double value) {
  public AdminEvaluation {
    checkArgument(value >= 0.0 && value <= 1.0, "Evaluation must be within [0, 1]: %s", value);
  }
}
