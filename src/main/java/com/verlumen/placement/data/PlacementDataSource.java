package com.verlumen.placement.data;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.verlumen.placement.model.EvaluationFactor;
import com.verlumen.placement.model.FactorType;
import com.verlumen.placement.model.Hospital;
import com.verlumen.placement.model.Resident;
import java.util.Optional;

/**
 * Read access to everything the optimizer consumes: master lists, per-year resident input and the
 * commute-time cache. Implementations are backed by whatever store the host application uses.
 */
public interface PlacementDataSource {
  /** Returns the residents to place, in a stable order. */
  ImmutableList<Resident> residents();

  /** Returns the candidate hospitals, in a stable order. */
  ImmutableList<Hospital> hospitals();

  /**
   * Returns the resident's declared choices for a fiscal year, keyed by rank (1 to 3) and
   * iterating in rank order. Empty if the resident declared none.
   */
  ImmutableMap<Integer, Integer> hospitalChoices(int residentId, int fiscalYear);

  /** Returns factor id to weight for the resident's staff-preference weights. */
  ImmutableMap<Integer, Double> factorWeights(int residentId, int fiscalYear);

  /** Returns factor id to value in [0, 1] for the department's evaluation of the resident. */
  ImmutableMap<Integer, Double> adminEvaluations(int residentId, int fiscalYear);

  /** Returns the cached commute time, or empty when it was never looked up. */
  Optional<Double> commuteMinutes(int residentId, int hospitalId);

  /** Returns the factor catalog of the given type. */
  ImmutableList<EvaluationFactor> evaluationFactors(FactorType type);
}
