package com.verlumen.placement.fitness;

import com.verlumen.placement.model.Candidate;

/** Scores a complete assignment against a fitness snapshot. */
public interface FitnessEvaluator {
  /**
   * Computes the fitness of a candidate. Deterministic: the same candidate and context always
   * yield the same value.
   *
   * @param candidate one hospital index per resident of {@code context}
   * @param context the snapshot the candidate was built for
   * @return a non-negative score, 0 when the context has no residents
   * @throws IndexOutOfBoundsException if a gene is not a valid hospital index
   */
  double score(Candidate candidate, FitnessContext context);
}
