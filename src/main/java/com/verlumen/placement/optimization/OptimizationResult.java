package com.verlumen.placement.optimization;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.verlumen.placement.model.Candidate;

/**
 * Outcome of one optimization run.
 *
 * @param best the best candidate seen in any generation, with its fitness
 * @param generations the number of generations evolved after the initial population
 * @param assignments one entry per resident, in roster order
 * @param statistics per-generation statistics, starting with the initial population
 */
public record OptimizationResult(
    Candidate best,
    double bestFitness,
    int generations,
    ImmutableList<ResidentAssignment> assignments,
    ImmutableList<GenerationStats> statistics,
    TerminationReason terminationReason) {
  public OptimizationResult {
    checkNotNull(best, "best");
    checkNotNull(assignments, "assignments");
    checkNotNull(statistics, "statistics");
    checkNotNull(terminationReason, "terminationReason");
  }

  public boolean converged() {
    return terminationReason == TerminationReason.CONVERGED;
  }

  public boolean cancelled() {
    return terminationReason == TerminationReason.CANCELLED;
  }

  public long mismatchCount() {
    return assignments.stream().filter(ResidentAssignment::isMismatch).count();
  }
}
