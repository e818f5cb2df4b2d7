package com.verlumen.placement.optimization;

import com.verlumen.placement.fitness.FitnessContext;

/**
 * Evolves an assignment of residents to hospitals for one fiscal year.
 *
 * <p>An optimizer moves through {@link State#UNINITIALIZED}, {@link State#DATA_LOADED},
 * {@link State#EVOLVING} and {@link State#COMPLETED}. {@link #loadData()} must succeed before
 * {@link #optimize}. Instances are not thread-safe, but separate instances share no state and
 * may run in parallel.
 */
public interface PlacementOptimizer {
  /** Lifecycle of an optimizer. */
  enum State {
    UNINITIALIZED,
    DATA_LOADED,
    EVOLVING,
    COMPLETED
  }

  /**
   * Builds the fitness snapshot for the configured fiscal year.
   *
   * @return {@code false} if there are no residents or no hospitals to place
   * @throws IllegalStateException if a resident or hospital id appears twice
   */
  boolean loadData();

  /**
   * Runs the generation loop to the configured limit, convergence or cancellation.
   *
   * @throws IllegalStateException if data has not been loaded
   */
  OptimizationResult optimize(ProgressListener listener, CancellationSignal cancellation);

  default OptimizationResult optimize() {
    return optimize(ProgressListener.NONE, CancellationSignal.NEVER);
  }

  State state();

  /**
   * Returns the loaded snapshot.
   *
   * @throws IllegalStateException if data has not been loaded
   */
  FitnessContext context();

  int fiscalYear();

  interface Factory {
    PlacementOptimizer create(int fiscalYear, OptimizationConfig config);
  }
}
