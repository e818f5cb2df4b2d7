package com.verlumen.placement.optimization;

/**
 * Receives progress of a running optimization: once for the initial population and then every
 * {@link GAConstants#PROGRESS_INTERVAL} generations.
 *
 * <p>Called on the optimizing thread. Exceptions thrown by a listener are logged and ignored.
 */
@FunctionalInterface
public interface ProgressListener {
  ProgressListener NONE = (generation, bestFitness) -> {};

  void onProgress(int generation, double bestFitness);
}
