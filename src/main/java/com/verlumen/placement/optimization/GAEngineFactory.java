package com.verlumen.placement.optimization;

import com.verlumen.placement.fitness.FitnessContext;
import io.jenetics.IntegerGene;
import io.jenetics.engine.Engine;

/**
 * Defines the contract for creating genetic algorithm engines.
 */
interface GAEngineFactory {
  /**
   * Creates a genetic algorithm engine for one run.
   *
   * @param context the snapshot candidates are scored against
   * @param config population size, probabilities and operator set of the run
   * @return a configured, single-threaded GA engine
   */
  Engine<IntegerGene, Double> createEngine(FitnessContext context, OptimizationConfig config);
}
