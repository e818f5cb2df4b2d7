package com.verlumen.placement.optimization;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.annotations.VisibleForTesting;
import java.util.OptionalLong;

/**
 * Validated settings of one optimization run.
 *
 * <p>{@link #create} enforces the production ranges; a configuration that fails them never
 * reaches the engine.
 *
 * @param mismatchBonus carried through to the fitness context; the score does not use it
 * @param seed when present, every random draw of the run is reproducible
 */
public record OptimizationConfig(
    int populationSize,
    int generations,
    double crossoverProbability,
    double mutationProbability,
    double mismatchBonus,
    OptionalLong seed,
    OperatorConfig operators) {
  public OptimizationConfig {
    checkArgument(populationSize > 0, "Population size must be positive: %s", populationSize);
    checkArgument(generations > 0, "Generations must be positive: %s", generations);
    OperatorConfig.checkProbability("crossoverProbability", crossoverProbability);
    OperatorConfig.checkProbability("mutationProbability", mutationProbability);
    checkNotNull(seed, "seed");
    checkNotNull(operators, "operators");
  }

  /**
   * Creates a configuration within the production ranges.
   *
   * @throws IllegalArgumentException if any value is outside its documented range
   */
  public static OptimizationConfig create(
      int populationSize,
      int generations,
      double crossoverProbability,
      double mutationProbability,
      double mismatchBonus) {
    checkArgument(
        populationSize >= GAConstants.MIN_POPULATION_SIZE
            && populationSize <= GAConstants.MAX_POPULATION_SIZE,
        "Population size must be between %s and %s: %s",
        GAConstants.MIN_POPULATION_SIZE,
        GAConstants.MAX_POPULATION_SIZE,
        populationSize);
    checkArgument(
        generations >= GAConstants.MIN_GENERATIONS && generations <= GAConstants.MAX_GENERATIONS,
        "Generations must be between %s and %s: %s",
        GAConstants.MIN_GENERATIONS,
        GAConstants.MAX_GENERATIONS,
        generations);
    checkArgument(
        mismatchBonus >= GAConstants.MIN_MISMATCH_BONUS
            && mismatchBonus <= GAConstants.MAX_MISMATCH_BONUS,
        "Mismatch bonus must be between %s and %s: %s",
        GAConstants.MIN_MISMATCH_BONUS,
        GAConstants.MAX_MISMATCH_BONUS,
        mismatchBonus);
    return new OptimizationConfig(
        populationSize,
        generations,
        crossoverProbability,
        mutationProbability,
        mismatchBonus,
        OptionalLong.empty(),
        OperatorConfig.defaults());
  }

  public static OptimizationConfig defaults() {
    return create(
        GAConstants.DEFAULT_POPULATION_SIZE,
        GAConstants.DEFAULT_GENERATIONS,
        GAConstants.DEFAULT_CROSSOVER_PROBABILITY,
        GAConstants.DEFAULT_MUTATION_PROBABILITY,
        GAConstants.DEFAULT_MISMATCH_BONUS);
  }

  /** Skips the production range checks so small runs stay fast. */
  @VisibleForTesting
  public static OptimizationConfig forTesting(
      int populationSize, int generations, double crossoverProbability, double mutationProbability) {
    return new OptimizationConfig(
        populationSize,
        generations,
        crossoverProbability,
        mutationProbability,
        GAConstants.DEFAULT_MISMATCH_BONUS,
        OptionalLong.empty(),
        OperatorConfig.defaults());
  }

  public OptimizationConfig withSeed(long value) {
    return new OptimizationConfig(
        populationSize,
        generations,
        crossoverProbability,
        mutationProbability,
        mismatchBonus,
        OptionalLong.of(value),
        operators);
  }

  public OptimizationConfig withOperators(OperatorConfig value) {
    return new OptimizationConfig(
        populationSize,
        generations,
        crossoverProbability,
        mutationProbability,
        mismatchBonus,
        seed,
        value);
  }
}
