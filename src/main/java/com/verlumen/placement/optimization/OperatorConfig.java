package com.verlumen.placement.optimization;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The genetic operators of one run and their per-call probabilities.
 *
 * @param swapMutationIndpb probability of the trailing swap mutation; 0 leaves it out of the chain
 */
public record OperatorConfig(
    int tournamentSize,
    CrossoverStrategy crossoverStrategy,
    double uniformCrossoverIndpb,
    double randomMutationIndpb,
    double capacityMutationIndpb,
    double hopeMutationIndpb,
    double swapMutationIndpb) {
  public OperatorConfig {
    checkArgument(tournamentSize >= 2, "Tournament size must be at least 2: %s", tournamentSize);
    checkNotNull(crossoverStrategy, "crossoverStrategy");
    checkProbability("uniformCrossoverIndpb", uniformCrossoverIndpb);
    checkProbability("randomMutationIndpb", randomMutationIndpb);
    checkProbability("capacityMutationIndpb", capacityMutationIndpb);
    checkProbability("hopeMutationIndpb", hopeMutationIndpb);
    checkProbability("swapMutationIndpb", swapMutationIndpb);
  }

  public static OperatorConfig defaults() {
    return new OperatorConfig(
        GAConstants.TOURNAMENT_SIZE,
        CrossoverStrategy.TWO_POINT,
        GAConstants.UNIFORM_CROSSOVER_INDPB,
        GAConstants.RANDOM_MUTATION_INDPB,
        GAConstants.CAPACITY_MUTATION_INDPB,
        GAConstants.HOPE_MUTATION_INDPB,
        0.0);
  }

  public OperatorConfig withCrossoverStrategy(CrossoverStrategy strategy) {
    return new OperatorConfig(
        tournamentSize,
        strategy,
        uniformCrossoverIndpb,
        randomMutationIndpb,
        capacityMutationIndpb,
        hopeMutationIndpb,
        swapMutationIndpb);
  }

  public OperatorConfig withSwapMutationIndpb(double indpb) {
    return new OperatorConfig(
        tournamentSize,
        crossoverStrategy,
        uniformCrossoverIndpb,
        randomMutationIndpb,
        capacityMutationIndpb,
        hopeMutationIndpb,
        indpb);
  }

  static void checkProbability(String name, double value) {
    checkArgument(value >= 0.0 && value <= 1.0, "%s must be within [0, 1]: %s", name, value);
  }
}
