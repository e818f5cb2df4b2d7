package com.verlumen.placement.optimization;

/**
 * Defaults and bounds of the placement search: run sizes, operator probabilities, and the
 * convergence and progress-reporting settings of the driver loop.
 */
public final class GAConstants {
  public static final int DEFAULT_POPULATION_SIZE = 100;
  public static final int MIN_POPULATION_SIZE = 10;
  public static final int MAX_POPULATION_SIZE = 500;

  public static final int DEFAULT_GENERATIONS = 200;
  public static final int MIN_GENERATIONS = 50;
  public static final int MAX_GENERATIONS = 1000;

  public static final double DEFAULT_CROSSOVER_PROBABILITY = 0.7;
  public static final double DEFAULT_MUTATION_PROBABILITY = 0.2;

  public static final double DEFAULT_MISMATCH_BONUS = 1.5;
  public static final double MIN_MISMATCH_BONUS = 1.0;
  public static final double MAX_MISMATCH_BONUS = 5.0;

  public static final int TOURNAMENT_SIZE = 3;
  public static final double UNIFORM_CROSSOVER_INDPB = 0.5;
  public static final double RANDOM_MUTATION_INDPB = 0.05;
  public static final double CAPACITY_MUTATION_INDPB = 0.3;
  public static final double HOPE_MUTATION_INDPB = 0.2;

  /** Early stopping is only considered after this generation. */
  public static final int CONVERGENCE_MIN_GENERATION = 50;
  public static final double CONVERGENCE_TOLERANCE = 0.001;
  public static final int PROGRESS_INTERVAL = 10;

  private GAConstants() {}
}
