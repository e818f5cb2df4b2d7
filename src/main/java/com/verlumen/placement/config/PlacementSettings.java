package com.verlumen.placement.config;

import com.verlumen.placement.optimization.GAConstants;
import com.verlumen.placement.optimization.OptimizationConfig;

/** Optimizer settings as stored in the system configuration. */
public record PlacementSettings(
    int populationSize,
    int generations,
    double crossoverProbability,
    double mutationProbability,
    double mismatchBonus,
    int fiscalYear) {

  public static PlacementSettings defaults() {
    return new PlacementSettings(
        GAConstants.DEFAULT_POPULATION_SIZE,
        GAConstants.DEFAULT_GENERATIONS,
        GAConstants.DEFAULT_CROSSOVER_PROBABILITY,
        GAConstants.DEFAULT_MUTATION_PROBABILITY,
        GAConstants.DEFAULT_MISMATCH_BONUS,
        (int) SettingKey.FISCAL_YEAR.defaultValue());
  }

  /**
   * Parses and range-checks a raw setting value.
   *
   * @throws IllegalArgumentException if the value is not a number or is out of range
   */
  public static double validate(SettingKey key, String rawValue) {
    double value;
    try {
      value = key.parse(rawValue);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          String.format("Invalid value for %s: %s", key.key(), rawValue), e);
    }
    key.checkRange(value);
    return value;
  }

  /**
   * Returns a copy with one setting replaced.
   *
   * @throws IllegalArgumentException if the value is not a number or is out of range
   */
  public PlacementSettings with(SettingKey key, String rawValue) {
    return with(key, validate(key, rawValue));
  }

  PlacementSettings with(SettingKey key, double value) {
    key.checkRange(value);
    switch (key) {
      case GA_POPULATION_SIZE:
        return new PlacementSettings(
            (int) value,
            generations,
            crossoverProbability,
            mutationProbability,
            mismatchBonus,
            fiscalYear);
      case GA_GENERATIONS:
        return new PlacementSettings(
            populationSize,
            (int) value,
            crossoverProbability,
            mutationProbability,
            mismatchBonus,
            fiscalYear);
      case GA_CROSSOVER_PROB:
        return new PlacementSettings(
            populationSize, generations, value, mutationProbability, mismatchBonus, fiscalYear);
      case GA_MUTATION_PROB:
        return new PlacementSettings(
            populationSize, generations, crossoverProbability, value, mismatchBonus, fiscalYear);
      case GA_MISMATCH_BONUS:
        return new PlacementSettings(
            populationSize,
            generations,
            crossoverProbability,
            mutationProbability,
            value,
            fiscalYear);
      case FISCAL_YEAR:
        return new PlacementSettings(
            populationSize,
            generations,
            crossoverProbability,
            mutationProbability,
            mismatchBonus,
            (int) value);
      default:
        throw new AssertionError("Unhandled setting: " + key);
    }
  }

  /**
   * Builds the run configuration.
   *
   * @throws IllegalArgumentException if a value is outside its production range
   */
  public OptimizationConfig toOptimizationConfig() {
    return OptimizationConfig.create(
        populationSize, generations, crossoverProbability, mutationProbability, mismatchBonus);
  }
}
