package com.verlumen.placement.config;

import static com.google.common.base.Preconditions.checkArgument;

import com.verlumen.placement.optimization.GAConstants;
import java.util.Arrays;
import java.util.Optional;

/** The optimizer settings kept in the system configuration, with their defaults and ranges. */
public enum SettingKey {
  GA_POPULATION_SIZE(
      "ga_population_size",
      true,
      GAConstants.DEFAULT_POPULATION_SIZE,
      GAConstants.MIN_POPULATION_SIZE,
      GAConstants.MAX_POPULATION_SIZE),
  GA_GENERATIONS(
      "ga_generations",
      true,
      GAConstants.DEFAULT_GENERATIONS,
      GAConstants.MIN_GENERATIONS,
      GAConstants.MAX_GENERATIONS),
  GA_CROSSOVER_PROB("ga_crossover_prob", false, GAConstants.DEFAULT_CROSSOVER_PROBABILITY, 0, 1),
  GA_MUTATION_PROB("ga_mutation_prob", false, GAConstants.DEFAULT_MUTATION_PROBABILITY, 0, 1),
  GA_MISMATCH_BONUS(
      "ga_mismatch_bonus",
      false,
      GAConstants.DEFAULT_MISMATCH_BONUS,
      GAConstants.MIN_MISMATCH_BONUS,
      GAConstants.MAX_MISMATCH_BONUS),
  FISCAL_YEAR("fiscal_year", true, 2025, 2000, 2100);

  private final String key;
  private final boolean integral;
  private final double defaultValue;
  private final double min;
  private final double max;

  SettingKey(String key, boolean integral, double defaultValue, double min, double max) {
    this.key = key;
    this.integral = integral;
    this.defaultValue = defaultValue;
    this.min = min;
    this.max = max;
  }

  public String key() {
    return key;
  }

  public boolean isIntegral() {
    return integral;
  }

  public double defaultValue() {
    return defaultValue;
  }

  public double min() {
    return min;
  }

  public double max() {
    return max;
  }

  public static Optional<SettingKey> fromKey(String key) {
    return Arrays.stream(values()).filter(setting -> setting.key.equals(key)).findFirst();
  }

  /**
   * Parses a raw value without range checks.
   *
   * @throws NumberFormatException if the value is not a number of the setting's kind
   */
  double parse(String raw) {
    String value = raw.trim();
    return integral ? Integer.parseInt(value) : Double.parseDouble(value);
  }

  /**
   * Rejects values outside the setting's range.
   *
   * @throws IllegalArgumentException if the value is out of range
   */
  void checkRange(double value) {
    checkArgument(
        value >= min && value <= max,
        "%s must be between %s and %s: %s",
        key,
        format(min),
        format(max),
        format(value));
  }

  private String format(double value) {
    return integral ? Long.toString((long) value) : Double.toString(value);
  }
}
