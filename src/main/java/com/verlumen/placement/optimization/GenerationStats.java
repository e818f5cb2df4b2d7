package com.verlumen.placement.optimization;

import java.util.DoubleSummaryStatistics;
import java.util.stream.DoubleStream;

/** Fitness statistics of one generation's population. */
public record GenerationStats(int generation, double average, double min, double max) {
  static GenerationStats of(int generation, DoubleStream fitnesses) {
    DoubleSummaryStatistics summary = fitnesses.summaryStatistics();
    if (summary.getCount() == 0) {
      return new GenerationStats(generation, 0.0, 0.0, 0.0);
    }
    return new GenerationStats(
        generation, summary.getAverage(), summary.getMin(), summary.getMax());
  }

  /** True when the best candidate is no better than the average, within {@code tolerance}. */
  boolean isConverged(double tolerance) {
    return Math.abs(max - average) < tolerance;
  }
}
