package com.verlumen.placement.fitness;

/** Builds the read-only scoring snapshot for one optimization run. */
public interface FitnessContextFactory {
  /**
   * Creates a snapshot of the current placement data for a fiscal year.
   *
   * @param fiscalYear the year whose choices, weights and evaluations are read
   * @param mismatchBonus configured mismatch bonus, carried on the snapshot
   * @return an immutable context
   * @throws IllegalArgumentException if the resident or hospital list is empty
   * @throws IllegalStateException if a resident or hospital id appears twice
   */
  FitnessContext create(int fiscalYear, double mismatchBonus);
}
