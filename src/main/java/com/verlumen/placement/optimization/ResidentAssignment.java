package com.verlumen.placement.optimization;

/**
 * Where one resident ended up in the best assignment.
 *
 * @param hopeRank rank at which the resident chose the hospital, 0 if it was not a choice
 * @param fitness the resident's fitness scored on their own
 */
public record ResidentAssignment(int residentId, int hospitalId, int hopeRank, double fitness) {
  public boolean isMismatch() {
    return hopeRank == 0;
  }
}
