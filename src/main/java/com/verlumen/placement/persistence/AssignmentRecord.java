package com.verlumen.placement.persistence;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.time.LocalDate;

/**
 * A saved placement of one resident for one fiscal year.
 *
 * @param mismatchReason set only when {@code mismatch} is true
 * @param hopeRank the rank at which the resident chose the hospital; {@code null} when it was not
 *     a choice
 * @param commuteMinutes rounded commute time; {@code null} when unknown
 */
public record AssignmentRecord(
    int residentId,
    int hospitalId,
    int fiscalYear,
    LocalDate startDate,
    LocalDate endDate,
    boolean mismatch,
    MismatchReason mismatchReason,
    double fitnessScore,
    Integer hopeRank,
    Integer commuteMinutes) {
  public AssignmentRecord {
    checkNotNull(startDate, "startDate");
    checkNotNull(endDate, "endDate");
    checkArgument(!endDate.isBefore(startDate), "End date %s precedes %s", endDate, startDate);
    checkArgument(
        mismatch == (mismatchReason != null),
        "Mismatch reason must be set exactly when mismatched: %s",
        mismatchReason);
  }
}
