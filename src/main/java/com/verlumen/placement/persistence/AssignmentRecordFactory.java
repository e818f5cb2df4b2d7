package com.verlumen.placement.persistence;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.verlumen.placement.fitness.FitnessContext;
import com.verlumen.placement.optimization.OptimizationResult;
import com.verlumen.placement.optimization.ResidentAssignment;
import java.time.LocalDate;
import java.time.Month;

/** Turns an optimization result into the records handed to an {@link AssignmentRepository}. */
public final class AssignmentRecordFactory {
  private AssignmentRecordFactory() {}

  public static ImmutableList<AssignmentRecord> create(
      OptimizationResult result, FitnessContext context) {
    return result.assignments().stream()
        .map(assignment -> create(assignment, context))
        .collect(toImmutableList());
  }

  static AssignmentRecord create(ResidentAssignment assignment, FitnessContext context) {
    int fiscalYear = context.fiscalYear();
    boolean mismatch = assignment.isMismatch();
    return new AssignmentRecord(
        assignment.residentId(),
        assignment.hospitalId(),
        fiscalYear,
        fiscalYearStart(fiscalYear),
        fiscalYearEnd(fiscalYear),
        mismatch,
        mismatch ? MismatchReason.NO_PREFERENCE : null,
        assignment.fitness(),
        mismatch ? null : assignment.hopeRank(),
        context
            .commuteMinutes(assignment.residentId(), assignment.hospitalId())
            .filter(minutes -> minutes > 0)
            .map(minutes -> (int) Math.round(minutes))
            .orElse(null));
  }

  /** April 1 of the fiscal year. */
  public static LocalDate fiscalYearStart(int fiscalYear) {
    return LocalDate.of(fiscalYear, Month.APRIL, 1);
  }

  /** March 31 of the following year. */
  public static LocalDate fiscalYearEnd(int fiscalYear) {
    return LocalDate.of(fiscalYear + 1, Month.MARCH, 31);
  }
}
