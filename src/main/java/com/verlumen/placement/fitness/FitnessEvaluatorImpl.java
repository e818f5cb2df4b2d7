package com.verlumen.placement.fitness;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableMap;
import com.google.inject.Inject;
import com.verlumen.placement.model.Candidate;
import com.verlumen.placement.model.EvaluationFactor;
import com.verlumen.placement.model.Hospital;
import java.util.HashMap;
import java.util.Map;

/**
 * Weighted sum of hope, preference and admin terms per resident, minus a capacity penalty,
 * averaged over residents.
 */
final class FitnessEvaluatorImpl implements FitnessEvaluator {
  static final double HOPE_WEIGHT = 0.4;
  static final double PREFERENCE_WEIGHT = 0.3;
  static final double ADMIN_WEIGHT = 0.3;
  static final double HOPE_RANK_STEP = 0.33;
  static final double PENALTY_PER_EXCESS = 0.5;
  static final double NEUTRAL_SCORE = 0.5;
  static final double SALARY_REFERENCE = 10_000_000;
  static final double COMMUTE_REFERENCE_MINUTES = 120;
  static final double DEFAULT_COMMUTE_MINUTES = 60;
  static final double CASELOAD_REFERENCE = 20;

  @Inject
  FitnessEvaluatorImpl() {}

  @Override
  public double score(Candidate candidate, FitnessContext context) {
    int residentCount = context.residentCount();
    if (residentCount == 0) {
      return 0.0;
    }
    checkArgument(
        candidate.size() == residentCount,
        "Candidate has %s genes for %s residents",
        candidate.size(),
        residentCount);

    Map<Integer, Integer> assignedCounts = new HashMap<>();
    double total = 0.0;
    for (int i = 0; i < residentCount; i++) {
      int residentId = context.residents().get(i).id();
      Hospital hospital = context.hospitalAt(candidate.gene(i));
      assignedCounts.merge(hospital.id(), 1, Integer::sum);

      total +=
          hopeScore(residentId, hospital.id(), context) * HOPE_WEIGHT
              + preferenceScore(residentId, hospital, context) * PREFERENCE_WEIGHT
              + adminScore(residentId, context) * ADMIN_WEIGHT;
    }
    total -= capacityPenalty(assignedCounts, context);
    return Math.max(0.0, total / residentCount);
  }

  /** 1.0 for the first choice, 0.67 for the second, 0.34 for the third, 0 otherwise. */
  @VisibleForTesting
  static double hopeScore(int residentId, int hospitalId, FitnessContext context) {
    int rank = context.hopeRank(residentId, hospitalId);
    return rank == 0 ? 0.0 : 1.0 - (rank - 1) * HOPE_RANK_STEP;
  }

  @VisibleForTesting
  static double preferenceScore(int residentId, Hospital hospital, FitnessContext context) {
    ImmutableMap<Integer, Double> weights = context.weightsOf(residentId);
    if (weights.isEmpty()) {
      return NEUTRAL_SCORE;
    }
    double totalWeight = weights.values().stream().mapToDouble(Double::doubleValue).sum();
    if (totalWeight == 0) {
      return NEUTRAL_SCORE;
    }

    double weighted = 0.0;
    for (EvaluationFactor factor : context.staffFactors()) {
      double weight = weights.getOrDefault(factor.id(), 0.0);
      if (weight == 0) {
        continue;
      }
      weighted += factorScore(factor, residentId, hospital, context) * (weight / totalWeight);
    }
    return weighted;
  }

  @VisibleForTesting
  static double factorScore(
      EvaluationFactor factor, int residentId, Hospital hospital, FitnessContext context) {
    switch (factor.effectiveKind()) {
      case SALARY:
        double salary = hospital.annualSalary();
        return salary > 0 ? Math.min(1.0, salary / SALARY_REFERENCE) : NEUTRAL_SCORE;
      case COMMUTE:
        double minutes =
            context.commuteMinutes(residentId, hospital.id()).orElse(DEFAULT_COMMUTE_MINUTES);
        return minutes > 0
            ? Math.max(0.0, 1.0 - minutes / COMMUTE_REFERENCE_MINUTES)
            : NEUTRAL_SCORE;
      case CASELOAD:
        int capacity = hospital.totalCapacity();
        return capacity > 0 ? Math.min(1.0, capacity / CASELOAD_REFERENCE) : NEUTRAL_SCORE;
      default:
        return NEUTRAL_SCORE;
    }
  }

  /** Mean of the resident's admin evaluations, neutral when there are none. */
  @VisibleForTesting
  static double adminScore(int residentId, FitnessContext context) {
    return context.evaluationsOf(residentId).values().stream()
        .mapToDouble(Double::doubleValue)
        .average()
        .orElse(NEUTRAL_SCORE);
  }

  @VisibleForTesting
  static double capacityPenalty(Map<Integer, Integer> assignedCounts, FitnessContext context) {
    double penalty = 0.0;
    for (Map.Entry<Integer, Integer> entry : assignedCounts.entrySet()) {
      int excess = entry.getValue() - context.capacityOf(entry.getKey());
      if (excess > 0) {
        penalty += excess * PENALTY_PER_EXCESS;
      }
    }
    return penalty;
  }
}
