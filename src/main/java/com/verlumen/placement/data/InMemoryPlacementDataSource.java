package com.verlumen.placement.data;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.collect.ImmutableMap.toImmutableMap;

import com.google.common.collect.HashBasedTable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableTable;
import com.google.common.collect.Table;
import com.verlumen.placement.model.AdminEvaluation;
import com.verlumen.placement.model.CommuteEntry;
import com.verlumen.placement.model.EvaluationFactor;
import com.verlumen.placement.model.FactorType;
import com.verlumen.placement.model.FactorWeight;
import com.verlumen.placement.model.Hospital;
import com.verlumen.placement.model.HospitalChoice;
import com.verlumen.placement.model.Resident;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** A {@link PlacementDataSource} holding a fixed snapshot in memory. */
public final class InMemoryPlacementDataSource implements PlacementDataSource {
  private final ImmutableList<Resident> residents;
  private final ImmutableList<Hospital> hospitals;
  private final ImmutableList<EvaluationFactor> factors;
  private final ImmutableMap<ResidentYear, ImmutableSortedMap<Integer, Integer>> choices;
  private final ImmutableMap<ResidentYear, ImmutableMap<Integer, Double>> weights;
  private final ImmutableMap<ResidentYear, ImmutableMap<Integer, Double>> evaluations;
  private final ImmutableTable<Integer, Integer, Double> commuteMinutes;

  private InMemoryPlacementDataSource(Builder builder) {
    this.residents = ImmutableList.copyOf(builder.residents);
    this.hospitals = ImmutableList.copyOf(builder.hospitals);
    this.factors = ImmutableList.copyOf(builder.factors);
    this.choices =
        builder.choices.entrySet().stream()
            .collect(
                toImmutableMap(Map.Entry::getKey, e -> ImmutableSortedMap.copyOf(e.getValue())));
    this.weights =
        builder.weights.entrySet().stream()
            .collect(toImmutableMap(Map.Entry::getKey, e -> ImmutableMap.copyOf(e.getValue())));
    this.evaluations =
        builder.evaluations.entrySet().stream()
            .collect(toImmutableMap(Map.Entry::getKey, e -> ImmutableMap.copyOf(e.getValue())));
    this.commuteMinutes = ImmutableTable.copyOf(builder.commuteMinutes);
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public ImmutableList<Resident> residents() {
    return residents;
  }

  @Override
  public ImmutableList<Hospital> hospitals() {
    return hospitals;
  }

  @Override
  public ImmutableMap<Integer, Integer> hospitalChoices(int residentId, int fiscalYear) {
    return choices.getOrDefault(
        new ResidentYear(residentId, fiscalYear), ImmutableSortedMap.of());
  }

  @Override
  public ImmutableMap<Integer, Double> factorWeights(int residentId, int fiscalYear) {
    return weights.getOrDefault(new ResidentYear(residentId, fiscalYear), ImmutableMap.of());
  }

  @Override
  public ImmutableMap<Integer, Double> adminEvaluations(int residentId, int fiscalYear) {
    return evaluations.getOrDefault(new ResidentYear(residentId, fiscalYear), ImmutableMap.of());
  }

  @Override
  public Optional<Double> commuteMinutes(int residentId, int hospitalId) {
    return Optional.ofNullable(commuteMinutes.get(residentId, hospitalId));
  }

  @Override
  public ImmutableList<EvaluationFactor> evaluationFactors(FactorType type) {
    return factors.stream().filter(factor -> factor.type() == type).collect(toImmutableList());
  }

  private record ResidentYear(int residentId, int fiscalYear) {}

  /** Accumulates a snapshot, rejecting inconsistent preference data as it is added. */
  public static final class Builder {
    private final List<Resident> residents = new ArrayList<>();
    private final List<Hospital> hospitals = new ArrayList<>();
    private final List<EvaluationFactor> factors = new ArrayList<>();
    private final Map<ResidentYear, Map<Integer, Integer>> choices = new LinkedHashMap<>();
    private final Map<ResidentYear, Map<Integer, Double>> weights = new LinkedHashMap<>();
    private final Map<ResidentYear, Map<Integer, Double>> evaluations = new LinkedHashMap<>();
    private final Table<Integer, Integer, Double> commuteMinutes = HashBasedTable.create();

    private Builder() {}

    public Builder addResident(Resident resident) {
      residents.add(resident);
      return this;
    }

    public Builder addHospital(Hospital hospital) {
      hospitals.add(hospital);
      return this;
    }

    public Builder addFactor(EvaluationFactor factor) {
      factors.add(factor);
      return this;
    }

    /**
     * Adds a ranked choice.
     *
     * @throws IllegalArgumentException if the rank is taken or the hospital is already ranked
     *     for the same resident and year
     */
    public Builder addChoice(HospitalChoice choice) {
      Map<Integer, Integer> ranks =
          choices.computeIfAbsent(
              new ResidentYear(choice.residentId(), choice.fiscalYear()), key -> new HashMap<>());
      checkArgument(
          !ranks.containsKey(choice.rank()),
          "Resident %s already has a rank %s choice for %s",
          choice.residentId(),
          choice.rank(),
          choice.fiscalYear());
      checkArgument(
          !ranks.containsValue(choice.hospitalId()),
          "Resident %s already ranked hospital %s for %s",
          choice.residentId(),
          choice.hospitalId(),
          choice.fiscalYear());
      ranks.put(choice.rank(), choice.hospitalId());
      return this;
    }

    public Builder addWeight(FactorWeight weight) {
      weights
          .computeIfAbsent(
              new ResidentYear(weight.residentId(), weight.fiscalYear()),
              key -> new LinkedHashMap<>())
          .put(weight.factorId(), weight.weight());
      return this;
    }

    public Builder addEvaluation(AdminEvaluation evaluation) {
      evaluations
          .computeIfAbsent(
              new ResidentYear(evaluation.residentId(), evaluation.fiscalYear()),
              key -> new LinkedHashMap<>())
          .put(evaluation.factorId(), evaluation.value());
      return this;
    }

    public Builder addCommute(CommuteEntry entry) {
      commuteMinutes.put(entry.residentId(), entry.hospitalId(), entry.minutes());
      return this;
    }

    public InMemoryPlacementDataSource build() {
      return new InMemoryPlacementDataSource(this);
    }
  }
}
