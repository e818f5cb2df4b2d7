package com.verlumen.placement.fitness;

import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkState;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableBiMap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableTable;
import com.verlumen.placement.model.EvaluationFactor;
import com.verlumen.placement.model.Hospital;
import com.verlumen.placement.model.Resident;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only snapshot of everything the fitness function needs for one run.
 *
 * <p>Residents and hospitals are addressed by index inside a candidate and by id everywhere else;
 * {@link #residentIndex()} and {@link #hospitalIndex()} map ids to indexes and are fixed for the
 * lifetime of the snapshot.
 */
@AutoValue
public abstract class FitnessContext {
  public abstract int fiscalYear();

  public abstract ImmutableList<Resident> residents();

  public abstract ImmutableList<Hospital> hospitals();

  /** Resident id to position in {@link #residents()}. */
  public abstract ImmutableBiMap<Integer, Integer> residentIndex();

  /** Hospital id to position in {@link #hospitals()}. */
  public abstract ImmutableBiMap<Integer, Integer> hospitalIndex();

  /** Resident id to (rank to hospital id), ranks iterating in ascending order. */
  public abstract ImmutableMap<Integer, ImmutableMap<Integer, Integer>> hospitalChoices();

  /** Resident id to (staff-preference factor id to weight). */
  public abstract ImmutableMap<Integer, ImmutableMap<Integer, Double>> staffWeights();

  /** Resident id to (admin-evaluation factor id to value). */
  public abstract ImmutableMap<Integer, ImmutableMap<Integer, Double>> adminEvaluations();

  /** Sparse commute minutes keyed by (resident id, hospital id). */
  public abstract ImmutableTable<Integer, Integer, Double> commuteTable();

  /** Staff-preference catalog with every kind resolved. */
  public abstract ImmutableList<EvaluationFactor> staffFactors();

  public abstract ImmutableList<EvaluationFactor> adminFactors();

  /** Hospital id to resident capacity. */
  public abstract ImmutableMap<Integer, Integer> hospitalCapacities();

  /** Configured mismatch bonus. Carried for reporting, not part of the score. */
  public abstract double mismatchBonus();

  public static Builder builder() {
    return new AutoValue_FitnessContext.Builder()
        .setHospitalChoices(ImmutableMap.of())
        .setStaffWeights(ImmutableMap.of())
        .setAdminEvaluations(ImmutableMap.of())
        .setCommuteTable(ImmutableTable.of())
        .setStaffFactors(ImmutableList.of())
        .setAdminFactors(ImmutableList.of())
        .setMismatchBonus(0.0);
  }

  public abstract Builder toBuilder();

  public int residentCount() {
    return residents().size();
  }

  public int hospitalCount() {
    return hospitals().size();
  }

  /**
   * Returns the hospital at a candidate gene value.
   *
   * @throws IndexOutOfBoundsException if the index is not a valid hospital index, which means a
   *     candidate was corrupted
   */
  public Hospital hospitalAt(int hospitalIndex) {
    checkElementIndex(hospitalIndex, hospitals().size(), "hospital index");
    return hospitals().get(hospitalIndex);
  }

  public ImmutableMap<Integer, Integer> choicesOf(int residentId) {
    return hospitalChoices().getOrDefault(residentId, ImmutableMap.of());
  }

  public ImmutableMap<Integer, Double> weightsOf(int residentId) {
    return staffWeights().getOrDefault(residentId, ImmutableMap.of());
  }

  public ImmutableMap<Integer, Double> evaluationsOf(int residentId) {
    return adminEvaluations().getOrDefault(residentId, ImmutableMap.of());
  }

  public Optional<Double> commuteMinutes(int residentId, int hospitalId) {
    return Optional.ofNullable(commuteTable().get(residentId, hospitalId));
  }

  /** Returns the hospital's resident capacity, zero if none was recorded. */
  public int capacityOf(int hospitalId) {
    return hospitalCapacities().getOrDefault(hospitalId, 0);
  }

  /** Returns the rank (1 to 3) at which the resident chose the hospital, or 0 if not chosen. */
  public int hopeRank(int residentId, int hospitalId) {
    for (Map.Entry<Integer, Integer> choice : choicesOf(residentId).entrySet()) {
      if (choice.getValue() == hospitalId) {
        return choice.getKey();
      }
    }
    return 0;
  }

  /** Returns the indexes of the hospitals the resident chose, in rank order. */
  public ImmutableList<Integer> choiceIndexesOf(int residentId) {
    return choicesOf(residentId).values().stream()
        .filter(hospitalIndex()::containsKey)
        .map(hospitalIndex()::get)
        .collect(toImmutableList());
  }

  /**
   * Returns a snapshot containing only the resident at {@code residentIndex}, at index 0. Hospitals,
   * capacities and catalogs are unchanged, so scoring a one-gene candidate against it gives that
   * resident's individual fitness.
   */
  public FitnessContext narrowedTo(int residentIndex) {
    Resident resident = residents().get(residentIndex);
    int id = resident.id();
    return toBuilder()
        .setResidents(ImmutableList.of(resident))
        .setResidentIndex(ImmutableBiMap.of(id, 0))
        .setHospitalChoices(ImmutableMap.of(id, choicesOf(id)))
        .setStaffWeights(ImmutableMap.of(id, weightsOf(id)))
        .setAdminEvaluations(ImmutableMap.of(id, evaluationsOf(id)))
        .build();
  }

  /** Builder for {@link FitnessContext}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setFiscalYear(int fiscalYear);

    public abstract Builder setResidents(ImmutableList<Resident> residents);

    public abstract Builder setHospitals(ImmutableList<Hospital> hospitals);

    public abstract Builder setResidentIndex(ImmutableBiMap<Integer, Integer> residentIndex);

    public abstract Builder setHospitalIndex(ImmutableBiMap<Integer, Integer> hospitalIndex);

    public abstract Builder setHospitalChoices(
        ImmutableMap<Integer, ImmutableMap<Integer, Integer>> hospitalChoices);

    public abstract Builder setStaffWeights(
        ImmutableMap<Integer, ImmutableMap<Integer, Double>> staffWeights);

    public abstract Builder setAdminEvaluations(
        ImmutableMap<Integer, ImmutableMap<Integer, Double>> adminEvaluations);

    public abstract Builder setCommuteTable(ImmutableTable<Integer, Integer, Double> commuteTable);

    public abstract Builder setStaffFactors(ImmutableList<EvaluationFactor> staffFactors);

    public abstract Builder setAdminFactors(ImmutableList<EvaluationFactor> adminFactors);

    public abstract Builder setHospitalCapacities(ImmutableMap<Integer, Integer> hospitalCapacities);

    public abstract Builder setMismatchBonus(double mismatchBonus);

    abstract FitnessContext autoBuild();

    public FitnessContext build() {
      FitnessContext context = autoBuild();
      checkState(
          context.residentIndex().size() == context.residents().size(),
          "Resident index covers %s of %s residents",
          context.residentIndex().size(),
          context.residents().size());
      checkState(
          context.hospitalIndex().size() == context.hospitals().size(),
          "Hospital index covers %s of %s hospitals",
          context.hospitalIndex().size(),
          context.hospitals().size());
      return context;
    }
  }
}
