package com.verlumen.placement.fitness;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableBiMap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableTable;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.placement.data.PlacementDataSource;
import com.verlumen.placement.model.EvaluationFactor;
import com.verlumen.placement.model.FactorType;
import com.verlumen.placement.model.Hospital;
import com.verlumen.placement.model.Resident;
import java.util.HashSet;
import java.util.Set;

final class FitnessContextFactoryImpl implements FitnessContextFactory {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final PlacementDataSource dataSource;

  @Inject
  FitnessContextFactoryImpl(PlacementDataSource dataSource) {
    this.dataSource = dataSource;
  }

  @Override
  public FitnessContext create(int fiscalYear, double mismatchBonus) {
    ImmutableList<Resident> residents = dataSource.residents();
    ImmutableList<Hospital> hospitals = dataSource.hospitals();
    checkArgument(!residents.isEmpty(), "Resident list cannot be empty");
    checkArgument(!hospitals.isEmpty(), "Hospital list cannot be empty");
    checkUniqueIds(residents.stream().map(Resident::id).collect(toImmutableList()), "resident");
    checkUniqueIds(hospitals.stream().map(Hospital::id).collect(toImmutableList()), "hospital");

    ImmutableBiMap.Builder<Integer, Integer> residentIndex = ImmutableBiMap.builder();
    ImmutableMap.Builder<Integer, ImmutableMap<Integer, Integer>> choices = ImmutableMap.builder();
    ImmutableMap.Builder<Integer, ImmutableMap<Integer, Double>> weights = ImmutableMap.builder();
    ImmutableMap.Builder<Integer, ImmutableMap<Integer, Double>> evaluations =
        ImmutableMap.builder();
    ImmutableTable.Builder<Integer, Integer, Double> commute = ImmutableTable.builder();
    for (int i = 0; i < residents.size(); i++) {
      int residentId = residents.get(i).id();
      residentIndex.put(residentId, i);
      choices.put(residentId, dataSource.hospitalChoices(residentId, fiscalYear));
      weights.put(residentId, dataSource.factorWeights(residentId, fiscalYear));
      evaluations.put(residentId, dataSource.adminEvaluations(residentId, fiscalYear));
      for (Hospital hospital : hospitals) {
        dataSource
            .commuteMinutes(residentId, hospital.id())
            .ifPresent(minutes -> commute.put(residentId, hospital.id(), minutes));
      }
    }

    ImmutableBiMap.Builder<Integer, Integer> hospitalIndex = ImmutableBiMap.builder();
    ImmutableMap.Builder<Integer, Integer> capacities = ImmutableMap.builder();
    for (int i = 0; i < hospitals.size(); i++) {
      Hospital hospital = hospitals.get(i);
      hospitalIndex.put(hospital.id(), i);
      capacities.put(hospital.id(), hospital.residentCapacity());
    }

    FitnessContext context =
        FitnessContext.builder()
            .setFiscalYear(fiscalYear)
            .setResidents(residents)
            .setHospitals(hospitals)
            .setResidentIndex(residentIndex.buildOrThrow())
            .setHospitalIndex(hospitalIndex.buildOrThrow())
            .setHospitalChoices(choices.buildOrThrow())
            .setStaffWeights(weights.buildOrThrow())
            .setAdminEvaluations(evaluations.buildOrThrow())
            .setCommuteTable(commute.build())
            .setStaffFactors(resolveKinds(dataSource.evaluationFactors(FactorType.STAFF_PREFERENCE)))
            .setAdminFactors(dataSource.evaluationFactors(FactorType.ADMIN_EVALUATION))
            .setHospitalCapacities(capacities.buildOrThrow())
            .setMismatchBonus(mismatchBonus)
            .build();
    logger.atInfo().log(
        "Built fitness context for %d: %d residents, %d hospitals, %d commute entries",
        fiscalYear, residents.size(), hospitals.size(), context.commuteTable().size());
    return context;
  }

  /** Duplicate ids are malformed data, reported as IllegalStateException. */
  private static void checkUniqueIds(ImmutableList<Integer> ids, String kind) {
    Set<Integer> seen = new HashSet<>();
    for (int id : ids) {
      checkState(seen.add(id), "Duplicate %s id: %s", kind, id);
    }
  }

  private static ImmutableList<EvaluationFactor> resolveKinds(
      ImmutableList<EvaluationFactor> factors) {
    return factors.stream().map(EvaluationFactor::withResolvedKind).collect(toImmutableList());
  }
}
