package com.verlumen.placement.data;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.flogger.FluentLogger;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.verlumen.placement.model.AdminEvaluation;
import com.verlumen.placement.model.CommuteEntry;
import com.verlumen.placement.model.EvaluationFactor;
import com.verlumen.placement.model.FactorWeight;
import com.verlumen.placement.model.Hospital;
import com.verlumen.placement.model.HospitalChoice;
import com.verlumen.placement.model.Resident;
import com.verlumen.placement.model.StaffType;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Loads a placement dataset exported as JSON.
 *
 * <p>The document holds one array per collaborator table: {@code staff}, {@code hospitals},
 * {@code factors}, {@code hospitalChoices}, {@code factorWeights}, {@code adminEvaluations} and
 * {@code commuteTimes}. Missing arrays are treated as empty. Only staff whose {@code staffType} is
 * {@code RESIDENT_DOCTOR} become residents.
 */
public final class JsonPlacementDataLoader {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final Gson GSON = new GsonBuilder().create();

  private JsonPlacementDataLoader() {}

  public static InMemoryPlacementDataSource load(Path path) {
    try {
      return parse(Files.readString(path, StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read placement data from: " + path, e);
    }
  }

  /**
   * Parses a dataset document.
   *
   * @throws IllegalArgumentException if the document is malformed or violates a model constraint
   */
  public static InMemoryPlacementDataSource parse(String json) {
    Document document;
    try {
      document = GSON.fromJson(json, Document.class);
    } catch (JsonParseException e) {
      throw new IllegalArgumentException("Malformed placement data document", e);
    } catch (RuntimeException e) {
      // Gson reports record constructor failures as bare RuntimeExceptions.
      throw new IllegalArgumentException("Invalid entry in placement data document", e);
    }
    if (document == null) {
      throw new IllegalArgumentException("Placement data document is empty");
    }

    InMemoryPlacementDataSource.Builder builder = InMemoryPlacementDataSource.builder();
    int skippedStaff = 0;
    for (StaffEntry staff : orEmpty(document.staff)) {
      if (staff.staffType() != null && staff.staffType().isPlaceable()) {
        builder.addResident(Resident.create(staff.id(), staff.name()));
      } else {
        skippedStaff++;
      }
    }
    orEmpty(document.hospitals).forEach(entry -> builder.addHospital(entry.toHospital()));
    orEmpty(document.factors).forEach(builder::addFactor);
    orEmpty(document.hospitalChoices).forEach(builder::addChoice);
    orEmpty(document.factorWeights).forEach(builder::addWeight);
    orEmpty(document.adminEvaluations).forEach(builder::addEvaluation);
    orEmpty(document.commuteTimes).forEach(entry -> builder.addCommute(entry.toCommuteEntry()));

    InMemoryPlacementDataSource dataSource = builder.build();
    logger.atInfo().log(
        "Loaded placement data: %d residents (%d other staff skipped), %d hospitals",
        dataSource.residents().size(), skippedStaff, dataSource.hospitals().size());
    return dataSource;
  }

  private static <T> List<T> orEmpty(List<T> values) {
    return values == null ? List.of() : values;
  }

  private record StaffEntry(int id, String name, StaffType staffType) {}

  /** Hospital row as exported; a null salary reads as zero. */
  private record HospitalEntry(
      int id,
      String name,
      int residentCapacity,
      int specialistCapacity,
      int instructorCapacity,
      Double annualSalary) {
    HospitalEntry {
      checkNotNull(name, "Hospital %s has no name", id);
    }

    Hospital toHospital() {
      return new Hospital(
          id,
          name,
          residentCapacity,
          specialistCapacity,
          instructorCapacity,
          annualSalary == null ? 0.0 : annualSalary);
    }
  }

  /** Commute cache row as exported; null minutes read as zero. */
  private record CommuteTimeEntry(int residentId, int hospitalId, Double minutes) {
    CommuteEntry toCommuteEntry() {
      return new CommuteEntry(residentId, hospitalId, minutes == null ? 0.0 : minutes);
    }
  }

  private static final class Document {
    List<StaffEntry> staff;
    List<HospitalEntry> hospitals;
    List<EvaluationFactor> factors;
    List<HospitalChoice> hospitalChoices;
    List<FactorWeight> factorWeights;
    List<AdminEvaluation> adminEvaluations;
    List<CommuteTimeEntry> commuteTimes;
  }
}
