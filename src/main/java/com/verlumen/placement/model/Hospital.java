package com.verlumen.placement.model;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A hospital that accepts residents.
 *
 * <p>Capacities are split by role. Only {@link #residentCapacity()} bounds the placement; the
 * total across all roles is used as a caseload proxy when scoring preferences.
 *
 * @param annualSalary annual salary offered, in yen; zero when unknown
 */
public record Hospital(
    int id,
    String name,
    int residentCapacity,
    int specialistCapacity,
    int instructorCapacity,
    double annualSalary) {
  public Hospital {
    checkNotNull(name, "name");
    checkArgument(residentCapacity >= 0, "Resident capacity cannot be negative: %s", residentCapacity);
    checkArgument(
        specialistCapacity >= 0, "Specialist capacity cannot be negative: %s", specialistCapacity);
    checkArgument(
        instructorCapacity >= 0, "Instructor capacity cannot be negative: %s", instructorCapacity);
  }

  /** Creates a hospital that only takes residents. */
  public static Hospital create(int id, String name, int residentCapacity, double annualSalary) {
    return new Hospital(id, name, residentCapacity, 0, 0, annualSalary);
  }

  public int totalCapacity() {
    return residentCapacity + specialistCapacity + instructorCapacity;
  }
}
