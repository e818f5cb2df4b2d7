package com.verlumen.placement.model;

/** Role of a staff member. Only {@link #RESIDENT_DOCTOR} staff are placed by the optimizer. */
public enum StaffType {
  RESIDENT_DOCTOR,
  ASSISTANT_PROFESSOR,
  LECTURER,
  ASSOCIATE_PROFESSOR,
  PROFESSOR,
  ADMINISTRATIVE;

  public boolean isPlaceable() {
    return this == RESIDENT_DOCTOR;
  }
}
