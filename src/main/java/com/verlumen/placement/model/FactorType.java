package com.verlumen.placement.model;

/** The two evaluation-factor catalogs. */
public enum FactorType {
  /** Factors residents weigh when judging a hospital (salary, commute, ...). */
  STAFF_PREFERENCE,
  /** Factors the department scores residents on (research record, attitude, ...). */
  ADMIN_EVALUATION
}
