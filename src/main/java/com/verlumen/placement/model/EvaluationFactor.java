package com.verlumen.placement.model;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * An entry of one of the evaluation-factor catalogs.
 *
 * @param kind explicit scoring kind, or {@code null} to classify from {@code name}
 */
public record EvaluationFactor(int id, String name, FactorType type, FactorKind kind) {
  public EvaluationFactor {
    checkNotNull(name, "name");
    checkNotNull(type, "type");
  }

  public static EvaluationFactor create(int id, String name, FactorType type) {
    return new EvaluationFactor(id, name, type, null);
  }

  /** The declared kind if present, otherwise the kind inferred from the name. */
  public FactorKind effectiveKind() {
    return kind != null ? kind : FactorKind.classify(name);
  }

  /** Returns a copy whose kind is always set. */
  public EvaluationFactor withResolvedKind() {
    return kind != null ? this : new EvaluationFactor(id, name, type, effectiveKind());
  }
}
