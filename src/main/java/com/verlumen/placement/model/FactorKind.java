package com.verlumen.placement.model;

import com.google.common.collect.ImmutableList;
import java.util.Locale;

/**
 * What a staff-preference factor measures, which decides how a hospital is scored against it.
 *
 * <p>Factors may declare their kind explicitly. Factors that do not are classified from their
 * display name with {@link #classify(String)}.
 */
public enum FactorKind {
  SALARY(ImmutableList.of("salary", "年収", "給与")),
  COMMUTE(ImmutableList.of("commute", "通勤", "距離")),
  CASELOAD(ImmutableList.of("caseload", "outpatient", "症例", "外勤")),
  OTHER(ImmutableList.of());

  private final ImmutableList<String> keywords;

  FactorKind(ImmutableList<String> keywords) {
    this.keywords = keywords;
  }

  /**
   * Classifies a factor by substring match on its lower-cased name. Kinds are tried in
   * declaration order, so a name mentioning both salary and commute is a salary factor.
   */
  public static FactorKind classify(String factorName) {
    String name = factorName.toLowerCase(Locale.ROOT);
    for (FactorKind kind : values()) {
      if (kind.keywords.stream().anyMatch(name::contains)) {
        return kind;
      }
    }
    return OTHER;
  }
}
