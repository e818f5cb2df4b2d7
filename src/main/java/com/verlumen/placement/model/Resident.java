package com.verlumen.placement.model;

import static com.google.common.base.Preconditions.checkNotNull;

/** A resident doctor on the placement roster. Immutable for the duration of a run. */
public record Resident(int id, String name) {
  public Resident {
    checkNotNull(name, "name");
  }

  public static Resident create(int id, String name) {
    return new Resident(id, name);
  }
}
