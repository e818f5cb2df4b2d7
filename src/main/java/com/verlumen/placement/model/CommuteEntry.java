package com.verlumen.placement.model;

import static com.google.common.base.Preconditions.checkArgument;

/** Cached driving time from a resident's home to a hospital. */
public record CommuteEntry(int residentId, int hospitalId, double minutes) {
  public CommuteEntry {
    checkArgument(minutes >= 0, "Commute minutes cannot be negative: %s", minutes);
  }
}
