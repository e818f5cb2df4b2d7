package com.verlumen.placement.execution;

import java.util.Locale;

/** Whether a run saves its assignments ({@link #WET}) or only reports them ({@link #DRY}). */
public enum RunMode {
  WET,
  DRY;

  public static RunMode fromString(String name) {
    return RunMode.valueOf(name.trim().toUpperCase(Locale.ROOT));
  }

  public boolean persistsResults() {
    return this == WET;
  }
}
