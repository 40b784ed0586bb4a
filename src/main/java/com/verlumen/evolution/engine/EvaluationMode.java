package com.verlumen.evolution.engine;

import java.util.Locale;

/** How the per-individual steps of a generation are scheduled. */
public enum EvaluationMode {
  PARALLEL,
  SEQUENTIAL;

  public static EvaluationMode fromString(String name) {
    return EvaluationMode.valueOf(name.toUpperCase(Locale.ROOT));
  }
}
