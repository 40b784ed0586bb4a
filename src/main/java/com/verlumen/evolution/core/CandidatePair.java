package com.verlumen.evolution.core;

import com.google.auto.value.AutoValue;

/** The two children produced by {@link Candidate#crossover}. */
@AutoValue
public abstract class CandidatePair<C> {
  public static <C> CandidatePair<C> of(C first, C second) {
    return new AutoValue_CandidatePair<>(first, second);
  }

  public abstract C first();

  public abstract C second();
}
