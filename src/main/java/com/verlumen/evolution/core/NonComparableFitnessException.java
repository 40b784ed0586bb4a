package com.verlumen.evolution.core;

/** Thrown when a fitness value cannot be ordered, e.g. NaN. */
public final class NonComparableFitnessException extends EvolutionException {
  public NonComparableFitnessException(String message) {
    super(message);
  }
}
