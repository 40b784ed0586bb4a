package com.verlumen.evolution.core;

/** Thrown when no initial population is given and no {@link CandidateFactory} is available. */
public final class MissingGeneratorException extends EvolutionException {
  public MissingGeneratorException(String message) {
    super(message);
  }
}
