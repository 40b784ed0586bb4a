package com.verlumen.evolution.core;

/** Base type for the terminal failures of an evolution run. */
public class EvolutionException extends RuntimeException {
  public EvolutionException(String message) {
    super(message);
  }

  public EvolutionException(String message, Throwable cause) {
    super(message, cause);
  }
}
