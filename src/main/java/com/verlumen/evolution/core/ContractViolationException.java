package com.verlumen.evolution.core;

/**
 * Thrown when an operator or a caller breaks a size contract, such as a selection returning the
 * wrong number of parents or an empty population where one is required.
 */
public final class ContractViolationException extends EvolutionException {
  public ContractViolationException(String message) {
    super(message);
  }
}
