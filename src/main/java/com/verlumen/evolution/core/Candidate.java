package com.verlumen.evolution.core;

import java.util.random.RandomGenerator;

/**
 * A single solution in a population.
 *
 * <p>Implementations must be safe for concurrent reads, since fitness is evaluated in parallel.
 *
 * @param <C> the concrete candidate type
 */
public interface Candidate<C extends Candidate<C>> {
  /**
   * Scores this candidate. Higher is better. Must be deterministic for a given state and free of
   * side effects.
   */
  double fitness();

  /**
   * Recombines this candidate with {@code other} into two new children. Neither parent is
   * modified.
   */
  CandidatePair<C> crossover(C other);

  /**
   * Perturbs this candidate in place.
   *
   * @param random the only source of randomness the implementation may use
   * @param strength half-width of the interval the perturbation is drawn from
   */
  void mutate(RandomGenerator random, double strength);

  /** Returns a fully independent duplicate of this candidate. */
  C copy();
}
