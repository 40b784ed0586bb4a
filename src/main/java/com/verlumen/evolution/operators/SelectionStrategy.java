package com.verlumen.evolution.operators;

import com.google.common.primitives.ImmutableDoubleArray;
import com.verlumen.evolution.core.Candidate;
import io.jenetics.util.ISeq;
import java.util.random.RandomGenerator;

/**
 * Chooses the parents of the next generation.
 *
 * @param <C> the candidate type
 */
public interface SelectionStrategy<C extends Candidate<C>> {
  /**
   * Selects parents from {@code population}.
   *
   * @param population the current population
   * @param fitness fitness values, where {@code fitness.get(i)} belongs to {@code population.get(i)}
   * @param random the only source of randomness the strategy may use
   * @return exactly {@code population.length()} parents, each an independent copy
   */
  ISeq<C> select(ISeq<C> population, ImmutableDoubleArray fitness, RandomGenerator random);
}
