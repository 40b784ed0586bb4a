package com.verlumen.evolution.operators;

import com.verlumen.evolution.core.Candidate;
import java.util.random.RandomGenerator;

/**
 * Perturbs a single offspring in place.
 *
 * @param <C> the candidate type
 */
public interface MutationOperator<C extends Candidate<C>> {
  void mutate(C candidate, RandomGenerator random);
}
