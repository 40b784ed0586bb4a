package com.verlumen.evolution.core;

import java.util.random.RandomGenerator;

/**
 * Creates fresh candidates for an initial population.
 *
 * @param <C> the candidate type produced
 */
@FunctionalInterface
public interface CandidateFactory<C extends Candidate<C>> {
  C create(RandomGenerator random);
}
