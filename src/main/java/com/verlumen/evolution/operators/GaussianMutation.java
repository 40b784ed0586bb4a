package com.verlumen.evolution.operators;

import static com.google.common.base.Preconditions.checkArgument;

import com.verlumen.evolution.core.Candidate;
import java.util.random.RandomGenerator;

/**
 * Mutates a candidate with probability {@code mutationRate}, passing {@code mutationStrength} on
 * as the perturbation half-width.
 */
public final class GaussianMutation<C extends Candidate<C>> implements MutationOperator<C> {
  private final double mutationRate;
  private final double mutationStrength;

  public GaussianMutation(double mutationRate, double mutationStrength) {
    checkArgument(
        mutationRate >= 0.0 && mutationRate <= 1.0,
        "Mutation rate must be within [0, 1]: %s",
        mutationRate);
    checkArgument(
        mutationStrength >= 0.0, "Mutation strength must not be negative: %s", mutationStrength);
    checkArgument(
        Double.isFinite(2 * mutationStrength),
        "Mutation strength is too large for a finite interval: %s",
        mutationStrength);
    this.mutationRate = mutationRate;
    this.mutationStrength = mutationStrength;
  }

  public double mutationRate() {
    return mutationRate;
  }

  public double mutationStrength() {
    return mutationStrength;
  }

  @Override
  public void mutate(C candidate, RandomGenerator random) {
    if (random.nextDouble() < mutationRate) {
      candidate.mutate(random, mutationStrength);
    }
  }
}
