package com.verlumen.evolution.example;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.MoreObjects;
import com.google.common.primitives.ImmutableDoubleArray;
import com.verlumen.evolution.core.Candidate;
import com.verlumen.evolution.core.CandidatePair;
import java.util.Arrays;
import java.util.random.RandomGenerator;

/**
 * A fixed-length vector of real-valued genes whose fitness is the sum of its genes.
 *
 * <p>Crossover splits both parents at the midpoint {@code length / 2}. Mutation adds a value drawn
 * uniformly from {@code [-strength, strength)} to one uniformly chosen gene.
 */
public final class RealVectorCandidate implements Candidate<RealVectorCandidate> {
  private final double[] genes;

  private RealVectorCandidate(double[] genes) {
    this.genes = genes;
  }

  public static RealVectorCandidate of(double... genes) {
    return new RealVectorCandidate(genes.clone());
  }

  public static RealVectorCandidate of(ImmutableDoubleArray genes) {
    return new RealVectorCandidate(genes.toArray());
  }

  public ImmutableDoubleArray genes() {
    return ImmutableDoubleArray.copyOf(genes);
  }

  public int length() {
    return genes.length;
  }

  @Override
  public double fitness() {
    double sum = 0.0;
    for (double gene : genes) {
      sum += gene;
    }
    return sum;
  }

  @Override
  public CandidatePair<RealVectorCandidate> crossover(RealVectorCandidate other) {
    checkArgument(
        genes.length == other.genes.length,
        "Cannot cross vectors of length %s and %s",
        genes.length,
        other.genes.length);
    int mid = genes.length / 2;
    return CandidatePair.of(splice(this, other, mid), splice(other, this, mid));
  }

  @Override
  public void mutate(RandomGenerator random, double strength) {
    if (genes.length == 0 || strength <= 0.0) {
      return;
    }
    int position = random.nextInt(genes.length);
    genes[position] += random.nextDouble(-strength, strength);
  }

  @Override
  public RealVectorCandidate copy() {
    return new RealVectorCandidate(genes.clone());
  }

  private static RealVectorCandidate splice(
      RealVectorCandidate head, RealVectorCandidate tail, int mid) {
    double[] child = new double[head.genes.length];
    System.arraycopy(head.genes, 0, child, 0, mid);
    System.arraycopy(tail.genes, mid, child, mid, child.length - mid);
    return new RealVectorCandidate(child);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RealVectorCandidate)) {
      return false;
    }
    return Arrays.equals(genes, ((RealVectorCandidate) o).genes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(genes);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("genes", Arrays.toString(genes)).toString();
  }
}
