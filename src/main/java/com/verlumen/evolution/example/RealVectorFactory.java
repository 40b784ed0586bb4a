package com.verlumen.evolution.example;

import static com.google.common.base.Preconditions.checkArgument;

import com.verlumen.evolution.core.CandidateFactory;
import java.util.random.RandomGenerator;

/** Creates vectors with genes drawn uniformly from {@code [0, 1)}. */
public final class RealVectorFactory implements CandidateFactory<RealVectorCandidate> {
  private final int geneLength;

  public RealVectorFactory(int geneLength) {
    checkArgument(geneLength >= 1, "Gene length must be positive: %s", geneLength);
    this.geneLength = geneLength;
  }

  @Override
  public RealVectorCandidate create(RandomGenerator random) {
    double[] genes = new double[geneLength];
    for (int i = 0; i < geneLength; i++) {
      genes[i] = random.nextDouble();
    }
    return RealVectorCandidate.of(genes);
  }
}
