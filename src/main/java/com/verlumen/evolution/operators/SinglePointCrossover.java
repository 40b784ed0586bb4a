package com.verlumen.evolution.operators;

import com.google.common.collect.ImmutableList;
import com.verlumen.evolution.core.Candidate;
import com.verlumen.evolution.core.CandidatePair;
import java.util.List;

/** Delegates to the candidate's own crossover and returns both of its children unmodified. */
public final class SinglePointCrossover<C extends Candidate<C>> implements CrossoverOperator<C> {
  @Override
  public List<C> crossover(C parent1, C parent2) {
    CandidatePair<C> children = parent1.crossover(parent2);
    return ImmutableList.of(children.first(), children.second());
  }
}
