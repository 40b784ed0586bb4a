package com.verlumen.evolution.example;

import com.verlumen.evolution.core.Candidate;
import com.verlumen.evolution.core.CandidateFactory;

/** Runs a complete optimization with the bound configuration. */
public interface OptimizationRunner {
  /**
   * Evolves a population created by {@code candidateFactory} for the configured number of
   * generations, seeded from the configured seed.
   *
   * @param candidateFactory creates the initial population
   * @return a summary of the final population
   */
  <C extends Candidate<C>> EvolutionSummary<C> run(CandidateFactory<C> candidateFactory);
}
