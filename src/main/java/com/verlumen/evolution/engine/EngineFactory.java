package com.verlumen.evolution.engine;

import com.verlumen.evolution.core.Candidate;
import com.verlumen.evolution.core.CandidateFactory;
import com.verlumen.evolution.operators.CrossoverOperator;
import com.verlumen.evolution.operators.MutationOperator;
import com.verlumen.evolution.operators.SelectionStrategy;

/** Defines the contract for creating configured evolution engines. */
public interface EngineFactory {
  /**
   * Creates an engine using tournament selection, single-point crossover and Gaussian mutation,
   * parameterized from the bound {@link EvolutionConfig}.
   *
   * @param candidateFactory creates the initial population
   * @return a configured engine
   */
  <C extends Candidate<C>> EvolutionEngine<C> createEngine(CandidateFactory<C> candidateFactory);

  /** Creates an engine with the given operators and the bound population size and mode. */
  <C extends Candidate<C>> EvolutionEngine<C> createEngine(
      SelectionStrategy<C> selectionStrategy,
      CrossoverOperator<C> crossoverOperator,
      MutationOperator<C> mutationOperator,
      CandidateFactory<C> candidateFactory);
}
