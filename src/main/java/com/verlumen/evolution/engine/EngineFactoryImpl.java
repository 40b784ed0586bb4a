package com.verlumen.evolution.engine;

import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.evolution.core.Candidate;
import com.verlumen.evolution.core.CandidateFactory;
import com.verlumen.evolution.operators.CrossoverOperator;
import com.verlumen.evolution.operators.GaussianMutation;
import com.verlumen.evolution.operators.MutationOperator;
import com.verlumen.evolution.operators.SelectionStrategy;
import com.verlumen.evolution.operators.SinglePointCrossover;
import com.verlumen.evolution.operators.TournamentSelection;
import java.util.concurrent.Executor;

final class EngineFactoryImpl implements EngineFactory {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final EvolutionConfig config;
  private final Executor executor;

  @Inject
  EngineFactoryImpl(EvolutionConfig config, Executor executor) {
    this.config = config;
    this.executor = executor;
  }

  @Override
  public <C extends Candidate<C>> EvolutionEngine<C> createEngine(
      CandidateFactory<C> candidateFactory) {
    logger.atFine().log(
        "Using tournament size %d, mutation rate %s, mutation strength %s",
        config.tournamentSize(), config.mutationRate(), config.mutationStrength());
    return createEngine(
        new TournamentSelection<C>(config.tournamentSize()),
        new SinglePointCrossover<C>(),
        new GaussianMutation<C>(config.mutationRate(), config.mutationStrength()),
        candidateFactory);
  }

  @Override
  public <C extends Candidate<C>> EvolutionEngine<C> createEngine(
      SelectionStrategy<C> selectionStrategy,
      CrossoverOperator<C> crossoverOperator,
      MutationOperator<C> mutationOperator,
      CandidateFactory<C> candidateFactory) {
    return EvolutionEngine.builder(
            config.populationSize(), selectionStrategy, crossoverOperator, mutationOperator)
        .candidateFactory(candidateFactory)
        .evaluationMode(config.evaluationMode())
        .executor(executor)
        .build();
  }
}
