package com.verlumen.evolution.example;

import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.evolution.core.Candidate;
import com.verlumen.evolution.core.CandidateFactory;
import com.verlumen.evolution.engine.EngineFactory;
import com.verlumen.evolution.engine.EvolutionConfig;
import com.verlumen.evolution.engine.EvolutionEngine;
import io.jenetics.util.ISeq;
import java.util.SplittableRandom;

/**
 * Coordinates an optimization run. Engine construction is delegated to the {@link EngineFactory}.
 */
final class OptimizationRunnerImpl implements OptimizationRunner {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final EngineFactory engineFactory;
  private final EvolutionConfig config;

  @Inject
  OptimizationRunnerImpl(EngineFactory engineFactory, EvolutionConfig config) {
    this.engineFactory = engineFactory;
    this.config = config;
  }

  @Override
  public <C extends Candidate<C>> EvolutionSummary<C> run(CandidateFactory<C> candidateFactory) {
    EvolutionEngine<C> engine = engineFactory.createEngine(candidateFactory);

    logger.atInfo().log("Starting optimization with seed %d", config.seed());
    ISeq<C> population = engine.evolve(config.generations(), new SplittableRandom(config.seed()));

    EvolutionSummary<C> summary = EvolutionSummary.of(population);
    logger.atInfo().log(
        "Best fitness %s, mean fitness %s", summary.bestFitness(), summary.meanFitness());
    return summary;
  }
}
