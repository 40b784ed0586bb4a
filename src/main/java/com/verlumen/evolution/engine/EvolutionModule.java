package com.verlumen.evolution.engine;

import com.google.auto.value.AutoValue;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

@AutoValue
public abstract class EvolutionModule extends AbstractModule {
  public static EvolutionModule create(EvolutionConfig config) {
    return new AutoValue_EvolutionModule(config);
  }

  abstract EvolutionConfig config();

  @Override
  protected void configure() {
    bind(EvolutionConfig.class).toInstance(config());
    bind(EvaluationMode.class).toInstance(config().evaluationMode());
    bind(EngineFactory.class).to(EngineFactoryImpl.class);
  }

  @Provides
  Executor provideExecutor(EvaluationMode evaluationMode) {
    return evaluationMode == EvaluationMode.PARALLEL
        ? ForkJoinPool.commonPool()
        : MoreExecutors.directExecutor();
  }
}
