package com.verlumen.evolution.example;

import com.google.inject.AbstractModule;

public final class ExampleModule extends AbstractModule {
  public static ExampleModule create() {
    return new ExampleModule();
  }

  private ExampleModule() {}

  @Override
  protected void configure() {
    bind(OptimizationRunner.class).to(OptimizationRunnerImpl.class);
  }
}
