package com.verlumen.evolution.engine;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;

/** Settings for a run of the reference operators. */
@AutoValue
public abstract class EvolutionConfig {
  public static Builder builder() {
    return new AutoValue_EvolutionConfig.Builder()
        .setPopulationSize(EvolutionConstants.DEFAULT_POPULATION_SIZE)
        .setGenerations(EvolutionConstants.DEFAULT_GENERATIONS)
        .setTournamentSize(EvolutionConstants.TOURNAMENT_SIZE)
        .setMutationRate(EvolutionConstants.MUTATION_RATE)
        .setMutationStrength(EvolutionConstants.MUTATION_STRENGTH)
        .setEvaluationMode(EvaluationMode.PARALLEL)
        .setSeed(EvolutionConstants.DEFAULT_SEED);
  }

  public static EvolutionConfig defaults() {
    return builder().build();
  }

  public abstract int populationSize();

  public abstract int generations();

  public abstract int tournamentSize();

  public abstract double mutationRate();

  public abstract double mutationStrength();

  public abstract EvaluationMode evaluationMode();

  public abstract long seed();

  public abstract Builder toBuilder();

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setPopulationSize(int populationSize);

    public abstract Builder setGenerations(int generations);

    public abstract Builder setTournamentSize(int tournamentSize);

    public abstract Builder setMutationRate(double mutationRate);

    public abstract Builder setMutationStrength(double mutationStrength);

    public abstract Builder setEvaluationMode(EvaluationMode evaluationMode);

    public abstract Builder setSeed(long seed);

    abstract EvolutionConfig autoBuild();

    public final EvolutionConfig build() {
      EvolutionConfig config = autoBuild();
      checkArgument(
          config.populationSize() >= 1,
          "Population size must be positive: %s",
          config.populationSize());
      checkArgument(
          config.generations() >= 0, "Generations must not be negative: %s", config.generations());
      checkArgument(
          config.tournamentSize() >= 1,
          "Tournament size must be positive: %s",
          config.tournamentSize());
      checkArgument(
          config.mutationRate() >= 0.0 && config.mutationRate() <= 1.0,
          "Mutation rate must be within [0, 1]: %s",
          config.mutationRate());
      checkArgument(
          config.mutationStrength() >= 0.0,
          "Mutation strength must not be negative: %s",
          config.mutationStrength());
      checkArgument(
          Double.isFinite(2 * config.mutationStrength()),
          "Mutation strength is too large for a finite interval: %s",
          config.mutationStrength());
      return config;
    }
  }
}
