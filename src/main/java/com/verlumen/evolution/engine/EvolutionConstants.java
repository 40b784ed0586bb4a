package com.verlumen.evolution.engine;

/** Default settings for an evolution run. */
public final class EvolutionConstants {
  public static final int DEFAULT_POPULATION_SIZE = 100;
  public static final int DEFAULT_GENERATIONS = 50;
  public static final int DEFAULT_GENE_LENGTH = 10;
  public static final int TOURNAMENT_SIZE = 3;
  public static final double MUTATION_RATE = 0.1;
  public static final double MUTATION_STRENGTH = 0.1;
  public static final long DEFAULT_SEED = 42L;

  private EvolutionConstants() {}
}
