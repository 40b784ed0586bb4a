package com.verlumen.evolution.example;

import com.google.auto.value.AutoValue;
import com.verlumen.evolution.core.Candidate;
import com.verlumen.evolution.core.ContractViolationException;
import com.verlumen.evolution.core.Fitness;
import io.jenetics.util.ISeq;

/** The outcome of an optimization run: the final population and its fittest candidate. */
@AutoValue
public abstract class EvolutionSummary<C extends Candidate<C>> {
  /**
   * Summarizes {@code population}. When several candidates share the best fitness the last one
   * wins.
   *
   * @throws ContractViolationException if the population is empty
   */
  public static <C extends Candidate<C>> EvolutionSummary<C> of(ISeq<C> population) {
    if (population.isEmpty()) {
      throw new ContractViolationException("Cannot summarize an empty population");
    }
    C best = population.get(0);
    double bestFitness = Fitness.checkComparable(best.fitness());
    double total = bestFitness;
    for (int i = 1; i < population.length(); i++) {
      C candidate = population.get(i);
      double fitness = candidate.fitness();
      if (Fitness.compare(fitness, bestFitness) >= 0) {
        best = candidate;
        bestFitness = fitness;
      }
      total += fitness;
    }
    return new AutoValue_EvolutionSummary<>(
        best, bestFitness, total / population.length(), population);
  }

  public abstract C best();

  public abstract double bestFitness();

  public abstract double meanFitness();

  public abstract ISeq<C> population();
}
