package com.verlumen.evolution.engine;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.flogger.LazyArgs.lazy;

import com.google.common.base.Throwables;
import com.google.common.collect.Sets;
import com.google.common.flogger.FluentLogger;
import com.google.common.primitives.ImmutableDoubleArray;
import com.google.common.util.concurrent.MoreExecutors;
import com.verlumen.evolution.core.Candidate;
import com.verlumen.evolution.core.CandidateFactory;
import com.verlumen.evolution.core.ContractViolationException;
import com.verlumen.evolution.core.EvolutionException;
import com.verlumen.evolution.core.MissingGeneratorException;
import com.verlumen.evolution.core.NonComparableFitnessException;
import com.verlumen.evolution.operators.CrossoverOperator;
import com.verlumen.evolution.operators.MutationOperator;
import com.verlumen.evolution.operators.SelectionStrategy;
import io.jenetics.util.ISeq;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.function.IntFunction;
import java.util.random.RandomGenerator.SplittableGenerator;

/**
 * Generational genetic algorithm. Each generation evaluates fitness, selects parents, recombines
 * consecutive parent pairs and mutates every child, producing a new population of the same size.
 *
 * <p>Fitness evaluation, initial candidate creation and mutation are fanned out per individual on
 * the configured {@link Executor}; selection and recombination run on the calling thread. Every
 * parallel task that needs randomness gets its own generator split from the caller's generator
 * in index order, so a run is reproducible from its seed whatever the scheduling.
 *
 * @param <C> the candidate type
 */
public final class EvolutionEngine<C extends Candidate<C>> {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final int populationSize;
  private final SelectionStrategy<C> selectionStrategy;
  private final CrossoverOperator<C> crossoverOperator;
  private final MutationOperator<C> mutationOperator;
  private final Optional<CandidateFactory<C>> candidateFactory;
  private final EvaluationMode evaluationMode;
  private final Executor executor;

  private EvolutionEngine(Builder<C> builder) {
    this.populationSize = builder.populationSize;
    this.selectionStrategy = builder.selectionStrategy;
    this.crossoverOperator = builder.crossoverOperator;
    this.mutationOperator = builder.mutationOperator;
    this.candidateFactory = builder.candidateFactory;
    this.evaluationMode = builder.evaluationMode;
    this.executor =
        builder.evaluationMode == EvaluationMode.SEQUENTIAL
            ? MoreExecutors.directExecutor()
            : builder.executor.orElse(ForkJoinPool.commonPool());
  }

  /** Creates a parallel engine without a candidate factory. */
  public static <C extends Candidate<C>> EvolutionEngine<C> create(
      int populationSize,
      SelectionStrategy<C> selectionStrategy,
      CrossoverOperator<C> crossoverOperator,
      MutationOperator<C> mutationOperator) {
    return builder(populationSize, selectionStrategy, crossoverOperator, mutationOperator).build();
  }

  public static <C extends Candidate<C>> Builder<C> builder(
      int populationSize,
      SelectionStrategy<C> selectionStrategy,
      CrossoverOperator<C> crossoverOperator,
      MutationOperator<C> mutationOperator) {
    return new Builder<>(populationSize, selectionStrategy, crossoverOperator, mutationOperator);
  }

  public int populationSize() {
    return populationSize;
  }

  public EvaluationMode evaluationMode() {
    return evaluationMode;
  }

  /**
   * Evolves a population created by the engine's candidate factory.
   *
   * @throws MissingGeneratorException if the engine was built without a candidate factory
   */
  public ISeq<C> evolve(int generations, SplittableGenerator random) {
    return evolve(generations, random, Optional.empty());
  }

  /**
   * Evolves {@code initialPopulation} when present, otherwise a population created by the
   * engine's candidate factory.
   *
   * @return the population after exactly {@code generations} generations
   */
  public ISeq<C> evolve(
      int generations, SplittableGenerator random, Optional<ISeq<C>> initialPopulation) {
    return run(generations, random, initialPopulation, candidateFactory);
  }

  /** Evolves a population created by {@code factory}, which takes precedence over the engine's. */
  public ISeq<C> evolve(int generations, SplittableGenerator random, CandidateFactory<C> factory) {
    return run(generations, random, Optional.empty(), Optional.of(factory));
  }

  private ISeq<C> run(
      int generations,
      SplittableGenerator random,
      Optional<ISeq<C>> initialPopulation,
      Optional<CandidateFactory<C>> factory) {
    checkArgument(generations >= 0, "Generations must not be negative: %s", generations);
    checkNotNull(random, "Random generator must not be null");
    logger.atInfo().log(
        "Evolving %d candidates for %d generations (%s)",
        populationSize, generations, evaluationMode);

    ISeq<C> population = initialize(random, initialPopulation, factory);
    for (int generation = 0; generation < generations; generation++) {
      population = nextGeneration(generation, population, random);
    }

    logger.atInfo().log("Evolution finished after %d generations", generations);
    return population;
  }

  private ISeq<C> initialize(
      SplittableGenerator random,
      Optional<ISeq<C>> initialPopulation,
      Optional<CandidateFactory<C>> factory) {
    if (initialPopulation.isPresent()) {
      ISeq<C> population = initialPopulation.get();
      if (population.isEmpty()) {
        throw new ContractViolationException("Initial population must not be empty");
      }
      if (population.length() != populationSize) {
        throw new ContractViolationException(
            String.format(
                "Initial population has %d candidates, expected %d",
                population.length(), populationSize));
      }
      return population;
    }

    CandidateFactory<C> generator =
        factory.orElseThrow(
            () ->
                new MissingGeneratorException(
                    "No initial population supplied and no candidate factory configured"));
    List<SplittableGenerator> streams = split(random, populationSize);
    logger.atFine().log("Generating %d initial candidates", populationSize);
    return ISeq.of(
        runIndexed(
            populationSize,
            index ->
                checkNotNull(
                    generator.create(streams.get(index)),
                    "Candidate factory returned null at index %s",
                    index)));
  }

  private ISeq<C> nextGeneration(int generation, ISeq<C> population, SplittableGenerator random) {
    ImmutableDoubleArray fitness = evaluate(population);
    logger.atFine().log(
        "Generation %d: best fitness %s, mean fitness %s",
        generation,
        lazy(() -> fitness.stream().max().getAsDouble()),
        lazy(() -> fitness.stream().average().getAsDouble()));

    ISeq<C> parents = selectionStrategy.select(population, fitness, random);
    if (parents == null || parents.length() != population.length()) {
      throw new ContractViolationException(
          String.format(
              "Selection returned %s parents for a population of %d",
              parents == null ? "no" : String.valueOf(parents.length()), population.length()));
    }

    return mutate(recombine(parents), random);
  }

  private ImmutableDoubleArray evaluate(ISeq<C> population) {
    List<Double> values = runIndexed(population.length(), index -> population.get(index).fitness());
    ImmutableDoubleArray.Builder fitness = ImmutableDoubleArray.builder(values.size());
    for (int i = 0; i < values.size(); i++) {
      double value = values.get(i);
      if (Double.isNaN(value)) {
        throw new NonComparableFitnessException(
            String.format("Candidate %d has a non-comparable fitness: %s", i, value));
      }
      fitness.add(value);
    }
    return fitness.build();
  }

  /**
   * Crosses consecutive parent pairs. Every pair is crossed once; when the children do not fill
   * the population, the pairs are crossed again in the same order until they do. Surplus children
   * are dropped, and an odd last parent is copied through unchanged.
   */
  private List<C> recombine(ISeq<C> parents) {
    boolean odd = parents.length() % 2 == 1;
    int pairedSlots = odd ? populationSize - 1 : populationSize;
    int pairCount = parents.length() / 2;

    List<C> offspring = new ArrayList<>(populationSize);
    Set<C> seen = Sets.newIdentityHashSet();
    for (int pair = 0; pair < pairCount || offspring.size() < pairedSlots; pair++) {
      int i = 2 * (pair % pairCount);
      List<C> children = crossoverOperator.crossover(parents.get(i), parents.get(i + 1));
      if (children == null || children.isEmpty()) {
        throw new ContractViolationException(
            String.format("Crossover of parents %d and %d produced no children", i, i + 1));
      }
      for (C child : children) {
        checkNotNull(child, "Crossover of parents %s and %s produced a null child", i, i + 1);
        // Each slot is mutated in place, so no two slots may share an instance.
        offspring.add(seen.add(child) ? child : child.copy());
      }
    }

    List<C> next = new ArrayList<>(offspring.subList(0, pairedSlots));
    if (odd) {
      // The unpaired last parent is carried over as-is.
      next.add(parents.get(parents.length() - 1).copy());
    }
    return next;
  }

  private ISeq<C> mutate(List<C> offspring, SplittableGenerator random) {
    List<SplittableGenerator> streams = split(random, offspring.size());
    return ISeq.of(
        runIndexed(
            offspring.size(),
            index -> {
              C child = offspring.get(index);
              mutationOperator.mutate(child, streams.get(index));
              return child;
            }));
  }

  private static List<SplittableGenerator> split(SplittableGenerator random, int count) {
    List<SplittableGenerator> streams = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      streams.add(random.split());
    }
    return streams;
  }

  /** Runs {@code task} for every index on the executor and returns the results in index order. */
  private <T> List<T> runIndexed(int count, IntFunction<T> task) {
    List<CompletableFuture<T>> futures = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      int index = i;
      futures.add(CompletableFuture.supplyAsync(() -> task.apply(index), executor));
    }

    List<T> results = new ArrayList<>(count);
    try {
      CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).join();
      for (CompletableFuture<T> future : futures) {
        results.add(future.join());
      }
    } catch (CompletionException e) {
      Throwable cause = e.getCause() == null ? e : e.getCause();
      Throwables.throwIfUnchecked(cause);
      throw new EvolutionException("Evolution task failed", cause);
    }
    return results;
  }

  /** Builder for {@link EvolutionEngine}. */
  public static final class Builder<C extends Candidate<C>> {
    private final int populationSize;
    private final SelectionStrategy<C> selectionStrategy;
    private final CrossoverOperator<C> crossoverOperator;
    private final MutationOperator<C> mutationOperator;
    private Optional<CandidateFactory<C>> candidateFactory = Optional.empty();
    private EvaluationMode evaluationMode = EvaluationMode.PARALLEL;
    private Optional<Executor> executor = Optional.empty();

    private Builder(
        int populationSize,
        SelectionStrategy<C> selectionStrategy,
        CrossoverOperator<C> crossoverOperator,
        MutationOperator<C> mutationOperator) {
      checkArgument(populationSize >= 1, "Population size must be positive: %s", populationSize);
      this.populationSize = populationSize;
      this.selectionStrategy = checkNotNull(selectionStrategy);
      this.crossoverOperator = checkNotNull(crossoverOperator);
      this.mutationOperator = checkNotNull(mutationOperator);
    }

    public Builder<C> candidateFactory(CandidateFactory<C> candidateFactory) {
      this.candidateFactory = Optional.of(candidateFactory);
      return this;
    }

    public Builder<C> evaluationMode(EvaluationMode evaluationMode) {
      this.evaluationMode = checkNotNull(evaluationMode);
      return this;
    }

    /** Executor for {@link EvaluationMode#PARALLEL}; ignored in sequential mode. */
    public Builder<C> executor(Executor executor) {
      this.executor = Optional.of(executor);
      return this;
    }

    public EvolutionEngine<C> build() {
      return new EvolutionEngine<>(this);
    }
  }
}
