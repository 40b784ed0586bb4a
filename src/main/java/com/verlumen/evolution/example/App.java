package com.verlumen.evolution.example;

import com.google.common.flogger.FluentLogger;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.verlumen.evolution.engine.EvaluationMode;
import com.verlumen.evolution.engine.EvolutionConfig;
import com.verlumen.evolution.engine.EvolutionConstants;
import com.verlumen.evolution.engine.EvolutionModule;
import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;

/** Command-line driver that maximizes the gene sum of random real vectors. */
final class App {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final OptimizationRunner optimizationRunner;

  @Inject
  App(OptimizationRunner optimizationRunner) {
    this.optimizationRunner = optimizationRunner;
  }

  EvolutionSummary<RealVectorCandidate> run(int geneLength) {
    return optimizationRunner.run(new RealVectorFactory(geneLength));
  }

  public static void main(String[] args) {
    ArgumentParser argumentParser = createArgumentParser();
    Namespace namespace;
    try {
      namespace = argumentParser.parseArgs(args);
    } catch (ArgumentParserException e) {
      argumentParser.handleError(e);
      System.exit(1);
      return;
    }

    EvolutionConfig config = toConfig(namespace);
    int geneLength = namespace.getInt("geneLength");
    logger.atInfo().log("Running with %s and gene length %d", config, geneLength);

    App app =
        Guice.createInjector(EvolutionModule.create(config), ExampleModule.create())
            .getInstance(App.class);
    try {
      EvolutionSummary<RealVectorCandidate> summary = app.run(geneLength);
      System.out.println("Best individual: " + summary.best());
      System.out.println("Fitness: " + summary.bestFitness());
    } catch (RuntimeException e) {
      logger.atSevere().withCause(e).log("Optimization failed");
      throw e;
    }
  }

  static EvolutionConfig toConfig(Namespace namespace) {
    return EvolutionConfig.builder()
        .setPopulationSize(namespace.getInt("populationSize"))
        .setGenerations(namespace.getInt("generations"))
        .setTournamentSize(namespace.getInt("tournamentSize"))
        .setMutationRate(namespace.getDouble("mutationRate"))
        .setMutationStrength(namespace.getDouble("mutationStrength"))
        .setEvaluationMode(EvaluationMode.fromString(namespace.getString("evaluationMode")))
        .setSeed(namespace.getLong("seed"))
        .build();
  }

  static ArgumentParser createArgumentParser() {
    ArgumentParser parser =
        ArgumentParsers.newFor("EvolutionExample")
            .build()
            .defaultHelp(true)
            .description("Evolves real-valued vectors towards the largest gene sum");

    parser.addArgument("--populationSize")
        .type(Integer.class)
        .setDefault(EvolutionConstants.DEFAULT_POPULATION_SIZE)
        .help("Number of candidates per generation");

    parser.addArgument("--generations")
        .type(Integer.class)
        .setDefault(EvolutionConstants.DEFAULT_GENERATIONS)
        .help("Number of generations to run");

    parser.addArgument("--geneLength")
        .type(Integer.class)
        .setDefault(EvolutionConstants.DEFAULT_GENE_LENGTH)
        .help("Number of genes per candidate");

    // Operator configuration
    parser.addArgument("--tournamentSize")
        .type(Integer.class)
        .setDefault(EvolutionConstants.TOURNAMENT_SIZE)
        .help("Candidates drawn per tournament");

    parser.addArgument("--mutationRate")
        .type(Double.class)
        .setDefault(EvolutionConstants.MUTATION_RATE)
        .help("Probability that an offspring is mutated");

    parser.addArgument("--mutationStrength")
        .type(Double.class)
        .setDefault(EvolutionConstants.MUTATION_STRENGTH)
        .help("Half-width of the mutation perturbation interval");

    parser.addArgument("--seed")
        .type(Long.class)
        .setDefault(EvolutionConstants.DEFAULT_SEED)
        .help("Seed of the random generator");

    parser.addArgument("--evaluationMode")
        .choices("parallel", "sequential")
        .setDefault("parallel")
        .help("Evaluate and mutate candidates in parallel or sequentially");

    return parser;
  }
}
