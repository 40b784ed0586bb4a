package com.verlumen.evolution.example;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.inject.Guice;
import com.verlumen.evolution.engine.EvaluationMode;
import com.verlumen.evolution.engine.EvolutionConfig;
import com.verlumen.evolution.engine.EvolutionConstants;
import com.verlumen.evolution.engine.EvolutionModule;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class AppTest {
  @Test
  public void toConfig_noArguments_usesDefaults() throws Exception {
    Namespace namespace = App.createArgumentParser().parseArgs(new String[0]);

    EvolutionConfig config = App.toConfig(namespace);

    assertThat(config).isEqualTo(EvolutionConfig.defaults());
    assertThat(namespace.getInt("geneLength")).isEqualTo(EvolutionConstants.DEFAULT_GENE_LENGTH);
  }

  @Test
  public void toConfig_customArguments_areApplied() throws Exception {
    Namespace namespace =
        App.createArgumentParser()
            .parseArgs(
                new String[] {
                  "--populationSize", "4",
                  "--generations", "1",
                  "--tournamentSize", "2",
                  "--mutationRate", "0.5",
                  "--mutationStrength", "0.2",
                  "--seed", "123",
                  "--evaluationMode", "sequential"
                });

    EvolutionConfig config = App.toConfig(namespace);

    assertThat(config.populationSize()).isEqualTo(4);
    assertThat(config.generations()).isEqualTo(1);
    assertThat(config.tournamentSize()).isEqualTo(2);
    assertThat(config.mutationRate()).isEqualTo(0.5);
    assertThat(config.mutationStrength()).isEqualTo(0.2);
    assertThat(config.seed()).isEqualTo(123L);
    assertThat(config.evaluationMode()).isEqualTo(EvaluationMode.SEQUENTIAL);
  }

  @Test
  public void parseArgs_unknownEvaluationMode_isRejected() {
    assertThrows(
        ArgumentParserException.class,
        () ->
            App.createArgumentParser()
                .parseArgs(new String[] {"--evaluationMode", "distributed"}));
  }

  @Test
  public void run_allOnesScenarioThroughInjector_returnsPopulationOfConfiguredSize() {
    EvolutionConfig config =
        EvolutionConfig.builder()
            .setPopulationSize(4)
            .setGenerations(1)
            .setTournamentSize(2)
            .setSeed(1L)
            .build();
    App app =
        Guice.createInjector(EvolutionModule.create(config), ExampleModule.create())
            .getInstance(App.class);

    EvolutionSummary<RealVectorCandidate> summary = app.run(3);

    assertThat(summary.population().length()).isEqualTo(4);
    assertThat(summary.best().length()).isEqualTo(3);
  }
}
