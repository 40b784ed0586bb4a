package com.verlumen.evolution.operators;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.mockito.Mockito.when;

import com.google.common.primitives.ImmutableDoubleArray;
import com.verlumen.evolution.core.ContractViolationException;
import com.verlumen.evolution.core.NonComparableFitnessException;
import com.verlumen.evolution.example.RealVectorCandidate;
import io.jenetics.util.ISeq;
import java.util.SplittableRandom;
import java.util.random.RandomGenerator;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnit;
import org.mockito.junit.MockitoRule;

@RunWith(JUnit4.class)
public class TournamentSelectionTest {
  @Rule public MockitoRule mockitoRule = MockitoJUnit.rule();

  @Mock private RandomGenerator mockRandom;

  private ISeq<RealVectorCandidate> population;
  private ImmutableDoubleArray fitness;

  @Before
  public void setUp() {
    // Candidates 1 and 3 share the best fitness.
    population =
        ISeq.of(
            RealVectorCandidate.of(5.0),
            RealVectorCandidate.of(4.0, 5.0),
            RealVectorCandidate.of(1.0),
            RealVectorCandidate.of(9.0));
    fitness = ImmutableDoubleArray.of(5.0, 9.0, 1.0, 9.0);
  }

  @Test
  public void select_tiedBest_returnsLastDrawnMaximum() {
    TournamentSelection<RealVectorCandidate> selection = new TournamentSelection<>(3);
    when(mockRandom.nextInt(4)).thenReturn(1, 3, 0, 3, 1, 2, 3, 0, 1, 2, 2, 2);

    ISeq<RealVectorCandidate> parents = selection.select(population, fitness, mockRandom);

    assertThat(parents.asList())
        .containsExactly(
            population.get(3), population.get(1), population.get(1), population.get(2))
        .inOrder();
  }

  @Test
  public void select_tiedBest_winnerDependsOnDrawOrderNotIndex() {
    TournamentSelection<RealVectorCandidate> selection = new TournamentSelection<>(2);
    when(mockRandom.nextInt(4)).thenReturn(3, 1, 1, 3, 0, 2, 2, 0);

    ISeq<RealVectorCandidate> parents = selection.select(population, fitness, mockRandom);

    assertThat(parents.asList())
        .containsExactly(
            population.get(1), population.get(3), population.get(0), population.get(0))
        .inOrder();
  }

  @Test
  public void select_signedZeroFitness_treatedAsTie() {
    ISeq<RealVectorCandidate> zeros =
        ISeq.of(RealVectorCandidate.of(0.0), RealVectorCandidate.of(-0.0));
    TournamentSelection<RealVectorCandidate> selection = new TournamentSelection<>(2);
    when(mockRandom.nextInt(2)).thenReturn(1, 0, 0, 1);

    ISeq<RealVectorCandidate> parents =
        selection.select(zeros, ImmutableDoubleArray.of(0.0, -0.0), mockRandom);

    assertThat(parents.asList()).containsExactly(zeros.get(0), zeros.get(1)).inOrder();
  }

  @Test
  public void select_returnsIndependentCopies() {
    TournamentSelection<RealVectorCandidate> selection = new TournamentSelection<>(1);
    when(mockRandom.nextInt(4)).thenReturn(0);

    ISeq<RealVectorCandidate> parents = selection.select(population, fitness, mockRandom);

    assertThat(parents.get(0)).isEqualTo(population.get(0));
    assertThat(parents.get(0)).isNotSameInstanceAs(population.get(0));
    assertThat(parents.get(1)).isNotSameInstanceAs(parents.get(0));
  }

  @Test
  public void select_returnsOneParentPerCandidate() {
    TournamentSelection<RealVectorCandidate> selection = new TournamentSelection<>(3);

    ISeq<RealVectorCandidate> parents =
        selection.select(population, fitness, new SplittableRandom(7));

    assertThat(parents.length()).isEqualTo(population.length());
  }

  @Test
  public void select_largeTournament_alwaysFindsBest() {
    ISeq<RealVectorCandidate> distinct =
        ISeq.of(
            RealVectorCandidate.of(1.0), RealVectorCandidate.of(3.0), RealVectorCandidate.of(2.0));
    TournamentSelection<RealVectorCandidate> selection = new TournamentSelection<>(200);

    ISeq<RealVectorCandidate> parents =
        selection.select(distinct, ImmutableDoubleArray.of(1.0, 3.0, 2.0), new SplittableRandom(1));

    assertThat(parents.asList()).containsExactly(distinct.get(1), distinct.get(1), distinct.get(1));
  }

  @Test
  public void select_emptyPopulation_throwsContractViolation() {
    TournamentSelection<RealVectorCandidate> selection = new TournamentSelection<>(2);

    assertThrows(
        ContractViolationException.class,
        () -> selection.select(ISeq.empty(), ImmutableDoubleArray.of(), new SplittableRandom(1)));
  }

  @Test
  public void select_fitnessCountMismatch_throwsContractViolation() {
    TournamentSelection<RealVectorCandidate> selection = new TournamentSelection<>(2);

    ContractViolationException thrown =
        assertThrows(
            ContractViolationException.class,
            () ->
                selection.select(
                    population, ImmutableDoubleArray.of(1.0, 2.0), new SplittableRandom(1)));

    assertThat(thrown).hasMessageThat().contains("does not match population size 4");
  }

  @Test
  public void select_nanFitness_throwsNonComparableFitness() {
    TournamentSelection<RealVectorCandidate> selection = new TournamentSelection<>(2);
    when(mockRandom.nextInt(4)).thenReturn(0, 1);

    assertThrows(
        NonComparableFitnessException.class,
        () ->
            selection.select(
                population, ImmutableDoubleArray.of(Double.NaN, 1.0, 2.0, 3.0), mockRandom));
  }

  @Test
  public void constructor_nonPositiveTournamentSize_throwsException() {
    assertThrows(
        IllegalArgumentException.class, () -> new TournamentSelection<RealVectorCandidate>(0));
  }
}
