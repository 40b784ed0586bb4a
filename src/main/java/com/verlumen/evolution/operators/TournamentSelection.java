package com.verlumen.evolution.operators;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.primitives.ImmutableDoubleArray;
import com.verlumen.evolution.core.Candidate;
import com.verlumen.evolution.core.ContractViolationException;
import com.verlumen.evolution.core.Fitness;
import io.jenetics.util.ISeq;
import io.jenetics.util.MSeq;
import java.util.random.RandomGenerator;

/**
 * Tournament selection. For each of the N output slots, draws {@code tournamentSize} indices
 * uniformly with replacement and keeps the fittest of them.
 *
 * <p>Ties are broken by draw order: among equally fit draws the one drawn <em>last</em> wins, not
 * the one with the lowest index.
 */
public final class TournamentSelection<C extends Candidate<C>> implements SelectionStrategy<C> {
  private final int tournamentSize;

  public TournamentSelection(int tournamentSize) {
    checkArgument(tournamentSize >= 1, "Tournament size must be positive: %s", tournamentSize);
    this.tournamentSize = tournamentSize;
  }

  public int tournamentSize() {
    return tournamentSize;
  }

  @Override
  public ISeq<C> select(ISeq<C> population, ImmutableDoubleArray fitness, RandomGenerator random) {
    if (population.isEmpty()) {
      throw new ContractViolationException("Cannot select from an empty population");
    }
    if (fitness.length() != population.length()) {
      throw new ContractViolationException(
          String.format(
              "Fitness count %d does not match population size %d",
              fitness.length(), population.length()));
    }

    int size = population.length();
    MSeq<C> parents = MSeq.ofLength(size);
    for (int slot = 0; slot < size; slot++) {
      parents.set(slot, population.get(runTournament(fitness, size, random)).copy());
    }
    return parents.toISeq();
  }

  private int runTournament(ImmutableDoubleArray fitness, int size, RandomGenerator random) {
    int winner = random.nextInt(size);
    for (int draw = 1; draw < tournamentSize; draw++) {
      int challenger = random.nextInt(size);
      // >= so that a later draw wins a tie.
      if (Fitness.compare(fitness.get(challenger), fitness.get(winner)) >= 0) {
        winner = challenger;
      }
    }
    Fitness.checkComparable(fitness.get(winner));
    return winner;
  }
}
