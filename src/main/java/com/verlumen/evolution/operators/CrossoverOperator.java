package com.verlumen.evolution.operators;

import com.verlumen.evolution.core.Candidate;
import java.util.List;

/**
 * Combines two parents into one or more children.
 *
 * @param <C> the candidate type
 */
public interface CrossoverOperator<C extends Candidate<C>> {
  /**
   * Returns the children of the two parents: at least one, and any number beyond that. Must not
   * modify either parent. The engine crosses the pairs again when a generation needs more
   * children than one pass produces.
   */
  List<C> crossover(C parent1, C parent2);
}
