/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.cqptree.compile;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import net.hydromatic.cqptree.ast.Identifier;
import net.hydromatic.cqptree.query.Constraint;

/**
 * Sequence of the arrangements of a set of tokens, that is, every order of
 * the tokens that is consistent with a collection of order constraints.
 *
 * <p>Arrangements are generated lazily, by backtracking, and each call to
 * {@link #iterator()} starts again from the beginning. The number of
 * arrangements is factorial in the number of unconstrained tokens.
 */
public class Arrangements implements Iterable<ImmutableList<Identifier>> {
  private final ImmutableList<Identifier> identifiers;

  /** For each token (by index), the indexes of tokens that must precede
   * it. */
  private final ImmutableList<ImmutableList<Integer>> predecessors;

  private Arrangements(
      ImmutableList<Identifier> identifiers,
      ImmutableList<ImmutableList<Integer>> predecessors) {
    this.identifiers = identifiers;
    this.predecessors = predecessors;
  }

  /**
   * Creates the arrangements of some tokens.
   *
   * <p>Order constraints that refer to tokens not in the collection are
   * ignored.
   */
  public static Arrangements of(
      Collection<Identifier> identifiers,
      Iterable<Constraint.Order> orders) {
    final ImmutableList<Identifier> list = ImmutableList.copyOf(identifiers);
    final List<List<Integer>> predecessors = new ArrayList<>();
    list.forEach(id -> predecessors.add(new ArrayList<>()));
    for (Constraint.Order order : orders) {
      final int fst = list.indexOf(order.fst);
      final int snd = list.indexOf(order.snd);
      if (fst >= 0 && snd >= 0 && !predecessors.get(snd).contains(fst)) {
        predecessors.get(snd).add(fst);
      }
    }
    final ImmutableList.Builder<ImmutableList<Integer>> b =
        ImmutableList.builder();
    predecessors.forEach(p -> b.add(ImmutableList.copyOf(p)));
    return new Arrangements(list, b.build());
  }

  @Override
  public Iterator<ImmutableList<Identifier>> iterator() {
    return new ArrangementIterator();
  }

  /** Walks the tree of partial arrangements depth-first.
   *
   * <p>{@code choice[d]} is the index of the token at position {@code d}, or
   * -1 if no token has been tried at that position yet. */
  private class ArrangementIterator
      extends AbstractIterator<ImmutableList<Identifier>> {
    final int n = identifiers.size();
    final int[] choice = new int[n];
    final boolean[] placed = new boolean[n];
    int depth;

    ArrangementIterator() {
      if (n == 0) {
        depth = -1;
      } else {
        choice[0] = -1;
      }
    }

    @Override
    protected ImmutableList<Identifier> computeNext() {
      while (depth >= 0) {
        if (choice[depth] >= 0) {
          placed[choice[depth]] = false;
        }
        final int next = nextCandidate(choice[depth] + 1);
        if (next < 0) {
          --depth;
          continue;
        }
        choice[depth] = next;
        placed[next] = true;
        if (depth == n - 1) {
          final ImmutableList.Builder<Identifier> b = ImmutableList.builder();
          for (int i : choice) {
            b.add(identifiers.get(i));
          }
          return b.build();
        }
        choice[++depth] = -1;
      }
      return endOfData();
    }

    /** Returns the first token, starting at index {@code start}, that is not
     * placed and whose predecessors are all placed; or -1. */
    private int nextCandidate(int start) {
      for (int i = start; i < n; i++) {
        if (!placed[i] && allPlaced(predecessors.get(i))) {
          return i;
        }
      }
      return -1;
    }

    private boolean allPlaced(List<Integer> indexes) {
      for (int i : indexes) {
        if (!placed[i]) {
          return false;
        }
      }
      return true;
    }
  }
}

// End Arrangements.java
