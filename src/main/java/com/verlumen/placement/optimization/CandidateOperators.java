package com.verlumen.placement.optimization;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.verlumen.placement.fitness.FitnessContext;
import com.verlumen.placement.model.Candidate;
import java.util.ArrayList;
import java.util.List;
import java.util.random.RandomGenerator;

/**
 * Crossover and mutation operators over candidates.
 *
 * <p>Every operator is a pure function of its inputs and the supplied random generator: inputs are
 * never modified, and a candidate whose genes are left unchanged is returned as is, cached fitness
 * included.
 */
final class CandidateOperators {
  private CandidateOperators() {}

  /** The two offspring of a crossover. */
  record Children(Candidate first, Candidate second) {}

  /**
   * Exchanges the segment between two cut points drawn uniformly from {@code [1, size - 1]}.
   * Parents shorter than two genes are returned unchanged.
   */
  static Children twoPointCrossover(Candidate first, Candidate second, RandomGenerator random) {
    checkSameSize(first, second);
    int size = first.size();
    if (size < 2) {
      return new Children(first, second);
    }
    int from = random.nextInt(1, size);
    int to = random.nextInt(1, size);
    if (to < from) {
      int swap = from;
      from = to;
      to = swap;
    }

    int[] child1 = first.toArray();
    int[] child2 = second.toArray();
    for (int i = from; i < to; i++) {
      child1[i] = second.gene(i);
      child2[i] = first.gene(i);
    }
    return new Children(first.withGenes(child1), second.withGenes(child2));
  }

  /** Swaps each gene position between the parents with probability {@code indpb}. */
  static Children uniformCrossover(
      Candidate first, Candidate second, double indpb, RandomGenerator random) {
    checkSameSize(first, second);
    int[] child1 = first.toArray();
    int[] child2 = second.toArray();
    for (int i = 0; i < child1.length; i++) {
      if (random.nextDouble() < indpb) {
        child1[i] = second.gene(i);
        child2[i] = first.gene(i);
      }
    }
    return new Children(first.withGenes(child1), second.withGenes(child2));
  }

  /** Replaces each gene with probability {@code indpb} by a uniformly random hospital index. */
  static Candidate randomMutation(
      Candidate candidate, int hospitalCount, double indpb, RandomGenerator random) {
    checkArgument(hospitalCount > 0, "Hospital count must be positive: %s", hospitalCount);
    int[] genes = candidate.toArray();
    for (int i = 0; i < genes.length; i++) {
      if (random.nextDouble() < indpb) {
        genes[i] = random.nextInt(hospitalCount);
      }
    }
    return candidate.withGenes(genes);
  }

  /** With probability {@code indpb}, swaps two distinct gene positions. */
  static Candidate swapMutation(Candidate candidate, double indpb, RandomGenerator random) {
    int size = candidate.size();
    if (size < 2 || random.nextDouble() >= indpb) {
      return candidate;
    }
    int i = random.nextInt(size);
    int j = random.nextInt(size - 1);
    if (j >= i) {
      j++;
    }
    int[] genes = candidate.toArray();
    genes[i] = candidate.gene(j);
    genes[j] = candidate.gene(i);
    return candidate.withGenes(genes);
  }

  /**
   * With probability {@code indpb}, moves the first resident found at an over-capacity hospital to
   * a randomly chosen hospital that still has room. At most one resident moves per call; nothing
   * moves when no hospital is over capacity or none has room.
   */
  static Candidate capacityAwareMutation(
      Candidate candidate, FitnessContext context, double indpb, RandomGenerator random) {
    if (random.nextDouble() > indpb) {
      return candidate;
    }

    int hospitalCount = context.hospitalCount();
    int[] counts = new int[hospitalCount];
    for (int i = 0; i < candidate.size(); i++) {
      int gene = candidate.gene(i);
      checkState(
          gene >= 0 && gene < hospitalCount,
          "Gene %s is outside the %s hospital indexes",
          gene,
          hospitalCount);
      counts[gene]++;
    }

    boolean[] overCapacity = new boolean[hospitalCount];
    List<Integer> withRoom = new ArrayList<>();
    boolean anyOver = false;
    for (int h = 0; h < hospitalCount; h++) {
      int capacity = context.capacityOf(context.hospitals().get(h).id());
      if (counts[h] > capacity) {
        overCapacity[h] = true;
        anyOver = true;
      } else if (counts[h] < capacity) {
        withRoom.add(h);
      }
    }
    if (!anyOver || withRoom.isEmpty()) {
      return candidate;
    }

    int[] genes = candidate.toArray();
    for (int i = 0; i < genes.length; i++) {
      if (overCapacity[genes[i]]) {
        genes[i] = withRoom.get(random.nextInt(withRoom.size()));
        break;
      }
    }
    return candidate.withGenes(genes);
  }

  /**
   * With probability {@code indpb}, reassigns the first resident placed outside their declared
   * choices to one of those choices, picked uniformly. Residents without usable choices are
   * skipped. At most one resident moves per call.
   */
  static Candidate hopeAwareMutation(
      Candidate candidate, FitnessContext context, double indpb, RandomGenerator random) {
    if (random.nextDouble() > indpb) {
      return candidate;
    }

    for (int i = 0; i < candidate.size(); i++) {
      int residentId = context.residents().get(i).id();
      ImmutableList<Integer> choiceIndexes = context.choiceIndexesOf(residentId);
      if (choiceIndexes.isEmpty() || choiceIndexes.contains(candidate.gene(i))) {
        continue;
      }
      int[] genes = candidate.toArray();
      genes[i] = choiceIndexes.get(random.nextInt(choiceIndexes.size()));
      return candidate.withGenes(genes);
    }
    return candidate;
  }

  private static void checkSameSize(Candidate first, Candidate second) {
    checkArgument(
        first.size() == second.size(),
        "Parents differ in length: %s and %s",
        first.size(),
        second.size());
  }
}
