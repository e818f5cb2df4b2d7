package com.verlumen.placement.model;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.MoreObjects;
import com.google.common.primitives.ImmutableIntArray;
import java.util.Arrays;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * One complete assignment of every resident to a hospital.
 *
 * <p>Gene {@code i} is the index of the hospital assigned to resident {@code i}. A candidate may
 * carry a cached fitness; any copy with different genes starts without one.
 */
public final class Candidate {
  private final ImmutableIntArray genes;
  private final OptionalDouble fitness;

  private Candidate(ImmutableIntArray genes, OptionalDouble fitness) {
    this.genes = genes;
    this.fitness = fitness;
  }

  public static Candidate of(int... genes) {
    return new Candidate(ImmutableIntArray.copyOf(genes), OptionalDouble.empty());
  }

  public int size() {
    return genes.length();
  }

  public int gene(int index) {
    return genes.get(index);
  }

  /** Returns a mutable copy of the genes. */
  public int[] toArray() {
    return genes.toArray();
  }

  public OptionalDouble fitness() {
    return fitness;
  }

  public Candidate withFitness(double value) {
    return new Candidate(genes, OptionalDouble.of(value));
  }

  /** Returns a candidate with the given genes and no cached fitness. */
  public Candidate withGenes(int[] newGenes) {
    checkArgument(
        newGenes.length == genes.length(),
        "Expected %s genes but got %s",
        genes.length(),
        newGenes.length);
    return Arrays.equals(newGenes, genes.toArray()) ? this : Candidate.of(newGenes);
  }

  public boolean hasSameGenes(Candidate other) {
    return genes.equals(other.genes);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Candidate)) {
      return false;
    }
    Candidate that = (Candidate) o;
    return genes.equals(that.genes) && fitness.equals(that.fitness);
  }

  @Override
  public int hashCode() {
    return Objects.hash(genes, fitness);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("genes", genes)
        .add("fitness", fitness)
        .toString();
  }
}
