package com.verlumen.placement.optimization;

import com.verlumen.placement.model.Candidate;
import io.jenetics.Genotype;
import io.jenetics.IntegerGene;

/** Converts between Jenetics genotypes and candidates. */
interface CandidateConverter {
  /**
   * Reads the single integer chromosome of a genotype as a candidate without fitness.
   *
   * @throws IllegalArgumentException if the genotype does not hold exactly one chromosome
   */
  Candidate toCandidate(Genotype<IntegerGene> genotype);

  /**
   * Encodes a candidate as a genotype whose genes range over {@code [0, hospitalCount)}.
   */
  Genotype<IntegerGene> toGenotype(Candidate candidate, int hospitalCount);
}
