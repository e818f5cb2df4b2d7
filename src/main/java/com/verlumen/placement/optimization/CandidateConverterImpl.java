package com.verlumen.placement.optimization;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.inject.Inject;
import com.verlumen.placement.model.Candidate;
import io.jenetics.Chromosome;
import io.jenetics.Genotype;
import io.jenetics.IntegerChromosome;
import io.jenetics.IntegerGene;

/**
 * One chromosome per genotype, one gene per resident. Gene bounds are fixed by the hospital count
 * so every encoded candidate is a valid genotype.
 */
final class CandidateConverterImpl implements CandidateConverter {
  @Inject
  CandidateConverterImpl() {}

  @Override
  public Candidate toCandidate(Genotype<IntegerGene> genotype) {
    checkArgument(
        genotype.length() == 1, "Expected one chromosome but got %s", genotype.length());
    Chromosome<IntegerGene> chromosome = genotype.chromosome();
    int[] genes = new int[chromosome.length()];
    for (int i = 0; i < genes.length; i++) {
      genes[i] = chromosome.get(i).allele();
    }
    return Candidate.of(genes);
  }

  @Override
  public Genotype<IntegerGene> toGenotype(Candidate candidate, int hospitalCount) {
    checkArgument(hospitalCount > 0, "Hospital count must be positive: %s", hospitalCount);
    IntegerGene[] genes = new IntegerGene[candidate.size()];
    for (int i = 0; i < genes.length; i++) {
      genes[i] = IntegerGene.of(candidate.gene(i), 0, hospitalCount);
    }
    return Genotype.of(IntegerChromosome.of(genes));
  }
}
