package com.verlumen.placement.optimization;

import static com.google.common.base.Preconditions.checkState;

import com.verlumen.placement.fitness.FitnessContext;
import com.verlumen.placement.model.Candidate;
import io.jenetics.Alterer;
import io.jenetics.AltererResult;
import io.jenetics.IntegerGene;
import io.jenetics.Phenotype;
import io.jenetics.util.ISeq;
import io.jenetics.util.RandomRegistry;
import io.jenetics.util.Seq;
import java.util.ArrayList;
import java.util.List;
import java.util.random.RandomGenerator;

/**
 * Applies one generation of variation to the selected offspring.
 *
 * <p>Adjacent pairs are recombined with the crossover probability. Each offspring then mutates
 * with the mutation probability, running random, capacity-aware and hope-aware mutation in that
 * order, followed by swap mutation when it is enabled. Only offspring whose genes changed come
 * back as new, unevaluated phenotypes.
 */
final class AssignmentAlterer implements Alterer<IntegerGene, Double> {
  private final FitnessContext context;
  private final OptimizationConfig config;
  private final CandidateConverter converter;

  AssignmentAlterer(
      FitnessContext context, OptimizationConfig config, CandidateConverter converter) {
    this.context = context;
    this.config = config;
    this.converter = converter;
  }

  @Override
  public AltererResult<IntegerGene, Double> alter(
      Seq<Phenotype<IntegerGene, Double>> population, long generation) {
    RandomGenerator random = RandomRegistry.random();
    List<Candidate> parents = new ArrayList<>(population.size());
    for (Phenotype<IntegerGene, Double> phenotype : population) {
      parents.add(converter.toCandidate(phenotype.genotype()));
    }

    List<Candidate> offspring = new ArrayList<>(parents);
    for (int i = 0; i + 1 < offspring.size(); i += 2) {
      if (random.nextDouble() < config.crossoverProbability()) {
        CandidateOperators.Children children =
            crossover(offspring.get(i), offspring.get(i + 1), random);
        offspring.set(i, children.first());
        offspring.set(i + 1, children.second());
      }
    }
    for (int i = 0; i < offspring.size(); i++) {
      if (random.nextDouble() < config.mutationProbability()) {
        offspring.set(i, mutate(offspring.get(i), random));
      }
    }

    List<Phenotype<IntegerGene, Double>> altered = new ArrayList<>(offspring.size());
    int alterations = 0;
    for (int i = 0; i < offspring.size(); i++) {
      Candidate child = offspring.get(i);
      if (child.hasSameGenes(parents.get(i))) {
        altered.add(population.get(i));
      } else {
        checkGenes(child);
        altered.add(
            Phenotype.of(converter.toGenotype(child, context.hospitalCount()), generation));
        alterations++;
      }
    }
    return new AltererResult<>(ISeq.of(altered), alterations);
  }

  private CandidateOperators.Children crossover(
      Candidate first, Candidate second, RandomGenerator random) {
    switch (config.operators().crossoverStrategy()) {
      case UNIFORM:
        return CandidateOperators.uniformCrossover(
            first, second, config.operators().uniformCrossoverIndpb(), random);
      case TWO_POINT:
      default:
        return CandidateOperators.twoPointCrossover(first, second, random);
    }
  }

  private Candidate mutate(Candidate candidate, RandomGenerator random) {
    OperatorConfig operators = config.operators();
    Candidate mutant =
        CandidateOperators.randomMutation(
            candidate, context.hospitalCount(), operators.randomMutationIndpb(), random);
    mutant =
        CandidateOperators.capacityAwareMutation(
            mutant, context, operators.capacityMutationIndpb(), random);
    mutant =
        CandidateOperators.hopeAwareMutation(
            mutant, context, operators.hopeMutationIndpb(), random);
    if (operators.swapMutationIndpb() > 0) {
      mutant = CandidateOperators.swapMutation(mutant, operators.swapMutationIndpb(), random);
    }
    return mutant;
  }

  private void checkGenes(Candidate candidate) {
    checkState(
        candidate.size() == context.residentCount(),
        "Candidate has %s genes for %s residents",
        candidate.size(),
        context.residentCount());
    for (int i = 0; i < candidate.size(); i++) {
      int gene = candidate.gene(i);
      checkState(
          gene >= 0 && gene < context.hospitalCount(),
          "Resident %s assigned to invalid hospital index %s",
          i,
          gene);
    }
  }
}
