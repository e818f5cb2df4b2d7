package com.verlumen.placement.optimization;

import com.google.inject.Inject;
import com.verlumen.placement.fitness.FitnessContext;
import com.verlumen.placement.fitness.FitnessEvaluator;
import com.verlumen.placement.model.Candidate;
import io.jenetics.Genotype;
import io.jenetics.IntegerGene;
import io.jenetics.TournamentSelector;
import io.jenetics.engine.Engine;
import java.util.function.Function;

final class GAEngineFactoryImpl implements GAEngineFactory {
  private final FitnessEvaluator fitnessEvaluator;
  private final CandidateConverter candidateConverter;

  @Inject
  GAEngineFactoryImpl(FitnessEvaluator fitnessEvaluator, CandidateConverter candidateConverter) {
    this.fitnessEvaluator = fitnessEvaluator;
    this.candidateConverter = candidateConverter;
  }

  @Override
  public Engine<IntegerGene, Double> createEngine(
      FitnessContext context, OptimizationConfig config) {
    Function<Genotype<IntegerGene>, Double> fitness =
        genotype -> fitnessEvaluator.score(candidateConverter.toCandidate(genotype), context);

    // Every generation is fully replaced by altered offspring; the best-ever slot lives in the
    // optimizer. Evaluation runs on the caller's thread so a seeded RandomRegistry scope applies.
    return Engine.builder(fitness, createGenotype(context))
        .populationSize(config.populationSize())
        .offspringFraction(1.0)
        .maximalPhenotypeAge(Long.MAX_VALUE)
        .selector(new TournamentSelector<>(config.operators().tournamentSize()))
        .alterers(new AssignmentAlterer(context, config, candidateConverter))
        .executor(Runnable::run)
        .maximizing()
        .build();
  }

  /**
   * Creates the genotype template: one gene per resident over the hospital indexes.
   */
  private Genotype<IntegerGene> createGenotype(FitnessContext context) {
    return candidateConverter.toGenotype(
        Candidate.of(new int[context.residentCount()]), context.hospitalCount());
  }
}
