package com.verlumen.placement.optimization;

import static com.google.common.base.Preconditions.checkState;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.google.inject.assistedinject.Assisted;
import com.verlumen.placement.fitness.FitnessContext;
import com.verlumen.placement.fitness.FitnessContextFactory;
import com.verlumen.placement.fitness.FitnessEvaluator;
import com.verlumen.placement.model.Candidate;
import com.verlumen.placement.model.Hospital;
import io.jenetics.IntegerGene;
import io.jenetics.Phenotype;
import io.jenetics.engine.Engine;
import io.jenetics.engine.EvolutionResult;
import io.jenetics.engine.EvolutionStart;
import io.jenetics.util.ISeq;
import io.jenetics.util.RandomRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Random;
import java.util.function.Supplier;
import java.util.random.RandomGenerator;
import java.util.stream.IntStream;

/**
 * Drives the Jenetics engine one generation at a time so that statistics, progress, convergence
 * and cancellation are handled between generations. The best phenotype of every generation is
 * compared against a single best-ever slot, whether or not it survives selection.
 */
final class PlacementOptimizerImpl implements PlacementOptimizer {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final FitnessContextFactory contextFactory;
  private final FitnessEvaluator fitnessEvaluator;
  private final GAEngineFactory engineFactory;
  private final CandidateConverter candidateConverter;
  private final int fiscalYear;
  private final OptimizationConfig config;

  private FitnessContext context;
  private State state = State.UNINITIALIZED;

  @Inject
  PlacementOptimizerImpl(
      FitnessContextFactory contextFactory,
      FitnessEvaluator fitnessEvaluator,
      GAEngineFactory engineFactory,
      CandidateConverter candidateConverter,
      @Assisted int fiscalYear,
      @Assisted OptimizationConfig config) {
    this.contextFactory = contextFactory;
    this.fitnessEvaluator = fitnessEvaluator;
    this.engineFactory = engineFactory;
    this.candidateConverter = candidateConverter;
    this.fiscalYear = fiscalYear;
    this.config = config;
    logger.atInfo().log("Placement optimizer created for fiscal year %d", fiscalYear);
  }

  @Override
  public boolean loadData() {
    checkState(state != State.EVOLVING, "Cannot load data while evolving");
    try {
      context = contextFactory.create(fiscalYear, config.mismatchBonus());
    } catch (IllegalArgumentException e) {
      logger.atWarning().withCause(e).log(
          "No usable placement data for %d: %s", fiscalYear, e.getMessage());
      context = null;
      state = State.UNINITIALIZED;
      return false;
    }
    state = State.DATA_LOADED;
    logger.atInfo().log(
        "Loaded %d residents, %d hospitals", context.residentCount(), context.hospitalCount());
    return true;
  }

  @Override
  public OptimizationResult optimize(ProgressListener listener, CancellationSignal cancellation) {
    checkState(context != null, "Data not loaded. Call loadData() first.");
    checkState(state != State.EVOLVING, "Optimization is already running");
    logger.atInfo().log(
        "Starting GA optimization: pop=%d, gen=%d", config.populationSize(), config.generations());

    state = State.EVOLVING;
    OptimizationResult result;
    try {
      result =
          config.seed().isPresent()
              ? RandomRegistry.with(
                  new Random(config.seed().getAsLong()), random -> evolve(listener, cancellation))
              : evolve(listener, cancellation);
    } catch (RuntimeException e) {
      state = State.DATA_LOADED;
      throw e;
    }
    state = State.COMPLETED;
    logger.atInfo().log(
        "Optimization complete after %d generations (%s). Best fitness: %.4f",
        result.generations(), result.terminationReason(), result.bestFitness());
    return result;
  }

  @Override
  public State state() {
    return state;
  }

  @Override
  public FitnessContext context() {
    checkState(context != null, "Data not loaded. Call loadData() first.");
    return context;
  }

  @Override
  public int fiscalYear() {
    return fiscalYear;
  }

  private OptimizationResult evolve(ProgressListener listener, CancellationSignal cancellation) {
    Engine<IntegerGene, Double> engine = engineFactory.createEngine(context, config);
    ISeq<Phenotype<IntegerGene, Double>> initial = initialPopulation();

    List<GenerationStats> statistics = new ArrayList<>();
    statistics.add(statsOf(0, initial));
    Phenotype<IntegerGene, Double> best = fittest(initial);
    notifyProgress(listener, 0, best.fitness());

    Supplier<EvolutionStart<IntegerGene, Double>> start = () -> EvolutionStart.of(initial, 1);
    Iterator<EvolutionResult<IntegerGene, Double>> results =
        engine.stream(start).limit(config.generations()).iterator();

    TerminationReason reason = TerminationReason.GENERATION_LIMIT;
    int generation = 0;
    while (generation < config.generations()) {
      if (cancellation.isCancelled()) {
        logger.atInfo().log("Optimization cancelled after generation %d", generation);
        reason = TerminationReason.CANCELLED;
        break;
      }
      EvolutionResult<IntegerGene, Double> result = results.next();
      generation++;

      Phenotype<IntegerGene, Double> fittest = fittest(result.population());
      if (fittest.fitness() > best.fitness()) {
        best = fittest;
      }
      GenerationStats stats = statsOf(generation, result.population());
      statistics.add(stats);
      logger.atFine().log(
          "Generation %d: avg=%.4f min=%.4f max=%.4f",
          generation, stats.average(), stats.min(), stats.max());

      if (generation % GAConstants.PROGRESS_INTERVAL == 0) {
        notifyProgress(listener, generation, best.fitness());
      }
      if (generation > GAConstants.CONVERGENCE_MIN_GENERATION
          && stats.isConverged(GAConstants.CONVERGENCE_TOLERANCE)) {
        logger.atInfo().log("Converged at generation %d", generation);
        reason = TerminationReason.CONVERGED;
        break;
      }
    }

    Candidate bestCandidate =
        candidateConverter.toCandidate(best.genotype()).withFitness(best.fitness());
    return new OptimizationResult(
        bestCandidate,
        best.fitness(),
        generation,
        assignmentsOf(bestCandidate),
        ImmutableList.copyOf(statistics),
        reason);
  }

  private ISeq<Phenotype<IntegerGene, Double>> initialPopulation() {
    RandomGenerator random = RandomRegistry.random();
    int residentCount = context.residentCount();
    int hospitalCount = context.hospitalCount();
    List<Phenotype<IntegerGene, Double>> population = new ArrayList<>(config.populationSize());
    for (int p = 0; p < config.populationSize(); p++) {
      int[] genes = new int[residentCount];
      for (int i = 0; i < residentCount; i++) {
        genes[i] = random.nextInt(hospitalCount);
      }
      Candidate candidate = Candidate.of(genes);
      population.add(
          Phenotype.of(
              candidateConverter.toGenotype(candidate, hospitalCount),
              0,
              fitnessEvaluator.score(candidate, context)));
    }
    return ISeq.of(population);
  }

  private ImmutableList<ResidentAssignment> assignmentsOf(Candidate best) {
    return IntStream.range(0, context.residentCount())
        .mapToObj(
            i -> {
              int residentId = context.residents().get(i).id();
              Hospital hospital = context.hospitalAt(best.gene(i));
              double fitness =
                  fitnessEvaluator.score(Candidate.of(best.gene(i)), context.narrowedTo(i));
              return new ResidentAssignment(
                  residentId, hospital.id(), context.hopeRank(residentId, hospital.id()), fitness);
            })
        .collect(toImmutableList());
  }

  private static Phenotype<IntegerGene, Double> fittest(
      ISeq<Phenotype<IntegerGene, Double>> population) {
    return population.stream()
        .max(Comparator.comparingDouble(phenotype -> phenotype.fitness()))
        .orElseThrow(() -> new IllegalStateException("Population is empty"));
  }

  private static GenerationStats statsOf(
      int generation, ISeq<Phenotype<IntegerGene, Double>> population) {
    return GenerationStats.of(
        generation, population.stream().mapToDouble(Phenotype::fitness));
  }

  private static void notifyProgress(ProgressListener listener, int generation, double fitness) {
    try {
      listener.onProgress(generation, fitness);
    } catch (RuntimeException e) {
      logger.atWarning().withCause(e).log("Progress listener failed at generation %d", generation);
    }
  }
}
