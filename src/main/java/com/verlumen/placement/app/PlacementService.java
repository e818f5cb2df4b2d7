package com.verlumen.placement.app;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.placement.execution.RunMode;
import com.verlumen.placement.fitness.FitnessContext;
import com.verlumen.placement.optimization.CancellationSignal;
import com.verlumen.placement.optimization.OptimizationConfig;
import com.verlumen.placement.optimization.OptimizationResult;
import com.verlumen.placement.optimization.PlacementOptimizer;
import com.verlumen.placement.optimization.ProgressListener;
import com.verlumen.placement.persistence.AssignmentRecord;
import com.verlumen.placement.persistence.AssignmentRecordFactory;
import com.verlumen.placement.persistence.AssignmentRepository;

/** Runs a placement end to end: load data, optimize and, in wet runs, save the assignments. */
public final class PlacementService {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final PlacementOptimizer.Factory optimizerFactory;
  private final AssignmentRepository assignmentRepository;

  @Inject
  PlacementService(
      PlacementOptimizer.Factory optimizerFactory, AssignmentRepository assignmentRepository) {
    this.optimizerFactory = optimizerFactory;
    this.assignmentRepository = assignmentRepository;
  }

  public OptimizationResult run(int fiscalYear, OptimizationConfig config, RunMode runMode) {
    return run(fiscalYear, config, ProgressListener.NONE, CancellationSignal.NEVER, runMode);
  }

  /**
   * Optimizes the placement for a fiscal year.
   *
   * @throws IllegalStateException if there are no residents or no hospitals to place
   */
  public OptimizationResult run(
      int fiscalYear,
      OptimizationConfig config,
      ProgressListener listener,
      CancellationSignal cancellation,
      RunMode runMode) {
    PlacementOptimizer optimizer = optimizerFactory.create(fiscalYear, config);
    if (!optimizer.loadData()) {
      throw new IllegalStateException("Failed to load data for optimization");
    }
    OptimizationResult result = optimizer.optimize(listener, cancellation);
    if (runMode.persistsResults()) {
      save(result, optimizer.context());
    } else {
      logger.atInfo().log("Dry run: %d assignments not saved", result.assignments().size());
    }
    return result;
  }

  /**
   * Replaces the fiscal year's saved assignments with those of {@code result}.
   *
   * @return the number of records saved
   */
  public int save(OptimizationResult result, FitnessContext context) {
    ImmutableList<AssignmentRecord> records = AssignmentRecordFactory.create(result, context);
    int saved = assignmentRepository.replaceFiscalYear(context.fiscalYear(), records);
    logger.atInfo().log("Saved %d assignments", saved);
    return saved;
  }
}
