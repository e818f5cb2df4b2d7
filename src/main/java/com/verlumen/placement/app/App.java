package com.verlumen.placement.app;

import com.google.common.flogger.FluentLogger;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.verlumen.placement.config.PlacementSettings;
import com.verlumen.placement.config.SettingKey;
import com.verlumen.placement.config.SettingsLoader;
import com.verlumen.placement.execution.RunMode;
import com.verlumen.placement.optimization.CancellationSignal;
import com.verlumen.placement.optimization.OptimizationConfig;
import com.verlumen.placement.optimization.OptimizationResult;
import com.verlumen.placement.optimization.ResidentAssignment;
import java.nio.file.Path;
import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.Namespace;

final class App {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final PlacementService placementService;

  @Inject
  App(PlacementService placementService) {
    this.placementService = placementService;
  }

  OptimizationResult run(int fiscalYear, OptimizationConfig config, RunMode runMode) {
    logger.atInfo().log("Starting placement for fiscal year %d in %s mode", fiscalYear, runMode);
    OptimizationResult result =
        placementService.run(
            fiscalYear,
            config,
            (generation, bestFitness) ->
                logger.atInfo().log("Generation %d: best fitness %.4f", generation, bestFitness),
            CancellationSignal.NEVER,
            runMode);
    for (ResidentAssignment assignment : result.assignments()) {
      logger.atInfo().log(
          "Resident %d -> hospital %d (hope rank %d, fitness %.4f)",
          assignment.residentId(),
          assignment.hospitalId(),
          assignment.hopeRank(),
          assignment.fitness());
    }
    logger.atInfo().log(
        "Best fitness %.4f after %d generations, %d of %d residents outside their choices",
        result.bestFitness(),
        result.generations(),
        result.mismatchCount(),
        result.assignments().size());
    return result;
  }

  public static void main(String[] args) throws Exception {
    logger.atInfo().log("Resident placement starting up with %d arguments", args.length);
    try {
      Namespace namespace = createParser().parseArgs(args);
      PlacementSettings settings = settingsFrom(namespace);
      OptimizationConfig config = settings.toOptimizationConfig();
      Long seed = namespace.get("seed");
      if (seed != null) {
        config = config.withSeed(seed);
      }
      RunMode runMode = RunMode.fromString(namespace.getString("runMode"));

      PlacementModule module =
          PlacementModule.create(
              Path.of(namespace.getString("data")), Path.of(namespace.getString("output")));
      App app = Guice.createInjector(module).getInstance(App.class);
      logger.atInfo().log("Guice initialization complete, running placement");
      app.run(settings.fiscalYear(), config, runMode);
    } catch (Exception e) {
      logger.atSevere().withCause(e).log("Fatal error during placement");
      throw e;
    }
  }

  /** Settings file values, then explicit flags on top. */
  static PlacementSettings settingsFrom(Namespace namespace) {
    String settingsPath = namespace.getString("settings");
    PlacementSettings settings =
        settingsPath == null
            ? PlacementSettings.defaults()
            : SettingsLoader.load(Path.of(settingsPath));
    settings = override(settings, SettingKey.FISCAL_YEAR, namespace.getString("fiscalYear"));
    settings =
        override(settings, SettingKey.GA_POPULATION_SIZE, namespace.getString("populationSize"));
    settings = override(settings, SettingKey.GA_GENERATIONS, namespace.getString("generations"));
    settings =
        override(
            settings, SettingKey.GA_CROSSOVER_PROB, namespace.getString("crossoverProbability"));
    settings =
        override(
            settings, SettingKey.GA_MUTATION_PROB, namespace.getString("mutationProbability"));
    return settings;
  }

  private static PlacementSettings override(
      PlacementSettings settings, SettingKey key, String value) {
    return value == null ? settings : settings.with(key, value);
  }

  static ArgumentParser createParser() {
    ArgumentParser parser = ArgumentParsers.newFor("ResidentPlacement")
      .build()
      .defaultHelp(true)
      .description("Genetic-algorithm placement of residents to hospitals");

    // Input and output
    parser.addArgument("--data")
      .required(true)
      .help("JSON placement dataset");

    parser.addArgument("--output")
      .setDefault("assignments.json")
      .help("JSON file the assignments are saved to");

    parser.addArgument("--settings")
      .help("YAML settings file");

    // Optimizer overrides
    parser.addArgument("--fiscalYear")
      .help("Fiscal year to place (default: settings value)");

    parser.addArgument("--populationSize")
      .help("Population size, 10 to 500");

    parser.addArgument("--generations")
      .help("Generation limit, 50 to 1000");

    parser.addArgument("--crossoverProbability")
      .help("Crossover probability, 0 to 1");

    parser.addArgument("--mutationProbability")
      .help("Mutation probability, 0 to 1");

    parser.addArgument("--seed")
      .type(Long.class)
      .help("Random seed for a reproducible run");

    // Run mode configuration
    parser.addArgument("--runMode")
      .choices("wet", "dry")
      .setDefault("wet")
      .help("Run mode: wet saves assignments, dry only reports them");

    return parser;
  }
}
