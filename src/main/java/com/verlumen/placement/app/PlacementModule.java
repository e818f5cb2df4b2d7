package com.verlumen.placement.app;

import com.google.auto.value.AutoValue;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.verlumen.placement.data.JsonPlacementDataLoader;
import com.verlumen.placement.data.PlacementDataSource;
import com.verlumen.placement.fitness.FitnessModule;
import com.verlumen.placement.optimization.OptimizationModule;
import com.verlumen.placement.persistence.AssignmentRepository;
import com.verlumen.placement.persistence.JsonAssignmentRepository;
import java.nio.file.Path;

@AutoValue
abstract class PlacementModule extends AbstractModule {
  static PlacementModule create(Path dataPath, Path outputPath) {
    return new AutoValue_PlacementModule(dataPath, outputPath);
  }

  abstract Path dataPath();

  abstract Path outputPath();

  @Override
  protected void configure() {
    install(new FitnessModule());
    install(new OptimizationModule());
  }

  @Provides
  @Singleton
  PlacementDataSource providePlacementDataSource() {
    return JsonPlacementDataLoader.load(dataPath());
  }

  @Provides
  @Singleton
  AssignmentRepository provideAssignmentRepository() {
    return new JsonAssignmentRepository(outputPath());
  }
}
