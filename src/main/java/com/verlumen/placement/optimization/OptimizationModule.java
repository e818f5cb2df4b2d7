package com.verlumen.placement.optimization;

import com.google.inject.AbstractModule;
import com.google.inject.assistedinject.FactoryModuleBuilder;

/** Binds the GA engine pieces and the assisted optimizer factory. */
public final class OptimizationModule extends AbstractModule {
  @Override
  protected void configure() {
    bind(CandidateConverter.class).to(CandidateConverterImpl.class);
    bind(GAEngineFactory.class).to(GAEngineFactoryImpl.class);
    install(
        new FactoryModuleBuilder()
            .implement(PlacementOptimizer.class, PlacementOptimizerImpl.class)
            .build(PlacementOptimizer.Factory.class));
  }
}
