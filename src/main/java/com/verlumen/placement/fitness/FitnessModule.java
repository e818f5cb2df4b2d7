package com.verlumen.placement.fitness;

import com.google.inject.AbstractModule;

/** Binds the context builder and the fitness evaluator. */
public final class FitnessModule extends AbstractModule {
  @Override
  protected void configure() {
    bind(FitnessContextFactory.class).to(FitnessContextFactoryImpl.class);
    bind(FitnessEvaluator.class).to(FitnessEvaluatorImpl.class);
  }
}
