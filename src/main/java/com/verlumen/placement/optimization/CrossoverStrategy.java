package com.verlumen.placement.optimization;

/** How two parents are recombined. */
public enum CrossoverStrategy {
  /** Exchange the segment between two random cut points. */
  TWO_POINT,
  /** Swap each gene independently. */
  UNIFORM
}
