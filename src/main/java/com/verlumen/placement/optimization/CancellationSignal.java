package com.verlumen.placement.optimization;

/**
 * Cooperative cancellation, polled once before each generation. A cancelled run stops and
 * reports the best candidate found so far.
 */
@FunctionalInterface
public interface CancellationSignal {
  CancellationSignal NEVER = () -> false;

  boolean isCancelled();
}
