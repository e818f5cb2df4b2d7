package com.verlumen.placement.optimization;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class OptimizationConfigTest {
  @Test
  public void defaults_matchConstants() {
    OptimizationConfig config = OptimizationConfig.defaults();

    assertThat(config.populationSize()).isEqualTo(100);
    assertThat(config.generations()).isEqualTo(200);
    assertThat(config.crossoverProbability()).isEqualTo(0.7);
    assertThat(config.mutationProbability()).isEqualTo(0.2);
    assertThat(config.mismatchBonus()).isEqualTo(1.5);
    assertThat(config.seed().isPresent()).isFalse();
    assertThat(config.operators()).isEqualTo(OperatorConfig.defaults());
  }

  @Test
  public void create_acceptsRangeBounds() {
    OptimizationConfig low = OptimizationConfig.create(10, 50, 0.0, 0.0, 1.0);
    OptimizationConfig high = OptimizationConfig.create(500, 1000, 1.0, 1.0, 5.0);

    assertThat(low.populationSize()).isEqualTo(10);
    assertThat(high.generations()).isEqualTo(1000);
  }

  @Test
  public void create_populationOutOfRange_throws() {
    assertThrows(
        IllegalArgumentException.class, () -> OptimizationConfig.create(9, 200, 0.7, 0.2, 1.5));
    assertThrows(
        IllegalArgumentException.class, () -> OptimizationConfig.create(501, 200, 0.7, 0.2, 1.5));
  }

  @Test
  public void create_generationsOutOfRange_throws() {
    assertThrows(
        IllegalArgumentException.class, () -> OptimizationConfig.create(100, 49, 0.7, 0.2, 1.5));
    assertThrows(
        IllegalArgumentException.class,
        () -> OptimizationConfig.create(100, 1001, 0.7, 0.2, 1.5));
  }

  @Test
  public void create_probabilityOutOfRange_throws() {
    assertThrows(
        IllegalArgumentException.class, () -> OptimizationConfig.create(100, 200, 1.1, 0.2, 1.5));
    assertThrows(
        IllegalArgumentException.class, () -> OptimizationConfig.create(100, 200, 0.7, -0.1, 1.5));
  }

  @Test
  public void create_mismatchBonusOutOfRange_throws() {
    assertThrows(
        IllegalArgumentException.class, () -> OptimizationConfig.create(100, 200, 0.7, 0.2, 0.9));
    assertThrows(
        IllegalArgumentException.class, () -> OptimizationConfig.create(100, 200, 0.7, 0.2, 5.1));
  }

  @Test
  public void forTesting_skipsProductionRanges() {
    OptimizationConfig config = OptimizationConfig.forTesting(4, 3, 0.5, 0.5);

    assertThat(config.populationSize()).isEqualTo(4);
    assertThat(config.generations()).isEqualTo(3);
  }

  @Test
  public void forTesting_stillRejectsNonPositiveSizes() {
    assertThrows(
        IllegalArgumentException.class, () -> OptimizationConfig.forTesting(0, 3, 0.5, 0.5));
  }

  @Test
  public void withSeed_keepsOtherSettings() {
    OptimizationConfig config = OptimizationConfig.defaults().withSeed(42);

    assertThat(config.seed().getAsLong()).isEqualTo(42);
    assertThat(config.populationSize()).isEqualTo(100);
  }

  @Test
  public void operatorConfig_tournamentSizeBelowTwo_throws() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new OperatorConfig(1, CrossoverStrategy.TWO_POINT, 0.5, 0.05, 0.3, 0.2, 0.0));
  }

  @Test
  public void operatorConfig_withSwapMutation_validatesProbability() {
    assertThrows(
        IllegalArgumentException.class, () -> OperatorConfig.defaults().withSwapMutationIndpb(2.0));
  }
}
