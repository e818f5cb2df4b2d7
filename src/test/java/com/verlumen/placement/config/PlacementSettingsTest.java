package com.verlumen.placement.config;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.verlumen.placement.optimization.OptimizationConfig;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class PlacementSettingsTest {
  @Test
  public void defaults_matchSettingKeys() {
    PlacementSettings settings = PlacementSettings.defaults();

    assertThat((double) settings.populationSize())
        .isEqualTo(SettingKey.GA_POPULATION_SIZE.defaultValue());
    assertThat((double) settings.generations()).isEqualTo(SettingKey.GA_GENERATIONS.defaultValue());
    assertThat(settings.mismatchBonus()).isEqualTo(SettingKey.GA_MISMATCH_BONUS.defaultValue());
    assertThat(settings.fiscalYear()).isEqualTo(2025);
  }

  @Test
  public void validate_acceptsRangeBounds() {
    assertThat(PlacementSettings.validate(SettingKey.GA_POPULATION_SIZE, "10")).isEqualTo(10.0);
    assertThat(PlacementSettings.validate(SettingKey.GA_CROSSOVER_PROB, " 1.0 ")).isEqualTo(1.0);
  }

  @Test
  public void validate_outOfRange_throws() {
    IllegalArgumentException thrown =
        assertThrows(
            IllegalArgumentException.class,
            () -> PlacementSettings.validate(SettingKey.GA_GENERATIONS, "1001"));

    assertThat(thrown).hasMessageThat().isEqualTo("ga_generations must be between 50 and 1000: 1001");
  }

  @Test
  public void validate_notANumber_throws() {
    IllegalArgumentException thrown =
        assertThrows(
            IllegalArgumentException.class,
            () -> PlacementSettings.validate(SettingKey.GA_MUTATION_PROB, "high"));

    assertThat(thrown).hasMessageThat().contains("Invalid value for ga_mutation_prob");
  }

  @Test
  public void with_replacesSingleSetting() {
    PlacementSettings settings =
        PlacementSettings.defaults().with(SettingKey.GA_CROSSOVER_PROB, "0.55");

    assertThat(settings.crossoverProbability()).isEqualTo(0.55);
    assertThat(settings.mutationProbability()).isEqualTo(0.2);
  }

  @Test
  public void toOptimizationConfig_carriesValues() {
    OptimizationConfig config =
        new PlacementSettings(150, 300, 0.8, 0.1, 2.5, 2026).toOptimizationConfig();

    assertThat(config.populationSize()).isEqualTo(150);
    assertThat(config.generations()).isEqualTo(300);
    assertThat(config.crossoverProbability()).isEqualTo(0.8);
    assertThat(config.mutationProbability()).isEqualTo(0.1);
    assertThat(config.mismatchBonus()).isEqualTo(2.5);
  }

  @Test
  public void settingKey_fromKey() {
    assertThat(SettingKey.fromKey("ga_mismatch_bonus")).hasValue(SettingKey.GA_MISMATCH_BONUS);
    assertThat(SettingKey.fromKey("GA_MISMATCH_BONUS")).isEmpty();
  }
}
