package com.verlumen.placement.fitness;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableBiMap;
import com.google.common.collect.ImmutableMap;
import com.verlumen.placement.testing.TestPlacements;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class FitnessContextTest {
  private FitnessContext context;

  @Before
  public void setUp() {
    context = TestPlacements.contextFor(TestPlacements.richRoster());
  }

  @Test
  public void indexes_followListOrder() {
    assertThat(context.residentIndex()).containsExactly(1, 0, 2, 1);
    assertThat(context.hospitalIndex()).containsExactly(10, 0, 20, 1, 30, 2);
  }

  @Test
  public void hopeRank_returnsRankOrZero() {
    assertThat(context.hopeRank(1, 20)).isEqualTo(2);
    assertThat(context.hopeRank(2, 20)).isEqualTo(0);
  }

  @Test
  public void capacityOf_unknownHospital_isZero() {
    assertThat(context.capacityOf(10)).isEqualTo(1);
    assertThat(context.capacityOf(99)).isEqualTo(0);
  }

  @Test
  public void choiceIndexesOf_mapsToHospitalIndexesInRankOrder() {
    assertThat(context.choiceIndexesOf(1)).containsExactly(0, 1, 2).inOrder();
    assertThat(context.choiceIndexesOf(2)).isEmpty();
  }

  @Test
  public void choiceIndexesOf_skipsUnknownHospitals() {
    FitnessContext withStaleChoice =
        context.toBuilder()
            .setHospitalChoices(ImmutableMap.of(1, ImmutableMap.of(1, 99, 2, 20)))
            .build();

    assertThat(withStaleChoice.choiceIndexesOf(1)).containsExactly(1);
  }

  @Test
  public void narrowedTo_keepsOnlyOneResident() {
    FitnessContext narrowed = context.narrowedTo(1);

    assertThat(narrowed.residentCount()).isEqualTo(1);
    assertThat(narrowed.residents().get(0).id()).isEqualTo(2);
    assertThat(narrowed.residentIndex()).containsExactly(2, 0);
    assertThat(narrowed.hospitals()).isEqualTo(context.hospitals());
    assertThat(narrowed.hospitalCapacities()).isEqualTo(context.hospitalCapacities());
  }

  @Test
  public void narrowedTo_carriesResidentInputs() {
    FitnessContext narrowed = context.narrowedTo(0);

    assertThat(narrowed.choicesOf(1)).isEqualTo(context.choicesOf(1));
    assertThat(narrowed.weightsOf(1)).isEqualTo(context.weightsOf(1));
    assertThat(narrowed.evaluationsOf(1)).isEqualTo(context.evaluationsOf(1));
  }

  @Test
  public void build_indexNotCoveringResidents_throws() {
    FitnessContext.Builder builder = context.toBuilder().setResidentIndex(ImmutableBiMap.of(1, 0));

    assertThrows(IllegalStateException.class, builder::build);
  }
}
