package com.verlumen.placement.optimization;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.Ints;
import com.verlumen.placement.fitness.FitnessContext;
import com.verlumen.placement.model.Candidate;
import com.verlumen.placement.testing.TestPlacements;
import java.util.Random;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class CandidateOperatorsTest {
  private Random random;
  private FitnessContext context;

  @Before
  public void setUp() {
    random = new Random(17);
    // hospital index 0 holds one resident, index 1 holds two; resident 1 chose index 0
    context = TestPlacements.contextFor(TestPlacements.scenarioA());
  }

  @Test
  public void twoPointCrossover_keepsGenesInPlace() {
    Candidate first = Candidate.of(0, 0, 0, 0, 0, 0);
    Candidate second = Candidate.of(1, 1, 1, 1, 1, 1);

    for (int round = 0; round < 20; round++) {
      CandidateOperators.Children children =
          CandidateOperators.twoPointCrossover(first, second, random);

      assertThat(children.first().size()).isEqualTo(6);
      assertThat(children.second().size()).isEqualTo(6);
      for (int i = 0; i < 6; i++) {
        assertThat(children.first().gene(i) + children.second().gene(i)).isEqualTo(1);
      }
      assertThat(children.first().gene(0)).isEqualTo(0);
    }
  }

  @Test
  public void twoPointCrossover_singleGene_returnsParents() {
    Candidate first = Candidate.of(0);
    Candidate second = Candidate.of(1);

    CandidateOperators.Children children =
        CandidateOperators.twoPointCrossover(first, second, random);

    assertThat(children.first()).isSameInstanceAs(first);
    assertThat(children.second()).isSameInstanceAs(second);
  }

  @Test
  public void twoPointCrossover_differentLengths_throws() {
    assertThrows(
        IllegalArgumentException.class,
        () -> CandidateOperators.twoPointCrossover(Candidate.of(0, 1), Candidate.of(0), random));
  }

  @Test
  public void uniformCrossover_zeroProbability_returnsParents() {
    Candidate first = Candidate.of(0, 0, 0).withFitness(0.4);
    Candidate second = Candidate.of(1, 1, 1);

    CandidateOperators.Children children =
        CandidateOperators.uniformCrossover(first, second, 0.0, random);

    assertThat(children.first()).isSameInstanceAs(first);
    assertThat(children.second()).isSameInstanceAs(second);
  }

  @Test
  public void uniformCrossover_certainProbability_swapsEveryGene() {
    CandidateOperators.Children children =
        CandidateOperators.uniformCrossover(
            Candidate.of(0, 1, 2), Candidate.of(2, 1, 0), 1.0, random);

    assertThat(Ints.asList(children.first().toArray())).containsExactly(2, 1, 0).inOrder();
    assertThat(Ints.asList(children.second().toArray())).containsExactly(0, 1, 2).inOrder();
  }

  @Test
  public void randomMutation_zeroProbability_returnsInput() {
    Candidate candidate = Candidate.of(0, 1, 1);

    assertThat(CandidateOperators.randomMutation(candidate, 2, 0.0, random))
        .isSameInstanceAs(candidate);
  }

  @Test
  public void randomMutation_staysWithinHospitalIndexes() {
    Candidate candidate = Candidate.of(0, 0, 0, 0, 0, 0, 0, 0);

    Candidate mutant = CandidateOperators.randomMutation(candidate, 3, 1.0, random);

    assertThat(mutant.size()).isEqualTo(8);
    for (int gene : mutant.toArray()) {
      assertThat(gene).isAtLeast(0);
      assertThat(gene).isLessThan(3);
    }
    assertThat(Ints.asList(candidate.toArray())).containsExactly(0, 0, 0, 0, 0, 0, 0, 0);
  }

  @Test
  public void randomMutation_noHospitals_throws() {
    assertThrows(
        IllegalArgumentException.class,
        () -> CandidateOperators.randomMutation(Candidate.of(0), 0, 1.0, random));
  }

  @Test
  public void swapMutation_certainProbability_swapsTwoPositions() {
    Candidate mutant = CandidateOperators.swapMutation(Candidate.of(0, 1), 1.0, random);

    assertThat(Ints.asList(mutant.toArray())).containsExactly(1, 0).inOrder();
  }

  @Test
  public void swapMutation_keepsMultiset() {
    Candidate mutant = CandidateOperators.swapMutation(Candidate.of(0, 1, 2, 2), 1.0, random);

    assertThat(Ints.asList(mutant.toArray())).containsExactly(0, 1, 2, 2);
  }

  @Test
  public void swapMutation_singleGene_returnsInput() {
    Candidate candidate = Candidate.of(1);

    assertThat(CandidateOperators.swapMutation(candidate, 1.0, random)).isSameInstanceAs(candidate);
  }

  @Test
  public void capacityAwareMutation_movesFirstResidentOutOfOverfullHospital() {
    Candidate mutant =
        CandidateOperators.capacityAwareMutation(Candidate.of(0, 0, 0), context, 1.0, random);

    assertThat(Ints.asList(mutant.toArray())).containsExactly(1, 0, 0).inOrder();
  }

  @Test
  public void capacityAwareMutation_movesIntoHospitalWithRoom() {
    Candidate mutant =
        CandidateOperators.capacityAwareMutation(Candidate.of(1, 1, 1), context, 1.0, random);

    assertThat(Ints.asList(mutant.toArray())).containsExactly(0, 1, 1).inOrder();
  }

  @Test
  public void capacityAwareMutation_feasibleCandidate_isUnchanged() {
    Candidate candidate = Candidate.of(0, 1, 1);

    assertThat(CandidateOperators.capacityAwareMutation(candidate, context, 1.0, random))
        .isSameInstanceAs(candidate);
  }

  @Test
  public void capacityAwareMutation_noHospitalWithRoom_isUnchanged() {
    FitnessContext tight =
        context.toBuilder().setHospitalCapacities(ImmutableMap.of(10, 1, 20, 1)).build();
    Candidate candidate = Candidate.of(0, 1, 1);

    assertThat(CandidateOperators.capacityAwareMutation(candidate, tight, 1.0, random))
        .isSameInstanceAs(candidate);
  }

  @Test
  public void capacityAwareMutation_invalidGene_throws() {
    assertThrows(
        IllegalStateException.class,
        () -> CandidateOperators.capacityAwareMutation(Candidate.of(0, 1, 5), context, 1.0, random));
  }

  @Test
  public void hopeAwareMutation_movesResidentToDeclaredChoice() {
    Candidate mutant =
        CandidateOperators.hopeAwareMutation(Candidate.of(1, 1, 1), context, 1.0, random);

    assertThat(Ints.asList(mutant.toArray())).containsExactly(0, 1, 1).inOrder();
  }

  @Test
  public void hopeAwareMutation_residentsWithoutUnmetChoices_areUnchanged() {
    Candidate candidate = Candidate.of(0, 0, 1);

    assertThat(CandidateOperators.hopeAwareMutation(candidate, context, 1.0, random))
        .isSameInstanceAs(candidate);
  }

  @Test
  public void operators_neverModifyInputs() {
    Candidate first = Candidate.of(1, 1, 1);
    Candidate second = Candidate.of(0, 0, 0);

    CandidateOperators.twoPointCrossover(first, second, random);
    CandidateOperators.uniformCrossover(first, second, 1.0, random);
    CandidateOperators.randomMutation(first, 2, 1.0, random);
    CandidateOperators.capacityAwareMutation(first, context, 1.0, random);
    CandidateOperators.hopeAwareMutation(first, context, 1.0, random);
    CandidateOperators.swapMutation(second, 1.0, random);

    assertThat(Ints.asList(first.toArray())).containsExactly(1, 1, 1);
    assertThat(Ints.asList(second.toArray())).containsExactly(0, 0, 0);
  }
}
