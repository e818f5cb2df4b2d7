package com.verlumen.placement.model;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class CandidateTest {
  @Test
  public void of_copiesGenes() {
    int[] genes = {0, 1, 2};

    Candidate candidate = Candidate.of(genes);
    genes[0] = 2;

    assertThat(candidate.gene(0)).isEqualTo(0);
    assertThat(candidate.size()).isEqualTo(3);
    assertThat(candidate.fitness().isPresent()).isFalse();
  }

  @Test
  public void toArray_returnsIndependentCopy() {
    Candidate candidate = Candidate.of(1, 1);

    candidate.toArray()[0] = 0;

    assertThat(candidate.toArray()).asList().containsExactly(1, 1).inOrder();
  }

  @Test
  public void withFitness_keepsGenes() {
    Candidate candidate = Candidate.of(0, 1).withFitness(0.75);

    assertThat(candidate.fitness().getAsDouble()).isEqualTo(0.75);
    assertThat(candidate.hasSameGenes(Candidate.of(0, 1))).isTrue();
  }

  @Test
  public void withGenes_sameGenes_returnsSameInstance() {
    Candidate candidate = Candidate.of(0, 1).withFitness(0.5);

    assertThat(candidate.withGenes(new int[] {0, 1})).isSameInstanceAs(candidate);
  }

  @Test
  public void withGenes_differentGenes_dropsFitness() {
    Candidate candidate = Candidate.of(0, 1).withFitness(0.5);

    Candidate changed = candidate.withGenes(new int[] {1, 1});

    assertThat(changed.fitness().isPresent()).isFalse();
    assertThat(changed.gene(0)).isEqualTo(1);
  }

  @Test
  public void withGenes_lengthMismatch_throws() {
    Candidate candidate = Candidate.of(0, 1);

    assertThrows(IllegalArgumentException.class, () -> candidate.withGenes(new int[] {0}));
  }

  @Test
  public void equals_considersFitness() {
    assertThat(Candidate.of(0, 1)).isEqualTo(Candidate.of(0, 1));
    assertThat(Candidate.of(0, 1).withFitness(0.1)).isNotEqualTo(Candidate.of(0, 1));
  }
}
