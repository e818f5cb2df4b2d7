package com.verlumen.placement.data;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.io.Resources;
import com.verlumen.placement.model.FactorKind;
import com.verlumen.placement.model.FactorType;
import com.verlumen.placement.model.Resident;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class JsonPlacementDataLoaderTest {
  private InMemoryPlacementDataSource dataSource;

  @Before
  public void setUp() throws Exception {
    Path path =
        Path.of(Resources.getResource(JsonPlacementDataLoaderTest.class, "placement-data.json").toURI());
    dataSource = JsonPlacementDataLoader.load(path);
  }

  @Test
  public void load_keepsOnlyResidentDoctors() {
    assertThat(dataSource.residents())
        .containsExactly(
            Resident.create(1, "Aoki"), Resident.create(2, "Baba"), Resident.create(4, "Doi"))
        .inOrder();
  }

  @Test
  public void load_readsHospitals() {
    assertThat(dataSource.hospitals()).hasSize(2);
    assertThat(dataSource.hospitals().get(0).totalCapacity()).isEqualTo(10);
    assertThat(dataSource.hospitals().get(1).annualSalary()).isEqualTo(12_000_000.0);
  }

  @Test
  public void load_choicesIterateInRankOrder() {
    assertThat(dataSource.hospitalChoices(1, 2025)).containsExactly(1, 10, 2, 20).inOrder();
  }

  @Test
  public void load_choicesAreScopedToFiscalYear() {
    assertThat(dataSource.hospitalChoices(2, 2025)).isEmpty();
    assertThat(dataSource.hospitalChoices(2, 2024)).containsExactly(1, 20);
  }

  @Test
  public void load_readsWeightsEvaluationsAndCommute() {
    assertThat(dataSource.factorWeights(1, 2025)).containsExactly(1, 70.0, 2, 30.0);
    assertThat(dataSource.adminEvaluations(1, 2025)).containsExactly(11, 0.9);
    assertThat(dataSource.commuteMinutes(1, 10)).hasValue(35.5);
    assertThat(dataSource.commuteMinutes(1, 20)).isEmpty();
  }

  @Test
  public void load_splitsFactorCatalogsByType() {
    assertThat(dataSource.evaluationFactors(FactorType.STAFF_PREFERENCE)).hasSize(2);
    assertThat(dataSource.evaluationFactors(FactorType.ADMIN_EVALUATION)).hasSize(1);
    assertThat(dataSource.evaluationFactors(FactorType.STAFF_PREFERENCE).get(0).effectiveKind())
        .isEqualTo(FactorKind.SALARY);
    assertThat(dataSource.evaluationFactors(FactorType.STAFF_PREFERENCE).get(1).kind())
        .isEqualTo(FactorKind.COMMUTE);
  }

  @Test
  public void load_missingFile_throwsUncheckedIOException() {
    assertThrows(
        UncheckedIOException.class,
        () -> JsonPlacementDataLoader.load(Path.of("does-not-exist", "placement.json")));
  }

  @Test
  public void parse_missingArraysAreEmpty() {
    InMemoryPlacementDataSource empty = JsonPlacementDataLoader.parse("{}");

    assertThat(empty.residents()).isEmpty();
    assertThat(empty.hospitals()).isEmpty();
  }

  @Test
  public void parse_malformedDocument_throwsIllegalArgumentException() {
    assertThrows(IllegalArgumentException.class, () -> JsonPlacementDataLoader.parse("{\"staff\": ["));
  }

  @Test
  public void parse_emptyDocument_throwsIllegalArgumentException() {
    assertThrows(IllegalArgumentException.class, () -> JsonPlacementDataLoader.parse(""));
  }

  @Test
  public void parse_invalidRank_throwsIllegalArgumentException() {
    String json =
        "{\"hospitalChoices\": [{\"residentId\": 1, \"fiscalYear\": 2025, \"rank\": 4,"
            + " \"hospitalId\": 10}]}";

    assertThrows(IllegalArgumentException.class, () -> JsonPlacementDataLoader.parse(json));
  }

  @Test
  public void parse_duplicateRank_throwsIllegalArgumentException() {
    String json =
        "{\"hospitalChoices\": ["
            + "{\"residentId\": 1, \"fiscalYear\": 2025, \"rank\": 1, \"hospitalId\": 10},"
            + "{\"residentId\": 1, \"fiscalYear\": 2025, \"rank\": 1, \"hospitalId\": 20}]}";

    assertThrows(IllegalArgumentException.class, () -> JsonPlacementDataLoader.parse(json));
  }

  @Test
  public void parse_nullSalary_readsAsZero() {
    String json =
        "{\"hospitals\": [{\"id\": 10, \"name\": \"North General\", \"residentCapacity\": 2,"
            + " \"annualSalary\": null}]}";

    InMemoryPlacementDataSource parsed = JsonPlacementDataLoader.parse(json);

    assertThat(parsed.hospitals()).hasSize(1);
    assertThat(parsed.hospitals().get(0).annualSalary()).isEqualTo(0.0);
    assertThat(parsed.hospitals().get(0).residentCapacity()).isEqualTo(2);
  }

  @Test
  public void parse_nullCommuteMinutes_readsAsZero() {
    String json =
        "{\"commuteTimes\": [{\"residentId\": 1, \"hospitalId\": 10, \"minutes\": null}]}";

    InMemoryPlacementDataSource parsed = JsonPlacementDataLoader.parse(json);

    assertThat(parsed.commuteMinutes(1, 10)).hasValue(0.0);
  }

  @Test
  public void parse_hospitalWithoutName_throwsIllegalArgumentException() {
    String json = "{\"hospitals\": [{\"id\": 10, \"residentCapacity\": 2}]}";

    assertThrows(IllegalArgumentException.class, () -> JsonPlacementDataLoader.parse(json));
  }
}
