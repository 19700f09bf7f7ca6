package com.dfisemesh.validation;

import com.dfisemesh.Fixtures;
import com.dfisemesh.dfise.DfiseDocument;
import com.dfisemesh.dfise.DfiseParser;
import com.dfisemesh.dfise.ParseMode;
import com.dfisemesh.dfise.Region;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ConsistencyValidatorTest {

    @Test
    void wellFormedMeshPassesEveryCheck() throws Exception {
        DfiseDocument doc = DfiseParser.parse(Fixtures.text("two_tets.grd"), ParseMode.LENIENT).orThrow();

        ValidationReport report = ConsistencyValidator.validate(doc);

        assertThat(report.allPassed()).isTrue();
        assertThat(report.eulerCharacteristic()).isEqualTo(1);
        assertThat(report.checks()).containsOnlyKeys(
                "regions_sum_correct", "all_elements_type_5", "all_faces_type_3",
                "locations_count_correct", "regions_count_correct");
    }

    @Test
    void regionsMustCoverEveryElementExactlyOnce() {
        assertThat(ConsistencyValidator.regionsCoverElements(List.of(
                new Region("A", "Silicon", 1, List.of(0)),
                new Region("B", "Oxide", 1, List.of(1))), 2)).isTrue();
        assertThat(ConsistencyValidator.regionsCoverElements(List.of(
                new Region("A", "Silicon", 1, List.of(0)),
                new Region("B", "Oxide", 1, List.of(0))), 2)).isFalse();
        assertThat(ConsistencyValidator.regionsCoverElements(List.of(
                new Region("A", "Silicon", 2, List.of(0))), 2)).isFalse();
        assertThat(ConsistencyValidator.regionsCoverElements(List.of(
                new Region("A", "Silicon", 1, List.of(0))), 2)).isFalse();
    }

    @Test
    void typeHomogeneityNeedsOneTagWithTheDeclaredCount() {
        assertThat(ConsistencyValidator.homogeneous(Map.of(5, 10), 5, 10)).isTrue();
        assertThat(ConsistencyValidator.homogeneous(Map.of(5, 9), 5, 10)).isFalse();
        assertThat(ConsistencyValidator.homogeneous(Map.of(5, 9, 4, 1), 5, 10)).isFalse();
        assertThat(ConsistencyValidator.homogeneous(Map.of(), 5, 0)).isFalse();
    }

    @Test
    void missingLocationsFailTheLocationCheck() throws Exception {
        String text = Fixtures.text("single_tet.grd").replace("  Locations (4) {\n    eeee\n  }\n", "");
        DfiseDocument doc = DfiseParser.parse(text, ParseMode.LENIENT).orThrow();

        ValidationReport report = ConsistencyValidator.validate(doc);

        assertThat(report.locationsCountCorrect()).isFalse();
        assertThat(report.regionsSumCorrect()).isTrue();
        assertThat(report.allPassed()).isFalse();
    }
}
