package com.dfisemesh.dfise;

import com.dfisemesh.Fixtures;
import com.dfisemesh.validation.ConsistencyValidator;
import com.dfisemesh.validation.ValidationReport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DfiseParserTest {

    @Test
    void parsesSingleTetrahedronCleanly() throws Exception {
        ParseResult<DfiseDocument> result = DfiseParser.parse(Fixtures.text("single_tet.grd"), ParseMode.LENIENT);

        assertThat(result.status()).isEqualTo(ParseStatus.SUCCESS);
        assertThat(result.warnings()).isEmpty();
        DfiseDocument doc = result.value();
        assertThat(doc.info().nbVertices()).isEqualTo(4);
        assertThat(doc.info().regions()).containsExactly("Bulk");
        assertThat(doc.vertices()).hasSize(4).contains(new Vertex(1.0, 0.0, 0.0));
        assertThat(doc.edges()).hasSize(6);
        assertThat(doc.faces()).hasSize(4);
        assertThat(doc.elements()).hasSize(1);
        assertThat(doc.locations()).containsOnly(LocationCode.EXTERIOR).hasSize(4);
        assertThat(doc.regions()).containsExactly(new Region("Bulk", "Silicon", 1, List.of(0)));
        assertThat(doc.coordSystem()).isNotNull();
        assertThat(doc.coordSystem().transform().get(1)).containsExactly(0.0, 1.0, 0.0);
    }

    @Test
    void malformedFaceGivesOneWarningAndAShorterList() throws Exception {
        ParseResult<DfiseDocument> result = DfiseParser.parse(Fixtures.text("malformed_face.grd"), ParseMode.LENIENT);

        assertThat(result.status()).isEqualTo(ParseStatus.PARTIAL);
        assertThat(result.errors()).isEmpty();
        assertThat(result.warnings()).hasSize(1);
        assertThat(result.warnings().get(0).message()).contains("expected 3");
        assertThat(result.value().faces()).hasSize(3);

        ValidationReport report = ConsistencyValidator.validate(result.value());
        assertThat(report.allFacesType3()).isFalse();
        assertThat(report.allElementsType5()).isTrue();
    }

    @Test
    void strictModeFailsOnTheMalformedFace() throws Exception {
        ParseResult<DfiseDocument> result = DfiseParser.parse(Fixtures.text("malformed_face.grd"), ParseMode.STRICT);

        assertThat(result.status()).isEqualTo(ParseStatus.FAILED);
        assertThat(result.hasValue()).isFalse();
        assertThat(result.errors()).singleElement()
                .satisfies(d -> assertThat(d.severity()).isEqualTo(Severity.ERROR));
    }

    @Test
    void missingInfoFailsWithMissingSection() {
        ParseResult<DfiseDocument> result = DfiseParser.parse("Data {\n  Vertices (0) {\n  }\n}\n", ParseMode.LENIENT);

        assertThat(result.status()).isEqualTo(ParseStatus.FAILED);
        assertThat(result.errors()).singleElement()
                .satisfies(d -> assertThat(d.kind()).isEqualTo(ErrorKind.MISSING_SECTION));
    }

    @Test
    void emptyInputIsCorrupted() {
        ParseResult<DfiseDocument> result = DfiseParser.parse("  \n", ParseMode.LENIENT);

        assertThat(result.status()).isEqualTo(ParseStatus.FAILED);
        assertThat(result.errors().get(0).kind()).isEqualTo(ErrorKind.CORRUPTED_FILE);
    }

    @Test
    void missingFileIsCorrupted(@TempDir Path dir) {
        ParseResult<DfiseDocument> result = DfiseParser.read(dir.resolve("absent.grd"), ParseMode.LENIENT);

        assertThat(result.hasValue()).isFalse();
        assertThat(result.errors().get(0).kind()).isEqualTo(ErrorKind.CORRUPTED_FILE);
    }

    @Test
    void directoryIsNotAFile(@TempDir Path dir) {
        ParseResult<DfiseDocument> result = DfiseParser.read(dir, ParseMode.LENIENT);

        assertThat(result.errors().get(0).message()).startsWith("Path is not a file");
    }

    @Test
    void regionElementListIsNotTakenForTheElementsBlock() throws Exception {
        String text = Fixtures.text("single_tet.grd")
                .replace("  Elements (1) {\n    5 0 1 2 3\n  }\n", "");

        ParseResult<DfiseDocument> result = DfiseParser.parse(text, ParseMode.LENIENT);

        assertThat(result.status()).isEqualTo(ParseStatus.FAILED);
        assertThat(result.hasValue()).isTrue();
        assertThat(result.errors()).singleElement()
                .satisfies(d -> assertThat(d.message()).isEqualTo("No Elements section found"));
        assertThat(result.value().regions()).hasSize(1);
    }

    @Test
    void countMismatchIsWarnedForCleanBlock() throws Exception {
        String text = Fixtures.text("single_tet.grd").replace("nb_vertices = 4", "nb_vertices = 5");

        ParseResult<DfiseDocument> result = DfiseParser.parse(text, ParseMode.LENIENT);

        assertThat(result.status()).isEqualTo(ParseStatus.PARTIAL);
        assertThat(result.warnings()).singleElement()
                .satisfies(d -> assertThat(d.message()).isEqualTo("Vertices count mismatch: found 4, expected 5"));
    }

    @Test
    void blockHeaderCountDifferingFromItsRecordsIsWarned() throws Exception {
        String text = Fixtures.text("single_tet.grd").replace("Edges (6) {", "Edges (7) {");

        ParseResult<DfiseDocument> result = DfiseParser.parse(text, ParseMode.LENIENT);

        assertThat(result.status()).isEqualTo(ParseStatus.PARTIAL);
        assertThat(result.warnings()).singleElement()
                .satisfies(d -> assertThat(d.message()).isEqualTo("Edges header declares 7 records, found 6"))
                .satisfies(d -> assertThat(d.line()).isEqualTo(31));
    }

    @Test
    void missingLocationsIsOnlyAWarning() throws Exception {
        String text = Fixtures.text("single_tet.grd").replace("  Locations (4) {\n    eeee\n  }\n", "");

        ParseResult<DfiseDocument> result = DfiseParser.parse(text, ParseMode.LENIENT);

        assertThat(result.status()).isEqualTo(ParseStatus.PARTIAL);
        assertThat(result.value().locations()).isEmpty();
        assertThat(result.warnings()).extracting(Diagnostic::message).containsExactly("No Locations section found");
    }

    @Test
    void duplicateRegionKeepsTheFirst() throws Exception {
        String text = Fixtures.text("two_tets.grd").replace("Region (\"Right\")", "Region (\"Left\")");

        ParseResult<DfiseDocument> result = DfiseParser.parse(text, ParseMode.LENIENT);

        assertThat(result.value().regions()).extracting(Region::material).containsExactly("Silicon");
        assertThat(result.warnings()).extracting(Diagnostic::message)
                .anyMatch(m -> m.startsWith("Duplicate region 'Left'"));
    }
}
