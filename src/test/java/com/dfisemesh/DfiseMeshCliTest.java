package com.dfisemesh;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class DfiseMeshCliTest {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

    @Test
    void printsHelpWithoutInput() {
        assertThat(DfiseMeshCli.run(new String[0], out)).isEqualTo(DfiseMeshCli.EXIT_USAGE);
        assertThat(output()).contains("Usage:");
        assertThat(DfiseMeshCli.run(new String[]{"--help"}, out)).isEqualTo(DfiseMeshCli.EXIT_OK);
    }

    @Test
    void missingInputFileIsAUsageError(@TempDir Path dir) {
        int code = DfiseMeshCli.run(new String[]{"--input", dir.resolve("absent.grd").toString()}, out);

        assertThat(code).isEqualTo(DfiseMeshCli.EXIT_USAGE);
        assertThat(output()).contains("File not found");
    }

    @Test
    void conciseReportOfAValidMesh() {
        int code = DfiseMeshCli.run(new String[]{"--input", Fixtures.path("two_tets.grd").toString()}, out);

        assertThat(code).isEqualTo(DfiseMeshCli.EXIT_OK);
        assertThat(output()).contains("DF-ISE MESH REPORT: two_tets.grd", "MATERIALS (2 regions):", "VALIDATION: VALID");
    }

    @Test
    void fullReportListsEveryCheck() {
        int code = DfiseMeshCli.run(new String[]{
                "--input", Fixtures.path("single_tet.grd").toString(), "--full-report"}, out);

        assertThat(code).isEqualTo(DfiseMeshCli.EXIT_OK);
        assertThat(output()).contains("--- COORDINATE SYSTEM ---", "regions_sum_correct", "Type 5: 1 (100.0%)");
    }

    @Test
    void warningsStillExitCleanly() {
        int code = DfiseMeshCli.run(new String[]{
                "--input", Fixtures.path("malformed_face.grd").toString(), "--show-issues"}, out);

        assertThat(code).isEqualTo(DfiseMeshCli.EXIT_OK);
        assertThat(output()).contains("WARNINGS (3):", "VALIDATION: INVALID", "Parsing completed with 3 warnings.");
    }

    @Test
    void strictModeReportsCorruptedFile() {
        int code = DfiseMeshCli.run(new String[]{
                "--input", Fixtures.path("malformed_face.grd").toString(), "--strict"}, out);

        assertThat(code).isEqualTo(DfiseMeshCli.EXIT_CORRUPTED);
        assertThat(output()).contains("ERRORS (1):");
    }

    @Test
    void missingInfoExitsWithMissingSection(@TempDir Path dir) throws Exception {
        Path input = dir.resolve("no_info.grd");
        Files.writeString(input, "DF-ISE text\nData {\n}\n", StandardCharsets.UTF_8);

        assertThat(DfiseMeshCli.run(new String[]{"--input", input.toString()}, out))
                .isEqualTo(DfiseMeshCli.EXIT_MISSING_SECTION);
    }

    @Test
    void exportsStatisticsJson(@TempDir Path dir) throws Exception {
        Path stats = dir.resolve("out/stats.json");

        int code = DfiseMeshCli.run(new String[]{
                "--input", Fixtures.path("single_tet.grd").toString(), "--export-stats", stats.toString()}, out);

        assertThat(code).isEqualTo(DfiseMeshCli.EXIT_OK);
        assertThat(Files.readString(stats)).contains("\"nb_vertices\" : 4");
    }

    @Test
    void nasModeWritesDeckWithSurfaces(@TempDir Path dir) throws Exception {
        Path nas = dir.resolve("two_tets.nas");

        int code = DfiseMeshCli.run(new String[]{
                "--mode", "nas",
                "--input", Fixtures.path("two_tets.grd").toString(),
                "--output", nas.toString(),
                "--materials", Fixtures.path("materials.json").toString(),
                "--surfaces"}, out);

        assertThat(code).isEqualTo(DfiseMeshCli.EXIT_OK);
        assertThat(Files.readAllLines(nas)).contains("MAT1,2,7.000000e+10,,0.170000,2.200000e+03", "ENDDATA")
                .filteredOn(l -> l.startsWith("CTRIA3,")).hasSize(6);
        assertThat(output()).contains("Boundaries (CTRIA3):");
    }

    @Test
    void nasModeUsesCommandLineProperties(@TempDir Path dir) throws Exception {
        Path nas = dir.resolve("single.nas");

        DfiseMeshCli.run(new String[]{
                "--mode", "nas",
                "--input", Fixtures.path("single_tet.grd").toString(),
                "--output", nas.toString(),
                "--youngsModulus", "1e9", "--poissonRatio", "0.25", "--density", "1000"}, out);

        assertThat(Files.readAllLines(nas)).contains("MAT1,1,1.000000e+09,,0.250000,1.000000e+03");
    }

    @Test
    void nasModeRefusesAFileWithErrors(@TempDir Path dir) throws Exception {
        Path input = dir.resolve("no_edges.grd");
        Files.writeString(input, Files.readString(Fixtures.path("single_tet.grd"))
                .replace("Edges (6) {", "Ridges (6) {"), StandardCharsets.UTF_8);
        Path nas = dir.resolve("out.nas");

        int code = DfiseMeshCli.run(new String[]{
                "--mode", "nas", "--input", input.toString(), "--output", nas.toString()}, out);

        assertThat(code).isEqualTo(DfiseMeshCli.EXIT_PARSE_ERRORS);
        assertThat(nas).doesNotExist();
    }

    @Test
    void badNumberIsAUsageError() {
        int code = DfiseMeshCli.run(new String[]{
                "--input", Fixtures.path("single_tet.grd").toString(), "--threads", "many"}, out);

        assertThat(code).isEqualTo(DfiseMeshCli.EXIT_USAGE);
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }
}
