package com.dfisemesh;

import com.dfisemesh.dfise.CoordSystem;
import com.dfisemesh.dfise.DfiseDocument;
import com.dfisemesh.dfise.Diagnostic;
import com.dfisemesh.dfise.InfoBlock;
import com.dfisemesh.dfise.LocationCode;
import com.dfisemesh.dfise.ParseResult;
import com.dfisemesh.mesh.BoundaryClassifier;
import com.dfisemesh.mesh.BoundaryKind;
import com.dfisemesh.mesh.ReconstructedMesh;
import com.dfisemesh.nastran.ExportSummary;
import com.dfisemesh.region.RegionSummary;
import com.dfisemesh.validation.ConsistencyValidator;
import com.dfisemesh.validation.MeshStatistics;
import com.dfisemesh.validation.ValidationReport;

import java.io.PrintStream;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

final class MeshReportPrinter {
    private static final String RULE = "=".repeat(75);

    private final PrintStream out;

    MeshReportPrinter(PrintStream out) {
        this.out = out;
    }

    void printConcise(String source, ReconstructedMesh mesh) {
        DfiseDocument document = mesh.document();
        InfoBlock info = document.info();
        MeshStatistics stats = MeshStatistics.compute(info, document.locations());

        out.println();
        out.println(RULE);
        out.println("DF-ISE MESH REPORT: " + source);
        out.println(RULE);

        out.println();
        out.println("MESH PROPERTIES:");
        out.printf(Locale.US, "  Dimension:      %12s%n", info.dimension() + "D");
        out.printf(Locale.US, "  Vertices:       %,12d%n", info.nbVertices());
        out.printf(Locale.US, "  Edges:          %,12d%n", info.nbEdges());
        out.printf(Locale.US, "  Faces:          %,12d%n", info.nbFaces());
        out.printf(Locale.US, "  Elements:       %,12d%n", info.nbElements());

        printCoordSystem(document.coordSystem(), false);

        out.println();
        out.println("TOPOLOGY:");
        out.printf(Locale.US, "  Euler char:     %12d%n", stats.eulerCharacteristic());
        out.printf(Locale.US, "  Edges/vertex:   %12.2f%n", stats.edgesPerVertex());
        out.printf(Locale.US, "  Faces/vertex:   %12.2f%n", stats.facesPerVertex());
        out.printf(Locale.US, "  Boundary edges: %,12d%n", stats.boundaryEdges());

        int total = document.locations().size();
        out.println();
        out.println("FACE TYPES:");
        out.printf(Locale.US, "  Interior:       %,12d  (%5.1f%%)%n", stats.interiorFaces(), percent(stats.interiorFaces(), total));
        out.printf(Locale.US, "  Interface:      %,12d  (%5.1f%%)%n", stats.interfaceFaces(), percent(stats.interfaceFaces(), total));
        out.printf(Locale.US, "  Exterior:       %,12d  (%5.1f%%)%n", stats.exteriorFaces(), percent(stats.exteriorFaces(), total));

        out.println();
        out.printf(Locale.US, "MATERIALS (%d regions):%n", info.nbRegions());
        for (RegionSummary region : new TreeMap<>(mesh.regions()).values()) {
            out.printf(Locale.US, "  %-20s (%-20s): %,8d (%5.1f%%)%n",
                    region.material(), region.name(), region.elementCount(), region.fraction() * 100.0);
        }

        ValidationReport report = ConsistencyValidator.validate(document);
        out.println();
        out.println("VALIDATION: " + (report.allPassed() ? "VALID" : "INVALID"));
        out.println();
        out.println(RULE);
    }

    void printFull(String source, ReconstructedMesh mesh) {
        DfiseDocument document = mesh.document();
        InfoBlock info = document.info();

        out.println();
        out.println(RULE);
        out.println("DF-ISE GRID FILE ANALYSIS SUMMARY");
        out.println(RULE);
        out.println();
        out.println("File: " + source);

        out.println();
        out.println("--- INFO BLOCK ---");
        out.println("Version: " + info.version());
        out.println("Type: " + info.type());
        out.println("Dimension: " + info.dimension() + "D");
        out.printf(Locale.US, "Vertices: %,d%n", info.nbVertices());
        out.printf(Locale.US, "Edges: %,d%n", info.nbEdges());
        out.printf(Locale.US, "Faces: %,d%n", info.nbFaces());
        out.printf(Locale.US, "Elements: %,d%n", info.nbElements());
        out.printf(Locale.US, "Regions: %d%n", info.nbRegions());

        printCoordSystem(document.coordSystem(), true);

        out.println();
        out.println("--- ELEMENT TYPES ---");
        printTypes(document.elementTypeCounts(), info.nbElements());

        out.println();
        out.println("--- FACE TYPES ---");
        printTypes(document.faceTypeCounts(), info.nbFaces());

        out.println();
        out.println("--- LOCATIONS DISTRIBUTION ---");
        int totalLocations = document.locations().size();
        for (LocationCode code : LocationCode.values()) {
            long count = document.locations().stream().filter(c -> c == code).count();
            out.printf(Locale.US, "'%c' (%s): %,d (%.1f%%)%n",
                    code.code(), code.name().toLowerCase(Locale.ROOT), count, percent(count, totalLocations));
        }

        out.println();
        out.println("--- BOUNDARY FACES ---");
        for (Map.Entry<BoundaryKind, Integer> entry : BoundaryClassifier.countByKind(mesh.boundaryFaces()).entrySet()) {
            out.printf(Locale.US, "%-13s %,d%n", entry.getKey().name().toLowerCase(Locale.ROOT) + ":", entry.getValue());
        }

        out.println();
        out.println("--- REGIONS ---");
        int totalCount = 0;
        for (RegionSummary region : new TreeMap<>(mesh.regions()).values()) {
            totalCount += region.elementCount();
            out.printf(Locale.US, "%-25s | %-15s | %,7d (%5.1f%%)%n",
                    region.name(), region.material(), region.elementCount(), region.fraction() * 100.0);
        }
        out.printf(Locale.US, "%-25s | %-15s | %,7d%n", "TOTAL", "", totalCount);

        MeshStatistics stats = MeshStatistics.compute(info, document.locations());
        out.println();
        out.println("--- MESH STATISTICS ---");
        out.printf(Locale.US, "Euler characteristic (V-E+F-C): %d%n", stats.eulerCharacteristic());
        out.printf(Locale.US, "Edges per vertex: %.2f%n", stats.edgesPerVertex());
        out.printf(Locale.US, "Faces per vertex: %.2f%n", stats.facesPerVertex());
        out.printf(Locale.US, "Elements per vertex: %.2f%n", stats.elementsPerVertex());
        out.printf(Locale.US, "Faces per edge: %.2f%n", stats.facesPerEdge());
        out.printf(Locale.US, "Elements per face: %.2f%n", stats.elementsPerFace());
        out.printf(Locale.US, "Boundary edges: %,d%n", stats.boundaryEdges());

        ValidationReport report = ConsistencyValidator.validate(document);
        out.println();
        out.println("--- VALIDATION ---");
        for (Map.Entry<String, Boolean> check : report.checks().entrySet()) {
            out.printf(Locale.US, "%-40s: %s%n", check.getKey(), check.getValue() ? "PASS" : "FAIL");
        }
        out.println();
        out.println(RULE);
    }

    void printIssues(ParseResult<?> result) {
        if (result.warnings().isEmpty() && result.errors().isEmpty()) {
            return;
        }
        out.println();
        out.println("PARSING ISSUES");
        printNumbered("WARNINGS", result.warnings());
        printNumbered("ERRORS", result.errors());
    }

    void printExportSummary(ExportSummary summary, boolean includeSurfaces) {
        out.println();
        out.println("Export complete:");
        out.printf(Locale.US, "  Vertices (GRID):     %,10d%n", summary.nodes());
        out.printf(Locale.US, "  Materials (MAT1):    %,10d%n", summary.materials());
        out.printf(Locale.US, "  Regions (PSOLID):    %,10d%n", summary.properties());
        out.printf(Locale.US, "  Tetrahedra (CTETRA): %,10d of %,d%n", summary.exportedElements(), summary.parsedElements());
        if (summary.hasOmissions()) {
            out.printf(Locale.US, "  Omitted (no region): %,10d%n", summary.omittedElements());
        }
        if (includeSurfaces) {
            if (summary.surfacesSkipped()) {
                out.println("  Boundaries (CTRIA3): skipped, locations do not cover every face");
            } else {
                out.printf(Locale.US, "  Boundaries (CTRIA3): %,10d%n", summary.surfaceElements());
            }
        }
    }

    private void printCoordSystem(CoordSystem coordSystem, boolean withMatrix) {
        if (coordSystem == null) {
            return;
        }
        List<Double> t = coordSystem.translate();
        out.println();
        if (!withMatrix) {
            out.println("COORDINATE SYSTEM:");
            out.printf(Locale.US, "  Translation:    [%8.3f, %8.3f, %8.3f]%n", t.get(0), t.get(1), t.get(2));
            return;
        }
        out.println("--- COORDINATE SYSTEM ---");
        out.printf(Locale.US, "Translation: [%10.6f, %10.6f, %10.6f]%n", t.get(0), t.get(1), t.get(2));
        out.println("Transform matrix:");
        List<List<Double>> rows = coordSystem.transform();
        for (int i = 0; i < rows.size(); i++) {
            List<Double> row = rows.get(i);
            out.printf(Locale.US, "  Row %d: [%10.6f, %10.6f, %10.6f]%n", i, row.get(0), row.get(1), row.get(2));
        }
    }

    private void printTypes(Map<Integer, Integer> counts, int declared) {
        for (Map.Entry<Integer, Integer> entry : new TreeMap<>(counts).entrySet()) {
            out.printf(Locale.US, "Type %d: %,d (%.1f%%)%n",
                    entry.getKey(), entry.getValue(), percent(entry.getValue(), declared));
        }
    }

    private void printNumbered(String title, List<Diagnostic> issues) {
        if (issues.isEmpty()) {
            return;
        }
        out.println();
        out.printf(Locale.US, "%s (%d):%n", title, issues.size());
        for (int i = 0; i < issues.size(); i++) {
            out.printf(Locale.US, "  %2d. %s%n", i + 1, issues.get(i));
        }
    }

    private static double percent(double count, int total) {
        return total > 0 ? 100.0 * count / total : 0.0;
    }
}
