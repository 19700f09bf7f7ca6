package com.dfisemesh.nastran;

import com.dfisemesh.dfise.LocationCode;
import com.dfisemesh.dfise.Vertex;
import com.dfisemesh.mesh.ReconstructedElement;
import com.dfisemesh.mesh.ReconstructedFace;
import com.dfisemesh.mesh.ReconstructedMesh;
import com.dfisemesh.region.RegionIndex;
import com.dfisemesh.region.RegionSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

public final class NastranBulkExporter {
    private static final Logger log = LoggerFactory.getLogger(NastranBulkExporter.class);

    static final int SURFACE_PROPERTY_ID = 1;

    private final MaterialLibrary materials;

    public NastranBulkExporter(MaterialLibrary materials) {
        this.materials = materials;
    }

    public ExportSummary export(ReconstructedMesh mesh,
                                Path output,
                                boolean includeSurfaces,
                                String sourceName) throws IOException {
        BulkDeck deck = render(mesh, includeSurfaces, sourceName);
        Files.write(output, deck.lines(), StandardCharsets.UTF_8);
        ExportSummary summary = deck.summary();
        log.info("Wrote {} GRID, {} CTETRA and {} CTRIA3 cards to {}",
                summary.nodes(), summary.exportedElements(), summary.surfaceElements(), output);
        if (summary.hasOmissions()) {
            log.warn("{} of {} tetrahedra have no region and were not exported",
                    summary.omittedElements(), summary.parsedElements());
        }
        return summary;
    }

    public BulkDeck render(ReconstructedMesh mesh, boolean includeSurfaces, String sourceName) {
        RegionIndex regions = mesh.regionIndex();
        List<String> lines = new ArrayList<>();
        lines.add("CEND");
        lines.add("BEGIN BULK");
        lines.add("$ Generated by dfise-mesh from " + sourceName);
        lines.add(String.format(Locale.US, "$ Vertices: %,d, Elements: %,d, Regions: %d",
                mesh.vertices().size(), mesh.elements().size(), regions.summaries().size()));
        lines.add("$");

        lines.add("$ GRID cards (vertices)");
        List<Vertex> vertices = mesh.vertices();
        for (int i = 0; i < vertices.size(); i++) {
            Vertex v = vertices.get(i);
            lines.add(String.format(Locale.US, "GRID,%d,,%.9e,%.9e,%.9e", i + 1, v.x(), v.y(), v.z()));
        }
        lines.add("$");

        lines.add("$ MAT1 cards (materials)");
        Map<String, Integer> materialIds = new LinkedHashMap<>();
        for (String material : regions.materials()) {
            int mid = materialIds.size() + 1;
            materialIds.put(material, mid);
            MaterialProperties props = materials.propertiesFor(material);
            lines.add("$ Material: " + material);
            lines.add(String.format(Locale.US, "MAT1,%d,%.6e,,%.6f,%.6e",
                    mid, props.youngsModulus(), props.poissonRatio(), props.density()));
        }
        lines.add("$");

        lines.add("$ PSOLID cards (regions)");
        Map<String, Integer> propertyIds = new LinkedHashMap<>();
        for (RegionSummary region : new TreeMap<>(regions.summaries()).values()) {
            int pid = propertyIds.size() + 1;
            propertyIds.put(region.name(), pid);
            lines.add(String.format(Locale.US, "PSOLID,%d,%d  $ Region: %s",
                    pid, materialIds.get(region.material()), region.name()));
        }
        lines.add("$");

        lines.add("$ CTETRA cards (tetrahedra)");
        int exported = 0;
        for (ReconstructedElement element : mesh.elements()) {
            Optional<String> region = regions.regionOf(element.index());
            if (region.isEmpty()) {
                continue;
            }
            List<Integer> n = element.vertices();
            exported++;
            lines.add(String.format(Locale.US, "CTETRA,%d,%d,%d,%d,%d,%d",
                    exported, propertyIds.get(region.get()),
                    n.get(0) + 1, n.get(1) + 1, n.get(2) + 1, n.get(3) + 1));
        }

        int surfaceElements = 0;
        boolean surfacesSkipped = false;
        if (includeSurfaces) {
            List<LocationCode> locations = mesh.locations();
            if (locations.size() == mesh.faces().size()) {
                lines.add("$");
                lines.add("$ CTRIA3 cards (exterior faces)");
                for (ReconstructedFace face : mesh.faces()) {
                    if (locations.get(face.index()) != LocationCode.EXTERIOR) {
                        continue;
                    }
                    List<Integer> n = face.vertices();
                    surfaceElements++;
                    lines.add(String.format(Locale.US, "CTRIA3,%d,%d,%d,%d,%d",
                            surfaceElements, SURFACE_PROPERTY_ID, n.get(0) + 1, n.get(1) + 1, n.get(2) + 1));
                }
            } else {
                surfacesSkipped = true;
                log.warn("Surface export skipped: {} location codes for {} faces",
                        locations.size(), mesh.faces().size());
            }
        }

        lines.add("$");
        lines.add("ENDDATA");

        ExportSummary summary = new ExportSummary(
                vertices.size(),
                materialIds.size(),
                propertyIds.size(),
                mesh.elements().size(),
                exported,
                surfaceElements,
                surfacesSkipped
        );
        return new BulkDeck(lines, summary);
    }
}
