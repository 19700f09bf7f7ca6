package com.dfisemesh.dfise;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

public final class DfiseParser {
    private static final Logger log = LoggerFactory.getLogger(DfiseParser.class);

    private DfiseParser() {
    }

    public static ParseResult<DfiseDocument> read(Path path, ParseMode mode) {
        List<Diagnostic> errors = new ArrayList<>();
        if (!Files.exists(path)) {
            errors.add(Diagnostic.error(ErrorKind.CORRUPTED_FILE, "File does not exist: " + path));
            return ParseResult.failed(List.of(), errors);
        }
        if (!Files.isRegularFile(path)) {
            errors.add(Diagnostic.error(ErrorKind.CORRUPTED_FILE, "Path is not a file: " + path));
            return ParseResult.failed(List.of(), errors);
        }
        String text;
        try {
            text = Files.readString(path, StandardCharsets.UTF_8);
        } catch (CharacterCodingException e) {
            errors.add(Diagnostic.error(ErrorKind.CORRUPTED_FILE, "File has invalid encoding: " + path));
            return ParseResult.failed(List.of(), errors);
        } catch (IOException e) {
            errors.add(Diagnostic.error(ErrorKind.CORRUPTED_FILE, "File reading failed: " + e.getMessage()));
            return ParseResult.failed(List.of(), errors);
        }
        log.debug("Read {} characters from {}", text.length(), path);
        return parse(text, mode);
    }

    public static ParseResult<DfiseDocument> parse(String text, ParseMode mode) {
        List<Diagnostic> warnings = new ArrayList<>();
        List<Diagnostic> errors = new ArrayList<>();
        if (text == null || text.isBlank()) {
            errors.add(Diagnostic.error(ErrorKind.CORRUPTED_FILE, "File is empty"));
            return ParseResult.failed(warnings, errors);
        }

        try {
            List<Section> roots = collect(SectionScanner.scan(text, mode), warnings);

            Optional<Section> infoSection = find(roots, "Info");
            if (infoSection.isEmpty()) {
                errors.add(Diagnostic.error(ErrorKind.MISSING_SECTION, "No Info block found in file"));
                return ParseResult.failed(warnings, errors);
            }
            InfoBlock info = collect(DfiseDecoders.decodeInfo(infoSection.get(), mode), warnings);

            CoordSystem coordSystem = null;
            Optional<Section> coordSection = find(roots, "CoordSystem");
            if (coordSection.isPresent()) {
                coordSystem = collect(DfiseDecoders.decodeCoordSystem(coordSection.get(), mode), warnings);
            }

            List<Vertex> vertices = List.of();
            Optional<Section> vertexSection = required(roots, "Vertices", errors);
            if (vertexSection.isPresent()) {
                Decoded<List<Vertex>> decoded = DfiseDecoders.decodeVertices(vertexSection.get(), mode);
                vertices = collect(decoded, warnings);
                checkDeclaredCount(vertexSection.get(), info.nbVertices(), vertices.size(), decoded, mode, warnings);
            }

            List<Edge> edges = List.of();
            Optional<Section> edgeSection = required(roots, "Edges", errors);
            if (edgeSection.isPresent()) {
                Decoded<List<Edge>> decoded = DfiseDecoders.decodeEdges(edgeSection.get(), mode);
                edges = collect(decoded, warnings);
                checkDeclaredCount(edgeSection.get(), info.nbEdges(), edges.size(), decoded, mode, warnings);
            }

            List<Face> faces = List.of();
            Map<Integer, Integer> faceTypes = Map.of();
            Optional<Section> faceSection = required(roots, "Faces", errors);
            if (faceSection.isPresent()) {
                Decoded<TypedRecords<Face>> decoded = DfiseDecoders.decodeFaces(faceSection.get(), mode);
                TypedRecords<Face> records = collect(decoded, warnings);
                faces = records.records();
                faceTypes = records.typeCounts();
                checkDeclaredCount(faceSection.get(), info.nbFaces(), faces.size(), decoded, mode, warnings);
            }

            List<Element> elements = List.of();
            Map<Integer, Integer> elementTypes = Map.of();
            Optional<Section> elementSection = required(roots, "Elements", errors);
            if (elementSection.isPresent()) {
                Decoded<TypedRecords<Element>> decoded = DfiseDecoders.decodeElements(elementSection.get(), mode);
                TypedRecords<Element> records = collect(decoded, warnings);
                elements = records.records();
                elementTypes = records.typeCounts();
                checkDeclaredCount(elementSection.get(), info.nbElements(), elements.size(), decoded, mode, warnings);
            }

            List<LocationCode> locations = List.of();
            Optional<Section> locationSection = find(roots, "Locations");
            if (locationSection.isPresent()) {
                Decoded<List<LocationCode>> decoded = DfiseDecoders.decodeLocations(locationSection.get(), mode);
                locations = collect(decoded, warnings);
                checkDeclaredCount(locationSection.get(), info.nbFaces(), locations.size(), decoded, mode, warnings);
            } else {
                Issues.warn(warnings, mode, ErrorKind.MISSING_SECTION, 0, "No Locations section found");
            }

            List<Region> regions = decodeRegions(roots, info, mode, warnings);

            log.debug("Decoded {} vertices, {} edges, {} faces, {} elements, {} locations, {} regions",
                    vertices.size(), edges.size(), faces.size(), elements.size(), locations.size(), regions.size());

            DfiseDocument document = new DfiseDocument(info, coordSystem, vertices, edges, faces, elements,
                    locations, regions, faceTypes, elementTypes);
            return ParseResult.of(document, warnings, errors);
        } catch (DfiseParseException e) {
            errors.add(e.diagnostic());
            return ParseResult.failed(warnings, errors);
        }
    }

    private static List<Region> decodeRegions(List<Section> roots,
                                              InfoBlock info,
                                              ParseMode mode,
                                              List<Diagnostic> warnings) {
        List<Section> sections = new ArrayList<>();
        findAll(roots, "Region", sections);
        if (sections.isEmpty() && info.nbRegions() > 0) {
            Issues.warn(warnings, mode, ErrorKind.MISSING_SECTION, 0, "No Region sections found");
        }

        List<Region> regions = new ArrayList<>(sections.size());
        Set<String> names = new HashSet<>();
        for (Section section : sections) {
            Region region = collect(DfiseDecoders.decodeRegion(section, mode), warnings);
            if (region == null) {
                continue;
            }
            if (!names.add(region.name())) {
                Issues.warn(warnings, mode, ErrorKind.DATA_INCONSISTENCY, section.headerLine(),
                        "Duplicate region '" + region.name() + "'; later record skipped");
                continue;
            }
            regions.add(region);
        }
        return regions;
    }

    private static void checkDeclaredCount(Section section,
                                           int declared,
                                           int decoded,
                                           Decoded<?> result,
                                           ParseMode mode,
                                           List<Diagnostic> warnings) {
        if (result.hasIssues()) {
            return;
        }
        if (declared != decoded) {
            Issues.warn(warnings, mode, ErrorKind.DATA_INCONSISTENCY, 0, String.format(Locale.US,
                    "%s count mismatch: found %d, expected %d", section.name(), decoded, declared));
        }
        OptionalInt header = section.declaredCount();
        if (header.isPresent() && header.getAsInt() != decoded) {
            Issues.warn(warnings, mode, ErrorKind.DATA_INCONSISTENCY, section.headerLine(), String.format(Locale.US,
                    "%s header declares %d records, found %d", section.name(), header.getAsInt(), decoded));
        }
    }

    private static <T> T collect(Decoded<T> decoded, List<Diagnostic> warnings) {
        warnings.addAll(decoded.issues());
        return decoded.value();
    }

    private static Optional<Section> required(List<Section> roots, String name, List<Diagnostic> errors) {
        Optional<Section> section = find(roots, name);
        if (section.isEmpty()) {
            errors.add(Diagnostic.error(ErrorKind.MISSING_SECTION, "No " + name + " section found"));
        }
        return section;
    }

    /**
     * Depth-first search for the first block with the given name, not descending into {@code Region} blocks,
     * so a region's element sublist is never taken for the top-level {@code Elements} block.
     */
    static Optional<Section> find(List<Section> sections, String name) {
        for (Section section : sections) {
            if (section.name().equals(name)) {
                return Optional.of(section);
            }
            if (!section.name().equals("Region")) {
                Optional<Section> nested = find(section.children(), name);
                if (nested.isPresent()) {
                    return nested;
                }
            }
        }
        return Optional.empty();
    }

    static void findAll(List<Section> sections, String name, List<Section> out) {
        for (Section section : sections) {
            if (section.name().equals(name)) {
                out.add(section);
            } else {
                findAll(section.children(), name, out);
            }
        }
    }
}
