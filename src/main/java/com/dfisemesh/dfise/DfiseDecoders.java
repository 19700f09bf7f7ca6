package com.dfisemesh.dfise;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class DfiseDecoders {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern MATERIAL = Pattern.compile("^material\\s*=\\s*\"?([^\"\\s]+)\"?\\s*$");
    private static final Pattern NUMERIC = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

    static final List<String> REQUIRED_INFO_FIELDS = List.of(
            "version", "type", "dimension",
            "nb_vertices", "nb_edges", "nb_faces", "nb_elements", "nb_regions"
    );

    private DfiseDecoders() {
    }

    public static Decoded<InfoBlock> decodeInfo(Section section, ParseMode mode) {
        List<Diagnostic> issues = new ArrayList<>();
        Map<String, String> values = new LinkedHashMap<>();
        Map<String, Integer> lineOf = new HashMap<>();

        List<SectionLine> lines = section.lines();
        for (int i = 0; i < lines.size(); i++) {
            SectionLine line = lines.get(i);
            int eq = line.text().indexOf('=');
            if (eq < 0) {
                Issues.warn(issues, mode, ErrorKind.CORRUPTED_FILE, line.number(), "Malformed assignment: " + line.text());
                continue;
            }
            String key = line.text().substring(0, eq).trim();
            StringBuilder value = new StringBuilder(line.text().substring(eq + 1).trim());
            if (key.isEmpty()) {
                Issues.warn(issues, mode, ErrorKind.CORRUPTED_FILE, line.number(), "Empty key in assignment: " + line.text());
                continue;
            }
            // list values may continue on the following lines until the closing bracket
            if (value.toString().startsWith("[")) {
                while (value.indexOf("]") < 0 && i + 1 < lines.size()) {
                    value.append(' ').append(lines.get(++i).text());
                }
            }
            values.put(key, value.toString());
            lineOf.put(key, line.number());
        }

        List<String> missing = new ArrayList<>();
        for (String field : REQUIRED_INFO_FIELDS) {
            if (!values.containsKey(field)) {
                missing.add(field);
            }
        }
        if (!missing.isEmpty()) {
            if (mode.isStrict()) {
                throw new DfiseParseException(Diagnostic.error(ErrorKind.MISSING_SECTION, section.headerLine(),
                        "Missing required Info fields: " + missing));
            }
            issues.add(Diagnostic.warning(ErrorKind.MISSING_SECTION, section.headerLine(),
                    "Missing Info fields (using defaults): " + missing));
        }

        String version = stringValue(values.get("version"), "1.0");
        String type = stringValue(values.get("type"), "grid");
        int dimension = intValue(values, lineOf, "dimension", 3, issues, mode);
        if (values.containsKey("dimension") && dimension != 2 && dimension != 3) {
            Issues.warn(issues, mode, ErrorKind.DATA_INCONSISTENCY, lineOf.get("dimension"), "Unusual dimension: " + dimension);
        }
        int nbVertices = countValue(values, lineOf, "nb_vertices", issues, mode);
        int nbEdges = countValue(values, lineOf, "nb_edges", issues, mode);
        int nbFaces = countValue(values, lineOf, "nb_faces", issues, mode);
        int nbElements = countValue(values, lineOf, "nb_elements", issues, mode);
        int nbRegions = countValue(values, lineOf, "nb_regions", issues, mode);
        List<String> regions = listValue(values, lineOf, "regions", issues, mode);
        List<String> materials = listValue(values, lineOf, "materials", issues, mode);

        InfoBlock info = new InfoBlock(version, type, dimension,
                nbVertices, nbEdges, nbFaces, nbElements, nbRegions, regions, materials);
        return new Decoded<>(info, issues);
    }

    public static Decoded<CoordSystem> decodeCoordSystem(Section section, ParseMode mode) {
        List<Diagnostic> issues = new ArrayList<>();
        List<Double> translate = new ArrayList<>();
        List<Double> transform = new ArrayList<>();
        List<Double> target = null;

        for (SectionLine line : section.lines()) {
            String cleaned = line.text().replace('[', ' ').replace(']', ' ')
                    .replace('(', ' ').replace(')', ' ').replace('=', ' ').trim();
            if (cleaned.isEmpty()) {
                continue;
            }
            for (String token : WHITESPACE.split(cleaned)) {
                if (token.equals("translate")) {
                    target = translate;
                } else if (token.equals("transform")) {
                    target = transform;
                } else if (target != null && NUMERIC.matcher(token).matches()) {
                    target.add(Double.parseDouble(token));
                } else {
                    Issues.warn(issues, mode, ErrorKind.CORRUPTED_FILE, line.number(),
                            "Unexpected token in CoordSystem: '" + token + "'");
                }
            }
        }

        if (translate.size() != 3 || transform.size() != 9) {
            Issues.warn(issues, mode, ErrorKind.CORRUPTED_FILE, section.headerLine(), String.format(Locale.US,
                    "CoordSystem needs 3 translate and 9 transform values, found %d and %d",
                    translate.size(), transform.size()));
            return new Decoded<>(null, issues);
        }
        List<List<Double>> rows = List.of(transform.subList(0, 3), transform.subList(3, 6), transform.subList(6, 9));
        return new Decoded<>(new CoordSystem(translate, rows), issues);
    }

    public static Decoded<List<Vertex>> decodeVertices(Section section, ParseMode mode) {
        List<Diagnostic> issues = new ArrayList<>();
        List<Vertex> vertices = new ArrayList<>(section.lines().size());
        for (SectionLine line : section.lines()) {
            String[] tokens = tokens(line.text());
            if (tokens.length != 3) {
                Issues.warn(issues, mode, ErrorKind.CORRUPTED_FILE, line.number(),
                        "Vertex has " + tokens.length + " coordinates, expected 3: " + line.text());
                continue;
            }
            try {
                double x = Double.parseDouble(tokens[0]);
                double y = Double.parseDouble(tokens[1]);
                double z = Double.parseDouble(tokens[2]);
                if (!Double.isFinite(x) || !Double.isFinite(y) || !Double.isFinite(z)) {
                    Issues.warn(issues, mode, ErrorKind.CORRUPTED_FILE, line.number(),
                            "Vertex has a non-finite coordinate: " + line.text());
                    continue;
                }
                vertices.add(new Vertex(x, y, z));
            } catch (NumberFormatException e) {
                Issues.warn(issues, mode, ErrorKind.CORRUPTED_FILE, line.number(),
                        "Invalid vertex coordinate: " + line.text());
            }
        }
        return new Decoded<>(vertices, issues);
    }

    public static Decoded<List<Edge>> decodeEdges(Section section, ParseMode mode) {
        List<Diagnostic> issues = new ArrayList<>();
        List<Edge> edges = new ArrayList<>(section.lines().size());
        for (SectionLine line : section.lines()) {
            String[] tokens = tokens(line.text());
            if (tokens.length != 2) {
                Issues.warn(issues, mode, ErrorKind.CORRUPTED_FILE, line.number(),
                        "Edge has " + tokens.length + " vertex references, expected 2: " + line.text());
                continue;
            }
            try {
                int tail = Integer.parseInt(tokens[0]);
                int head = Integer.parseInt(tokens[1]);
                if (tail < 0 || head < 0) {
                    Issues.warn(issues, mode, ErrorKind.CORRUPTED_FILE, line.number(),
                            "Edge has a negative vertex reference: " + line.text());
                    continue;
                }
                edges.add(new Edge(tail, head));
            } catch (NumberFormatException e) {
                Issues.warn(issues, mode, ErrorKind.CORRUPTED_FILE, line.number(),
                        "Invalid edge vertex reference: " + line.text());
            }
        }
        return new Decoded<>(edges, issues);
    }

    public static Decoded<TypedRecords<Face>> decodeFaces(Section section, ParseMode mode) {
        List<Diagnostic> issues = new ArrayList<>();
        List<Face> faces = new ArrayList<>(section.lines().size());
        Map<Integer, Integer> typeCounts = new HashMap<>();
        for (SectionLine line : section.lines()) {
            Optional<List<SignedRef>> refs = typedRefs(line, "Face", Face.TYPE_TAG, Face.EDGE_COUNT,
                    typeCounts, issues, mode);
            refs.ifPresent(r -> faces.add(new Face(r)));
        }
        return new Decoded<>(new TypedRecords<>(faces, typeCounts), issues);
    }

    public static Decoded<TypedRecords<Element>> decodeElements(Section section, ParseMode mode) {
        List<Diagnostic> issues = new ArrayList<>();
        List<Element> elements = new ArrayList<>(section.lines().size());
        Map<Integer, Integer> typeCounts = new HashMap<>();
        for (SectionLine line : section.lines()) {
            Optional<List<SignedRef>> refs = typedRefs(line, "Element", Element.TYPE_TAG, Element.FACE_COUNT,
                    typeCounts, issues, mode);
            refs.ifPresent(r -> elements.add(new Element(r)));
        }
        return new Decoded<>(new TypedRecords<>(elements, typeCounts), issues);
    }

    public static Decoded<List<LocationCode>> decodeLocations(Section section, ParseMode mode) {
        List<Diagnostic> issues = new ArrayList<>();
        List<LocationCode> locations = new ArrayList<>();
        for (SectionLine line : section.lines()) {
            for (String token : WHITESPACE.split(line.text())) {
                for (int k = 0; k < token.length(); k++) {
                    char c = token.charAt(k);
                    Optional<LocationCode> code = LocationCode.fromCode(c);
                    if (code.isPresent()) {
                        locations.add(code.get());
                    } else {
                        Issues.warn(issues, mode, ErrorKind.CORRUPTED_FILE, line.number(),
                                "Unexpected location character: '" + c + "'");
                    }
                }
            }
        }
        return new Decoded<>(locations, issues);
    }

    public static Decoded<Region> decodeRegion(Section section, ParseMode mode) {
        List<Diagnostic> issues = new ArrayList<>();
        Optional<String> name = section.label();
        if (name.isEmpty() || name.get().isBlank()) {
            Issues.warn(issues, mode, ErrorKind.CORRUPTED_FILE, section.headerLine(),
                    "Region header has no quoted name: " + section.name() + " (" + section.argument() + ")");
            return new Decoded<>(null, issues);
        }

        String material = null;
        for (SectionLine line : section.lines()) {
            Matcher m = MATERIAL.matcher(line.text());
            if (m.matches()) {
                material = m.group(1);
            }
        }

        List<Integer> indices = new ArrayList<>();
        int declared = 0;
        Optional<Section> elements = section.child("Elements");
        if (elements.isPresent()) {
            for (SectionLine line : elements.get().lines()) {
                for (String token : tokens(line.text())) {
                    try {
                        int index = Integer.parseInt(token);
                        if (index < 0) {
                            Issues.warn(issues, mode, ErrorKind.CORRUPTED_FILE, line.number(),
                                    "Negative element index in region '" + name.get() + "': " + index);
                            continue;
                        }
                        indices.add(index);
                    } catch (NumberFormatException e) {
                        Issues.warn(issues, mode, ErrorKind.CORRUPTED_FILE, line.number(),
                                "Invalid element index in region '" + name.get() + "': '" + token + "'");
                    }
                }
            }
            declared = elements.get().declaredCount().orElse(indices.size());
        } else {
            Issues.warn(issues, mode, ErrorKind.MISSING_SECTION, section.headerLine(),
                    "Region '" + name.get() + "' has no Elements list");
        }

        if (material == null) {
            Issues.warn(issues, mode, ErrorKind.MISSING_SECTION, section.headerLine(),
                    "Region '" + name.get() + "' has no material; record skipped");
            return new Decoded<>(null, issues);
        }
        return new Decoded<>(new Region(name.get(), material, declared, indices), issues);
    }

    static String payload(String text) {
        int open = text.indexOf('(');
        int close = text.lastIndexOf(')');
        if (open >= 0 && close > open) {
            return text.substring(open + 1, close).trim();
        }
        return text.trim();
    }

    static String[] tokens(String text) {
        String p = payload(text);
        return p.isEmpty() ? new String[0] : WHITESPACE.split(p);
    }

    private static Optional<List<SignedRef>> typedRefs(SectionLine line,
                                                       String what,
                                                       int expectedTag,
                                                       int expectedRefs,
                                                       Map<Integer, Integer> typeCounts,
                                                       List<Diagnostic> issues,
                                                       ParseMode mode) {
        String[] tokens = tokens(line.text());
        if (tokens.length == 0) {
            Issues.warn(issues, mode, ErrorKind.CORRUPTED_FILE, line.number(), what + " line is empty");
            return Optional.empty();
        }
        int tag;
        int[] raw = new int[tokens.length - 1];
        try {
            tag = Integer.parseInt(tokens[0]);
            for (int k = 1; k < tokens.length; k++) {
                raw[k - 1] = Integer.parseInt(tokens[k]);
            }
        } catch (NumberFormatException e) {
            Issues.warn(issues, mode, ErrorKind.CORRUPTED_FILE, line.number(),
                    "Invalid " + what.toLowerCase(Locale.ROOT) + " record: " + line.text());
            return Optional.empty();
        }
        if (tag != expectedTag) {
            typeCounts.merge(tag, 1, Integer::sum);
            Issues.warn(issues, mode, ErrorKind.DATA_INCONSISTENCY, line.number(),
                    "Unsupported " + what.toLowerCase(Locale.ROOT) + " type " + tag + ", expected " + expectedTag);
            return Optional.empty();
        }
        if (raw.length != expectedRefs) {
            Issues.warn(issues, mode, ErrorKind.CORRUPTED_FILE, line.number(), String.format(Locale.US,
                    "%s has %d references, expected %d: %s", what, raw.length, expectedRefs, line.text()));
            return Optional.empty();
        }
        typeCounts.merge(tag, 1, Integer::sum);
        List<SignedRef> refs = new ArrayList<>(raw.length);
        for (int r : raw) {
            refs.add(SignedRef.decode(r));
        }
        return Optional.of(refs);
    }

    private static String stringValue(String raw, String fallback) {
        if (raw == null) {
            return fallback;
        }
        return unquote(raw.trim());
    }

    private static int intValue(Map<String, String> values,
                                Map<String, Integer> lineOf,
                                String key,
                                int fallback,
                                List<Diagnostic> issues,
                                ParseMode mode) {
        String raw = values.get(key);
        if (raw == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(unquote(raw.trim()));
        } catch (NumberFormatException e) {
            Issues.warn(issues, mode, ErrorKind.CORRUPTED_FILE, lineOf.get(key),
                    "Invalid numeric value for " + key + ": '" + raw + "'");
            return fallback;
        }
    }

    private static int countValue(Map<String, String> values,
                                  Map<String, Integer> lineOf,
                                  String key,
                                  List<Diagnostic> issues,
                                  ParseMode mode) {
        int value = intValue(values, lineOf, key, 0, issues, mode);
        if (value < 0) {
            Issues.warn(issues, mode, ErrorKind.DATA_INCONSISTENCY, lineOf.get(key), key + " has negative value: " + value);
            return 0;
        }
        return value;
    }

    private static List<String> listValue(Map<String, String> values,
                                          Map<String, Integer> lineOf,
                                          String key,
                                          List<Diagnostic> issues,
                                          ParseMode mode) {
        String raw = values.get(key);
        if (raw == null) {
            return List.of();
        }
        int open = raw.indexOf('[');
        int close = raw.lastIndexOf(']');
        if (open < 0 || close < open) {
            Issues.warn(issues, mode, ErrorKind.CORRUPTED_FILE, lineOf.get(key), "Invalid list format for " + key + ": " + raw);
            return List.of();
        }
        String inner = raw.substring(open + 1, close).trim();
        List<String> items = new ArrayList<>();
        if (!inner.isEmpty()) {
            for (String token : WHITESPACE.split(inner)) {
                String item = unquote(token);
                if (!item.isEmpty()) {
                    items.add(item);
                }
            }
        }
        return items;
    }

    private static String unquote(String s) {
        if (s.length() >= 2 && s.startsWith("\"") && s.endsWith("\"")) {
            return s.substring(1, s.length() - 1);
        }
        return s;
    }
}
