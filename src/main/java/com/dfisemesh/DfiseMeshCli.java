package com.dfisemesh;

import com.dfisemesh.dfise.Diagnostic;
import com.dfisemesh.dfise.ErrorKind;
import com.dfisemesh.dfise.ParseMode;
import com.dfisemesh.dfise.ParseResult;
import com.dfisemesh.io.MeshJson;
import com.dfisemesh.io.StatsDocument;
import com.dfisemesh.mesh.MeshReader;
import com.dfisemesh.mesh.ReconstructedMesh;
import com.dfisemesh.mesh.ReconstructionConfig;
import com.dfisemesh.nastran.ExportSummary;
import com.dfisemesh.nastran.MaterialLibrary;
import com.dfisemesh.nastran.MaterialProperties;
import com.dfisemesh.nastran.NastranBulkExporter;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

public final class DfiseMeshCli {
    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_PARSE_ERRORS = 2;
    static final int EXIT_CORRUPTED = 3;
    static final int EXIT_MISSING_SECTION = 4;
    static final int EXIT_IO = 5;

    private static final Set<String> FLAGS = Set.of("help", "strict", "surfaces", "full-report", "show-issues");

    private DfiseMeshCli() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }

    static int run(String[] args, PrintStream out) {
        Map<String, String> parsed;
        try {
            parsed = parseArgs(args);
        } catch (IllegalArgumentException e) {
            out.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        }
        String mode = parsed.getOrDefault("mode", "report").toLowerCase(Locale.ROOT);
        boolean isNasMode = "nas".equals(mode);

        if (parsed.containsKey("help")) {
            printHelp(out);
            return EXIT_OK;
        }
        if (!parsed.containsKey("input")
                || (isNasMode && !parsed.containsKey("output"))
                || (!isNasMode && !"report".equals(mode))) {
            printHelp(out);
            return EXIT_USAGE;
        }

        Path input = Path.of(parsed.get("input"));
        if (!Files.exists(input)) {
            out.println("Error: File not found: " + input);
            return EXIT_USAGE;
        }

        try {
            ParseMode parseMode = parsed.containsKey("strict") ? ParseMode.STRICT : ParseMode.LENIENT;
            ReconstructionConfig config = new ReconstructionConfig(parseInt(parsed, "threads", 1));
            ParseResult<ReconstructedMesh> result = MeshReader.read(input, parseMode, config);
            String source = input.getFileName() == null ? input.toString() : input.getFileName().toString();
            return isNasMode
                    ? runNasMode(parsed, source, result, out)
                    : runReportMode(parsed, source, result, out);
        } catch (IllegalArgumentException e) {
            out.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        } catch (IOException e) {
            out.println("Error: " + e.getMessage());
            return EXIT_IO;
        }
    }

    private static int runReportMode(Map<String, String> parsed,
                                     String source,
                                     ParseResult<ReconstructedMesh> result,
                                     PrintStream out) throws IOException {
        MeshReportPrinter printer = new MeshReportPrinter(out);
        if (parsed.containsKey("show-issues") || !result.errors().isEmpty()) {
            printer.printIssues(result);
        }
        if (result.hasValue()) {
            if (parsed.containsKey("full-report")) {
                printer.printFull(source, result.value());
            } else {
                printer.printConcise(source, result.value());
            }
        } else {
            out.println("Could not generate report: the file is unreadable or a required section is missing.");
        }

        if (parsed.containsKey("export-stats") && result.hasValue()) {
            Path statsOutput = Path.of(parsed.get("export-stats"));
            ensureOutputPath(statsOutput);
            MeshJson.writeStats(StatsDocument.from(source, result), statsOutput);
            out.println("Statistics exported to " + statsOutput);
        }
        return exitCode(result, out);
    }

    private static int runNasMode(Map<String, String> parsed,
                                  String source,
                                  ParseResult<ReconstructedMesh> result,
                                  PrintStream out) throws IOException {
        if (!result.errors().isEmpty() || !result.hasValue()) {
            new MeshReportPrinter(out).printIssues(result);
            out.println("Not exporting: the file did not parse cleanly.");
            return exitCode(result, out);
        }

        Path output = Path.of(parsed.get("output"));
        ensureOutputPath(output);
        boolean includeSurfaces = parsed.containsKey("surfaces");
        MaterialLibrary materials = materialLibrary(parsed);

        out.println("DF-ISE to NASTRAN export");
        out.println("Input:  " + source);
        out.println("Output: " + output);
        out.println("Mode:   " + (includeSurfaces ? "Volume + Surfaces" : "Volume only"));

        ExportSummary summary = new NastranBulkExporter(materials).export(result.value(), output, includeSurfaces, source);
        new MeshReportPrinter(out).printExportSummary(summary, includeSurfaces);
        if (summary.hasOmissions()) {
            out.printf(Locale.US, "Warning: %d tetrahedra have no region and were not exported%n",
                    summary.omittedElements());
        }
        return exitCode(result, out);
    }

    private static MaterialLibrary materialLibrary(Map<String, String> parsed) throws IOException {
        MaterialProperties defaults = new MaterialProperties(
                parseDouble(parsed, "youngsModulus", MaterialProperties.SILICON.youngsModulus()),
                parseDouble(parsed, "poissonRatio", MaterialProperties.SILICON.poissonRatio()),
                parseDouble(parsed, "density", MaterialProperties.SILICON.density())
        );
        if (!parsed.containsKey("materials")) {
            return MaterialLibrary.uniform(defaults);
        }
        return MaterialLibrary.fromDocument(MeshJson.readMaterials(Path.of(parsed.get("materials"))), defaults);
    }

    static int exitCode(ParseResult<?> result, PrintStream out) {
        if (result.errors().isEmpty()) {
            if (!result.warnings().isEmpty()) {
                out.printf(Locale.US, "Parsing completed with %d warnings.%n", result.warnings().size());
            }
            return EXIT_OK;
        }
        out.printf(Locale.US, "Parsing completed with %d errors.%n", result.errors().size());
        if (result.hasValue()) {
            return EXIT_PARSE_ERRORS;
        }
        Diagnostic first = result.errors().get(0);
        if (first.kind() == ErrorKind.CORRUPTED_FILE) {
            return EXIT_CORRUPTED;
        }
        return first.kind() == ErrorKind.MISSING_SECTION ? EXIT_MISSING_SECTION : EXIT_PARSE_ERRORS;
    }

    private static void ensureOutputPath(Path output) throws IOException {
        if (Files.exists(output) && Files.isDirectory(output)) {
            throw new IllegalArgumentException("Output path is a directory, expected file: " + output);
        }
        Path parent = output.getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
        }
    }

    private static int parseInt(Map<String, String> args, String key, int fallback) {
        return args.containsKey(key) ? Integer.parseInt(args.get(key)) : fallback;
    }

    private static double parseDouble(Map<String, String> args, String key, double fallback) {
        return args.containsKey(key) ? Double.parseDouble(args.get(key)) : fallback;
    }

    private static Map<String, String> parseArgs(String[] args) {
        Map<String, String> map = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (!a.startsWith("--")) {
                continue;
            }
            String key = a.substring(2);
            if (FLAGS.contains(key)) {
                map.put(key, "true");
                continue;
            }
            if (i + 1 >= args.length) {
                throw new IllegalArgumentException("Missing value for argument: " + a);
            }
            map.put(key, args[++i]);
        }
        return map;
    }

    private static void printHelp(PrintStream out) {
        out.println("dfise-mesh CLI");
        out.println("Usage:");
        out.println("  Report mode:");
        out.println("    java -jar dfise-mesh.jar --input device.grd [--full-report] [--show-issues] [--export-stats stats.json]");
        out.println("  NASTRAN mode:");
        out.println("    java -jar dfise-mesh.jar --mode nas --input device.grd --output device.nas [--surfaces]");
        out.println("Options:");
        out.println("  --mode <report|nas>           default: report");
        out.println("  --strict                      any warning fails the parse, no Info defaults");
        out.println("  --threads <int>               reconstruction threads, default: 1");
        out.println("  --full-report                 detailed report (report mode)");
        out.println("  --show-issues                 list all warnings and errors");
        out.println("  --export-stats <file.json>    write statistics as JSON (report mode)");
        out.println("  --surfaces                    also write exterior faces as CTRIA3 (nas mode)");
        out.println("  --materials <file.json>       per-material properties (nas mode)");
        out.println("  --youngsModulus <double>      default: 1.7e11 Pa");
        out.println("  --poissonRatio <double>       default: 0.28");
        out.println("  --density <double>            default: 2329 kg/m^3");
        out.println("Exit codes: 0 ok, 1 usage or file not found, 2 parse errors, 3 corrupted file,");
        out.println("            4 missing required section, 5 I/O failure on an output or materials file");
    }
}
