package com.dfisemesh.mesh;

import com.dfisemesh.dfise.DfiseDocument;
import com.dfisemesh.dfise.DfiseParser;
import com.dfisemesh.dfise.Diagnostic;
import com.dfisemesh.dfise.ErrorKind;
import com.dfisemesh.dfise.ParseMode;
import com.dfisemesh.dfise.ParseResult;
import com.dfisemesh.validation.ConsistencyValidator;
import com.dfisemesh.validation.ValidationReport;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public final class MeshReader {
    private MeshReader() {
    }

    public static ParseResult<ReconstructedMesh> read(Path path, ParseMode mode, ReconstructionConfig config) {
        return build(DfiseParser.read(path, mode), mode, config);
    }

    public static ParseResult<ReconstructedMesh> parse(String text, ParseMode mode, ReconstructionConfig config) {
        return build(DfiseParser.parse(text, mode), mode, config);
    }

    static ParseResult<ReconstructedMesh> build(ParseResult<DfiseDocument> parsed,
                                                ParseMode mode,
                                                ReconstructionConfig config) {
        if (!parsed.hasValue()) {
            return ParseResult.failed(parsed.warnings(), parsed.errors());
        }
        ReconstructedMesh mesh = MeshBuilder.fromDocument(parsed.value(), config);

        List<Diagnostic> warnings = new ArrayList<>(parsed.warnings());
        List<Diagnostic> errors = new ArrayList<>(parsed.errors());
        List<Diagnostic> issues = new ArrayList<>(mesh.issues());
        ValidationReport report = ConsistencyValidator.validate(parsed.value());
        for (Map.Entry<String, Boolean> check : report.checks().entrySet()) {
            if (!check.getValue()) {
                issues.add(Diagnostic.warning(ErrorKind.DATA_INCONSISTENCY, 0,
                        "Consistency check failed: " + check.getKey()));
            }
        }
        if (mode.isStrict()) {
            for (Diagnostic issue : issues) {
                errors.add(issue.asError());
            }
        } else {
            warnings.addAll(issues);
        }
        return ParseResult.of(mesh, warnings, errors);
    }
}
