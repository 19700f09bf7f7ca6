package com.dfisemesh.io;

import com.dfisemesh.dfise.CoordSystem;
import com.dfisemesh.dfise.DfiseDocument;
import com.dfisemesh.dfise.Diagnostic;
import com.dfisemesh.dfise.InfoBlock;
import com.dfisemesh.dfise.LocationCode;
import com.dfisemesh.dfise.ParseResult;
import com.dfisemesh.mesh.BoundaryClassifier;
import com.dfisemesh.mesh.BoundaryKind;
import com.dfisemesh.mesh.ReconstructedMesh;
import com.dfisemesh.region.RegionSummary;
import com.dfisemesh.validation.ConsistencyValidator;
import com.dfisemesh.validation.MeshStatistics;
import com.dfisemesh.validation.ValidationReport;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

public class StatsDocument {
    public String source;
    public String status;
    public InfoDto info;
    public MeshStatistics statistics;
    public List<RegionDto> regions;
    public Map<String, Integer> elementTypes;
    public Map<String, Integer> faceTypes;
    public Map<String, Integer> locationsDistribution;
    public Map<String, Integer> boundaryFaces;
    public Map<String, Object> coordSystem;
    public Map<String, Boolean> validation;
    public Integer eulerCharacteristic;
    public List<String> warnings = new ArrayList<>();
    public List<String> errors = new ArrayList<>();

    public static StatsDocument from(String source, ParseResult<ReconstructedMesh> result) {
        StatsDocument doc = new StatsDocument();
        doc.source = source;
        doc.status = result.status().name().toLowerCase(Locale.ROOT);
        for (Diagnostic warning : result.warnings()) {
            doc.warnings.add(warning.toString());
        }
        for (Diagnostic error : result.errors()) {
            doc.errors.add(error.toString());
        }
        if (!result.hasValue()) {
            return doc;
        }

        ReconstructedMesh mesh = result.value();
        DfiseDocument document = mesh.document();
        doc.info = toInfo(document.info());
        doc.statistics = MeshStatistics.compute(document.info(), document.locations());

        doc.regions = new ArrayList<>();
        for (RegionSummary summary : mesh.regions().values()) {
            RegionDto dto = new RegionDto();
            dto.name = summary.name();
            dto.material = summary.material();
            dto.elementCount = summary.elementCount();
            dto.fraction = summary.fraction();
            doc.regions.add(dto);
        }

        doc.elementTypes = typeTally(document.elementTypeCounts());
        doc.faceTypes = typeTally(document.faceTypeCounts());

        doc.locationsDistribution = new LinkedHashMap<>();
        for (LocationCode code : LocationCode.values()) {
            doc.locationsDistribution.put(String.valueOf(code.code()), 0);
        }
        for (LocationCode code : document.locations()) {
            doc.locationsDistribution.merge(String.valueOf(code.code()), 1, Integer::sum);
        }

        doc.boundaryFaces = new LinkedHashMap<>();
        for (Map.Entry<BoundaryKind, Integer> entry : BoundaryClassifier.countByKind(mesh.boundaryFaces()).entrySet()) {
            doc.boundaryFaces.put(entry.getKey().name().toLowerCase(Locale.ROOT), entry.getValue());
        }

        CoordSystem coordSystem = document.coordSystem();
        if (coordSystem != null) {
            doc.coordSystem = new LinkedHashMap<>();
            doc.coordSystem.put("translate", coordSystem.translate());
            doc.coordSystem.put("transform", coordSystem.transform());
        }

        ValidationReport report = ConsistencyValidator.validate(document);
        doc.validation = report.checks();
        doc.eulerCharacteristic = report.eulerCharacteristic();
        return doc;
    }

    private static InfoDto toInfo(InfoBlock info) {
        InfoDto dto = new InfoDto();
        dto.version = info.version();
        dto.type = info.type();
        dto.dimension = info.dimension();
        dto.nbVertices = info.nbVertices();
        dto.nbEdges = info.nbEdges();
        dto.nbFaces = info.nbFaces();
        dto.nbElements = info.nbElements();
        dto.nbRegions = info.nbRegions();
        dto.regions = new ArrayList<>(info.regions());
        dto.materials = new ArrayList<>(info.materials());
        return dto;
    }

    private static Map<String, Integer> typeTally(Map<Integer, Integer> counts) {
        Map<String, Integer> out = new LinkedHashMap<>();
        for (Map.Entry<Integer, Integer> entry : new TreeMap<>(counts).entrySet()) {
            out.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return out;
    }
}
