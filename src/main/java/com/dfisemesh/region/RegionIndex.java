package com.dfisemesh.region;

import com.dfisemesh.dfise.Region;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Element to region to material lookup built from the region records.
 * <p>
 * An element listed by more than one region belongs to the first of them in file order. Such overlaps are
 * not reported here; the consistency validator's region coverage check catches them.
 */
public final class RegionIndex {
    private final Map<String, RegionSummary> summaries;
    private final Map<Integer, String> elementToRegion;
    private final List<String> materials;

    private RegionIndex(Map<String, RegionSummary> summaries,
                        Map<Integer, String> elementToRegion,
                        List<String> materials) {
        this.summaries = summaries;
        this.elementToRegion = elementToRegion;
        this.materials = materials;
    }

    public static RegionIndex build(List<Region> regions, int totalElements) {
        Map<String, RegionSummary> summaries = new LinkedHashMap<>();
        Map<Integer, String> elementToRegion = new TreeMap<>();
        Set<String> materials = new LinkedHashSet<>();

        for (Region region : regions) {
            double fraction = totalElements > 0 ? (double) region.declaredElementCount() / totalElements : 0.0;
            summaries.put(region.name(), new RegionSummary(
                    region.name(), region.material(), region.declaredElementCount(), fraction));
            materials.add(region.material());
            for (int element : region.elementIndices()) {
                elementToRegion.putIfAbsent(element, region.name());
            }
        }
        return new RegionIndex(
                Collections.unmodifiableMap(summaries),
                Collections.unmodifiableMap(elementToRegion),
                List.copyOf(materials)
        );
    }

    public Optional<String> regionOf(int element) {
        return Optional.ofNullable(elementToRegion.get(element));
    }

    public Optional<String> materialOfRegion(String region) {
        RegionSummary summary = region == null ? null : summaries.get(region);
        return summary == null ? Optional.empty() : Optional.of(summary.material());
    }

    public Optional<String> materialOf(int element) {
        return regionOf(element).flatMap(this::materialOfRegion);
    }

    public Map<String, RegionSummary> summaries() {
        return summaries;
    }

    public Map<Integer, String> elementRegions() {
        return elementToRegion;
    }

    public List<String> materials() {
        return materials;
    }
}
