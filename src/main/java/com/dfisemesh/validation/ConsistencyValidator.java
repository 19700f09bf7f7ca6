package com.dfisemesh.validation;

import com.dfisemesh.dfise.DfiseDocument;
import com.dfisemesh.dfise.Element;
import com.dfisemesh.dfise.Face;
import com.dfisemesh.dfise.InfoBlock;
import com.dfisemesh.dfise.Region;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

public final class ConsistencyValidator {
    private ConsistencyValidator() {
    }

    public static ValidationReport validate(DfiseDocument document) {
        InfoBlock info = document.info();
        return new ValidationReport(
                regionsCoverElements(document.regions(), info.nbElements()),
                homogeneous(document.elementTypeCounts(), Element.TYPE_TAG, info.nbElements()),
                homogeneous(document.faceTypeCounts(), Face.TYPE_TAG, info.nbFaces()),
                document.locations().size() == info.nbFaces(),
                document.regions().size() == info.nbRegions(),
                eulerCharacteristic(info)
        );
    }

    public static int eulerCharacteristic(InfoBlock info) {
        return info.nbVertices() - info.nbEdges() + info.nbFaces() - info.nbElements();
    }

    static boolean regionsCoverElements(List<Region> regions, int nbElements) {
        int declared = 0;
        List<Integer> all = new ArrayList<>();
        for (Region region : regions) {
            declared += region.declaredElementCount();
            all.addAll(region.elementIndices());
        }
        if (declared != nbElements || all.size() != nbElements) {
            return false;
        }
        Collections.sort(all);
        for (int i = 0; i < all.size(); i++) {
            if (all.get(i) != i) {
                return false;
            }
        }
        return true;
    }

    static boolean homogeneous(Map<Integer, Integer> typeCounts, int expectedTag, int declared) {
        return typeCounts.size() == 1 && typeCounts.getOrDefault(expectedTag, -1) == declared;
    }
}
