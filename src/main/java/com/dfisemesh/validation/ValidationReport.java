package com.dfisemesh.validation;

import java.util.LinkedHashMap;
import java.util.Map;

public record ValidationReport(
        boolean regionsSumCorrect,
        boolean allElementsType5,
        boolean allFacesType3,
        boolean locationsCountCorrect,
        boolean regionsCountCorrect,
        int eulerCharacteristic
) {
    public boolean allPassed() {
        return regionsSumCorrect && allElementsType5 && allFacesType3 && locationsCountCorrect && regionsCountCorrect;
    }

    public Map<String, Boolean> checks() {
        Map<String, Boolean> checks = new LinkedHashMap<>();
        checks.put("regions_sum_correct", regionsSumCorrect);
        checks.put("all_elements_type_5", allElementsType5);
        checks.put("all_faces_type_3", allFacesType3);
        checks.put("locations_count_correct", locationsCountCorrect);
        checks.put("regions_count_correct", regionsCountCorrect);
        return checks;
    }
}
