package com.dfisemesh.region;

public record RegionSummary(String name, String material, int elementCount, double fraction) {
}
