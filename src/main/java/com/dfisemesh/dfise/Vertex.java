package com.dfisemesh.dfise;

public record Vertex(double x, double y, double z) {
}
