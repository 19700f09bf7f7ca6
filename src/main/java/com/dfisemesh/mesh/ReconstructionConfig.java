package com.dfisemesh.mesh;

public record ReconstructionConfig(int threads) {
    public static final ReconstructionConfig SEQUENTIAL = new ReconstructionConfig(1);
}
