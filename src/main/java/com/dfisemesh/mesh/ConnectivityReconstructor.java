package com.dfisemesh.mesh;

import com.dfisemesh.dfise.Diagnostic;
import com.dfisemesh.dfise.Edge;
import com.dfisemesh.dfise.Element;
import com.dfisemesh.dfise.ErrorKind;
import com.dfisemesh.dfise.Face;
import com.dfisemesh.dfise.SignedRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.IntStream;

/**
 * Resolves signed element -> face -> edge -> vertex chains into direct vertex tuples.
 * <p>
 * Faces keep the first-seen order of their edge traversal. Elements take the union of their faces' vertices
 * in ascending order; a consumer that needs a consistent winding has to recompute it from coordinates.
 * Malformed chains are repaired (cut or padded with vertex 0) and flagged, never fatal.
 */
public class ConnectivityReconstructor {
    private static final Logger log = LoggerFactory.getLogger(ConnectivityReconstructor.class);

    private final ReconstructionConfig config;

    public ConnectivityReconstructor(ReconstructionConfig config) {
        this.config = config;
    }

    public Reconstruction reconstruct(int vertexCount, List<Edge> edges, List<Face> faces, List<Element> elements) {
        ReconstructedFace[] faceOut = new ReconstructedFace[faces.size()];
        ReconstructedElement[] elementOut = new ReconstructedElement[elements.size()];

        if (config.threads() > 1) {
            ForkJoinPool pool = new ForkJoinPool(config.threads());
            try {
                runInPool(pool, () -> IntStream.range(0, faceOut.length).parallel()
                        .forEach(i -> faceOut[i] = reconstructFace(i, faces.get(i), edges, vertexCount)));
                List<ReconstructedFace> resolved = Arrays.asList(faceOut);
                runInPool(pool, () -> IntStream.range(0, elementOut.length).parallel()
                        .forEach(i -> elementOut[i] = reconstructElement(i, elements.get(i), resolved)));
            } finally {
                pool.shutdown();
            }
        } else {
            for (int i = 0; i < faceOut.length; i++) {
                faceOut[i] = reconstructFace(i, faces.get(i), edges, vertexCount);
            }
            List<ReconstructedFace> resolved = Arrays.asList(faceOut);
            for (int i = 0; i < elementOut.length; i++) {
                elementOut[i] = reconstructElement(i, elements.get(i), resolved);
            }
        }

        List<Diagnostic> issues = new ArrayList<>();
        for (ReconstructedFace face : faceOut) {
            if (face.degraded()) {
                issues.add(Diagnostic.warning(ErrorKind.DATA_INCONSISTENCY, 0,
                        "Face " + face.index() + " does not resolve to 3 distinct vertices in range; kept "
                                + face.vertices()));
            }
        }
        for (ReconstructedElement element : elementOut) {
            if (element.degraded()) {
                issues.add(Diagnostic.warning(ErrorKind.DATA_INCONSISTENCY, 0,
                        "Element " + element.index() + " does not resolve to 4 distinct vertices; kept "
                                + element.vertices()));
            }
        }
        if (!issues.isEmpty()) {
            log.warn("{} faces or elements were reconstructed in degraded form", issues.size());
        }
        log.debug("Reconstructed {} faces and {} elements", faceOut.length, elementOut.length);
        return new Reconstruction(Arrays.asList(faceOut), Arrays.asList(elementOut), issues);
    }

    public static ReconstructedFace reconstructFace(int index, Face face, List<Edge> edges, int vertexCount) {
        Set<Integer> distinct = new LinkedHashSet<>();
        boolean degraded = false;
        for (SignedRef ref : face.edgeRefs()) {
            if (ref.index() >= edges.size()) {
                degraded = true;
                continue;
            }
            Edge edge = edges.get(ref.index());
            distinct.add(edge.from(ref.orientation()));
            distinct.add(edge.to(ref.orientation()));
        }
        List<Integer> vertices = new ArrayList<>(distinct);
        if (vertices.size() != 3) {
            degraded = true;
        }
        vertices = fit(vertices, 3);
        degraded |= outOfRange(vertices, vertexCount);
        return new ReconstructedFace(index, vertices, degraded);
    }

    public static ReconstructedElement reconstructElement(int index, Element element, List<ReconstructedFace> faces) {
        Set<Integer> union = new TreeSet<>();
        boolean degraded = false;
        for (SignedRef ref : element.faceRefs()) {
            if (ref.index() >= faces.size()) {
                degraded = true;
                continue;
            }
            union.addAll(faces.get(ref.index()).vertices());
        }
        List<Integer> vertices = new ArrayList<>(union);
        if (vertices.size() != 4) {
            degraded = true;
        }
        return new ReconstructedElement(index, fit(vertices, 4), degraded);
    }

    private static List<Integer> fit(List<Integer> vertices, int size) {
        List<Integer> out = new ArrayList<>(vertices.subList(0, Math.min(size, vertices.size())));
        while (out.size() < size) {
            out.add(0);
        }
        return out;
    }

    private static boolean outOfRange(List<Integer> vertices, int vertexCount) {
        for (int v : vertices) {
            if (v < 0 || v >= vertexCount) {
                return true;
            }
        }
        return false;
    }

    private static void runInPool(ForkJoinPool pool, Runnable action) {
        pool.submit(action).join();
    }
}
