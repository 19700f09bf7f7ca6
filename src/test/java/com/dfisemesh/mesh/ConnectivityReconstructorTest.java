package com.dfisemesh.mesh;

import com.dfisemesh.Fixtures;
import com.dfisemesh.dfise.DfiseDocument;
import com.dfisemesh.dfise.DfiseParser;
import com.dfisemesh.dfise.Edge;
import com.dfisemesh.dfise.Element;
import com.dfisemesh.dfise.Face;
import com.dfisemesh.dfise.Orientation;
import com.dfisemesh.dfise.ParseMode;
import com.dfisemesh.dfise.SignedRef;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.RepetitionInfo;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class ConnectivityReconstructorTest {

    @Test
    void resolvesSingleTetrahedron() throws Exception {
        DfiseDocument doc = DfiseParser.parse(Fixtures.text("single_tet.grd"), ParseMode.STRICT).orThrow();

        Reconstruction r = new ConnectivityReconstructor(ReconstructionConfig.SEQUENTIAL)
                .reconstruct(doc.vertices().size(), doc.edges(), doc.faces(), doc.elements());

        assertThat(r.issues()).isEmpty();
        assertThat(r.faces()).extracting(ReconstructedFace::vertices).containsExactly(
                List.of(0, 1, 2), List.of(0, 1, 3), List.of(0, 2, 3), List.of(1, 2, 3));
        assertThat(r.elements()).singleElement()
                .satisfies(e -> assertThat(e.vertices()).containsExactly(0, 1, 2, 3));
    }

    @RepeatedTest(20)
    void faceVertexSetIgnoresReferenceOrderAndSigns(RepetitionInfo repetition) {
        long seed = repetition.getCurrentRepetition();
        Random random = new Random(seed);
        List<Edge> edges = new ArrayList<>();
        for (int[] pair : new int[][]{{4, 9}, {9, 7}, {4, 7}}) {
            edges.add(random.nextBoolean() ? new Edge(pair[0], pair[1]) : new Edge(pair[1], pair[0]));
        }
        List<SignedRef> refs = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            refs.add(new SignedRef(i, random.nextBoolean() ? Orientation.FORWARD : Orientation.REVERSED));
        }
        Collections.shuffle(refs, random);

        ReconstructedFace face = ConnectivityReconstructor.reconstructFace(0, new Face(refs), edges, 10);

        assertThat(face.degraded()).as("seed %d", seed).isFalse();
        assertThat(face.vertices()).as("seed %d", seed).containsExactlyInAnyOrder(4, 7, 9);
    }

    @Test
    void consistentlyOrientedFaceKeepsTraversalOrder() {
        List<Edge> edges = List.of(new Edge(0, 1), new Edge(0, 2), new Edge(1, 2));
        Face face = new Face(List.of(SignedRef.decode(0), SignedRef.decode(2), SignedRef.decode(-2)));

        ReconstructedFace resolved = ConnectivityReconstructor.reconstructFace(0, face, edges, 3);

        assertThat(resolved.vertices()).containsExactly(0, 1, 2);
    }

    @Test
    void repeatedEdgeIsPaddedAndFlagged() {
        List<Edge> edges = List.of(new Edge(1, 2));
        Face face = new Face(List.of(SignedRef.decode(0), SignedRef.decode(0), SignedRef.decode(-1)));

        ReconstructedFace resolved = ConnectivityReconstructor.reconstructFace(3, face, edges, 3);

        assertThat(resolved.degraded()).isTrue();
        assertThat(resolved.vertices()).containsExactly(1, 2, 0);
    }

    @Test
    void edgeReferenceOutOfRangeIsFlagged() {
        List<Edge> edges = List.of(new Edge(0, 1), new Edge(1, 2), new Edge(0, 2));
        Face face = new Face(List.of(SignedRef.decode(0), SignedRef.decode(1), SignedRef.decode(5)));

        ReconstructedFace resolved = ConnectivityReconstructor.reconstructFace(0, face, edges, 3);

        assertThat(resolved.degraded()).isTrue();
        assertThat(resolved.vertices()).containsExactly(0, 1, 2);
    }

    @Test
    void vertexOutOfRangeIsFlagged() {
        List<Edge> edges = List.of(new Edge(0, 1), new Edge(1, 8), new Edge(0, 8));
        Face face = new Face(List.of(SignedRef.decode(0), SignedRef.decode(1), SignedRef.decode(-3)));

        assertThat(ConnectivityReconstructor.reconstructFace(0, face, edges, 4).degraded()).isTrue();
    }

    @Test
    void elementWithMissingFaceIsFlagged() {
        List<ReconstructedFace> faces = List.of(
                new ReconstructedFace(0, List.of(0, 1, 2), false),
                new ReconstructedFace(1, List.of(0, 1, 3), false));
        Element element = new Element(List.of(
                SignedRef.decode(0), SignedRef.decode(1), SignedRef.decode(2), SignedRef.decode(3)));

        ReconstructedElement resolved = ConnectivityReconstructor.reconstructElement(0, element, faces);

        assertThat(resolved.vertices()).containsExactly(0, 1, 2, 3);
        assertThat(resolved.degraded()).isTrue();
    }

    @Test
    void degradedRecordsAreReportedAsWarnings() {
        List<Edge> edges = List.of(new Edge(1, 2));
        List<Face> faces = List.of(new Face(List.of(SignedRef.decode(0), SignedRef.decode(0), SignedRef.decode(0))));

        Reconstruction r = new ConnectivityReconstructor(ReconstructionConfig.SEQUENTIAL)
                .reconstruct(3, edges, faces, List.of());

        assertThat(r.issues()).singleElement()
                .satisfies(d -> assertThat(d.message()).startsWith("Face 0 does not resolve"));
    }

    @Test
    void parallelRunMatchesSequentialRun() throws Exception {
        DfiseDocument doc = DfiseParser.parse(Fixtures.text("two_tets.grd"), ParseMode.STRICT).orThrow();

        Reconstruction sequential = new ConnectivityReconstructor(ReconstructionConfig.SEQUENTIAL)
                .reconstruct(doc.vertices().size(), doc.edges(), doc.faces(), doc.elements());
        Reconstruction parallel = new ConnectivityReconstructor(new ReconstructionConfig(4))
                .reconstruct(doc.vertices().size(), doc.edges(), doc.faces(), doc.elements());

        assertThat(parallel.faces()).isEqualTo(sequential.faces());
        assertThat(parallel.elements()).isEqualTo(sequential.elements());
        assertThat(parallel.elements().get(1).vertices()).containsExactly(1, 2, 3, 4);
    }
}
