package com.dfisemesh.dfise;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SignedRefTest {

    @Test
    void negativeRawValueMeansReversedOneLower() {
        assertThat(SignedRef.decode(-1)).isEqualTo(new SignedRef(0, Orientation.REVERSED));
        assertThat(SignedRef.decode(-8)).isEqualTo(new SignedRef(7, Orientation.REVERSED));
        assertThat(SignedRef.decode(0)).isEqualTo(new SignedRef(0, Orientation.FORWARD));
    }

    @Test
    void reversedEdgeSwapsEndpoints() {
        Edge edge = new Edge(2, 5);

        assertThat(edge.from(Orientation.FORWARD)).isEqualTo(2);
        assertThat(edge.to(Orientation.FORWARD)).isEqualTo(5);
        assertThat(edge.from(Orientation.REVERSED)).isEqualTo(5);
        assertThat(edge.to(Orientation.REVERSED)).isEqualTo(2);
    }

    @Test
    void indexMustBeNonNegative() {
        assertThatThrownBy(() -> new SignedRef(-1, Orientation.FORWARD))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
