package com.dfisemesh.dfise;

public record Edge(int tail, int head) {

    public int from(Orientation orientation) {
        return orientation == Orientation.REVERSED ? head : tail;
    }

    public int to(Orientation orientation) {
        return orientation == Orientation.REVERSED ? tail : head;
    }
}
