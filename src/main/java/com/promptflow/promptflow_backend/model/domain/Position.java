package com.promptflow.promptflow_backend.model.domain;

/** Canvas coordinates of a node. */
public record Position(double x, double y) {

    public static Position origin() {
        return new Position(0, 0);
    }

    public Position offset(double dx, double dy) {
        return new Position(x + dx, y + dy);
    }
}
