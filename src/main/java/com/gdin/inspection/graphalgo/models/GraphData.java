package com.gdin.inspection.graphalgo.models;

import lombok.Value;

import java.util.List;

@Value
public class GraphData {
    List<NodeRecord> nodes;
    List<EdgeRecord> edges;

    public static GraphData of(List<NodeRecord> nodes, List<EdgeRecord> edges) {
        return new GraphData(nodes == null ? List.of() : nodes, edges == null ? List.of() : edges);
    }
}
