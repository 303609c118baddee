package com.gdin.inspection.graphalgo.algorithm;

import com.gdin.inspection.graphalgo.graph.AnalyticsGraph;

import java.util.Map;

/**
 * 图算法：输入一张图，输出 节点 id -> 值。
 *
 * 实现只负责计算，计时、异常兜底、写回都由 {@link ManagedAlgorithm} 处理。
 * 图是只读的，实现不能假设调用之间保留任何状态。
 */
public interface GraphAlgorithm<V extends Number> {

    String name();

    Map<String, V> compute(AnalyticsGraph graph, AlgorithmParameters parameters) throws Exception;
}
