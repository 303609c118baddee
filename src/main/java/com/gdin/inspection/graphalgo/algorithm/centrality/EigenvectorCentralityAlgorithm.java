package com.gdin.inspection.graphalgo.algorithm.centrality;

import com.gdin.inspection.graphalgo.algorithm.AlgorithmParameters;
import com.gdin.inspection.graphalgo.algorithm.GraphAlgorithm;
import com.gdin.inspection.graphalgo.graph.AnalyticsGraph;
import com.gdin.inspection.graphalgo.graph.GraphEdge;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.jgrapht.Graph;
import org.jgrapht.Graphs;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 特征向量中心性，幂迭代求 (A + I) 的主特征向量，每轮做 L2 归一化。
 *
 * 有向图上节点的得分来自指向它的节点（入边）。
 * 相邻两轮差值之和小于 n * tol 视为收敛。
 * max_iter 轮内不收敛（如有向无环图，邻接矩阵幂零）时改用 commons-math 直接求解：
 * 取实部最大的实特征值 λ，再用 SVD 求 (M - λI) 的零空间向量作为特征向量，按分量和取正号后做 L2 归一化。
 * 直接求解也失败才报错。
 */
@Slf4j
public class EigenvectorCentralityAlgorithm implements GraphAlgorithm<Double> {

    public static final String NAME = "eigenvector_centrality";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Map<String, Double> compute(AnalyticsGraph graph, AlgorithmParameters parameters) {
        int maxIter = parameters.getInt("max_iter", 100);
        double tol = parameters.getDouble("tol", 1e-6);
        String weight = parameters.getString("weight", null);

        Graph<String, GraphEdge> view = graph.weightedView(weight);
        List<String> ids = new ArrayList<>(graph.nodeIds());
        int n = ids.size();
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < n; i++) index.put(ids.get(i), i);

        double[] x = new double[n];
        Arrays.fill(x, 1.0 / n);

        for (int iter = 0; iter < maxIter; iter++) {
            double[] last = x;
            x = last.clone();
            for (int i = 0; i < n; i++) {
                String u = ids.get(i);
                for (GraphEdge e : view.outgoingEdgesOf(u)) {
                    String v = Graphs.getOppositeVertex(view, e, u);
                    x[index.get(v)] += last[i] * view.getEdgeWeight(e);
                }
            }

            double norm = 0d;
            for (double value : x) norm += value * value;
            norm = Math.sqrt(norm);
            if (norm == 0d) norm = 1d;
            for (int i = 0; i < n; i++) x[i] /= norm;

            double err = 0d;
            for (int i = 0; i < n; i++) err += Math.abs(x[i] - last[i]);
            if (err < n * tol) {
                Map<String, Double> result = new LinkedHashMap<>();
                for (int i = 0; i < n; i++) result.put(ids.get(i), x[i]);
                return result;
            }
        }
        log.warn("[{}] 幂迭代 {} 轮未收敛，改用特征分解直接求解", NAME, maxIter);
        try {
            return solveExactly(view, ids, index);
        } catch (RuntimeException e) {
            throw new IllegalStateException("eigenvector centrality failed to converge in " + maxIter
                    + " iterations and the direct solve failed: " + e.getMessage(), e);
        }
    }

    private Map<String, Double> solveExactly(Graph<String, GraphEdge> view, List<String> ids, Map<String, Integer> index) {
        int n = ids.size();
        // m[v][u]：u 指向 v 的边权，无向图对称
        RealMatrix m = MatrixUtils.createRealMatrix(n, n);
        for (int i = 0; i < n; i++) {
            String u = ids.get(i);
            for (GraphEdge e : view.outgoingEdgesOf(u)) {
                String v = Graphs.getOppositeVertex(view, e, u);
                m.addToEntry(index.get(v), i, view.getEdgeWeight(e));
            }
        }

        EigenDecomposition eigen = new EigenDecomposition(m);
        double[] real = eigen.getRealEigenvalues();
        double[] imag = eigen.getImagEigenvalues();
        double lambda = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < real.length; i++) {
            if (Math.abs(imag[i]) < 1e-9 && real[i] > lambda) lambda = real[i];
        }
        if (Double.isInfinite(lambda)) {
            throw new IllegalStateException("no real eigenvalue");
        }

        RealMatrix shifted = m.subtract(MatrixUtils.createRealIdentityMatrix(n).scalarMultiply(lambda));
        // 奇异值降序排列，最后一列对应最小奇异值
        RealVector vector = new SingularValueDecomposition(shifted).getV().getColumnVector(n - 1);

        double sum = 0d;
        for (int i = 0; i < n; i++) sum += vector.getEntry(i);
        double norm = vector.getNorm();
        if (norm == 0d) {
            throw new IllegalStateException("zero eigenvector");
        }
        double divisor = sum < 0 ? -norm : norm;

        Map<String, Double> result = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) result.put(ids.get(i), vector.getEntry(i) / divisor);
        return result;
    }
}
