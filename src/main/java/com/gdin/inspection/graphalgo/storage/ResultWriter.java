package com.gdin.inspection.graphalgo.storage;

import com.gdin.inspection.graphalgo.models.AlgorithmMetadata;

import java.util.Map;

/**
 * 算法结果写回。
 *
 * 两个方法的失败语义不同：标量写回用返回值表示成败，社区节点创建失败直接抛异常。
 */
public interface ResultWriter {

    /**
     * 把 节点 -> 分值 写成节点上的 {@code <algorithm>_score} 属性，附带 {@code <algorithm>_<元数据字段>}。
     *
     * @return 全部批次成功为 true；任一批次失败为 false，之前已提交的批次不回滚
     */
    boolean writeScalarResults(String algorithm, Map<String, ? extends Number> results, AlgorithmMetadata metadata);

    /**
     * 按社区编号分组，每个社区新建一个 Community 节点并挂上成员。
     *
     * @return 社区编号 -> 新节点 uid；没拿到 uid 的社区不在结果里
     */
    Map<Integer, String> createCommunityEntities(
            String algorithm,
            Map<String, ? extends Number> partition,
            AlgorithmMetadata metadata
    );
}
