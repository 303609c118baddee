package com.gdin.inspection.graphalgo.storage;

import com.gdin.inspection.graphalgo.models.GraphData;

import java.util.List;
import java.util.Map;

/**
 * 实体图存储。失败统一抛 {@link GraphStoreException}。
 */
public interface GraphStore {

    /**
     * 拉取某类实体及其 relatedTo 关系。
     */
    GraphData fetchGraphData(String entityType, int limit);

    /**
     * 一次提交一组 set mutation。
     *
     * @return blank node 名 -> 新分配的 uid（只更新已有节点时为空）
     */
    Map<String, String> persist(List<Map<String, Object>> mutations);

    boolean ping();
}
