package com.ubi.dbal.driver;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 打开句柄登记表：标识 → 尚未释放的活动结果，生命周期与单个连接一致
 * 非线程安全，每个连接独占一份
 */
public class OpenQueryRegistry {
    private final Map<String, QueryResult> openQueries = new LinkedHashMap<>();

    void register(QueryResult result) {
        if (result.isCached()) {
            throw new IllegalArgumentException("缓存结果不能登记为活动句柄：" + result.getId());
        }
        openQueries.put(result.getId(), result);
    }

    public boolean contains(String id) {
        return openQueries.containsKey(id);
    }

    QueryResult remove(String id) {
        return openQueries.remove(id);
    }

    public int size() {
        return openQueries.size();
    }

    /**
     * 取出并清空所有登记项
     */
    List<QueryResult> drain() {
        List<QueryResult> results = new ArrayList<>(openQueries.values());
        openQueries.clear();
        return results;
    }
}
