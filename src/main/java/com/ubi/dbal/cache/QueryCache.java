package com.ubi.dbal.cache;

import com.ubi.dbal.driver.DatabaseDriver;
import com.ubi.dbal.driver.QueryResult;

import java.util.Map;

/**
 * 查询结果缓存：按原始SQL文本存储行集，按结果标识读取已打开的缓存游标
 * 驱动把缓存视为可选依赖，存储策略由缓存实现决定
 */
public interface QueryCache {

    /**
     * 读取普通缓存变量
     * @return 未命中或已过期时返回null
     */
    Object get(String key);

    /**
     * 写入普通缓存变量（永不过期，直到被外部销毁）
     */
    void put(String key, Object value);

    /**
     * 写入普通缓存变量
     * @param ttlSeconds 存活秒数，0表示永不过期
     */
    void put(String key, Object value, int ttlSeconds);

    void destroy(String key);

    /**
     * 按SQL文本加载缓存行集并打开游标
     * @return 命中时返回缓存结果，否则返回null
     */
    QueryResult sqlLoad(String query);

    /**
     * 读完活动结果的所有行并存储，随后通过驱动释放活动结果
     * @return 指向新存储行集的缓存结果
     */
    QueryResult sqlSave(DatabaseDriver driver, String query, QueryResult result, int ttlSeconds);

    boolean sqlExists(String id);

    /**
     * @return 下一行（保持原始列顺序与值类型）；游标结束或不存在时返回null
     */
    Map<String, Object> sqlFetchRow(String id);

    boolean sqlRowSeek(long rowNum, String id);

    void sqlFreeResult(String id);
}
