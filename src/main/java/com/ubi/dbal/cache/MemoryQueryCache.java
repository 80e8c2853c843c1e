package com.ubi.dbal.cache;

import com.ubi.dbal.driver.DatabaseDriver;
import com.ubi.dbal.driver.QueryResult;
import com.ubi.dbal.monitor.log.LogUtils;
import org.apache.commons.codec.digest.DigestUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * 进程内查询缓存
 * 行集按SQL文本的MD5存储并按TTL过期；每次加载/保存都会打开一个新的缓存游标（cache:n）
 */
public class MemoryQueryCache implements QueryCache {
    private static final String SQL_KEY_PREFIX = "sql_";

    private final TtlStore<String, Object> vars;
    private final TtlStore<String, List<Map<String, Object>>> rowSets;
    // 已打开的缓存游标：标识 → 游标
    private final Map<String, Cursor> cursors = new HashMap<>();
    private long cursorSequence;

    private static final class Cursor {
        final List<Map<String, Object>> rows;
        int pointer;

        Cursor(List<Map<String, Object>> rows) {
            this.rows = rows;
        }
    }

    public MemoryQueryCache(int maxEntries) {
        this(maxEntries, System::currentTimeMillis);
    }

    public MemoryQueryCache(int maxEntries, LongSupplier nowMillis) {
        this.vars = new TtlStore<>(maxEntries, nowMillis);
        this.rowSets = new TtlStore<>(maxEntries, nowMillis);
    }

    @Override
    public synchronized Object get(String key) {
        return vars.get(key);
    }

    @Override
    public void put(String key, Object value) {
        put(key, value, 0);
    }

    @Override
    public synchronized void put(String key, Object value, int ttlSeconds) {
        vars.put(key, value, TimeUnit.SECONDS.toMillis(ttlSeconds));
    }

    @Override
    public synchronized void destroy(String key) {
        vars.remove(key);
    }

    @Override
    public synchronized QueryResult sqlLoad(String query) {
        List<Map<String, Object>> rows = rowSets.get(sqlKey(query));
        if (rows == null) {
            return null;
        }
        LogUtils.cacheDebug("缓存命中 | 行数: {} | SQL: {}", rows.size(), query);
        return openCursor(rows, query);
    }

    @Override
    public QueryResult sqlSave(DatabaseDriver driver, String query, QueryResult result, int ttlSeconds) {
        List<Map<String, Object>> rows = new ArrayList<>();
        Map<String, Object> row;
        while ((row = driver.fetchRow(result)) != null) {
            rows.add(row);
        }
        driver.freeResult(result);
        List<Map<String, Object>> stored = Collections.unmodifiableList(rows);
        synchronized (this) {
            rowSets.put(sqlKey(query), stored, TimeUnit.SECONDS.toMillis(ttlSeconds));
            LogUtils.cacheDebug("缓存保存 | 行数: {} | ttl: {}s | SQL: {}", rows.size(), ttlSeconds, query);
            return openCursor(stored, query);
        }
    }

    @Override
    public synchronized boolean sqlExists(String id) {
        return cursors.containsKey(id);
    }

    @Override
    public synchronized Map<String, Object> sqlFetchRow(String id) {
        Cursor cursor = cursors.get(id);
        if (cursor == null || cursor.pointer >= cursor.rows.size()) {
            return null;
        }
        return new LinkedHashMap<>(cursor.rows.get(cursor.pointer++));
    }

    @Override
    public synchronized boolean sqlRowSeek(long rowNum, String id) {
        Cursor cursor = cursors.get(id);
        if (cursor == null || rowNum < 0) {
            return false;
        }
        if (rowNum >= cursor.rows.size()) {
            // 越过末尾：游标停在数据末尾，后续读取返回null
            cursor.pointer = cursor.rows.size();
            return false;
        }
        cursor.pointer = (int) rowNum;
        return true;
    }

    @Override
    public synchronized void sqlFreeResult(String id) {
        cursors.remove(id);
    }

    /**
     * 清理过期的变量与行集
     */
    public synchronized void tidy() {
        int removed = vars.pruneExpired() + rowSets.pruneExpired();
        LogUtils.cacheDebug("缓存整理完成，清理条目数: {}", removed);
    }

    public synchronized int openCursorCount() {
        return cursors.size();
    }

    private QueryResult openCursor(List<Map<String, Object>> rows, String query) {
        QueryResult cached = QueryResult.cached(++cursorSequence, query);
        cursors.put(cached.getId(), new Cursor(rows));
        return cached;
    }

    private static String sqlKey(String query) {
        return SQL_KEY_PREFIX + DigestUtils.md5Hex(query);
    }
}
