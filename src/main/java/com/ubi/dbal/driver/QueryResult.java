package com.ubi.dbal.driver;

import com.ubi.dbal.client.ResultHandle;

/**
 * 查询结果：活动句柄（live）或缓存行集快照（cached）
 * 标识由句柄序号或缓存游标序号确定，两个命名空间互不重叠
 */
public final class QueryResult {
    private static final String LIVE_PREFIX = "live:";
    private static final String CACHED_PREFIX = "cache:";

    public enum Source {
        LIVE,
        CACHED
    }

    private final Source source;
    private final String query;
    private String id;
    private ResultHandle handle;
    // 游标位置：已读取的行数
    private long position;

    private QueryResult(Source source, String id, String query, ResultHandle handle) {
        this.source = source;
        this.id = id;
        this.query = query;
        this.handle = handle;
    }

    public static QueryResult live(ResultHandle handle, String query) {
        return new QueryResult(Source.LIVE, liveId(handle), query, handle);
    }

    public static QueryResult cached(long cursorNumber, String query) {
        return new QueryResult(Source.CACHED, CACHED_PREFIX + cursorNumber, query, null);
    }

    static String liveId(ResultHandle handle) {
        return LIVE_PREFIX + handle.getId();
    }

    public String getId() {
        return id;
    }

    public Source getSource() {
        return source;
    }

    public boolean isCached() {
        return source == Source.CACHED;
    }

    public String getQuery() {
        return query;
    }

    /**
     * @return 活动句柄；缓存结果返回null
     */
    public ResultHandle getHandle() {
        return handle;
    }

    public long getPosition() {
        return position;
    }

    void advance() {
        position++;
    }

    void moveTo(long rowNum) {
        this.position = rowNum;
    }

    /**
     * 重新执行后绑定新句柄，游标归零
     */
    void rebind(ResultHandle newHandle) {
        if (source != Source.LIVE) {
            throw new IllegalStateException("缓存结果不能重新绑定句柄：" + id);
        }
        this.handle = newHandle;
        this.id = liveId(newHandle);
        this.position = 0;
    }

    @Override
    public String toString() {
        return "QueryResult{" + id + ", position=" + position + "}";
    }
}
