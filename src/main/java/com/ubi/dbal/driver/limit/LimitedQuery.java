package com.ubi.dbal.driver.limit;

import lombok.Data;

/**
 * 分页改写结果：改写后的SQL + 执行后需要前移的行数
 */
@Data
public class LimitedQuery {
    private final String sql;
    private final long seekOffset;
    // 改写后请求的行数；未改写时为0（不限行数）
    private final long requestedRows;

    public boolean isRewritten() {
        return requestedRows > 0;
    }
}
