package com.ubi.dbal.driver.limit;

/**
 * 分页改写器：把"取total行、跳过offset行"转换为引擎特有的SQL改写 + 执行后的游标前移
 * 纯文本转换，不依赖后端状态
 */
public interface LimitRewriter {

    /**
     * @param sql    单条 SELECT [DISTINCT] ... 语句
     * @param total  需要的行数，0表示全部
     * @param offset 跳过的行数
     */
    LimitedQuery rewrite(String sql, int total, int offset);
}
