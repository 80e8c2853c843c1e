package com.ubi.dbal.driver.limit;

import com.ubi.dbal.core.DriverConfigurationException;

/**
 * T-SQL的TOP分页改写：请求total+offset行，执行后再前移offset行
 * TOP只能限制返回行数，不能跳过，因此必须多取offset行
 */
public class TopLimitRewriter implements LimitRewriter {
    private static final String SELECT = "SELECT";
    private static final String DISTINCT = "DISTINCT";

    @Override
    public LimitedQuery rewrite(String sql, int total, int offset) {
        if (total < 0 || offset < 0) {
            throw new DriverConfigurationException("分页参数不能为负数（total: " + total + ", offset: " + offset + "）");
        }
        // total为0表示取全部行，不需要TOP
        if (total == 0) {
            return new LimitedQuery(sql, offset, 0);
        }
        // 用long计算，int范围内的total+offset不会溢出
        long rows = (long) total + offset;
        // 关键字大小写不敏感，忽略前导空白；语句其余部分保持原样
        String statement = sql.stripLeading();
        int afterSelect = keywordEnd(statement, SELECT);
        if (afterSelect < 0) {
            throw new DriverConfigurationException("分页改写只支持SELECT语句：" + sql);
        }
        String rest = statement.substring(afterSelect).stripLeading();
        String rewritten;
        int afterDistinct = keywordEnd(rest, DISTINCT);
        if (afterDistinct >= 0) {
            rewritten = SELECT + " " + DISTINCT + " TOP " + rows + " " + rest.substring(afterDistinct).stripLeading();
        } else {
            rewritten = SELECT + " TOP " + rows + " " + rest;
        }
        return new LimitedQuery(rewritten, offset, rows);
    }

    /**
     * 关键字（后跟空白）结束的位置；不匹配时返回-1
     * 关键字后必须是空白，避免把 SELECTED / SELECT DISTINCTROW 之类误判
     */
    private static int keywordEnd(String text, String keyword) {
        int end = keyword.length();
        if (!text.regionMatches(true, 0, keyword, 0, end)) {
            return -1;
        }
        return text.length() > end && Character.isWhitespace(text.charAt(end)) ? end : -1;
    }
}
