package com.ubi.dbal.driver;

import com.ubi.dbal.cache.QueryCache;
import com.ubi.dbal.client.BackendClient;
import com.ubi.dbal.driver.limit.LimitRewriter;
import com.ubi.dbal.driver.limit.TopLimitRewriter;
import com.ubi.dbal.monitor.QueryProfiler;
import com.ubi.dbal.transaction.TransactionStatus;

/**
 * MSSQL数据库驱动
 * 功能：提供T-SQL特有的部分（TOP分页、SERVERPROPERTY版本查询、事务语句、@@IDENTITY、字面量转义）
 */
public class MSSQLDriver extends AbstractDatabaseDriver {
    public static final String VERSION_CACHE_KEY = "mssqljdbc_version";

    private static final String SERVER_LABEL = "MSSQL (JDBC)";
    private static final String VERSION_QUERY =
            "SELECT SERVERPROPERTY('productversion'), SERVERPROPERTY('productlevel'), SERVERPROPERTY('edition')";

    private final LimitRewriter limitRewriter = new TopLimitRewriter();

    public MSSQLDriver(BackendClient client) {
        this(client, null, null, DebugMode.NONE);
    }

    public MSSQLDriver(BackendClient client, QueryCache cache, QueryProfiler profiler, DebugMode debugMode) {
        super(client, cache, profiler, debugMode);
    }

    @Override
    protected String serverLabel() {
        return SERVER_LABEL;
    }

    @Override
    protected String serverVersionCacheKey() {
        return VERSION_CACHE_KEY;
    }

    @Override
    protected String serverVersionQuery() {
        return VERSION_QUERY;
    }

    @Override
    protected String transactionStatement(TransactionStatus status) {
        switch (status) {
            case BEGIN:
                return "BEGIN TRANSACTION";
            case COMMIT:
                return "COMMIT TRANSACTION";
            case ROLLBACK:
                return "ROLLBACK TRANSACTION";
            default:
                throw new IllegalArgumentException("未知事务状态: " + status);
        }
    }

    @Override
    protected String lastInsertedIdQuery() {
        return "SELECT @@IDENTITY";
    }

    @Override
    protected LimitRewriter limitRewriter() {
        return limitRewriter;
    }

    /**
     * T-SQL字符串字面量转义：单引号加倍
     */
    @Override
    public String escape(String text) {
        return text == null ? "" : text.replace("'", "''");
    }
}
