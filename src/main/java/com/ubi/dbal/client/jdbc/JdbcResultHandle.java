package com.ubi.dbal.client.jdbc;

import com.ubi.dbal.client.ResultHandle;

import java.sql.ResultSet;
import java.sql.Statement;

/**
 * JDBC结果句柄：持有语句与结果集；无结果集的语句只保留影响行数
 */
class JdbcResultHandle implements ResultHandle {
    private final long id;
    private final Statement statement;
    private final ResultSet resultSet;
    private final long updateCount;
    private boolean released;

    JdbcResultHandle(long id, Statement statement, ResultSet resultSet, long updateCount) {
        this.id = id;
        this.statement = statement;
        this.resultSet = resultSet;
        this.updateCount = updateCount;
        // 无结果集的语句在执行后立即关闭
        this.released = resultSet == null;
    }

    @Override
    public long getId() {
        return id;
    }

    @Override
    public boolean isReleased() {
        return released;
    }

    Statement getStatement() {
        return statement;
    }

    ResultSet getResultSet() {
        return resultSet;
    }

    long getUpdateCount() {
        return updateCount;
    }

    void markReleased() {
        this.released = true;
    }
}
