package com.ubi.dbal.client.jdbc;

import com.ubi.dbal.client.ClientLink;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * JDBC连接句柄
 */
class JdbcClientLink implements ClientLink {
    private final Connection connection;
    // 是否从连接池借出（关闭即归还）
    private final boolean pooled;

    JdbcClientLink(Connection connection, boolean pooled) {
        this.connection = connection;
        this.pooled = pooled;
    }

    Connection getConnection() {
        return connection;
    }

    boolean isPooled() {
        return pooled;
    }

    @Override
    public boolean isClosed() {
        try {
            return connection.isClosed();
        } catch (SQLException e) {
            return true;
        }
    }
}
