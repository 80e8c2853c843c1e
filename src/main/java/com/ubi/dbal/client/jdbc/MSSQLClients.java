package com.ubi.dbal.client.jdbc;

import com.ubi.dbal.client.ConnectParams;
import com.ubi.dbal.config.DriverConfig;

/**
 * MSSQL客户端构建：SQL Server JDBC驱动类与URL格式
 */
public final class MSSQLClients {
    public static final String DRIVER_CLASS = "com.microsoft.sqlserver.jdbc.SQLServerDriver";
    public static final int DEFAULT_PORT = 1433;

    private MSSQLClients() {
    }

    public static JdbcBackendClient jdbc(DriverConfig.PoolConfig poolConfig, boolean encrypt) {
        return new JdbcBackendClient("mssql-jdbc", DRIVER_CLASS, params -> buildUrl(params, encrypt), poolConfig);
    }

    static String buildUrl(ConnectParams params, boolean encrypt) {
        int port = params.getPort() != null ? params.getPort() : DEFAULT_PORT;
        StringBuilder url = new StringBuilder(String.format("jdbc:sqlserver://%s:%d", params.getHost(), port));
        if (params.getDatabase() != null && !params.getDatabase().isEmpty()) {
            url.append(";databaseName=").append(params.getDatabase());
        }
        url.append(";encrypt=").append(encrypt);
        return url.toString();
    }
}
