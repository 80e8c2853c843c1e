package com.ubi.dbal.client.jdbc;

import com.ubi.dbal.client.BackendClient;
import com.ubi.dbal.client.ClientLink;
import com.ubi.dbal.client.ClientPrimitive;
import com.ubi.dbal.client.ClientResult;
import com.ubi.dbal.client.ConnectParams;
import com.ubi.dbal.client.ResultHandle;
import com.ubi.dbal.config.DriverConfig;
import com.ubi.dbal.core.ErrorRecord;
import com.ubi.dbal.monitor.log.LogUtils;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * 基于JDBC的后端客户端
 * 功能：通过JDBC驱动类探测能力；非持久连接走DriverManager，持久连接从HikariCP连接池借出（连接池懒加载）
 */
public class JdbcBackendClient implements BackendClient {
    private static final String HIKARI_CLASS = "com.zaxxer.hikari.HikariDataSource";

    private final String name;
    private final String driverClassName;
    // 连接参数 → JDBC URL
    private final Function<ConnectParams, String> urlBuilder;
    private final DriverConfig.PoolConfig poolConfig;

    // 句柄序号
    private final AtomicLong handleSequence = new AtomicLong();
    // 类存在性探测结果缓存
    private final Map<String, Boolean> classPresence = new ConcurrentHashMap<>();

    // 连接池缓存：key=服务器|用户|数据库，value=连接池
    private final Map<String, HikariDataSource> dataSources = new HashMap<>();
    // 连接池创建锁：确保线程安全
    private final ReentrantLock lock = new ReentrantLock();

    private volatile ErrorRecord lastError = ErrorRecord.none();

    public JdbcBackendClient(String name, String driverClassName,
                             Function<ConnectParams, String> urlBuilder,
                             DriverConfig.PoolConfig poolConfig) {
        this.name = name;
        this.driverClassName = driverClassName;
        this.urlBuilder = urlBuilder;
        this.poolConfig = poolConfig == null ? new DriverConfig.PoolConfig() : poolConfig;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean isAvailable(ClientPrimitive primitive) {
        switch (primitive) {
            case ERROR:
                return true;
            case PERSISTENT_CONNECT:
                return isClassPresent(driverClassName) && isClassPresent(HIKARI_CLASS);
            default:
                return isClassPresent(driverClassName);
        }
    }

    @Override
    public ClientResult<ClientLink> connect(ConnectParams params) {
        String url = urlBuilder.apply(params);
        try {
            if (params.isPersistent()) {
                Connection conn = getDataSource(params, url).getConnection();
                return ClientResult.success(new JdbcClientLink(conn, true));
            }
            Connection conn = DriverManager.getConnection(url, params.getUser(), params.getPassword());
            return ClientResult.success(new JdbcClientLink(conn, false));
        } catch (SQLException e) {
            return ClientResult.failure(recordError(e));
        }
    }

    @Override
    public ClientResult<ResultHandle> execute(ClientLink link, String sql) {
        Connection conn = ((JdbcClientLink) link).getConnection();
        Statement st = null;
        try {
            st = conn.createStatement();
            boolean hasResultSet = st.execute(sql);
            long id = handleSequence.incrementAndGet();
            if (hasResultSet) {
                return ClientResult.success(new JdbcResultHandle(id, st, st.getResultSet(), -1));
            }
            long updateCount = st.getUpdateCount();
            closeStatement(st);
            return ClientResult.success(new JdbcResultHandle(id, null, null, updateCount));
        } catch (SQLException e) {
            closeStatement(st);
            return ClientResult.failure(recordError(e));
        }
    }

    @Override
    public Map<String, Object> fetchRow(ResultHandle handle) {
        JdbcResultHandle jdbcHandle = (JdbcResultHandle) handle;
        if (jdbcHandle.isReleased()) {
            return null;
        }
        ResultSet rs = jdbcHandle.getResultSet();
        try {
            if (!rs.next()) {
                return null;
            }
            ResultSetMetaData meta = rs.getMetaData();
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= meta.getColumnCount(); i++) {
                row.put(meta.getColumnLabel(i), rs.getObject(i));
            }
            return row;
        } catch (SQLException e) {
            recordError(e);
            return null;
        }
    }

    @Override
    public long numRows(ResultHandle handle) {
        return ((JdbcResultHandle) handle).getUpdateCount();
    }

    @Override
    public void free(ResultHandle handle) {
        JdbcResultHandle jdbcHandle = (JdbcResultHandle) handle;
        if (jdbcHandle.isReleased()) {
            return;
        }
        jdbcHandle.markReleased();
        try {
            jdbcHandle.getResultSet().close();
        } catch (SQLException e) {
            LogUtils.driverWarn("关闭结果集失败（句柄: {}）：{}", jdbcHandle.getId(), e.getMessage());
        }
        closeStatement(jdbcHandle.getStatement());
    }

    @Override
    public ErrorRecord lastError() {
        return lastError;
    }

    /**
     * 关闭连接（连接池连接实际是归还）
     */
    @Override
    public void close(ClientLink link) {
        JdbcClientLink jdbcLink = (JdbcClientLink) link;
        try {
            Connection conn = jdbcLink.getConnection();
            if (jdbcLink.isPooled() && !conn.getAutoCommit()) {
                // 恢复自动提交（避免影响连接池中的其他使用者）
                conn.setAutoCommit(true);
            }
            conn.close();
        } catch (SQLException e) {
            LogUtils.driverWarn("关闭连接失败：{}", e.getMessage());
        }
    }

    /**
     * 关闭所有连接池（应用退出时调用）
     */
    public void shutdown() {
        lock.lock();
        try {
            dataSources.values().forEach(HikariDataSource::close);
            dataSources.clear();
        } finally {
            lock.unlock();
        }
    }

    private HikariDataSource getDataSource(ConnectParams params, String url) {
        String key = params.getServer() + "|" + params.getUser() + "|" + params.getDatabase();
        lock.lock();
        try {
            HikariDataSource ds = dataSources.get(key);
            if (ds == null) {
                ds = createDataSource(params, url);
                dataSources.put(key, ds);
                LogUtils.driverInfo("创建连接池：{}（客户端: {}）", key, name);
            }
            return ds;
        } finally {
            lock.unlock();
        }
    }

    private HikariDataSource createDataSource(ConnectParams params, String url) {
        HikariConfig hc = new HikariConfig();
        hc.setJdbcUrl(url);
        hc.setDriverClassName(driverClassName);
        hc.setUsername(params.getUser());
        hc.setPassword(params.getPassword());
        // 连接池参数
        hc.setMaximumPoolSize(poolConfig.getMaxPoolSize());
        hc.setMinimumIdle(poolConfig.getMinIdle());
        hc.setConnectionTimeout(poolConfig.getConnectionTimeout());
        hc.setIdleTimeout(poolConfig.getIdleTimeout());
        hc.setInitializationFailTimeout(0); // 懒加载：启动不检查连接
        return new HikariDataSource(hc);
    }

    private ErrorRecord recordError(SQLException e) {
        String code = e.getSQLState() != null ? e.getSQLState() : String.valueOf(e.getErrorCode());
        lastError = ErrorRecord.of(e.getMessage(), code);
        LogUtils.driverDebug("后端报告错误 | 代码: {} | 信息: {}", code, e.getMessage());
        return lastError;
    }

    private void closeStatement(Statement st) {
        if (st == null) {
            return;
        }
        try {
            st.close();
        } catch (SQLException e) {
            LogUtils.driverWarn("关闭语句失败：{}", e.getMessage());
        }
    }

    private boolean isClassPresent(String className) {
        return classPresence.computeIfAbsent(className, cn -> {
            try {
                Class.forName(cn, false, JdbcBackendClient.class.getClassLoader());
                return true;
            } catch (ClassNotFoundException e) {
                LogUtils.driverDebug("类不存在：{}", cn);
                return false;
            }
        });
    }
}
