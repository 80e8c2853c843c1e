package com.ubi.dbal.driver;

import com.ubi.dbal.cache.MemoryQueryCache;
import com.ubi.dbal.cache.QueryCache;
import com.ubi.dbal.client.jdbc.MSSQLClients;
import com.ubi.dbal.config.DriverConfig;
import com.ubi.dbal.core.ConnectivityException;
import com.ubi.dbal.monitor.LoggingQueryProfiler;
import com.ubi.dbal.monitor.QueryProfiler;
import com.ubi.dbal.monitor.SlowQueryLogger;
import com.ubi.dbal.monitor.log.LogUtils;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * 数据库驱动工厂
 * 核心功能：按驱动类型注册构建器，每次调用创建新的驱动实例（每个实例独占一个连接）
 * 同一工厂创建的驱动共享查询缓存
 */
public class DriverFactory {

    // 驱动构建器：key=数据库类型（如"mssql"），value=按配置创建驱动
    private final Map<String, Function<DriverConfig, AbstractDatabaseDriver>> builders = new ConcurrentHashMap<>();
    // 共享查询缓存（配置未开启时为null）
    private final QueryCache sharedCache;

    public DriverFactory(DriverConfig defaults) {
        this.sharedCache = defaults != null && defaults.getCache().isEnabled()
                ? new MemoryQueryCache(defaults.getCache().getMaxEntries())
                : null;
        registerDriver("mssql", config -> new MSSQLDriver(
                MSSQLClients.jdbc(config.getPool(), config.getConnection().isEncrypt()),
                sharedCache,
                createProfiler(config),
                DebugMode.of(config.getDebug().getMode())));
    }

    /**
     * 根据配置创建驱动实例（不连接）
     * @throws IllegalArgumentException 不支持的数据库类型时抛出
     */
    public AbstractDatabaseDriver create(DriverConfig config) {
        Function<DriverConfig, AbstractDatabaseDriver> builder = builders.get(config.getType());
        if (builder == null) {
            throw new IllegalArgumentException("不支持的数据库类型: " + config.getType());
        }
        AbstractDatabaseDriver driver = builder.apply(config);
        driver.setPortDelimiter(config.getConnection().getPortDelimiter());
        return driver;
    }

    /**
     * 根据配置创建驱动并建立连接
     */
    public AbstractDatabaseDriver connect(DriverConfig config) throws ConnectivityException {
        AbstractDatabaseDriver driver = create(config);
        DriverConfig.ConnectionConfig conn = config.getConnection();
        driver.connect(conn.getHost(), conn.getUser(), conn.getPassword(), conn.getDatabase(),
                conn.getPort(), conn.isPersistent());
        return driver;
    }

    /**
     * 动态注册新的数据库驱动（扩展用）
     * @param type 数据库类型标识
     * @param builder 驱动构建器
     */
    public void registerDriver(String type, Function<DriverConfig, AbstractDatabaseDriver> builder) {
        builders.put(type, builder);
        LogUtils.coreDebug("注册数据库驱动：{}", type);
    }

    public QueryCache getSharedCache() {
        return sharedCache;
    }

    private static QueryProfiler createProfiler(DriverConfig config) {
        if (DebugMode.of(config.getDebug().getMode()) != DebugMode.EXPLAIN) {
            return null;
        }
        return new LoggingQueryProfiler(new SlowQueryLogger(config.getSlowLog()));
    }
}
