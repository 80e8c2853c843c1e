package com.ubi.dbal.config;

import lombok.Data;

/**
 * 驱动配置：连接、调试模式、查询缓存、慢查询与连接池
 */
@Data
public class DriverConfig {
    // 驱动类型（对应DriverFactory中的注册名）
    private String type = "mssql";
    private ConnectionConfig connection = new ConnectionConfig();
    private DebugConfig debug = new DebugConfig();
    private CacheConfig cache = new CacheConfig();
    private SlowLogConfig slowLog = new SlowLogConfig();
    private PoolConfig pool = new PoolConfig();

    @Data
    public static class ConnectionConfig {
        private String host = "localhost";
        private int port = 1433;
        private String database;
        private String user;
        private String password;
        private boolean persistent = false;
        // 端口分隔符，为空时按目标平台自动选择
        private String portDelimiter;
        private boolean encrypt = false;
    }

    @Data
    public static class DebugConfig {
        // none / explain / load_time
        private String mode = "none";
    }

    @Data
    public static class CacheConfig {
        private boolean enabled = false;
        private int maxEntries = 1000;
    }

    @Data
    public static class SlowLogConfig {
        private boolean enabled = true;
        private long thresholdMs = 1000;
    }

    @Data
    public static class PoolConfig {
        private int maxPoolSize = 10;
        private int minIdle = 0; // 懒加载：初始不创建连接
        private long connectionTimeout = 30000;
        private long idleTimeout = 600000;
    }
}
