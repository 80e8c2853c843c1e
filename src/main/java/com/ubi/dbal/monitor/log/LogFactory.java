package com.ubi.dbal.monitor.log;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;

/**
 * 日志工厂：统一管理各模块Logger，支持动态调整日志级别
 */
public class LogFactory {
    // 模块日志名称（与log4j2.xml中的Logger名称对应）
    public static final String MODULE_CORE = "DBAL_CORE";             // 配置与工厂
    public static final String MODULE_DRIVER = "DBAL_DRIVER";         // 数据库驱动
    public static final String MODULE_CACHE = "DBAL_CACHE";           // 查询结果缓存
    public static final String MODULE_MONITOR = "DBAL_MONITOR";       // 性能剖析
    public static final String MODULE_SLOW_QUERY = "DBAL_SLOW_QUERY"; // 慢查询

    private LogFactory() {
    }

    /**
     * 获取指定模块的Logger
     */
    public static Logger getLogger(String module) {
        return LogManager.getLogger(module);
    }

    /**
     * 动态调整日志级别（支持运行时修改）
     * @param module 模块名称
     * @param level 日志级别（trace/debug/info/warn/error/fatal）
     */
    public static void setLevel(String module, String level) {
        Level logLevel = Level.valueOf(level.toUpperCase());
        Configurator.setLevel(module, logLevel);
    }
}
