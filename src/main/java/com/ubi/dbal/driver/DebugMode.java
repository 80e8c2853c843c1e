package com.ubi.dbal.driver;

import com.ubi.dbal.core.DriverConfigurationException;

/**
 * 调试模式：explain（逐条剖析）与load_time（累计耗时）互斥
 */
public enum DebugMode {
    NONE,
    EXPLAIN,
    LOAD_TIME;

    public static DebugMode of(String name) {
        if (name == null || name.trim().isEmpty()) {
            return NONE;
        }
        switch (name.trim().toLowerCase()) {
            case "none":
                return NONE;
            case "explain":
                return EXPLAIN;
            case "load_time":
            case "load-time":
                return LOAD_TIME;
            default:
                throw new DriverConfigurationException("不支持的调试模式: " + name);
        }
    }
}
