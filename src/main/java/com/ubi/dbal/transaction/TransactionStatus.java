package com.ubi.dbal.transaction;

import com.ubi.dbal.core.DriverConfigurationException;

/**
 * 事务状态：驱动只识别开启、提交、回滚三种
 */
public enum TransactionStatus {
    BEGIN,
    COMMIT,
    ROLLBACK;

    /**
     * 按名称解析（忽略大小写）
     * @throws DriverConfigurationException 无法识别的状态名
     */
    public static TransactionStatus of(String name) {
        if (name != null) {
            for (TransactionStatus status : values()) {
                if (status.name().equalsIgnoreCase(name.trim())) {
                    return status;
                }
            }
        }
        throw new DriverConfigurationException("无法识别的事务状态: " + name + "（只支持begin/commit/rollback）");
    }
}
