package com.ubi.dbal.core;

/**
 * 驱动配置异常：调用参数或配置非法时抛出（如负数的分页参数、无法识别的事务状态）
 *
 * @author 邹安族
 */
public class DriverConfigurationException extends RuntimeException {

    /**
     * 带错误消息的构造器
     *
     * @param message 错误详情（如"分页参数不能为负数"）
     */
    public DriverConfigurationException(String message) {
        super(message);
    }

    /**
     * 带错误消息和根因的构造器
     *
     * @param message 错误详情
     * @param cause   原始异常
     */
    public DriverConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
