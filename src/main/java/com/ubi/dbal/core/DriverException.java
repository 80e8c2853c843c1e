package com.ubi.dbal.core;

/**
 * 驱动异常基类：驱动层受检异常的公共父类
 *
 * @author 邹安族
 */
public class DriverException extends Exception {

    /**
     * 无参构造器
     */
    public DriverException() {
        super();
    }

    /**
     * 带错误消息的构造器
     *
     * @param message 错误详情
     */
    public DriverException(String message) {
        super(message);
    }

    /**
     * 带错误消息和根因的构造器
     *
     * @param message 错误详情
     * @param cause   原始异常
     */
    public DriverException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * 带根因的构造器
     *
     * @param cause 原始异常
     */
    public DriverException(Throwable cause) {
        super(cause);
    }
}
