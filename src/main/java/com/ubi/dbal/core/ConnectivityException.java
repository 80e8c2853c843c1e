package com.ubi.dbal.core;

/**
 * 连接异常：客户端能力缺失或建立连接失败时抛出
 *
 * @author 邹安族
 */
public class ConnectivityException extends DriverException {

    // 错误报告器生成的错误记录
    private final ErrorRecord error;

    /**
     * 带错误记录的构造器
     *
     * @param error 错误记录（消息为空时使用默认描述）
     */
    public ConnectivityException(ErrorRecord error) {
        super(error.getMessage().isEmpty() ? "数据库连接失败" : error.getMessage());
        this.error = error;
    }

    public ErrorRecord getError() {
        return error;
    }
}
