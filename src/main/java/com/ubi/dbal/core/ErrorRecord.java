package com.ubi.dbal.core;

import lombok.Data;

/**
 * 错误记录：单次失败操作的错误信息（消息 + 错误码），不做持久保留
 */
@Data
public class ErrorRecord {
    private static final ErrorRecord NONE = new ErrorRecord("", "");

    // 错误消息
    private final String message;
    // 错误码（JDBC为SQLState，缺失时为厂商错误码）
    private final String code;

    public static ErrorRecord of(String message, String code) {
        return new ErrorRecord(message == null ? "" : message, code == null ? "" : code);
    }

    /**
     * 无错误
     */
    public static ErrorRecord none() {
        return NONE;
    }

    public boolean isEmpty() {
        return message.isEmpty() && code.isEmpty();
    }
}
