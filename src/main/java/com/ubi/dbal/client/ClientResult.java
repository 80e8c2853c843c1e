package com.ubi.dbal.client;

import com.ubi.dbal.core.ErrorRecord;

import java.util.Objects;

/**
 * 客户端调用结果：成功时携带值，失败时携带错误记录（二者互斥）
 * @param <T> 成功值类型
 */
public final class ClientResult<T> {
    private final T value;
    private final ErrorRecord error;

    private ClientResult(T value, ErrorRecord error) {
        this.value = value;
        this.error = error;
    }

    public static <T> ClientResult<T> success(T value) {
        return new ClientResult<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> ClientResult<T> failure(ErrorRecord error) {
        return new ClientResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    /**
     * @throws IllegalStateException 失败结果没有值
     */
    public T getValue() {
        if (error != null) {
            throw new IllegalStateException("失败结果没有值：" + error.getMessage());
        }
        return value;
    }

    public ErrorRecord getError() {
        return error;
    }
}
