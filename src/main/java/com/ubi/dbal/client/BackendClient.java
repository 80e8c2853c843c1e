package com.ubi.dbal.client;

import com.ubi.dbal.core.ErrorRecord;

import java.util.Map;

/**
 * 后端客户端能力：驱动所依赖的底层原语（连接、执行、取行、释放、错误、关闭）
 * 所有失败通过{@link ClientResult}或{@link #lastError()}返回，不向驱动抛出异常
 */
public interface BackendClient {

    /**
     * 客户端名称（用于日志与错误消息）
     */
    String getName();

    /**
     * 探测原语是否可用，驱动在首次使用前必须调用
     */
    boolean isAvailable(ClientPrimitive primitive);

    ClientResult<ClientLink> connect(ConnectParams params);

    ClientResult<ResultHandle> execute(ClientLink link, String sql);

    /**
     * 前进一行
     * @return 列名到值的有序映射；无数据或句柄已释放时返回null
     */
    Map<String, Object> fetchRow(ResultHandle handle);

    /**
     * 语句影响的行数；结果集语句返回-1
     */
    long numRows(ResultHandle handle);

    /**
     * 释放句柄（幂等）
     */
    void free(ResultHandle handle);

    /**
     * 最近一次后端报告的错误
     */
    ErrorRecord lastError();

    void close(ClientLink link);
}
