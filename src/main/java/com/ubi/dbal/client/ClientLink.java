package com.ubi.dbal.client;

/**
 * 客户端连接句柄：由{@link BackendClient#connect}创建，驱动只持有不解析
 */
public interface ClientLink {

    boolean isClosed();
}
