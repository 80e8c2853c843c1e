package com.ubi.dbal.driver;

/**
 * 连接状态：disconnected → connected → closed
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTED,
    CLOSED
}
