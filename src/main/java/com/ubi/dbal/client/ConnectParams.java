package com.ubi.dbal.client;

import lombok.Data;

/**
 * 建立连接所需的参数
 */
@Data
public class ConnectParams {
    // 服务器标识（主机 + 端口分隔符 + 端口），用于日志与连接身份
    private String server;
    private String host;
    // 为null时使用客户端的默认端口
    private Integer port;
    private String user;
    private String password;
    private String database;
    // 是否使用持久连接（连接池借出）
    private boolean persistent;
}
