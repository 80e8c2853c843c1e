package com.ubi.dbal.client;

/**
 * 客户端原语：驱动在首次使用前需要探测的底层能力
 */
public enum ClientPrimitive {
    CONNECT("connect"),
    PERSISTENT_CONNECT("pconnect"),
    EXECUTE("exec"),
    FETCH("fetch"),
    FREE("free_result"),
    ERROR("error"),
    CLOSE("close");

    private final String primitiveName;

    ClientPrimitive(String primitiveName) {
        this.primitiveName = primitiveName;
    }

    public String getPrimitiveName() {
        return primitiveName;
    }
}
