package com.ubi.dbal.client;

/**
 * 活动结果句柄：指向后端正在执行的游标
 */
public interface ResultHandle {

    /**
     * 句柄序号，在同一客户端内单调递增且不复用
     */
    long getId();

    /**
     * 底层资源是否已释放
     */
    boolean isReleased();
}
