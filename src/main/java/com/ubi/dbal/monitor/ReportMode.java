package com.ubi.dbal.monitor;

/**
 * 剖析事件类型
 */
public enum ReportMode {
    // 查询开始执行
    START,
    // 查询执行结束
    STOP,
    // 结果来自缓存
    FROM_CACHE,
    // 缓存命中后重新执行得到的对比耗时
    RECORD_FROM_CACHE
}
