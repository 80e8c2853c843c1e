package com.ubi.dbal.monitor;

/**
 * 查询剖析器：explain模式下由驱动在执行前后调用
 */
public interface QueryProfiler {

    void report(ReportMode mode, String query);

    /**
     * @param startNanos 计时起点（System.nanoTime）
     * @param endNanos   计时终点（System.nanoTime）
     */
    void report(ReportMode mode, String query, long startNanos, long endNanos);
}
