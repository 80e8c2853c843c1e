package com.ubi.dbal.monitor;

import com.ubi.dbal.monitor.log.LogFactory;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.TimeUnit;

/**
 * 基于日志的剖析器：记录每条查询的耗时、缓存命中与缓存对比耗时，并把耗时交给慢查询日志
 * 与驱动一样按单连接使用，非线程安全
 */
public class LoggingQueryProfiler implements QueryProfiler {
    private static final Logger MONITOR_LOGGER = LogFactory.getLogger(LogFactory.MODULE_MONITOR);

    private final SlowQueryLogger slowQueryLogger;
    private long queryStart;
    private int queryCount;
    private int cachedCount;
    private long totalNanos;

    public LoggingQueryProfiler(SlowQueryLogger slowQueryLogger) {
        this.slowQueryLogger = slowQueryLogger;
    }

    @Override
    public void report(ReportMode mode, String query) {
        switch (mode) {
            case START:
                queryStart = System.nanoTime();
                break;
            case STOP:
                report(mode, query, queryStart, System.nanoTime());
                break;
            case FROM_CACHE:
                cachedCount++;
                MONITOR_LOGGER.debug("查询结果来自缓存 | SQL: {}", query);
                break;
            default:
                throw new IllegalArgumentException(mode + " 需要提供计时参数");
        }
    }

    @Override
    public void report(ReportMode mode, String query, long startNanos, long endNanos) {
        long elapsed = Math.max(0, endNanos - startNanos);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(elapsed);
        switch (mode) {
            case STOP:
                queryCount++;
                totalNanos += elapsed;
                MONITOR_LOGGER.debug("查询完成 | 耗时: {}ms | SQL: {}", elapsedMs, query);
                if (slowQueryLogger != null) {
                    slowQueryLogger.logIfSlow(query, elapsedMs);
                }
                break;
            case RECORD_FROM_CACHE:
                MONITOR_LOGGER.debug("缓存对比 | 直接执行耗时: {}ms | SQL: {}", elapsedMs, query);
                break;
            default:
                report(mode, query);
                break;
        }
    }

    public int getQueryCount() {
        return queryCount;
    }

    public int getCachedCount() {
        return cachedCount;
    }

    public long getTotalMillis() {
        return TimeUnit.NANOSECONDS.toMillis(totalNanos);
    }
}
