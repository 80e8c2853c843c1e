package com.ubi.dbal.monitor;

import com.ubi.dbal.config.DriverConfig;
import com.ubi.dbal.monitor.log.LogFactory;
import org.apache.logging.log4j.Logger;

import java.util.regex.Pattern;

/**
 * 慢查询日志记录器：记录超过阈值的SQL查询
 */
public class SlowQueryLogger {
    private static final Logger SLOW_QUERY_LOGGER = LogFactory.getLogger(LogFactory.MODULE_SLOW_QUERY);
    // 敏感字段的字面量：password = 'xxx' / token='xxx'
    private static final Pattern SENSITIVE_LITERAL =
            Pattern.compile("(?i)(password|token|secret)(\\s*=\\s*)'[^']*'");

    private final boolean enabled;
    private final long slowThresholdMs; // 慢查询阈值（毫秒）

    // 构造器：从配置获取阈值，无配置时默认1000ms
    public SlowQueryLogger(DriverConfig.SlowLogConfig config) {
        this.enabled = config == null || config.isEnabled();
        this.slowThresholdMs = config != null ? config.getThresholdMs() : 1000;
    }

    /**
     * 当查询耗时超过阈值时记录慢查询日志
     * @param sql SQL语句
     * @param costTimeMs 耗时（毫秒）
     * @return 是否记录
     */
    public boolean logIfSlow(String sql, long costTimeMs) {
        // 未开启或耗时未超过阈值，不记录
        if (!enabled || costTimeMs < slowThresholdMs) {
            return false;
        }
        SLOW_QUERY_LOGGER.warn(
                "慢查询 detected | 耗时: {}ms (阈值: {}ms) | SQL: {}",
                costTimeMs,
                slowThresholdMs,
                maskSensitiveLiterals(sql)
        );
        return true;
    }

    public long getSlowThresholdMs() {
        return slowThresholdMs;
    }

    /**
     * 敏感字面量脱敏（避免日志泄露密码等）
     */
    static String maskSensitiveLiterals(String sql) {
        if (sql == null) {
            return "null";
        }
        return SENSITIVE_LITERAL.matcher(sql).replaceAll("$1$2'***脱敏***'");
    }
}
