package com.ubi.dbal.transaction.impl;

import com.ubi.dbal.transaction.TransactionManager;
import com.ubi.dbal.transaction.TransactionStatus;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * 支持嵌套的事务管理器
 * 已在事务中再次开启只增加层数（不提交外层数据）；内层提交只减少层数；回滚总是执行并清零
 */
public class NestingTransactionManager implements TransactionManager {
    // 执行事务语句（由驱动提供，失败时驱动负责报告错误）
    private final Predicate<TransactionStatus> statementExecutor;
    private boolean active;
    private int depth;

    public NestingTransactionManager(Predicate<TransactionStatus> statementExecutor) {
        this.statementExecutor = Objects.requireNonNull(statementExecutor, "statementExecutor");
    }

    @Override
    public boolean transaction(TransactionStatus status) {
        switch (status) {
            case BEGIN:
                if (active) {
                    depth++;
                    return true;
                }
                boolean begun = statementExecutor.test(TransactionStatus.BEGIN);
                active = begun;
                return begun;
            case COMMIT:
                if (active && depth > 0) {
                    depth--;
                    return true;
                }
                // 没有打开的事务（可能之前出错已回滚）
                if (!active) {
                    return false;
                }
                boolean committed = statementExecutor.test(TransactionStatus.COMMIT);
                active = false;
                depth = 0;
                return committed;
            case ROLLBACK:
                boolean rolledBack = statementExecutor.test(TransactionStatus.ROLLBACK);
                active = false;
                depth = 0;
                return rolledBack;
            default:
                throw new IllegalArgumentException("未知事务状态: " + status);
        }
    }

    @Override
    public boolean isActive() {
        return active;
    }

    @Override
    public int getDepth() {
        return depth;
    }

    /**
     * 连接关闭后重置状态
     */
    public void reset() {
        active = false;
        depth = 0;
    }
}
