package com.ubi.dbal.transaction;

/**
 * 事务管理器接口：定义事务的核心操作规范
 */
public interface TransactionManager {

    /**
     * 执行一次事务状态转换
     * @param status 目标状态
     * @return 是否成功
     */
    boolean transaction(TransactionStatus status);

    /**
     * 判断当前是否处于事务中
     */
    boolean isActive();

    /**
     * 当前嵌套层数（最外层事务为0）
     */
    int getDepth();
}
