package com.ubi.dbal.driver;

import com.ubi.dbal.core.ConnectivityException;
import com.ubi.dbal.core.ErrorRecord;
import com.ubi.dbal.transaction.TransactionStatus;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * 数据库驱动接口：定义跨后端的统一操作契约
 * 包含连接、查询（可缓存）、分页查询、取行、影响行数、自增ID、释放结果、错误报告、事务与关闭
 * 执行失败不抛异常：返回空结果，错误信息通过{@link #reportError()}按需获取
 * 单连接、单语句模型，不提供内部加锁，多线程请各自持有驱动实例
 */
public interface DatabaseDriver {

    /**
     * 建立连接
     * @param host 服务器地址
     * @param user 用户名
     * @param password 密码
     * @param database 目标数据库
     * @param port 端口（为null时不拼接端口）
     * @param persistent 是否使用持久连接
     * @throws ConnectivityException 客户端能力不可用或连接失败时抛出
     */
    void connect(String host, String user, String password, String database, Integer port, boolean persistent)
            throws ConnectivityException;

    /**
     * 获取服务器版本信息
     * @param raw true返回原始版本串，false返回可读描述
     * @param useCache 是否使用缓存中的版本信息
     */
    String serverInfo(boolean raw, boolean useCache);

    /**
     * 执行查询
     * @param sql SQL语句，为空时直接返回空结果
     * @param cacheTtl 缓存存活秒数，0表示不缓存
     * @return 查询结果；执行失败时为空
     */
    Optional<QueryResult> query(String sql, int cacheTtl);

    /**
     * 分页查询
     * @param sql 单条 SELECT [DISTINCT] 语句
     * @param total 返回行数，0表示全部
     * @param offset 跳过的行数
     * @param cacheTtl 缓存存活秒数，0表示不缓存
     */
    Optional<QueryResult> queryLimit(String sql, int total, int offset, int cacheTtl);

    /**
     * 读取下一行
     * @param result 查询结果，为null时使用最近一次查询结果
     * @return 列名到值的有序映射；无数据或结果无效时返回null
     */
    Map<String, Object> fetchRow(QueryResult result);

    /**
     * 读取剩余的所有行
     */
    List<Map<String, Object>> fetchRowSet(QueryResult result);

    /**
     * 读取下一行的指定列
     * @return 列值；无数据或列不存在时返回null
     */
    Object fetchField(String field, QueryResult result);

    /**
     * 移动游标到指定行（从0开始）
     */
    boolean rowSeek(long rowNum, QueryResult result);

    /**
     * 最近一次语句影响的行数；未连接时为空
     */
    OptionalLong affectedRows();

    /**
     * 最近插入的自增ID；不存在时为空
     */
    Optional<Long> lastInsertedId();

    /**
     * 释放查询结果（幂等）
     * @param result 查询结果，为null时使用最近一次查询结果
     */
    void freeResult(QueryResult result);

    /**
     * 事务状态转换
     * @return 是否成功
     */
    boolean transaction(TransactionStatus status);

    /**
     * 转义字符串字面量
     */
    String escape(String text);

    /**
     * 最近一次后端错误；从未连接成功时返回连接阶段记录的错误
     */
    ErrorRecord reportError();

    /**
     * 关闭连接（尽力清理，总是返回true）
     */
    boolean close();

    ConnectionState getState();
}
