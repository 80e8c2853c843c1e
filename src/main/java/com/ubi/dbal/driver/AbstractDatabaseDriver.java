package com.ubi.dbal.driver;

import com.ubi.dbal.cache.QueryCache;
import com.ubi.dbal.client.BackendClient;
import com.ubi.dbal.client.ClientLink;
import com.ubi.dbal.client.ClientPrimitive;
import com.ubi.dbal.client.ClientResult;
import com.ubi.dbal.client.ConnectParams;
import com.ubi.dbal.client.ResultHandle;
import com.ubi.dbal.core.ConnectivityException;
import com.ubi.dbal.core.DriverConfigurationException;
import com.ubi.dbal.core.ErrorRecord;
import com.ubi.dbal.driver.limit.LimitRewriter;
import com.ubi.dbal.driver.limit.LimitedQuery;
import com.ubi.dbal.monitor.QueryProfiler;
import com.ubi.dbal.monitor.ReportMode;
import com.ubi.dbal.monitor.log.LogUtils;
import com.ubi.dbal.transaction.TransactionStatus;
import com.ubi.dbal.transaction.impl.NestingTransactionManager;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * 驱动基类：实现与后端无关的查询结果生命周期
 * 功能：缓存拦截、打开句柄登记、剖析钩子、分页改写后的游标前移、事务嵌套与错误报告
 * 后端子类只提供SQL方言相关的部分（版本查询、事务语句、自增ID查询、分页改写器）
 */
public abstract class AbstractDatabaseDriver implements DatabaseDriver {

    protected final BackendClient client;
    // 查询缓存（可选）
    protected final QueryCache cache;
    // 剖析器（explain模式必需）
    protected final QueryProfiler profiler;
    protected final DebugMode debugMode;

    private final OpenQueryRegistry openQueries = new OpenQueryRegistry();
    private final NestingTransactionManager transactionManager =
            new NestingTransactionManager(this::executeTransactionStatement);

    // 连接状态与身份
    private ConnectionState state = ConnectionState.DISCONNECTED;
    private ClientLink link;
    private boolean everConnected;
    private String connectError = "";
    private String server;
    private String user;
    private String dbName;
    private boolean persistency;
    // 端口分隔符，为null时按目标平台选择
    private String portDelimiter;

    // 最近一次查询
    private QueryResult queryResult;
    // 最近一次直接执行的语句句柄（影响行数来源，缓存命中不更新）
    private ResultHandle lastStatement;
    private String lastQueryText;
    private String serverVersion;

    // 查询计数与累计耗时
    private int cachedQueries;
    private int normalQueries;
    private long queryStartNanos;
    private long sqlTimeNanos;

    // 错误状态
    private boolean errorTriggered;
    private String errorSql;
    private ErrorRecord lastError = ErrorRecord.none();

    protected AbstractDatabaseDriver(BackendClient client, QueryCache cache, QueryProfiler profiler, DebugMode debugMode) {
        this.client = Objects.requireNonNull(client, "client");
        this.cache = cache;
        this.profiler = profiler;
        this.debugMode = debugMode == null ? DebugMode.NONE : debugMode;
        if (this.debugMode == DebugMode.EXPLAIN && profiler == null) {
            throw new DriverConfigurationException("explain调试模式需要提供剖析器");
        }
    }

    // ========================= 后端方言 =========================

    /**
     * 可读版本描述的前缀（如"MSSQL (JDBC)"）
     */
    protected abstract String serverLabel();

    /**
     * 版本信息在缓存中的固定键
     */
    protected abstract String serverVersionCacheKey();

    protected abstract String serverVersionQuery();

    protected abstract String transactionStatement(TransactionStatus status);

    protected abstract String lastInsertedIdQuery();

    protected abstract LimitRewriter limitRewriter();

    // ========================= 连接 =========================

    @Override
    public void connect(String host, String user, String password, String database, Integer port, boolean persistent)
            throws ConnectivityException {
        if (state == ConnectionState.CONNECTED) {
            throw new IllegalStateException("驱动已连接到 " + server + "，每个驱动实例只允许一个连接");
        }
        this.persistency = persistent;
        this.user = user;
        this.dbName = database;
        this.server = host + ((port != null && port > 0) ? getPortDelimiter() + port : "");

        // 使用前先确认客户端具备全部原语
        ClientPrimitive connectPrimitive = persistent ? ClientPrimitive.PERSISTENT_CONNECT : ClientPrimitive.CONNECT;
        for (ClientPrimitive primitive : requiredPrimitives(connectPrimitive)) {
            if (!client.isAvailable(primitive)) {
                connectError = primitive.getPrimitiveName() + " 功能不存在（客户端: " + client.getName() + "），请确认驱动依赖已安装";
                throw new ConnectivityException(sqlError("", ErrorRecord.of(connectError, "")));
            }
        }

        ConnectParams params = new ConnectParams();
        params.setServer(server);
        params.setHost(host);
        params.setPort(port != null && port > 0 ? port : null);
        params.setUser(user);
        params.setPassword(password);
        params.setDatabase(database);
        params.setPersistent(persistent);

        ClientResult<ClientLink> connected = client.connect(params);
        if (connected.isFailure()) {
            connectError = connected.getError().getMessage();
            throw new ConnectivityException(sqlError("", connected.getError()));
        }
        link = connected.getValue();
        everConnected = true;
        state = ConnectionState.CONNECTED;
        LogUtils.driverInfo("数据库连接成功 | 服务器: {} | 数据库: {} | 持久连接: {}", server, database, persistent);
    }

    private static List<ClientPrimitive> requiredPrimitives(ClientPrimitive connectPrimitive) {
        return List.of(connectPrimitive, ClientPrimitive.EXECUTE, ClientPrimitive.FETCH,
                ClientPrimitive.FREE, ClientPrimitive.CLOSE);
    }

    /**
     * 使用指定的端口分隔符（为null时按目标平台自动选择）
     */
    public void setPortDelimiter(String portDelimiter) {
        this.portDelimiter = portDelimiter;
    }

    public String getPortDelimiter() {
        if (portDelimiter != null && !portDelimiter.isEmpty()) {
            return portDelimiter;
        }
        return defaultPortDelimiter(System.getProperty("os.name", ""));
    }

    /**
     * Windows平台使用逗号，其余平台使用冒号
     */
    static String defaultPortDelimiter(String osName) {
        return osName.regionMatches(true, 0, "WIN", 0, 3) ? "," : ":";
    }

    @Override
    public String serverInfo(boolean raw, boolean useCache) {
        Object cached = (useCache && cache != null) ? cache.get(serverVersionCacheKey()) : null;
        if (cached != null) {
            serverVersion = cached.toString();
        } else {
            Map<String, Object> row = null;
            ClientResult<ResultHandle> exec = executeOnLink(serverVersionQuery());
            if (exec.isSuccess()) {
                ResultHandle handle = exec.getValue();
                try {
                    row = client.fetchRow(handle);
                } finally {
                    releaseTemporary(handle);
                }
            }
            serverVersion = row != null ? joinVersionFields(row) : "";
            if (useCache && cache != null) {
                cache.put(serverVersionCacheKey(), serverVersion);
            }
        }
        if (raw) {
            return serverVersion.isEmpty() ? "0" : serverVersion;
        }
        return serverVersion.isEmpty() ? serverLabel() : serverLabel() + " " + serverVersion;
    }

    private static String joinVersionFields(Map<String, Object> row) {
        return row.values().stream()
                .filter(Objects::nonNull)
                .map(value -> value.toString().trim())
                .filter(value -> !value.isEmpty())
                .collect(Collectors.joining(" "));
    }

    // ========================= 查询 =========================

    public Optional<QueryResult> query(String sql) {
        return query(sql, 0);
    }

    @Override
    public Optional<QueryResult> query(String sql, int cacheTtl) {
        if (sql == null || sql.isEmpty()) {
            return Optional.empty();
        }
        if (debugMode == DebugMode.EXPLAIN) {
            profiler.report(ReportMode.START, sql);
        } else if (debugMode == DebugMode.LOAD_TIME) {
            queryStartNanos = System.nanoTime();
        }

        lastQueryText = sql;
        boolean useCache = cache != null && cacheTtl > 0;
        QueryResult result = useCache ? cache.sqlLoad(sql) : null;
        addNumQueries(result != null);

        if (result == null) {
            ClientResult<ResultHandle> exec = executeOnLink(sql);
            if (exec.isFailure()) {
                sqlError(sql, exec.getError());
            }

            if (debugMode == DebugMode.EXPLAIN) {
                profiler.report(ReportMode.STOP, sql);
            } else if (debugMode == DebugMode.LOAD_TIME) {
                sqlTimeNanos += System.nanoTime() - queryStartNanos;
            }

            if (exec.isFailure()) {
                queryResult = null;
                lastStatement = null;
                return Optional.empty();
            }

            lastStatement = exec.getValue();
            result = QueryResult.live(lastStatement, sql);
            if (useCache) {
                // 先登记，缓存读完行后通过freeResult注销并释放
                openQueries.register(result);
                result = cache.sqlSave(this, sql, result, cacheTtl);
            } else if (isRowProducing(sql)) {
                openQueries.register(result);
            }
        } else if (debugMode == DebugMode.EXPLAIN) {
            reportFromCache(sql);
        }

        queryResult = result;
        return Optional.of(result);
    }

    public Optional<QueryResult> queryLimit(String sql, int total) {
        return queryLimit(sql, total, 0, 0);
    }

    @Override
    public Optional<QueryResult> queryLimit(String sql, int total, int offset, int cacheTtl) {
        if (sql == null || sql.isEmpty()) {
            return Optional.empty();
        }
        LimitedQuery limited = limitRewriter().rewrite(sql, total, offset);
        queryResult = null;

        Optional<QueryResult> result = query(limited.getSql(), cacheTtl);
        if (limited.getSeekOffset() > 0 && result.isPresent()) {
            rowSeek(limited.getSeekOffset(), result.get());
        }
        return result;
    }

    /**
     * 语句是否产生结果集（按前缀判断）
     */
    protected boolean isRowProducing(String sql) {
        String trimmed = sql.trim();
        return trimmed.regionMatches(true, 0, "SELECT", 0, 6);
    }

    /**
     * explain模式下缓存命中：重新直接执行一次，记录与缓存的耗时对比
     */
    protected void reportFromCache(String sql) {
        profiler.report(ReportMode.FROM_CACHE, sql);
        long start = System.nanoTime();
        ClientResult<ResultHandle> exec = executeOnLink(sql);
        if (exec.isSuccess()) {
            ResultHandle handle = exec.getValue();
            try {
                // 取完所有行，计入行解析耗时
                while (client.fetchRow(handle) != null) {
                    continue;
                }
            } finally {
                releaseTemporary(handle);
            }
        }
        profiler.report(ReportMode.RECORD_FROM_CACHE, sql, start, System.nanoTime());
    }

    // ========================= 结果读取 =========================

    public Map<String, Object> fetchRow() {
        return fetchRow(null);
    }

    @Override
    public Map<String, Object> fetchRow(QueryResult result) {
        QueryResult target = result != null ? result : queryResult;
        if (target == null) {
            return null;
        }
        if (cache != null && cache.sqlExists(target.getId())) {
            Map<String, Object> row = cache.sqlFetchRow(target.getId());
            if (row != null) {
                target.advance();
            }
            return row;
        }
        if (target.isCached() || target.getHandle().isReleased()) {
            return null;
        }
        Map<String, Object> row = client.fetchRow(target.getHandle());
        if (row != null) {
            target.advance();
        }
        return row;
    }

    @Override
    public List<Map<String, Object>> fetchRowSet(QueryResult result) {
        QueryResult target = result != null ? result : queryResult;
        List<Map<String, Object>> rows = new ArrayList<>();
        Map<String, Object> row;
        while ((row = fetchRow(target)) != null) {
            rows.add(row);
        }
        return rows;
    }

    @Override
    public Object fetchField(String field, QueryResult result) {
        Map<String, Object> row = fetchRow(result);
        return row != null ? row.get(field) : null;
    }

    /**
     * 先移动到指定行再读取字段
     */
    public Object fetchField(String field, long rowNum, QueryResult result) {
        QueryResult target = result != null ? result : queryResult;
        if (!rowSeek(rowNum, target)) {
            return null;
        }
        return fetchField(field, target);
    }

    @Override
    public boolean rowSeek(long rowNum, QueryResult result) {
        QueryResult target = result != null ? result : queryResult;
        if (target == null || rowNum < 0) {
            return false;
        }
        if (cache != null && cache.sqlExists(target.getId())) {
            if (!cache.sqlRowSeek(rowNum, target.getId())) {
                return false;
            }
            target.moveTo(rowNum);
            return true;
        }
        if (target.isCached() || target.getHandle().isReleased()) {
            return false;
        }
        // 只进游标：目标行在当前位置之前时，释放并重新执行
        if (rowNum < target.getPosition() && !reopen(target)) {
            return false;
        }
        while (target.getPosition() < rowNum) {
            if (fetchRow(target) == null) {
                return false;
            }
        }
        return true;
    }

    private boolean reopen(QueryResult target) {
        boolean registered = openQueries.contains(target.getId());
        if (registered) {
            openQueries.remove(target.getId());
        }
        client.free(target.getHandle());

        ClientResult<ResultHandle> exec = executeOnLink(target.getQuery());
        if (exec.isFailure()) {
            sqlError(target.getQuery(), exec.getError());
            return false;
        }
        target.rebind(exec.getValue());
        if (registered) {
            openQueries.register(target);
        }
        return true;
    }

    /**
     * 已连接时总有值：最近一次语句失败或尚未执行语句时为0
     */
    @Override
    public OptionalLong affectedRows() {
        if (link == null) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(lastStatement != null ? client.numRows(lastStatement) : 0);
    }

    @Override
    public Optional<Long> lastInsertedId() {
        ClientResult<ResultHandle> exec = executeOnLink(lastInsertedIdQuery());
        if (exec.isFailure()) {
            return Optional.empty();
        }
        ResultHandle handle = exec.getValue();
        try {
            Map<String, Object> row = client.fetchRow(handle);
            if (row == null || row.isEmpty()) {
                return Optional.empty();
            }
            Object id = row.values().iterator().next();
            if (id == null) {
                return Optional.empty();
            }
            return Optional.of(id instanceof Number ? ((Number) id).longValue() : Long.parseLong(id.toString().trim()));
        } finally {
            releaseTemporary(handle);
        }
    }

    public void freeResult() {
        freeResult(null);
    }

    @Override
    public void freeResult(QueryResult result) {
        QueryResult target = result != null ? result : queryResult;
        if (target == null) {
            return;
        }
        String id = target.getId();
        if (cache != null && cache.sqlExists(id)) {
            cache.sqlFreeResult(id);
        } else if (openQueries.contains(id)) {
            openQueries.remove(id);
            client.free(target.getHandle());
        }
    }

    // ========================= 事务 =========================

    @Override
    public boolean transaction(TransactionStatus status) {
        return transactionManager.transaction(status);
    }

    /**
     * 按名称执行事务转换
     * @throws DriverConfigurationException 无法识别的状态名
     */
    public boolean transaction(String status) {
        return transaction(TransactionStatus.of(status));
    }

    public boolean isInTransaction() {
        return transactionManager.isActive();
    }

    public int getTransactionDepth() {
        return transactionManager.getDepth();
    }

    private boolean executeTransactionStatement(TransactionStatus status) {
        String sql = transactionStatement(status);
        ClientResult<ResultHandle> exec = executeOnLink(sql);
        if (exec.isFailure()) {
            sqlError(sql, exec.getError());
            return false;
        }
        releaseTemporary(exec.getValue());
        return true;
    }

    // ========================= 错误与关闭 =========================

    @Override
    public ErrorRecord reportError() {
        if (!everConnected || !client.isAvailable(ClientPrimitive.ERROR)) {
            return ErrorRecord.of(connectError, "");
        }
        return client.lastError();
    }

    /**
     * 统一的错误报告入口：记录错误状态并输出日志，每次失败只调用一次
     */
    protected ErrorRecord sqlError(String sql, ErrorRecord reported) {
        errorTriggered = true;
        errorSql = sql;
        lastError = reported != null && !reported.isEmpty() ? reported : reportError();
        LogUtils.driverWarn("SQL错误 | 代码: {} | 信息: {} | SQL: {}", lastError.getCode(), lastError.getMessage(), sql);
        return lastError;
    }

    @Override
    public boolean close() {
        if (link != null) {
            if (transactionManager.isActive()) {
                transactionManager.transaction(TransactionStatus.ROLLBACK);
            }
            for (QueryResult open : openQueries.drain()) {
                client.free(open.getHandle());
            }
            client.close(link);
            LogUtils.driverInfo("数据库连接已关闭 | 服务器: {}", server);
        }
        transactionManager.reset();
        link = null;
        queryResult = null;
        lastStatement = null;
        state = ConnectionState.CLOSED;
        return true;
    }

    private ClientResult<ResultHandle> executeOnLink(String sql) {
        if (link == null) {
            return ClientResult.failure(ErrorRecord.of("数据库未连接", ""));
        }
        return client.execute(link, sql);
    }

    /**
     * 释放驱动内部使用的临时句柄（无结果集的句柄已由客户端释放）
     */
    private void releaseTemporary(ResultHandle handle) {
        if (!handle.isReleased()) {
            client.free(handle);
        }
    }

    private void addNumQueries(boolean cached) {
        if (cached) {
            cachedQueries++;
        } else {
            normalQueries++;
        }
    }

    // ========================= 状态查询 =========================

    @Override
    public ConnectionState getState() {
        return state;
    }

    public boolean isConnected() {
        return state == ConnectionState.CONNECTED;
    }

    public String getServer() {
        return server;
    }

    public String getUser() {
        return user;
    }

    public String getDbName() {
        return dbName;
    }

    public boolean isPersistent() {
        return persistency;
    }

    public QueryResult getLastResult() {
        return queryResult;
    }

    public String getLastQueryText() {
        return lastQueryText;
    }

    /**
     * @param cached true返回缓存命中数，false返回总查询数
     */
    public int getNumQueries(boolean cached) {
        return cached ? cachedQueries : cachedQueries + normalQueries;
    }

    /**
     * load_time模式下累计的查询耗时（毫秒）
     */
    public long getSqlTimeMillis() {
        return TimeUnit.NANOSECONDS.toMillis(sqlTimeNanos);
    }

    public long getSqlTimeNanos() {
        return sqlTimeNanos;
    }

    public int getOpenQueryCount() {
        return openQueries.size();
    }

    public boolean isOpen(QueryResult result) {
        return result != null && openQueries.contains(result.getId());
    }

    public boolean isErrorTriggered() {
        return errorTriggered;
    }

    public String getErrorSql() {
        return errorSql;
    }

    public ErrorRecord getLastError() {
        return lastError;
    }
}
