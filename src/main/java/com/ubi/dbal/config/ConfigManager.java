package com.ubi.dbal.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.ubi.dbal.monitor.log.LogUtils;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 配置管理器（支持JSON/YAML，优先读取基础目录，其次读取classpath）
 * @author 邹安族
 */
public class ConfigManager {
    // 配置路径的环境变量/系统属性名
    public static final String CONFIG_PATH_KEY = "DBAL_CONFIG_PATH";
    // 默认配置路径（不含扩展名）
    public static final String DEFAULT_CONFIG_PATH = "config/dbal-config";

    // 单例实例（volatile确保多线程可见性）
    private static volatile ConfigManager INSTANCE;

    // 配置文件格式映射（扩展名 → ObjectMapper），按尝试顺序排列
    private static final Map<String, ObjectMapper> FORMAT_MAPPERS = new LinkedHashMap<>();
    static {
        ObjectMapper jsonMapper = new ObjectMapper();
        jsonMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        // YAML解析器（需要引入jackson-dataformat-yaml依赖）
        ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
        yamlMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        FORMAT_MAPPERS.put("json", jsonMapper);
        FORMAT_MAPPERS.put("yaml", yamlMapper);
        FORMAT_MAPPERS.put("yml", yamlMapper);
    }

    private final ClassLoader classLoader = ConfigManager.class.getClassLoader();
    private final String baseDir; // 基础目录（支持自定义）
    private final DriverConfig driverConfig;

    /**
     * 通过自定义基础目录初始化
     * @param baseDir 配置文件基础目录（为null时使用用户工作目录）
     */
    public ConfigManager(String baseDir) {
        this.baseDir = resolveBaseDir(baseDir);
        try {
            String configPath = getConfigPathFromEnv(CONFIG_PATH_KEY, DEFAULT_CONFIG_PATH);
            this.driverConfig = loadDriverConfig(configPath);
        } catch (Exception e) {
            throw new RuntimeException("配置管理器初始化失败", e);
        }
    }

    /**
     * 获取单例实例（使用默认基础目录）
     */
    public static ConfigManager getInstance() {
        if (INSTANCE == null) {
            synchronized (ConfigManager.class) {
                if (INSTANCE == null) {
                    INSTANCE = new ConfigManager(null);
                }
            }
        }
        return INSTANCE;
    }

    public DriverConfig getDriverConfig() {
        return driverConfig;
    }

    public String getBaseDir() {
        return baseDir;
    }

    private static String resolveBaseDir(String baseDir) {
        if (baseDir == null || baseDir.trim().isEmpty()) {
            return System.getProperty("user.dir");
        }
        File dir = new File(baseDir);
        if (!dir.isAbsolute()) {
            dir = new File(System.getProperty("user.dir"), baseDir);
        }
        try {
            return dir.getCanonicalPath();
        } catch (IOException e) {
            throw new RuntimeException("无效的基础目录：" + baseDir, e);
        }
    }

    /**
     * 加载驱动配置（自动识别JSON/YAML）
     * @param basePath 配置路径；带扩展名时只按该格式加载
     */
    private DriverConfig loadDriverConfig(String basePath) throws IOException {
        String ext = getFileExtension(basePath);
        if (ext != null && FORMAT_MAPPERS.containsKey(ext)) {
            DriverConfig config = loadSingleConfig(basePath, FORMAT_MAPPERS.get(ext));
            validateDriverConfig(config, basePath);
            LogUtils.coreInfo("加载驱动配置成功：{}", basePath);
            return config;
        }
        for (Map.Entry<String, ObjectMapper> format : FORMAT_MAPPERS.entrySet()) {
            String fullPath = basePath + "." + format.getKey();
            try {
                DriverConfig config = loadSingleConfig(fullPath, format.getValue());
                validateDriverConfig(config, fullPath);
                LogUtils.coreInfo("加载驱动配置成功：{}", fullPath);
                return config;
            } catch (FileNotFoundException e) {
                LogUtils.coreDebug("驱动配置文件不存在（尝试格式：{}）：{}", format.getKey(), fullPath);
            }
        }
        throw new FileNotFoundException("未找到驱动配置文件（尝试所有格式）：" + basePath + ".[json|yaml|yml]");
    }

    private DriverConfig loadSingleConfig(String path, ObjectMapper mapper) throws IOException {
        try (InputStream is = getInputStream(path)) {
            if (is == null) {
                throw new FileNotFoundException("配置文件不存在：" + path);
            }
            return mapper.readValue(is, DriverConfig.class);
        }
    }

    /**
     * 先按基础目录（或绝对路径）查找文件，找不到再查classpath
     */
    private InputStream getInputStream(String path) throws IOException {
        String processedPath = path.trim().replace("\\", "/");
        if (processedPath.startsWith("classpath:")) {
            return classLoader.getResourceAsStream(processedPath.substring("classpath:".length()));
        }
        File file = new File(processedPath);
        if (!file.isAbsolute()) {
            file = new File(baseDir, processedPath).getCanonicalFile();
        }
        if (file.exists()) {
            return Files.newInputStream(file.toPath());
        }
        return classLoader.getResourceAsStream(processedPath);
    }

    private void validateDriverConfig(DriverConfig config, String path) {
        if (config == null || config.getConnection() == null) {
            throw new IllegalArgumentException("驱动配置缺少connection节点：" + path);
        }
        if (config.getType() == null || config.getType().trim().isEmpty()) {
            throw new IllegalArgumentException("驱动配置缺少type：" + path);
        }
    }

    private String getFileExtension(String fileName) {
        int slashIndex = fileName.lastIndexOf('/');
        int extIndex = fileName.lastIndexOf('.');
        return extIndex > slashIndex + 1 && extIndex < fileName.length() - 1
                ? fileName.substring(extIndex + 1).toLowerCase()
                : null;
    }

    private String getConfigPathFromEnv(String envKey, String defaultValue) {
        String path = System.getProperty(envKey);
        if (path == null || path.trim().isEmpty()) {
            path = System.getenv(envKey);
        }
        return (path == null || path.trim().isEmpty()) ? defaultValue : path.trim();
    }
}
