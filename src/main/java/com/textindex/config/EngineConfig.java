package com.textindex.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.textindex.postings.WeightEncoding;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 引擎运行时配置
 *
 * 支持从CLI参数或JSON配置文件注入，覆盖Constants默认值
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class EngineConfig {
    private WeightEncoding weightEncoding = WeightEncoding.INTEGER;
    private int inspectLimit = Constants.DEFAULT_INSPECT_LIMIT;

    public WeightEncoding getWeightEncoding() {
        return weightEncoding;
    }

    public void setWeightEncoding(WeightEncoding weightEncoding) {
        this.weightEncoding = weightEncoding;
    }

    public int getInspectLimit() {
        return inspectLimit;
    }

    public void setInspectLimit(int inspectLimit) {
        this.inspectLimit = inspectLimit;
    }

    /**
     * 使用默认配置创建实例
     */
    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    /**
     * 从JSON文件加载配置，未出现的字段保持默认值。
     *
     * @param configFile 配置文件路径
     * @return 配置实例
     * @throws IOException 文件不可读或格式错误时抛出
     */
    public static EngineConfig load(Path configFile) throws IOException {
        if (configFile == null) {
            throw new IllegalArgumentException("配置文件路径不能为null");
        }
        if (!Files.isRegularFile(configFile)) {
            throw new IOException("配置文件不存在: " + configFile);
        }
        EngineConfig config = new ObjectMapper().readValue(configFile.toFile(), EngineConfig.class);
        if (config.getWeightEncoding() == null) {
            throw new IOException("配置文件缺少 weightEncoding: " + configFile);
        }
        if (config.getInspectLimit() < 0) {
            throw new IOException("inspectLimit 不能为负数: " + config.getInspectLimit());
        }
        return config;
    }
}
