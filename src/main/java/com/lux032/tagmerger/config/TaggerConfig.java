package com.lux032.tagmerger.config;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 标签写入配置类
 */
@Slf4j
@Data
public class TaggerConfig {

    public static final String CONFIG_FILE_NAME = "tagger.properties";

    // 封面配置
    private String coverDescription; // APIC / PICTURE 块的描述文本
    private boolean preferCoverUrl; // 同时有图片数据和 URL 时优先写 URL

    // 日志配置
    private String jaudiotaggerLogLevel; // jaudiotagger 使用 java.util.logging

    private static TaggerConfig instance;

    // JUL 只保留弱引用，需持有 logger 才能让级别生效
    private static final Logger JAUDIOTAGGER_LOGGER = Logger.getLogger("org.jaudiotagger");

    public TaggerConfig() {
        // 默认配置
        this.coverDescription = "Front cover";
        this.preferCoverUrl = false;
        this.jaudiotaggerLogLevel = "WARNING";
    }

    /**
     * 获取配置单例
     */
    public static synchronized TaggerConfig getInstance() {
        if (instance == null) {
            instance = new TaggerConfig();
            instance.loadDefaultFile();
            instance.applyLogLevels();
        }
        return instance;
    }

    /**
     * 从指定文件加载配置
     */
    public static TaggerConfig load(Path configFile) throws IOException {
        TaggerConfig config = new TaggerConfig();
        try (InputStream in = new FileInputStream(configFile.toFile())) {
            config.loadFrom(in);
        }
        return config;
    }

    /**
     * 先查找工作目录下的配置文件，找不到再查 classpath
     */
    private void loadDefaultFile() {
        Path local = Paths.get(CONFIG_FILE_NAME);
        if (Files.isRegularFile(local)) {
            try (InputStream in = new FileInputStream(local.toFile())) {
                loadFrom(in);
                log.info("Loaded configuration from {}", local.toAbsolutePath());
                return;
            } catch (IOException e) {
                log.warn("Failed to read {}, falling back to classpath: {}", local.toAbsolutePath(), e.getMessage());
            }
        }

        try (InputStream in = TaggerConfig.class.getResourceAsStream("/" + CONFIG_FILE_NAME)) {
            if (in == null) {
                log.info("No {} found, using defaults", CONFIG_FILE_NAME);
                return;
            }
            loadFrom(in);
            log.info("Loaded configuration from classpath:{}", CONFIG_FILE_NAME);
        } catch (IOException e) {
            log.warn("Failed to read classpath:{}, using defaults: {}", CONFIG_FILE_NAME, e.getMessage());
        }
    }

    void loadFrom(InputStream in) throws IOException {
        Properties props = new Properties();
        props.load(new InputStreamReader(in, StandardCharsets.UTF_8));

        if (props.containsKey("tag.cover.description")) {
            this.coverDescription = props.getProperty("tag.cover.description");
        }
        if (props.containsKey("tag.cover.preferUrl")) {
            this.preferCoverUrl = Boolean.parseBoolean(props.getProperty("tag.cover.preferUrl").trim());
        }
        if (props.containsKey("logging.jaudiotagger.level")) {
            this.jaudiotaggerLogLevel = props.getProperty("logging.jaudiotagger.level").trim();
        }
    }

    /**
     * jaudiotagger 默认在 INFO 级别输出大量日志，这里按配置压低
     */
    public void applyLogLevels() {
        Level level;
        try {
            level = Level.parse(jaudiotaggerLogLevel);
        } catch (IllegalArgumentException e) {
            log.warn("Invalid logging.jaudiotagger.level: {}, using WARNING", jaudiotaggerLogLevel);
            level = Level.WARNING;
        }
        JAUDIOTAGGER_LOGGER.setLevel(level);
    }
}
