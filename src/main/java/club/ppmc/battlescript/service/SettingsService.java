/**
 * SettingsService.java
 *
 * 该服务是后端的配置中心，负责管理运行环境的所有可配置项。
 * 它处理配置的加载、更新和持久化，将配置信息以JSON格式存储在设置目录下的 settings.json 中。
 * 在首次启动时，它会使用 application.properties 中的值和 classpath 下的 toolchains.json 作为默认设置。
 * 所有其他需要配置的服务都应依赖此服务，而不是直接使用 @Value 注解。
 */
package club.ppmc.battlescript.service;

import club.ppmc.battlescript.exception.EnvironmentConfigurationException;
import club.ppmc.battlescript.model.Settings;
import club.ppmc.battlescript.model.TargetId;
import club.ppmc.battlescript.model.ToolchainCommand;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class SettingsService {

    private static final Logger LOGGER = LoggerFactory.getLogger(SettingsService.class);
    private static final String SETTINGS_FILE_NAME = "settings.json";
    private static final String TOOLCHAINS_RESOURCE = "toolchains.json";

    private final Path settingsFilePath;
    private final ObjectMapper objectMapper;
    private volatile Settings currentSettings;

    // --- 用于首次初始化的默认值 ---
    private final String initialScratchDirectory;
    private final long initialInputPollMillis;
    private final long initialCancelGraceMillis;
    private final List<String> initialSearchPaths;

    public SettingsService(
            @Value("${app.settings-dir:./.battlescript}") String settingsDirectory,
            @Value("${app.scratch-dir:${java.io.tmpdir}}") String initialScratchDirectory,
            @Value("${app.run.input-poll-millis:300}") long initialInputPollMillis,
            @Value("${app.run.cancel-grace-millis:2000}") long initialCancelGraceMillis,
            @Value("${app.toolchain.search-paths:}") String[] initialSearchPaths) {

        this.initialScratchDirectory = initialScratchDirectory;
        this.initialInputPollMillis = initialInputPollMillis;
        this.initialCancelGraceMillis = initialCancelGraceMillis;
        this.initialSearchPaths = initialSearchPaths == null
                ? List.of()
                : Arrays.stream(initialSearchPaths).filter(StringUtils::hasText).map(String::trim).toList();

        this.settingsFilePath = Paths.get(settingsDirectory, SETTINGS_FILE_NAME).toAbsolutePath().normalize();
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @PostConstruct
    public void init() {
        try {
            Path settingsDir = this.settingsFilePath.getParent();
            if (Files.notExists(settingsDir)) {
                Files.createDirectories(settingsDir);
            }
            if (Files.exists(this.settingsFilePath)) {
                loadSettings();
                if (mergeDefaultToolchains(this.currentSettings)) {
                    saveSettings();
                }
            } else {
                createAndSaveDefaultSettings();
            }
        } catch (IOException e) {
            LOGGER.error("初始化设置失败。将使用临时的默认设置。", e);
            this.currentSettings = createDefaultSettings();
        }

        List<String> unknown = unknownTargets(this.currentSettings);
        if (!unknown.isEmpty()) {
            throw new EnvironmentConfigurationException(
                    "工具链配置中包含未知的目标语言: " + String.join(", ", unknown), "toolchain", unknown.get(0));
        }
    }

    public synchronized Settings getSettings() {
        return this.currentSettings;
    }

    /**
     * 更新并保存设置。
     *
     * @throws IllegalArgumentException 如果工具链配置中包含未知的目标语言。
     */
    public synchronized void updateSettings(Settings newSettings) throws IOException {
        List<String> unknown = unknownTargets(newSettings);
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException("未知的目标语言: " + String.join(", ", unknown));
        }
        this.currentSettings = newSettings;
        saveSettings();
    }

    /**
     * @return 目标语言的工具链命令，没有配置时为空。
     */
    public Optional<ToolchainCommand> toolchain(TargetId target) {
        return Optional.ofNullable(getSettings().getToolchains().get(target.id()));
    }

    public Path scratchDirectory() {
        return Paths.get(getSettings().getScratchDirectory()).toAbsolutePath().normalize();
    }

    private void loadSettings() throws IOException {
        try {
            byte[] jsonData = Files.readAllBytes(settingsFilePath);
            this.currentSettings = objectMapper.readValue(jsonData, Settings.class);
            LOGGER.info("已成功从 {} 加载设置。", settingsFilePath);
        } catch (IOException e) {
            LOGGER.error("读取设置文件时出错。下次保存时将创建新的默认文件。", e);
            this.currentSettings = createDefaultSettings();
            throw e;
        }
    }

    private void saveSettings() throws IOException {
        if (Files.notExists(settingsFilePath.getParent())) {
            Files.createDirectories(settingsFilePath.getParent());
        }
        try {
            byte[] jsonData = objectMapper.writeValueAsBytes(currentSettings);
            Files.write(settingsFilePath, jsonData);
            LOGGER.info("已成功将设置保存到 {}", settingsFilePath);
        } catch (IOException e) {
            LOGGER.error("将设置保存到文件 {} 时失败", settingsFilePath, e);
            throw e;
        }
    }

    private void createAndSaveDefaultSettings() throws IOException {
        this.currentSettings = createDefaultSettings();
        saveSettings();
        LOGGER.info("未找到设置文件。已在 {} 创建了包含默认值的新文件。", settingsFilePath);
    }

    private Settings createDefaultSettings() {
        var settings = new Settings();
        if (StringUtils.hasText(this.initialScratchDirectory)) {
            settings.setScratchDirectory(this.initialScratchDirectory);
        }
        settings.setInputPollMillis(this.initialInputPollMillis);
        settings.setCancelGraceMillis(this.initialCancelGraceMillis);
        settings.setToolchainSearchPaths(new ArrayList<>(this.initialSearchPaths));
        mergeDefaultToolchains(settings);
        return settings;
    }

    /**
     * 把 toolchains.json 中有、而设置里没有的目标语言补进设置。已存在的条目保留用户的修改。
     *
     * @return 如果设置被修改。
     */
    private boolean mergeDefaultToolchains(Settings settings) {
        if (settings.getToolchains() == null) {
            settings.setToolchains(new LinkedHashMap<>());
        }
        boolean changed = false;
        for (var entry : loadDefaultToolchains().entrySet()) {
            if (!settings.getToolchains().containsKey(entry.getKey())) {
                settings.getToolchains().put(entry.getKey(), entry.getValue());
                changed = true;
            }
        }
        return changed;
    }

    private Map<String, ToolchainCommand> loadDefaultToolchains() {
        var resource = new ClassPathResource(TOOLCHAINS_RESOURCE);
        if (!resource.exists()) {
            LOGGER.warn("classpath 中未找到 {}，不会提供默认的工具链命令。", TOOLCHAINS_RESOURCE);
            return Map.of();
        }
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readValue(in, new TypeReference<LinkedHashMap<String, ToolchainCommand>>() {});
        } catch (IOException e) {
            throw new EnvironmentConfigurationException(
                    "无法解析默认工具链配置 " + TOOLCHAINS_RESOURCE + ": " + e.getMessage(), "toolchain", null);
        }
    }

    private static List<String> unknownTargets(Settings settings) {
        if (settings.getToolchains() == null) {
            return List.of();
        }
        return settings.getToolchains().keySet().stream()
                .filter(key -> TargetId.find(key).isEmpty())
                .toList();
    }
}
