/**
 * SystemCommandExecutor.java
 *
 * 这是一个工具类，负责以跨平台、安全的方式启动外部系统命令。
 * 它接受一个命令列表（而不是单个字符串）以避免因路径中存在空格而导致的解析问题，
 * 并在启动前把配置的工具链目录加到 PATH 的最前面。
 * 标准输出和标准错误分别由独立的读取任务排空，避免管道写满导致的死锁。
 */
package club.ppmc.battlescript.util;

import club.ppmc.battlescript.model.PipeBuffer;
import club.ppmc.battlescript.service.SettingsService;
import jakarta.annotation.PreDestroy;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class SystemCommandExecutor {

    private static final Logger LOGGER = LoggerFactory.getLogger(SystemCommandExecutor.class);

    private final SettingsService settingsService;
    private final ExecutorService readerPool = Executors.newCachedThreadPool();

    public SystemCommandExecutor(SettingsService settingsService) {
        this.settingsService = settingsService;
    }

    /**
     * 启动一个系统命令。标准输出与标准错误不合并。
     *
     * @param commandList 要执行的命令及其参数列表 (e.g., ["clang", "-o", "out", "main.c"])。
     * @param workingDirectory 命令执行的工作目录。
     * @return 已启动的进程。
     * @throws IOException 如果命令无法启动 (例如可执行文件不存在)。
     */
    public Process launch(List<String> commandList, Path workingDirectory) throws IOException {
        if (commandList == null || commandList.isEmpty()) {
            throw new IOException("执行的命令不能为空。");
        }
        LOGGER.info("在目录 {} 中执行命令: {}", workingDirectory, String.join(" ", commandList));

        var processBuilder = new ProcessBuilder(commandList).directory(workingDirectory.toFile());
        augmentPath(processBuilder.environment());
        return processBuilder.start();
    }

    /**
     * 在独立线程中把一个输出流完整读入缓冲区。
     *
     * @return 一个在流读到末尾后完成的 CompletableFuture。
     */
    public CompletableFuture<Void> drain(InputStream stream, PipeBuffer target) {
        return CompletableFuture.runAsync(
                () -> {
                    try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
                        char[] buffer = new char[4096];
                        int charsRead;
                        while ((charsRead = reader.read(buffer)) != -1) {
                            target.append(buffer, 0, charsRead);
                        }
                    } catch (IOException e) {
                        // 进程被强行结束时流会被关闭，这是正常现象
                        LOGGER.debug("读取进程输出流时出错 (如果进程被终止，此为正常现象): {}", e.getMessage());
                    }
                },
                readerPool);
    }

    private void augmentPath(Map<String, String> environment) {
        List<String> searchPaths = settingsService.getSettings().getToolchainSearchPaths();
        if (searchPaths == null || searchPaths.isEmpty()) {
            return;
        }
        String pathKey = environment.keySet().stream()
                .filter(key -> key.equalsIgnoreCase("PATH"))
                .findFirst()
                .orElse("PATH");
        String existing = environment.getOrDefault(pathKey, "");
        String prefix = String.join(File.pathSeparator, searchPaths);
        environment.put(pathKey, existing.isEmpty() ? prefix : prefix + File.pathSeparator + existing);
    }

    @PreDestroy
    public void shutdown() {
        readerPool.shutdownNow();
    }
}
