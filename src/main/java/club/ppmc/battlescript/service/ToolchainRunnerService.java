/**
 * ToolchainRunnerService.java
 *
 * 该服务负责把一段目标语言源码编译并运行起来。
 * 它把源码写入临时目录下固定的文件，按工具链命令模板依次执行编译 (汇编、SDK 探测、链接) 和运行步骤，
 * 任一步骤失败都会立即结束并报告失败的步骤，不会继续执行后面的步骤。
 * 所有子进程都通过 ProcessSessionManager 启动，因此同一时刻只会有一个运行中的程序。
 */
package club.ppmc.battlescript.service;

import club.ppmc.battlescript.model.CommandResult;
import club.ppmc.battlescript.model.ExecutionMode;
import club.ppmc.battlescript.model.ExecutionRequest;
import club.ppmc.battlescript.model.RunOutcome;
import club.ppmc.battlescript.model.TargetId;
import club.ppmc.battlescript.model.ToolchainCommand;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class ToolchainRunnerService {

    private static final String SCRATCH_PREFIX = "battlescript_";

    private final ProcessSessionManager sessionManager;
    private final SettingsService settingsService;
    private final InteractiveBridge interactiveBridge;
    private final ExecutorService taskExecutor = Executors.newCachedThreadPool();

    public ToolchainRunnerService(
            ProcessSessionManager sessionManager,
            SettingsService settingsService,
            InteractiveBridge interactiveBridge) {
        this.sessionManager = sessionManager;
        this.settingsService = settingsService;
        this.interactiveBridge = interactiveBridge;
    }

    /**
     * 在后台线程中执行一次运行。
     */
    public CompletableFuture<RunOutcome> submit(ExecutionRequest request) {
        return CompletableFuture.supplyAsync(() -> run(request), taskExecutor);
    }

    /**
     * 同步执行一次运行：写入源码、编译 (如需要)、运行。
     *
     * @param request 运行请求。
     * @return 运行结果，运行期间的错误都以结果的形式返回。
     */
    public RunOutcome run(ExecutionRequest request) {
        TargetId target = request.target();
        long ticket = sessionManager.beginRun();
        log.info("开始运行目标语言 {} 的程序 (运行代号 {})。", target.id(), ticket);

        Optional<ToolchainCommand> configured = settingsService.toolchain(target);
        if (configured.isEmpty() || (!configured.get().isCompiled() && configured.get().run().isEmpty())) {
            return RunOutcome.runError("No compiler or runner for target: " + target.id());
        }
        ToolchainCommand toolchain = configured.get();

        Path scratch = settingsService.scratchDirectory();
        Path source = scratch.resolve(SCRATCH_PREFIX + target.id() + target.extension());
        Path output = scratch.resolve(SCRATCH_PREFIX + target.id() + "_out");
        try {
            Files.createDirectories(scratch);
            Files.writeString(source, request.source(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("写入源文件 {} 失败", source, e);
            return RunOutcome.writeError(e.getMessage());
        }

        Map<String, String> placeholders = new HashMap<>();
        placeholders.put("{src}", source.toString());
        placeholders.put("{out}", output.toString());
        placeholders.put("{obj}", output + ".o");

        try {
            if (toolchain.isCompiled()) {
                boolean assembled = toolchain.needsLink();
                CommandResult compiled = runStep(toolchain.compile(), placeholders, scratch, ticket);
                Optional<RunOutcome> failure = checkStep(
                        compiled, assembled ? "Assembly error" : "Compile error", assembled ? "assemble" : "compile");
                if (failure.isPresent()) {
                    return failure.get();
                }
            }
            if (!toolchain.sdkProbe().isEmpty()) {
                CommandResult probe = runStep(toolchain.sdkProbe(), placeholders, scratch, ticket);
                Optional<RunOutcome> failure = checkStep(probe, "SDK error", "sdk");
                if (failure.isPresent()) {
                    return failure.get();
                }
                placeholders.put("{sdk}", probe.stdout().trim());
            }
            if (toolchain.needsLink()) {
                CommandResult linked = runStep(toolchain.link(), placeholders, scratch, ticket);
                Optional<RunOutcome> failure = checkStep(linked, "Link error", "link");
                if (failure.isPresent()) {
                    return failure.get();
                }
            }

            List<String> runCommand = toolchain.run().isEmpty()
                    ? List.of(output.toString())
                    : substitute(toolchain.run(), placeholders);
            SessionHandle handle = sessionManager.start(runCommand, scratch, request.mode(), ticket);
            if (request.isInteractive()) {
                return interactiveBridge.relay(handle, request);
            }
            return RunOutcome.fromExecution(handle.result().get());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            sessionManager.cancel();
            return RunOutcome.stopped();
        } catch (ExecutionException e) {
            log.error("等待进程结果时出错", e);
            return RunOutcome.runError(String.valueOf(e.getCause()));
        }
    }

    /** 取消当前运行。 */
    public boolean cancel() {
        return sessionManager.cancel();
    }

    private CommandResult runStep(List<String> template, Map<String, String> placeholders, Path workDir, long ticket)
            throws InterruptedException, ExecutionException {
        SessionHandle handle = sessionManager.start(substitute(template, placeholders), workDir, ExecutionMode.BATCH, ticket);
        return handle.result().get();
    }

    /**
     * 检查一个构建步骤的结果。
     *
     * @return 步骤失败时的运行结果；成功时为空。
     */
    private static Optional<RunOutcome> checkStep(CommandResult result, String heading, String step) {
        if (result.signaled()) {
            return Optional.of(RunOutcome.stopped());
        }
        if (!result.launched()) {
            return Optional.of(RunOutcome.runError(result.launchError()));
        }
        if (result.exitCode() != 0) {
            log.info("步骤 {} 失败，退出码: {}", step, result.exitCode());
            return Optional.of(RunOutcome.compileError(heading, step, result.diagnostics()));
        }
        return Optional.empty();
    }

    static List<String> substitute(List<String> template, Map<String, String> placeholders) {
        return template.stream()
                .map(arg -> {
                    String value = arg;
                    for (var entry : placeholders.entrySet()) {
                        value = value.replace(entry.getKey(), entry.getValue());
                    }
                    return value;
                })
                .toList();
    }

    @PreDestroy
    public void shutdown() {
        taskExecutor.shutdownNow();
    }
}
