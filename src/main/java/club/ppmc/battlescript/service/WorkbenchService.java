/**
 * WorkbenchService.java
 *
 * 工作台服务，组合运行与反向转译两条流程：
 * 运行某个目标语言的源码，如果源码被用户修改过并且运行成功，则把它反向转译回 JibJab，
 * 保持两种表示同步。它还负责用编译器库为全部目标语言生成初始源码，以及直接运行 JibJab 源码。
 */
package club.ppmc.battlescript.service;

import club.ppmc.battlescript.model.ExecutionRequest;
import club.ppmc.battlescript.model.ReconciledRun;
import club.ppmc.battlescript.model.RunOutcome;
import club.ppmc.battlescript.model.TargetId;
import jakarta.annotation.PreDestroy;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class WorkbenchService {

    static final String TRANSPILE_FAILED = "// Transpilation failed";
    static final String PARSE_ERROR_PREFIX = "// Parse error: ";
    static final String NO_COMPILER = "JibJab compiler library is not installed";

    private final ToolchainRunnerService runnerService;
    private final ReverseTranspilerService reverseTranspiler;
    private final ObjectProvider<ScriptCompiler> compilerProvider;
    private final ExecutorService taskExecutor = Executors.newCachedThreadPool();

    public WorkbenchService(
            ToolchainRunnerService runnerService,
            ReverseTranspilerService reverseTranspiler,
            ObjectProvider<ScriptCompiler> compilerProvider) {
        this.runnerService = runnerService;
        this.reverseTranspiler = reverseTranspiler;
        this.compilerProvider = compilerProvider;
    }

    /**
     * 运行目标语言源码，并在需要时把它同步回 JibJab。
     *
     * @param request 运行请求。
     * @param edited 源码是否被用户修改过。
     * @return 在后台完成的运行结果。
     */
    public CompletableFuture<ReconciledRun> runTarget(ExecutionRequest request, boolean edited) {
        return runnerService.submit(request).thenApply(outcome -> {
            if (!outcome.isOk() || !edited) {
                return new ReconciledRun(outcome, null);
            }
            String canonical = reverseTranspiler.decompile(request.source(), request.target()).orElse(null);
            if (canonical == null) {
                log.info("目标语言 {} 的源码没有反向转译出任何内容。", request.target().id());
            }
            return new ReconciledRun(outcome, canonical);
        });
    }

    /** 在后台线程中反向转译。 */
    public CompletableFuture<Optional<String>> decompileAsync(String code, TargetId target) {
        return CompletableFuture.supplyAsync(() -> reverseTranspiler.decompile(code, target), taskExecutor);
    }

    /**
     * 用编译器库把 JibJab 源码转译到全部目标语言。
     *
     * @return 每个目标语言的源码 (失败的目标语言为占位注释)；没有安装编译器库时为空。
     */
    public Optional<Map<TargetId, String>> seedTargets(String canonical) {
        ScriptCompiler compiler = compilerProvider.getIfAvailable();
        if (compiler == null) {
            log.warn("没有安装 JibJab 编译器库，无法生成目标语言源码。");
            return Optional.empty();
        }
        var seeded = new EnumMap<TargetId, String>(TargetId.class);
        Object program;
        try {
            program = compiler.parse(canonical);
        } catch (RuntimeException e) {
            log.info("JibJab 源码解析失败: {}", e.getMessage());
            for (TargetId target : TargetId.values()) {
                seeded.put(target, PARSE_ERROR_PREFIX + e.getMessage());
            }
            return Optional.of(seeded);
        }
        for (TargetId target : TargetId.values()) {
            String source;
            try {
                source = compiler.transpile(program, target).orElse(TRANSPILE_FAILED);
            } catch (RuntimeException e) {
                log.warn("转译到 {} 时出错: {}", target.id(), e.getMessage());
                source = TRANSPILE_FAILED;
            }
            seeded.put(target, source);
        }
        return Optional.of(seeded);
    }

    /**
     * 直接解释执行 JibJab 源码。
     */
    public CompletableFuture<RunOutcome> runCanonical(String source) {
        return CompletableFuture.supplyAsync(
                () -> {
                    ScriptCompiler compiler = compilerProvider.getIfAvailable();
                    if (compiler == null) {
                        return RunOutcome.runError(NO_COMPILER);
                    }
                    try {
                        return RunOutcome.ok(compiler.interpret(compiler.parse(source)).trim(), 0);
                    } catch (RuntimeException e) {
                        log.info("解释执行 JibJab 源码失败: {}", e.getMessage());
                        return RunOutcome.runError(String.valueOf(e.getMessage()));
                    }
                },
                taskExecutor);
    }

    public boolean cancel() {
        return runnerService.cancel();
    }

    @PreDestroy
    public void shutdown() {
        taskExecutor.shutdownNow();
    }
}
