/**
 * ToolchainRunnerServiceTest.java
 *
 * 用 sh 脚本模拟各目标语言的工具链，检查编译、汇编、链接和运行步骤的编排。
 */
package club.ppmc.battlescript.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import club.ppmc.battlescript.model.ExecutionRequest;
import club.ppmc.battlescript.model.RunOutcome;
import club.ppmc.battlescript.model.SessionState;
import club.ppmc.battlescript.model.TargetId;
import club.ppmc.battlescript.model.ToolchainCommand;
import club.ppmc.battlescript.util.SystemCommandExecutor;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ToolchainRunnerServiceTest {

    @TempDir
    Path tempDir;

    private SettingsService settingsService;
    private SystemCommandExecutor executor;
    private ProcessSessionManager sessionManager;
    private ToolchainRunnerService runner;

    @BeforeEach
    void setUp() {
        settingsService = TestSettings.create(tempDir, 300);
        executor = new SystemCommandExecutor(settingsService);
        sessionManager = new ProcessSessionManager(executor, settingsService);
        runner = new ToolchainRunnerService(sessionManager, settingsService, new InteractiveBridge(settingsService));
    }

    @AfterEach
    void tearDown() {
        runner.shutdown();
        sessionManager.shutdown();
        executor.shutdown();
    }

    private void configure(TargetId target, ToolchainCommand command) {
        settingsService.getSettings().getToolchains().put(target.id(), command);
    }

    private static List<String> sh(String script) {
        return List.of("sh", "-c", script);
    }

    private Path scratch() {
        return settingsService.scratchDirectory();
    }

    @Test
    void interpretedTargetRunsTheSourceFile() {
        configure(TargetId.PY, new ToolchainCommand(null, null, null, List.of("sh", "{src}")));

        RunOutcome outcome = runner.run(ExecutionRequest.batch(TargetId.PY, "echo hello"));

        assertEquals(RunOutcome.Kind.OK, outcome.kind());
        assertEquals("hello", outcome.text());
        assertEquals(0, outcome.exitCode());
        assertTrue(Files.exists(scratch().resolve("battlescript_py.py")));
    }

    @Test
    void nonZeroExitIsReportedButStillOk() {
        configure(TargetId.PY, new ToolchainCommand(null, null, null, sh("echo partial; exit 4")));

        RunOutcome outcome = runner.run(ExecutionRequest.batch(TargetId.PY, ""));

        assertTrue(outcome.isOk());
        assertEquals(4, outcome.exitCode());
        assertEquals("partial", outcome.text());
    }

    @Test
    void compiledTargetExecutesTheBuiltBinary() {
        configure(TargetId.C, new ToolchainCommand(
                sh("printf '#!/bin/sh\\necho built\\n' > {out} && chmod +x {out}"), null, null, null));

        RunOutcome outcome = runner.run(ExecutionRequest.batch(TargetId.C, "int main() { return 0; }"));

        assertEquals(RunOutcome.Kind.OK, outcome.kind());
        assertEquals("built", outcome.text());
    }

    @Test
    void compileErrorStopsBeforeRunning() {
        configure(TargetId.C, new ToolchainCommand(
                sh("echo 'bad syntax' >&2; exit 1"), null, null, sh("touch ran.txt")));

        RunOutcome outcome = runner.run(ExecutionRequest.batch(TargetId.C, "int main( {"));

        assertEquals(RunOutcome.Kind.COMPILE_ERROR, outcome.kind());
        assertEquals("Compile error:\nbad syntax", outcome.text());
        assertEquals("compile", outcome.failedStep());
        assertFalse(Files.exists(scratch().resolve("ran.txt")));
    }

    @Test
    void assemblyChainProbesSdkAndLinks() {
        configure(TargetId.ASM, new ToolchainCommand(
                sh("echo obj > {obj}"),
                sh("printf '#!/bin/sh\\necho linked {sdk}\\n' > {out} && chmod +x {out}"),
                sh("echo /fake/sdk"),
                null));

        RunOutcome outcome = runner.run(ExecutionRequest.batch(TargetId.ASM, "_main:\n    ret\n"));

        assertEquals(RunOutcome.Kind.OK, outcome.kind());
        assertEquals("linked /fake/sdk", outcome.text());
        assertTrue(Files.exists(scratch().resolve("battlescript_asm_out.o")));
    }

    @Test
    void assemblyFailuresNameTheirStep() {
        configure(TargetId.ASM, new ToolchainCommand(
                sh("echo 'unknown opcode' >&2; exit 1"), sh("true"), sh("echo /fake/sdk"), null));
        RunOutcome assembled = runner.run(ExecutionRequest.batch(TargetId.ASM, "bogus"));
        assertEquals("assemble", assembled.failedStep());
        assertEquals("Assembly error:\nunknown opcode", assembled.text());

        configure(TargetId.ASM, new ToolchainCommand(
                sh("true"), sh("echo 'undefined symbol' >&2; exit 1"), sh("echo /fake/sdk"), null));
        RunOutcome linked = runner.run(ExecutionRequest.batch(TargetId.ASM, "bogus"));
        assertEquals("link", linked.failedStep());
        assertEquals("Link error:\nundefined symbol", linked.text());

        configure(TargetId.ASM, new ToolchainCommand(
                sh("true"), sh("true"), sh("echo 'no sdk' >&2; exit 1"), null));
        RunOutcome probed = runner.run(ExecutionRequest.batch(TargetId.ASM, "bogus"));
        assertEquals("sdk", probed.failedStep());
        assertEquals(RunOutcome.Kind.COMPILE_ERROR, probed.kind());
    }

    @Test
    void missingToolchainIsARunError() {
        settingsService.getSettings().getToolchains().remove(TargetId.GO.id());

        RunOutcome outcome = runner.run(ExecutionRequest.batch(TargetId.GO, "package main"));

        assertEquals(RunOutcome.Kind.RUN_ERROR, outcome.kind());
        assertEquals("Run error: No compiler or runner for target: go", outcome.text());
    }

    @Test
    void missingCompilerExecutableIsARunError() {
        configure(TargetId.SWIFT, new ToolchainCommand(
                List.of("battlescript-no-such-compiler", "{src}"), null, null, null));

        RunOutcome outcome = runner.run(ExecutionRequest.batch(TargetId.SWIFT, "print(1)"));

        assertEquals(RunOutcome.Kind.RUN_ERROR, outcome.kind());
    }

    @Test
    void unwritableScratchDirectoryIsAWriteError() throws Exception {
        Path blocker = Files.writeString(tempDir.resolve("not-a-directory"), "x");
        settingsService.getSettings().setScratchDirectory(blocker.resolve("scratch").toString());

        RunOutcome outcome = runner.run(ExecutionRequest.batch(TargetId.PY, "print(1)"));

        assertEquals(RunOutcome.Kind.WRITE_ERROR, outcome.kind());
        assertTrue(outcome.text().startsWith("Error writing source: "));
        assertEquals("write", outcome.failedStep());
    }

    @Test
    void cancelStopsTheRunningProgram() throws Exception {
        configure(TargetId.PY, new ToolchainCommand(null, null, null, List.of("sleep", "30")));

        CompletableFuture<RunOutcome> pending = runner.submit(ExecutionRequest.batch(TargetId.PY, ""));
        long deadline = System.currentTimeMillis() + 5000;
        while (sessionManager.status() != SessionState.RUNNING && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertTrue(runner.cancel());

        RunOutcome outcome = pending.get(10, TimeUnit.SECONDS);
        assertEquals(RunOutcome.Kind.STOPPED, outcome.kind());
        assertEquals(RunOutcome.STOPPED_TEXT, outcome.text());
    }

    @Test
    void substitutesPlaceholdersInsideArguments() {
        assertEquals(
                List.of("ld", "-o", "/tmp/out", "-L/sdk/lib"),
                ToolchainRunnerService.substitute(
                        List.of("ld", "-o", "{out}", "-L{sdk}/lib"),
                        Map.of("{out}", "/tmp/out", "{sdk}", "/sdk")));
    }
}
