/**
 * InteractiveBridgeTest.java
 *
 * 交互运行的测试：程序在提示后等待输入时，应向 InputProvider 请求一行并写入子进程。
 */
package club.ppmc.battlescript.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import club.ppmc.battlescript.model.ExecutionRequest;
import club.ppmc.battlescript.model.RunOutcome;
import club.ppmc.battlescript.model.TargetId;
import club.ppmc.battlescript.model.ToolchainCommand;
import club.ppmc.battlescript.util.SystemCommandExecutor;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class InteractiveBridgeTest {

    private static final String GREETER =
            "printf 'name? '; if read n; then echo \"hi $n\"; else echo eof; fi";

    @TempDir
    Path tempDir;

    private SystemCommandExecutor executor;
    private ProcessSessionManager sessionManager;
    private ToolchainRunnerService runner;

    private final List<String> prompts = new CopyOnWriteArrayList<>();
    private final StringBuffer output = new StringBuffer();

    @BeforeEach
    void setUp() {
        SettingsService settingsService = TestSettings.create(tempDir, 400);
        settingsService.getSettings().getToolchains()
                .put(TargetId.PY.id(), new ToolchainCommand(null, null, null, List.of("sh", "{src}")));
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

    @Test
    void suppliesInputWhenTheProgramWaits() throws Exception {
        ExecutionRequest request = ExecutionRequest.interactive(
                TargetId.PY,
                GREETER,
                prompt -> {
                    prompts.add(prompt);
                    return CompletableFuture.completedFuture("Ann");
                },
                output::append);

        RunOutcome outcome = runner.submit(request).get(20, TimeUnit.SECONDS);

        assertEquals(RunOutcome.Kind.OK, outcome.kind());
        assertEquals("name? hi Ann", outcome.text());
        assertEquals("name? ", prompts.get(0));
        assertEquals("name? hi Ann\n", output.toString());
    }

    @Test
    void missingInputClosesStandardInput() throws Exception {
        ExecutionRequest request = ExecutionRequest.interactive(
                TargetId.PY, GREETER, prompt -> CompletableFuture.completedFuture(null), output::append);

        RunOutcome outcome = runner.submit(request).get(20, TimeUnit.SECONDS);

        assertEquals(RunOutcome.Kind.OK, outcome.kind());
        assertTrue(outcome.text().endsWith("eof"));
    }

    @Test
    void programsThatNeverWaitAreNotAskedForInput() throws Exception {
        ExecutionRequest request = ExecutionRequest.interactive(
                TargetId.PY,
                "echo done",
                prompt -> {
                    prompts.add(prompt);
                    return CompletableFuture.completedFuture("");
                },
                output::append);

        RunOutcome outcome = runner.submit(request).get(20, TimeUnit.SECONDS);

        assertEquals("done", outcome.text());
        assertTrue(prompts.isEmpty());
    }

    @Test
    void cancelReleasesAPendingInputRequest() throws Exception {
        var requested = new CompletableFuture<String>();
        ExecutionRequest request = ExecutionRequest.interactive(
                TargetId.PY,
                GREETER,
                prompt -> {
                    requested.complete(prompt);
                    return new CompletableFuture<>();
                },
                output::append);

        CompletableFuture<RunOutcome> pending = runner.submit(request);
        assertEquals("name? ", requested.get(20, TimeUnit.SECONDS));
        assertFalse(pending.isDone());

        assertTrue(runner.cancel());
        RunOutcome outcome = pending.get(20, TimeUnit.SECONDS);
        assertEquals(RunOutcome.Kind.STOPPED, outcome.kind());
    }
}
