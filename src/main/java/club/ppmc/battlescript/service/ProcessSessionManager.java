/**
 * ProcessSessionManager.java
 *
 * 该服务负责管理全局唯一的子进程会话的生命周期。
 * 任意时刻最多只有一个会话处于运行状态：开始新的运行前会先停止旧会话，并等待它真正结束。
 * 一次运行可能包含多个步骤 (编译、链接、执行)，每次运行领取一个“代号”，
 * 取消或被新运行取代后代号失效，旧的步骤链因此无法再启动后续步骤。
 * 使用 CompletableFuture 和 Process.onExit() 来可靠地协调进程退出与输出读取。
 *
 * <p>Java 无法区分被信号结束的进程与自行以 128 以上退出码退出的进程，
 * 因此只有通过 {@link #cancel()} 或新运行发出的停止请求才会把会话记为被停止，
 * 其余退出一律按正常结束处理并保留退出码。
 */
package club.ppmc.battlescript.service;

import club.ppmc.battlescript.model.CommandResult;
import club.ppmc.battlescript.model.ExecutionMode;
import club.ppmc.battlescript.model.SessionState;
import club.ppmc.battlescript.util.SystemCommandExecutor;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class ProcessSessionManager {

    private static final boolean IS_WINDOWS = System.getProperty("os.name").toLowerCase().contains("win");
    private static final int SIGNAL_EXIT_BASE = 128;

    private final SystemCommandExecutor commandExecutor;
    private final SettingsService settingsService;
    private final AtomicReference<SessionHandle> currentSession = new AtomicReference<>();
    private final AtomicLong generation = new AtomicLong();
    private final AtomicLong sessionIds = new AtomicLong();
    private final ScheduledExecutorService killScheduler = Executors.newSingleThreadScheduledExecutor();
    private final Object startLock = new Object();

    public ProcessSessionManager(SystemCommandExecutor commandExecutor, SettingsService settingsService) {
        this.commandExecutor = commandExecutor;
        this.settingsService = settingsService;
    }

    /**
     * 开始一次新的运行：停止当前会话 (并等待其结束)，然后返回新运行的代号。
     *
     * @return 新运行的代号，之后每个步骤都要携带它调用 {@link #start(List, Path, ExecutionMode, long)}。
     */
    public long beginRun() {
        synchronized (startLock) {
            long ticket = generation.incrementAndGet();
            SessionHandle previous = currentSession.get();
            if (previous != null && !previous.state().isFinal()) {
                log.info("新的运行开始前，先停止会话 {}。", previous.id());
                terminate(previous);
                awaitTermination(previous);
            }
            return ticket;
        }
    }

    /**
     * 作为一次独立的运行启动命令 (会先停止当前会话)。
     *
     * @param command 命令及参数。
     * @param workDir 工作目录。
     * @param onExit 进程结束且输出读取完毕后的回调，可以为 null。
     */
    public SessionHandle start(List<String> command, Path workDir, Consumer<CommandResult> onExit) {
        SessionHandle handle = start(command, workDir, ExecutionMode.BATCH, beginRun());
        if (onExit != null) {
            handle.result().thenAccept(onExit);
        }
        return handle;
    }

    /**
     * 启动运行中的一个步骤。
     *
     * @param command 命令及参数。
     * @param workDir 工作目录。
     * @param mode 批处理模式下会立即关闭子进程的标准输入。
     * @param ticket {@link #beginRun()} 返回的代号；代号已失效时不会启动进程，直接返回已停止的句柄。
     */
    public SessionHandle start(List<String> command, Path workDir, ExecutionMode mode, long ticket) {
        synchronized (startLock) {
            if (ticket != generation.get()) {
                log.info("运行 {} 已被取消或取代，跳过命令: {}", ticket, String.join(" ", command));
                return SessionHandle.superseded(sessionIds.incrementAndGet(), ticket);
            }
            SessionHandle previous = currentSession.get();
            if (previous != null && !previous.state().isFinal()) {
                terminate(previous);
                awaitTermination(previous);
            }

            var handle = new SessionHandle(sessionIds.incrementAndGet(), ticket);
            currentSession.set(handle);
            Process process;
            try {
                process = commandExecutor.launch(command, workDir);
            } catch (IOException e) {
                log.error("启动进程失败，命令: {}", command, e);
                handle.finish(CommandResult.launchFailed(e.getMessage()), SessionState.FAILED);
                currentSession.compareAndSet(handle, null);
                return handle;
            }
            handle.attach(process);
            log.info("已启动会话 {}，PID: {}", handle.id(), process.pid());
            // cancel() 不持有 startLock，可能在进程启动期间到达：此时它只能标记停止请求
            if (ticket != generation.get() || handle.isStopRequested()) {
                log.info("会话 {} 在启动过程中被取消，立即停止。", handle.id());
                handle.requestStop();
                signal(handle, process);
            }
            if (mode == ExecutionMode.BATCH) {
                handle.closeInput();
            }

            // 进程退出并且两个输出流都读完后，才认为会话结束，保证输出不会丢失
            CompletableFuture<Void> stdoutReader = commandExecutor.drain(process.getInputStream(), handle.stdout());
            CompletableFuture<Void> stderrReader = commandExecutor.drain(process.getErrorStream(), handle.stderr());
            process.onExit()
                    .thenCombine(CompletableFuture.allOf(stdoutReader, stderrReader), (p, v) -> p)
                    .whenComplete((p, error) -> handleSessionTermination(handle, process));
            return handle;
        }
    }

    /**
     * 停止当前会话。没有活动会话时什么也不做。
     * 无论是否有活动会话，当前运行的代号都会失效，尚未启动的后续步骤不会再执行。
     *
     * @return 如果确实向一个活动会话发送了停止信号。
     */
    public boolean cancel() {
        generation.incrementAndGet();
        SessionHandle session = currentSession.get();
        if (session == null || session.state().isFinal()) {
            log.debug("没有正在运行的会话，忽略停止请求。");
            return false;
        }
        return terminate(session);
    }

    public SessionState status() {
        SessionHandle session = currentSession.get();
        return session == null ? SessionState.IDLE : session.state();
    }

    /**
     * 标记停止请求并向已启动的进程发送信号。
     * 进程尚未启动时只做标记，由 {@link #start(List, Path, ExecutionMode, long)} 在启动后补发信号。
     */
    private boolean terminate(SessionHandle session) {
        if (!session.requestStop()) {
            return false;
        }
        Process process = session.process();
        if (process != null) {
            signal(session, process);
        }
        return true;
    }

    /** 先发送 SIGTERM，宽限期过后仍未退出则强制结束。 */
    private void signal(SessionHandle session, Process process) {
        log.info("正在停止会话 {}，PID: {}", session.id(), process.pid());
        process.destroy();
        long grace = settingsService.getSettings().getCancelGraceMillis();
        killScheduler.schedule(
                () -> {
                    if (process.isAlive()) {
                        log.warn("会话 {} 在 {} 毫秒内未退出，强制结束。", session.id(), grace);
                        process.destroyForcibly();
                    }
                },
                grace,
                TimeUnit.MILLISECONDS);
    }

    private void awaitTermination(SessionHandle session) {
        long timeout = settingsService.getSettings().getCancelGraceMillis() + 5000;
        try {
            session.result().get(timeout, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            log.warn("等待会话 {} 结束失败: {}", session.id(), e.toString());
        }
    }

    /**
     * 统一处理会话的结束。收到过停止请求的会话记为 TERMINATED，
     * 其余无论退出码是否为 0 都记为 COMPLETED。
     */
    private void handleSessionTermination(SessionHandle session, Process process) {
        int exitCode = process.exitValue();
        boolean signaled = session.isStopRequested();
        if (!signaled && !IS_WINDOWS && exitCode > SIGNAL_EXIT_BASE) {
            log.warn("会话 {} 以退出码 {} 结束，可能是被外部信号终止，按正常退出处理。", session.id(), exitCode);
        }
        var result = new CommandResult(
                exitCode, session.stdout().contents(), session.stderr().contents(), signaled, null);
        session.finish(result, signaled ? SessionState.TERMINATED : SessionState.COMPLETED);
        log.info("会话 {} 已结束，退出码: {}{}", session.id(), exitCode, signaled ? " (已停止)" : "");
        currentSession.compareAndSet(session, null);
    }

    @PreDestroy
    public void shutdown() {
        log.info("正在关闭 ProcessSessionManager...");
        cancel();
        killScheduler.shutdown();
        try {
            if (!killScheduler.awaitTermination(1, TimeUnit.SECONDS)) {
                killScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            killScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
