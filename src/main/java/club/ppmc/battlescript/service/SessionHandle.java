/**
 * SessionHandle.java
 *
 * 调用方看到的进程会话句柄。它只暴露状态、结果、标准输入写入、只读的输出缓冲区以及取消回调，
 * 底层的 Process 对象只由 ProcessSessionManager 持有和操作，
 * 从而避免取消与进程自然退出之间的竞争。
 */
package club.ppmc.battlescript.service;

import club.ppmc.battlescript.model.CommandResult;
import club.ppmc.battlescript.model.PipeBuffer;
import club.ppmc.battlescript.model.SessionState;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class SessionHandle {

    private final long id;
    private final long generation;
    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.STARTING);
    private final CompletableFuture<CommandResult> result = new CompletableFuture<>();
    private final PipeBuffer stdout = new PipeBuffer();
    private final PipeBuffer stderr = new PipeBuffer();
    private final List<Runnable> cancelHooks = new CopyOnWriteArrayList<>();
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);

    private volatile Process process;
    private BufferedWriter stdin;

    SessionHandle(long id, long generation) {
        this.id = id;
        this.generation = generation;
    }

    /** 一个从未启动、直接以“已停止”结束的句柄，用于已被新运行取代的步骤。 */
    static SessionHandle superseded(long id, long generation) {
        var handle = new SessionHandle(id, generation);
        handle.stopRequested.set(true);
        handle.finish(new CommandResult(-1, "", "", true, null), SessionState.TERMINATED);
        return handle;
    }

    public long id() {
        return id;
    }

    long generation() {
        return generation;
    }

    public SessionState state() {
        return state.get();
    }

    /** 进程退出且两个输出流都读完后完成。 */
    public CompletableFuture<CommandResult> result() {
        return result;
    }

    public boolean isAlive() {
        Process p = process;
        return p != null && p.isAlive();
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }

    public PipeBuffer stdout() {
        return stdout;
    }

    public PipeBuffer stderr() {
        return stderr;
    }

    /**
     * 向子进程标准输入写入一行 (自动追加换行)。
     *
     * @return 如果写入成功。
     */
    public synchronized boolean writeLine(String line) {
        if (stdin == null) {
            return false;
        }
        try {
            stdin.write(line);
            stdin.write('\n');
            stdin.flush();
            return true;
        } catch (IOException e) {
            log.warn("向会话 {} 的标准输入写入失败: {}", id, e.getMessage());
            return false;
        }
    }

    /** 关闭子进程的标准输入，让读取输入的程序看到 EOF。 */
    public synchronized void closeInput() {
        if (stdin == null) {
            return;
        }
        try {
            stdin.close();
        } catch (IOException e) {
            log.debug("关闭会话 {} 的标准输入时出错: {}", id, e.getMessage());
        } finally {
            stdin = null;
        }
    }

    /**
     * 注册一个在会话被取消时执行的回调。如果会话已被取消，回调立即执行。
     */
    public void onCancel(Runnable hook) {
        cancelHooks.add(hook);
        if (stopRequested.get() && cancelHooks.remove(hook)) {
            hook.run();
        }
    }

    // --- 以下方法只由 ProcessSessionManager 调用 ---

    synchronized void attach(Process process) {
        this.process = process;
        this.stdin = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
        state.set(SessionState.RUNNING);
    }

    Process process() {
        return process;
    }

    /**
     * 标记停止请求并执行取消回调。
     *
     * @return 如果这是第一次停止请求。
     */
    boolean requestStop() {
        if (!stopRequested.compareAndSet(false, true)) {
            return false;
        }
        for (Runnable hook : cancelHooks) {
            if (cancelHooks.remove(hook)) {
                try {
                    hook.run();
                } catch (RuntimeException e) {
                    log.warn("会话 {} 的取消回调执行失败", id, e);
                }
            }
        }
        return true;
    }

    void finish(CommandResult commandResult, SessionState finalState) {
        state.set(finalState);
        closeInput();
        result.complete(commandResult);
    }
}
