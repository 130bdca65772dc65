/**
 * InteractiveBridge.java
 *
 * 交互运行时，连接子进程与调用方的桥梁。
 * 它以固定间隔轮询会话的输出缓冲区，把新输出实时转发给 OutputListener；
 * 当子进程仍在运行、但一个轮询间隔内没有任何新输出时，认为程序在等待输入，
 * 于是向 InputProvider 请求一行输入并写入子进程的标准输入。
 * 这种判断是启发式的：一个计算很慢、并不读取输入的程序同样会触发输入请求。
 */
package club.ppmc.battlescript.service;

import club.ppmc.battlescript.model.CommandResult;
import club.ppmc.battlescript.model.ExecutionRequest;
import club.ppmc.battlescript.model.InputWaitToken;
import club.ppmc.battlescript.model.RunOutcome;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class InteractiveBridge {

    private static final long MIN_SLEEP_MILLIS = 10;

    private final SettingsService settingsService;

    public InteractiveBridge(SettingsService settingsService) {
        this.settingsService = settingsService;
    }

    /**
     * 在调用线程上转发一个交互会话的输入输出，直到会话结束。
     *
     * @param handle 已启动的会话。
     * @param request 运行请求，提供 InputProvider 与 OutputListener。
     * @return 会话的运行结果。
     */
    public RunOutcome relay(SessionHandle handle, ExecutionRequest request) {
        long pollMillis = Math.max(MIN_SLEEP_MILLIS, settingsService.getSettings().getInputPollMillis());
        long sleepMillis = Math.max(MIN_SLEEP_MILLIS, Math.min(50, pollMillis / 4));

        var pendingWait = new AtomicReference<InputWaitToken>();
        Runnable releasePending = () -> {
            InputWaitToken token = pendingWait.getAndSet(null);
            if (token != null) {
                token.release();
            }
        };
        handle.onCancel(releasePending);
        handle.result().thenRun(releasePending);

        var cursor = new OutputCursor();
        boolean inputClosed = false;
        long lastOutputAt = System.currentTimeMillis();
        try {
            while (!handle.result().isDone()) {
                if (cursor.forward(handle, request)) {
                    lastOutputAt = System.currentTimeMillis();
                }
                boolean quiet = System.currentTimeMillis() - lastOutputAt >= pollMillis;
                if (quiet && !inputClosed && handle.isAlive() && !handle.isStopRequested()) {
                    String line = awaitInput(handle, request, cursor.prompt(), pendingWait);
                    if (line != null) {
                        handle.writeLine(line);
                    } else if (handle.isAlive()) {
                        log.info("调用方放弃输入，关闭会话 {} 的标准输入。", handle.id());
                        handle.closeInput();
                        inputClosed = true;
                    }
                    lastOutputAt = System.currentTimeMillis();
                    continue;
                }
                Thread.sleep(sleepMillis);
            }
            CommandResult result = handle.result().get();
            cursor.forward(handle, request);
            return RunOutcome.fromExecution(result);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            releasePending.run();
            return RunOutcome.stopped();
        } catch (ExecutionException e) {
            log.error("等待交互会话 {} 的结果时出错", handle.id(), e);
            return RunOutcome.runError(String.valueOf(e.getCause()));
        }
    }

    private String awaitInput(
            SessionHandle handle,
            ExecutionRequest request,
            String prompt,
            AtomicReference<InputWaitToken> pendingWait) throws InterruptedException {
        var token = new InputWaitToken();
        pendingWait.set(token);
        // 注册之后再检查一次，避免错过在注册前发生的取消或退出
        if (handle.isStopRequested() || handle.result().isDone()) {
            token.release();
        }
        log.debug("会话 {} 在等待输入，提示: '{}'", handle.id(), prompt);
        request.inputProvider()
                .requestInput(prompt)
                .whenComplete((line, error) -> {
                    if (!token.isResumed()) {
                        token.resume(error == null ? line : null);
                    }
                });
        String line = token.await();
        pendingWait.compareAndSet(token, null);
        return line;
    }

    /** 记录两个输出缓冲区已转发到的位置，以及标准输出中最后一个未换行的片段。 */
    private static final class OutputCursor {

        private int stdoutOffset;
        private int stderrOffset;
        private final StringBuilder partialLine = new StringBuilder();

        /** @return 如果有新的输出。 */
        boolean forward(SessionHandle handle, ExecutionRequest request) {
            String out = handle.stdout().since(stdoutOffset);
            String err = handle.stderr().since(stderrOffset);
            stdoutOffset += out.length();
            stderrOffset += err.length();
            if (!out.isEmpty()) {
                int newline = out.lastIndexOf('\n');
                if (newline >= 0) {
                    partialLine.setLength(0);
                    partialLine.append(out.substring(newline + 1));
                } else {
                    partialLine.append(out);
                }
                request.outputListener().onOutput(out);
            }
            if (!err.isEmpty()) {
                request.outputListener().onOutput(err);
            }
            return !out.isEmpty() || !err.isEmpty();
        }

        String prompt() {
            return partialLine.toString();
        }
    }
}
