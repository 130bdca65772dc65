/**
 * RunConsoleService.java
 *
 * 交互运行的控制台。它把 WebSocket 客户端与后台的交互会话连接起来：
 * 程序输出推送到 /topic/run-log，程序等待输入时推送输入请求，客户端的输入再交还给会话。
 * 同一时刻只有一个控制台，属于发起运行的 WebSocket 会话；该会话断开时运行会被停止。
 */
package club.ppmc.battlescript.service;

import club.ppmc.battlescript.model.ExecutionRequest;
import club.ppmc.battlescript.model.RunResponse;
import club.ppmc.battlescript.model.SessionState;
import club.ppmc.battlescript.model.TargetId;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class RunConsoleService {

    private final WorkbenchService workbenchService;
    private final WebSocketNotificationService notificationService;
    private final AtomicReference<ConsoleChannel> currentChannel = new AtomicReference<>();

    public RunConsoleService(WorkbenchService workbenchService, WebSocketNotificationService notificationService) {
        this.workbenchService = workbenchService;
        this.notificationService = notificationService;
    }

    /**
     * 为指定的 WebSocket 会话启动一次交互运行。之前的运行 (无论属于谁) 会被停止。
     *
     * @param ownerSessionId 发起运行的 WebSocket 会话 ID，可以为 null。
     * @param targetId 目标语言 ID。
     * @param source 目标语言源码。
     * @param edited 源码是否被用户修改过。
     * @return 运行结束后完成，结果同时推送到 /topic/run/result。
     * @throws IllegalArgumentException 目标语言未知时。
     */
    public CompletableFuture<RunResponse> startInteractive(
            String ownerSessionId, String targetId, String source, boolean edited) {
        TargetId target = TargetId.fromId(targetId);
        var channel = new ConsoleChannel(ownerSessionId);
        ConsoleChannel previous = currentChannel.getAndSet(channel);
        if (previous != null) {
            previous.abandonInput();
        }
        log.info("会话 {} 开始交互运行，目标语言: {}", ownerSessionId, target.id());
        notificationService.sendRunStatus(SessionState.STARTING);

        ExecutionRequest request = ExecutionRequest.interactive(
                target,
                source,
                prompt -> {
                    CompletableFuture<String> pending = channel.awaitInput();
                    notificationService.sendInputRequest(prompt);
                    return pending;
                },
                notificationService::sendRunLog);

        return workbenchService.runTarget(request, edited).handle((run, error) -> {
            currentChannel.compareAndSet(channel, null);
            RunResponse response;
            if (error != null) {
                log.error("交互运行失败", error);
                response = new RunResponse("RUN_ERROR", "Run error: " + error.getMessage(), -1, null);
            } else {
                response = RunResponse.of(run.outcome(), run.canonical());
            }
            notificationService.sendRunResult(response);
            notificationService.sendRunStatus(SessionState.IDLE);
            return response;
        });
    }

    /**
     * 把客户端输入的一行交给正在等待输入的程序。
     *
     * @return 如果该输入被接受 (会话是控制台的所有者，并且程序确实在等待输入)。
     */
    public boolean submitInput(String sessionId, String line) {
        ConsoleChannel channel = currentChannel.get();
        if (channel == null || !channel.acceptsInputFrom(sessionId)) {
            log.warn("会话 {} 不是当前控制台的所有者，忽略输入。", sessionId);
            return false;
        }
        return channel.supply(line);
    }

    /** WebSocket 会话断开时调用。只有断开的是控制台所有者时才停止运行。 */
    public void handleDisconnect(String sessionId) {
        ConsoleChannel channel = currentChannel.get();
        if (channel == null || !sessionId.equals(channel.ownerSessionId())) {
            return;
        }
        log.info("控制台所有者 {} 已断开，停止当前运行。", sessionId);
        cancel();
    }

    /**
     * 停止当前运行，并放弃正在等待的输入。
     *
     * @return 如果确实停止了一个活动会话。
     */
    public boolean cancel() {
        ConsoleChannel channel = currentChannel.get();
        boolean stopped = workbenchService.cancel();
        if (channel != null) {
            channel.abandonInput();
        }
        return stopped;
    }

    /** 一个交互控制台：所有者会话，以及当前等待中的输入请求。 */
    private static final class ConsoleChannel {

        private final String ownerSessionId;
        private final AtomicReference<CompletableFuture<String>> pendingInput = new AtomicReference<>();

        ConsoleChannel(String ownerSessionId) {
            this.ownerSessionId = ownerSessionId;
        }

        String ownerSessionId() {
            return ownerSessionId;
        }

        /** 没有所有者的控制台 (通过 REST 启动且未指定会话) 接受任意会话的输入。 */
        boolean acceptsInputFrom(String sessionId) {
            return ownerSessionId == null || ownerSessionId.equals(sessionId);
        }

        CompletableFuture<String> awaitInput() {
            var future = new CompletableFuture<String>();
            CompletableFuture<String> previous = pendingInput.getAndSet(future);
            if (previous != null) {
                previous.complete(null);
            }
            return future;
        }

        boolean supply(String line) {
            CompletableFuture<String> future = pendingInput.getAndSet(null);
            return future != null && future.complete(line);
        }

        void abandonInput() {
            CompletableFuture<String> future = pendingInput.getAndSet(null);
            if (future != null) {
                future.complete(null);
            }
        }
    }
}
