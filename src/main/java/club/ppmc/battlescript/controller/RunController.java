/**
 * RunController.java
 *
 * 该控制器处理运行相关的请求：批处理运行 (并同步回 JibJab)、启动交互运行、停止运行和查询状态。
 * 交互运行的输入和 WebSocket 上的启动请求通过 STOMP 消息到达。
 */
package club.ppmc.battlescript.controller;

import club.ppmc.battlescript.model.ExecutionRequest;
import club.ppmc.battlescript.model.RunRequest;
import club.ppmc.battlescript.model.RunResponse;
import club.ppmc.battlescript.model.TargetId;
import club.ppmc.battlescript.service.ProcessSessionManager;
import club.ppmc.battlescript.service.RunConsoleService;
import club.ppmc.battlescript.service.WorkbenchService;
import jakarta.validation.Valid;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/run")
@Slf4j
public class RunController {

    /** 运行 JibJab 源码本身时使用的目标 ID。 */
    static final String CANONICAL_TARGET = "jj";

    private final WorkbenchService workbenchService;
    private final RunConsoleService runConsoleService;
    private final ProcessSessionManager sessionManager;

    public RunController(
            WorkbenchService workbenchService,
            RunConsoleService runConsoleService,
            ProcessSessionManager sessionManager) {
        this.workbenchService = workbenchService;
        this.runConsoleService = runConsoleService;
        this.sessionManager = sessionManager;
    }

    /**
     * 以批处理模式运行源码，等待运行结束后返回结果。
     * 源码被修改过且运行成功时，响应中附带反向转译得到的 JibJab 源码。
     */
    @PostMapping
    public CompletableFuture<ResponseEntity<?>> run(@Valid @RequestBody RunRequest request) {
        if (CANONICAL_TARGET.equals(request.target())) {
            return workbenchService.runCanonical(request.source())
                    .thenApply(outcome -> ResponseEntity.ok(RunResponse.of(outcome, null)));
        }
        TargetId target;
        try {
            target = TargetId.fromId(request.target());
        } catch (IllegalArgumentException e) {
            return CompletableFuture.completedFuture(
                    ResponseEntity.badRequest().body(Map.of("message", e.getMessage())));
        }
        return workbenchService.runTarget(ExecutionRequest.batch(target, request.source()), request.edited())
                .thenApply(run -> ResponseEntity.ok(RunResponse.of(run.outcome(), run.canonical())));
    }

    /**
     * 启动一次交互运行。输出和输入请求通过 WebSocket 推送，结果推送到 /topic/run/result。
     *
     * @param sessionId 拥有该控制台的 WebSocket 会话 ID，可选。
     */
    @PostMapping("/interactive")
    public ResponseEntity<Map<String, String>> runInteractive(
            @Valid @RequestBody RunRequest request, @RequestParam(required = false) String sessionId) {
        try {
            runConsoleService.startInteractive(sessionId, request.target(), request.source(), request.edited());
            return ResponseEntity.accepted().body(Map.of("message", "交互运行已启动。"));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("message", e.getMessage()));
        }
    }

    /**
     * 停止当前正在运行的程序。
     */
    @PostMapping("/stop")
    public ResponseEntity<Map<String, String>> stop() {
        boolean stopped = runConsoleService.cancel();
        return ResponseEntity.ok(Map.of(
                "message", stopped ? "已向正在运行的进程发送停止信号。" : "当前没有正在运行的进程。"));
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, String>> status() {
        return ResponseEntity.ok(Map.of("state", sessionManager.status().name()));
    }

    /**
     * 通过 WebSocket 启动交互运行，发送消息的会话成为控制台的所有者。
     */
    @MessageMapping("/run/interactive")
    public void startInteractive(@Payload RunRequest request, SimpMessageHeaderAccessor headerAccessor) {
        String sessionId = headerAccessor.getSessionId();
        try {
            runConsoleService.startInteractive(sessionId, request.target(), request.source(), request.edited());
        } catch (IllegalArgumentException e) {
            log.warn("会话 {} 的交互运行请求无效: {}", sessionId, e.getMessage());
        }
    }

    /**
     * 接收用户在控制台输入的一行。
     */
    @MessageMapping("/run/input")
    public void handleInput(@Payload String line, SimpMessageHeaderAccessor headerAccessor) {
        String sessionId = headerAccessor.getSessionId();
        if (sessionId != null) {
            runConsoleService.submitInput(sessionId, line);
        }
    }
}
