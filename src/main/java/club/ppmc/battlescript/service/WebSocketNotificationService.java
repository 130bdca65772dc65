/**
 * WebSocketNotificationService.java
 *
 * 统一的 WebSocket 消息发送服务。
 * 交互运行的输出、输入请求、状态变化和最终结果都通过它推送到前端。
 */
package club.ppmc.battlescript.service;

import club.ppmc.battlescript.model.RunResponse;
import club.ppmc.battlescript.model.SessionState;
import com.google.gson.Gson;
import java.util.Map;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

@Service
public class WebSocketNotificationService {

    static final String RUN_LOG_TOPIC = "/topic/run-log";
    static final String INPUT_REQUEST_TOPIC = "/topic/run/input-request";
    static final String STATUS_TOPIC = "/topic/run/status";
    static final String RESULT_TOPIC = "/topic/run/result";

    private final SimpMessagingTemplate messagingTemplate;
    private final Gson gson;

    public WebSocketNotificationService(SimpMessagingTemplate messagingTemplate, Gson gson) {
        this.messagingTemplate = messagingTemplate;
        this.gson = gson;
    }

    /**
     * 发送运行输出片段。
     * @param chunk 子进程的一段输出，不保证以换行结尾。
     */
    public void sendRunLog(String chunk) {
        sendMessage(RUN_LOG_TOPIC, chunk);
    }

    /**
     * 通知前端程序在等待输入。
     * @param prompt 标准输出中最后一个未换行的片段，可能为空字符串。
     */
    public void sendInputRequest(String prompt) {
        sendMessage(INPUT_REQUEST_TOPIC, gson.toJson(Map.of("prompt", prompt)));
    }

    public void sendRunStatus(SessionState state) {
        sendMessage(STATUS_TOPIC, gson.toJson(Map.of("state", state.name())));
    }

    public void sendRunResult(RunResponse response) {
        sendMessage(RESULT_TOPIC, gson.toJson(response));
    }

    /**
     * 向指定的 WebSocket 主题发送一个载荷。
     * @param destination 目标主题，例如 "/topic/run-log"。
     * @param payload 要发送的对象 (会被自动序列化)。
     */
    public void sendMessage(String destination, Object payload) {
        messagingTemplate.convertAndSend(destination, payload);
    }
}
