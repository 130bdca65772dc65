/**
 * WebSocketSessionListener.java
 *
 * 监听 WebSocket 的连接和断开事件。拥有交互控制台的客户端断开时，停止它发起的运行。
 */
package club.ppmc.battlescript.listener;

import club.ppmc.battlescript.service.RunConsoleService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionConnectedEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

@Component
@Slf4j
public class WebSocketSessionListener {

    private final RunConsoleService runConsoleService;

    public WebSocketSessionListener(RunConsoleService runConsoleService) {
        this.runConsoleService = runConsoleService;
    }

    @EventListener
    public void handleWebSocketConnectListener(SessionConnectedEvent event) {
        var headerAccessor = StompHeaderAccessor.wrap(event.getMessage());
        log.info("接收到新的 WebSocket 连接，会话 ID: {}", headerAccessor.getSessionId());
    }

    @EventListener
    public void handleWebSocketDisconnectListener(SessionDisconnectEvent event) {
        String sessionId = event.getSessionId();
        if (sessionId != null) {
            log.info("WebSocket 连接断开，会话 ID: {}", sessionId);
            runConsoleService.handleDisconnect(sessionId);
        }
    }
}
