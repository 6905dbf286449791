package com.astroinsight.astroinsight_backend.engine;

import com.astroinsight.astroinsight_backend.model.session.NodeId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@Component
public class SessionEventPublisher {

    private final SimpMessagingTemplate messagingTemplate;
    private final ObjectProvider<RedisEventBridge> redisBridgeProvider;

    // Clients subscribe to /topic/session/{sessionId} to follow a session live
    public static final String TOPIC = "/topic/session/";

    public SessionEventPublisher(SimpMessagingTemplate messagingTemplate,
                                 ObjectProvider<RedisEventBridge> redisBridgeProvider) {
        this.messagingTemplate = messagingTemplate;
        this.redisBridgeProvider = redisBridgeProvider;
    }

    public void nodeStarted(String sessionId, NodeId node) {
        publish(sessionId, "NODE_STARTED", node, "RUNNING", null);
    }

    public void nodeCompleted(String sessionId, NodeId node, String outcome) {
        publish(sessionId, "NODE_COMPLETED", node, outcome, null);
    }

    public void nodeFailed(String sessionId, NodeId node, String error) {
        publish(sessionId, "NODE_FAILED", node, "ERROR", error);
    }

    public void sessionSuspended(String sessionId, NodeId node) {
        publish(sessionId, "SESSION_SUSPENDED", node, "AWAITING_INPUT", null);
    }

    public void sessionCompleted(String sessionId) {
        publish(sessionId, "SESSION_COMPLETED", NodeId.END, "COMPLETE", null);
    }

    private void publish(String sessionId, String type, NodeId node, String status, String error) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type",      type);
        payload.put("sessionId", sessionId);
        payload.put("node",      node.getKey());
        payload.put("status",    status);
        payload.put("error",     error != null ? error : "");
        payload.put("timestamp", System.currentTimeMillis());

        String destination = TOPIC + sessionId;
        RedisEventBridge bridge = redisBridgeProvider.getIfAvailable();
        log.debug("Session event {} {} {} via {}", destination, type, node, bridge != null ? "Redis" : "Direct");
        // Live events are best effort; a broker problem must not fail the dispatch
        try {
            if (bridge != null) {
                bridge.publish(destination, payload);
            } else {
                messagingTemplate.convertAndSend(destination, payload);
            }
        } catch (MessagingException e) {
            log.warn("Could not publish {} for session {}: {}", type, sessionId, e.getMessage());
        }
    }
}
