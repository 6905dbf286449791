package com.astroinsight.astroinsight_backend.handler;

import com.astroinsight.astroinsight_backend.model.session.NodeId;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class NodeHandlerRegistry {

    private final List<NodeHandler> handlers;
    private final Map<NodeId, NodeHandler> registry = new EnumMap<>(NodeId.class);

    @PostConstruct
    public void init() {
        handlers.forEach(handler -> {
            NodeHandler previous = registry.put(handler.supportedNode(), handler);
            if (previous != null) {
                throw new IllegalStateException("Two handlers registered for node " + handler.supportedNode()
                        + ": " + previous.getClass().getSimpleName() + ", " + handler.getClass().getSimpleName());
            }
        });
    }

    public NodeHandler get(NodeId node) {
        NodeHandler handler = registry.get(node);
        if (handler == null) {
            throw new UnsupportedOperationException("No handler registered for node: " + node);
        }
        return handler;
    }

    public boolean isSupported(NodeId node) {
        return registry.containsKey(node);
    }
}
