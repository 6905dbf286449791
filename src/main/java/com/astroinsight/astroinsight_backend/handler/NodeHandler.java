package com.astroinsight.astroinsight_backend.handler;

import com.astroinsight.astroinsight_backend.model.session.NodeId;
import com.astroinsight.astroinsight_backend.model.session.Session;

public interface NodeHandler {

    NodeId supportedNode();

    // Reads the session, returns the update and the next node; never writes the session itself
    NodeResult handle(Session session, String userInput);
}
