package com.tsrouter.api;

import com.tsrouter.config.NodeConfig;
import com.tsrouter.registry.RegistrySnapshot;
import com.tsrouter.service.RouterService;
import org.apache.catalina.connector.Connector;
import org.apache.coyote.AbstractProtocol;
import org.apache.coyote.ProtocolHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.web.embedded.tomcat.TomcatServletWebServerFactory;
import org.springframework.boot.web.server.WebServerFactoryCustomizer;
import org.springframework.stereotype.Component;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.List;

/**
 * Opens one Tomcat connector per listening node. The first node takes the
 * primary connector; every other node gets an additional one. Idle client
 * connections are closed after the node's idle timeout.
 */
@Component
public class NodeConnectorCustomizer implements WebServerFactoryCustomizer<TomcatServletWebServerFactory> {

    private static final Logger logger = LoggerFactory.getLogger(NodeConnectorCustomizer.class);

    @Autowired
    private RouterService routerService;

    @Override
    public void customize(TomcatServletWebServerFactory factory) {
        RegistrySnapshot snapshot = routerService.getSnapshot();
        List<NodeConfig> nodes = new ArrayList<>(snapshot.getNodes().values());
        if (nodes.isEmpty()) {
            nodes.add(snapshot.getFallbackNode());
        }

        NodeConfig primary = nodes.get(0);
        factory.setPort(primary.getPort());
        if (!primary.getHost().isEmpty()) {
            factory.setAddress(resolve(primary.getHost()));
        }
        factory.addConnectorCustomizers(connector -> setKeepAliveTimeout(connector, primary));
        logger.info("Node {} listening on {}", primary.getName(), primary.getListenAddr());

        for (NodeConfig node : nodes.subList(1, nodes.size())) {
            Connector connector = new Connector(TomcatServletWebServerFactory.DEFAULT_PROTOCOL);
            connector.setPort(node.getPort());
            if (!node.getHost().isEmpty()) {
                connector.setProperty("address", node.getHost());
            }
            setKeepAliveTimeout(connector, node);
            factory.addAdditionalTomcatConnectors(connector);
            logger.info("Node {} listening on {}", node.getName(), node.getListenAddr());
        }
    }

    private static void setKeepAliveTimeout(Connector connector, NodeConfig node) {
        ProtocolHandler handler = connector.getProtocolHandler();
        if (handler instanceof AbstractProtocol) {
            ((AbstractProtocol<?>) handler).setKeepAliveTimeout(node.getIdleTimeout() * 1000);
        }
    }

    private static InetAddress resolve(String host) {
        try {
            return InetAddress.getByName(host);
        } catch (UnknownHostException e) {
            throw new IllegalStateException("Cannot resolve listen host " + host, e);
        }
    }
}
