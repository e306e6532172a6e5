/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.eventrelay.messaging.rabbitmq;

import com.eventrelay.common.exception.ConnectionException;
import com.eventrelay.common.model.RegisterConfig;
import com.eventrelay.messaging.transport.BrokerConnection;
import com.eventrelay.messaging.transport.BrokerConnectionFactory;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.PossibleAuthenticationFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import java.io.IOException;
import java.security.NoSuchAlgorithmException;
import java.util.concurrent.TimeoutException;

/**
 * RabbitMQ transport using AMQP 0-9-1.
 *
 * <p>The client library's automatic recovery is switched off: reconnects are driven by
 * {@code ConnectionManager} so that pooled channels and consumers are rebuilt in one place.
 * With {@code ssl_enabled} the JVM default trust store is used and the port moves to 5671
 * unless one was configured explicitly.</p>
 */
public class RabbitMQConnectionFactory implements BrokerConnectionFactory {

    private static final Logger log = LoggerFactory.getLogger(RabbitMQConnectionFactory.class);

    private final RegisterConfig config;
    private final ConnectionFactory factory;

    public RabbitMQConnectionFactory(RegisterConfig config) {
        this.config = config;
        this.factory = createFactory(config);
    }

    static ConnectionFactory createFactory(RegisterConfig config) {
        ConnectionFactory factory = new ConnectionFactory();
        factory.setHost(config.getHost());
        factory.setPort(config.getPort());
        factory.setVirtualHost(config.getVirtualHost());
        factory.setUsername(config.getUsername());
        factory.setPassword(config.getPassword());
        factory.setConnectionTimeout(config.getConnectionTimeoutMs());
        factory.setRequestedHeartbeat(config.getHeartbeatSeconds());
        factory.setAutomaticRecoveryEnabled(false);
        factory.setTopologyRecoveryEnabled(false);

        if (config.isSslEnabled()) {
            try {
                factory.useSslProtocol(SSLContext.getDefault());
                factory.enableHostnameVerification();
            } catch (NoSuchAlgorithmException e) {
                throw new IllegalStateException("No default SSLContext available", e);
            }
            if (config.getPort() == ConnectionFactory.DEFAULT_AMQP_PORT) {
                factory.setPort(ConnectionFactory.DEFAULT_AMQP_OVER_SSL_PORT);
            }
            log.info("RabbitMQ SSL/TLS enabled");
        }
        return factory;
    }

    @Override
    public BrokerConnection newConnection(String connectionName) throws IOException, TimeoutException {
        try {
            var connection = factory.newConnection(connectionName);
            log.info("RabbitMQ connection '{}' opened to {}", connectionName, describe());
            return new RabbitMQConnection(connection);
        } catch (PossibleAuthenticationFailureException e) {
            throw ConnectionException.credentials(config.getUsername(), e);
        }
    }

    @Override
    public String describe() {
        return "amqp://" + factory.getHost() + ":" + factory.getPort() + factory.getVirtualHost();
    }
}
