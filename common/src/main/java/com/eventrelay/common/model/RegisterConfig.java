/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.eventrelay.common.model;

import com.eventrelay.common.util.JsonUtil;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.File;
import java.io.IOException;

/**
 * Configuration for an event register: broker coordinates, queue names, retry budgets and
 * backoff parameters. Loaded by an external loader (or {@link #fromFile}) and handed to the
 * register once at construction.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RegisterConfig {

    public enum BrokerType {
        RABBITMQ, IN_MEMORY
    }

    @JsonProperty("broker_type")
    private BrokerType brokerType = BrokerType.RABBITMQ;

    @JsonProperty("host")
    private String host = "localhost";

    @JsonProperty("port")
    private int port = 5672;

    @JsonProperty("virtual_host")
    private String virtualHost = "/";

    @JsonProperty("username")
    private String username = "guest";

    @JsonProperty("password")
    private String password = "guest";

    @JsonProperty("queue_name")
    private String queueName = "relayer.events";

    @JsonProperty("dead_letter_queue")
    private String deadLetterQueue;

    @JsonProperty("connection_name")
    private String connectionName = "event-relay";

    @JsonProperty("connection_timeout_ms")
    private int connectionTimeoutMs = 30000;

    @JsonProperty("heartbeat_seconds")
    private int heartbeatSeconds = 60;

    @JsonProperty("ssl_enabled")
    private boolean sslEnabled = false;

    @JsonProperty("confirm_timeout_ms")
    private long confirmTimeoutMs = 5000;

    @JsonProperty("publish_max_attempts")
    private int publishMaxAttempts = 5;

    @JsonProperty("backoff_base_ms")
    private long backoffBaseMs = 200;

    @JsonProperty("backoff_max_ms")
    private long backoffMaxMs = 30000;

    @JsonProperty("reconnect_max_attempts")
    private int reconnectMaxAttempts = 0;

    @JsonProperty("max_attempts")
    private int maxAttempts = 5;

    @JsonProperty("prefetch_count")
    private int prefetchCount = 1;

    @JsonProperty("channel_pool_size")
    private int channelPoolSize = 8;

    @JsonProperty("dedup_window_ms")
    private long dedupWindowMs = 600_000;

    @JsonProperty("shutdown_timeout_ms")
    private long shutdownTimeoutMs = 10_000;

    @JsonProperty("declare_dead_letter_arguments")
    private boolean declareDeadLetterArguments = true;

    public RegisterConfig() {}

    public static RegisterConfig fromFile(File file) throws IOException {
        RegisterConfig config = JsonUtil.fromFile(file, RegisterConfig.class);
        config.validate();
        return config;
    }

    /**
     * Reject values the register cannot work with.
     *
     * @throws IllegalArgumentException naming the first offending property
     */
    public void validate() {
        require(brokerType != null, "broker_type is required");
        require(queueName != null && !queueName.isBlank(), "queue_name is required");
        require(!getDeadLetterQueue().equals(queueName), "dead_letter_queue must differ from queue_name");
        require(port > 0 && port < 65536, "port out of range: " + port);
        require(confirmTimeoutMs > 0, "confirm_timeout_ms must be > 0");
        require(publishMaxAttempts >= 1, "publish_max_attempts must be >= 1");
        require(backoffBaseMs >= 0, "backoff_base_ms must be >= 0");
        require(backoffMaxMs >= backoffBaseMs, "backoff_max_ms must be >= backoff_base_ms");
        require(reconnectMaxAttempts >= 0, "reconnect_max_attempts must be >= 0");
        require(maxAttempts >= 0, "max_attempts must be >= 0");
        require(prefetchCount >= 0, "prefetch_count must be >= 0");
        require(channelPoolSize >= 2, "channel_pool_size must be >= 2");
        require(dedupWindowMs >= 0, "dedup_window_ms must be >= 0");
    }

    private static void require(boolean condition, String message) {
        if (!condition) throw new IllegalArgumentException(message);
    }

    public BrokerType getBrokerType() { return brokerType; }
    public void setBrokerType(BrokerType brokerType) { this.brokerType = brokerType; }
    public String getHost() { return host; }
    public void setHost(String host) { this.host = host; }
    public int getPort() { return port; }
    public void setPort(int port) { this.port = port; }
    public String getVirtualHost() { return virtualHost; }
    public void setVirtualHost(String virtualHost) { this.virtualHost = virtualHost; }
    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public String getQueueName() { return queueName; }
    public void setQueueName(String queueName) { this.queueName = queueName; }

    /** Defaults to {@code <queue_name>.dlq}. */
    public String getDeadLetterQueue() {
        return deadLetterQueue != null && !deadLetterQueue.isBlank() ? deadLetterQueue : queueName + ".dlq";
    }

    public void setDeadLetterQueue(String deadLetterQueue) { this.deadLetterQueue = deadLetterQueue; }
    public String getConnectionName() { return connectionName; }
    public void setConnectionName(String connectionName) { this.connectionName = connectionName; }
    public int getConnectionTimeoutMs() { return connectionTimeoutMs; }
    public void setConnectionTimeoutMs(int connectionTimeoutMs) { this.connectionTimeoutMs = connectionTimeoutMs; }
    public int getHeartbeatSeconds() { return heartbeatSeconds; }
    public void setHeartbeatSeconds(int heartbeatSeconds) { this.heartbeatSeconds = heartbeatSeconds; }
    public boolean isSslEnabled() { return sslEnabled; }
    public void setSslEnabled(boolean sslEnabled) { this.sslEnabled = sslEnabled; }
    public long getConfirmTimeoutMs() { return confirmTimeoutMs; }
    public void setConfirmTimeoutMs(long confirmTimeoutMs) { this.confirmTimeoutMs = confirmTimeoutMs; }
    public int getPublishMaxAttempts() { return publishMaxAttempts; }
    public void setPublishMaxAttempts(int publishMaxAttempts) { this.publishMaxAttempts = publishMaxAttempts; }
    public long getBackoffBaseMs() { return backoffBaseMs; }
    public void setBackoffBaseMs(long backoffBaseMs) { this.backoffBaseMs = backoffBaseMs; }
    public long getBackoffMaxMs() { return backoffMaxMs; }
    public void setBackoffMaxMs(long backoffMaxMs) { this.backoffMaxMs = backoffMaxMs; }
    public int getReconnectMaxAttempts() { return reconnectMaxAttempts; }
    public void setReconnectMaxAttempts(int reconnectMaxAttempts) { this.reconnectMaxAttempts = reconnectMaxAttempts; }
    public int getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
    public int getPrefetchCount() { return prefetchCount; }
    public void setPrefetchCount(int prefetchCount) { this.prefetchCount = prefetchCount; }
    public int getChannelPoolSize() { return channelPoolSize; }
    public void setChannelPoolSize(int channelPoolSize) { this.channelPoolSize = channelPoolSize; }
    public long getDedupWindowMs() { return dedupWindowMs; }
    public void setDedupWindowMs(long dedupWindowMs) { this.dedupWindowMs = dedupWindowMs; }
    public long getShutdownTimeoutMs() { return shutdownTimeoutMs; }
    public void setShutdownTimeoutMs(long shutdownTimeoutMs) { this.shutdownTimeoutMs = shutdownTimeoutMs; }
    public boolean isDeclareDeadLetterArguments() { return declareDeadLetterArguments; }
    public void setDeclareDeadLetterArguments(boolean declareDeadLetterArguments) {
        this.declareDeadLetterArguments = declareDeadLetterArguments;
    }

    @Override
    public String toString() {
        return "RegisterConfig{" + brokerType + " " + username + "@" + host + ":" + port + virtualHost
                + ", queue='" + queueName + "', dlq='" + getDeadLetterQueue() + "'}";
    }
}
