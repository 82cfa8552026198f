package com.meltwater.rabbitdriver;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Sets;
import com.meltwater.rabbitdriver.util.Logger;

import java.util.Map;
import java.util.Set;

/**
 * Connection and consume settings of a {@link com.meltwater.rabbitdriver.impl.RabbitDriver}.
 *
 * This object can be built programmatically by using the various {@link DriverSettings.Builder}
 * withXX methods or by supplying a JSON formatted String to {@link DriverSettings#fromJson(String)}.
 * Field names may be unquoted and the surrounding braces may be left out, e.g.
 * <pre>heartbeat:5, pre_fetch_count:10, app_id:"billing"</pre>
 *
 * The available JSON parameter names are included as String constants and they directly correspond to the names
 * of the fields in this class. The {@link #toString()} method shows the JSON representation and can be parsed back.
 *
 * NOTE 0 means forever for all timeout settings.
 */
public class DriverSettings {

    private static final Logger log = new Logger(DriverSettings.class);
    private static final ObjectMapper mapper = new ObjectMapper()
            .configure(JsonParser.Feature.ALLOW_UNQUOTED_FIELD_NAMES, true)
            .configure(JsonParser.Feature.STRICT_DUPLICATE_DETECTION, true);

    public static final int DEFAULT_HEARTBEAT               = 10; //in seconds
    public static final int DEFAULT_CONNECTION_TIMEOUT      = 30_000;
    public static final int DEFAULT_HANDSHAKE_TIMEOUT       = 10_000;
    public static final int DEFAULT_SHUTDOWN_TIMEOUT        = 10_000;
    public static final int DEFAULT_FRAME_MAX               = 0; //0 = Infinite
    public static final int DEFAULT_PRE_FETCH               = 0; //no basic.qos
    public static final String DEFAULT_APP_ID               = "unknown";

    public final static String heartbeat_param                 = "heartbeat";
    public final static String connection_timeout_param        = "connection_timeout_millis";
    public final static String handshake_timeout_millis_param  = "handshake_timeout_millis";
    public final static String shutdown_timeout_param          = "shutdown_timeout_millis";
    public final static String frame_max_param                 = "frame_max";
    public final static String pre_fetch_count_param           = "pre_fetch_count";
    public final static String app_id_param                    = "app_id";

    private static final Set<String> KNOWN_PARAMS = Sets.newHashSet(
            heartbeat_param, connection_timeout_param, handshake_timeout_millis_param, shutdown_timeout_param,
            frame_max_param, pre_fetch_count_param, app_id_param);

    public final int heartbeat;
    public final int connection_timeout_millis;
    public final int handshake_timeout_millis;
    public final int shutdown_timeout_millis;
    public final int frame_max;
    public final int pre_fetch_count;
    public final String app_id;

    private DriverSettings(Builder b) {
        this.heartbeat = b.heartbeat;
        this.connection_timeout_millis = b.connectionTimeout;
        this.handshake_timeout_millis = b.handshakeTimeout;
        this.shutdown_timeout_millis = b.shutdownTimeout;
        this.frame_max = b.frameMax;
        this.pre_fetch_count = b.preFetchCount;
        this.app_id = b.appId;
    }

    public static DriverSettings defaults() {
        return new Builder().build();
    }

    /**
     * @throws IllegalArgumentException if the string is not valid JSON, has duplicate or unknown fields or wrongly typed values
     */
    public static DriverSettings fromJson(String settingsJSONString) {
        String json = settingsJSONString.trim();
        if (!json.startsWith("{")) {
            json = "{" + json + "}";
        }
        try {
            Map<String, Object> map = mapper.readValue(json, new TypeReference<Map<String, Object>>() {});
            Set<String> unknown = Sets.difference(map.keySet(), KNOWN_PARAMS);
            if (!unknown.isEmpty()) {
                throw new IllegalArgumentException("Unknown settings " + unknown);
            }
            return new Builder(map).build();
        } catch (JsonProcessingException | ClassCastException e) {
            log.errorWithParams("Could not parse settings string.", e, "settings", settingsJSONString);
            throw new IllegalArgumentException(e);
        }
    }

    public Builder toBuilder() {
        return new Builder(asMap());
    }

    private Map<String, Object> asMap() {
        return ImmutableMap.<String, Object>builder()
                .put(heartbeat_param, heartbeat)
                .put(connection_timeout_param, connection_timeout_millis)
                .put(handshake_timeout_millis_param, handshake_timeout_millis)
                .put(shutdown_timeout_param, shutdown_timeout_millis)
                .put(frame_max_param, frame_max)
                .put(pre_fetch_count_param, pre_fetch_count)
                .put(app_id_param, app_id)
                .build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return asMap().equals(((DriverSettings) o).asMap());
    }

    @Override
    public int hashCode() {
        return asMap().hashCode();
    }

    @Override
    public String toString() {
        try {
            return mapper.writeValueAsString(asMap());
        } catch (JsonProcessingException e) {
            return e.toString();
        }
    }

    public static class Builder {

        private int heartbeat;
        private int connectionTimeout;
        private int handshakeTimeout;
        private int shutdownTimeout;
        private int frameMax;
        private int preFetchCount;
        private String appId;

        public Builder() {
            this(ImmutableMap.of());
        }

        private Builder(Map<String, Object> map) {
            heartbeat = (int) map.getOrDefault(heartbeat_param, DEFAULT_HEARTBEAT);
            connectionTimeout = (int) map.getOrDefault(connection_timeout_param, DEFAULT_CONNECTION_TIMEOUT);
            handshakeTimeout = (int) map.getOrDefault(handshake_timeout_millis_param, DEFAULT_HANDSHAKE_TIMEOUT);
            shutdownTimeout = (int) map.getOrDefault(shutdown_timeout_param, DEFAULT_SHUTDOWN_TIMEOUT);
            frameMax = (int) map.getOrDefault(frame_max_param, DEFAULT_FRAME_MAX);
            preFetchCount = (int) map.getOrDefault(pre_fetch_count_param, DEFAULT_PRE_FETCH);
            appId = (String) map.getOrDefault(app_id_param, DEFAULT_APP_ID);
        }

        public DriverSettings build() {
            return new DriverSettings(this);
        }

        public Builder withHeartbeatSecs(int heartbeat) {
            assert heartbeat >= 0;
            this.heartbeat = heartbeat;
            return this;
        }

        public Builder withConnectionTimeoutMillis(int connectionTimeout) {
            assert connectionTimeout >= 0;
            this.connectionTimeout = connectionTimeout;
            return this;
        }

        public Builder withHandshakeTimeoutMillis(int handshakeTimeout) {
            assert handshakeTimeout >= 0;
            this.handshakeTimeout = handshakeTimeout;
            return this;
        }

        public Builder withShutdownTimeoutMillis(int shutdownTimeout) {
            assert shutdownTimeout >= 0;
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        public Builder withFrameMax(int frameMax) {
            this.frameMax = frameMax;
            return this;
        }

        public Builder withPreFetchCount(int preFetchCount) {
            assert preFetchCount >= 0;
            this.preFetchCount = preFetchCount;
            return this;
        }

        public Builder withAppId(String appId) {
            assert appId != null;
            this.appId = appId;
            return this;
        }
    }
}
