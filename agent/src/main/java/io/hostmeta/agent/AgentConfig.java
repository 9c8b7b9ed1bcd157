/**
 * Copyright Pravega Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.hostmeta.agent;

import io.hostmeta.common.util.ConfigBuilder;
import io.hostmeta.common.util.Property;
import io.hostmeta.common.util.TypedProperties;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import lombok.Getter;
import lombok.ToString;

/**
 * Agent configuration.
 */
@ToString
public class AgentConfig {
    //region Config Names

    public static final String PROPERTY_FILE = "agent.configurationFile";
    public static final String PROPERTY_FILE_DEFAULT_PATH = "./config/agent.properties";

    public static final Property<Boolean> VERBOSE_LOGGING = Property.named("verboseLogging", false);
    public static final Property<String> API_HOST = Property.named("api.host", "0.0.0.0");
    public static final Property<Integer> API_PORT = Property.named("api.port", 8000);
    public static final Property<Integer> API_THREADS = Property.named("api.threads", 3);
    public static final Property<Integer> API_SHUTDOWN_TIMEOUT_SECONDS = Property.named("api.shutdownTimeoutSeconds", 30);
    public static final Property<Integer> INSTANCE_UPDATE_INTERVAL_SECONDS = Property.named("instance.updateIntervalSeconds", 60);
    public static final Property<String> INSTANCE_RESOURCE_TYPE = Property.named("instance.resourceType", "gce_instance");
    public static final Property<String> INSTANCE_ID = Property.named("instance.id", "");
    public static final Property<String> INSTANCE_ZONE = Property.named("instance.zone", "");

    private static final String COMPONENT_CODE = "agent";

    //endregion

    //region Members

    /**
     * Whether to log every API request and lookup.
     */
    @Getter
    private final boolean verboseLogging;

    /**
     * The address the metadata API binds to.
     */
    @Getter
    private final String apiHost;

    @Getter
    private final int apiPort;

    /**
     * The number of API worker threads.
     */
    @Getter
    private final int apiThreads;

    /**
     * How long the API server waits for in-flight requests when shutting down.
     */
    @Getter
    private final Duration apiShutdownTimeout;

    /**
     * The instance updater polling period. Zero disables the instance updater.
     */
    @Getter
    private final Duration instanceUpdateInterval;

    @Getter
    private final String instanceResourceType;
    @Getter
    private final String instanceId;
    @Getter
    private final String instanceZone;

    //endregion

    //region Constructor

    private AgentConfig(TypedProperties properties) {
        this.verboseLogging = properties.getBoolean(VERBOSE_LOGGING);
        this.apiHost = properties.get(API_HOST);
        this.apiPort = properties.getNonNegativeInt(API_PORT);
        this.apiThreads = properties.getPositiveInt(API_THREADS);
        this.apiShutdownTimeout = Duration.ofSeconds(properties.getPositiveInt(API_SHUTDOWN_TIMEOUT_SECONDS));
        this.instanceUpdateInterval = properties.getDuration(INSTANCE_UPDATE_INTERVAL_SECONDS, ChronoUnit.SECONDS);
        this.instanceResourceType = properties.get(INSTANCE_RESOURCE_TYPE);
        this.instanceId = properties.get(INSTANCE_ID);
        this.instanceZone = properties.get(INSTANCE_ZONE);
    }

    /**
     * Creates a new ConfigBuilder that can be used to create instances of this class.
     *
     * @return A new Builder for this class.
     */
    public static ConfigBuilder<AgentConfig> builder() {
        return new ConfigBuilder<>(COMPONENT_CODE, AgentConfig::new);
    }

    //endregion
}
