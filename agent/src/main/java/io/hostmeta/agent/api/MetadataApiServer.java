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
package io.hostmeta.agent.api;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.AbstractIdleService;
import io.hostmeta.agent.AgentConfig;
import io.hostmeta.agent.store.MetadataStore;
import io.hostmeta.common.LoggerHelpers;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.glassfish.grizzly.GrizzlyFuture;
import org.glassfish.grizzly.http.server.HttpServer;
import org.glassfish.grizzly.http.server.NetworkListener;
import org.glassfish.grizzly.threadpool.ThreadPoolConfig;

/**
 * The local metadata API: a Grizzly HTTP server whose fixed pool of worker threads all serve one shared
 * {@link Dispatcher}.
 */
@Slf4j
public class MetadataApiServer extends AbstractIdleService {
    /**
     * The local metadata API request format is {@code {host}:{port}/monitoredResource/{id}}.
     */
    public static final String MONITORED_RESOURCE_PREFIX = "/monitoredResource/";
    private static final String WORKER_POOL_NAME = "metadata-api";

    private final String objectId;
    private final Dispatcher dispatcher;
    @Getter
    private final String host;
    @Getter
    private final int port;
    @Getter
    private final int serverThreads;
    private final Duration shutdownTimeout;
    private HttpServer httpServer;

    /**
     * Creates a new instance of the MetadataApiServer class serving the agent's routes.
     *
     * @param config The agent configuration.
     * @param store  The store to answer lookups from. Not owned by this instance.
     */
    public MetadataApiServer(AgentConfig config, MetadataStore store) {
        this(config, new Dispatcher(
                ImmutableMap.<RouteKey, RequestHandler>of(
                        new RouteKey("GET", MONITORED_RESOURCE_PREFIX),
                        new MonitoredResourceHandler(MONITORED_RESOURCE_PREFIX, store, config.isVerboseLogging())),
                config.isVerboseLogging()));
    }

    /**
     * Creates a new instance of the MetadataApiServer class serving the given dispatcher.
     *
     * @param config     The agent configuration.
     * @param dispatcher The dispatcher shared by all worker threads.
     */
    public MetadataApiServer(AgentConfig config, Dispatcher dispatcher) {
        Preconditions.checkNotNull(config, "config");
        this.objectId = "MetadataApiServer";
        this.dispatcher = Preconditions.checkNotNull(dispatcher, "dispatcher");
        this.host = config.getApiHost();
        this.port = config.getApiPort();
        this.serverThreads = config.getApiThreads();
        this.shutdownTimeout = config.getApiShutdownTimeout();
    }

    @Override
    protected void startUp() throws Exception {
        long traceId = LoggerHelpers.traceEnterWithContext(log, this.objectId, "startUp");
        try {
            log.info("Starting metadata API server on {}:{} with {} worker threads.", this.host, this.port, this.serverThreads);
            NetworkListener listener = new NetworkListener(this.objectId, this.host, this.port);
            listener.getTransport().setWorkerThreadPoolConfig(ThreadPoolConfig.defaultConfig()
                    .setPoolName(WORKER_POOL_NAME)
                    .setCorePoolSize(this.serverThreads)
                    .setMaxPoolSize(this.serverThreads));

            HttpServer server = new HttpServer();
            server.addListener(listener);
            server.getServerConfiguration().addHttpHandler(this.dispatcher, "/");
            server.start();
            this.httpServer = server;
        } finally {
            LoggerHelpers.traceLeave(log, this.objectId, "startUp", traceId);
        }
    }

    /**
     * Stops accepting connections and blocks until in-flight requests are drained, or until the shutdown timeout
     * expires and the remaining connections are closed.
     */
    @Override
    protected void shutDown() throws Exception {
        long traceId = LoggerHelpers.traceEnterWithContext(log, this.objectId, "shutDown");
        try {
            log.info("Stopping metadata API server on {}:{}.", this.host, this.port);
            final GrizzlyFuture<HttpServer> shutdown = this.httpServer.shutdown(this.shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS);
            log.info("Awaiting termination of metadata API server.");
            shutdown.get();
            log.info("Metadata API server terminated.");
        } finally {
            LoggerHelpers.traceLeave(log, this.objectId, "shutDown", traceId);
        }
    }

    @Override
    protected String serviceName() {
        return this.objectId;
    }
}
