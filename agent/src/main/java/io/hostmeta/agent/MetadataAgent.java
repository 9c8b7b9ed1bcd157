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

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.Service;
import io.hostmeta.agent.api.MetadataApiServer;
import io.hostmeta.agent.store.InMemoryMetadataStore;
import io.hostmeta.agent.store.MetadataStore;
import io.hostmeta.agent.updater.MetadataUpdater;
import io.hostmeta.agent.updater.UpdaterHooks;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.annotation.concurrent.GuardedBy;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * The agent process: the store, the update sources writing into it, and the API server reading from it.
 * The store outlives both; updaters and the server only hold references to it.
 */
@Slf4j
public class MetadataAgent implements AutoCloseable {
    @Getter
    private final AgentConfig config;
    @Getter
    private final MetadataStore store;
    @Getter
    private final MetadataApiServer apiServer;
    @GuardedBy("updaters")
    private final List<MetadataUpdater> updaters;
    private final AtomicBoolean closed;

    public MetadataAgent(AgentConfig config) {
        this(config, new InMemoryMetadataStore());
    }

    public MetadataAgent(AgentConfig config, MetadataStore store) {
        this.config = Preconditions.checkNotNull(config, "config");
        this.store = Preconditions.checkNotNull(store, "store");
        this.apiServer = new MetadataApiServer(config, store);
        this.updaters = new ArrayList<>();
        this.closed = new AtomicBoolean();
    }

    /**
     * Registers an update source. Must be called before {@link #start()}.
     *
     * @param hooks The update source.
     * @return The updater driving it.
     */
    public MetadataUpdater addUpdater(UpdaterHooks hooks) {
        Preconditions.checkState(this.apiServer.state() == Service.State.NEW, "Cannot add updaters once the agent has started.");
        MetadataUpdater updater = new MetadataUpdater(this.store, hooks);
        synchronized (this.updaters) {
            this.updaters.add(updater);
        }
        return updater;
    }

    /**
     * Starts every updater, then the API server. An updater that is misconfigured or fails to start is logged and
     * left behind; it does not prevent the others or the server from running.
     */
    public void start() {
        for (MetadataUpdater updater : getUpdaters()) {
            try {
                updater.start();
            } catch (RuntimeException ex) {
                log.error("{}: Failed to start.", updater.getName(), ex);
            }
        }

        this.apiServer.startAsync().awaitRunning();
        log.info("Metadata agent is serving on {}:{}.", this.apiServer.getHost(), this.apiServer.getPort());
    }

    /**
     * Blocks until the API server has terminated.
     */
    public void awaitTerminated() {
        this.apiServer.awaitTerminated();
    }

    public List<MetadataUpdater> getUpdaters() {
        synchronized (this.updaters) {
            return new ArrayList<>(this.updaters);
        }
    }

    @Override
    public void close() {
        if (!this.closed.compareAndSet(false, true)) {
            return;
        }

        for (MetadataUpdater updater : getUpdaters()) {
            try {
                updater.stop();
            } catch (RuntimeException ex) {
                log.error("{}: Failed to stop.", updater.getName(), ex);
            }
        }
        this.apiServer.stopAsync();
        try {
            this.apiServer.awaitTerminated();
        } catch (IllegalStateException ex) {
            log.warn("API server did not terminate cleanly.", this.apiServer.failureCause());
        }
        log.info("Metadata agent closed.");
    }
}
