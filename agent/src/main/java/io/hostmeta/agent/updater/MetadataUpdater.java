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
package io.hostmeta.agent.updater;

import com.google.common.base.Preconditions;
import io.hostmeta.agent.store.MetadataStore;
import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Drives the lifecycle of a single update source and binds its commits to the metadata store.
 * <p>
 * The lifecycle is IDLE -> RUNNING -> STOPPED. {@link #start()} only leaves IDLE if the update source's configuration
 * is valid; otherwise the updater stays IDLE and never runs. {@link #stop()} is idempotent and has no effect unless
 * the updater is RUNNING. An updater cannot be restarted.
 */
@Slf4j
@ThreadSafe
public final class MetadataUpdater implements AutoCloseable {
    @Getter
    private final String name;
    private final MetadataStore store;
    private final UpdaterHooks hooks;
    private final MetadataCommitter committer;
    @GuardedBy("this")
    private State state;

    /**
     * Creates a new instance of the MetadataUpdater class.
     *
     * @param store The store to commit into. Not owned by this instance.
     * @param hooks The update source.
     */
    public MetadataUpdater(MetadataStore store, UpdaterHooks hooks) {
        this.store = Preconditions.checkNotNull(store, "store");
        this.hooks = Preconditions.checkNotNull(hooks, "hooks");
        this.name = hooks.getName();
        this.committer = new StoreCommitter();
        this.state = State.IDLE;
    }

    /**
     * Starts the update source if its configuration is valid.
     *
     * @throws RuntimeException If the update source failed to start. The updater remains IDLE.
     */
    public synchronized void start() {
        if (this.state != State.IDLE) {
            log.warn("{}: Ignoring start request; updater is {}.", this.name, this.state);
            return;
        }

        if (!this.hooks.validateConfiguration()) {
            log.error("{}: Invalid configuration; updater will not run.", this.name);
            return;
        }

        this.hooks.startUpdater(this.committer);
        this.state = State.RUNNING;
        log.info("{}: Started.", this.name);
    }

    /**
     * Stops the update source. Blocks until it has stopped committing.
     */
    public synchronized void stop() {
        if (this.state != State.RUNNING) {
            return;
        }

        log.info("{}: Stopping.", this.name);
        try {
            this.hooks.stopUpdater();
        } finally {
            this.state = State.STOPPED;
        }
        log.info("{}: Stopped.", this.name);
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * Gets the current lifecycle state.
     *
     * @return The state.
     */
    public synchronized State getState() {
        return this.state;
    }

    @Override
    public String toString() {
        return String.format("MetadataUpdater(%s, %s)", this.name, getState());
    }

    public enum State {
        IDLE,
        RUNNING,
        STOPPED
    }

    private class StoreCommitter implements MetadataCommitter {
        @Override
        public void updateResource(ResourceMetadata result) {
            store.updateResource(result.getIds(), result.getResource());
        }

        @Override
        public void updateMetadata(ResourceMetadata result) {
            store.updateMetadata(result.getResource(), result.takeMetadata());
        }
    }
}
