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
package io.hostmeta.agent.instance;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.hostmeta.agent.AgentConfig;
import io.hostmeta.agent.resource.MonitoredResource;
import io.hostmeta.agent.store.Metadata;
import io.hostmeta.agent.updater.MetadataCommitter;
import io.hostmeta.agent.updater.PollingMetadataUpdater;
import io.hostmeta.agent.updater.ResourceMetadata;
import io.hostmeta.agent.updater.UpdaterHooks;
import java.time.Duration;
import java.util.List;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Update source for the host the agent runs on. It registers the host's own resource under the empty id, so that
 * {@code GET /monitoredResource/} answers with it. It only maintains the mapping and records no metadata.
 * <p>
 * Polling is delegated to a {@link PollingMetadataUpdater}; this class only adds the instance id check.
 */
@Slf4j
public final class InstanceUpdater implements UpdaterHooks {
    static final String NAME = "InstanceUpdater";
    static final String INSTANCE_ID_LABEL = "instance_id";
    static final String ZONE_LABEL = "zone";
    static final String HOST_RESOURCE_ID = "";

    @Getter
    private final MonitoredResource instanceResource;
    private final PollingMetadataUpdater poller;

    /**
     * Creates a new instance of the InstanceUpdater class.
     *
     * @param config The agent configuration.
     */
    public InstanceUpdater(AgentConfig config) {
        Preconditions.checkNotNull(config, "config");
        this.instanceResource = new MonitoredResource(config.getInstanceResourceType(), ImmutableMap.of(
                INSTANCE_ID_LABEL, config.getInstanceId(),
                ZONE_LABEL, config.getInstanceZone()));
        final MonitoredResource resource = this.instanceResource;
        this.poller = new PollingMetadataUpdater(NAME, config.getInstanceUpdateInterval(), () -> queryInstance(resource));
    }

    @Override
    public String getName() {
        return NAME;
    }

    public Duration getPeriod() {
        return this.poller.getPeriod();
    }

    @Override
    public boolean validateConfiguration() {
        if (Strings.isNullOrEmpty(this.instanceResource.getLabels().get(INSTANCE_ID_LABEL))) {
            log.warn("{}: No instance id configured.", NAME);
            return false;
        }
        return this.poller.validateConfiguration();
    }

    @Override
    public void startUpdater(MetadataCommitter committer) {
        this.poller.startUpdater(committer);
    }

    @Override
    public void stopUpdater() {
        this.poller.stopUpdater();
    }

    @Override
    public String toString() {
        return String.format("InstanceUpdater(%s, %s)", this.instanceResource, this.poller);
    }

    private static List<ResourceMetadata> queryInstance(MonitoredResource instanceResource) {
        return ImmutableList.of(new ResourceMetadata(ImmutableList.of(HOST_RESOURCE_ID), instanceResource, Metadata.IGNORED));
    }
}
