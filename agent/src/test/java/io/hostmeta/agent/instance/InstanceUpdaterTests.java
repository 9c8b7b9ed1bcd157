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

import com.google.common.collect.ImmutableMap;
import io.hostmeta.agent.AgentConfig;
import io.hostmeta.agent.resource.MonitoredResource;
import io.hostmeta.agent.store.InMemoryMetadataStore;
import io.hostmeta.agent.updater.MetadataCommitter;
import io.hostmeta.agent.updater.MetadataUpdater;
import io.hostmeta.agent.updater.ResourceMetadata;
import io.hostmeta.test.common.AssertExtensions;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import lombok.val;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.Timeout;
import org.mockito.ArgumentCaptor;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;

/**
 * Unit tests for the InstanceUpdater class.
 */
public class InstanceUpdaterTests {
    @Rule
    public final Timeout globalTimeout = new Timeout(30, TimeUnit.SECONDS);

    /**
     * Tests that the host resource is registered under the empty id and that no metadata is recorded for it.
     */
    @Test
    public void testRegistersHostResource() throws Exception {
        val config = AgentConfig.builder()
                .with(AgentConfig.INSTANCE_ID, "1234")
                .with(AgentConfig.INSTANCE_ZONE, "us-central1-a")
                .with(AgentConfig.INSTANCE_UPDATE_INTERVAL_SECONDS, 3600)
                .build();
        val expected = new MonitoredResource("gce_instance", ImmutableMap.of("instance_id", "1234", "zone", "us-central1-a"));
        val instanceUpdater = new InstanceUpdater(config);
        Assert.assertEquals(expected, instanceUpdater.getInstanceResource());
        Assert.assertEquals(Duration.ofHours(1), instanceUpdater.getPeriod());

        val store = new InMemoryMetadataStore();
        val updater = new MetadataUpdater(store, instanceUpdater);
        updater.start();
        Assert.assertEquals(MetadataUpdater.State.RUNNING, updater.getState());
        AssertExtensions.assertEventuallyTrue("Host resource was not registered.", () -> {
            try {
                return expected.equals(store.lookupResource(InstanceUpdater.HOST_RESOURCE_ID));
            } catch (Exception ex) {
                return false;
            }
        }, Duration.ofSeconds(10));
        updater.stop();
        Assert.assertTrue(store.getMetadataMap().isEmpty());
    }

    /**
     * Tests that start and stop drive the underlying poller, which commits the host resource on its first poll.
     */
    @Test
    public void testDelegatesToPoller() {
        val config = AgentConfig.builder()
                .with(AgentConfig.INSTANCE_ID, "1234")
                .with(AgentConfig.INSTANCE_UPDATE_INTERVAL_SECONDS, 3600)
                .build();
        val instanceUpdater = new InstanceUpdater(config);
        Assert.assertEquals(InstanceUpdater.NAME, instanceUpdater.getName());
        Assert.assertTrue(instanceUpdater.validateConfiguration());

        val committer = mock(MetadataCommitter.class);
        instanceUpdater.startUpdater(committer);
        val captor = ArgumentCaptor.forClass(ResourceMetadata.class);
        verify(committer, timeout(10000)).updateMetadata(captor.capture());
        instanceUpdater.stopUpdater();

        val result = captor.getValue();
        Assert.assertEquals(InstanceUpdater.HOST_RESOURCE_ID, result.getIds().get(0));
        Assert.assertEquals(instanceUpdater.getInstanceResource(), result.getResource());
        verify(committer).updateResource(result);
        verifyNoMoreInteractions(committer);
    }

    /**
     * Tests configurations that prevent the updater from running.
     */
    @Test
    public void testInvalidConfiguration() {
        val noId = AgentConfig.builder().with(AgentConfig.INSTANCE_ZONE, "us-central1-a").build();
        Assert.assertFalse(new InstanceUpdater(noId).validateConfiguration());

        val disabled = AgentConfig.builder()
                .with(AgentConfig.INSTANCE_ID, "1234")
                .with(AgentConfig.INSTANCE_UPDATE_INTERVAL_SECONDS, 0)
                .build();
        val updater = new MetadataUpdater(new InMemoryMetadataStore(), new InstanceUpdater(disabled));
        updater.start();
        Assert.assertEquals(MetadataUpdater.State.IDLE, updater.getState());
    }
}
