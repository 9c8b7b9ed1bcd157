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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.gson.JsonPrimitive;
import io.hostmeta.agent.resource.MonitoredResource;
import io.hostmeta.agent.store.Metadata;
import io.hostmeta.agent.store.MetadataStore;
import io.hostmeta.test.common.AssertExtensions;
import io.hostmeta.test.common.IntentionalException;
import java.time.Instant;
import lombok.val;
import org.junit.Assert;
import org.junit.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for the MetadataUpdater class.
 */
public class MetadataUpdaterTests {
    private static final MonitoredResource RESOURCE = new MonitoredResource("docker_container", ImmutableMap.of("container_id", "abc"));

    /**
     * Tests the IDLE -> RUNNING -> STOPPED lifecycle, including repeated and out-of-order calls.
     */
    @Test
    public void testLifecycle() {
        val hooks = newHooks(true);
        val updater = new MetadataUpdater(mock(MetadataStore.class), hooks);
        Assert.assertEquals(MetadataUpdater.State.IDLE, updater.getState());
        Assert.assertEquals("test", updater.getName());

        // Stopping an updater that never started does nothing.
        updater.stop();
        Assert.assertEquals(MetadataUpdater.State.IDLE, updater.getState());
        verify(hooks, never()).stopUpdater();

        updater.start();
        Assert.assertEquals(MetadataUpdater.State.RUNNING, updater.getState());
        updater.start();
        verify(hooks, times(1)).startUpdater(any());

        updater.stop();
        updater.stop();
        updater.close();
        Assert.assertEquals(MetadataUpdater.State.STOPPED, updater.getState());
        verify(hooks, times(1)).stopUpdater();

        // No restart.
        updater.start();
        Assert.assertEquals(MetadataUpdater.State.STOPPED, updater.getState());
        verify(hooks, times(1)).startUpdater(any());
    }

    /**
     * Tests that an updater with an invalid configuration never starts and stays IDLE.
     */
    @Test
    public void testInvalidConfiguration() {
        val hooks = newHooks(false);
        val updater = new MetadataUpdater(mock(MetadataStore.class), hooks);
        updater.start();
        Assert.assertEquals(MetadataUpdater.State.IDLE, updater.getState());
        verify(hooks, never()).startUpdater(any());
        updater.stop();
        verify(hooks, never()).stopUpdater();
    }

    /**
     * Tests that a failure in startUpdater propagates and leaves the updater IDLE.
     */
    @Test
    public void testStartFailure() {
        val hooks = newHooks(true);
        doThrow(new IntentionalException()).when(hooks).startUpdater(any());
        val updater = new MetadataUpdater(mock(MetadataStore.class), hooks);
        AssertExtensions.assertThrows(
                "Start failure was not propagated.",
                updater::start,
                ex -> ex instanceof IntentionalException);
        Assert.assertEquals(MetadataUpdater.State.IDLE, updater.getState());
    }

    /**
     * Tests that the committer handed to the update source writes into the store, and that metadata is handed over
     * exactly once.
     */
    @Test
    public void testCommitter() {
        val store = mock(MetadataStore.class);
        val hooks = newHooks(true);
        val updater = new MetadataUpdater(store, hooks);
        updater.start();
        val captor = ArgumentCaptor.forClass(MetadataCommitter.class);
        verify(hooks).startUpdater(captor.capture());

        val metadata = new Metadata("1", false, Instant.EPOCH, Instant.now(), new JsonPrimitive("payload"));
        val result = new ResourceMetadata(ImmutableList.of("abc", "container.abc"), RESOURCE, metadata);
        val committer = captor.getValue();
        committer.updateResource(result);
        Assert.assertFalse(result.isMetadataTaken());
        committer.updateMetadata(result);
        Assert.assertTrue(result.isMetadataTaken());

        InOrder order = inOrder(store);
        order.verify(store).updateResource(ImmutableList.of("abc", "container.abc"), RESOURCE);
        order.verify(store).updateMetadata(RESOURCE, metadata);

        AssertExtensions.assertThrows(
                "Metadata was committed twice.",
                () -> committer.updateMetadata(result),
                ex -> ex instanceof IllegalStateException);
        verify(store, times(1)).updateMetadata(any(), any());
        updater.stop();
    }

    /**
     * Tests ResourceMetadata argument checks and single handover.
     */
    @Test
    public void testResourceMetadata() {
        AssertExtensions.assertThrows(
                "Empty ids were accepted.",
                () -> new ResourceMetadata(ImmutableList.of(), RESOURCE, Metadata.IGNORED),
                ex -> ex instanceof IllegalArgumentException);

        val result = new ResourceMetadata(ImmutableList.of("abc"), RESOURCE, Metadata.IGNORED);
        Assert.assertSame(Metadata.IGNORED, result.takeMetadata());
        AssertExtensions.assertThrows(
                "Metadata was taken twice.",
                result::takeMetadata,
                ex -> ex instanceof IllegalStateException);
    }

    private static UpdaterHooks newHooks(boolean valid) {
        val hooks = mock(UpdaterHooks.class);
        when(hooks.getName()).thenReturn("test");
        when(hooks.validateConfiguration()).thenReturn(valid);
        return hooks;
    }
}
