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
package io.hostmeta.agent.store;

import com.google.common.collect.ImmutableMap;
import io.hostmeta.agent.resource.MonitoredResource;
import java.util.List;

/**
 * Shared mapping from identifiers to monitored resources, and from monitored resources to their metadata.
 * Implementations must be safe for concurrent use by any number of readers and writers; callers take no locks.
 */
public interface MetadataStore {
    /**
     * Looks up the resource registered under the given id.
     *
     * @param id The id to look up.
     * @return The resource.
     * @throws ResourceNotFoundException If no resource is registered for id.
     */
    MonitoredResource lookupResource(String id) throws ResourceNotFoundException;

    /**
     * Registers the given resource under each of the given ids, replacing any previous mapping for them.
     *
     * @param ids      The alias ids.
     * @param resource The resource.
     */
    void updateResource(List<String> ids, MonitoredResource resource);

    /**
     * Records metadata for the given resource. The store takes ownership of metadata; callers must not hold on to it.
     * An existing entry is only replaced by a fresher one, and {@link Metadata#IGNORED} is never recorded.
     *
     * @param resource The resource the metadata describes.
     * @param metadata The metadata.
     */
    void updateMetadata(MonitoredResource resource, Metadata metadata);

    /**
     * Gets a point-in-time snapshot of all recorded metadata.
     *
     * @return An immutable map of resource to metadata.
     */
    ImmutableMap<MonitoredResource, Metadata> getMetadataMap();
}
