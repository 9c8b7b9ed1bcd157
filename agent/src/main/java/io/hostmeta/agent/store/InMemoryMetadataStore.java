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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import io.hostmeta.agent.resource.MonitoredResource;
import io.hostmeta.common.Exceptions;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;
import lombok.extern.slf4j.Slf4j;

/**
 * Volatile, process-owned {@link MetadataStore}. The id map and the metadata map are guarded by separate locks,
 * so lookups never wait on metadata writes.
 */
@Slf4j
@ThreadSafe
public class InMemoryMetadataStore implements MetadataStore {
    private final Object resourceLock = new Object();
    private final Object metadataLock = new Object();
    @GuardedBy("resourceLock")
    private final Map<String, MonitoredResource> resourceMap = new HashMap<>();
    @GuardedBy("metadataLock")
    private final Map<MonitoredResource, Metadata> metadataMap = new HashMap<>();

    @Override
    public MonitoredResource lookupResource(String id) throws ResourceNotFoundException {
        Preconditions.checkNotNull(id, "id");
        MonitoredResource resource;
        synchronized (this.resourceLock) {
            resource = this.resourceMap.get(id);
        }

        if (resource == null) {
            throw new ResourceNotFoundException(id);
        }
        return resource;
    }

    @Override
    public void updateResource(List<String> ids, MonitoredResource resource) {
        Exceptions.checkNotNullOrEmpty(ids, "ids");
        Preconditions.checkNotNull(resource, "resource");
        synchronized (this.resourceLock) {
            for (String id : ids) {
                MonitoredResource previous = this.resourceMap.put(id, resource);
                if (previous == null) {
                    log.debug("Registered id '{}' for {}.", id, resource);
                } else if (!previous.equals(resource)) {
                    log.debug("Remapped id '{}' from {} to {}.", id, previous, resource);
                }
            }
        }
    }

    @Override
    public void updateMetadata(MonitoredResource resource, Metadata metadata) {
        Preconditions.checkNotNull(resource, "resource");
        Preconditions.checkNotNull(metadata, "metadata");
        if (metadata.isIgnored()) {
            return;
        }

        synchronized (this.metadataLock) {
            Metadata existing = this.metadataMap.get(resource);
            if (existing == null || metadata.isFresherThan(existing)) {
                this.metadataMap.put(resource, metadata);
            } else {
                log.trace("Discarding stale metadata for {} collected at {}.", resource, metadata.getCollectedAt());
            }
        }
    }

    @Override
    public ImmutableMap<MonitoredResource, Metadata> getMetadataMap() {
        synchronized (this.metadataLock) {
            return ImmutableMap.copyOf(this.metadataMap);
        }
    }
}
