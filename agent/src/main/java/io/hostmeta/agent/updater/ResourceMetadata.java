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
import com.google.common.collect.ImmutableList;
import io.hostmeta.agent.resource.MonitoredResource;
import io.hostmeta.agent.store.Metadata;
import io.hostmeta.common.Exceptions;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import javax.annotation.concurrent.ThreadSafe;
import lombok.Getter;

/**
 * One result of an update source query: the ids a resource may be looked up under, the resource itself, and its
 * metadata. Everything is immutable except the metadata, which is handed over to the store exactly once.
 */
@ThreadSafe
public final class ResourceMetadata {
    @Getter
    private final ImmutableList<String> ids;
    @Getter
    private final MonitoredResource resource;
    private final AtomicReference<Metadata> metadata;

    /**
     * Creates a new instance of the ResourceMetadata class.
     *
     * @param ids      The alias ids. Must not be empty.
     * @param resource The resource.
     * @param metadata The metadata for the resource, or {@link Metadata#IGNORED}.
     */
    public ResourceMetadata(List<String> ids, MonitoredResource resource, Metadata metadata) {
        this.ids = ImmutableList.copyOf(Exceptions.checkNotNullOrEmpty(ids, "ids"));
        this.resource = Preconditions.checkNotNull(resource, "resource");
        this.metadata = new AtomicReference<>(Preconditions.checkNotNull(metadata, "metadata"));
    }

    /**
     * Gets a value indicating whether the metadata has already been handed over.
     *
     * @return True if {@link #takeMetadata()} has been called.
     */
    public boolean isMetadataTaken() {
        return this.metadata.get() == null;
    }

    /**
     * Hands the metadata over to the caller and clears this instance's reference to it.
     *
     * @return The metadata.
     * @throws IllegalStateException If the metadata has already been taken.
     */
    Metadata takeMetadata() {
        Metadata result = this.metadata.getAndSet(null);
        Preconditions.checkState(result != null, "Metadata for %s has already been committed.", this.resource);
        return result;
    }

    @Override
    public String toString() {
        return String.format("ResourceMetadata(ids=%s, resource=%s, metadataTaken=%s)", this.ids, this.resource, isMetadataTaken());
    }
}
