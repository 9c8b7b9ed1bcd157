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
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import java.time.Instant;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * The opaque, updater-defined payload associated with a monitored resource, together with its freshness marker.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class Metadata {
    /**
     * Placeholder used by updaters that only maintain the id to resource mapping. The store never records it.
     */
    public static final Metadata IGNORED = new Metadata("", false, Instant.EPOCH, Instant.EPOCH, JsonNull.INSTANCE, true);

    private final String version;
    private final boolean deleted;
    private final Instant createdAt;
    private final Instant collectedAt;
    @Getter(AccessLevel.NONE)
    private final JsonElement payload;
    private final boolean ignored;

    /**
     * Creates a new instance of the Metadata class.
     *
     * @param version     The payload schema version, as defined by the producing updater.
     * @param deleted     Whether the payload describes a resource that no longer exists.
     * @param createdAt   When the resource was created.
     * @param collectedAt When this payload was collected. Fresher payloads replace staler ones in the store.
     * @param payload     The payload itself. A deep copy is kept.
     */
    public Metadata(String version, boolean deleted, Instant createdAt, Instant collectedAt, JsonElement payload) {
        this(Preconditions.checkNotNull(version, "version"), deleted,
                Preconditions.checkNotNull(createdAt, "createdAt"),
                Preconditions.checkNotNull(collectedAt, "collectedAt"),
                Preconditions.checkNotNull(payload, "payload").deepCopy(),
                false);
    }

    /**
     * Gets a copy of the payload.
     *
     * @return A deep copy of the payload.
     */
    public JsonElement getPayload() {
        return this.payload.deepCopy();
    }

    /**
     * Determines whether this instance was collected strictly after the given one.
     *
     * @param other The Metadata to compare against.
     * @return True if this is fresher.
     */
    public boolean isFresherThan(Metadata other) {
        return this.collectedAt.isAfter(other.collectedAt);
    }
}
