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

/**
 * Pushes update source results into the metadata store.
 */
public interface MetadataCommitter {
    /**
     * Registers the result's resource under each of the result's ids. The result is not consumed.
     *
     * @param result The result to commit.
     */
    void updateResource(ResourceMetadata result);

    /**
     * Records the result's metadata for its resource. This consumes the metadata: it is cleared from result and the
     * caller must not reference it afterwards.
     *
     * @param result The result to commit.
     * @throws IllegalStateException If the result's metadata has already been committed.
     */
    void updateMetadata(ResourceMetadata result);
}
