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

import java.util.List;

/**
 * Queries an update source for the current set of resources and their metadata.
 */
@FunctionalInterface
public interface MetadataQuery {
    /**
     * Runs one query. Invoked repeatedly from a single thread; must complete in bounded time.
     *
     * @return The results of this query.
     * @throws Exception If the query failed. The results of this cycle are discarded.
     */
    List<ResourceMetadata> query() throws Exception;
}
