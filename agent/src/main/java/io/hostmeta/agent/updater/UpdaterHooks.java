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
 * The operations a concrete update source provides to a {@link MetadataUpdater}. The updater owns the lifecycle and
 * guarantees that {@link #startUpdater} is invoked at most once, only after {@link #validateConfiguration()} returned
 * true, and that {@link #stopUpdater()} is only invoked after a successful start.
 */
public interface UpdaterHooks {
    /**
     * Gets the name of this update source, used in logs and thread names.
     *
     * @return The name.
     */
    String getName();

    /**
     * Validates the configuration this update source depends on. Must not start any thread or timer.
     *
     * @return True if the update source can run.
     */
    default boolean validateConfiguration() {
        return true;
    }

    /**
     * Starts producing updates.
     *
     * @param committer The committer to push results into.
     */
    void startUpdater(MetadataCommitter committer);

    /**
     * Stops producing updates. Once this returns, no further commits are made.
     */
    void stopUpdater();
}
