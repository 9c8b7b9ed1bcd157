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
package io.hostmeta.agent.api;

import com.google.common.base.Preconditions;
import io.hostmeta.agent.resource.MonitoredResource;
import io.hostmeta.agent.store.MetadataStore;
import io.hostmeta.agent.store.ResourceNotFoundException;
import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import org.glassfish.grizzly.http.server.Request;
import org.glassfish.grizzly.http.server.Response;
import org.glassfish.grizzly.http.util.HttpStatus;

/**
 * Serves {@code GET {prefix}{id}}: the resource registered under id, as JSON, or a 404 error object.
 */
@Slf4j
class MonitoredResourceHandler implements RequestHandler {
    private final String prefix;
    private final MetadataStore store;
    private final boolean verbose;

    MonitoredResourceHandler(String prefix, MetadataStore store, boolean verbose) {
        this.prefix = Preconditions.checkNotNull(prefix, "prefix");
        this.store = Preconditions.checkNotNull(store, "store");
        this.verbose = verbose;
    }

    @Override
    public void handle(Request request, Response response) throws IOException {
        String id = request.getRequestURI().substring(this.prefix.length());
        if (this.verbose) {
            log.info("Handler called for '{}'.", id);
        }

        MonitoredResource resource;
        try {
            resource = this.store.lookupResource(id);
        } catch (ResourceNotFoundException ex) {
            // Expected while update sources catch up with new containers.
            if (this.verbose) {
                log.warn("No matching resource for '{}'.", id);
            }
            ApiResponses.writeError(response, HttpStatus.NOT_FOUND_404, ApiResponses.NOT_FOUND);
            return;
        }

        if (this.verbose) {
            log.info("Found resource for '{}': {}.", id, resource);
        }
        ApiResponses.writeJson(response, HttpStatus.OK_200, resource.toJson());
    }
}
