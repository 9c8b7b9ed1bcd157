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

import org.glassfish.grizzly.http.server.Request;
import org.glassfish.grizzly.http.server.Response;

/**
 * Handles a request routed to it by the {@link Dispatcher}.
 */
@FunctionalInterface
public interface RequestHandler {
    /**
     * Handles the request. Invoked concurrently from any of the server's worker threads.
     *
     * @param request  The request.
     * @param response The response to write to.
     * @throws Exception If the request could not be handled. The dispatcher answers with a 500.
     */
    void handle(Request request, Response response) throws Exception;
}
