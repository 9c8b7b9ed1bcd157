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
import com.google.common.collect.ImmutableSortedMap;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import javax.annotation.concurrent.ThreadSafe;
import lombok.extern.slf4j.Slf4j;
import org.glassfish.grizzly.http.server.HttpHandler;
import org.glassfish.grizzly.http.server.Request;
import org.glassfish.grizzly.http.server.Response;
import org.glassfish.grizzly.http.util.HttpStatus;

/**
 * Routes requests to handlers by method and longest matching path prefix.
 * <p>
 * The route table is fixed at construction. Routes are scanned in descending (method, prefix) order, which visits a
 * prefix's extensions before the prefix itself, and the first matching route is the only one invoked. Requests that
 * match no route get a 404; handlers that throw get a 500.
 * <p>
 * In verbose mode the logged body is read through {@link Request#getPostBody(int)}, which buffers it without
 * consuming it, so handlers can still read the full body from the request's input stream.
 */
@Slf4j
@ThreadSafe
public class Dispatcher extends HttpHandler {
    private static final int MAX_LOGGED_BODY_LENGTH = 4096;
    private final ImmutableSortedMap<RouteKey, RequestHandler> routes;
    private final boolean verbose;

    /**
     * Creates a new instance of the Dispatcher class.
     *
     * @param routes  The route table. A copy is made.
     * @param verbose Whether to log every request.
     */
    public Dispatcher(Map<RouteKey, RequestHandler> routes, boolean verbose) {
        super("Dispatcher");
        this.routes = ImmutableSortedMap.copyOf(Preconditions.checkNotNull(routes, "routes"));
        this.verbose = verbose;
    }

    @Override
    public void service(Request request, Response response) throws Exception {
        String method = request.getMethod().getMethodString();
        String path = request.getRequestURI();
        if (this.verbose) {
            log.info("Dispatcher called: {} {} headers: {} body: {}", method, path, getHeaders(request), getBody(request));
        }

        Optional<RequestHandler> handler = resolve(method, path);
        if (!handler.isPresent()) {
            log.debug("No route for {} {}.", method, path);
            ApiResponses.writeError(response, HttpStatus.NOT_FOUND_404, ApiResponses.NOT_FOUND);
            return;
        }

        try {
            handler.get().handle(request, response);
        } catch (Exception ex) {
            log.error("Handler failed for {} {}.", method, path, ex);
            if (!response.isCommitted()) {
                response.reset();
                ApiResponses.writeError(response, HttpStatus.INTERNAL_SERVER_ERROR_500, ApiResponses.INTERNAL_ERROR);
            }
        }
    }

    /**
     * Finds the handler for the given request method and path.
     *
     * @param method The request method.
     * @param path   The request path.
     * @return The handler of the longest prefix registered for method that path starts with, if any.
     */
    public Optional<RequestHandler> resolve(String method, String path) {
        for (Map.Entry<RouteKey, RequestHandler> route : this.routes.descendingMap().entrySet()) {
            if (route.getKey().matches(method, path)) {
                log.trace("Handler found for {} {}: {}.", method, path, route.getKey());
                return Optional.of(route.getValue());
            }
        }

        return Optional.empty();
    }

    private static Map<String, String> getHeaders(Request request) {
        Map<String, String> headers = new LinkedHashMap<>();
        for (String name : request.getHeaderNames()) {
            headers.put(name, request.getHeader(name));
        }
        return headers;
    }

    private static String getBody(Request request) {
        if (request.getContentLength() <= 0) {
            return "";
        }

        try {
            int length = Math.min(request.getContentLength(), MAX_LOGGED_BODY_LENGTH);
            return request.getPostBody(length).toStringContent(StandardCharsets.UTF_8);
        } catch (IOException ex) {
            return "<unreadable: " + ex.getMessage() + ">";
        }
    }
}
