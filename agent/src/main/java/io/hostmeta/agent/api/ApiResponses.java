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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.glassfish.grizzly.http.server.Response;
import org.glassfish.grizzly.http.util.HttpStatus;

/**
 * JSON response helpers shared by the dispatcher and the route handlers.
 */
final class ApiResponses {
    static final String JSON_CONTENT_TYPE = "application/json";
    static final String NOT_FOUND = "Not found";
    static final String INTERNAL_ERROR = "Internal server error";
    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

    static void writeJson(Response response, HttpStatus status, JsonElement body) throws IOException {
        byte[] content = GSON.toJson(body).getBytes(StandardCharsets.UTF_8);
        response.setStatus(status);
        response.setContentType(JSON_CONTENT_TYPE);
        response.setContentLength(content.length);
        response.getOutputStream().write(content);
    }

    /**
     * Writes an error object of the form {@code {"status_code":404,"error":"Not found"}}.
     */
    static void writeError(Response response, HttpStatus status, String error) throws IOException {
        JsonObject body = new JsonObject();
        body.addProperty("status_code", status.getStatusCode());
        body.addProperty("error", error);
        writeJson(response, status, body);
    }
}
