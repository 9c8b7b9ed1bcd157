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
package io.hostmeta.agent.resource;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSortedMap;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import io.hostmeta.common.Exceptions;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * A typed descriptor identifying a monitored entity: a resource type tag plus a set of labels.
 * Instances are immutable; labels are kept sorted by name so the JSON form is stable.
 */
@EqualsAndHashCode
public final class MonitoredResource {
    private static final String TYPE_FIELD = "type";
    private static final String LABELS_FIELD = "labels";

    @Getter
    private final String type;
    @Getter
    private final ImmutableSortedMap<String, String> labels;

    /**
     * Creates a new instance of the MonitoredResource class.
     *
     * @param type   The resource type tag (for example "gce_instance").
     * @param labels The label name to label value mapping. A copy is made.
     */
    public MonitoredResource(String type, Map<String, String> labels) {
        this.type = Exceptions.checkNotNullOrEmpty(type, "type");
        this.labels = ImmutableSortedMap.copyOf(Preconditions.checkNotNull(labels, "labels"));
    }

    /**
     * Serializes this resource as {@code {"type": ..., "labels": {...}}}.
     *
     * @return A new JsonObject.
     */
    public JsonObject toJson() {
        JsonObject labelsJson = new JsonObject();
        this.labels.forEach(labelsJson::addProperty);
        JsonObject result = new JsonObject();
        result.addProperty(TYPE_FIELD, this.type);
        result.add(LABELS_FIELD, labelsJson);
        return result;
    }

    /**
     * Parses a resource from the shape produced by {@link #toJson()}.
     *
     * @param json The JSON to parse.
     * @return The parsed resource.
     * @throws IllegalArgumentException If the JSON does not have the expected shape.
     */
    public static MonitoredResource fromJson(JsonElement json) {
        Preconditions.checkArgument(json != null && json.isJsonObject(), "Resource JSON must be an object.");
        JsonObject object = json.getAsJsonObject();
        JsonElement type = object.get(TYPE_FIELD);
        Preconditions.checkArgument(type != null && type.isJsonPrimitive(), "Resource JSON is missing '%s'.", TYPE_FIELD);
        ImmutableSortedMap.Builder<String, String> labels = ImmutableSortedMap.naturalOrder();
        JsonElement labelsJson = object.get(LABELS_FIELD);
        if (labelsJson != null && !labelsJson.isJsonNull()) {
            Preconditions.checkArgument(labelsJson.isJsonObject(), "Resource '%s' must be an object.", LABELS_FIELD);
            for (Map.Entry<String, JsonElement> label : labelsJson.getAsJsonObject().entrySet()) {
                Preconditions.checkArgument(label.getValue().isJsonPrimitive(), "Label '%s' must be a JSON primitive.", label.getKey());
                labels.put(label.getKey(), label.getValue().getAsString());
            }
        }

        return new MonitoredResource(type.getAsString(), labels.build());
    }

    @Override
    public String toString() {
        return String.format("MonitoredResource(%s,%s)", this.type, this.labels);
    }
}
