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

import com.google.common.collect.ImmutableMap;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import io.hostmeta.test.common.AssertExtensions;
import java.util.HashMap;
import java.util.Map;
import lombok.val;
import org.junit.Assert;
import org.junit.Test;

/**
 * Unit tests for the MonitoredResource class.
 */
public class MonitoredResourceTests {
    /**
     * Tests the JSON shape of a resource.
     */
    @Test
    public void testToJson() {
        val resource = new MonitoredResource("gce_instance", ImmutableMap.of("zone", "us-central1-a", "instance_id", "1234"));
        JsonObject json = resource.toJson();
        Assert.assertEquals("{\"type\":\"gce_instance\",\"labels\":{\"instance_id\":\"1234\",\"zone\":\"us-central1-a\"}}",
                json.toString());
    }

    /**
     * Tests that fromJson() reverses toJson(), including labels with characters that need escaping.
     */
    @Test
    public void testJsonRoundTrip() {
        val resource = new MonitoredResource("k8s_container", ImmutableMap.of(
                "pod_name", "web-<1>",
                "container_name", "nginx \"main\"",
                "namespace_name", "default"));
        val parsed = MonitoredResource.fromJson(JsonParser.parseString(resource.toJson().toString()));
        Assert.assertEquals("Round trip did not preserve the resource.", resource, parsed);
        Assert.assertEquals(resource.hashCode(), parsed.hashCode());
    }

    /**
     * Tests that a resource is not affected by later changes to the label map it was built from.
     */
    @Test
    public void testImmutability() {
        Map<String, String> labels = new HashMap<>();
        labels.put("zone", "a");
        val resource = new MonitoredResource("gce_instance", labels);
        labels.put("zone", "b");
        Assert.assertEquals("a", resource.getLabels().get("zone"));
        AssertExtensions.assertThrows(
                "Labels were modifiable.",
                () -> resource.getLabels().put("x", "y"),
                ex -> ex instanceof UnsupportedOperationException);
    }

    /**
     * Tests argument and shape validation.
     */
    @Test
    public void testInvalidArguments() {
        AssertExtensions.assertThrows(
                "Empty type was accepted.",
                () -> new MonitoredResource("", ImmutableMap.of()),
                ex -> ex instanceof IllegalArgumentException);
        AssertExtensions.assertThrows(
                "JSON without a type was accepted.",
                () -> MonitoredResource.fromJson(JsonParser.parseString("{\"labels\":{}}")),
                ex -> ex instanceof IllegalArgumentException);
        AssertExtensions.assertThrows(
                "Non-object JSON was accepted.",
                () -> MonitoredResource.fromJson(JsonParser.parseString("[]")),
                ex -> ex instanceof IllegalArgumentException);
        for (String label : new String[]{"{\"a\":\"b\"}", "[\"a\"]", "null"}) {
            AssertExtensions.assertThrows(
                    "Non-primitive label value was accepted: " + label,
                    () -> MonitoredResource.fromJson(JsonParser.parseString("{\"type\":\"t\",\"labels\":{\"zone\":" + label + "}}")),
                    ex -> ex instanceof IllegalArgumentException);
        }
    }
}
