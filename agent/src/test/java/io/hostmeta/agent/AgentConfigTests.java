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
package io.hostmeta.agent;

import io.hostmeta.common.util.ConfigurationException;
import io.hostmeta.test.common.AssertExtensions;
import java.io.File;
import java.io.FileWriter;
import java.io.Writer;
import java.time.Duration;
import java.util.Properties;
import lombok.val;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/**
 * Unit tests for the AgentConfig class and configuration loading in MetadataAgentMain.
 */
public class AgentConfigTests {
    @Rule
    public final TemporaryFolder folder = new TemporaryFolder();

    /**
     * Tests default values.
     */
    @Test
    public void testDefaults() {
        val config = AgentConfig.builder().build();
        Assert.assertFalse(config.isVerboseLogging());
        Assert.assertEquals("0.0.0.0", config.getApiHost());
        Assert.assertEquals(8000, config.getApiPort());
        Assert.assertEquals(3, config.getApiThreads());
        Assert.assertEquals(Duration.ofSeconds(30), config.getApiShutdownTimeout());
        Assert.assertEquals(Duration.ofSeconds(60), config.getInstanceUpdateInterval());
        Assert.assertEquals("gce_instance", config.getInstanceResourceType());
        Assert.assertEquals("", config.getInstanceId());
    }

    /**
     * Tests that invalid values are rejected when the configuration is built.
     */
    @Test
    public void testInvalidValues() {
        AssertExtensions.assertThrows(
                "Zero API threads were accepted.",
                () -> AgentConfig.builder().with(AgentConfig.API_THREADS, 0).build(),
                ex -> ex instanceof ConfigurationException);
        AssertExtensions.assertThrows(
                "Negative port was accepted.",
                () -> AgentConfig.builder().with(AgentConfig.API_PORT, -1).build(),
                ex -> ex instanceof ConfigurationException);
        AssertExtensions.assertThrows(
                "Negative interval was accepted.",
                () -> AgentConfig.builder().with(AgentConfig.INSTANCE_UPDATE_INTERVAL_SECONDS, -1).build(),
                ex -> ex instanceof ConfigurationException);
    }

    /**
     * Tests loading from a file, with overrides taking precedence.
     */
    @Test
    public void testLoadConfig() throws Exception {
        File file = this.folder.newFile("agent.properties");
        try (Writer writer = new FileWriter(file)) {
            writer.write("agent.api.port=9000\n");
            writer.write("agent.api.threads=5\n");
            writer.write("agent.instance.id=from-file\n");
        }

        val overrides = new Properties();
        overrides.setProperty("agent.instance.id", "from-override");
        overrides.setProperty("unrelated.property", "x");
        val config = MetadataAgentMain.loadConfig(file.toPath(), overrides);
        Assert.assertEquals(9000, config.getApiPort());
        Assert.assertEquals(5, config.getApiThreads());
        Assert.assertEquals("from-override", config.getInstanceId());
        Assert.assertEquals("0.0.0.0", config.getApiHost());
    }

    /**
     * Tests that a missing file yields the defaults.
     */
    @Test
    public void testLoadConfigMissingFile() throws Exception {
        val config = MetadataAgentMain.loadConfig(new File(this.folder.getRoot(), "missing.properties").toPath(), new Properties());
        Assert.assertEquals(8000, config.getApiPort());
    }
}
