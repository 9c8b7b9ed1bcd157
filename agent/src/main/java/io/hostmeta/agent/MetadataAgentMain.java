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

import io.hostmeta.agent.instance.InstanceUpdater;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point for the metadata agent process.
 */
@Slf4j
public final class MetadataAgentMain {
    public static void main(String[] args) {
        try {
            AgentConfig config = loadConfig(
                    Paths.get(System.getProperty(AgentConfig.PROPERTY_FILE, AgentConfig.PROPERTY_FILE_DEFAULT_PATH)),
                    System.getProperties());
            log.info("Starting metadata agent with {}.", config);

            final MetadataAgent agent = new MetadataAgent(config);
            agent.addUpdater(new InstanceUpdater(config));
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                agent.close();
                log.info("ByeBye!");
            }, "shutdown-hook"));

            agent.start();
            agent.awaitTerminated();
        } catch (Exception ex) {
            log.error("Exception occurred running metadata agent.", ex);
            System.exit(1);
        }
    }

    /**
     * Loads the agent configuration from the given properties file, if it exists, overlaid with the given overrides.
     *
     * @param configurationFile The properties file.
     * @param overrides         Properties that take precedence over the file (typically the system properties).
     * @return The configuration.
     * @throws IOException If the file exists but cannot be read.
     */
    static AgentConfig loadConfig(Path configurationFile, Properties overrides) throws IOException {
        Properties properties = new Properties();
        if (Files.isRegularFile(configurationFile)) {
            try (Reader reader = Files.newBufferedReader(configurationFile, StandardCharsets.UTF_8)) {
                properties.load(reader);
            }
            log.info("Loaded configuration from {}.", configurationFile);
        } else {
            log.info("Configuration file {} not found; using defaults.", configurationFile);
        }

        properties.putAll(overrides);
        return AgentConfig.builder().rebase(properties).build();
    }
}
