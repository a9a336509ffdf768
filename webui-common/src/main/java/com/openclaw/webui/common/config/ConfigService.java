package com.openclaw.webui.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads the relay configuration from a JSON file.
 * Missing files yield defaults; an unreadable or malformed file is fatal.
 * {@code ${VAR}} and {@code ${VAR:-default}} references in string values are
 * substituted from the environment after parsing.
 */
@Slf4j
public class ConfigService {

    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    /**
     * Thrown when an existing config file cannot be read or parsed.
     */
    public static class ConfigLoadException extends RuntimeException {
        public ConfigLoadException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    private final ObjectMapper objectMapper;
    private final Path configPath;
    private final Map<String, String> env;

    public ConfigService(Path configPath) {
        this(configPath, System.getenv());
    }

    public ConfigService(Path configPath, Map<String, String> env) {
        this.configPath = expandHome(configPath);
        this.env = env;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Read and parse the config file.
     *
     * @throws ConfigLoadException when the file exists but cannot be read or parsed
     */
    public WebUiConfig loadConfig() {
        if (!Files.exists(configPath)) {
            log.warn("Config file not found: {}, using defaults", configPath);
            return ConfigDefaults.applyDefaults(new WebUiConfig());
        }
        WebUiConfig config;
        try {
            JsonNode tree = objectMapper.readTree(Files.readString(configPath));
            if (tree == null || !tree.isObject()) {
                throw new ConfigLoadException("Config file " + configPath + " must hold a JSON object", null);
            }
            config = objectMapper.treeToValue(substituteEnvVars(tree), WebUiConfig.class);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to load config from " + configPath + ": " + e.getMessage(), e);
        }
        config = ConfigDefaults.applyDefaults(config);
        log.info("Config loaded from: {} ({} gateway(s), auth={})",
                configPath, config.getGateways().size(), config.isAuthRequired());
        return config;
    }

    public Path getConfigPath() {
        return configPath;
    }

    /**
     * Resolve a path relative to the directory holding the config file.
     */
    public Path resolveSibling(String path) {
        Path p = expandHome(Path.of(path));
        if (p.isAbsolute()) {
            return p;
        }
        Path parent = configPath.toAbsolutePath().getParent();
        return parent != null ? parent.resolve(p) : p;
    }

    /**
     * Substitute env references in every string value of {@code node}, in place.
     */
    JsonNode substituteEnvVars(JsonNode node) {
        if (node.isObject()) {
            ObjectNode obj = (ObjectNode) node;
            List<String> names = new ArrayList<>();
            obj.fieldNames().forEachRemaining(names::add);
            for (String name : names) {
                JsonNode value = obj.get(name);
                if (value.isTextual()) {
                    obj.set(name, TextNode.valueOf(substituteEnvVars(value.asText())));
                } else {
                    substituteEnvVars(value);
                }
            }
        } else if (node.isArray()) {
            ArrayNode array = (ArrayNode) node;
            for (int i = 0; i < array.size(); i++) {
                JsonNode value = array.get(i);
                if (value.isTextual()) {
                    array.set(i, TextNode.valueOf(substituteEnvVars(value.asText())));
                } else {
                    substituteEnvVars(value);
                }
            }
        }
        return node;
    }

    /**
     * Substitute ${VAR} and ${VAR:-default} patterns.
     */
    String substituteEnvVars(String raw) {
        Matcher matcher = ENV_VAR_PATTERN.matcher(raw);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String varName = matcher.group(1);
            String defaultValue = matcher.group(2);
            String value = env.getOrDefault(varName,
                    defaultValue != null ? defaultValue : "");
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private static Path expandHome(Path path) {
        String pathStr = path.toString();
        if (pathStr.startsWith("~")) {
            return Path.of(System.getProperty("user.home") + pathStr.substring(1));
        }
        return path;
    }
}
