package app.toolwatch.rules;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads {@code rules.json}. A missing or unreadable file never stops the service; it
 * falls back to {@link RulesConfig#defaults()}.
 */
@Slf4j
@RequiredArgsConstructor
public class RulesConfigLoader {

    private final ObjectMapper objectMapper;

    public RulesConfig load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            log.warn("Rules file {} not found, allowing all tool calls", path);
            return RulesConfig.defaults();
        }
        try {
            RulesConfig config = objectMapper.readValue(path.toFile(), RulesConfig.class);
            if (config == null) {
                log.warn("Rules file {} is empty, allowing all tool calls", path);
                return RulesConfig.defaults();
            }
            log.info("Loaded {} rule(s) and {} plugin reference(s) from {}",
                    config.rules().size(), config.plugins().size(), path);
            return config;
        } catch (IOException | IllegalArgumentException ex) {
            log.warn("Failed to load rules file {}, allowing all tool calls: {}", path, ex.getMessage());
            return RulesConfig.defaults();
        }
    }
}
