package app.toolwatch.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.ObjectMapper;

import app.toolwatch.manual.ManualApprovalCoordinator;
import app.toolwatch.plugin.PluginRegistry;
import app.toolwatch.rules.RulesConfig;
import app.toolwatch.rules.RulesConfigLoader;

/**
 * Rules and plugins of the collector. The rules file is read once at startup.
 */
@Configuration
@EnableConfigurationProperties(CollectorProperties.class)
public class CollectorConfig {

    @Bean
    public RulesConfig collectorRules(CollectorProperties properties, ObjectMapper objectMapper) {
        return new RulesConfigLoader(objectMapper).load(properties.rulesPath());
    }

    @Bean
    public PluginRegistry pluginRegistry(ManualApprovalCoordinator coordinator) {
        PluginRegistry registry = new PluginRegistry();
        registry.register(ManualApprovalCoordinator.PLUGIN_NAME, coordinator);
        return registry;
    }
}
