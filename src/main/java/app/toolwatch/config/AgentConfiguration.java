package app.toolwatch.config;

import java.nio.file.Path;
import java.time.Clock;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import com.fasterxml.jackson.databind.ObjectMapper;

import app.toolwatch.agent.HostIdentity;
import app.toolwatch.agent.ToolwatchInterceptor;
import app.toolwatch.audit.AuditSender;
import app.toolwatch.evaluator.LocalEvaluator;
import app.toolwatch.evaluator.RemoteEvaluator;
import app.toolwatch.evaluator.RulesMode;
import app.toolwatch.evaluator.TerminalManualApprovalPrompt;
import app.toolwatch.plugin.PluginRegistry;
import app.toolwatch.rules.RulesConfig;
import app.toolwatch.rules.RulesConfigLoader;
import lombok.extern.slf4j.Slf4j;

/**
 * Embedded agent side, only with {@code toolwatch.agent.enabled=true}.
 *
 * <p>Der Agent hat eine eigene PluginRegistry; das Plugin {@code manual} des Collectors
 * ist hier nicht registriert.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "toolwatch.agent", name = "enabled", havingValue = "true")
public class AgentConfiguration {

    @Bean
    public ToolwatchInterceptor toolwatchInterceptor(AgentProperties properties,
                                                     AuditSender auditSender,
                                                     WebClient agentWebClient,
                                                     ObjectMapper objectMapper) {
        AgentProperties.Rules rules = properties.getRules();

        LocalEvaluator localEvaluator = null;
        if (rules.getMode() == RulesMode.LOCAL) {
            Path rulesPath = Path.of(rules.getRulesFile()).toAbsolutePath();
            RulesConfig rulesConfig = new RulesConfigLoader(objectMapper).load(rulesPath);
            localEvaluator = new LocalEvaluator(rulesConfig, new PluginRegistry(),
                    new TerminalManualApprovalPrompt(), rulesPath.getParent());
        }

        String url = properties.getAudit().getHttpUrl();
        RemoteEvaluator remoteEvaluator = url != null && !url.isBlank()
                ? new RemoteEvaluator(agentWebClient, url, rules.getTimeout(), rules.getErrorAction())
                : null;

        log.info("toolwatch agent active: rules={}, audit={}, tools={}", rules.getMode(),
                properties.getAudit().getMode(), properties.getTools().isEmpty() ? "all" : properties.getTools());
        return new ToolwatchInterceptor(properties.getTools(), rules.getMode(), localEvaluator, remoteEvaluator,
                auditSender, HostIdentity.detect(), Clock.systemUTC());
    }
}
