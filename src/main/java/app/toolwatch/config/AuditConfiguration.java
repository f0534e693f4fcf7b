package app.toolwatch.config;

import java.nio.file.Path;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import com.fasterxml.jackson.databind.ObjectMapper;

import app.toolwatch.audit.AuditDrainService;
import app.toolwatch.audit.AuditSender;

/**
 * Audit sender and drain. Both exist even without the embedded agent so that
 * {@code drain} works from the same jar.
 */
@Configuration
@EnableConfigurationProperties(AgentProperties.class)
public class AuditConfiguration {

    @Bean
    public AuditSender auditSender(WebClient agentWebClient, ObjectMapper objectMapper, AgentProperties properties) {
        AgentProperties.Audit audit = properties.getAudit();
        return new AuditSender(agentWebClient, objectMapper, audit.getMode(), audit.getHttpUrl(), filePath(audit));
    }

    @Bean
    public AuditDrainService auditDrainService(WebClient agentWebClient, AgentProperties properties) {
        AgentProperties.Audit audit = properties.getAudit();
        return new AuditDrainService(agentWebClient, audit.getHttpUrl(), filePath(audit));
    }

    private static Path filePath(AgentProperties.Audit audit) {
        return audit.getFilePath() != null && !audit.getFilePath().isBlank() ? Path.of(audit.getFilePath()) : null;
    }
}
