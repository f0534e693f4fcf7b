package app.toolwatch.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import app.toolwatch.audit.AuditMode;
import app.toolwatch.evaluator.ErrorAction;
import app.toolwatch.evaluator.RulesMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

/**
 * Settings of the embedded agent side: which tools are watched, where rules are evaluated
 * and where audit events go.
 */
@Validated
@ConfigurationProperties(prefix = "toolwatch.agent")
public class AgentProperties {

    private boolean enabled = false;

    /**
     * Watched tools; empty means all.
     */
    private List<String> tools = new ArrayList<>();

    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(5);

    @Valid
    private Rules rules = new Rules();

    @Valid
    private Audit audit = new Audit();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public List<String> getTools() {
        return tools;
    }

    public void setTools(List<String> tools) {
        this.tools = tools;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Rules getRules() {
        return rules;
    }

    public void setRules(Rules rules) {
        this.rules = rules;
    }

    public Audit getAudit() {
        return audit;
    }

    public void setAudit(Audit audit) {
        this.audit = audit;
    }

    public static class Rules {

        @NotNull
        private RulesMode mode = RulesMode.NONE;

        private String rulesFile = "rules.json";

        /**
         * Remote evaluation timeout; unset or zero waits indefinitely.
         */
        private Duration timeout;

        @NotNull
        private ErrorAction errorAction = ErrorAction.BLOCK;

        public RulesMode getMode() {
            return mode;
        }

        public void setMode(RulesMode mode) {
            this.mode = mode;
        }

        public String getRulesFile() {
            return rulesFile;
        }

        public void setRulesFile(String rulesFile) {
            this.rulesFile = rulesFile;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public ErrorAction getErrorAction() {
            return errorAction;
        }

        public void setErrorAction(ErrorAction errorAction) {
            this.errorAction = errorAction;
        }
    }

    public static class Audit {

        @NotNull
        private AuditMode mode = AuditMode.NONE;

        /**
         * Collector {@code /events} endpoint, also used for remote evaluation and drain.
         */
        private String httpUrl = "http://localhost:9999/events";

        private String filePath = Path.of(System.getProperty("java.io.tmpdir"), "toolwatch.jsonl").toString();

        public AuditMode getMode() {
            return mode;
        }

        public void setMode(AuditMode mode) {
            this.mode = mode;
        }

        public String getHttpUrl() {
            return httpUrl;
        }

        public void setHttpUrl(String httpUrl) {
            this.httpUrl = httpUrl;
        }

        public String getFilePath() {
            return filePath;
        }

        public void setFilePath(String filePath) {
            this.filePath = filePath;
        }
    }
}
