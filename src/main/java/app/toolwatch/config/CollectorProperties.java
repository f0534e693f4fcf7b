package app.toolwatch.config;

import java.nio.file.Path;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

@Validated
@ConfigurationProperties(prefix = "toolwatch.collector")
public class CollectorProperties {

    /**
     * SQLite file, shared by every collector instance that should see the same approvals.
     */
    @NotBlank
    private String dbPath = "toolwatch.db";

    /**
     * Rules file; relative plugin references resolve against its directory.
     */
    @NotBlank
    private String rulesFile = "rules.json";

    @Min(50)
    private long manualPollIntervalMs = 500;

    public String dbPath() {
        return dbPath;
    }

    public void setDbPath(String dbPath) {
        this.dbPath = dbPath;
    }

    public String rulesFile() {
        return rulesFile;
    }

    public void setRulesFile(String rulesFile) {
        this.rulesFile = rulesFile;
    }

    public long manualPollIntervalMs() {
        return manualPollIntervalMs;
    }

    public void setManualPollIntervalMs(long manualPollIntervalMs) {
        this.manualPollIntervalMs = manualPollIntervalMs;
    }

    public Path rulesPath() {
        return Path.of(rulesFile).toAbsolutePath();
    }

    public Path pluginBasePath() {
        return rulesPath().getParent();
    }
}
