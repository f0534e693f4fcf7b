package app.toolwatch.rules;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.ObjectMapper;

class RulesConfigLoaderTest {

    @TempDir
    Path tempDir;

    private final RulesConfigLoader loader = new RulesConfigLoader(new ObjectMapper());

    @Test
    void readsRulesAndPlugins() throws IOException {
        Path file = tempDir.resolve("rules.json");
        Files.writeString(file, """
                {
                  "rules": [
                    { "comment": "no force push", "match": { "tool": "bash", "params.command": ["/--force/", "/-f /"] },
                      "action": "deny", "reason": "Force push blocked" },
                    { "match": { "tool": "write" }, "action": "manual" },
                    { "action": "plugin", "plugin": "checker" }
                  ],
                  "plugins": { "checker": "class:com.example.Checker" }
                }
                """);

        RulesConfig config = loader.load(file);

        assertThat(config.rules()).hasSize(3);
        Rule first = config.rules().get(0);
        assertThat(first.action()).isEqualTo(RuleAction.DENY);
        assertThat(first.match().get("params.command").patterns()).containsExactly("/--force/", "/-f /");
        assertThat(first.match().get("tool").anyOf()).isFalse();
        assertThat(config.rules().get(2).matchesEverything()).isTrue();
        assertThat(config.plugins()).containsEntry("checker", "class:com.example.Checker");
    }

    @Test
    void missingFileAllowsEverything() {
        RulesConfig config = loader.load(tempDir.resolve("absent.json"));

        assertThat(config.rules()).containsExactly(Rule.allowAll());
        assertThat(config.plugins()).isEmpty();
    }

    @Test
    void malformedFileAllowsEverything() throws IOException {
        Path file = tempDir.resolve("rules.json");
        Files.writeString(file, "{ \"rules\": [ { \"action\": \"explode\" } ] }");

        assertThat(loader.load(file).rules()).containsExactly(Rule.allowAll());
    }

    @Test
    void ruleWithoutActionIsRejected() throws IOException {
        Path file = tempDir.resolve("rules.json");
        Files.writeString(file, "{ \"rules\": [ { \"match\": { \"tool\": \"bash\" } } ] }");

        assertThat(loader.load(file)).isEqualTo(RulesConfig.defaults());
    }

    @Test
    void missingRulesKeyDefaultsToAllowAll() throws IOException {
        Path file = tempDir.resolve("rules.json");
        Files.writeString(file, "{ \"plugins\": { \"a\": \"builtin:manual\" } }");

        RulesConfig config = loader.load(file);

        assertThat(config.rules()).containsExactly(Rule.allowAll());
        assertThat(config.plugins()).containsKey("a");
    }
}
