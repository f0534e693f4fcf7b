package app.toolwatch.rules;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Content of a {@code rules.json} file.
 *
 * @param rules   ordered rule list
 * @param plugins plugin name to reference ({@code class:...}, a jar path or {@code builtin:...})
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RulesConfig(List<Rule> rules, Map<String, String> plugins) {

    public RulesConfig {
        rules = rules != null ? List.copyOf(rules) : List.of(Rule.allowAll());
        plugins = plugins != null ? Map.copyOf(plugins) : Map.of();
    }

    /**
     * Single catch-all allow rule, no plugins.
     */
    public static RulesConfig defaults() {
        return new RulesConfig(null, null);
    }
}
