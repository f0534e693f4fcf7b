package app.toolwatch.storage;

import java.util.List;

/**
 * Distinct values for building filter drop-downs.
 */
public record FilterOptions(List<String> users, List<String> tools, List<String> models) {
}
