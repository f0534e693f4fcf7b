package app.toolwatch.audit;

/**
 * Outcome of one drain run.
 *
 * @param sent   lines accepted by the collector
 * @param failed lines kept in the fallback file
 */
public record DrainResult(int sent, int failed) {

    public static DrainResult empty() {
        return new DrainResult(0, 0);
    }

    public boolean complete() {
        return failed == 0;
    }
}
