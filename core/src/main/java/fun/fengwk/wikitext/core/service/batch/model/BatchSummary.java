package fun.fengwk.wikitext.core.service.batch.model;

/**
 * Outcome counts of a batch run.
 *
 * @author fengwk
 */
public record BatchSummary(int succeeded, int skipped, int failed) {

    public int total() {
        return succeeded + skipped + failed;
    }

}
