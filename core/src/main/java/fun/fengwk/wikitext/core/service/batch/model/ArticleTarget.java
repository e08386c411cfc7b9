package fun.fengwk.wikitext.core.service.batch.model;

/**
 * One entry of a target list.
 *
 * @param raw article URL or title as written in the list
 * @param sourceFile list file the entry came from
 * @author fengwk
 */
public record ArticleTarget(String raw, TargetKind kind, String sourceFile) {

    public static ArticleTarget of(String raw, String sourceFile) {
        String value = raw.strip();
        boolean url = value.startsWith("http://") || value.startsWith("https://");
        return new ArticleTarget(value, url ? TargetKind.URL : TargetKind.TITLE, sourceFile);
    }

}
