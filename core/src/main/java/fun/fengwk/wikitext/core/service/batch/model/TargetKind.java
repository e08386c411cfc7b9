package fun.fengwk.wikitext.core.service.batch.model;

import java.util.Locale;

/**
 * @author fengwk
 */
public enum TargetKind {

    URL,
    TITLE;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

}
