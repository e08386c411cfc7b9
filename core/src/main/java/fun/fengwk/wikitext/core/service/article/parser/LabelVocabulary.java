package fun.fengwk.wikitext.core.service.article.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Fixed labels that precede a {@code "："} and a value, e.g. {@code 英語：Jolin Tsai}.
 *
 * @author fengwk
 */
public final class LabelVocabulary {

    /**
     * Characters that end a value. A label directly followed by one of the detection
     * characters is considered to have lost its value.
     */
    public static final String STOP_CHARACTERS = "，,、；;,)）」』】〉。.";

    private static final String MISSING_VALUE_LOOKAHEAD = "：(?=\\s*[，、；)）])";

    public static final LabelVocabulary DEFAULT = new LabelVocabulary(defaultLanguageCodes(), List.of(
        "英語", "英文", "English", "日語", "日文", "Japanese", "韓語", "韓文", "法語", "法文",
        "德語", "德文", "西班牙語", "西文", "西語", "俄語", "俄文", "義大利語", "義文", "意大利語",
        "意文", "葡萄牙語", "葡文", "拉丁語", "拉丁文", "越南語", "越文", "泰語", "馬來語", "馬來文",
        "印尼語", "印尼文", "粵語", "廣東話", "閩南語", "臺語", "台語", "閩南話", "客語",
        "學名", "藝名", "本名", "原名", "舊稱", "又名", "別名", "別稱", "外文"
    ));

    private final Map<String, String> languageCodes;
    private final List<String> labels;
    private final Pattern missingValuePattern;

    public LabelVocabulary(Map<String, String> languageCodes, List<String> labels) {
        this.languageCodes = Collections.unmodifiableMap(new LinkedHashMap<>(languageCodes));
        this.labels = List.copyOf(labels);
        String alternation = this.labels.stream()
            .map(Pattern::quote)
            .collect(Collectors.joining("|"));
        this.missingValuePattern = Pattern.compile("(" + alternation + ")" + MISSING_VALUE_LOOKAHEAD);
    }

    public List<String> labels() {
        return labels;
    }

    public Optional<String> languageCode(String label) {
        return Optional.ofNullable(languageCodes.get(label));
    }

    /**
     * Matches {@code <label>：} whose value is missing; group 1 is the label.
     */
    public Pattern missingValuePattern() {
        return missingValuePattern;
    }

    public static boolean isStopCharacter(char ch) {
        return STOP_CHARACTERS.indexOf(ch) >= 0;
    }

    private static Map<String, String> defaultLanguageCodes() {
        Map<String, String> codes = new LinkedHashMap<>();
        put(codes, "en", "英語", "英文", "English");
        put(codes, "ja", "日語", "日文", "Japanese");
        put(codes, "ko", "韓語", "韓文");
        put(codes, "fr", "法語", "法文");
        put(codes, "de", "德語", "德文");
        put(codes, "es", "西班牙語", "西文", "西語");
        put(codes, "ru", "俄語", "俄文");
        put(codes, "it", "義大利語", "義文", "意大利語", "意文");
        put(codes, "pt", "葡萄牙語", "葡文");
        put(codes, "la", "拉丁語", "拉丁文");
        put(codes, "vi", "越南語", "越文");
        put(codes, "th", "泰語");
        put(codes, "ms", "馬來語", "馬來文");
        put(codes, "id", "印尼語", "印尼文");
        put(codes, "yue", "粵語", "廣東話");
        put(codes, "nan", "閩南語", "臺語", "台語", "閩南話");
        put(codes, "hak", "客語");
        // scientific names are mostly Latin
        put(codes, "la", "學名");
        return codes;
    }

    private static void put(Map<String, String> codes, String code, String... labels) {
        for (String label : labels) {
            codes.put(label, code);
        }
    }

}
