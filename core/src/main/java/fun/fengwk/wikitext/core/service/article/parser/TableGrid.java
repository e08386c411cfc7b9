package fun.fengwk.wikitext.core.service.article.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Logical grid rebuilt from table rows with merged cells.
 *
 * <p>A cell reserves the leftmost run of free columns in its row. A rowspan keeps its
 * columns occupied in the following rows and repeats the cell value there.
 *
 * @author fengwk
 */
public class TableGrid {

    private final List<ActiveSpan> activeSpans = new ArrayList<>();
    private final List<List<String>> rows = new ArrayList<>();
    private List<String> currentRow;

    public void startRow() {
        currentRow = new ArrayList<>();
        for (int column = 0; column < activeSpans.size(); column++) {
            ActiveSpan span = activeSpans.get(column);
            if (span == null) {
                currentRow.add(null);
                continue;
            }
            currentRow.add(span.value);
            span.rowsRemaining--;
            if (span.rowsRemaining <= 0) {
                activeSpans.set(column, null);
            }
        }
    }

    public void placeCell(String text, int colspan, int rowspan) {
        if (currentRow == null) {
            throw new IllegalStateException("startRow must be called before placeCell");
        }
        int start = findFreeRun(colspan);
        for (int offset = 0; offset < colspan; offset++) {
            int column = start + offset;
            String value = offset == 0 ? text : "";
            currentRow.set(column, value);
            activeSpans.set(column, rowspan > 1 ? new ActiveSpan(rowspan - 1, value) : null);
        }
    }

    /**
     * Finishes the current row. Trailing blank columns are trimmed and rows without any
     * content are dropped.
     */
    public void endRow() {
        if (currentRow == null) {
            return;
        }
        List<String> cleaned = new ArrayList<>(currentRow.size());
        for (String value : currentRow) {
            cleaned.add(value == null ? "" : value);
        }
        while (!cleaned.isEmpty() && cleaned.get(cleaned.size() - 1).isBlank()) {
            cleaned.remove(cleaned.size() - 1);
        }
        if (cleaned.stream().anyMatch(value -> !value.isBlank())) {
            rows.add(cleaned);
        }
        currentRow = null;
    }

    public List<List<String>> rows() {
        return rows;
    }

    private int findFreeRun(int colspan) {
        int start = 0;
        while (true) {
            boolean fits = true;
            for (int offset = 0; offset < colspan; offset++) {
                int column = start + offset;
                ensureColumn(column);
                if (currentRow.get(column) != null) {
                    start = column + 1;
                    fits = false;
                    break;
                }
            }
            if (fits) {
                return start;
            }
        }
    }

    private void ensureColumn(int column) {
        while (column >= currentRow.size()) {
            currentRow.add(null);
        }
        while (column >= activeSpans.size()) {
            activeSpans.add(null);
        }
    }

    private static final class ActiveSpan {

        private int rowsRemaining;
        private final String value;

        private ActiveSpan(int rowsRemaining, String value) {
            this.rowsRemaining = rowsRemaining;
            this.value = value;
        }

    }

}
