package work.lcod.state.values;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Column-oriented table (typically loaded from CSV). Serializes as its row collection.
 */
public final class DataTable {
    private final List<String> columns;
    private final List<Map<String, Object>> rows = new ArrayList<>();

    public DataTable(List<String> columns) {
        this.columns = List.copyOf(Objects.requireNonNull(columns, "columns"));
    }

    public DataTable addRow(List<?> cells) {
        if (cells.size() > columns.size()) {
            throw new IllegalArgumentException(
                "Row has " + cells.size() + " cells but the table has " + columns.size() + " columns"
            );
        }
        var row = new LinkedHashMap<String, Object>();
        for (int i = 0; i < columns.size(); i++) {
            row.put(columns.get(i), i < cells.size() ? cells.get(i) : null);
        }
        rows.add(row);
        return this;
    }

    public List<String> columns() {
        return columns;
    }

    public List<Map<String, Object>> rows() {
        return Collections.unmodifiableList(rows);
    }

    public int size() {
        return rows.size();
    }
}
