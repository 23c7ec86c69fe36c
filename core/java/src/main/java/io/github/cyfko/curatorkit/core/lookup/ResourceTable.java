package io.github.cyfko.curatorkit.core.lookup;

import io.github.cyfko.curatorkit.core.exception.LookupDefinitionException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An already-loaded curation resource: a header and rows of text cells.
 * <p>
 * Loading the file is the caller's business. This class only knows the column conventions
 * shared by every curation resource:
 * </p>
 * <ul>
 *   <li>columns ending with {@value #LOOKUP_SUFFIX} form the lookup key, in header order</li>
 *   <li>columns ending with {@value #CURATION_SUFFIX} hold the curated values</li>
 *   <li>an optional {@value #MOVE_TO_COLUMN} column names a resource to move the leaf to</li>
 * </ul>
 * <p>
 * Suffixes and column names are matched case-insensitively. Header names are trimmed and
 * every cell has its mojibake repaired on construction; {@code null} cells become empty.
 * </p>
 *
 * <pre>{@code
 * ResourceTable table = new ResourceTable("gene_alteration",
 *         List.of("Gene_lookup", "Variant_lookup", "Gene_curation", "Move_to"),
 *         rows);
 * LookupTable<ResourceTable.Row> lookup = LookupTable.fromResource(table);
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ResourceTable {

    public static final String LOOKUP_SUFFIX = "_lookup";
    public static final String CURATION_SUFFIX = "_curation";
    public static final String MOVE_TO_COLUMN = "Move_to";

    private final String name;
    private final List<String> header;
    private final Map<String, Integer> indexByLowerName;
    private final List<Row> rows;

    /**
     * @param name   resource name, used in messages and by Move-to resolution
     * @param header column names
     * @param rows   cell values, one list per row; short rows are padded with empty cells
     * @throws LookupDefinitionException if the header repeats a column or a row is longer than the header
     */
    public ResourceTable(String name, List<String> header, List<? extends List<?>> rows) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Resource name is required");
        }
        Objects.requireNonNull(header, "header cannot be null");
        Objects.requireNonNull(rows, "rows cannot be null");
        this.name = name;

        List<String> columns = new ArrayList<>(header.size());
        Map<String, Integer> index = new LinkedHashMap<>();
        for (String column : header) {
            String cleaned = TextNormalizer.fixMojibake(column == null ? "" : column).strip();
            if (index.putIfAbsent(cleaned.toLowerCase(Locale.ROOT), columns.size()) != null) {
                throw new LookupDefinitionException(String.format(
                        "Resource '%s' declares column '%s' twice", name, cleaned));
            }
            columns.add(cleaned);
        }
        this.header = Collections.unmodifiableList(columns);
        this.indexByLowerName = Collections.unmodifiableMap(index);

        List<Row> built = new ArrayList<>(rows.size());
        for (int r = 0; r < rows.size(); r++) {
            List<?> cells = rows.get(r);
            if (cells.size() > columns.size()) {
                throw new LookupDefinitionException(String.format(
                        "Row %d of resource '%s' has %d cells for %d columns", r, name, cells.size(), columns.size()));
            }
            List<String> values = new ArrayList<>(columns.size());
            for (int c = 0; c < columns.size(); c++) {
                Object cell = c < cells.size() ? cells.get(c) : null;
                values.add(cell == null ? "" : TextNormalizer.fixMojibake(String.valueOf(cell)));
            }
            built.add(new Row(r, Collections.unmodifiableList(values)));
        }
        this.rows = Collections.unmodifiableList(built);
    }

    public String name() {
        return name;
    }

    public List<String> header() {
        return header;
    }

    public List<Row> rows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    /**
     * @param column a column name, matched case-insensitively
     * @return true if the header has the column
     */
    public boolean hasColumn(String column) {
        return indexByLowerName.containsKey(column.strip().toLowerCase(Locale.ROOT));
    }

    /**
     * @return the {@value #LOOKUP_SUFFIX} columns, in header order
     */
    public List<String> lookupColumns() {
        return columnsEndingWith(LOOKUP_SUFFIX);
    }

    /**
     * @return the {@value #CURATION_SUFFIX} columns, in header order
     */
    public List<String> curationColumns() {
        return columnsEndingWith(CURATION_SUFFIX);
    }

    /**
     * @return the header name of the Move-to column, if the resource has one
     */
    public Optional<String> moveToColumn() {
        Integer index = indexByLowerName.get(MOVE_TO_COLUMN.toLowerCase(Locale.ROOT));
        return index == null ? Optional.empty() : Optional.of(header.get(index));
    }

    public Optional<String> firstLookupColumn() {
        List<String> lookup = lookupColumns();
        return lookup.isEmpty() ? Optional.empty() : Optional.of(lookup.get(0));
    }

    /**
     * @param columns names that must be present
     * @throws LookupDefinitionException naming every missing column
     */
    public void requireColumns(String... columns) {
        List<String> missing = new ArrayList<>();
        for (String column : columns) {
            if (!hasColumn(column)) {
                missing.add(column);
            }
        }
        if (!missing.isEmpty()) {
            throw new LookupDefinitionException(String.format(
                    "Resource '%s' is missing column(s) %s; available: %s", name, missing, header));
        }
    }

    /**
     * Finds the first row whose cell in {@code column} normalizes to the same text as {@code value}.
     *
     * @param column the column to search
     * @param value  the value to match, normalized before comparison
     * @return the first matching row
     */
    public Optional<Row> findFirst(String column, Object value) {
        int index = indexOf(column);
        String wanted = TextNormalizer.normalize(value);
        if (wanted.isEmpty()) {
            return Optional.empty();
        }
        for (Row row : rows) {
            if (TextNormalizer.normalize(row.cells().get(index)).equals(wanted)) {
                return Optional.of(row);
            }
        }
        return Optional.empty();
    }

    private int indexOf(String column) {
        Integer index = indexByLowerName.get(column.strip().toLowerCase(Locale.ROOT));
        if (index == null) {
            throw new LookupDefinitionException(String.format(
                    "Resource '%s' has no column '%s'; available: %s", name, column, header));
        }
        return index;
    }

    private List<String> columnsEndingWith(String suffix) {
        List<String> matches = new ArrayList<>();
        for (String column : header) {
            if (column.toLowerCase(Locale.ROOT).endsWith(suffix)) {
                matches.add(column);
            }
        }
        return matches;
    }

    @Override
    public String toString() {
        return "ResourceTable[name=" + name + ", columns=" + header + ", rows=" + rows.size() + "]";
    }

    /**
     * One row of a {@link ResourceTable}. Cells are addressed by column name, case-insensitively.
     */
    public final class Row {

        private final int index;
        private final List<String> cells;

        private Row(int index, List<String> cells) {
            this.index = index;
            this.cells = cells;
        }

        /**
         * @return the position of the row in its table, starting at 0
         */
        public int index() {
            return index;
        }

        public List<String> cells() {
            return cells;
        }

        /**
         * @param column a column of the table
         * @return the cell, never {@code null}
         * @throws LookupDefinitionException if the table has no such column
         */
        public String get(String column) {
            return cells.get(indexOf(column));
        }

        /**
         * @param columns columns of the table
         * @return the cells of these columns, in the given order
         */
        public List<String> values(List<String> columns) {
            List<String> values = new ArrayList<>(columns.size());
            for (String column : columns) {
                values.add(get(column));
            }
            return values;
        }

        /**
         * @return the Move-to target of this row, if the table has the column and the cell is not empty
         */
        public Optional<String> moveTo() {
            return moveToColumn()
                    .map(this::get)
                    .filter(cell -> !TextNormalizer.isEffectivelyEmpty(cell))
                    .map(String::strip);
        }

        public ResourceTable table() {
            return ResourceTable.this;
        }

        // rows of one table with the same cells are interchangeable
        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Row)) return false;
            Row other = (Row) o;
            return table() == other.table() && cells.equals(other.cells);
        }

        @Override
        public int hashCode() {
            return cells.hashCode();
        }

        @Override
        public String toString() {
            return name + "#" + index + cells;
        }
    }
}
