package io.github.cyfko.curatorkit.core.rewrite;

import io.github.cyfko.curatorkit.core.lookup.ResourceTable;
import io.github.cyfko.curatorkit.core.lookup.TextNormalizer;
import io.github.cyfko.curatorkit.core.model.LeafCriterion;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rewrite copying {@code _curation} cells of the matched row into leaf fields.
 * <p>
 * Each mapping names a column and a target field. The cell is split into alternatives on
 * {@code '|'} after removing parentheses wrapping the whole cell, so {@code "(KRAS | NRAS)"}
 * gives {@code ["KRAS", "NRAS"]}. A required column with no alternative removes the leaf;
 * an optional one gives an empty list. Fields appear in mapping order.
 * </p>
 *
 * <pre>{@code
 * LeafRewrite<ResourceTable.Row> rewrite = CurationColumnsRewrite.builder()
 *         .required("Gene_curation", "gene_curated")
 *         .optional("Variant_curation", "variant_curated")
 *         .required("FindingsModel_curation", "findings_model")
 *         .build();
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class CurationColumnsRewrite implements LeafRewrite<ResourceTable.Row> {

    private final List<Mapping> mappings;

    private CurationColumnsRewrite(List<Mapping> mappings) {
        this.mappings = List.copyOf(mappings);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Map<String, Object> rewrite(LeafCriterion leaf, ResourceTable.Row row) {
        Map<String, Object> fields = new LinkedHashMap<>();
        for (Mapping mapping : mappings) {
            List<String> terms = row.table().hasColumn(mapping.column())
                    ? TextNormalizer.splitOrTermsStrippingParens(row.get(mapping.column()))
                    : List.of();
            if (terms.isEmpty() && mapping.required()) {
                return null;
            }
            fields.put(mapping.field(), new ArrayList<>(terms));
        }
        return fields;
    }

    private record Mapping(String column, String field, boolean required) {
    }

    /**
     * Builder for {@link CurationColumnsRewrite}.
     */
    public static final class Builder {

        private final List<Mapping> mappings = new ArrayList<>();

        private Builder() {
        }

        public Builder required(String column, String field) {
            mappings.add(new Mapping(column, field, true));
            return this;
        }

        public Builder optional(String column, String field) {
            mappings.add(new Mapping(column, field, false));
            return this;
        }

        public CurationColumnsRewrite build() {
            if (mappings.isEmpty()) {
                throw new IllegalStateException("At least one curation column must be mapped");
            }
            return new CurationColumnsRewrite(mappings);
        }
    }
}
