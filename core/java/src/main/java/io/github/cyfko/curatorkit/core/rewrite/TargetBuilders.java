package io.github.cyfko.curatorkit.core.rewrite;

import io.github.cyfko.curatorkit.core.lookup.TextNormalizer;
import io.github.cyfko.curatorkit.core.model.LeafCriterion;
import io.github.cyfko.curatorkit.core.ontology.OncoTree;

import java.util.Map;
import java.util.Optional;

/**
 * The Move-to target builders known out of the box.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class TargetBuilders {

    public static final String PRIMARY_TUMOR_TYPE = "PrimaryTumorCriterion";
    public static final String MOLECULAR_SIGNATURE_TYPE = "MolecularSignatureCriterion";

    public static final String ONCOTREE_CURATION_COLUMN = "Oncotree_curation";
    public static final String FINDINGS_CURATION_COLUMN = "Findings_curation";
    public static final String FINDINGS_SIGNATURE_FIELD = "findings_signature";

    private TargetBuilders() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    /**
     * Primary tumour target: the row's {@value #ONCOTREE_CURATION_COLUMN} cell becomes the
     * ontology term and level fields.
     *
     * @param tree the ontology placing the curated terms
     * @return the builder
     */
    public static MoveToTargetBuilder primaryTumor(OncoTree tree) {
        OncoTreeLeveler leveler = new OncoTreeLeveler(tree);
        return (oldLeaf, row) -> {
            if (!row.table().hasColumn(ONCOTREE_CURATION_COLUMN)) {
                return Optional.empty();
            }
            return leveler.levelFields(row.get(ONCOTREE_CURATION_COLUMN))
                    .map(fields -> new LeafCriterion(PRIMARY_TUMOR_TYPE, fields));
        };
    }

    /**
     * Molecular signature target: the row's {@value #FINDINGS_CURATION_COLUMN} cell becomes
     * the {@value #FINDINGS_SIGNATURE_FIELD} field.
     *
     * @return the builder
     */
    public static MoveToTargetBuilder molecularSignature() {
        return (oldLeaf, row) -> {
            if (!row.table().hasColumn(FINDINGS_CURATION_COLUMN)) {
                return Optional.empty();
            }
            String findings = row.get(FINDINGS_CURATION_COLUMN);
            if (TextNormalizer.isEffectivelyEmpty(findings)) {
                return Optional.empty();
            }
            return Optional.of(new LeafCriterion(MOLECULAR_SIGNATURE_TYPE,
                    Map.of(FINDINGS_SIGNATURE_FIELD, findings.strip())));
        };
    }
}
