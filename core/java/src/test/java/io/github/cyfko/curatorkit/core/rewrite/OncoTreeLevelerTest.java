package io.github.cyfko.curatorkit.core.rewrite;

import io.github.cyfko.curatorkit.core.model.LeafCriterion;
import io.github.cyfko.curatorkit.core.ontology.OncoTree;
import io.github.cyfko.curatorkit.core.ontology.OncoTreeFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("OncoTreeLeveler Tests")
class OncoTreeLevelerTest {

    private final OncoTree tree = OncoTreeFixtures.lungAndBreast();

    @Test
    @DisplayName("Should pair every curated term with its level")
    void shouldPairTermsWithLevels() {
        // When
        Optional<Map<String, Object>> fields = new OncoTreeLeveler(tree)
                .levelFields("Lung Adenocarcinoma (LUAD) | Breast (BREAST)");

        // Then
        assertEquals(Optional.of(Map.of(
                OncoTreeLeveler.TERM_FIELD, List.of("Lung Adenocarcinoma (LUAD)", "Breast (BREAST)"),
                OncoTreeLeveler.LEVEL_FIELD, List.of(3, 1))), fields);
    }

    @Test
    @DisplayName("Should give nothing for a blank cell or an unknown term")
    void shouldRejectUnknownTerms() {
        OncoTreeLeveler leveler = new OncoTreeLeveler(tree);

        assertTrue(leveler.levelFields("Lung (LUNG) | Colon (COLON)").isEmpty());
        assertTrue(leveler.levelFields(" n/a ").isEmpty());
        assertTrue(leveler.levelFields(null).isEmpty());
    }

    @Test
    @DisplayName("Should lift terms to the canonical level and collapse duplicates")
    void shouldLiftToCanonicalLevel() {
        OncoTreeLeveler leveler = new OncoTreeLeveler(tree, 1);

        Optional<Map<String, Object>> fields = leveler.levelFields("Lung Adenocarcinoma (LUAD) | Small Cell Lung Cancer (SCLC)");

        assertEquals(List.of("Lung (LUNG)"), fields.orElseThrow().get(OncoTreeLeveler.TERM_FIELD));
        assertEquals(List.of(1), fields.orElseThrow().get(OncoTreeLeveler.LEVEL_FIELD));
    }

    @Test
    @DisplayName("Should give nothing when a term sits above the canonical level")
    void shouldNotLiftDownwards() {
        assertTrue(new OncoTreeLeveler(tree, 3).levelFields("Lung (LUNG)").isEmpty());
    }

    @Test
    @DisplayName("Should reject a canonical level outside the ontology")
    void shouldRejectInvalidLevel() {
        assertThrows(IllegalArgumentException.class, () -> new OncoTreeLeveler(tree, 0));
        assertThrows(IllegalArgumentException.class, () -> new OncoTreeLeveler(tree, 8));
    }

    @Test
    @DisplayName("Should act as a leaf rewrite")
    void shouldActAsRewrite() {
        LeafRewrite<String> rewrite = new OncoTreeLeveler(tree).asRewrite(Function.identity());
        LeafCriterion leaf = new LeafCriterion("PrimaryTumorCriterion");

        assertEquals(List.of(2), rewrite.rewrite(leaf, "Small Cell Lung Cancer (SCLC)").get(OncoTreeLeveler.LEVEL_FIELD));
        assertNull(rewrite.rewrite(leaf, "Colon (COLON)"));
    }
}
