package io.github.cyfko.curatorkit.core.rewrite;

import io.github.cyfko.curatorkit.core.lookup.ResourceTable;
import io.github.cyfko.curatorkit.core.model.LeafCriterion;
import io.github.cyfko.curatorkit.core.ontology.OncoTreeFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MoveToTargetResolver Tests")
class MoveToTargetResolverTest {

    private final LeafCriterion oldLeaf = new LeafCriterion("GeneAlterationCriterion", Map.of("gene", "x"));

    private MoveToTargetResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = MoveToTargetResolver.builder()
                .resource(RewriteFixtures.primaryTumour())
                .resource(RewriteFixtures.molecularSignature())
                .resource(new ResourceTable("Other", List.of("Other_lookup"), List.of(List.of("x"))))
                .withDefaultTargets(OncoTreeFixtures.lungAndBreast())
                .build();
    }

    @Test
    @DisplayName("Should build a primary tumour leaf from the ontology curation")
    void shouldBuildPrimaryTumour() {
        // When
        Optional<LeafCriterion> moved = resolver.resolve("PrimaryTumour.csv", "lung adenocarcinoma", oldLeaf);

        // Then
        LeafCriterion leaf = moved.orElseThrow();
        assertEquals(TargetBuilders.PRIMARY_TUMOR_TYPE, leaf.typeName());
        assertEquals(List.of("Lung Adenocarcinoma (LUAD)"), leaf.get(OncoTreeLeveler.TERM_FIELD));
        assertEquals(List.of(3L), leaf.get(OncoTreeLeveler.LEVEL_FIELD));
    }

    @Test
    @DisplayName("Should build a molecular signature leaf from the findings curation")
    void shouldBuildMolecularSignature() {
        Optional<LeafCriterion> moved = resolver.resolve(" molecularsignature ", "hrd", oldLeaf);

        assertEquals(Optional.of(new LeafCriterion(TargetBuilders.MOLECULAR_SIGNATURE_TYPE,
                Map.of(TargetBuilders.FINDINGS_SIGNATURE_FIELD, "Homologous recombination deficiency"))), moved);
    }

    @Test
    @DisplayName("Should resolve to nothing whenever a step fails")
    void shouldResolveToNothing() {
        assertTrue(resolver.resolve("Nowhere.csv", "hrd", oldLeaf).isEmpty(), "unknown resource");
        assertTrue(resolver.resolve("MolecularSignature", "brca", oldLeaf).isEmpty(), "no matching row");
        assertTrue(resolver.resolve("MolecularSignature", "msi", oldLeaf).isEmpty(), "empty curation");
        assertTrue(resolver.resolve("PrimaryTumour", "lung cancer", oldLeaf).isEmpty(), "unknown ontology term");
        assertTrue(resolver.resolve("Other", "x", oldLeaf).isEmpty(), "no target builder");
        assertTrue(resolver.resolve("", "x", oldLeaf).isEmpty(), "blank Move-to");
        assertTrue(MoveToTargetResolver.none().resolve("PrimaryTumour", "lung adenocarcinoma", oldLeaf).isEmpty());
    }

    @Test
    @DisplayName("Should try target builders in registration order")
    void shouldUseFirstMatchingBuilder() {
        LeafCriterion marker = new LeafCriterion("Marker");
        MoveToTargetResolver custom = MoveToTargetResolver.builder()
                .resource(new ResourceTable("SpecialOther", List.of("Key_lookup"), List.of(List.of("x"))))
                .target("special", (leaf, row) -> Optional.of(marker))
                .target("other", (leaf, row) -> Optional.empty())
                .build();

        assertEquals(Optional.of(marker), custom.resolve("SpecialOther.csv", "x", oldLeaf));
    }

    @Test
    @DisplayName("Should match resource names without case or extension")
    void shouldNormalizeResourceNames() {
        assertEquals("primarytumour", MoveToTargetResolver.resourceKey("  PrimaryTumour.CSV "));
        assertEquals(3, resolver.resources().size());
        assertThrows(IllegalArgumentException.class, () -> MoveToTargetResolver.builder().target(" ", (l, r) -> Optional.empty()));
    }
}
