package io.github.cyfko.curatorkit.core.rewrite;

import io.github.cyfko.curatorkit.core.impl.CriterionDslParser;
import io.github.cyfko.curatorkit.core.lookup.LookupTable;
import io.github.cyfko.curatorkit.core.lookup.ResourceTable;
import io.github.cyfko.curatorkit.core.model.Criterion;
import io.github.cyfko.curatorkit.core.model.Document;
import io.github.cyfko.curatorkit.core.model.LeafCriterion;
import io.github.cyfko.curatorkit.core.model.ListCriterion;
import io.github.cyfko.curatorkit.core.ontology.OncoTreeFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LeafOverwriter Tests")
class LeafOverwriterTest {

    private final CriterionDslParser parser = new CriterionDslParser();

    private LeafOverwriter<ResourceTable.Row> overwriter;

    @BeforeEach
    void setUp() {
        MoveToTargetResolver resolver = MoveToTargetResolver.builder()
                .resource(RewriteFixtures.primaryTumour())
                .resource(RewriteFixtures.molecularSignature())
                .withDefaultTargets(OncoTreeFixtures.lungAndBreast())
                .build();
        CurationColumnsRewrite rewrite = CurationColumnsRewrite.builder()
                .required("Gene_curation", "gene")
                .optional("Variant_curation", "variant")
                .build();
        overwriter = LeafOverwriter.forResource("gene", List.of("gene", "variant"),
                RewriteFixtures.geneAlteration(), resolver, rewrite);
    }

    private Document document(String text) {
        return new Document("doc-1", text, parser.parseForest(text));
    }

    @Nested
    @DisplayName("Per-leaf outcomes")
    class Outcomes {

        @Test
        @DisplayName("Should rewrite, move and remove leaves in one pass")
        void shouldRewriteMoveAndRemove() {
            // Given
            Document document = document("and{\n"
                    + "    gene(gene=\"KRAS\", variant=\"G12C\"),\n"
                    + "    gene(gene=\"EGFR\"),\n"
                    + "    not{ gene(gene=\"ALK\") },\n"
                    + "    gene(gene=\"Lung Adenocarcinoma\"),\n"
                    + "    gene(gene=\"HRD\"),\n"
                    + "    gene(gene=\"BRAF\"),\n"
                    + "    gene(gene=\"ROS1\"),\n"
                    + "    age(min=18)\n"
                    + "}");

            // When
            OverwriteReport report = overwriter.overwrite(document);

            // Then
            List<Criterion> children = ((ListCriterion) document.roots().get(0)).children();
            assertEquals(5, children.size());
            assertEquals(new LeafCriterion("gene", Map.of("gene", List.of("KRAS"), "variant", List.of("G12C"))),
                    children.get(0));
            assertEquals(List.of("L858R", "T790M"), ((LeafCriterion) children.get(1)).get("variant"));
            assertEquals(TargetBuilders.PRIMARY_TUMOR_TYPE, children.get(2).typeName());
            assertEquals(TargetBuilders.MOLECULAR_SIGNATURE_TYPE, children.get(3).typeName());
            assertEquals("age", children.get(4).typeName());
            assertEquals(new OverwriteReport(7, 2, 2, 3), report);
        }

        @Test
        @DisplayName("Should not fall back to the gene alone when the variant is unmapped")
        void shouldNotDegradeMappedTuple() {
            Document document = document("or{ gene(gene=\"KRAS\", variant=\"G13D\"), gene(gene=\"KRAS\") }");

            OverwriteReport report = overwriter.overwrite(document);

            assertEquals(1, report.removed());
            assertEquals(List.of(new LeafCriterion("gene", Map.of("gene", List.of("KRAS"), "variant", List.of()))),
                    ((ListCriterion) document.roots().get(0)).children());
        }

        @Test
        @DisplayName("Should leave the document empty when its only leaf goes")
        void shouldEmptyDocument() {
            Document document = document("if{ not{ gene(gene=\"BRAF\") } } then{ age() }");

            overwriter.overwrite(document);

            assertTrue(document.isDiscardable());
        }

        @Test
        @DisplayName("Should ignore leaves of other types")
        void shouldIgnoreOtherTypes() {
            Document document = document("age(min=18)");

            assertEquals(OverwriteReport.empty(), overwriter.overwrite(document));
            assertEquals(parser.parse("age(min=18)"), document.roots().get(0));
        }

        @Test
        @DisplayName("Should sum the counts of several runs")
        void shouldSumReports() {
            OverwriteReport total = overwriter.overwrite(List.of(document("gene(gene=\"KRAS\")"), document("gene(gene=\"BRAF\")")))
                    .plus(new OverwriteReport(1, 1, 0, 0));

            assertEquals(new OverwriteReport(3, 2, 0, 1), total);
        }
    }

    @Nested
    @DisplayName("Configuration")
    class Configuration {

        private final LookupTable<String> table = LookupTable.<String>builder("t", List.of("A_lookup", "B_lookup"))
                .put(List.of("x", "y"), "xy")
                .build();

        @Test
        @DisplayName("Should accept any lookup value type")
        void shouldAcceptCustomValues() {
            LeafOverwriter<String> custom = LeafOverwriter.<String>builder()
                    .targetType("t")
                    .keyFields("a", "b")
                    .table(table)
                    .rewrite((leaf, value) -> Map.of("label", value))
                    .build();
            Document document = new Document("doc-1", parser.parse("t(a=\"X\", b=\"Y\", c=1)"));

            custom.overwrite(document);

            assertEquals(new LeafCriterion("t", Map.of("label", "xy")), document.roots().get(0));
            assertEquals("t", custom.targetType());
        }

        @Test
        @DisplayName("Should reject an incomplete configuration")
        void shouldRejectIncompleteConfiguration() {
            assertThrows(IllegalArgumentException.class, () -> LeafOverwriter.<String>builder()
                    .table(table).keyFields("a").rewrite((leaf, value) -> null).build());
            assertThrows(IllegalArgumentException.class, () -> LeafOverwriter.<String>builder()
                    .targetType("t").table(table).keyFields("a", "b", "c").rewrite((leaf, value) -> null).build());
            assertThrows(IllegalArgumentException.class, () -> LeafOverwriter.<String>builder()
                    .targetType("t").table(table).rewrite((leaf, value) -> null).build());
            assertThrows(NullPointerException.class, () -> LeafOverwriter.<String>builder()
                    .targetType("t").keyFields("a").rewrite((leaf, value) -> null).build());
            assertThrows(IllegalStateException.class, () -> CurationColumnsRewrite.builder().build());
        }
    }
}
