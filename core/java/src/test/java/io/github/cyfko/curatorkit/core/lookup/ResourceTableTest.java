package io.github.cyfko.curatorkit.core.lookup;

import io.github.cyfko.curatorkit.core.exception.LookupDefinitionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ResourceTable Tests")
class ResourceTableTest {

    private ResourceTable table;

    @BeforeEach
    void setUp() {
        table = new ResourceTable("gene_alteration",
                List.of(" Gene_lookup", "Variant_LOOKUP", "Gene_curation", "Move_to"),
                List.of(
                        List.of("KRAS", "G12C", "KRAS", ""),
                        Arrays.asList("EGFR", null, "EGFR", "PrimaryTumour.csv "),
                        List.of("BRAF")));
    }

    @Test
    @DisplayName("Should classify columns by suffix, case-insensitively")
    void shouldClassifyColumns() {
        assertEquals(List.of("Gene_lookup", "Variant_LOOKUP"), table.lookupColumns());
        assertEquals(List.of("Gene_curation"), table.curationColumns());
        assertEquals(Optional.of("Move_to"), table.moveToColumn());
        assertEquals(Optional.of("Gene_lookup"), table.firstLookupColumn());
        assertTrue(table.hasColumn("gene_LOOKUP"));
    }

    @Test
    @DisplayName("Should pad short rows and blank null cells")
    void shouldPadRows() {
        ResourceTable.Row braf = table.rows().get(2);

        assertEquals(List.of("BRAF", "", "", ""), braf.cells());
        assertEquals("", table.rows().get(1).get("variant_lookup"));
        assertEquals(2, braf.index());
    }

    @Test
    @DisplayName("Should expose a non-empty Move-to target stripped")
    void shouldExposeMoveTo() {
        assertEquals(Optional.empty(), table.rows().get(0).moveTo());
        assertEquals(Optional.of("PrimaryTumour.csv"), table.rows().get(1).moveTo());
    }

    @Test
    @DisplayName("Should find the first row by normalized value")
    void shouldFindFirst() {
        assertEquals(1, table.findFirst("Gene_lookup", " egfr ").map(ResourceTable.Row::index).orElse(-1));
        assertTrue(table.findFirst("Gene_lookup", "n/a").isEmpty());
        assertTrue(table.findFirst("Gene_lookup", "ALK").isEmpty());
    }

    @Test
    @DisplayName("Should reject unknown and missing columns")
    void shouldRejectUnknownColumns() {
        LookupDefinitionException e = assertThrows(LookupDefinitionException.class,
                () -> table.requireColumns("Gene_lookup", "Oncotree_curation"));

        assertTrue(e.getMessage().contains("[Oncotree_curation]"));
        assertThrows(LookupDefinitionException.class, () -> table.rows().get(0).get("nope"));
    }

    @Test
    @DisplayName("Should reject duplicate columns and overlong rows")
    void shouldRejectMalformedTables() {
        assertThrows(LookupDefinitionException.class,
                () -> new ResourceTable("t", List.of("A", "a "), List.of()));
        assertThrows(LookupDefinitionException.class,
                () -> new ResourceTable("t", List.of("A"), List.of(List.of("x", "y"))));
    }

    @Test
    @DisplayName("Should repair mojibake in headers and cells")
    void shouldRepairMojibake() {
        ResourceTable repaired = new ResourceTable("t", List.of("Age_lookup"), List.of(List.of("â‰¥ 18")));

        assertEquals("≥ 18", repaired.rows().get(0).get("Age_lookup"));
    }
}
