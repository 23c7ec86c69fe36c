package io.github.cyfko.curatorkit.core.tree;

import io.github.cyfko.curatorkit.core.impl.CriterionDslParser;
import io.github.cyfko.curatorkit.core.model.AndCriterion;
import io.github.cyfko.curatorkit.core.model.Criteria;
import io.github.cyfko.curatorkit.core.model.Criterion;
import io.github.cyfko.curatorkit.core.model.Document;
import io.github.cyfko.curatorkit.core.model.LeafCriterion;
import io.github.cyfko.curatorkit.core.model.NotCriterion;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TreeWalker Tests")
class TreeWalkerTest {

    private final CriterionDslParser parser = new CriterionDslParser();

    @Test
    @DisplayName("Should visit parents before children, slot by slot")
    void shouldVisitInPreOrder() {
        // Given
        Criterion root = parser.parse("and{ a(), if{ b() } then{ not{ c() } } else{ d() } }");

        // When
        List<NodeVisit> rows = TreeWalker.tabulate(List.of(root));

        // Then
        assertEquals(List.of("and", "a", "if", "b", "not", "c", "d"),
                rows.stream().map(v -> v.node().typeName()).collect(Collectors.toList()));
        assertEquals(List.of(0, 1, 1, 2, 2, 3, 2),
                rows.stream().map(NodeVisit::depth).collect(Collectors.toList()));
        NodeVisit c = rows.get(5);
        assertSame(rows.get(4).node(), c.parent());
        assertSame(rows.get(2).node(), c.grandparent());
        assertSame(root, c.path().get(0));
        assertTrue(rows.get(0).isRoot());
    }

    @Test
    @DisplayName("Should report the slot of a child by identity")
    void shouldReportSlots() {
        LeafCriterion cond = new LeafCriterion("x");
        LeafCriterion then = new LeafCriterion("x");
        LeafCriterion other = new LeafCriterion("x");
        Criterion ifNode = Criteria.ifThenElse(cond, then, other);

        assertEquals(ChildSlot.CONDITION, TreeWalker.slotOf(ifNode, cond));
        assertEquals(ChildSlot.THEN, TreeWalker.slotOf(ifNode, then));
        assertEquals(ChildSlot.ELSE, TreeWalker.slotOf(ifNode, other));
        assertNull(TreeWalker.slotOf(ifNode, new LeafCriterion("x")), "An equal but distinct node is not a child");
        assertEquals(ChildSlot.CRITERION, TreeWalker.slotOf(Criteria.not(cond), cond));
        assertEquals(ChildSlot.CRITERION, TreeWalker.slotOf(Criteria.timing(cond, "reference", "now"), cond));
        assertNull(TreeWalker.slotOf(cond, then));
    }

    @Test
    @DisplayName("Should visit identical siblings separately")
    void shouldVisitIdenticalSiblings() {
        AndCriterion root = Criteria.and(new LeafCriterion("x"), new LeafCriterion("x"));

        List<NodeVisit> rows = TreeWalker.tabulate(List.of(root));

        assertEquals(3, rows.size());
        assertNotSame(rows.get(1).node(), rows.get(2).node());
    }

    @Test
    @DisplayName("Should visit a node reached twice only once")
    void shouldSkipCycles() {
        NotCriterion loop = Criteria.not(new LeafCriterion("x"));
        loop.setChild(loop);
        List<Criterion> visited = new ArrayList<>();

        TreeWalker.walkNode(loop, visit -> visited.add(visit.node()));

        assertEquals(1, visited.size());
    }

    @Test
    @DisplayName("Should find types anywhere in a forest")
    void shouldFindTypes() {
        List<Criterion> forest = parser.parseForest("age(min=18)\nnot{ or{ histology(), bmi() } }");

        assertTrue(TreeWalker.containsType(forest, Set.of("histology")));
        assertTrue(TreeWalker.containsType(forest, Set.of("or")));
        assertFalse(TreeWalker.containsType(forest, Set.of("gene")));
        assertFalse(TreeWalker.containsType(forest.get(0), Set.of("bmi")));
    }

    @Test
    @DisplayName("Should carry the document and skip nodes detached by an earlier rewrite")
    void shouldSkipDetachedNodes() {
        // Given
        Document document = new Document("doc-1", "", parser.parseForest("and{ a(), not{ b() } }"));
        List<String> visited = new ArrayList<>();

        // When: removing the 'not' detaches 'b'
        TreeWalker.walkForRewrite(List.of(document), visit -> {
            assertSame(document, visit.document());
            visited.add(visit.node().typeName());
            if (visit.node().typeName().equals("not")) {
                NodeReplacer.remove(visit);
            }
        });

        // Then
        assertEquals(List.of("and", "a", "not"), visited);
        assertEquals(parser.parse("and{ a() }"), document.roots().get(0));
    }

    @Test
    @DisplayName("Should tabulate documents in order")
    void shouldTabulateDocuments() {
        Document first = new Document("doc-1", parser.parse("a()"));
        Document second = new Document("doc-2", parser.parse("not{ b() }"));

        List<NodeVisit> rows = TreeWalker.tabulateDocuments(List.of(first, second));

        assertEquals(List.of("doc-1", "doc-2", "doc-2"),
                rows.stream().map(v -> v.document().id()).collect(Collectors.toList()));
    }

    @Test
    @DisplayName("Should reject a visit whose depth disagrees with its path")
    void shouldValidateVisits() {
        LeafCriterion leaf = new LeafCriterion("x");

        assertThrows(IllegalArgumentException.class, () -> new NodeVisit(null, leaf, null, 1, List.of()));
        assertThrows(IllegalArgumentException.class,
                () -> new NodeVisit(null, leaf, new LeafCriterion("y"), 1, List.of(new LeafCriterion("y"))));
    }
}
