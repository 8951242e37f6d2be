package work.lcod.assembly.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class ModelTreeTest {
    @Test
    void indexesSystemsAndVariablesInDeclarationOrder() {
        var tree = ModelTree.builder()
            .group("G", group -> group
                .leaf("A", leaf -> leaf.add(VariableDecl.input("x")).add(VariableDecl.output("y")))
                .leaf("B", leaf -> leaf.add(VariableDecl.input("z"))))
            .leaf("C", leaf -> leaf.add(VariableDecl.output("w")))
            .build();

        assertEquals(List.of("", "G", "G.A", "G.B", "C"), List.copyOf(tree.systems().keySet()));
        assertEquals(List.of("G.A.x", "G.A.y", "G.B.z", "C.w"), List.copyOf(tree.variables().keySet()));
        assertTrue(tree.variable("G.A.x").isInput());
        assertFalse(tree.variable("C.w").isInput());
        assertEquals("G.A", tree.variable("G.A.y").systemPath());
    }

    @Test
    void stampsIncreasingSequenceNumbers() {
        var tree = ModelTree.builder()
            .group("G", group -> group
                .leaf("A", leaf -> leaf.add(VariableDecl.input("x")))
                .inputDefaults("x", InputOverride.of(2.0, null)))
            .promotes("G", "x")
            .inputDefaults("x", InputOverride.of(3.0, null))
            .build();

        long groupSequence = tree.system("G").inputDefaults().get(0).sequence();
        long rootSequence = tree.root().inputDefaults().get(0).sequence();
        long ruleSequence = tree.root().promotions().get(0).sequence();
        assertTrue(groupSequence < ruleSequence);
        assertTrue(ruleSequence < rootSequence);
    }

    @Test
    void variableDefaultsToScalarOne() {
        var decl = VariableDecl.input("x").build();
        assertEquals(DefaultValue.ONE, decl.defaultValue());
        assertEquals(Shape.SCALAR, decl.shapeSpec().shape());
    }

    @Test
    void staticShapeFollowsDefaultValueLength() {
        var decl = VariableDecl.input("x").value(new double[] { 1, 2, 3 }).build();
        assertEquals(Shape.of(3), decl.shapeSpec().shape());
    }

    @Test
    void rejectsDuplicatesAndBadReferences() {
        assertThrows(IllegalArgumentException.class, () -> ModelTree.builder()
            .leaf("A", leaf -> leaf.add(VariableDecl.input("x")).add(VariableDecl.output("x"))));
        assertThrows(IllegalArgumentException.class, () -> ModelTree.builder()
            .leaf("A", leaf -> leaf.add(VariableDecl.output("y").copyShape("missing"))));
        assertThrows(IllegalArgumentException.class, () -> ModelTree.builder()
            .leaf("A", leaf -> { })
            .leaf("A", leaf -> { }));
        assertThrows(IllegalArgumentException.class, () -> VariableDecl.input("x").discrete(true).units("m").build());
    }

    @Test
    void parsesAliasPromotions() {
        var rule = PromotionRule.parse("C1", "x as a").build();
        assertEquals("x", rule.pattern());
        assertEquals("a", rule.alias());
        assertEquals("a", rule.promotedName("x"));
        assertTrue(rule.matches("x", IoDirection.INPUT));
    }

    @Test
    void globsMatchWithFilter() {
        var rule = PromotionRule.builder("C1", "x*").filter(PromotionRule.Filter.INPUTS).build();
        assertTrue(rule.isWildcard());
        assertTrue(rule.matches("x1", IoDirection.INPUT));
        assertFalse(rule.matches("x1", IoDirection.OUTPUT));
        assertFalse(rule.matches("y", IoDirection.INPUT));
        assertTrue(PromotionRule.builder("C1", "[ab]?").build().matches("b7", IoDirection.OUTPUT));
    }
}
