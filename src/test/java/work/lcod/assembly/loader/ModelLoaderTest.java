package work.lcod.assembly.loader;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.assembly.index.Indexer;
import work.lcod.assembly.model.DefaultValue;
import work.lcod.assembly.model.PromotionRule;
import work.lcod.assembly.model.Shape;
import work.lcod.assembly.model.ShapeSpec;
import work.lcod.assembly.resolve.ModelResolver;
import work.lcod.assembly.support.ModelFixtures;

class ModelLoaderTest {
    @Test
    void loadsLeavesAndPromotions() {
        var tree = ModelLoader.loadFromLocalFile(ModelFixtures.resource("models", "scenario-b.yaml"));

        assertEquals(List.of("C1.x", "C2.x"), List.copyOf(tree.variables().keySet()));
        var decl = tree.variable("C1.x").decl();
        assertEquals(DefaultValue.continuous(3000.0), decl.defaultValue());
        assertEquals("mm", decl.units());
        assertEquals(2, tree.root().promotions().size());
        var defaults = tree.root().inputDefaults().get(0);
        assertEquals("x", defaults.name());
        assertEquals("m", defaults.override().units());
    }

    @Test
    void loadsNestedGroupsWithSlicing() {
        var tree = ModelLoader.loadFromLocalFile(ModelFixtures.resource("models", "sliced.yaml"));

        assertEquals(ShapeSpec.of(3, 3), tree.variable("S.y").decl().shapeSpec());
        assertEquals(ShapeSpec.Kind.COPY_SHAPE, tree.variable("G.T.y").decl().shapeSpec().kind());
        assertTrue(tree.variable("G.T.mode").decl().discrete());
        var rule = tree.system("G").promotions().get(0);
        assertEquals(Indexer.parse(":, 1"), rule.srcIndices());
        assertEquals(Shape.of(3, 2), rule.srcShape());
        assertEquals("out", tree.system("G").promotions().get(1).alias());
        assertEquals(PromotionRule.Filter.INPUTS, tree.root().promotions().get(0).filter());
        assertEquals(Indexer.parse(":, [0, 2]"), tree.root().connections().get(0).srcIndices());
    }

    @Test
    void loadedModelResolves() {
        var model = new ModelResolver().resolve(ModelLoader.loadFromLocalFile(ModelFixtures.resource("models", "sliced.yaml")));

        assertArrayEquals(new int[] { 2, 5, 8 }, model.sourceOf("G.T.x").orElseThrow().srcIndices().flatIndices());
        assertEquals(Shape.of(3), model.variable("G.T.y").shape());
        assertEquals("G.out", model.variable("G.T.y").promotedName());
        assertEquals("fast", model.inputStartValue("G.T.mode").discreteValue());
    }

    @Test
    void readsJsonWithFlatIndices() {
        var tree = ModelLoader.loadFromLocalFile(ModelFixtures.resource("models", "flat.json"));
        assertEquals(Indexer.flat(3, 0), tree.root().connections().get(0).srcIndices());

        var model = new ModelResolver().resolve(tree);
        assertEquals(Shape.of(2), model.variable("T.x").shape());
        assertArrayEquals(new int[] { 3, 0 }, model.sourceOf("T.x").orElseThrow().srcIndices().flatIndices());
    }

    @Test
    void parsesInlineDocuments() {
        var tree = ModelLoader.parse("""
            model:
              children:
                - name: A
                  variables:
                    - { name: x, val: [1, 2, 3] }
            """);
        assertEquals(Shape.of(3), tree.variable("A.x").decl().shapeSpec().shape());
        assertTrue(tree.variable("A.x").isInput());
    }

    @Test
    void rejectsMalformedModels() {
        var ex = assertThrows(IllegalArgumentException.class,
            () -> ModelLoader.loadFromLocalFile(ModelFixtures.resource("models", "malformed.yaml")));
        assertTrue(ex.getMessage().contains("unknown io 'sideways'"));
        assertThrows(IllegalArgumentException.class, () -> ModelLoader.parse("children: []"));
        assertThrows(IllegalArgumentException.class, () -> ModelLoader.parse("model:\n  children:\n    - { variables: [] }"));
    }

    @Test
    void missingFileIsAReadFailure() {
        assertThrows(IllegalStateException.class,
            () -> ModelLoader.loadFromLocalFile(ModelFixtures.resource("models", "absent.yaml")));
    }
}
