package work.lcod.assembly.resolve;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.assembly.error.DistributedShapeMismatchException;
import work.lcod.assembly.error.ShapeMismatchException;
import work.lcod.assembly.error.UnresolvableShapeException;
import work.lcod.assembly.index.Indexer;
import work.lcod.assembly.model.ModelTree;
import work.lcod.assembly.model.PromotionRule;
import work.lcod.assembly.model.Shape;
import work.lcod.assembly.model.ShapeSpec;
import work.lcod.assembly.model.VariableDecl;
import work.lcod.assembly.support.ModelFixtures;

class ShapeInferenceEngineTest {
    @Test
    void outputTakesShapeOfConnectedInput() {
        var model = new ModelResolver().resolve(ModelFixtures.scenarioC());

        assertEquals(Shape.of(4, 2), model.variable("A.y").shape());
        assertEquals(ShapeGraph.Status.RESOLVED, model.shapeGraph().node("A.y").orElseThrow().status());
        assertEquals(ShapeGraph.Status.STATIC, model.shapeGraph().node("B.x").orElseThrow().status());
    }

    @Test
    void propagationIsDirectionAgnostic() {
        var forward = new ModelResolver().resolve(ModelFixtures.scenarioCMirrored());
        var backward = new ModelResolver().resolve(ModelFixtures.scenarioC());

        assertEquals(forward.variable("A.y").shape(), backward.variable("A.y").shape());
        assertEquals(forward.variable("B.x").shape(), backward.variable("B.x").shape());
    }

    @Test
    void copyShapeFollowsSibling() {
        var tree = ModelTree.builder()
            .leaf("S", leaf -> leaf.add(VariableDecl.output("out").shape(5)))
            .leaf("A", leaf -> leaf
                .add(VariableDecl.input("x").shapeByConnection())
                .add(VariableDecl.output("y").copyShape("x")))
            .connect("S.out", "A.x")
            .build();

        var model = new ModelResolver().resolve(tree);
        assertEquals(Shape.of(5), model.variable("A.y").shape());
        assertTrue(model.shapeGraph().edges().contains(new ShapeGraph.Edge("A.x", "A.y", ShapeGraph.EdgeKind.COPY)));
    }

    @Test
    void copyShapeWorksAgainstTheDeclaredDirection() {
        var tree = ModelTree.builder()
            .leaf("A", leaf -> leaf
                .add(VariableDecl.input("x").shapeByConnection())
                .add(VariableDecl.output("y").copyShape("x")))
            .leaf("B", leaf -> leaf.add(VariableDecl.input("z").shape(2, 2)))
            .connect("A.y", "B.z")
            .build();

        var model = new ModelResolver().resolve(tree);
        assertEquals(Shape.of(2, 2), model.variable("A.x").shape());
        assertEquals(ShapeSpec.Kind.BY_CONNECTION, model.autoSources().get(0).shapeSpec().kind());
        assertEquals(Shape.of(2, 2), model.variable("_auto_ivc.v0").shape());
    }

    @Test
    void computedShapeFiresOnceInputsAreKnown() {
        var tree = ModelTree.builder()
            .leaf("S", leaf -> leaf.add(VariableDecl.output("m").shape(2, 3)))
            .leaf("A", leaf -> leaf
                .add(VariableDecl.input("x").shapeByConnection())
                .add(VariableDecl.output("cols").computedShape(inputs -> Shape.of(inputs.get("x").dim(1)))))
            .connect("S.m", "A.x")
            .build();

        var model = new ModelResolver().resolve(tree);
        assertEquals(Shape.of(3), model.variable("A.cols").shape());
        assertTrue(model.shapeGraph().edges().contains(new ShapeGraph.Edge("A.x", "A.cols", ShapeGraph.EdgeKind.COMPUTED)));
    }

    @Test
    void failingShapeFunctionIsReported() {
        var tree = ModelTree.builder()
            .leaf("A", leaf -> leaf
                .add(VariableDecl.input("x").shape(2))
                .add(VariableDecl.output("y").computedShape(inputs -> Shape.of(inputs.get("x").dim(1)))))
            .build();

        var ex = assertThrows(ShapeMismatchException.class, () -> new ModelResolver().resolve(tree));
        assertEquals(List.of("A.y"), ex.paths());
    }

    @Test
    void unresolvedChainListsEveryPathAndKeepsTheGraph() {
        var tree = ModelTree.builder()
            .leaf("A", leaf -> leaf.add(VariableDecl.output("y").shapeByConnection()))
            .leaf("B", leaf -> leaf.add(VariableDecl.input("x").shapeByConnection()))
            .connect("A.y", "B.x")
            .build();

        var ex = assertThrows(UnresolvableShapeException.class, () -> new ModelResolver().resolve(tree));
        assertEquals(List.of("A.y", "B.x"), ex.paths());
        assertTrue(ex.getMessage().contains("A.y"));
        assertEquals(List.of("A.y", "B.x"), ex.shapeGraph().unresolved());
        assertEquals(
            List.of(new ShapeGraph.Edge("A.y", "B.x", ShapeGraph.EdgeKind.CONNECTION)),
            ex.shapeGraph().edges());
    }

    @Test
    void slicedConnectionNeedsSourceShapeToPropagateUpstream() {
        var tree = ModelTree.builder()
            .leaf("A", leaf -> leaf.add(VariableDecl.output("y").shapeByConnection()))
            .leaf("B", leaf -> leaf.add(VariableDecl.input("x").shape(2)))
            .connect("A.y", "B.x", Indexer.parse("[0, 2]"))
            .build();

        assertThrows(UnresolvableShapeException.class, () -> new ModelResolver().resolve(tree));
    }

    @Test
    void declaredSrcShapeSeedsAutoSource() {
        var tree = ModelTree.builder()
            .leaf("T", leaf -> leaf.add(VariableDecl.input("x").shape(2)))
            .promote(PromotionRule.builder("T", "x").srcIndices(Indexer.parse("[1, 3]")).srcShape(Shape.of(4)))
            .build();

        var model = new ModelResolver().resolve(tree);
        assertEquals(Shape.of(4), model.variable("_auto_ivc.v0").shape());
        assertEquals("[1, 3]", model.sourceOf("T.x").orElseThrow().srcIndices().toString());
    }

    @Test
    void dynamicDistributedOutputCannotFeedDynamicSerialInput() {
        var tree = ModelTree.builder()
            .leaf("S", leaf -> leaf.add(VariableDecl.output("out").shape(4)))
            .leaf("A", leaf -> leaf
                .add(VariableDecl.input("w").shapeByConnection())
                .add(VariableDecl.output("y").copyShape("w").distributed(true)))
            .leaf("B", leaf -> leaf.add(VariableDecl.input("x").shapeByConnection()))
            .connect("S.out", "A.w")
            .connect("A.y", "B.x")
            .build();

        var ex = assertThrows(DistributedShapeMismatchException.class, () -> new ModelResolver().resolve(tree));
        assertEquals(List.of("A.y", "B.x"), ex.paths());
    }

    @Test
    void staticOutputMayFeedDistributedInput() {
        var tree = ModelTree.builder()
            .leaf("S", leaf -> leaf.add(VariableDecl.output("out").shape(4)))
            .leaf("B", leaf -> leaf.add(VariableDecl.input("x").shapeByConnection().distributed(true)))
            .connect("S.out", "B.x")
            .build();

        assertEquals(Shape.of(4), new ModelResolver().resolve(tree).variable("B.x").shape());
    }
}
