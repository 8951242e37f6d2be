package work.lcod.assembly.resolve;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.assembly.error.AmbiguousInputDefaultsException;
import work.lcod.assembly.error.ModelResolutionException;
import work.lcod.assembly.error.PromotionException;
import work.lcod.assembly.error.ResolutionException;
import work.lcod.assembly.support.ModelFixtures;

class ModelResolverTest {
    @Test
    void resolvingTwiceYieldsEqualModels() {
        var tree = ModelFixtures.twoLevelSlicing();
        var resolver = new ModelResolver();

        var first = resolver.resolve(tree);
        var second = resolver.resolve(tree);
        assertNotSame(first, second);
        assertEquals(first, second);
        assertEquals(first.promotions(), second.promotions());
        assertEquals(first.connections(), second.connections());
        assertEquals(first.shapeGraph(), second.shapeGraph());
    }

    @Test
    void scenarioBIsIdempotentToo() {
        var tree = ModelFixtures.scenarioB();
        assertEquals(new ModelResolver().resolve(tree), new ModelResolver().resolve(tree));
    }

    @Test
    void collectsEveryProblemBeforeThrowing() {
        var tree = ModelFixtures.conflictingInputs().promotes("C1", "nope").build();

        var ex = assertThrows(ModelResolutionException.class, () -> new ModelResolver().resolve(tree));
        assertEquals("multiple", ex.code());
        assertEquals(2, ex.errors().size());
        assertInstanceOf(PromotionException.class, ex.errors().get(0));
        assertInstanceOf(AmbiguousInputDefaultsException.class, ex.errors().get(1));
        assertEquals(1, ex.errorsOf(AmbiguousInputDefaultsException.class).size());
        assertTrue(ex.getMessage().startsWith("2 problems found"));
    }

    @Test
    void singleProblemIsThrownAsIs() {
        var ex = assertThrows(ResolutionException.class, () -> new ModelResolver().resolve(ModelFixtures.scenarioA()));
        assertInstanceOf(AmbiguousInputDefaultsException.class, ex);
    }

    @Test
    void errorsProjectToMaps() {
        var ex = assertThrows(ModelResolutionException.class,
            () -> new ModelResolver().resolve(ModelFixtures.conflictingInputs().promotes("C1", "nope").build()));

        var map = ex.toMap();
        assertEquals("multiple", map.get("code"));
        var errors = (List<?>) map.get("errors");
        assertEquals("promotion", ((Map<?, ?>) errors.get(0)).get("code"));
    }

    @Test
    void serializableProjectionListsVariablesAndConnections() {
        var model = new ModelResolver().resolve(ModelFixtures.twoLevelSlicing());
        var map = model.toSerializableMap();

        var variables = (Map<?, ?>) map.get("variables");
        assertEquals(List.of("S.y", "G.T.x"), List.copyOf(variables.keySet()));
        var target = (Map<?, ?>) variables.get("G.T.x");
        assertEquals("x", target.get("promotedName"));
        assertEquals(List.of(3), target.get("shape"));
        var connections = (List<?>) map.get("connections");
        var connection = (Map<?, ?>) connections.get(0);
        assertEquals(List.of(2, 5, 8), connection.get("srcIndices"));
        assertEquals(true, connection.get("explicit"));
    }
}
