package work.lcod.assembly.index;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import work.lcod.assembly.model.Shape;

class IndexerTest {
    @Test
    void selectsColumnsWithArraySelector() {
        var indexer = Indexer.parse(":, [0, 2]");
        assertEquals(Shape.of(3, 2), indexer.resultShape(Shape.of(3, 3)));
        assertArrayEquals(new int[] { 0, 2, 3, 5, 6, 8 }, indexer.flatIndices(Shape.of(3, 3)));
    }

    @Test
    void integerSelectorDropsDimension() {
        var indexer = Indexer.parse(":, 1");
        assertEquals(Shape.of(3), indexer.resultShape(Shape.of(3, 2)));
        assertArrayEquals(new int[] { 1, 3, 5 }, indexer.flatIndices(Shape.of(3, 2)));
    }

    @Test
    void singleIntegerYieldsScalar() {
        var indexer = Indexer.parse("-1");
        assertEquals(Shape.SCALAR, indexer.resultShape(Shape.of(5)));
        assertArrayEquals(new int[] { 4 }, indexer.flatIndices(Shape.of(5)));
    }

    @Test
    void followsSliceSemantics() {
        assertArrayEquals(new int[] { 3, 2, 1, 0 }, Indexer.parse("::-1").flatIndices(Shape.of(4)));
        assertArrayEquals(new int[] { 1, 3 }, Indexer.parse("1:4:2").flatIndices(Shape.of(5)));
        assertArrayEquals(new int[] { 3, 4 }, Indexer.parse("-2:").flatIndices(Shape.of(5)));
        assertArrayEquals(new int[] { 0, 1, 2 }, Indexer.parse(":10").flatIndices(Shape.of(3)));
        assertEquals(Shape.of(0), Indexer.parse("3:1").resultShape(Shape.of(5)));
    }

    @Test
    void trailingDimensionsAreTakenWhole() {
        var indexer = Indexer.of(Selector.at(1));
        assertEquals(Shape.of(3), indexer.resultShape(Shape.of(2, 3)));
        assertArrayEquals(new int[] { 3, 4, 5 }, indexer.flatIndices(Shape.of(2, 3)));
    }

    @Test
    void adjacentArraySelectorsPairElementWise() {
        var indexer = Indexer.parse("[0, 1], [1, 2]");
        assertEquals(Shape.of(2), indexer.resultShape(Shape.of(3, 3)));
        assertArrayEquals(new int[] { 1, 5 }, indexer.flatIndices(Shape.of(3, 3)));
    }

    @Test
    void separatedArraySelectorsMoveToTheFront() {
        var indexer = Indexer.parse("[0, 2], :, [1, 2]");
        assertEquals(Shape.of(2, 3), indexer.resultShape(Shape.of(3, 3, 4)));
        assertArrayEquals(new int[] { 1, 5, 9, 26, 30, 34 }, indexer.flatIndices(Shape.of(3, 3, 4)));
    }

    @Test
    void integerSelectorBroadcastsWithArrays() {
        var indexer = Indexer.parse("1, :, [0, 3]");
        assertEquals(Shape.of(2, 3), indexer.resultShape(Shape.of(2, 3, 4)));
        assertArrayEquals(new int[] { 12, 16, 20, 15, 19, 23 }, indexer.flatIndices(Shape.of(2, 3, 4)));
        assertEquals(Shape.of(2), Indexer.parse("[1], [0, 2]").resultShape(Shape.of(2, 3)));
        assertThrows(IllegalArgumentException.class, () -> Indexer.parse("[0, 1], [0, 1, 2]").resultShape(Shape.of(3, 3)));
    }

    @Test
    void flatIndicesAddressRaveledSource() {
        var indexer = Indexer.flat(0, 5, -1);
        assertEquals(Shape.of(3), indexer.resultShape(Shape.of(2, 4)));
        assertArrayEquals(new int[] { 0, 5, 7 }, indexer.flatIndices(Shape.of(2, 4)));
    }

    @Test
    void rejectsOutOfBoundsAndTooManyIndices() {
        assertThrows(IllegalArgumentException.class, () -> Indexer.parse("3").flatIndices(Shape.of(3)));
        assertThrows(IllegalArgumentException.class, () -> Indexer.parse("[0, -4]").resultShape(Shape.of(3)));
        assertThrows(IllegalArgumentException.class, () -> Indexer.parse("0, 0").resultShape(Shape.of(3)));
        assertThrows(IllegalArgumentException.class, () -> Indexer.flat(6).flatIndices(Shape.of(2, 3)));
    }

    @Test
    void rejectsMalformedText() {
        assertThrows(IllegalArgumentException.class, () -> Indexer.parse("[0, 1"));
        assertThrows(IllegalArgumentException.class, () -> Indexer.parse("a"));
        assertThrows(IllegalArgumentException.class, () -> Indexer.parse("::0"));
        assertThrows(IllegalArgumentException.class, () -> Indexer.parse(" "));
    }

    @Test
    void rendersAndComparesByValue() {
        assertEquals("[:, [0, 2]]", Indexer.parse(":, [0, 2]").toString());
        assertEquals(Indexer.of(Selector.all(), Selector.array(0, 2)), Indexer.parse(":,[0,2]"));
        assertEquals("flat[1, 2]", Indexer.flat(1, 2).toString());
    }
}
