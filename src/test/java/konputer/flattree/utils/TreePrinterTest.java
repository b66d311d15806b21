package konputer.flattree.utils;

import konputer.flattree.FlatTree;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TreePrinterTest {

    private static FlatTree<String> sample() {
        return FlatTree.fromSequences(
                List.of("root", "child1", "child2", "gc0", "gc1"),
                List.of(0, 0, 0, 1, 2));
    }

    @Test
    void testSimple() {
        assertEquals("root {0}, child1 {0}, child2 {0}, gc0 {1}, gc1 {2}", TreePrinter.simple(sample()));
        assertEquals("solo {0}", TreePrinter.simple(new FlatTree<>("solo")));
    }

    @Test
    void testToStringUsesSimple() {
        FlatTree<String> tree = sample();
        assertEquals(TreePrinter.simple(tree), tree.toString());
    }

    @Test
    void testMultiMap() {
        String expected = "root: \n" +
                "child1: gc0\n" +
                "child2: gc1\n";
        assertEquals(expected, TreePrinter.multiMap(sample()));
    }

    @Test
    void testMultiMapListsSiblingsInSlotOrder() {
        FlatTree<String> tree = new FlatTree<>("r");
        tree.insert(0, "a");
        tree.insertAll(1, List.of("x", "y", "z"));
        assertEquals("r: \na: x,y,z\n", TreePrinter.multiMap(tree));
    }
}
