package konputer.flattree;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FlatTreeRemoveTest {
    private FlatTree<String> tree;

    @BeforeEach
    void setUp() {
        tree = FlatTree.fromSequences(
                List.of("root", "child1", "child2", "gc0", "gc1", "gc2", "gc3", "gc4"),
                List.of(0, 0, 0, 1, 1, 1, 2, 2));
    }

    @Test
    void testRemoveSubtree() {
        assertTrue(tree.remove(1));
        assertEquals(4, tree.size());
        assertTrue(tree.isValid());
        assertEquals(Set.of("root", "child2", "gc3", "gc4"), new HashSet<>(tree.values()));

        int child2 = tree.values().indexOf("child2");
        int gc3 = tree.values().indexOf("gc3");
        int gc4 = tree.values().indexOf("gc4");
        assertEquals(0, tree.getParentIndex(child2));
        assertEquals(child2, tree.getParentIndex(gc3));
        assertEquals(child2, tree.getParentIndex(gc4));
        assertEquals(Set.of(gc3, gc4), new HashSet<>(tree.getAllDescendants(child2)));
        assertTrue(tree.doesIndexExist(child2));
        assertFalse(tree.doesIndexExist(gc3));
    }

    @Test
    void testRemoveLeafIsNoOp() {
        FlatTree<String> before = FlatTree.copyOf(tree);
        assertFalse(tree.remove(3));
        assertFalse(tree.remove(7));
        assertEquals(before, tree);
    }

    @Test
    void testRemoveOutOfRangeFails() {
        FlatTree<String> before = FlatTree.copyOf(tree);
        assertFalse(tree.remove(8));
        assertFalse(tree.remove(-3));
        assertEquals(before, tree);
    }

    @Test
    void testRemoveRootKeepsOnlyRoot() {
        assertTrue(tree.remove(0));
        assertEquals(1, tree.size());
        assertTrue(tree.isEmpty());
        assertEquals("root", tree.get(0));
        assertFalse(tree.remove(0));
    }

    @Test
    void testRelocatedNodeKeepsItsChildren() {
        // last slot holds "d" which has a child, removing "a" moves "d" into a freed slot
        FlatTree<String> t = FlatTree.fromSequences(
                List.of("r", "a", "a1", "b", "d1", "d"),
                List.of(0, 0, 1, 0, 5, 0));
        assertTrue(t.remove(1));
        assertEquals(4, t.size());
        assertTrue(t.isValid());

        int d = t.values().indexOf("d");
        int d1 = t.values().indexOf("d1");
        int b = t.values().indexOf("b");
        assertEquals(d, t.getParentIndex(d1));
        assertEquals(0, t.getParentIndex(d));
        assertEquals(0, t.getParentIndex(b));
        assertEquals(List.of(d1), t.getAllDescendants(d));
    }

    @Test
    void testRemoveAfterTruncatingResize() {
        // "z" keeps parent 4 after the resize drops slot 4
        FlatTree<String> t = FlatTree.fromSequences(
                List.of("r", "a", "a1", "z", "w"),
                List.of(0, 0, 1, 4, 0));
        t.resize(4);

        assertTrue(t.remove(1));
        assertEquals(2, t.size());
        assertTrue(t.isValid());
        assertEquals(List.of("r", "z"), List.copyOf(t.values()));
        assertEquals(4, t.getParentIndex(1));
    }

    @Test
    void testRemoveDeepSubtree() {
        FlatTree<Integer> t = new FlatTree<>(0);
        t.insert(0, 1);
        t.insert(0, 2);
        for (int i = 3; i < 30; i++) {
            t.insert(i % 2 == 0 ? 2 : 1, i);
        }
        int subtree = t.getAllDescendants(1).size();
        assertTrue(t.remove(1));
        assertEquals(30 - 1 - subtree, t.size());
        for (int v : t) {
            assertTrue(v == 0 || v == 2 || v % 2 == 0, "value " + v + " should have been removed");
        }
    }

    @Test
    void testRandomOperationsKeepInvariants() {
        Random random = new Random(7);
        FlatTree<Integer> t = new FlatTree<>(0);
        int nextValue = 1;

        for (int step = 0; step < 600; step++) {
            int sizeBefore = t.size();
            if (random.nextInt(3) > 0 || sizeBefore < 3) {
                int parent = random.nextInt(sizeBefore);
                assertTrue(t.insert(parent, nextValue++));
                assertEquals(sizeBefore + 1, t.size());
            } else {
                int victim = 1 + random.nextInt(sizeBefore - 1);
                Map<Integer, Integer> parentValues = parentValueMap(t);
                int expectedGone = t.getAllDescendants(victim).size();
                boolean removed = t.remove(victim);
                if (expectedGone == 0) {
                    assertFalse(removed);
                    assertEquals(sizeBefore, t.size());
                } else {
                    assertTrue(removed);
                    assertEquals(sizeBefore - 1 - expectedGone, t.size());
                    assertEquals(parentValues.size() - 1 - expectedGone, parentValueMap(t).size());
                }
                // surviving nodes keep the same parent value
                Map<Integer, Integer> after = parentValueMap(t);
                for (Map.Entry<Integer, Integer> e : after.entrySet()) {
                    assertEquals(parentValues.get(e.getKey()), e.getValue(), "parent of value " + e.getKey());
                }
            }
            assertTrue(t.isValid());
            assertEquals(0, t.getParentIndex(0));
            assertDescendantsComplete(t);
        }
    }

    // value -> value of its parent, values are unique in these trees
    private static Map<Integer, Integer> parentValueMap(FlatTree<Integer> t) {
        Map<Integer, Integer> out = new HashMap<>();
        for (int i = 1; i < t.size(); i++) {
            out.put(t.get(i), t.get(t.getParentIndex(i)));
        }
        return out;
    }

    private static void assertDescendantsComplete(FlatTree<Integer> t) {
        // spot check a few nodes against a walk up the parent links
        for (int p = 1; p < t.size(); p += Math.max(1, t.size() / 5)) {
            Set<Integer> expected = new HashSet<>();
            for (int i = 1; i < t.size(); i++) {
                int cur = i;
                while (cur != 0) {
                    cur = t.getParentIndex(cur);
                    if (cur == p) {
                        expected.add(i);
                        break;
                    }
                }
            }
            List<Integer> all = t.getAllDescendants(p);
            assertEquals(expected.size(), all.size(), "duplicates or omissions below " + p);
            assertEquals(expected, new HashSet<>(all));
        }
    }
}
