package tree.ukkonen;

import junit.framework.TestCase;

import java.util.Arrays;

public class NodeArenaTestCase extends TestCase {

    private NodeArena arena;
    private LeafEnd leafEnd;

    public NodeArenaTestCase(String name) {
        super(name);
    }

    protected void setUp() throws Exception {
        super.setUp();
        arena = new NodeArena(4);
        leafEnd = new LeafEnd();
    }

    public void testRootLinksToItself() {
        assertEquals(1, arena.size());
        assertEquals(NodeArena.ROOT, arena.suffixLink(NodeArena.ROOT));
        assertEquals(0, arena.edgeLength(NodeArena.ROOT, leafEnd));
        assertFalse(arena.isLeaf(NodeArena.ROOT));
    }

    public void testClosedAndOpenEdges() {
        int closed = arena.newNode(2, 4);
        int open = arena.newLeaf(3);
        leafEnd.advanceTo(5);
        assertEquals(3, arena.edgeLength(closed, leafEnd));
        assertEquals(3, arena.edgeLength(open, leafEnd));
        leafEnd.advanceTo(9);
        assertEquals(3, arena.edgeLength(closed, leafEnd));
        assertEquals(7, arena.edgeLength(open, leafEnd));
        assertTrue(arena.isOpen(open));
        assertFalse(arena.isOpen(closed));
        assertEquals(-1, arena.suffixIndex(open));
        assertEquals(NodeArena.NO_NODE, arena.suffixLink(open));
    }

    public void testChildrenByFirstSymbol() {
        int a = arena.newLeaf(0);
        int b = arena.newLeaf(1);
        assertEquals(NodeArena.NO_NODE, arena.child(NodeArena.ROOT, 'a'));
        arena.setChild(NodeArena.ROOT, 'b', b);
        arena.setChild(NodeArena.ROOT, 'a', a);
        assertEquals(a, arena.child(NodeArena.ROOT, 'a'));
        assertEquals(2, arena.childCount(NodeArena.ROOT));
        assertTrue(Arrays.equals(new int[]{a, b}, arena.sortedChildren(NodeArena.ROOT)));

        // replacing the child for a symbol keeps one entry per symbol
        int c = arena.newLeaf(2);
        arena.setChild(NodeArena.ROOT, 'a', c);
        assertEquals(2, arena.childCount(NodeArena.ROOT));
        assertEquals(c, arena.child(NodeArena.ROOT, 'a'));
        assertTrue(arena.isLeaf(a));
    }

    public void testGrowsBeyondInitialCapacity() {
        for (int i = 0; i < 100; i++) {
            arena.newLeaf(i);
        }
        assertEquals(101, arena.size());
        arena.trimToSize();
        assertEquals(57, arena.start(57 + 1));
    }

    public void testUnknownHandle() {
        try {
            arena.checkHandle(3);
            fail("expected IllegalArgumentException");
        } catch (IllegalArgumentException expected) {
            // ok
        }
    }

    public void testRejectsNonPositiveCapacity() {
        try {
            new NodeArena(0);
            fail("expected IllegalArgumentException");
        } catch (IllegalArgumentException expected) {
            // ok
        }
    }
}
