package tree.ukkonen;

import junit.framework.TestCase;

public class PhaseExtenderTestCase extends TestCase {

    private NodeArena arena;
    private SymbolSequence text;
    private LeafEnd leafEnd;
    private PhaseExtender extender;

    public PhaseExtenderTestCase(String name) {
        super(name);
    }

    protected void setUp() throws Exception {
        super.setUp();
        arena = new NodeArena(8);
        text = new SymbolSequence(8);
        leafEnd = new LeafEnd();
        extender = new PhaseExtender(arena, text, leafEnd, true);
    }

    private ActivePoint feed(String symbols, ActivePoint ap) {
        for (int i = 0; i < symbols.length(); i++) {
            int pos = text.append(symbols.charAt(i));
            extender.extend(pos, ap);
        }
        return ap;
    }

    public void testFirstPhaseCreatesOneLeaf() {
        ActivePoint ap = feed("a", new ActivePoint());
        assertEquals(2, arena.size());
        int leaf = arena.child(NodeArena.ROOT, 'a');
        assertTrue(arena.isOpen(leaf));
        assertEquals(0, leafEnd.get());
        assertEquals(0, ap.remaining());
    }

    public void testRuleThreeStopsPhaseEarly() {
        ActivePoint ap = feed("aa", new ActivePoint());
        // second 'a' is already on the edge: nothing created, one suffix pending
        assertEquals(2, arena.size());
        assertEquals(1, ap.remaining());
        assertEquals(1, ap.length());
        assertEquals(NodeArena.ROOT, ap.node());
    }

    public void testSplitCreatesInternalNodeAndLeaf() {
        feed("aab", new ActivePoint());
        int internal = arena.child(NodeArena.ROOT, 'a');
        assertFalse(arena.isOpen(internal));
        assertEquals(1, arena.edgeLength(internal, leafEnd));
        assertEquals(2, arena.childCount(internal));
        assertTrue(arena.child(internal, 'a') != NodeArena.NO_NODE);
        assertTrue(arena.child(internal, 'b') != NodeArena.NO_NODE);
        assertTrue(arena.child(NodeArena.ROOT, 'b') != NodeArena.NO_NODE);
    }

    public void testSkipCountWalksWholeEdges() {
        // after "abcabxab" the active point has to skip the "ab" edge to continue
        ActivePoint ap = feed("abcabxab", new ActivePoint());
        int ab = arena.child(NodeArena.ROOT, 'a');
        assertEquals(2, arena.edgeLength(ab, leafEnd));
        assertEquals(2, ap.remaining());
        feed("c", ap);
        // "abc" pending: the walk must go through the internal "ab" node
        assertEquals(ab, ap.node());
        assertEquals(1, ap.length());
    }

    public void testPhaseReplayFromSnapshotMatchesTree() {
        ActivePoint ap = feed("banana", new ActivePoint());
        SuffixTree tree = SuffixTree.build("banana");
        ActivePoint fromTree = tree.activePoint();
        assertEquals(fromTree.node(), ap.node());
        assertEquals(fromTree.edge(), ap.edge());
        assertEquals(fromTree.length(), ap.length());
        assertEquals(fromTree.remaining(), ap.remaining());
        assertEquals(tree.nodeCount(), arena.size());
    }

    public void testSnapshotIsDetached() {
        ActivePoint ap = feed("ab", new ActivePoint());
        ActivePoint snapshot = ap.snapshot();
        feed("a", ap);
        assertEquals(0, snapshot.length());
        assertEquals(1, ap.length());
    }

    public void testLeafEndMovesOncePerPhase() {
        feed("abc", new ActivePoint());
        assertEquals(2, leafEnd.get());
        try {
            leafEnd.advanceTo(1);
            fail("expected IllegalStateException");
        } catch (IllegalStateException expected) {
            // ok
        }
    }
}
