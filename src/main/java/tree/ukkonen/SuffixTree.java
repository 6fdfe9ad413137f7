package tree.ukkonen;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntArrays;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import org.openjdk.jol.info.GraphLayout;
import org.openjdk.jol.vm.VM;
import utilities.FootprintReport;
import utilities.SuffixTreeLogger;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

import static tree.ukkonen.SuffixTreeException.ErrorKind.ALREADY_FINALIZED;
import static tree.ukkonen.SuffixTreeException.ErrorKind.INVALID_TERMINATOR;
import static tree.ukkonen.SuffixTreeException.ErrorKind.NOT_FINALIZED;
import static tree.ukkonen.SuffixTreeException.ErrorKind.NOT_INDEXED;

/**
 * Suffix tree over an int alphabet, built online with Ukkonen's algorithm.
 *
 * Lifecycle:
 *   1. {@link #build(int[])} (or {@link #append(int)} one symbol at a time) produces an implicit
 *      tree, one phase per symbol.
 *   2. {@link #makeExplicit()} appends the configured terminator and runs the last phase, so
 *      every suffix ends at its own leaf.
 *   3. {@link #assignSuffixIndices()} labels each leaf with the start of its suffix.
 *
 * Queries ({@link #contains}, {@link #findAll}, {@link #count}) need at least step 2; suffix
 * index lookups need step 3. Nodes are exposed as int handles, {@link #root()} being the root.
 *
 * Empty patterns match at every boundary of the text, {@code 0..length()} inclusive, in line
 * with {@link java.util.regex} semantics. A pattern containing the terminator never matches.
 */
public final class SuffixTree {

    private final SuffixTreeConfiguration config;
    private final SymbolSequence text;
    private final NodeArena arena;
    private final LeafEnd leafEnd;
    private final ActivePoint activePoint;
    private final PhaseExtender extender;

    private TreeState state = TreeState.EMPTY;
    private int originalLength = 0;
    private boolean terminatorSeen = false;
    private int leafCount = -1;

    public SuffixTree() {
        this(SuffixTreeConfiguration.defaults());
    }

    public SuffixTree(SuffixTreeConfiguration config) {
        this.config = Objects.requireNonNull(config, "config");
        this.text = new SymbolSequence(config.initialCapacity());
        this.arena = new NodeArena(config.initialCapacity());
        this.leafEnd = new LeafEnd();
        this.activePoint = new ActivePoint();
        this.extender = new PhaseExtender(arena, text, leafEnd, config.traceConstruction());
    }

    public static SuffixTree build(int[] symbols) {
        return build(symbols, SuffixTreeConfiguration.defaults());
    }

    public static SuffixTree build(int[] symbols, SuffixTreeConfiguration config) {
        if (symbols == null) {
            throw new IllegalArgumentException("symbols cannot be null");
        }
        Objects.requireNonNull(config, "config");
        SuffixTreeConfiguration sized = config;
        if (symbols.length + 1 > config.initialCapacity()) {
            sized = config.toBuilder().initialCapacity(symbols.length + 1).build();
        }
        SuffixTree tree = new SuffixTree(sized);
        for (int symbol : symbols) {
            tree.append(symbol);
        }
        SuffixTreeLogger.debug("built implicit suffix tree: symbols=" + symbols.length
                + " nodes=" + tree.nodeCount());
        return tree;
    }

    // Each char is one symbol.
    public static SuffixTree build(CharSequence text) {
        return build(text, SuffixTreeConfiguration.defaults());
    }

    public static SuffixTree build(CharSequence text, SuffixTreeConfiguration config) {
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
        return build(toSymbols(text), config);
    }

    /** Extend the implicit tree by one symbol: a single Ukkonen phase. */
    public SuffixTree append(int symbol) {
        if (state.isExplicit()) {
            throw reject(ALREADY_FINALIZED, "cannot append to a finalized suffix tree");
        }
        if (symbol == config.terminator()) {
            terminatorSeen = true;
        }
        int pos = text.append(symbol);
        extender.extend(pos, activePoint);
        originalLength++;
        state = TreeState.IMPLICIT;
        return this;
    }

    /**
     * Append the terminator and run the final phase. Fails without touching the tree if the
     * terminator already occurs in the text or the tree is already explicit.
     */
    public SuffixTree makeExplicit() {
        if (state.isExplicit()) {
            throw reject(ALREADY_FINALIZED, "suffix tree is already explicit");
        }
        if (terminatorSeen) {
            throw reject(INVALID_TERMINATOR, "terminator " + config.terminator() + " occurs in the text");
        }
        int pos = text.append(config.terminator());
        extender.extend(pos, activePoint);
        state = TreeState.EXPLICIT;
        SuffixTreeLogger.debug("suffix tree made explicit: length=" + originalLength + " nodes=" + arena.size());
        return this;
    }

    public SuffixTree assignSuffixIndices() {
        requireExplicit("assign suffix indices");
        if (state == TreeState.INDEXED) {
            return this;
        }
        leafCount = SuffixTreeTraversal.assignSuffixIndices(arena, leafEnd, text.size());
        state = TreeState.INDEXED;
        return this;
    }

    public boolean contains(int[] pattern) {
        Objects.requireNonNull(pattern, "pattern");
        requireExplicit("query");
        return locate(pattern) != null;
    }

    public boolean contains(CharSequence pattern) {
        return contains(toSymbols(Objects.requireNonNull(pattern, "pattern")));
    }

    /** Every start position of {@code pattern} in the text, ascending and without duplicates. */
    public IntList findAll(int[] pattern) {
        Objects.requireNonNull(pattern, "pattern");
        requireExplicit("query");
        if (pattern.length == 0) {
            IntArrayList all = new IntArrayList(originalLength + 1);
            for (int i = 0; i <= originalLength; i++) {
                all.add(i);
            }
            return IntLists.unmodifiable(all);
        }
        int[] match = locate(pattern);
        if (match == null) {
            return IntLists.emptyList();
        }
        IntArrayList result = new IntArrayList();
        SuffixTreeTraversal.collectLeafStarts(arena, leafEnd, text.size(), match[0], match[1], result);
        IntArrays.quickSort(result.elements(), 0, result.size());
        return IntLists.unmodifiable(result);
    }

    public IntList findAll(CharSequence pattern) {
        return findAll(toSymbols(Objects.requireNonNull(pattern, "pattern")));
    }

    public int count(int[] pattern) {
        Objects.requireNonNull(pattern, "pattern");
        requireExplicit("query");
        if (pattern.length == 0) {
            return originalLength + 1;
        }
        int[] match = locate(pattern);
        return (match == null) ? 0 : SuffixTreeTraversal.countLeaves(arena, match[0]);
    }

    public int count(CharSequence pattern) {
        return count(toSymbols(Objects.requireNonNull(pattern, "pattern")));
    }

    /**
     * Walk {@code pattern} down from the root. Returns {node, depth} for the node whose incoming
     * edge holds the end of the match, or null when the pattern does not occur.
     */
    private int[] locate(int[] pattern) {
        for (int symbol : pattern) {
            if (symbol == config.terminator()) {
                return null;
            }
        }

        int current = NodeArena.ROOT;
        int depth = 0;
        int patternIndex = 0;
        while (patternIndex < pattern.length) {
            int next = arena.child(current, pattern[patternIndex]);
            if (next == NodeArena.NO_NODE) {
                return null;
            }
            int edgeStart = arena.start(next);
            int edgeLength = arena.edgeLength(next, leafEnd);
            int consumed = 0;
            while (consumed < edgeLength && patternIndex < pattern.length) {
                if (text.get(edgeStart + consumed) != pattern[patternIndex]) {
                    return null;
                }
                consumed++;
                patternIndex++;
            }
            depth += edgeLength;
            current = next;
        }
        return new int[]{current, depth};
    }

    public int suffixIndex(int leaf) {
        arena.checkHandle(leaf);
        if (state != TreeState.INDEXED) {
            throw reject(NOT_INDEXED, "suffix indices have not been assigned");
        }
        if (!arena.isLeaf(leaf)) {
            throw new IllegalArgumentException("node " + leaf + " is not a leaf");
        }
        return arena.suffixIndex(leaf);
    }

    /** Labels from the root to each leaf; the set of these is the set of terminated suffixes. */
    public List<int[]> leafPaths() {
        requireExplicit("reconstruct leaf paths");
        return SuffixTreeTraversal.leafPaths(arena, text, leafEnd);
    }

    public int leafCount() {
        requireExplicit("count leaves");
        if (leafCount < 0) {
            leafCount = SuffixTreeTraversal.countLeaves(arena, NodeArena.ROOT);
        }
        return leafCount;
    }

    /**
     * Shrink internal buffers to their exact size. Only valid once the tree is explicit, since no
     * further symbols can arrive.
     */
    public void compactForQuerying() {
        requireExplicit("compact");
        text.shrinkToFit();
        arena.trimToSize();
    }

    // ---- read-only structure view ----

    public TreeState state() {
        return state;
    }

    public SuffixTreeConfiguration configuration() {
        return config;
    }

    public int root() {
        return NodeArena.ROOT;
    }

    public int nodeCount() {
        return arena.size();
    }

    /** Length of the text, without the terminator. */
    public int length() {
        return originalLength;
    }

    /** The stored symbols, including the terminator once the tree is explicit. */
    public int[] symbols() {
        return text.toArray();
    }

    public int[] children(int node) {
        arena.checkHandle(node);
        return arena.sortedChildren(node);
    }

    public int child(int node, int symbol) {
        arena.checkHandle(node);
        return arena.child(node, symbol);
    }

    public boolean isLeaf(int node) {
        arena.checkHandle(node);
        return arena.isLeaf(node);
    }

    public int suffixLink(int node) {
        arena.checkHandle(node);
        return arena.suffixLink(node);
    }

    public int edgeLength(int node) {
        arena.checkHandle(node);
        return arena.edgeLength(node, leafEnd);
    }

    public int[] edgeLabel(int node) {
        arena.checkHandle(node);
        if (node == NodeArena.ROOT) {
            return new int[0];
        }
        return text.copyRange(arena.start(node), arena.effectiveEnd(node, leafEnd));
    }

    public ActivePoint activePoint() {
        return activePoint.snapshot();
    }

    // ---- memory report ----

    /**
     * JOL footprint of the whole tree, split into node arena and symbol storage.
     *
     * @param includeFootprintTable when true, append the class histogram of the tree.
     */
    public FootprintReport footprint(boolean includeFootprintTable) {
        StringBuilder sb = new StringBuilder(2_048);
        sb.append("=== JOL / VM details ===\n");
        sb.append(VM.current().details()).append('\n');

        GraphLayout totalLayout = GraphLayout.parseInstance(this);
        long totalBytes = totalLayout.totalSize();
        long arenaBytes = GraphLayout.parseInstance(arena).totalSize();
        long textBytes = GraphLayout.parseInstance(text).totalSize();

        sb.append("=== SuffixTree (").append(arena.size()).append(" nodes, ")
                .append(text.size()).append(" symbols) ===\n");
        appendLayout(sb, "Total", totalBytes);
        appendLayout(sb, "Node arena", arenaBytes);
        appendLayout(sb, "Symbols", textBytes);
        appendLayout(sb, "Other fields", Math.max(0, totalBytes - arenaBytes - textBytes));

        if (includeFootprintTable) {
            sb.append("\n--- Class footprint ---\n");
            sb.append(totalLayout.toFootprint()).append('\n');
        }
        return new FootprintReport(sb.toString(), totalBytes / (1024.0 * 1024.0), arena.size());
    }

    private static void appendLayout(StringBuilder sb, String label, long bytes) {
        sb.append(String.format(Locale.ROOT, "%s: %d B (%.3f MiB)%n", label, bytes, bytes / (1024.0 * 1024.0)));
    }

    // ---- helpers ----

    private void requireExplicit(String operation) {
        if (!state.isExplicit()) {
            throw reject(NOT_FINALIZED, "cannot " + operation + " before makeExplicit()");
        }
    }

    private static SuffixTreeException reject(SuffixTreeException.ErrorKind kind, String message) {
        SuffixTreeLogger.debug("rejected [" + kind + "]: " + message);
        return new SuffixTreeException(kind, message);
    }

    static int[] toSymbols(CharSequence text) {
        int[] symbols = new int[text.length()];
        for (int i = 0; i < symbols.length; i++) {
            symbols[i] = text.charAt(i);
        }
        return symbols;
    }
}
