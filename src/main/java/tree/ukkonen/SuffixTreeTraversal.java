package tree.ukkonen;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

import java.util.ArrayList;
import java.util.List;

/**
 * Depth-first walks over a finished suffix tree. All walks use an explicit stack so that deep
 * trees over repetitive input cannot overflow the call stack.
 */
final class SuffixTreeTraversal {

    private SuffixTreeTraversal() {
    }

    /**
     * Give every leaf its suffix index: {@code totalLength} minus the label length accumulated on
     * the way down. Returns the number of leaves visited.
     */
    static int assignSuffixIndices(NodeArena arena, LeafEnd leafEnd, int totalLength) {
        IntArrayList nodes = new IntArrayList();
        IntArrayList depths = new IntArrayList();
        nodes.push(NodeArena.ROOT);
        depths.push(0);
        int leaves = 0;

        while (!nodes.isEmpty()) {
            int node = nodes.popInt();
            int depth = depths.popInt();
            if (arena.isLeaf(node)) {
                arena.setSuffixIndex(node, totalLength - depth);
                leaves++;
                continue;
            }
            arena.forEachChild(node, child -> {
                nodes.push(child);
                depths.push(depth + arena.edgeLength(child, leafEnd));
            });
        }
        return leaves;
    }

    /**
     * Append the start of every suffix below {@code node} to {@code out}. {@code depth} is the
     * label length from the root down to the end of {@code node}'s incoming edge.
     */
    static void collectLeafStarts(NodeArena arena, LeafEnd leafEnd, int totalLength,
                                  int node, int depth, IntList out) {
        IntArrayList nodes = new IntArrayList();
        IntArrayList depths = new IntArrayList();
        nodes.push(node);
        depths.push(depth);

        while (!nodes.isEmpty()) {
            int current = nodes.popInt();
            int currentDepth = depths.popInt();
            if (arena.isLeaf(current)) {
                int indexed = arena.suffixIndex(current);
                out.add(indexed >= 0 ? indexed : totalLength - currentDepth);
                continue;
            }
            arena.forEachChild(current, child -> {
                nodes.push(child);
                depths.push(currentDepth + arena.edgeLength(child, leafEnd));
            });
        }
    }

    static int countLeaves(NodeArena arena, int node) {
        IntArrayList nodes = new IntArrayList();
        nodes.push(node);
        int leaves = 0;
        while (!nodes.isEmpty()) {
            int current = nodes.popInt();
            if (arena.isLeaf(current)) {
                leaves++;
            } else {
                arena.forEachChild(current, nodes::push);
            }
        }
        return leaves;
    }

    /**
     * Concatenated edge labels from the root to each leaf, in depth-first order with children
     * visited by ascending first symbol.
     */
    static List<int[]> leafPaths(NodeArena arena, SymbolSequence text, LeafEnd leafEnd) {
        List<int[]> paths = new ArrayList<>();
        List<IntArrayList> prefixes = new ArrayList<>();
        IntArrayList nodes = new IntArrayList();
        nodes.push(NodeArena.ROOT);
        prefixes.add(new IntArrayList());

        while (!nodes.isEmpty()) {
            int node = nodes.popInt();
            IntArrayList prefix = prefixes.remove(prefixes.size() - 1);
            if (node != NodeArena.ROOT) {
                prefix.addElements(prefix.size(), text.copyRange(arena.start(node), arena.effectiveEnd(node, leafEnd)));
            }
            if (arena.isLeaf(node)) {
                paths.add(prefix.toIntArray());
                continue;
            }
            int[] children = arena.sortedChildren(node);
            // push in reverse so the smallest symbol is popped first
            for (int i = children.length - 1; i >= 0; i--) {
                nodes.push(children[i]);
                prefixes.add(new IntArrayList(prefix));
            }
        }
        return paths;
    }
}
