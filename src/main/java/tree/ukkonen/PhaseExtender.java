package tree.ukkonen;

import utilities.SuffixTreeLogger;

/**
 * Runs single phases of Ukkonen's construction against a node arena.
 *
 * A phase for position {@code pos} assumes the symbol at {@code pos} has already been appended
 * to the sequence. It advances the shared leaf end, then inserts pending suffixes until either
 * all are explicit or rule 3 ends the phase early.
 */
final class PhaseExtender {

    private final NodeArena arena;
    private final SymbolSequence text;
    private final LeafEnd leafEnd;
    private final boolean trace;

    PhaseExtender(NodeArena arena, SymbolSequence text, LeafEnd leafEnd, boolean trace) {
        this.arena = arena;
        this.text = text;
        this.leafEnd = leafEnd;
        this.trace = trace;
    }

    void extend(int pos, ActivePoint ap) {
        // rule 1 for every open leaf at once
        leafEnd.advanceTo(pos);
        ap.remaining++;
        int lastNewInternalNode = NodeArena.NO_NODE;

        while (ap.remaining > 0) {
            if (ap.length == 0) {
                ap.edge = pos;
            }

            int edgeSymbol = text.get(ap.edge);
            int next = arena.child(ap.node, edgeSymbol);

            if (next == NodeArena.NO_NODE) {
                // rule 2: new leaf hanging off the active node
                arena.setChild(ap.node, edgeSymbol, arena.newLeaf(pos));
                if (lastNewInternalNode != NodeArena.NO_NODE) {
                    arena.setSuffixLink(lastNewInternalNode, ap.node);
                    lastNewInternalNode = NodeArena.NO_NODE;
                }
            } else {
                if (ap.walkDown(arena, leafEnd, next)) {
                    continue;
                }

                int current = text.get(pos);
                if (text.get(arena.start(next) + ap.length) == current) {
                    // rule 3: suffix already present, the rest of this phase is implicit
                    if (lastNewInternalNode != NodeArena.NO_NODE && ap.node != NodeArena.ROOT) {
                        arena.setSuffixLink(lastNewInternalNode, ap.node);
                    }
                    ap.length++;
                    break;
                }

                // rule 2: split the edge ap.length symbols in
                int nextStart = arena.start(next);
                int split = arena.newNode(nextStart, nextStart + ap.length - 1);
                arena.setChild(ap.node, edgeSymbol, split);
                arena.setChild(split, current, arena.newLeaf(pos));
                arena.setStart(next, nextStart + ap.length);
                arena.setChild(split, text.get(arena.start(next)), next);

                if (lastNewInternalNode != NodeArena.NO_NODE) {
                    arena.setSuffixLink(lastNewInternalNode, split);
                }
                lastNewInternalNode = split;
            }

            ap.remaining--;
            ap.afterExtension(arena, pos);
        }

        if (trace) {
            SuffixTreeLogger.trace("phase " + pos + " done: " + ap + ", nodes=" + arena.size());
        }
    }
}
