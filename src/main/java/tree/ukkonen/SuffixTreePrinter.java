package tree.ukkonen;

import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.util.function.IntFunction;

/**
 * Plain-text dump of a suffix tree: one edge label per line, children indented four spaces under
 * their parent and listed by ascending first symbol. Leaves carry their suffix index in brackets
 * once the tree is indexed.
 */
public final class SuffixTreePrinter {

    private static final int INDENT = 4;

    private SuffixTreePrinter() {
    }

    // Symbols are printed as chars.
    public static String render(SuffixTree tree) {
        return render(tree, symbol -> String.valueOf((char) symbol));
    }

    public static String render(SuffixTree tree, IntFunction<String> symbolName) {
        StringBuilder sb = new StringBuilder();
        boolean indexed = tree.state() == TreeState.INDEXED;

        IntArrayList nodes = new IntArrayList();
        IntArrayList indents = new IntArrayList();
        pushChildren(tree, tree.root(), 0, nodes, indents);

        while (!nodes.isEmpty()) {
            int node = nodes.popInt();
            int indent = indents.popInt();

            sb.append(" ".repeat(indent));
            for (int symbol : tree.edgeLabel(node)) {
                sb.append(symbolName.apply(symbol));
            }
            if (indexed && tree.isLeaf(node)) {
                sb.append(" [").append(tree.suffixIndex(node)).append(']');
            }
            sb.append('\n');
            pushChildren(tree, node, indent + INDENT, nodes, indents);
        }
        return sb.toString();
    }

    private static void pushChildren(SuffixTree tree, int node, int indent, IntArrayList nodes, IntArrayList indents) {
        int[] children = tree.children(node);
        for (int i = children.length - 1; i >= 0; i--) {
            nodes.push(children[i]);
            indents.push(indent);
        }
    }
}
