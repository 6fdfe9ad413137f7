package tree.ukkonen;

import junit.framework.TestCase;

public class SuffixTreePrinterTestCase extends TestCase {

    public SuffixTreePrinterTestCase(String name) {
        super(name);
    }

    public void testBananaIndexed() {
        SuffixTree tree = SuffixTree.build("banana").makeExplicit().assignSuffixIndices();
        String expected = ""
                + "$ [6]\n"
                + "a\n"
                + "    $ [5]\n"
                + "    na\n"
                + "        $ [3]\n"
                + "        na$ [1]\n"
                + "banana$ [0]\n"
                + "na\n"
                + "    $ [4]\n"
                + "    na$ [2]\n";
        assertEquals(expected, SuffixTreePrinter.render(tree));
    }

    public void testImplicitTreeHasNoIndices() {
        SuffixTree tree = SuffixTree.build("abab");
        // "ab" is still pending, so only the two leaves exist
        assertEquals("abab\nbab\n", SuffixTreePrinter.render(tree));
    }

    public void testCustomSymbolNames() {
        SuffixTree tree = SuffixTree.build(new int[]{1, 2}).makeExplicit();
        String rendered = SuffixTreePrinter.render(tree, symbol -> "<" + symbol + ">");
        assertEquals("<1><2><36>\n<2><36>\n<36>\n", rendered);
    }
}
