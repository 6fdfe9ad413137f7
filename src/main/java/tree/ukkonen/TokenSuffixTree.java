package tree.ukkonen;

import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import utilities.AlphabetMapper;

import java.util.List;
import java.util.Objects;

/**
 * Suffix tree over a sequence of arbitrary tokens (words, n-grams, ...). Tokens are mapped to
 * dense ids through an {@link AlphabetMapper}; id 0 is the terminator, so no token can clash
 * with it. The tree is explicit and indexed once constructed.
 */
public final class TokenSuffixTree<T> {

    private final AlphabetMapper<T> mapper;
    private final SuffixTree tree;

    private TokenSuffixTree(AlphabetMapper<T> mapper, SuffixTree tree) {
        this.mapper = mapper;
        this.tree = tree;
    }

    public static <T> TokenSuffixTree<T> build(List<T> tokens) {
        Objects.requireNonNull(tokens, "tokens");
        AlphabetMapper<T> mapper = new AlphabetMapper<>(tokens.size());
        int[] symbols = new int[tokens.size()];
        for (int i = 0; i < symbols.length; i++) {
            symbols[i] = mapper.getId(Objects.requireNonNull(tokens.get(i), "token"));
        }
        SuffixTreeConfiguration config = SuffixTreeConfiguration.builder()
                .terminator(AlphabetMapper.RESERVED_ID)
                .initialCapacity(symbols.length + 1)
                .build();
        SuffixTree tree = SuffixTree.build(symbols, config)
                .makeExplicit()
                .assignSuffixIndices();
        tree.compactForQuerying();
        return new TokenSuffixTree<>(mapper, tree);
    }

    public boolean contains(List<T> pattern) {
        int[] symbols = map(pattern);
        return symbols != null && tree.contains(symbols);
    }

    public IntList findAll(List<T> pattern) {
        int[] symbols = map(pattern);
        return (symbols == null) ? IntLists.emptyList() : tree.findAll(symbols);
    }

    public int alphabetSize() {
        return mapper.size();
    }

    public SuffixTree tree() {
        return tree;
    }

    // null when some token never occurs in the text
    private int[] map(List<T> pattern) {
        Objects.requireNonNull(pattern, "pattern");
        int[] symbols = new int[pattern.size()];
        for (int i = 0; i < symbols.length; i++) {
            int id = mapper.lookup(pattern.get(i));
            if (id == AlphabetMapper.UNKNOWN) {
                return null;
            }
            symbols[i] = id;
        }
        return symbols;
    }
}
