package io.proofcheck.p2;

/**
 * Recursive-descent parser for prefix-notation formulas.
 *
 * <pre>
 * WFF := 'A'..'Z' | 'n' WFF | 'c' WFF WFF
 * </pre>
 *
 * Whitespace between symbols is ignored.
 */
public final class WffParser {
    private static final WffParser DEFAULT = new WffParser(new CheckerConfig().maxFormulaDepth);

    private final int maxDepth;

    public WffParser(int maxDepth) {
        if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be positive");
        this.maxDepth = maxDepth;
    }

    public static WffParser withDefaults() {
        return DEFAULT;
    }

    /**
     * Parse the longest formula starting at {@code position}, after leading whitespace.
     * @throws CapacityExceededException if nesting exceeds the depth limit
     */
    public ParseResult parse(String text, int position) {
        return parseAt(text, position, 1);
    }

    /**
     * Parse {@code text} as exactly one formula surrounded by optional whitespace.
     * @throws WffSyntaxException if it is not
     */
    public Formula parse(String text) {
        ParseResult result = parse(text, 0);
        if (result instanceof ParseResult.Failure f) {
            throw new WffSyntaxException(f.position(), "not a WFF: \"" + text + "\": " + f.reason());
        }
        ParseResult.Success ok = (ParseResult.Success) result;
        int end = skipWhitespace(text, ok.position());
        if (end != text.length()) {
            throw new WffSyntaxException(end, "not a WFF: \"" + text + "\": trailing characters at " + end);
        }
        return ok.formula();
    }

    /** True iff the whole string is one formula; trailing non-whitespace is a rejection. */
    public boolean isWff(String text) {
        ParseResult result = parse(text, 0);
        return result instanceof ParseResult.Success ok
            && skipWhitespace(text, ok.position()) == text.length();
    }

    public static boolean isWffText(String text) {
        return DEFAULT.isWff(text);
    }

    private ParseResult parseAt(String text, int position, int depth) {
        if (depth > maxDepth) {
            throw new CapacityExceededException("formula nesting exceeds " + maxDepth + " levels");
        }
        int pos = skipWhitespace(text, position);
        if (pos >= text.length()) return new ParseResult.Failure(pos, "unexpected end of formula");
        char ch = text.charAt(pos);

        if (ch >= 'A' && ch <= 'Z') {
            return new ParseResult.Success(Formula.atom(ch), pos + 1);
        }
        if (ch == 'n') {
            ParseResult child = parseAt(text, pos + 1, depth + 1);
            if (!(child instanceof ParseResult.Success c)) return child;
            return new ParseResult.Success(Formula.not(c.formula()), c.position());
        }
        if (ch == 'c') {
            ParseResult left = parseAt(text, pos + 1, depth + 1);
            if (!(left instanceof ParseResult.Success l)) return left;
            ParseResult right = parseAt(text, l.position(), depth + 1);
            if (!(right instanceof ParseResult.Success r)) return right;
            return new ParseResult.Success(Formula.implies(l.formula(), r.formula()), r.position());
        }
        return new ParseResult.Failure(pos, "unexpected character '" + ch + "'");
    }

    static int skipWhitespace(String text, int position) {
        int pos = position;
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) pos++;
        return pos;
    }
}
