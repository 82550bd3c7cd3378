package io.proofcheck.p2;

import java.util.Objects;

/**
 * Well-formed formula of the implicational-negational propositional calculus.
 * Sealed interface with record variants; instances are immutable and never share mutable state.
 */
public sealed interface Formula {
    record Atom(char letter) implements Formula {
        public Atom {
            if (letter < 'A' || letter > 'Z') {
                throw new IllegalArgumentException("atom must be an uppercase letter: '" + letter + "'");
            }
        }

        @Override
        public String toString() { return String.valueOf(letter); }
    }

    record Not(Formula child) implements Formula {
        public Not {
            Objects.requireNonNull(child, "child");
        }

        @Override
        public String toString() { return toPrefix(); }
    }

    record Implies(Formula left, Formula right) implements Formula {
        public Implies {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public String toString() { return toPrefix(); }
    }

    static Formula atom(char letter) { return new Atom(letter); }
    static Formula not(Formula child) { return new Not(child); }
    static Formula implies(Formula left, Formula right) { return new Implies(left, right); }

    /**
     * Structural equality: same shape and same atom letters at every position.
     * A null on exactly one side is never equal.
     */
    static boolean equal(Formula a, Formula b) {
        if (a == b) return true;
        if (a == null || b == null) return false;
        if (a instanceof Atom x && b instanceof Atom y) return x.letter() == y.letter();
        if (a instanceof Not x && b instanceof Not y) return equal(x.child(), y.child());
        if (a instanceof Implies x && b instanceof Implies y) {
            return equal(x.left(), y.left()) && equal(x.right(), y.right());
        }
        return false;
    }

    /**
     * Rebuilds this formula with every atom {@code variable} replaced by {@code replacement}.
     * Other atoms and all operators keep their shape.
     */
    default Formula substitute(char variable, Formula replacement) {
        Objects.requireNonNull(replacement, "replacement");
        if (this instanceof Atom a) {
            return a.letter() == variable ? replacement : a;
        }
        if (this instanceof Not n) {
            return new Not(n.child().substitute(variable, replacement));
        }
        Implies i = (Implies) this;
        return new Implies(i.left().substitute(variable, replacement), i.right().substitute(variable, replacement));
    }

    /** Canonical prefix token, e.g. {@code cPcQP}. */
    default String toPrefix() {
        StringBuilder sb = new StringBuilder();
        appendPrefix(this, sb);
        return sb.toString();
    }

    /** Infix rendering for humans, e.g. {@code P → (Q → P)}. */
    default String toInfix() {
        StringBuilder sb = new StringBuilder();
        appendInfix(this, sb, false);
        return sb.toString();
    }

    default int depth() {
        if (this instanceof Not n) return 1 + n.child().depth();
        if (this instanceof Implies i) return 1 + Math.max(i.left().depth(), i.right().depth());
        return 1;
    }

    private static void appendPrefix(Formula f, StringBuilder sb) {
        if (f instanceof Atom a) {
            sb.append(a.letter());
        } else if (f instanceof Not n) {
            sb.append('n');
            appendPrefix(n.child(), sb);
        } else {
            Implies i = (Implies) f;
            sb.append('c');
            appendPrefix(i.left(), sb);
            appendPrefix(i.right(), sb);
        }
    }

    private static void appendInfix(Formula f, StringBuilder sb, boolean nested) {
        if (f instanceof Atom a) {
            sb.append(a.letter());
        } else if (f instanceof Not n) {
            sb.append('¬');
            appendInfix(n.child(), sb, true);
        } else {
            Implies i = (Implies) f;
            if (nested) sb.append('(');
            appendInfix(i.left(), sb, true);
            sb.append(" → ");
            appendInfix(i.right(), sb, true);
            if (nested) sb.append(')');
        }
    }
}
