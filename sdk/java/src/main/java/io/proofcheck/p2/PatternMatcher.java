package io.proofcheck.p2;

import java.util.Optional;

/**
 * One-way matching of a schema pattern against a formula. Every atom of the pattern is a
 * metavariable that may stand for any subformula; repeated metavariables must stand for
 * structurally equal subformulas.
 */
public final class PatternMatcher {
    private PatternMatcher() {}

    public static Optional<Bindings> match(Formula pattern, Formula target) {
        Bindings bindings = new Bindings();
        if (!matchInto(pattern, target, bindings)) return Optional.empty();
        return Optional.of(bindings.freeze());
    }

    public static boolean matches(Formula pattern, Formula target) {
        return matchInto(pattern, target, new Bindings());
    }

    private static boolean matchInto(Formula pattern, Formula target, Bindings bindings) {
        if (pattern == null || target == null) return false;
        if (pattern instanceof Formula.Atom meta) {
            Formula bound = bindings.get(meta.letter());
            if (bound == null) {
                bindings.put(meta.letter(), target);
                return true;
            }
            return Formula.equal(bound, target);
        }
        if (pattern instanceof Formula.Not p) {
            return target instanceof Formula.Not t && matchInto(p.child(), t.child(), bindings);
        }
        Formula.Implies p = (Formula.Implies) pattern;
        return target instanceof Formula.Implies t
            && matchInto(p.left(), t.left(), bindings)
            && matchInto(p.right(), t.right(), bindings);
    }
}
