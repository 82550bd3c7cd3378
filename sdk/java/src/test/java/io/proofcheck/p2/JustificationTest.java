package io.proofcheck.p2;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class JustificationTest {

    static Justification parse(String s) {
        return Justification.parse(s, WffParser.withDefaults());
    }

    @Test void premise() {
        assertInstanceOf(Justification.Premise.class, parse("Premise"));
        assertInstanceOf(Justification.Premise.class, parse("pReMiSe"));
        assertInstanceOf(Justification.Unknown.class, parse("Premise 1"));
    }

    @Test void axioms() {
        assertEquals(new Justification.AxiomRef(Axiom.AX2), parse("ax2"));
        assertInstanceOf(Justification.Unknown.class, parse("AX4"));
        assertInstanceOf(Justification.Unknown.class, parse("AX"));
    }

    @Test void modusPonens() {
        assertEquals(new Justification.ModusPonens(1, 2), parse("MP 1 2"));
        assertEquals(new Justification.ModusPonens(3, 10), parse("mp   3\t10"));
        assertEquals(new Justification.ModusPonens(4, 5), parse("MP 4 5 from above"));
        assertEquals(new Justification.ModusPonens(1, 2), parse("MP 1 2."));
        assertEquals(new Justification.ModusPonens(1, 2), parse("MP 1 2x"));
    }

    @Test void modusPonensBadFormat() {
        Justification.Malformed m = assertInstanceOf(Justification.Malformed.class, parse("MP 1"));
        assertEquals("bad MP justification format", m.reason());
        assertInstanceOf(Justification.Malformed.class, parse("MP one two"));
        assertInstanceOf(Justification.Malformed.class, parse("MP"));
        assertInstanceOf(Justification.Malformed.class, parse("MP 1 99999999999"));
    }

    @Test void substitution() {
        Justification.SubstitutionRule s =
            assertInstanceOf(Justification.SubstitutionRule.class, parse("Substitution Q=S"));
        assertEquals('Q', s.substitution().variable());
        assertEquals(Formula.atom('S'), s.substitution().replacement());
    }

    @Test void substitutionVariableIsNotTakenFromKeyword() {
        Justification.SubstitutionRule s =
            assertInstanceOf(Justification.SubstitutionRule.class, parse("SUBSTITUTION P = c Q nR"));
        assertEquals('P', s.substitution().variable());
        assertEquals("cQnR", s.substitution().replacement().toPrefix());
    }

    @Test void substitutionBadFormat() {
        assertInstanceOf(Justification.Malformed.class, parse("Substitution QS"));
        assertInstanceOf(Justification.Malformed.class, parse("Substitution q=S"));
        assertInstanceOf(Justification.Malformed.class, parse("Substitution Q="));
        Justification.Malformed m = assertInstanceOf(Justification.Malformed.class, parse("Substitution Q=cP"));
        assertEquals("replacement is not a WFF", m.reason());
    }

    @Test void unknown() {
        assertEquals(new Justification.Unknown("FooBar"), parse("FooBar"));
        assertEquals(new Justification.Unknown(""), parse(""));
        assertEquals(new Justification.Unknown(""), parse(null));
    }
}
