package io.proofcheck.p2;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class WffParserTest {

    private final WffParser parser = WffParser.withDefaults();

    // --- isWff ---

    @Test void singleCharacterIsWffOnlyForUppercase() {
        for (char ch = 0; ch < 0x250; ch++) {
            boolean expected = ch >= 'A' && ch <= 'Z';
            assertEquals(expected, parser.isWff(String.valueOf(ch)), "char " + (int) ch);
        }
    }

    @Test void wellFormed() {
        assertTrue(parser.isWff("nP"));
        assertTrue(parser.isWff("cPQ"));
        assertTrue(parser.isWff("ccnPnQcQP"));
        assertTrue(parser.isWff("nnnnnZ"));
    }

    @Test void whitespaceBetweenSymbols() {
        assertTrue(parser.isWff("  c P\tc Q P \n"));
    }

    @Test void trailingGarbageRejected() {
        assertFalse(parser.isWff("cPQR"));
        assertFalse(parser.isWff("P Q"));
        assertFalse(parser.isWff("nPx"));
    }

    @Test void missingOperand() {
        assertFalse(parser.isWff("cP"));
        assertFalse(parser.isWff("n"));
        assertFalse(parser.isWff("c"));
        assertFalse(parser.isWff(""));
        assertFalse(parser.isWff("   "));
    }

    @Test void unknownSymbols() {
        assertFalse(parser.isWff("p"));
        assertFalse(parser.isWff("(P)"));
        assertFalse(parser.isWff("P->Q"));
        assertFalse(parser.isWff("aPQ"));
    }

    @Test void staticShortcut() {
        assertTrue(WffParser.isWffText("cPQ"));
        assertFalse(WffParser.isWffText("cP"));
    }

    // --- parse(text, position) ---

    @Test void parseReturnsNewPosition() {
        ParseResult r = parser.parse("cPQ R", 0);
        ParseResult.Success ok = assertInstanceOf(ParseResult.Success.class, r);
        assertEquals("cPQ", ok.formula().toPrefix());
        assertEquals(3, ok.position());
    }

    @Test void parseFromMiddle() {
        ParseResult.Success ok = assertInstanceOf(ParseResult.Success.class, parser.parse("cPQ R", 3));
        assertEquals(Formula.atom('R'), ok.formula());
        assertEquals(5, ok.position());
    }

    @Test void parseConsumesLongestFormulaOnly() {
        ParseResult.Success ok = assertInstanceOf(ParseResult.Success.class, parser.parse("nPQ", 0));
        assertEquals("nP", ok.formula().toPrefix());
        assertEquals(2, ok.position());
    }

    @Test void failureAtEnd() {
        ParseResult.Failure f = assertInstanceOf(ParseResult.Failure.class, parser.parse("cP", 0));
        assertEquals(2, f.position());
        assertEquals("unexpected end of formula", f.reason());
    }

    @Test void failureOnBadCharacter() {
        ParseResult.Failure f = assertInstanceOf(ParseResult.Failure.class, parser.parse("cPx", 0));
        assertEquals(2, f.position());
        assertTrue(f.reason().contains("'x'"));
        assertFalse(f.isSuccess());
    }

    // --- parse(text) ---

    @Test void parseWhole() {
        Formula f = parser.parse("cnPQ");
        assertEquals(Formula.implies(Formula.not(Formula.atom('P')), Formula.atom('Q')), f);
    }

    @Test void parseWholeRejectsTrailing() {
        WffSyntaxException e = assertThrows(WffSyntaxException.class, () -> parser.parse("cPQ Q"));
        assertEquals(4, e.position());
    }

    @Test void parseWholeRejectsIncomplete() {
        assertThrows(WffSyntaxException.class, () -> parser.parse("ccPQ"));
    }

    // --- Depth limit ---

    @Test void depthLimit() {
        WffParser shallow = new WffParser(3);
        assertTrue(shallow.isWff("nnP"));
        assertThrows(CapacityExceededException.class, () -> shallow.isWff("nnnP"));
    }

    @Test void depthMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new WffParser(0));
    }
}
