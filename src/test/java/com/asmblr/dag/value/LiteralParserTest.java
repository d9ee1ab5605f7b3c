package com.asmblr.dag.value;

import org.junit.Test;

import static org.junit.Assert.*;

public class LiteralParserTest {

    @Test
    public void testWords() {
        assertSame(Values.none(), LiteralParser.parse("None"));
        assertSame(Values.none(), LiteralParser.parse("null"));
        assertEquals(Values.of(true), LiteralParser.parse("True"));
        assertEquals(Values.of(false), LiteralParser.parse(" false "));
        assertTrue(Double.isNaN(((NumberValue) LiteralParser.parse("nan")).doubleValue()));
    }

    @Test
    public void testNumbers() {
        assertEquals(NumberValue.of(42L), LiteralParser.parse("42"));
        assertEquals(NumberValue.of(-1.5e3), LiteralParser.parse("-1.5e3"));
        assertEquals(NumberValue.of(1000000L), LiteralParser.parse("1_000_000"));
        assertEquals(NumberValue.of(0.5), LiteralParser.parse(".5"));
    }

    @Test
    public void testStrings() {
        assertEquals(new StringValue("it's"), LiteralParser.parse("\"it's\""));
        assertEquals(new StringValue("a\nb"), LiteralParser.parse("'a\\nb'"));
    }

    @Test
    public void testSequences() {
        assertEquals(Values.tuple(1L), LiteralParser.parse("(1,)"));
        assertEquals(Values.tuple(1L, "x", Values.tuple(true)), LiteralParser.parse("[1, 'x', (True,)]"));
        assertEquals(Values.tuple(), LiteralParser.parse("()"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsTrailingContent() {
        LiteralParser.parse("1 2");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsUnknownWord() {
        LiteralParser.parse("object");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsUnterminatedString() {
        LiteralParser.parse("'abc");
    }
}
