package com.example.jestadapter.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TestSelectorTest {

    @Test
    void splitsOnFirstQuestionMark() {
        TestSelector selector = TestSelector.parse("tests/a.test.js?does it work? yes");
        assertEquals("tests/a.test.js", selector.path());
        assertEquals("does it work? yes", selector.name());
        assertEquals("tests/a.test.js?does it work? yes", selector.value());
    }

    @Test
    void selectorWithoutSeparatorAddressesWholeFile() {
        TestSelector selector = TestSelector.parse("tests/a.test.js");
        assertEquals("tests/a.test.js", selector.path());
        assertTrue(selector.isWholeFile());
    }

    @Test
    void pathUsesForwardSlashes() {
        assertEquals("tests/unit/a.test.js", new TestSelector("tests\\unit\\a.test.js", "x").path());
    }

    @Test
    void encodeUriKeepsReservedCharacters() {
        assertEquals("tests/a.test.js?sum%20module%20adds%201%20+%202",
                TestSelector.encodeUri("tests/a.test.js?sum module adds 1 + 2"));
    }

    @Test
    void encodeUriEscapesNonAscii() {
        assertEquals("a.test.js?caf%C3%A9", TestSelector.encodeUri("a.test.js?café"));
        assertEquals("a.test.js?100%25", TestSelector.encodeUri("a.test.js?100%"));
    }

    @Test
    void decodeUriReversesEncoding() {
        String raw = "a.test.js?café works | fast";
        assertEquals(raw, TestSelector.decodeUri(TestSelector.encodeUri(raw)));
    }

    @Test
    void malformedEscapeIsLeftAsIs() {
        assertEquals("50% done", TestSelector.decodeUri("50% done"));
    }

    @Test
    void decodeUriKeepsReservedEscapes() {
        assertEquals("what%3F a%2Fb c", TestSelector.decodeUri("what%3F a%2Fb%20c"));
        assertEquals("tag %23one", TestSelector.decodeUri("tag %23one"));
    }

    @Test
    void invalidUtf8EscapeIsLeftAsIs() {
        assertEquals("bad %E9 byte", TestSelector.decodeUri("bad %E9 byte"));
    }
}
