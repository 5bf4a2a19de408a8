package com.vfxport.tree;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TextLinesTest {

    @Test
    void detectsSeparator() {
        assertEquals("\r\n", TextLines.separatorOf("a\r\nb"));
        assertEquals("\n", TextLines.separatorOf("a\nb"));
        assertEquals("\n", TextLines.separatorOf("single line"));
    }

    @Test
    void reindentKeepsRelativeIndentation() {
        String block = "        Outer {\n            inner: u8 = 1\n        }\n\n";
        assertEquals("  Outer {\n      inner: u8 = 1\n  }", TextLines.reindent(block, "  ", "\n"));
    }

    @Test
    void removeLinesTakesBlankRemainders() {
        String text = "a\n    block {\n    }\nb\n";
        int start = text.indexOf("block");
        int end = text.indexOf('}') + 1;
        assertEquals("a\nb\n", TextLines.removeLines(text, start, end));
    }

    @Test
    void formatsNumbersInShortestForm() {
        assertEquals("1", TextLines.formatNumber(1.0));
        assertEquals("0.5", TextLines.formatNumber(0.50));
        assertEquals("0", TextLines.formatNumber(-0.0));
        assertEquals("9999", TextLines.formatNumber(9999));
        assertEquals("-2.25", TextLines.formatNumber(-2.25));
    }
}
