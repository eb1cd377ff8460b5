package com.postal.directory.parser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RecordSource Tests")
class RecordSourceTest {

    @Test
    @DisplayName("Blank lines are skipped but keep counting physical lines")
    void blankLinesKeepLineNumbers() {
        RecordSource source = RecordSource.fromText("a\n\nb\n   \nc");

        List<SourceLine> lines = source.lines().collect(Collectors.toList());

        assertEquals(List.of(new SourceLine(1, "a"), new SourceLine(3, "b"), new SourceLine(5, "c")), lines);
    }

    @Test
    @DisplayName("CRLF terminators are stripped")
    void crlf() {
        List<String> texts = RecordSource.fromText("a@b\r\nc@d\r\n").lines()
                .map(SourceLine::text)
                .collect(Collectors.toList());

        assertEquals(List.of("a@b", "c@d"), texts);
    }

    @Test
    @DisplayName("Trailing newline does not add a line")
    void trailingNewline() {
        assertEquals(2, RecordSource.fromText("x\ny\n").lines().count());
    }

    @Test
    @DisplayName("Lines holding only no-break spaces or NEL are blank")
    void latin1SpacesAreBlank() {
        byte[] bytes = {0x61, 0x0A, (byte) 0xA0, (byte) 0xA0, 0x0A, (byte) 0x85, 0x0A, 0x62};

        List<SourceLine> lines = RecordSource.fromLatin1(bytes).lines().collect(Collectors.toList());

        assertEquals(List.of(new SourceLine(1, "a"), new SourceLine(4, "b")), lines);
    }

    @Test
    void emptyContent() {
        assertEquals(0, RecordSource.fromText("").lines().count());
        assertEquals(0, RecordSource.fromText("\n\n\n").lines().count());
    }

    @Test
    @DisplayName("Each call to lines() starts a new pass")
    void restartable() {
        RecordSource source = RecordSource.fromText("1\n2\n3");

        assertEquals(3, source.lines().count());
        assertEquals(3, source.lines().count());
    }

    @Test
    void decodesLatin1Bytes() {
        byte[] bytes = {0x4A, 0x6F, (byte) 0xE3, 0x6F, 0x0A};
        RecordSource source = RecordSource.fromLatin1(bytes);

        assertEquals("João", source.lines().findFirst().orElseThrow().text());
    }
}
