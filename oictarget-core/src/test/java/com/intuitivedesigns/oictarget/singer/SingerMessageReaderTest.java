/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.oictarget.singer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.oictarget.error.SingerProtocolException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SingerMessageReaderTest {

    private final SingerMessageReader reader = new SingerMessageReader();

    @Test
    void testParsesSchemaRecordAndState() {
        SingerMessage schema = reader.parse("{\"type\":\"SCHEMA\",\"stream\":\"users\",\"schema\":{\"properties\":{}},"
                + "\"key_properties\":[\"id\"]}", 1).orElseThrow();
        SingerMessage record = reader.parse("{\"type\":\"RECORD\",\"stream\":\"users\",\"record\":{\"id\":\"u1\"}}", 2).orElseThrow();
        SingerMessage state = reader.parse("{\"type\":\"STATE\",\"value\":{\"bookmarks\":{\"users\":{\"ts\":1}}}}", 3).orElseThrow();

        SingerMessage.SchemaMessage s = assertInstanceOf(SingerMessage.SchemaMessage.class, schema);
        assertEquals("users", s.stream());
        assertEquals(List.of("id"), s.keyProperties());

        SingerMessage.RecordMessage r = assertInstanceOf(SingerMessage.RecordMessage.class, record);
        assertEquals("u1", r.record().get("id").asText());

        SingerMessage.StateMessage st = assertInstanceOf(SingerMessage.StateMessage.class, state);
        assertEquals(1, st.value().at("/bookmarks/users/ts").asInt());
    }

    @Test
    void testIgnoredLines() {
        assertEquals(Optional.empty(), reader.parse("   ", 1));
        assertEquals(Optional.empty(), reader.parse("{\"type\":\"ACTIVATE_VERSION\",\"stream\":\"users\",\"version\":1}", 2));
    }

    @Test
    void testProtocolViolationsCarryLineNumber() {
        SingerProtocolException bad = assertThrows(SingerProtocolException.class, () -> reader.parse("{not json", 7));
        assertEquals(7, bad.lineNumber());

        assertThrows(SingerProtocolException.class, () -> reader.parse("[1,2]", 1));
        assertThrows(SingerProtocolException.class, () -> reader.parse("{\"stream\":\"users\"}", 1));
        assertThrows(SingerProtocolException.class, () -> reader.parse("{\"type\":\"BATCH\",\"stream\":\"users\"}", 1));
        assertThrows(SingerProtocolException.class, () -> reader.parse("{\"type\":\"RECORD\",\"record\":{}}", 1));
        assertThrows(SingerProtocolException.class, () -> reader.parse("{\"type\":\"RECORD\",\"stream\":\"users\",\"record\":\"x\"}", 1));
        assertThrows(SingerProtocolException.class, () -> reader.parse("{\"type\":\"SCHEMA\",\"stream\":\"users\"}", 1));
        assertThrows(SingerProtocolException.class, () -> reader.parse("{\"type\":\"STATE\"}", 1));
    }

    @Test
    void testTrailingContentAfterMessageIsRejected() {
        SingerProtocolException ex = assertThrows(SingerProtocolException.class,
                () -> reader.parse("{\"type\":\"STATE\",\"value\":{}} garbage", 4));
        assertEquals(4, ex.lineNumber());

        assertThrows(SingerProtocolException.class,
                () -> reader.parse("{\"type\":\"STATE\",\"value\":{}}{\"type\":\"STATE\",\"value\":{}}", 5));
    }

    @Test
    void testStateWriterEmitsOneLinePerState() throws Exception {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        StdoutStateWriter writer = new StdoutStateWriter(new PrintStream(bytes, true, StandardCharsets.UTF_8));
        ObjectMapper mapper = new ObjectMapper();

        writer.emit(mapper.readTree("{\"bookmarks\":{\"users\":{\"ts\":1}}}"));
        writer.emit(mapper.readTree("{\"bookmarks\":{\"users\":{\"ts\":2}}}"));

        String[] lines = bytes.toString(StandardCharsets.UTF_8).split(System.lineSeparator());
        assertEquals(2, lines.length);
        assertEquals("{\"bookmarks\":{\"users\":{\"ts\":1}}}", lines[0]);
    }
}
