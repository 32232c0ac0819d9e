package org.example.ednascan.service.impl;

import org.example.ednascan.model.SequenceRecord;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Component
public class FastaParser {

    private static final char RECORD_MARKER = '>';

    // undecodable bytes become U+FFFD instead of failing the read
    public List<SequenceRecord> parse(Path file) throws IOException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(Files.newInputStream(file), decoder))) {
            return parse(reader);
        }
    }

    public List<SequenceRecord> parse(String content) {
        try {
            return parse(new StringReader(content));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public List<SequenceRecord> parse(Reader source) throws IOException {
        BufferedReader reader = source instanceof BufferedReader br ? br : new BufferedReader(source);
        List<SequenceRecord> records = new ArrayList<>();

        String header = null;
        StringBuilder body = new StringBuilder();
        String line;
        while ((line = reader.readLine()) != null) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (trimmed.charAt(0) == RECORD_MARKER) {
                emit(records, header, body);
                header = trimmed.substring(1).trim();
                body.setLength(0);
            } else if (header != null) {
                body.append(trimmed);
            }
        }
        emit(records, header, body);
        return records;
    }

    private static void emit(List<SequenceRecord> records, String header, StringBuilder body) {
        if (header != null && !header.isEmpty() && body.length() > 0) {
            records.add(new SequenceRecord(header, body.toString()));
        }
    }
}
