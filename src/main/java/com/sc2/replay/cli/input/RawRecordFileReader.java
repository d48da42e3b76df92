package com.sc2.replay.cli.input;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HexFormat;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sc2.replay.model.RawAttributeRecord;

/**
 * Reader for raw attribute dump files, one record per line.
 *
 * Format:
 * - Record: header code owner hexvalue (whitespace separated)
 * - Code is decimal or 0x-prefixed hex: 0x0BB9
 * - Value is hex bytes, "-" for an empty value: 5465727200
 * - Comments: # comment
 */
public class RawRecordFileReader {
    private static final Logger log = LoggerFactory.getLogger(RawRecordFileReader.class);

    public RawRecordFile read(Path dumpFile) throws IOException {
        List<String> lines = Files.readAllLines(dumpFile);
        return read(lines);
    }

    public RawRecordFile read(List<String> lines) {
        RawRecordFile file = new RawRecordFile();

        int lineNum = 0;
        for (String line : lines) {
            lineNum++;

            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }

            try {
                RawAttributeRecord record = parseLine(trimmed);
                file.addRecord(record);
                log.debug("Read record {}", record);
            } catch (IllegalArgumentException e) {
                file.addError("Line " + lineNum + ": " + e.getMessage());
                log.warn("Failed to read record line {}: {}", lineNum, e.getMessage());
            }
        }

        return file;
    }

    private RawAttributeRecord parseLine(String line) {
        String[] parts = line.split("\\s+");
        if (parts.length != 4) {
            throw new IllegalArgumentException("Expected 4 columns but found " + parts.length + ": " + line);
        }
        int header = Integer.parseInt(parts[0]);
        int code = parseCode(parts[1]);
        int owner = Integer.parseInt(parts[2]);
        byte[] value = "-".equals(parts[3]) ? new byte[0] : HexFormat.of().parseHex(parts[3]);
        return new RawAttributeRecord(header, code, owner, value);
    }

    private int parseCode(String code) {
        if (code.startsWith("0x") || code.startsWith("0X")) {
            return Integer.parseInt(code.substring(2), 16);
        }
        return Integer.parseInt(code);
    }
}
