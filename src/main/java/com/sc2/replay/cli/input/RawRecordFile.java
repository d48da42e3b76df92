package com.sc2.replay.cli.input;

import java.util.ArrayList;
import java.util.List;

import com.sc2.replay.model.RawAttributeRecord;

import lombok.Data;

/**
 * Records read from a raw attribute dump, plus the lines that could not be read.
 */
@Data
public class RawRecordFile {
    private final List<RawAttributeRecord> records = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();

    public void addRecord(RawAttributeRecord record) {
        records.add(record);
    }

    public void addError(String error) {
        errors.add(error);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
