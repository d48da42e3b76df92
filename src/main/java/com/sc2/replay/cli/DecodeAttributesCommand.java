package com.sc2.replay.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sc2.replay.attribute.AttributeDecoder;
import com.sc2.replay.attribute.AttributeSet;
import com.sc2.replay.attribute.DecodeDiagnostics;
import com.sc2.replay.attribute.DecoderConfig;
import com.sc2.replay.cli.input.RawRecordFile;
import com.sc2.replay.cli.input.RawRecordFileReader;
import com.sc2.replay.cli.output.DecodeResultsPrinter;
import com.sc2.replay.exception.AttributeDecodeException;
import com.sc2.replay.model.RawAttributeRecord;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * CLI command decoding a dump of raw attribute records.
 */
@Command(
        name = "decode-attributes",
        mixinStandardHelpOptions = true,
        version = "sc2-replay-core 1.0.0",
        description = "Decodes raw replay attribute records into named, typed attributes."
)
public class DecodeAttributesCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(DecodeAttributesCommand.class);

    @Option(names = {"--input", "-i"}, required = true, description = "Raw attribute dump: one 'header code owner hexvalue' per line")
    private Path input;

    @Option(names = {"--owner", "-o"}, description = "Only decode records of this owner index")
    private Integer owner;

    @Option(names = {"--strict"}, description = "Fail on the first record that cannot be decoded")
    private boolean strict;

    @Option(names = {"--drop-unknown"}, description = "Leave out attributes with unrecognized codes")
    private boolean dropUnknown;

    private final DecodeResultsPrinter printer = new DecodeResultsPrinter();

    @Override
    public Integer call() {
        if (!Files.isRegularFile(input)) {
            log.error("Input file does not exist: {}", input);
            return 1;
        }

        printer.printBanner(input, strict);

        RawRecordFile file;
        try {
            file = new RawRecordFileReader().read(input);
        } catch (IOException e) {
            log.error("Cannot read input file {}", input, e);
            return 1;
        }
        if (strict && file.hasErrors()) {
            file.getErrors().forEach(e -> log.error("  {}", e));
            return 1;
        }

        List<RawAttributeRecord> records = owner == null
                ? file.getRecords()
                : file.getRecords().stream().filter(r -> r.getOwnerIndex() == owner).toList();

        DecoderConfig config = DecoderConfig.builder()
                .strict(strict)
                .keepUnknown(!dropUnknown)
                .build();
        DecodeDiagnostics diagnostics = new DecodeDiagnostics();

        AttributeSet attributes;
        try {
            attributes = new AttributeDecoder(config).decodeAll(records, diagnostics);
        } catch (AttributeDecodeException e) {
            log.error("Decoding failed: {}", e.getMessage());
            return 1;
        }

        printer.printAttributes(attributes);
        printer.printSummary(records.size(), attributes, diagnostics, file.getErrors());
        return 0;
    }
}
