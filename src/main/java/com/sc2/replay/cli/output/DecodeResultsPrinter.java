package com.sc2.replay.cli.output;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sc2.replay.attribute.AttributeSet;
import com.sc2.replay.attribute.DecodeDiagnostics;
import com.sc2.replay.model.Attribute;

/**
 * Responsible only for printing CLI output for the "decode-attributes" command.
 */
public class DecodeResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(DecodeResultsPrinter.class);

    public void printBanner(Path input, boolean strict) {
        log.info("=================================================");
        log.info("Replay Attribute Decoder");
        log.info("=================================================");
        log.info("Input: {}", input.toAbsolutePath());
        log.info("Strict: {}", strict);
        log.info("=================================================");
    }

    public void printAttributes(AttributeSet attributes) {
        for (Map.Entry<Integer, List<Attribute>> group : attributes.groupByOwner().entrySet()) {
            log.info("Owner {}:", group.getKey());
            for (Attribute attribute : group.getValue()) {
                log.info("  {}: {}", attribute.getDisplayName(), attribute.getValue());
            }
        }
    }

    public void printSummary(int recordsRead, AttributeSet attributes, DecodeDiagnostics diagnostics,
                             List<String> inputErrors) {
        log.info("");
        log.info("=================================================");
        log.info("Records Read: {}", recordsRead);
        log.info("Attributes Decoded: {}", attributes.size());
        log.info("Owners: {}", attributes.groupByOwner().size());

        if (!inputErrors.isEmpty()) {
            log.warn("Unreadable Lines: {}", inputErrors.size());
            inputErrors.forEach(e -> log.warn("  {}", e));
        }
        if (diagnostics.hasWarnings()) {
            log.warn("Warnings: {}", diagnostics.getWarnings().size());
            diagnostics.getWarnings().forEach(w -> log.warn("  {}", w));
        }
        if (diagnostics.hasErrors()) {
            log.error("Failed Records: {}", diagnostics.getErrors().size());
            diagnostics.getErrors().forEach(e -> log.error("  {}", e));
        }
        log.info("=================================================");
    }
}
