package com.sc2.replay;

import com.sc2.replay.cli.DecodeAttributesCommand;
import picocli.CommandLine;

/**
 * Main entry point for the replay attribute decoder.
 * Reads raw attribute records split out of a replay and prints them decoded.
 */
public class ReplayCoreApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new DecodeAttributesCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
