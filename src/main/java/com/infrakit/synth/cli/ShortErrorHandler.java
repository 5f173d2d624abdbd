package com.infrakit.synth.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Reports unexpected command failures as a single line; the stack trace only goes to
 * the debug log.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ShortErrorHandler.class);

    @Override
    public int handleExecutionException(Exception ex, CommandLine commandLine, CommandLine.ParseResult parseResult) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            message = ex.getClass().getSimpleName();
        }
        log.error("{}", message);
        log.debug("Command failed", ex);
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }
}
