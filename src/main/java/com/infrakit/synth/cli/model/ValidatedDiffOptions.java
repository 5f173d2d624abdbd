package com.infrakit.synth.cli.model;

import java.nio.file.Path;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Normalized paths needed by the diff command.
 */
@Data
@AllArgsConstructor
public class ValidatedDiffOptions {
    Path current;
    Path previous;
    Path report;
}
