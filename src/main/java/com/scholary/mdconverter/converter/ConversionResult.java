package com.scholary.mdconverter.converter;

import java.nio.file.Path;

/** Outcome of a successful conversion. */
public record ConversionResult(Path source, Path outputPath) {}
