package com.scholary.mdconverter.expansion;

import java.util.List;

/**
 * Files resolved from a list of patterns.
 *
 * @param files absolute paths, deduplicated, in first-seen order
 * @param unmatched patterns that resolved to no supported file, in input order
 */
public record ExpansionResult(List<String> files, List<String> unmatched) {}
