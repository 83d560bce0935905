package com.scholary.mdconverter.converter;

import java.nio.file.Path;
import java.util.Locale;

/** Naming of derived files written next to their source. */
public final class OutputPaths {

  private OutputPaths() {}

  /**
   * Derive the output path for a source file.
   *
   * <p>{@code report.pdf -> report.md}. A source that already carries the output extension gets
   * a {@code .converted} infix so it is never overwritten: {@code notes.md -> notes.converted.md}.
   */
  public static Path derive(Path source, String outputExtension) {
    String name = source.getFileName().toString();
    int dot = name.lastIndexOf('.');
    String stem = dot > 0 ? name.substring(0, dot) : name;
    String extension = dot > 0 ? name.substring(dot + 1) : "";

    String derivedName =
        extension.toLowerCase(Locale.ROOT).equals(outputExtension.toLowerCase(Locale.ROOT))
            ? stem + ".converted." + outputExtension
            : stem + "." + outputExtension;
    return source.resolveSibling(derivedName);
  }

  /** Lower-cased extension of a file name, or an empty string. */
  public static String extensionOf(Path file) {
    String name = file.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
  }
}
