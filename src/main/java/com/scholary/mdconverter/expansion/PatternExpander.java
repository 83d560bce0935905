package com.scholary.mdconverter.expansion;

import com.scholary.mdconverter.config.ConversionProperties;
import com.scholary.mdconverter.converter.OutputPaths;
import java.io.IOException;
import java.nio.file.FileSystem;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Expands user supplied path patterns into concrete files.
 *
 * <p>A pattern is one of:
 *
 * <ul>
 *   <li>a literal file path
 *   <li>a literal directory, which selects its direct children
 *   <li>a wildcard expression using {@code *} and {@code ?} within one path segment
 *   <li>a recursive expression where {@code **} spans any number of directories, including none
 * </ul>
 *
 * <p>Only files with a supported extension are returned. Results keep the order in which the
 * patterns were given and, within a pattern, the order of the filesystem walk.
 */
@Component
public class PatternExpander {

  private static final Logger LOGGER = LoggerFactory.getLogger(PatternExpander.class);

  private static final String RECURSIVE = "**";

  private final Set<String> supportedExtensions;

  @Autowired
  public PatternExpander(ConversionProperties properties) {
    this(properties.normalizedExtensions());
  }

  public PatternExpander(Set<String> supportedExtensions) {
    this.supportedExtensions = Set.copyOf(supportedExtensions);
  }

  public ExpansionResult expand(List<String> patterns) {
    Set<String> files = new LinkedHashSet<>();
    List<String> unmatched = new ArrayList<>();

    for (String raw : patterns) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String pattern = raw.strip();

      List<Path> matches;
      try {
        matches = isWildcard(pattern) ? expandGlob(pattern) : expandLiteral(pattern);
      } catch (InvalidPathException e) {
        LOGGER.warn("Invalid path pattern: {} ({})", pattern, e.getReason());
        matches = List.of();
      } catch (PatternSyntaxException e) {
        LOGGER.warn("Malformed glob pattern: {} ({})", pattern, e.getDescription());
        matches = List.of();
      }
      if (matches.isEmpty()) {
        LOGGER.debug("Pattern matched no supported files: {}", pattern);
        unmatched.add(pattern);
        continue;
      }
      for (Path match : matches) {
        files.add(match.toAbsolutePath().normalize().toString());
      }
    }

    return new ExpansionResult(List.copyOf(files), List.copyOf(unmatched));
  }

  static boolean isWildcard(String pattern) {
    return pattern.indexOf('*') >= 0 || pattern.indexOf('?') >= 0;
  }

  private List<Path> expandLiteral(String pattern) {
    Path path = Paths.get(pattern);
    if (Files.isRegularFile(path)) {
      return isSupported(path) ? List.of(path) : List.of();
    }
    if (Files.isDirectory(path)) {
      try (Stream<Path> children = Files.list(path)) {
        return children.filter(Files::isRegularFile).filter(this::isSupported).toList();
      } catch (IOException e) {
        LOGGER.warn("Failed to list directory: {}", path, e);
      }
    }
    return List.of();
  }

  private List<Path> expandGlob(String pattern) {
    GlobPattern glob = GlobPattern.split(pattern);
    if (!Files.isDirectory(glob.base())) {
      return List.of();
    }

    List<PathMatcher> matchers = matchersFor(glob.base().getFileSystem(), glob.glob());
    int maxDepth = glob.recursive() ? Integer.MAX_VALUE : glob.depth();
    GlobVisitor visitor = new GlobVisitor(glob, matchers);

    try {
      Files.walkFileTree(glob.base(), EnumSet.noneOf(FileVisitOption.class), maxDepth, visitor);
    } catch (IOException e) {
      LOGGER.warn("Failed to walk directory for pattern: {}", pattern, e);
    }
    return visitor.matches;
  }

  /**
   * Collects supported files under a glob's base directory.
   *
   * <p>Unreadable entries are skipped. Hidden entries only match when the glob names them with a
   * leading dot.
   */
  private final class GlobVisitor extends SimpleFileVisitor<Path> {

    private final GlobPattern glob;
    private final List<PathMatcher> matchers;
    private final boolean hiddenDirectories;
    private final boolean hiddenFiles;
    private final List<Path> matches = new ArrayList<>();

    GlobVisitor(GlobPattern glob, List<PathMatcher> matchers) {
      this.glob = glob;
      this.matchers = matchers;
      String[] segments = glob.glob().split("/");
      boolean dottedDirectory = false;
      for (int i = 0; i < segments.length - 1; i++) {
        dottedDirectory |= segments[i].startsWith(".");
      }
      this.hiddenDirectories = dottedDirectory;
      this.hiddenFiles = segments[segments.length - 1].startsWith(".");
    }

    @Override
    public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
      if (!dir.equals(glob.base()) && !hiddenDirectories && isHidden(dir)) {
        return FileVisitResult.SKIP_SUBTREE;
      }
      return FileVisitResult.CONTINUE;
    }

    @Override
    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
      if (!Files.isRegularFile(file) || !isSupported(file)) {
        return FileVisitResult.CONTINUE;
      }
      if (!hiddenFiles && isHidden(file)) {
        return FileVisitResult.CONTINUE;
      }
      Path relative = glob.base().relativize(file);
      if (!hiddenDirectories && hasHiddenDirectory(relative)) {
        return FileVisitResult.CONTINUE;
      }
      if (matchers.stream().anyMatch(m -> m.matches(relative))) {
        matches.add(file);
      }
      return FileVisitResult.CONTINUE;
    }

    @Override
    public FileVisitResult visitFileFailed(Path file, IOException e) {
      LOGGER.warn("Skipping unreadable path: {} ({})", file, e.toString());
      return FileVisitResult.CONTINUE;
    }

    @Override
    public FileVisitResult postVisitDirectory(Path dir, IOException e) {
      if (e != null) {
        LOGGER.warn("Stopped listing directory early: {} ({})", dir, e.toString());
      }
      return FileVisitResult.CONTINUE;
    }

    private boolean hasHiddenDirectory(Path relative) {
      for (int i = 0; i < relative.getNameCount() - 1; i++) {
        if (isHidden(relative.getName(i))) {
          return true;
        }
      }
      return false;
    }

    private boolean isHidden(Path path) {
      Path name = path.getFileName();
      return name != null && name.toString().startsWith(".");
    }
  }

  /**
   * Build matchers for a relative glob.
   *
   * <p>{@code **}{@code /} in a java.nio glob needs at least one directory, so every such
   * occurrence is tried both present and removed.
   */
  static List<PathMatcher> matchersFor(FileSystem fileSystem, String glob) {
    List<String> variants = new ArrayList<>();
    collectVariants(glob, 0, variants);
    return variants.stream().map(v -> fileSystem.getPathMatcher("glob:" + v)).toList();
  }

  private static void collectVariants(String glob, int from, List<String> variants) {
    int index = glob.indexOf(RECURSIVE + "/", from);
    if (index < 0) {
      variants.add(glob);
      return;
    }
    collectVariants(glob, index + RECURSIVE.length() + 1, variants);
    collectVariants(glob.substring(0, index) + glob.substring(index + 3), index, variants);
  }

  private boolean isSupported(Path file) {
    return supportedExtensions.contains(OutputPaths.extensionOf(file));
  }

  /** A wildcard pattern split into its literal base directory and the glob below it. */
  record GlobPattern(Path base, String glob, int depth, boolean recursive) {

    static GlobPattern split(String pattern) {
      String normalized = pattern.replace('\\', '/');
      String[] segments = normalized.split("/", -1);

      int firstWildcard = 0;
      while (firstWildcard < segments.length && !isWildcard(segments[firstWildcard])) {
        firstWildcard++;
      }

      StringBuilder base = new StringBuilder();
      for (int i = 0; i < firstWildcard; i++) {
        if (i > 0) {
          base.append('/');
        }
        base.append(segments[i]);
      }
      if (normalized.startsWith("/") && base.length() == 0) {
        base.append('/');
      }

      List<String> rest = List.of(segments).subList(firstWildcard, segments.length);
      Path basePath = base.length() == 0 ? Paths.get("") : Paths.get(base.toString());
      return new GlobPattern(
          basePath.toAbsolutePath(),
          String.join("/", rest),
          rest.size(),
          rest.stream().anyMatch(s -> s.contains(RECURSIVE)));
    }
  }
}
