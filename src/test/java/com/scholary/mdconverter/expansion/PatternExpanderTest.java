package com.scholary.mdconverter.expansion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeFalse;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PatternExpanderTest {

  @TempDir Path root;

  private PatternExpander expander;

  private Path pdf;
  private Path docx;
  private Path nestedPdf;
  private Path deepPdf;
  private Path upperCaseDocx;

  @BeforeEach
  void setUp() throws IOException {
    expander = new PatternExpander(Set.of("pdf", "docx", "pptx", "txt", "md"));

    pdf = Files.writeString(root.resolve("a.pdf"), "a");
    docx = Files.writeString(root.resolve("b.docx"), "b");
    Files.writeString(root.resolve("notes.xyz"), "ignored");
    Files.createDirectories(root.resolve("sub/deep"));
    Files.createDirectories(root.resolve("empty"));
    nestedPdf = Files.writeString(root.resolve("sub/c.pdf"), "c");
    deepPdf = Files.writeString(root.resolve("sub/deep/d.pdf"), "d");
    upperCaseDocx = Files.writeString(root.resolve("sub/deep/E.DOCX"), "e");
  }

  @Test
  void expand_shouldIncludeLiteralFile() {
    ExpansionResult result = expander.expand(List.of(pdf.toString()));

    assertThat(result.files()).containsExactly(abs(pdf));
    assertThat(result.unmatched()).isEmpty();
  }

  @Test
  void expand_shouldDeduplicateKeepingFirstOccurrence() {
    ExpansionResult result =
        expander.expand(List.of(pdf.toString(), pdf.toString(), docx.toString()));

    assertThat(result.files()).containsExactly(abs(pdf), abs(docx));
  }

  @Test
  void expand_shouldDeduplicateAcrossLiteralAndGlob() {
    ExpansionResult result =
        expander.expand(List.of(docx.toString(), root.resolve("*").toString()));

    assertThat(result.files()).hasSize(2).startsWith(abs(docx)).contains(abs(pdf));
  }

  @Test
  void expand_shouldReportPatternWithNoMatches() {
    String pattern = root.resolve("missing/*.pdf").toString();

    ExpansionResult result = expander.expand(List.of(pattern));

    assertThat(result.files()).isEmpty();
    assertThat(result.unmatched()).containsExactly(pattern);
  }

  @Test
  void expand_shouldReportMissingLiteralAndUnsupportedLiteral() {
    String missing = root.resolve("nope.pdf").toString();
    String unsupported = root.resolve("notes.xyz").toString();

    ExpansionResult result = expander.expand(List.of(missing, unsupported));

    assertThat(result.files()).isEmpty();
    assertThat(result.unmatched()).containsExactly(missing, unsupported);
  }

  @Test
  void expand_singleLevelWildcardShouldNotDescend() {
    ExpansionResult result = expander.expand(List.of(root.resolve("*.pdf").toString()));

    assertThat(result.files()).containsExactly(abs(pdf));
  }

  @Test
  void expand_questionMarkShouldMatchOneCharacter() {
    ExpansionResult result = expander.expand(List.of(root.resolve("?.docx").toString()));

    assertThat(result.files()).containsExactly(abs(docx));
  }

  @Test
  void expand_wildcardDirectorySegmentShouldMatchOneLevel() {
    ExpansionResult result = expander.expand(List.of(root.resolve("*/*.pdf").toString()));

    assertThat(result.files()).containsExactly(abs(nestedPdf));
  }

  @Test
  void expand_recursiveWildcardShouldMatchAtEveryDepth() {
    ExpansionResult result = expander.expand(List.of(root + "/**/*.pdf"));

    assertThat(result.files()).containsExactlyInAnyOrder(abs(pdf), abs(nestedPdf), abs(deepPdf));
  }

  @Test
  void expand_extensionCheckShouldIgnoreCase() {
    ExpansionResult result = expander.expand(List.of(root.resolve("sub/deep/*").toString()));

    assertThat(result.files()).containsExactlyInAnyOrder(abs(deepPdf), abs(upperCaseDocx));
  }

  @Test
  void expand_shouldSilentlyExcludeUnsupportedExtensions() {
    ExpansionResult result = expander.expand(List.of(root.resolve("*").toString()));

    assertThat(result.files()).containsExactlyInAnyOrder(abs(pdf), abs(docx));
    assertThat(result.unmatched()).isEmpty();
  }

  @Test
  void expand_globMatchingOnlyUnsupportedFilesIsUnmatched() {
    String pattern = root.resolve("*.xyz").toString();

    ExpansionResult result = expander.expand(List.of(pattern));

    assertThat(result.files()).isEmpty();
    assertThat(result.unmatched()).containsExactly(pattern);
  }

  @Test
  void expand_directoryShouldSelectSupportedChildren() {
    ExpansionResult result =
        expander.expand(List.of(root.toString(), root.resolve("empty").toString()));

    assertThat(result.files()).containsExactlyInAnyOrder(abs(pdf), abs(docx));
    assertThat(result.unmatched()).containsExactly(root.resolve("empty").toString());
  }

  @Test
  void expand_invalidPathShouldBeUnmatchedWithoutFailingBatch() {
    String invalid = root.resolve("a").toString() + "\u0000.pdf";

    ExpansionResult result = expander.expand(List.of(invalid, pdf.toString()));

    assertThat(result.files()).containsExactly(abs(pdf));
    assertThat(result.unmatched()).containsExactly(invalid);
  }

  @Test
  void expand_malformedGlobShouldBeUnmatchedWithoutFailingBatch() {
    String openBrace = root.resolve("{dr*.pdf").toString();
    String openBracket = root.resolve("[a*.pdf").toString();

    ExpansionResult result = expander.expand(List.of(openBrace, pdf.toString(), openBracket));

    assertThat(result.files()).containsExactly(abs(pdf));
    assertThat(result.unmatched()).containsExactly(openBrace, openBracket);
  }

  @Test
  void expand_recursiveWildcardShouldSkipUnreadableDirectory() throws IOException {
    assumeFalse("root".equals(System.getProperty("user.name")), "root can read any directory");
    Path locked = Files.createDirectories(root.resolve("sub/locked"));
    Files.writeString(locked.resolve("hidden.pdf"), "x");
    Files.setPosixFilePermissions(locked, Set.of());
    try {
      ExpansionResult result = expander.expand(List.of(root + "/**/*.pdf"));

      assertThat(result.files())
          .containsExactlyInAnyOrder(abs(pdf), abs(nestedPdf), abs(deepPdf));
      assertThat(result.unmatched()).isEmpty();
    } finally {
      Files.setPosixFilePermissions(locked, PosixFilePermissions.fromString("rwx------"));
    }
  }

  @Test
  void expand_wildcardShouldSkipHiddenEntriesUnlessNamed() throws IOException {
    Files.createDirectories(root.resolve(".git"));
    Path gitPdf = Files.writeString(root.resolve(".git/x.pdf"), "x");
    Path dotPdf = Files.writeString(root.resolve(".draft.pdf"), "x");

    ExpansionResult recursive = expander.expand(List.of(root + "/**/*.pdf"));
    ExpansionResult named =
        expander.expand(
            List.of(root.resolve(".git/*.pdf").toString(), root.resolve(".*.pdf").toString()));

    assertThat(recursive.files())
        .containsExactlyInAnyOrder(abs(pdf), abs(nestedPdf), abs(deepPdf));
    assertThat(named.files()).containsExactly(abs(gitPdf), abs(dotPdf));
  }

  @Test
  void expand_shouldSkipBlankPatternsAndTrimOthers() {
    ExpansionResult result = expander.expand(Arrays.asList("", "   ", null, "  " + pdf + "  "));

    assertThat(result.files()).containsExactly(abs(pdf));
    assertThat(result.unmatched()).isEmpty();
  }

  @Test
  void expand_shouldKeepPatternOrder() {
    ExpansionResult result =
        expander.expand(
            List.of(
                nestedPdf.toString(), root.resolve("nope/*.md").toString(), docx.toString()));

    assertThat(result.files()).containsExactly(abs(nestedPdf), abs(docx));
    assertThat(result.unmatched()).containsExactly(root.resolve("nope/*.md").toString());
  }

  @Test
  void globPattern_shouldSplitBaseFromWildcardSegments() {
    PatternExpander.GlobPattern glob = PatternExpander.GlobPattern.split("/data/in/**/*.pdf");

    assertThat(glob.base()).isEqualTo(Path.of("/data/in").toAbsolutePath());
    assertThat(glob.glob()).isEqualTo("**/*.pdf");
    assertThat(glob.recursive()).isTrue();
  }

  private static String abs(Path path) {
    return path.toAbsolutePath().normalize().toString();
  }
}
