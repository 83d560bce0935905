package com.scholary.mdconverter.converter;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Removes recurring noise from converted Markdown.
 *
 * <p>Office exports tend to repeat classification banners, page counters and copyright footers on
 * every page. These add nothing once the document is flattened to text, so they are stripped,
 * and whitespace is normalised afterwards.
 */
@Component
public class MarkdownCleaner {

  private static final Map<Pattern, String> REPLACEMENTS = new LinkedHashMap<>();

  static {
    for (String banner :
        new String[] {
          "RESTRICTED, NON-SENSITIVE",
          "RESTRICTED NON-SENSITIVE",
          "RESTRICTED,NON-SENSITIVE",
          "RESTRICTED - NON-SENSITIVE",
          "RESTRICTED-NON-SENSITIVE"
        }) {
      REPLACEMENTS.put(Pattern.compile(Pattern.quote(banner), Pattern.CASE_INSENSITIVE), "");
    }
    REPLACEMENTS.put(Pattern.compile("Page \\d+ of \\d+", Pattern.CASE_INSENSITIVE), "");
    REPLACEMENTS.put(Pattern.compile("Copyright.*\\d{4}", Pattern.CASE_INSENSITIVE), "");
    REPLACEMENTS.put(Pattern.compile(Pattern.quote("# File:"), Pattern.CASE_INSENSITIVE), "File:");
    REPLACEMENTS.put(Pattern.compile(Pattern.quote("# Path:"), Pattern.CASE_INSENSITIVE), "Path:");
  }

  private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("\\n{3,}");
  private static final Pattern HORIZONTAL_WHITESPACE = Pattern.compile("[ \\t]+");
  private static final Pattern WHITESPACE_ONLY_LINE =
      Pattern.compile("^[ \\t]+$", Pattern.MULTILINE);

  public String clean(String content) {
    if (content == null || content.isEmpty()) {
      return "";
    }

    String cleaned = content;
    for (Map.Entry<Pattern, String> replacement : REPLACEMENTS.entrySet()) {
      cleaned = replacement.getKey().matcher(cleaned).replaceAll(replacement.getValue());
    }

    cleaned = EXCESS_BLANK_LINES.matcher(cleaned).replaceAll("\n\n");
    cleaned = HORIZONTAL_WHITESPACE.matcher(cleaned).replaceAll(" ");
    cleaned = WHITESPACE_ONLY_LINE.matcher(cleaned).replaceAll("");

    return cleaned.strip();
  }
}
