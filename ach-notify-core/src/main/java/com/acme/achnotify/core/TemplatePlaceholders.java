package com.acme.achnotify.core;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces {@code ${name}} placeholders with values from a map. Unknown placeholders are left
 * untouched; known keys with a null value become empty.
 */
public final class TemplatePlaceholders {
  private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([A-Za-z0-9_.]+)}");

  private TemplatePlaceholders() {}

  public static String fill(String template, Map<String, ?> values) {
    if (template == null) {
      return null;
    }
    Matcher matcher = PLACEHOLDER.matcher(template);
    StringBuilder out = new StringBuilder();
    while (matcher.find()) {
      String key = matcher.group(1);
      String replacement;
      if (values.containsKey(key)) {
        Object value = values.get(key);
        replacement = value != null ? value.toString() : "";
      } else {
        replacement = matcher.group();
      }
      matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
    }
    matcher.appendTail(out);
    return out.toString();
  }

  /** Same as {@link #fill} with every value HTML-escaped, for templates with an HTML body. */
  public static String fillHtml(String template, Map<String, ?> values) {
    Map<String, String> escaped = new LinkedHashMap<>();
    values.forEach((key, value) -> escaped.put(key, value != null ? escapeHtml(value.toString()) : null));
    return fill(template, escaped);
  }

  public static String escapeHtml(String value) {
    if (value == null) {
      return "";
    }
    StringBuilder escaped = new StringBuilder(value.length());
    for (char c : value.toCharArray()) {
      switch (c) {
        case '<' -> escaped.append("&lt;");
        case '>' -> escaped.append("&gt;");
        case '&' -> escaped.append("&amp;");
        case '"' -> escaped.append("&quot;");
        case '\'' -> escaped.append("&#39;");
        default -> escaped.append(c);
      }
    }
    return escaped.toString();
  }
}
