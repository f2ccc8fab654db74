package com.consullo.editor.document;

import java.util.Locale;
import java.util.Map;

/**
 * Default extension table.
 */
public final class DefaultFileTypeResolver implements FileTypeResolver {

  public static final String UNKNOWN = "Unknown";

  private static final Map<String, String> TYPES = Map.ofEntries(
      Map.entry("c", "C"),
      Map.entry("h", "C Header"),
      Map.entry("cpp", "C++"),
      Map.entry("hpp", "C++ Header"),
      Map.entry("cs", "C#"),
      Map.entry("css", "CSS"),
      Map.entry("go", "Go"),
      Map.entry("html", "HTML"),
      Map.entry("java", "Java"),
      Map.entry("js", "JavaScript"),
      Map.entry("json", "JSON"),
      Map.entry("kt", "Kotlin"),
      Map.entry("md", "Markdown"),
      Map.entry("py", "Python"),
      Map.entry("rb", "Ruby"),
      Map.entry("rs", "Rust"),
      Map.entry("sh", "Shell"),
      Map.entry("toml", "TOML"),
      Map.entry("ts", "TypeScript"),
      Map.entry("txt", "Plain Text"),
      Map.entry("xml", "XML"),
      Map.entry("yaml", "YAML"),
      Map.entry("yml", "YAML"));

  @Override
  public String resolve(String extension) {
    if (extension == null || extension.isEmpty()) {
      return UNKNOWN;
    }
    return TYPES.getOrDefault(extension.toLowerCase(Locale.ROOT), UNKNOWN);
  }
}
