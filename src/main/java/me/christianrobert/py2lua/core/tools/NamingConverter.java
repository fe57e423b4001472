package me.christianrobert.py2lua.core.tools;

/**
 * Converts Python-style snake_case identifiers to the camelCase member names
 * used by the ComputerCraft Lua API.
 *
 * Examples:
 * - get_names -> getNames
 * - is_present -> isPresent
 * - wrap -> wrap
 *
 * The first segment is kept as written; every following segment gets its first
 * character upper-cased and the rest copied unchanged. Empty segments (from
 * doubled or leading underscores) contribute nothing.
 */
public class NamingConverter {

  static final char SEGMENT_SEPARATOR = '_';

  private NamingConverter() {
  }

  /**
   * Converts a snake_case identifier to camelCase.
   *
   * @param name Identifier in snake_case (may be null or empty)
   * @return camelCase identifier, or the input itself when null, empty or without separator
   */
  public static String snakeToCamel(String name) {
    if (name == null || name.isEmpty()) {
      return name;
    }
    if (name.indexOf(SEGMENT_SEPARATOR) < 0) {
      return name;
    }

    String[] segments = name.split(String.valueOf(SEGMENT_SEPARATOR), -1);
    StringBuilder result = new StringBuilder(segments[0]);
    for (int i = 1; i < segments.length; i++) {
      String segment = segments[i];
      if (segment.isEmpty()) {
        continue;
      }
      result.append(Character.toUpperCase(segment.charAt(0)));
      result.append(segment, 1, segment.length());
    }
    return result.toString();
  }
}
