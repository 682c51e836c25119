// Copyright 2026 The Buildfarm Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package io.trievfs.glob;

import io.trievfs.common.PosixPaths;
import io.trievfs.common.StringUtils;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import lombok.extern.java.Log;

/**
 * Translation of shell-style globs into {@link Pattern}s.
 *
 * <p>Two flavors exist. {@link #globToPattern} is the loose translation used to build directory
 * patterns, where {@code *} matches any sequence including separators. {@link #matcher} follows
 * shell matching rules:
 *
 * <ul>
 *   <li>{@code *} matches any sequence of characters except the path separator
 *   <li>{@code **} matches any sequence of characters including path separators
 *   <li>{@code ?} matches any single character except the path separator
 *   <li>{@code [abc]}, {@code [a-z]}, {@code [!abc]} match a single character in (or not in) a set
 *   <li>{@code {a,b}} matches either alternative
 *   <li>{@code \} escapes the next character
 * </ul>
 */
@Log
public final class Globs {
  private static final String REGEX_META_CHARS = ".^$+{[]|()\\*?";
  private static final String LOOKUP_STOP_CHARS = "*{?[\\";

  private Globs() {}

  /**
   * Loose glob translation: separators become escaped literals and {@code *} matches any sequence.
   * Every other character is matched literally. The result is not anchored.
   */
  public static String globToPattern(String path) {
    StringBuilder regex = new StringBuilder();
    for (int i = 0; i < path.length(); i++) {
      char c = path.charAt(i);
      if (c == PosixPaths.SEPARATOR) {
        regex.append("\\/");
      } else if (c == '*') {
        regex.append(".*");
      } else {
        appendLiteral(regex, c);
      }
    }
    return regex.toString();
  }

  /**
   * The pattern of paths exactly one segment below {@code path}, optionally followed by a trailing
   * separator. {@code /kui/docs} yields a pattern matching {@code /kui/docs/x} and {@code
   * /kui/docs/x/}, but neither {@code /kui/docs} nor {@code /kui/docs/x/y}.
   */
  public static Pattern directoryPattern(String path) {
    if (path.isEmpty() || path.charAt(path.length() - 1) != PosixPaths.SEPARATOR) {
      return directoryPattern(path + PosixPaths.SEPARATOR);
    }
    return Pattern.compile("^" + globToPattern(path) + "[^/]+\\/?$");
  }

  /**
   * The portion of {@code path} before its first glob metacharacter, suitable as a prefix lookup
   * key.
   */
  public static String lookupPrefix(String path) {
    return StringUtils.truncateAtAny(path, LOOKUP_STOP_CHARS);
  }

  /** Anchored shell-style matcher for {@code glob}. Malformed globs match only themselves. */
  public static Pattern matcher(String glob) {
    try {
      return Pattern.compile(globToRegex(glob));
    } catch (PatternSyntaxException e) {
      log.fine(String.format("treating malformed glob %s literally: %s", glob, e.getDescription()));
      return Pattern.compile("^" + Pattern.quote(glob) + "$");
    }
  }

  private static boolean isRegexMeta(char c) {
    return REGEX_META_CHARS.indexOf(c) != -1;
  }

  private static void appendLiteral(StringBuilder regex, char c) {
    if (isRegexMeta(c)) {
      regex.append('\\');
    }
    regex.append(c);
  }

  private static char nextChar(String glob, int i) {
    return i < glob.length() ? glob.charAt(i) : 0;
  }

  // follows the structure of sun.nio.fs.Globs
  static String globToRegex(String glob) {
    boolean inGroup = false;
    StringBuilder regex = new StringBuilder("^");

    int i = 0;
    while (i < glob.length()) {
      char c = glob.charAt(i++);
      switch (c) {
        case '\\':
          if (i == glob.length()) {
            throw new PatternSyntaxException("No character to escape", glob, i - 1);
          }
          appendLiteral(regex, glob.charAt(i++));
          break;
        case '[':
          i = appendCharacterClass(regex, glob, i);
          break;
        case '{':
          if (inGroup) {
            throw new PatternSyntaxException("Cannot nest groups", glob, i - 1);
          }
          regex.append("(?:(?:");
          inGroup = true;
          break;
        case '}':
          if (inGroup) {
            regex.append("))");
            inGroup = false;
          } else {
            regex.append("\\}");
          }
          break;
        case ',':
          regex.append(inGroup ? ")|(?:" : ",");
          break;
        case '*':
          if (nextChar(glob, i) == '*') {
            regex.append(".*");
            i++;
          } else {
            regex.append("[^/]*");
          }
          break;
        case '?':
          regex.append("[^/]");
          break;
        default:
          appendLiteral(regex, c);
      }
    }
    if (inGroup) {
      throw new PatternSyntaxException("Missing '}'", glob, i - 1);
    }
    return regex.append('$').toString();
  }

  private static int appendCharacterClass(StringBuilder regex, String glob, int i) {
    regex.append("[[^/]&&[");
    if (nextChar(glob, i) == '^') {
      regex.append("\\^");
      i++;
    } else {
      if (nextChar(glob, i) == '!') {
        regex.append('^');
        i++;
      }
      if (nextChar(glob, i) == '-') {
        regex.append('-');
        i++;
      }
    }
    boolean hasRangeStart = false;
    char last = 0;
    char c = 0;
    while (i < glob.length()) {
      c = glob.charAt(i++);
      if (c == ']') {
        break;
      }
      if (c == PosixPaths.SEPARATOR) {
        throw new PatternSyntaxException("Explicit 'name separator' in class", glob, i - 1);
      }
      if (c == '\\' || c == '[' || c == '&' && nextChar(glob, i) == '&') {
        regex.append('\\');
      }
      regex.append(c);
      if (c == '-') {
        if (!hasRangeStart) {
          throw new PatternSyntaxException("Invalid range", glob, i - 1);
        }
        c = nextChar(glob, i++);
        if (c == 0 || c == ']') {
          break;
        }
        if (c < last) {
          throw new PatternSyntaxException("Invalid range", glob, i - 3);
        }
        regex.append(c);
        hasRangeStart = false;
      } else {
        hasRangeStart = true;
        last = c;
      }
    }
    if (c != ']') {
      throw new PatternSyntaxException("Missing ']'", glob, i - 1);
    }
    regex.append("]]");
    return i;
  }
}
