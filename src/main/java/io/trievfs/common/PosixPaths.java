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

package io.trievfs.common;

/**
 * POSIX-style string path helpers. These never touch a real filesystem and are total over any
 * input string.
 */
public final class PosixPaths {
  public static final char SEPARATOR = '/';
  public static final String ROOT = "/";

  private PosixPaths() {}

  /** The last path segment, ignoring trailing separators. {@code basename("/")} is {@code "/"}. */
  public static String basename(String path) {
    String trimmed = StringUtils.trimTrailing(path, SEPARATOR);
    if (trimmed.isEmpty()) {
      return path.isEmpty() ? "" : ROOT;
    }
    return trimmed.substring(trimmed.lastIndexOf(SEPARATOR) + 1);
  }

  /**
   * All segments but the last. Paths without a separator have a dirname of {@code "."}, top-level
   * absolute paths have a dirname of {@code "/"}.
   */
  public static String dirname(String path) {
    String trimmed = StringUtils.trimTrailing(path, SEPARATOR);
    if (trimmed.isEmpty()) {
      return path.isEmpty() ? "." : ROOT;
    }
    int endIndex = trimmed.lastIndexOf(SEPARATOR);
    if (endIndex == -1) {
      return ".";
    }
    String parent = StringUtils.trimTrailing(trimmed.substring(0, endIndex), SEPARATOR);
    return parent.isEmpty() ? ROOT : parent;
  }

  /** Joins {@code base} and {@code name} with exactly one separator between them. */
  public static String join(String base, String name) {
    if (base.isEmpty()) {
      return name;
    }
    if (name.isEmpty()) {
      return base;
    }
    String head = StringUtils.trimTrailing(base, SEPARATOR);
    int start = 0;
    while (start < name.length() && name.charAt(start) == SEPARATOR) {
      start++;
    }
    return head + SEPARATOR + name.substring(start);
  }

  /** Normalizes a namespace key: leading separator, no trailing separator except for the root. */
  public static String toKey(String path) {
    String key = StringUtils.trimTrailing(path, SEPARATOR);
    if (key.isEmpty()) {
      return ROOT;
    }
    return key.charAt(0) == SEPARATOR ? key : SEPARATOR + key;
  }
}
