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

public class StringUtils {
  public static String removePrefix(String str, String prefix) {
    if (str.startsWith(prefix)) {
      return str.substring(prefix.length());
    }
    return str;
  }

  /** Drops every trailing occurrence of {@code c}. */
  public static String trimTrailing(String str, char c) {
    int end = str.length();
    while (end > 0 && str.charAt(end - 1) == c) {
      end--;
    }
    return str.substring(0, end);
  }

  /** Returns {@code str} up to, but excluding, the first character contained in {@code chars}. */
  public static String truncateAtAny(String str, String chars) {
    for (int i = 0; i < str.length(); i++) {
      if (chars.indexOf(str.charAt(i)) != -1) {
        return str.substring(0, i);
      }
    }
    return str;
  }
}
