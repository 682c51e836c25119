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

package io.trievfs.vfs;

import com.google.common.collect.ImmutableList;
import io.trievfs.common.PosixPaths;
import io.trievfs.glob.Globs;
import io.trievfs.index.TrieIndex;
import java.util.List;
import java.util.logging.Level;
import java.util.regex.Pattern;
import lombok.extern.java.Log;

/**
 * Resolves path expressions, possibly containing globs, against a {@link TrieIndex} of entries.
 *
 * <p>Candidates are bounded by a prefix lookup on the literal head of the expression before any
 * pattern is applied. An expression whose literal head reaches no entry resolves to nothing, even
 * when a full scan could have matched it (a leading wildcard, for instance).
 */
@Log
public class EntryResolver {
  private final TrieIndex<Entry> index;

  public EntryResolver(TrieIndex<Entry> index) {
    this.index = index;
  }

  public List<Entry> find(String filepath) {
    return find(filepath, /* directoryOnly= */ false, /* exact= */ false);
  }

  /**
   * Finds the entries named by {@code filepath}, a mount-stripped path expression.
   *
   * @param directoryOnly return the entry named by {@code filepath} itself rather than its
   *     contents
   * @param exact only an entry keyed by exactly {@code filepath} matches; globs are literal
   */
  public List<Entry> find(String filepath, boolean directoryOnly, boolean exact) {
    List<Entry> candidates = index.get(Globs.lookupPrefix(filepath));
    if (candidates.isEmpty()) {
      log.log(Level.FINE, "no index candidates for " + filepath);
      return ImmutableList.of();
    }

    if (directoryOnly) {
      String withSeparator = filepath + PosixPaths.SEPARATOR;
      return candidates.stream()
          .filter(
              entry ->
                  entry.mountPath().equals(filepath) || entry.mountPath().equals(withSeparator))
          .collect(ImmutableList.toImmutableList());
    }

    if (exact) {
      return candidates.stream()
          .filter(entry -> entry.mountPath().equals(filepath))
          .collect(ImmutableList.toImmutableList());
    }

    Pattern glob = Globs.matcher(filepath);
    Pattern directoryContents = Globs.directoryPattern(filepath);
    return candidates.stream()
        .filter(
            entry ->
                glob.matcher(entry.mountPath()).matches()
                    || directoryContents.matcher(entry.mountPath()).find())
        // a directory is not one of its own children
        .filter(entry -> !entry.isDirectory() || !entry.mountPath().equals(filepath))
        .collect(ImmutableList.toImmutableList());
  }

  /**
   * True if {@code key} names a directory: the root, a directory entry, or any key beneath it.
   * Directories need not have been created explicitly.
   */
  public boolean directoryExists(String key) {
    if (key.equals(PosixPaths.ROOT)) {
      return true;
    }
    for (Entry entry : index.getExact(key)) {
      if (entry.isDirectory()) {
        return true;
      }
    }
    return index.containsPrefix(key + PosixPaths.SEPARATOR);
  }
}
