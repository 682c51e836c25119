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

import java.util.List;

/**
 * One listing record, as produced by {@link VFS#ls}.
 *
 * @param name the basename of the entry
 * @param path the mount-prefixed path of the entry
 * @param nameForDisplay the human-facing name supplied by the backend
 * @param viewer the viewer tag supplied by the backend
 */
public record GlobStats(
    String name, String path, String nameForDisplay, String viewer, Stats stats, Dirent dirent) {
  /** Synthetic stat values; uid and gid are sentinels since nothing is on a real disk. */
  public record Stats(long size, long mtimeMs, int uid, int gid, int mode) {}

  public record Dirent(
      boolean isFile,
      boolean isDirectory,
      boolean isSymbolicLink,
      boolean isSpecial,
      boolean isExecutable,
      String permissions,
      String username,
      MountInfo mount) {}

  public record MountInfo(boolean isLocal, List<String> tags, String mountPath) {}
}
