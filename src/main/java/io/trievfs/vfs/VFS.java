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

import com.google.common.util.concurrent.ListenableFuture;
import java.util.List;

/**
 * POSIX-like operations over a virtual namespace mounted at {@link #mountPath()}. Caller paths may
 * carry the mount prefix; every returned path does.
 */
public interface VFS {
  String mountPath();

  boolean isLocal();

  boolean isVirtual();

  List<String> tags();

  /** Stat records for every entry matched by {@code filepaths}, flattened in input order. */
  ListenableFuture<List<GlobStats>> ls(ListOptions options, List<String> filepaths);

  /**
   * Stats the entry exactly named by {@code filepath}. A miss fails with {@link
   * EntryNotFoundException}, or yields {@code null} if {@code enoentOk}.
   */
  ListenableFuture<FStat> fstat(String filepath, boolean withData, boolean enoentOk);

  /** Single-file search is not supported by virtual filesystems; always empty. */
  ListenableFuture<List<GrepResult>> grep(String filepath, String pattern);

  /** The leaves under {@code filepaths} whose content contains a match for {@code pattern}. */
  ListenableFuture<List<GrepResult>> grepdir(List<String> filepaths, String pattern);

  ListenableFuture<String> cp(List<String> srcFilepaths, String dstFilepath);

  ListenableFuture<String> rm(String filepath);

  ListenableFuture<Void> fwrite(String filepath, byte[] data);

  ListenableFuture<Void> mkdir(String filepath);

  ListenableFuture<Void> rmdir(String filepath);

  /** The characters {@code [offset, offset + length)} of a leaf, or empty for anything else. */
  ListenableFuture<String> fslice(String filepath, int offset, int length);
}
