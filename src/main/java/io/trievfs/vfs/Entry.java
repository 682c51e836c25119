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

/**
 * A node of the virtual namespace, stored in the index under its {@link #mountPath()}.
 *
 * <p>There are exactly two kinds: a {@link Directory} marker and a content-bearing {@link Leaf}.
 */
public interface Entry {
  /** The namespace-relative key of this entry, without the mount path. */
  String mountPath();

  boolean isExecutable();

  boolean isLeaf();

  /** Directories report true; leaves never do. */
  boolean isDirectory();
}
