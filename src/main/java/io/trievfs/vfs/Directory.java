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
 * A contentless namespace node. Directories exist so listings of their key succeed and so {@code
 * mkdir} is observable; children are never owned structurally.
 */
public record Directory(String mountPath, boolean isDirectory, boolean isExecutable)
    implements Entry {
  public static Directory of(String mountPath) {
    return new Directory(mountPath, /* isDirectory= */ true, /* isExecutable= */ false);
  }

  @Override
  public boolean isLeaf() {
    return false;
  }
}
