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

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A content-bearing node. {@code data} is backend-defined and typically records where the real
 * content can be fetched.
 */
public record Leaf<D>(String mountPath, boolean isExecutable, D data) implements Entry {
  public Leaf {
    checkNotNull(mountPath);
    checkNotNull(data);
  }

  public static <D> Leaf<D> of(String mountPath, D data) {
    return new Leaf<>(mountPath, /* isExecutable= */ false, data);
  }

  @Override
  public boolean isLeaf() {
    return true;
  }

  @Override
  public boolean isDirectory() {
    return false;
  }
}
