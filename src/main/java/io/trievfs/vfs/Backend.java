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

import static com.google.common.util.concurrent.Futures.immediateFuture;

import com.google.common.util.concurrent.ListenableFuture;

/**
 * The capabilities a content backend supplies to a {@link TrieVFS}. The VFS never reaches into
 * backend state other than through these hooks.
 *
 * @param <D> the leaf data type recorded by this backend
 */
public interface Backend<D> {
  String DEFAULT_VIEWER = "open";

  /** Fetches the content of {@code leaf} as text. */
  ListenableFuture<String> loadAsString(Leaf<D> leaf);

  /** The leaf data recording {@code source} as the provenance of a copied or written leaf. */
  D fromSource(SourceReference source);

  /** A human-facing name for {@code entry}, by default {@code name} itself. */
  default ListenableFuture<String> nameForDisplay(String name, Entry entry) {
    return immediateFuture(name);
  }

  default String viewer(Leaf<D> leaf) {
    return DEFAULT_VIEWER;
  }
}
