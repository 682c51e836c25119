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

package io.trievfs.content;

import static com.google.common.util.concurrent.Futures.catching;
import static com.google.common.util.concurrent.Futures.immediateFuture;
import static com.google.common.util.concurrent.Futures.transform;
import static com.google.common.util.concurrent.MoreExecutors.directExecutor;

import com.google.common.collect.ImmutableSet;
import com.google.common.util.concurrent.ListenableFuture;
import io.trievfs.vfs.Backend;
import io.trievfs.vfs.Entry;
import io.trievfs.vfs.Leaf;
import io.trievfs.vfs.SourceReference;
import java.io.IOException;
import java.util.Set;
import java.util.logging.Level;
import javax.annotation.Nullable;
import lombok.extern.java.Log;

/**
 * A backend for bundled notebooks. Leaves record their {@link SourceReference} and are read from a
 * {@link ContentStore}; markdown leaves are displayed under their first level-one heading.
 */
@Log
public class NotebookBackend implements Backend<SourceReference> {
  public static final String NOTEBOOK_VIEWER = "notebook";

  private static final Set<String> NOTEBOOK_EXTENSIONS = ImmutableSet.of("md", "json");
  private static final String HEADING = "# ";

  private final ContentStore store;

  public NotebookBackend(ContentStore store) {
    this.store = store;
  }

  @Override
  public ListenableFuture<String> loadAsString(Leaf<SourceReference> leaf) {
    return store.get(leaf.data().srcFilepath());
  }

  @Override
  public SourceReference fromSource(SourceReference source) {
    return source;
  }

  @Override
  public String viewer(Leaf<SourceReference> leaf) {
    return NOTEBOOK_EXTENSIONS.contains(leaf.data().extension()) ? NOTEBOOK_VIEWER : DEFAULT_VIEWER;
  }

  @Override
  public ListenableFuture<String> nameForDisplay(String name, Entry entry) {
    if (!(entry instanceof Leaf<?> leaf)
        || !(leaf.data() instanceof SourceReference source)
        || !source.extension().equals("md")) {
      return immediateFuture(name);
    }
    ListenableFuture<String> title =
        transform(
            store.get(source.srcFilepath()),
            content -> {
              String heading = title(content);
              return heading == null ? name : heading;
            },
            directExecutor());
    return catching(
        title,
        IOException.class,
        e -> {
          log.log(Level.FINE, "no title for " + source.srcFilepath(), e);
          return name;
        },
        directExecutor());
  }

  static @Nullable String title(String content) {
    for (String line : content.split("\n")) {
      String trimmed = line.strip();
      if (trimmed.startsWith(HEADING)) {
        String heading = trimmed.substring(HEADING.length()).strip();
        if (!heading.isEmpty()) {
          return heading;
        }
      }
    }
    return null;
  }
}
