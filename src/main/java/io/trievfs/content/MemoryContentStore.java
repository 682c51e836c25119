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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.util.concurrent.Futures.immediateFailedFuture;
import static com.google.common.util.concurrent.Futures.immediateFuture;

import com.google.common.collect.Maps;
import com.google.common.util.concurrent.ListenableFuture;
import java.util.Map;
import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;

public class MemoryContentStore implements ContentStore {
  @GuardedBy("this")
  private final Map<String, String> storage = Maps.newHashMap();

  public synchronized void put(String srcFilepath, String content) {
    storage.put(checkNotNull(srcFilepath), checkNotNull(content));
  }

  public synchronized @Nullable String remove(String srcFilepath) {
    return storage.remove(srcFilepath);
  }

  public synchronized boolean contains(String srcFilepath) {
    return storage.containsKey(srcFilepath);
  }

  @Override
  public synchronized ListenableFuture<String> get(String srcFilepath) {
    String content = storage.get(srcFilepath);
    if (content == null) {
      return immediateFailedFuture(new ContentNotFoundException(srcFilepath));
    }
    return immediateFuture(content);
  }
}
