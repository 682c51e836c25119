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

import com.google.common.util.concurrent.ListenableFuture;

/** A store of text content addressed by source path, such as {@code plugin://client/a.md}. */
public interface ContentStore {
  /**
   * Fetches the content recorded under {@code srcFilepath}. Unknown sources fail with {@link
   * ContentNotFoundException}.
   */
  ListenableFuture<String> get(String srcFilepath);
}
