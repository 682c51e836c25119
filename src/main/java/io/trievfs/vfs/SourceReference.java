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

import javax.annotation.Nullable;

/**
 * A parsed copy source: a backend-bundled content reference recorded as the provenance of a leaf.
 *
 * @param srcFilepath the original source string, e.g. {@code plugin://client/notebooks/a.md}
 * @param kind which source shape matched
 * @param plugin the plugin name for {@link SourcePath.SourceKind#PluginNotebook} sources
 * @param file the file stem, which may contain separators
 * @param extension the extension without its dot
 */
public record SourceReference(
    String srcFilepath,
    SourcePath.SourceKind kind,
    @Nullable String plugin,
    String file,
    String extension) {
  public SourceReference {
    checkNotNull(srcFilepath);
    checkNotNull(kind);
    checkNotNull(file);
    checkNotNull(extension);
  }

  /** The file name a copy of this source is given, {@code file.extension}. */
  public String fileName() {
    return file + "." + extension;
  }
}
