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

import io.trievfs.common.PosixPaths;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.annotation.Nullable;

/** Recognizes the source path shapes that may be copied or written into a virtual filesystem. */
public class SourcePath {
  public static final String CLIENT_NOTEBOOKS = "plugin://client/notebooks/";

  private static final Pattern WRITE_NAME = Pattern.compile("([^/]+)\\.([^./]+)$");

  public enum SourceKind {
    // plugin://plugin-{plugin}/notebooks/{file}.{md,json}
    PluginNotebook(Pattern.compile("^plugin://plugin-(.*)/notebooks/(.*)\\.(md|json)$")),
    // plugin://client/notebooks/{file}.{md,json,yml,yaml,txt,py}
    ClientNotebook(Pattern.compile("^plugin://client/notebooks/(.*)\\.(md|json|yml|yaml|txt|py)$")),
    // plugin://client/{file}.{md,json}
    ClientResource(Pattern.compile("^plugin://client/(.*)\\.(md|json)$"));

    private final Pattern pattern;

    SourceKind(Pattern pattern) {
      this.pattern = pattern;
    }

    private @Nullable SourceReference match(String srcFilepath) {
      Matcher matcher = pattern.matcher(srcFilepath);
      if (!matcher.matches()) {
        return null;
      }
      if (this == PluginNotebook) {
        return new SourceReference(
            srcFilepath, this, matcher.group(1), matcher.group(2), matcher.group(3));
      }
      return new SourceReference(
          srcFilepath, this, /* plugin= */ null, matcher.group(1), matcher.group(2));
    }
  }

  /**
   * Parses a copy source. Shapes are tried in declaration order, so a client notebook is never
   * reported as a client resource.
   *
   * @throws InvalidSourceException if no shape matches
   */
  public static SourceReference parse(String srcFilepath) throws InvalidSourceException {
    for (SourceKind kind : SourceKind.values()) {
      SourceReference reference = kind.match(srcFilepath);
      if (reference != null) {
        return reference;
      }
    }
    throw new InvalidSourceException(srcFilepath);
  }

  /**
   * The client notebook reference synthesized for a written file, derived from the basename of
   * {@code filepath}.
   *
   * @throws InvalidFilenameException if the basename has no extension
   */
  public static SourceReference forWrite(String filepath) throws InvalidFilenameException {
    Matcher matcher = WRITE_NAME.matcher(PosixPaths.basename(filepath));
    if (!matcher.find()) {
      throw new InvalidFilenameException(filepath);
    }
    String file = matcher.group(1);
    String extension = matcher.group(2);
    return new SourceReference(
        CLIENT_NOTEBOOKS + file + "." + extension,
        SourceKind.ClientNotebook,
        /* plugin= */ null,
        file,
        extension);
  }
}
