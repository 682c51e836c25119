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

package io.trievfs.common;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Strips and re-adds the mount path of a virtual filesystem. Stripped paths always begin with a
 * separator, and the mount root itself strips to {@code "/"}.
 */
public final class MountPrefix {
  private final String mountPath;

  private MountPrefix(String mountPath) {
    this.mountPath = mountPath;
  }

  public static MountPrefix of(String mountPath) {
    checkArgument(
        !mountPath.isEmpty() && mountPath.charAt(0) == PosixPaths.SEPARATOR,
        "mount path must be absolute: %s",
        mountPath);
    String normalized = StringUtils.trimTrailing(mountPath, PosixPaths.SEPARATOR);
    return new MountPrefix(normalized);
  }

  /** The normalized mount path, without a trailing separator; the empty string for {@code "/"}. */
  public String mountPath() {
    return mountPath.isEmpty() ? PosixPaths.ROOT : mountPath;
  }

  /** True if {@code path} is the mount path or lies beneath it. */
  public boolean matches(String path) {
    if (!path.startsWith(mountPath)) {
      return false;
    }
    return path.length() == mountPath.length()
        || path.charAt(mountPath.length()) == PosixPaths.SEPARATOR
        || mountPath.isEmpty();
  }

  /** Removes the mount path from {@code path}. Paths outside the mount are only made absolute. */
  public String strip(String path) {
    String stripped = matches(path) ? StringUtils.removePrefix(path, mountPath) : path;
    if (stripped.isEmpty()) {
      return PosixPaths.ROOT;
    }
    return stripped.charAt(0) == PosixPaths.SEPARATOR ? stripped : PosixPaths.SEPARATOR + stripped;
  }

  /** Prefixes a stripped key with the mount path. */
  public String prefix(String key) {
    if (mountPath.isEmpty()) {
      return key;
    }
    return key.equals(PosixPaths.ROOT) ? mountPath : mountPath + key;
  }

  @Override
  public String toString() {
    return mountPath();
  }
}
