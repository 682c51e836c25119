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

import static com.google.common.util.concurrent.Futures.immediateFailedFuture;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.io.Resources;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import io.trievfs.common.PosixPaths;
import io.trievfs.common.StringUtils;
import java.net.URL;

/**
 * Content bundled on the classpath. {@code plugin://client/notebooks/a.md} is read from the
 * resource {@code <base>/client/notebooks/a.md}.
 */
public class ResourceContentStore implements ContentStore {
  public static final String SCHEME = "plugin://";

  private final ClassLoader classLoader;
  private final String base;
  private final ListeningExecutorService service;

  public ResourceContentStore(
      ClassLoader classLoader, String base, ListeningExecutorService service) {
    this.classLoader = classLoader;
    this.base = StringUtils.trimTrailing(StringUtils.removePrefix(base, "/"), '/');
    this.service = service;
  }

  String resourceName(String srcFilepath) {
    return PosixPaths.join(base, StringUtils.removePrefix(srcFilepath, SCHEME));
  }

  @Override
  public ListenableFuture<String> get(String srcFilepath) {
    if (!srcFilepath.startsWith(SCHEME)) {
      return immediateFailedFuture(new ContentNotFoundException(srcFilepath));
    }
    String resourceName = resourceName(srcFilepath);
    return service.submit(
        () -> {
          URL url = classLoader.getResource(resourceName);
          if (url == null) {
            throw new ContentNotFoundException(srcFilepath);
          }
          return Resources.toString(url, UTF_8);
        });
  }
}
