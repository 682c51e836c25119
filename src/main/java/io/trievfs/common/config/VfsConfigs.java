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

package io.trievfs.common.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import lombok.extern.java.Log;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

@Data
@Log
public final class VfsConfigs {
  private static VfsConfigs vfsConfigs;

  private List<Mount> mounts = new ArrayList<>();
  private int fanoutPoolThreads = 4;

  public VfsConfigs() {}

  public static synchronized VfsConfigs getInstance() {
    if (vfsConfigs == null) {
      vfsConfigs = new VfsConfigs();
    }
    return vfsConfigs;
  }

  public static synchronized VfsConfigs loadConfigs(Path configLocation) throws IOException {
    log.info("Loading configs from " + configLocation);
    try (InputStream inputStream = Files.newInputStream(configLocation)) {
      return loadConfigs(inputStream);
    }
  }

  public static synchronized VfsConfigs loadConfigs(InputStream inputStream) {
    Yaml yaml = new Yaml(new Constructor(VfsConfigs.class, new LoaderOptions()));
    VfsConfigs loaded = yaml.load(inputStream);
    if (loaded == null) {
      throw new IllegalStateException("Could not load configs: empty document");
    }
    if (loaded.getFanoutPoolThreads() <= 0) {
      throw new IllegalStateException(
          "fanoutPoolThreads must be positive: " + loaded.getFanoutPoolThreads());
    }
    log.info(loaded.toString());
    vfsConfigs = loaded;
    return vfsConfigs;
  }
}
