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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ListeningExecutorService;
import io.trievfs.common.MountPrefix;
import io.trievfs.common.VfsExecutors;
import io.trievfs.common.config.Mount;
import io.trievfs.common.config.VfsConfigs;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import lombok.extern.java.Log;

/** The virtual filesystems of a larger path space, each owning the paths under its mount path. */
@Log
public class MountTable {
  @GuardedBy("this")
  private final Map<String, VFS> mounts = new HashMap<>();

  /**
   * Mounts a {@link TrieVFS} for every mount in the loaded configuration. All of them fan out on
   * one shared pool.
   */
  public static <D> MountTable fromConfigs(Function<Mount, Backend<D>> backends) {
    MountTable table = new MountTable();
    ListeningExecutorService fanoutPool = VfsExecutors.getFanoutPool();
    for (Mount mount : VfsConfigs.getInstance().getMounts()) {
      table.mount(new TrieVFS<>(mount, backends.apply(mount), fanoutPool));
    }
    return table;
  }

  public synchronized void mount(VFS vfs) {
    String mountPath = vfs.mountPath();
    checkState(!mounts.containsKey(mountPath), "%s is already mounted", mountPath);
    mounts.put(mountPath, vfs);
    log.info("Mounted " + vfs.getClass().getSimpleName() + " at " + mountPath);
  }

  /** @return the unmounted filesystem, or null if nothing was mounted at {@code mountPath} */
  public synchronized @Nullable VFS unmount(String mountPath) {
    VFS vfs = mounts.remove(MountPrefix.of(mountPath).mountPath());
    if (vfs != null) {
      log.info("Unmounted " + mountPath);
    }
    return vfs;
  }

  /** The filesystem with the longest mount path containing {@code path}, or null if none does. */
  public synchronized @Nullable VFS findMount(String path) {
    VFS best = null;
    int bestLength = -1;
    for (Map.Entry<String, VFS> mount : mounts.entrySet()) {
      String mountPath = mount.getKey();
      if (MountPrefix.of(mountPath).matches(path) && mountPath.length() > bestLength) {
        best = mount.getValue();
        bestLength = mountPath.length();
      }
    }
    return best;
  }

  public synchronized List<VFS> list() {
    return ImmutableList.copyOf(mounts.values());
  }
}
