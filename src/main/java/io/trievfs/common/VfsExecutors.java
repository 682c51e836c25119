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

import static com.google.common.util.concurrent.MoreExecutors.listeningDecorator;

import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.trievfs.common.config.VfsConfigs;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

public class VfsExecutors {
  public static ListeningExecutorService getFanoutPool() {
    String threadNameFormat = "vfs-fanout-pool-%d";
    ExecutorService pool =
        Executors.newFixedThreadPool(
            VfsConfigs.getInstance().getFanoutPoolThreads(),
            new ThreadFactoryBuilder().setNameFormat(threadNameFormat).setDaemon(true).build());
    return listeningDecorator(pool);
  }
}
