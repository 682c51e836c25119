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

import javax.annotation.Nullable;

/**
 * The result of {@link VFS#fstat}.
 *
 * @param filepath the namespace-relative path of the entry
 * @param fullpath the mount-prefixed path of the entry
 * @param data the loaded content, present only for leaves fetched with data
 */
public record FStat(
    String viewer,
    String filepath,
    String fullpath,
    boolean isDirectory,
    boolean isExecutable,
    long size,
    @Nullable String data) {}
