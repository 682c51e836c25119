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

/** Thrown when a copy source matches none of the recognized source path shapes. */
public class InvalidSourceException extends VfsException {
  private final String source;

  public InvalidSourceException(String source) {
    super("Unable to copy given source into the VFS: " + source, BAD_REQUEST);
    this.source = source;
  }

  public String getSource() {
    return source;
  }
}
