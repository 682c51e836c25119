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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.util.concurrent.Futures.allAsList;
import static com.google.common.util.concurrent.Futures.catching;
import static com.google.common.util.concurrent.Futures.immediateFailedFuture;
import static com.google.common.util.concurrent.Futures.immediateFuture;
import static com.google.common.util.concurrent.Futures.transform;
import static com.google.common.util.concurrent.Futures.transformAsync;
import static com.google.common.util.concurrent.MoreExecutors.directExecutor;
import static com.google.common.util.concurrent.MoreExecutors.newDirectExecutorService;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import io.trievfs.common.MountPrefix;
import io.trievfs.common.PosixPaths;
import io.trievfs.common.config.Mount;
import io.trievfs.index.TrieIndex;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import lombok.extern.java.Log;

/**
 * A virtual filesystem whose namespace lives in a {@link TrieIndex}, with content supplied lazily
 * by a {@link Backend}.
 *
 * <p>Leaves record where their content comes from rather than the content itself; {@code cp} and
 * {@code fwrite} store provenance and every read goes through {@link Backend#loadAsString}.
 * Index mutations complete before an operation returns its future, and every mutating operation
 * validates its arguments before touching the index.
 *
 * <p>Batch operations resolve each input path on the fan-out executor and join the results.
 *
 * @param <D> the leaf data type of the backend
 */
@Log
public class TrieVFS<D> implements VFS {
  static final int UID = -1;
  static final int GID = -1;
  static final String USERNAME = "";

  @SuppressWarnings("OctalInteger")
  static final int EXECUTABLE_MODE = 0755;

  @SuppressWarnings("OctalInteger")
  static final int REGULAR_MODE = 0644;

  private final MountPrefix prefix;
  private final Backend<D> backend;
  private final TrieIndex<Entry> index;
  private final EntryResolver resolver;
  private final ListeningExecutorService fanoutService;
  private final List<String> tags;

  public TrieVFS(String mountPath, Backend<D> backend) {
    this(
        MountPrefix.of(mountPath),
        backend,
        new TrieIndex<>(),
        newDirectExecutorService(),
        ImmutableList.of());
  }

  public TrieVFS(Mount mount, Backend<D> backend, ListeningExecutorService fanoutService) {
    this(
        MountPrefix.of(mount.getPath()),
        backend,
        new TrieIndex<>(),
        fanoutService,
        mount.getTags());
  }

  public TrieVFS(
      MountPrefix prefix,
      Backend<D> backend,
      TrieIndex<Entry> index,
      ListeningExecutorService fanoutService,
      List<String> tags) {
    this.prefix = prefix;
    this.backend = backend;
    this.index = index;
    this.resolver = new EntryResolver(index);
    this.fanoutService = fanoutService;
    this.tags = ImmutableList.copyOf(tags);
  }

  @Override
  public String mountPath() {
    return prefix.mountPath();
  }

  @Override
  public boolean isLocal() {
    return false;
  }

  @Override
  public boolean isVirtual() {
    return true;
  }

  @Override
  public List<String> tags() {
    return tags;
  }

  /** Seeds a leaf, replacing any entry under the same key. */
  public Leaf<D> addLeaf(String filepath, D data, boolean isExecutable) {
    Leaf<D> leaf = new Leaf<>(key(filepath), isExecutable, data);
    index.put(leaf.mountPath(), leaf);
    return leaf;
  }

  /** Seeds a directory, replacing any entry under the same key. */
  public Directory addDirectory(String filepath) {
    Directory directory = Directory.of(key(filepath));
    index.put(directory.mountPath(), directory);
    return directory;
  }

  private String key(String filepath) {
    return PosixPaths.toKey(prefix.strip(filepath));
  }

  @SuppressWarnings("unchecked")
  private Leaf<D> asLeaf(Entry entry) {
    return (Leaf<D>) entry;
  }

  private String viewer(Entry entry) {
    return entry.isLeaf() ? backend.viewer(asLeaf(entry)) : Backend.DEFAULT_VIEWER;
  }

  private ListenableFuture<String> load(Leaf<D> leaf) {
    try {
      return backend.loadAsString(leaf);
    } catch (RuntimeException e) {
      return immediateFailedFuture(e);
    }
  }

  private static String permissions(boolean isDirectory, boolean isExecutable) {
    return (isDirectory ? "d" : "-") + (isExecutable ? "rwxr-xr-x" : "rw-r--r--");
  }

  private GlobStats globStats(Entry entry, String nameForDisplay) {
    boolean isDirectory = !entry.isLeaf() && entry.isDirectory();
    boolean isExecutable = entry.isExecutable();
    return new GlobStats(
        PosixPaths.basename(entry.mountPath()),
        prefix.prefix(entry.mountPath()),
        nameForDisplay,
        viewer(entry),
        new GlobStats.Stats(
            /* size= */ 0,
            /* mtimeMs= */ 0,
            UID,
            GID,
            isExecutable ? EXECUTABLE_MODE : REGULAR_MODE),
        new GlobStats.Dirent(
            /* isFile= */ !isDirectory,
            isDirectory,
            /* isSymbolicLink= */ false,
            /* isSpecial= */ false,
            isExecutable,
            permissions(isDirectory, isExecutable),
            USERNAME,
            new GlobStats.MountInfo(isLocal(), tags, mountPath())));
  }

  private ListenableFuture<GlobStats> globStats(Entry entry) {
    return transform(
        backend.nameForDisplay(PosixPaths.basename(entry.mountPath()), entry),
        nameForDisplay -> globStats(entry, nameForDisplay),
        directExecutor());
  }

  private ListenableFuture<List<Entry>> findAsync(
      String filepath, boolean directoryOnly, boolean exact) {
    return fanoutService.submit(() -> resolver.find(prefix.strip(filepath), directoryOnly, exact));
  }

  private static <T> List<T> flatten(List<List<T>> lists) {
    ImmutableList.Builder<T> flattened = ImmutableList.builder();
    for (List<T> list : lists) {
      flattened.addAll(list);
    }
    return flattened.build();
  }

  @Override
  public ListenableFuture<List<GlobStats>> ls(ListOptions options, List<String> filepaths) {
    List<ListenableFuture<List<GlobStats>>> perPath = new ArrayList<>(filepaths.size());
    for (String filepath : filepaths) {
      perPath.add(
          transformAsync(
              findAsync(filepath, options.directoryOnly(), /* exact= */ false),
              entries -> {
                List<ListenableFuture<GlobStats>> stats = new ArrayList<>(entries.size());
                for (Entry entry : entries) {
                  stats.add(globStats(entry));
                }
                return allAsList(stats);
              },
              directExecutor()));
    }
    return transform(allAsList(perPath), TrieVFS::flatten, directExecutor());
  }

  private FStat fstat(Entry entry, String data) {
    return new FStat(
        viewer(entry),
        entry.mountPath(),
        prefix.prefix(entry.mountPath()),
        !entry.isLeaf() && entry.isDirectory(),
        entry.isExecutable(),
        /* size= */ 0,
        data);
  }

  @Override
  public ListenableFuture<FStat> fstat(String filepath, boolean withData, boolean enoentOk) {
    List<Entry> matches =
        resolver.find(key(filepath), /* directoryOnly= */ false, /* exact= */ true);
    if (matches.isEmpty()) {
      if (enoentOk) {
        return immediateFuture(null);
      }
      return immediateFailedFuture(new EntryNotFoundException(filepath));
    }
    Entry entry = matches.get(0);
    if (withData && entry.isLeaf()) {
      return transform(load(asLeaf(entry)), data -> fstat(entry, data), directExecutor());
    }
    return immediateFuture(fstat(entry, /* data= */ null));
  }

  @Override
  public ListenableFuture<List<GrepResult>> grep(String filepath, String pattern) {
    return immediateFuture(ImmutableList.of());
  }

  private ListenableFuture<Leaf<D>> matchingLeaf(Leaf<D> leaf, Pattern pattern) {
    ListenableFuture<Leaf<D>> match =
        transform(
            load(leaf),
            content -> pattern.matcher(content).find() ? leaf : null,
            directExecutor());
    return catching(
        match,
        Exception.class,
        e -> {
          log.log(Level.WARNING, "could not load " + prefix.prefix(leaf.mountPath()), e);
          return null;
        },
        directExecutor());
  }

  @Override
  public ListenableFuture<List<GrepResult>> grepdir(List<String> filepaths, String pattern) {
    Pattern compiled;
    try {
      compiled = Pattern.compile(pattern);
    } catch (PatternSyntaxException e) {
      return immediateFailedFuture(e);
    }
    List<ListenableFuture<List<Leaf<D>>>> perPath = new ArrayList<>(filepaths.size());
    for (String filepath : filepaths) {
      perPath.add(
          transformAsync(
              findAsync(filepath, /* directoryOnly= */ false, /* exact= */ false),
              entries -> {
                List<ListenableFuture<Leaf<D>>> leaves = new ArrayList<>();
                for (Entry entry : entries) {
                  if (entry.isLeaf()) {
                    leaves.add(matchingLeaf(asLeaf(entry), compiled));
                  }
                }
                return allAsList(leaves);
              },
              directExecutor()));
    }
    return transform(
        allAsList(perPath),
        leaves ->
            leaves.stream()
                .flatMap(List::stream)
                .filter(Objects::nonNull)
                .map(leaf -> new GrepResult(prefix.prefix(leaf.mountPath()), /* size= */ 0))
                .collect(ImmutableList.toImmutableList()),
        directExecutor());
  }

  /**
   * The key a copy of {@code source} lands under. A destination naming an existing directory
   * receives the source file name; any other destination is the leaf itself and must sit in an
   * existing directory. Only a directory destination accepts more than one source.
   */
  private String copyTarget(String dstFilepath, SourceReference source)
      throws MissingDirectoryException {
    String dst = prefix.strip(dstFilepath);
    String dstKey = PosixPaths.toKey(dst);
    if (resolver.directoryExists(dstKey)) {
      return PosixPaths.join(dstKey, source.fileName());
    }
    if (dst.charAt(dst.length() - 1) == PosixPaths.SEPARATOR) {
      throw new MissingDirectoryException(prefix.prefix(dstKey));
    }
    String parent = PosixPaths.dirname(dstKey);
    if (!resolver.directoryExists(parent)) {
      throw new MissingDirectoryException(prefix.prefix(parent));
    }
    return dstKey;
  }

  @Override
  public ListenableFuture<String> cp(List<String> srcFilepaths, String dstFilepath) {
    ImmutableList.Builder<Leaf<D>> copies = ImmutableList.builder();
    try {
      if (srcFilepaths.size() > 1) {
        String dstKey = key(dstFilepath);
        if (!resolver.directoryExists(dstKey)) {
          throw new MissingDirectoryException(prefix.prefix(dstKey));
        }
      }
      for (String srcFilepath : srcFilepaths) {
        SourceReference source = SourcePath.parse(srcFilepath);
        copies.add(
            new Leaf<>(
                copyTarget(dstFilepath, source),
                /* isExecutable= */ false,
                backend.fromSource(source)));
      }
    } catch (VfsException e) {
      log.log(Level.WARNING, "rejected copy into " + dstFilepath + ": " + e.getMessage());
      return immediateFailedFuture(e);
    }
    for (Leaf<D> leaf : copies.build()) {
      index.put(leaf.mountPath(), leaf);
      log.log(Level.FINE, "copied " + leaf.data() + " to " + prefix.prefix(leaf.mountPath()));
    }
    return immediateFuture("ok");
  }

  @Override
  public ListenableFuture<String> rm(String filepath) {
    String key = key(filepath);
    List<Entry> removed = index.remove(key);
    log.log(Level.FINE, "removed " + removed.size() + " entries at " + prefix.prefix(key));
    return immediateFuture("ok");
  }

  @Override
  public ListenableFuture<Void> fwrite(String filepath, byte[] data) {
    SourceReference source;
    try {
      source = SourcePath.forWrite(filepath);
    } catch (InvalidFilenameException e) {
      return immediateFailedFuture(e);
    }
    checkNotNull(data, "data");
    Leaf<D> leaf = addLeaf(filepath, backend.fromSource(source), /* isExecutable= */ false);
    log.log(
        Level.FINE,
        String.format(
            "recorded %s for %d written bytes at %s",
            source.srcFilepath(), data.length, prefix.prefix(leaf.mountPath())));
    return immediateFuture(null);
  }

  @Override
  public ListenableFuture<Void> mkdir(String filepath) {
    Directory directory = addDirectory(filepath);
    log.log(Level.FINE, "created directory " + prefix.prefix(directory.mountPath()));
    return immediateFuture(null);
  }

  @Override
  public ListenableFuture<Void> rmdir(String filepath) {
    return transform(rm(filepath), result -> null, directExecutor());
  }

  private static String slice(String content, int offset, int length) {
    int start = Math.min(offset, content.length());
    int end = (int) Math.min((long) offset + length, content.length());
    return content.substring(start, end);
  }

  @Override
  public ListenableFuture<String> fslice(String filepath, int offset, int length) {
    checkArgument(offset >= 0, "offset must be non-negative: %s", offset);
    checkArgument(length >= 0, "length must be non-negative: %s", length);
    List<Entry> matches =
        resolver.find(key(filepath), /* directoryOnly= */ false, /* exact= */ true);
    if (matches.isEmpty() || !matches.get(0).isLeaf()) {
      return immediateFuture("");
    }
    return transform(
        load(asLeaf(matches.get(0))),
        content -> slice(content, offset, length),
        directExecutor());
  }
}
