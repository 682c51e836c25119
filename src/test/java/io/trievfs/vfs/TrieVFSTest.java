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

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.util.concurrent.Futures.immediateFuture;
import static com.google.common.util.concurrent.MoreExecutors.listeningDecorator;
import static com.google.common.util.concurrent.MoreExecutors.newDirectExecutorService;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ListeningExecutorService;
import io.trievfs.common.config.Mount;
import io.trievfs.content.ContentNotFoundException;
import io.trievfs.content.MemoryContentStore;
import io.trievfs.content.NotebookBackend;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class TrieVFSTest {
  private static final String README = "plugin://client/notebooks/readme.md";
  private static final String README_CONTENT = "# Read Me\nhello world\n";
  private static final String OTHER = "plugin://client/notebooks/other.md";

  private MemoryContentStore store;
  private TrieVFS<SourceReference> vfs;

  @Before
  public void setUp() {
    store = new MemoryContentStore();
    store.put(README, README_CONTENT);
    store.put(OTHER, "goodbye\n");
    vfs = new TrieVFS<>("/kui", new NotebookBackend(store));
  }

  private static Throwable failure(Future<?> future) {
    ExecutionException e = assertThrows(ExecutionException.class, future::get);
    return e.getCause();
  }

  private static List<String> names(List<GlobStats> stats) {
    return stats.stream().map(GlobStats::name).collect(Collectors.toList());
  }

  private List<GlobStats> ls(String... filepaths) throws Exception {
    return vfs.ls(ListOptions.DEFAULT, ImmutableList.copyOf(filepaths)).get();
  }

  @Test
  public void copiedNotebookIsListedAndReadable() throws Exception {
    vfs.mkdir("/kui/docs").get();

    assertThat(vfs.cp(ImmutableList.of(README), "/kui/docs/out.md").get()).isEqualTo("ok");

    List<GlobStats> listing = ls("/kui/docs/");
    assertThat(names(listing)).containsExactly("out.md");
    GlobStats stats = listing.get(0);
    assertThat(stats.path()).isEqualTo("/kui/docs/out.md");
    assertThat(stats.nameForDisplay()).isEqualTo("Read Me");
    assertThat(stats.viewer()).isEqualTo(NotebookBackend.NOTEBOOK_VIEWER);
    assertThat(stats.dirent().isFile()).isTrue();
    assertThat(stats.dirent().permissions()).isEqualTo("-rw-r--r--");
    assertThat(stats.stats().mode()).isEqualTo(TrieVFS.REGULAR_MODE);
    assertThat(stats.stats().uid()).isEqualTo(TrieVFS.UID);

    FStat fstat = vfs.fstat("/kui/docs/out.md", /* withData= */ true, /* enoentOk= */ false).get();
    assertThat(fstat.data()).isEqualTo(README_CONTENT);
    assertThat(fstat.filepath()).isEqualTo("/docs/out.md");
    assertThat(fstat.fullpath()).isEqualTo("/kui/docs/out.md");
    assertThat(fstat.isDirectory()).isFalse();
  }

  @Test
  public void copyIntoDirectoryKeepsSourceName() throws Exception {
    vfs.mkdir("/kui/docs").get();

    vfs.cp(ImmutableList.of(README, OTHER), "/kui/docs").get();

    assertThat(names(ls("/kui/docs"))).containsExactly("other.md", "readme.md").inOrder();
  }

  @Test
  public void copyIntoImplicitDirectory() throws Exception {
    vfs.addLeaf("/kui/implicit/x.md", SourcePath.parse(OTHER), /* isExecutable= */ false);

    vfs.cp(ImmutableList.of(README), "/kui/implicit/").get();

    assertThat(names(ls("/kui/implicit"))).containsExactly("readme.md", "x.md");
  }

  @Test
  public void copyToMountRoot() throws Exception {
    vfs.cp(ImmutableList.of(README), "/kui/top.md").get();

    assertThat(vfs.fstat("/kui/top.md", false, false).get().fullpath()).isEqualTo("/kui/top.md");
  }

  @Test
  public void copyOfInvalidSourceFails() throws Exception {
    vfs.mkdir("/kui/docs").get();

    Throwable cause = failure(vfs.cp(ImmutableList.of("/etc/hosts"), "/kui/docs"));

    assertThat(cause).isInstanceOf(InvalidSourceException.class);
    assertThat(((VfsException) cause).getCode()).isEqualTo(VfsException.BAD_REQUEST);
    assertThat(ls("/kui/docs")).isEmpty();
  }

  @Test
  public void copyIntoMissingDirectoryFails() {
    Throwable cause = failure(vfs.cp(ImmutableList.of(README), "/kui/missing/out.md"));

    assertThat(cause).isInstanceOf(MissingDirectoryException.class);
    assertThat(((MissingDirectoryException) cause).getDirectory()).isEqualTo("/kui/missing");
    assertThat(((VfsException) cause).getCode()).isEqualTo(VfsException.NOT_FOUND);
  }

  @Test
  public void copyIntoMissingDirectoryWithTrailingSeparatorFails() {
    Throwable cause = failure(vfs.cp(ImmutableList.of(README), "/kui/missing/"));

    assertThat(cause).isInstanceOf(MissingDirectoryException.class);
    assertThat(((MissingDirectoryException) cause).getDirectory()).isEqualTo("/kui/missing");
  }

  @Test
  public void copyIsAllOrNothing() throws Exception {
    vfs.mkdir("/kui/docs").get();

    Throwable cause = failure(vfs.cp(ImmutableList.of(README, "bogus"), "/kui/docs"));

    assertThat(cause).isInstanceOf(InvalidSourceException.class);
    assertThat(ls("/kui/docs")).isEmpty();
  }

  @Test
  public void copyReplacesExistingLeaf() throws Exception {
    vfs.cp(ImmutableList.of(README), "/kui/same.md").get();
    vfs.cp(ImmutableList.of(OTHER), "/kui/same.md").get();

    assertThat(ls("/kui/same.md")).hasSize(1);
    assertThat(vfs.fstat("/kui/same.md", true, false).get().data()).isEqualTo("goodbye\n");
  }

  @Test
  public void fwriteRecordsClientNotebook() throws Exception {
    store.put("plugin://client/notebooks/out.md", "# Out\n");

    vfs.fwrite("/kui/docs/out.md", "ignored".getBytes(UTF_8)).get();

    FStat fstat = vfs.fstat("/kui/docs/out.md", true, false).get();
    assertThat(fstat.data()).isEqualTo("# Out\n");
  }

  @Test
  public void fwriteWithoutExtensionFails() {
    Throwable cause = failure(vfs.fwrite("/kui/docs/README", new byte[0]));

    assertThat(cause).isInstanceOf(InvalidFilenameException.class);
  }

  @Test
  public void rmIsIdempotent() throws Exception {
    vfs.cp(ImmutableList.of(README), "/kui/a.md").get();

    assertThat(vfs.rm("/kui/a.md").get()).isEqualTo("ok");
    assertThat(vfs.rm("/kui/a.md").get()).isEqualTo("ok");
    assertThat(vfs.fstat("/kui/a.md", false, /* enoentOk= */ true).get()).isNull();
  }

  @Test
  public void fstatOfMissingEntryFails() {
    Throwable cause = failure(vfs.fstat("/kui/nope.md", false, /* enoentOk= */ false));

    assertThat(cause).isInstanceOf(EntryNotFoundException.class);
    assertThat(((EntryNotFoundException) cause).getPath()).isEqualTo("/kui/nope.md");
    assertThat(((VfsException) cause).getCode()).isEqualTo(VfsException.NOT_FOUND);
  }

  @Test
  public void fstatOfDirectoryHasNoData() throws Exception {
    vfs.mkdir("/kui/docs").get();

    FStat fstat = vfs.fstat("/kui/docs", /* withData= */ true, false).get();

    assertThat(fstat.isDirectory()).isTrue();
    assertThat(fstat.data()).isNull();
    assertThat(fstat.viewer()).isEqualTo(Backend.DEFAULT_VIEWER);
  }

  @Test
  public void fstatDoesNotExpandGlobs() throws Exception {
    vfs.mkdir("/kui/a").get();
    vfs.cp(ImmutableList.of(README), "/kui/a").get();

    assertThat(vfs.fstat("/kui/a/*", false, /* enoentOk= */ true).get()).isNull();
  }

  @Test
  public void lsDirectoryOnlyListsDirectoryItself() throws Exception {
    vfs.mkdir("/kui/docs").get();
    vfs.cp(ImmutableList.of(README), "/kui/docs").get();

    List<GlobStats> listing =
        vfs.ls(ListOptions.DIRECTORY_ONLY, ImmutableList.of("/kui/docs")).get();

    assertThat(names(listing)).containsExactly("docs");
    GlobStats stats = listing.get(0);
    assertThat(stats.path()).isEqualTo("/kui/docs");
    assertThat(stats.dirent().isDirectory()).isTrue();
    assertThat(stats.dirent().isFile()).isFalse();
    assertThat(stats.dirent().permissions()).isEqualTo("drw-r--r--");
    assertThat(stats.viewer()).isEqualTo(Backend.DEFAULT_VIEWER);
  }

  @Test
  public void lsExpandsGlobs() throws Exception {
    vfs.mkdir("/kui/a").get();
    vfs.cp(ImmutableList.of(README, OTHER), "/kui/a").get();

    assertThat(names(ls("/kui/a/*"))).containsExactly("other.md", "readme.md");
    assertThat(names(ls("/kui/a/r*.md"))).containsExactly("readme.md");
  }

  @Test
  public void lsExpandsSingleCharacterAndClassGlobs() throws Exception {
    vfs.mkdir("/kui/a").get();
    vfs.cp(ImmutableList.of(README, OTHER), "/kui/a").get();

    assertThat(names(ls("/kui/a/?eadme.md"))).containsExactly("readme.md");
    assertThat(names(ls("/kui/a/[ro]*.md"))).containsExactly("other.md", "readme.md");
    assertThat(names(ls("/kui/a/[!r]*.md"))).containsExactly("other.md");
  }

  @Test
  public void lsFlattensPathsInOrder() throws Exception {
    vfs.mkdir("/kui/a").get();
    vfs.mkdir("/kui/b").get();
    vfs.cp(ImmutableList.of(README), "/kui/b").get();
    vfs.cp(ImmutableList.of(OTHER), "/kui/a").get();

    assertThat(names(ls("/kui/b", "/kui/a"))).containsExactly("readme.md", "other.md").inOrder();
  }

  @Test
  public void lsOfMissingPathIsEmpty() throws Exception {
    assertThat(ls("/kui/missing")).isEmpty();
  }

  @Test
  public void lsCarriesMountInfo() throws Exception {
    Mount mount = new Mount();
    mount.setTags(ImmutableList.of("notebooks"));
    TrieVFS<SourceReference> tagged =
        new TrieVFS<>(mount, new NotebookBackend(store), newDirectExecutorService());
    tagged.cp(ImmutableList.of(README), "/kui").get();

    GlobStats stats = tagged.ls(ListOptions.DEFAULT, ImmutableList.of("/kui")).get().get(0);

    assertThat(stats.dirent().mount().mountPath()).isEqualTo("/kui");
    assertThat(stats.dirent().mount().isLocal()).isFalse();
    assertThat(stats.dirent().mount().tags()).containsExactly("notebooks");
    assertThat(tagged.tags()).containsExactly("notebooks");
  }

  @Test
  public void executableLeafStats() throws Exception {
    vfs.addLeaf(
        "/kui/run.py",
        SourcePath.parse("plugin://client/notebooks/run.py"),
        /* isExecutable= */ true);

    GlobStats stats = ls("/kui/run.py").get(0);

    assertThat(stats.stats().mode()).isEqualTo(TrieVFS.EXECUTABLE_MODE);
    assertThat(stats.dirent().permissions()).isEqualTo("-rwxr-xr-x");
    assertThat(stats.dirent().isExecutable()).isTrue();
    assertThat(stats.viewer()).isEqualTo(Backend.DEFAULT_VIEWER);
    assertThat(stats.nameForDisplay()).isEqualTo("run.py");
  }

  @Test
  public void grepdirReturnsMatchingLeaves() throws Exception {
    vfs.mkdir("/kui/docs").get();
    vfs.cp(ImmutableList.of(README, OTHER), "/kui/docs").get();

    List<GrepResult> results = vfs.grepdir(ImmutableList.of("/kui/docs"), "hel+o").get();

    assertThat(results).containsExactly(new GrepResult("/kui/docs/readme.md", 0));
  }

  @Test
  public void grepdirSkipsUnloadableLeaves() throws Exception {
    vfs.mkdir("/kui/docs").get();
    vfs.cp(ImmutableList.of(README, "plugin://client/notebooks/missing.md"), "/kui/docs").get();

    List<GrepResult> results = vfs.grepdir(ImmutableList.of("/kui/docs"), "o").get();

    assertThat(results).containsExactly(new GrepResult("/kui/docs/readme.md", 0));
  }

  @Test
  public void grepdirWithInvalidPatternFails() {
    Throwable cause = failure(vfs.grepdir(ImmutableList.of("/kui"), "("));

    assertThat(cause).isInstanceOf(PatternSyntaxException.class);
  }

  @Test
  public void grepIsEmpty() throws Exception {
    vfs.cp(ImmutableList.of(README), "/kui/a.md").get();

    assertThat(vfs.grep("/kui/a.md", "hello").get()).isEmpty();
  }

  @Test
  public void fsliceReturnsSubstring() throws Exception {
    vfs.cp(ImmutableList.of(README), "/kui/a.md").get();

    assertThat(vfs.fslice("/kui/a.md", 2, 4).get()).isEqualTo("Read");
    assertThat(vfs.fslice("/kui/a.md", 0, 1000).get()).isEqualTo(README_CONTENT);
    assertThat(vfs.fslice("/kui/a.md", 1000, 4).get()).isEmpty();
  }

  @Test
  public void fsliceOfDirectoryOrMissingIsEmpty() throws Exception {
    vfs.mkdir("/kui/docs").get();

    assertThat(vfs.fslice("/kui/docs", 0, 10).get()).isEmpty();
    assertThat(vfs.fslice("/kui/missing.md", 0, 10).get()).isEmpty();
  }

  @Test
  public void fsliceRejectsNegativeArguments() {
    assertThrows(IllegalArgumentException.class, () -> vfs.fslice("/kui/a.md", -1, 4));
    assertThrows(IllegalArgumentException.class, () -> vfs.fslice("/kui/a.md", 0, -4));
  }

  @Test
  public void rmdirDoesNotRemoveChildren() throws Exception {
    vfs.mkdir("/kui/docs").get();
    vfs.cp(ImmutableList.of(README), "/kui/docs").get();

    vfs.rmdir("/kui/docs").get();

    assertThat(vfs.fstat("/kui/docs", false, true).get()).isNull();
    assertThat(vfs.fstat("/kui/docs/readme.md", false, true).get()).isNotNull();
  }

  @Test
  public void mutationsIgnoreTrailingSeparator() throws Exception {
    vfs.mkdir("/kui/docs/").get();

    assertThat(vfs.fstat("/kui/docs", false, false).get().isDirectory()).isTrue();

    vfs.rm("/kui/docs/").get();

    assertThat(vfs.fstat("/kui/docs", false, true).get()).isNull();
  }

  @Test
  public void readsUseSameKeyAsMutations() throws Exception {
    vfs.mkdir("/kui/d/").get();
    vfs.cp(ImmutableList.of(README), "/kui/d/out.md").get();

    assertThat(vfs.fstat("/kui/d/", false, /* enoentOk= */ false).get().isDirectory()).isTrue();
    assertThat(vfs.fslice("/kui/d/out.md/", 2, 4).get()).isEqualTo("Read");
  }

  @Test
  public void fwriteRejectsNullDataBeforeWriting() throws Exception {
    assertThrows(NullPointerException.class, () -> vfs.fwrite("/kui/a.md", null));

    assertThat(vfs.fstat("/kui/a.md", false, /* enoentOk= */ true).get()).isNull();
  }

  @Test
  public void copyOfSeveralSourcesRequiresDirectory() throws Exception {
    Throwable cause = failure(vfs.cp(ImmutableList.of(README, OTHER), "/kui/out.md"));

    assertThat(cause).isInstanceOf(MissingDirectoryException.class);
    assertThat(((MissingDirectoryException) cause).getDirectory()).isEqualTo("/kui/out.md");
    assertThat(vfs.fstat("/kui/out.md", false, /* enoentOk= */ true).get()).isNull();
  }

  @Test
  public void missingContentFailsFstatWithData() throws Exception {
    vfs.cp(ImmutableList.of("plugin://client/notebooks/missing.md"), "/kui/m.md").get();

    Throwable cause = failure(vfs.fstat("/kui/m.md", /* withData= */ true, false));

    assertThat(cause).isInstanceOf(ContentNotFoundException.class);
    assertThat(names(ls("/kui/m.md"))).containsExactly("m.md");
    assertThat(ls("/kui/m.md").get(0).nameForDisplay()).isEqualTo("m.md");
  }

  @Test
  @SuppressWarnings("unchecked")
  public void copyDoesNotLoadContent() throws Exception {
    Backend<String> backend = mock(Backend.class);
    when(backend.fromSource(any(SourceReference.class))).thenReturn("ref");
    TrieVFS<String> mocked = new TrieVFS<>("/kui", backend);

    mocked.cp(ImmutableList.of(README), "/kui/a.md").get();

    verify(backend, times(1)).fromSource(any(SourceReference.class));
    verify(backend, never()).loadAsString(any());

    when(backend.loadAsString(any())).thenReturn(immediateFuture("content"));
    assertThat(mocked.fstat("/kui/a.md", /* withData= */ true, false).get().data())
        .isEqualTo("content");
  }

  @Test
  @SuppressWarnings("unchecked")
  public void backendExceptionBecomesFailedFuture() {
    Backend<String> backend = mock(Backend.class);
    when(backend.loadAsString(any())).thenThrow(new IllegalStateException("broken"));
    TrieVFS<String> mocked = new TrieVFS<>("/kui", backend);
    mocked.addLeaf("/kui/a.md", "ref", /* isExecutable= */ false);

    Throwable cause = failure(mocked.fstat("/kui/a.md", /* withData= */ true, false));

    assertThat(cause).isInstanceOf(IllegalStateException.class);
  }

  @Test
  public void fanoutOnThreadPool() throws Exception {
    ListeningExecutorService pool = listeningDecorator(Executors.newFixedThreadPool(4));
    try {
      TrieVFS<SourceReference> pooled =
          new TrieVFS<>(new Mount(), new NotebookBackend(store), pool);
      ImmutableList.Builder<String> dirs = ImmutableList.builder();
      for (int i = 0; i < 16; i++) {
        String dir = "/kui/d" + i;
        pooled.mkdir(dir).get();
        pooled.cp(ImmutableList.of(README), dir).get();
        dirs.add(dir);
      }

      List<GlobStats> listing = pooled.ls(ListOptions.DEFAULT, dirs.build()).get();

      assertThat(listing).hasSize(16);
      assertThat(listing.get(15).path()).isEqualTo("/kui/d15/readme.md");
      assertThat(pooled.grepdir(dirs.build(), "world").get()).hasSize(16);
    } finally {
      pool.shutdownNow();
    }
  }
}
