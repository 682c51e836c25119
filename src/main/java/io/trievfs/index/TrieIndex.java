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

package io.trievfs.index;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;
import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;

/**
 * A character trie mapping string keys to values, with retrieval of every value reachable from a
 * key prefix.
 *
 * <p>The index enforces no uniqueness: {@link #insert} appends to the values already stored under
 * a key, while {@link #put} replaces them. Prefix results are ordered by key, and values under a
 * single key by insertion.
 *
 * <p>Mutations are atomic with respect to readers.
 */
public class TrieIndex<V> {
  private static final class Node<V> {
    final NavigableMap<Character, Node<V>> children = new TreeMap<>();
    final List<V> values = new ArrayList<>(1);

    boolean isEmpty() {
      return children.isEmpty() && values.isEmpty();
    }
  }

  @GuardedBy("this")
  private final Node<V> root = new Node<>();

  @GuardedBy("this")
  private int size = 0;

  /** Adds {@code value} under {@code key}, keeping any values already stored there. */
  public synchronized void insert(String key, V value) {
    checkNotNull(value);
    nodeForInsert(key).values.add(value);
    size++;
  }

  /** Stores {@code value} as the only value under {@code key}. */
  public synchronized void put(String key, V value) {
    checkNotNull(value);
    Node<V> node = nodeForInsert(key);
    size -= node.values.size();
    node.values.clear();
    node.values.add(value);
    size++;
  }

  /**
   * Removes every value stored under exactly {@code key}.
   *
   * @return the removed values, empty if the key was absent
   */
  public synchronized List<V> remove(String key) {
    Deque<Node<V>> path = new ArrayDeque<>(key.length() + 1);
    Node<V> node = root;
    path.push(node);
    for (int i = 0; i < key.length(); i++) {
      node = node.children.get(key.charAt(i));
      if (node == null) {
        return ImmutableList.of();
      }
      path.push(node);
    }
    List<V> removed = ImmutableList.copyOf(node.values);
    node.values.clear();
    size -= removed.size();

    // prune the branch back to the nearest node still in use
    int index = key.length();
    path.pop();
    while (node.isEmpty() && !path.isEmpty()) {
      Node<V> parent = path.pop();
      parent.children.remove(key.charAt(--index));
      node = parent;
    }
    return removed;
  }

  /** All values whose key starts with {@code prefix}, the empty prefix reaching every value. */
  public synchronized List<V> get(String prefix) {
    Node<V> node = find(prefix);
    if (node == null) {
      return ImmutableList.of();
    }
    ImmutableList.Builder<V> values = ImmutableList.builder();
    collect(node, values);
    return values.build();
  }

  /** The values stored under exactly {@code key}. */
  public synchronized List<V> getExact(String key) {
    Node<V> node = find(key);
    return node == null ? ImmutableList.of() : ImmutableList.copyOf(node.values);
  }

  /** True if any value is stored under a key starting with {@code prefix}. */
  public synchronized boolean containsPrefix(String prefix) {
    Node<V> node = find(prefix);
    return node != null && !node.isEmpty();
  }

  public synchronized int size() {
    return size;
  }

  public synchronized boolean isEmpty() {
    return size == 0;
  }

  @GuardedBy("this")
  private Node<V> nodeForInsert(String key) {
    Node<V> node = root;
    for (int i = 0; i < key.length(); i++) {
      node = node.children.computeIfAbsent(key.charAt(i), c -> new Node<>());
    }
    return node;
  }

  @GuardedBy("this")
  private @Nullable Node<V> find(String key) {
    Node<V> node = root;
    for (int i = 0; node != null && i < key.length(); i++) {
      node = node.children.get(key.charAt(i));
    }
    return node;
  }

  // preorder walk in key order; children are pushed in reverse so the smallest is visited first
  private static <V> void collect(Node<V> start, ImmutableList.Builder<V> values) {
    Deque<Node<V>> pending = new ArrayDeque<>();
    pending.push(start);
    while (!pending.isEmpty()) {
      Node<V> node = pending.pop();
      values.addAll(node.values);
      for (Node<V> child : node.children.descendingMap().values()) {
        pending.push(child);
      }
    }
  }
}
