/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.gql.util;

import static com.google.common.base.Preconditions.checkElementIndex;
import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Stack of analysis frames in which any frame, not only the top one, can be
 * read or replaced by its depth.
 *
 * <p>Depth 0 is the bottom. When a nested construct finishes, the analysis
 * pops its frame and folds it into the frame that is then on top.
 *
 * @param <E> Frame type
 */
public class FrameStack<E> {
  private final List<E> frames = new ArrayList<>();

  public FrameStack() {
  }

  /** Creates a stack whose bottom frame is {@code bottom}. */
  public static <E> FrameStack<E> of(E bottom) {
    final FrameStack<E> stack = new FrameStack<>();
    stack.push(bottom);
    return stack;
  }

  /** Pushes a frame, and returns it. */
  public E push(E frame) {
    frames.add(requireNonNull(frame, "frame"));
    return frame;
  }

  /** Pops the top frame. */
  public E pop() {
    return frames.remove(topIndex());
  }

  public E top() {
    return frames.get(topIndex());
  }

  /** Replaces the top frame, and returns the frame it replaced. */
  public E setTop(E frame) {
    return set(topIndex(), frame);
  }

  private int topIndex() {
    if (frames.isEmpty()) {
      throw new NoSuchElementException("stack is empty");
    }
    return frames.size() - 1;
  }

  public int size() {
    return frames.size();
  }

  public boolean isEmpty() {
    return frames.isEmpty();
  }

  /** Returns the frame at depth {@code i}. */
  public E get(int i) {
    return frames.get(checkElementIndex(i, frames.size()));
  }

  /** Replaces the frame at depth {@code i}, and returns the frame it
   * replaced. */
  public E set(int i, E frame) {
    checkElementIndex(i, frames.size());
    return frames.set(i, requireNonNull(frame, "frame"));
  }

  /** Returns a read-only view of the frames, bottom first. */
  public List<E> asList() {
    return Collections.unmodifiableList(frames);
  }

  @Override public String toString() {
    return frames.toString();
  }
}

// End FrameStack.java
