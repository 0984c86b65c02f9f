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
import static com.google.common.base.Preconditions.checkPositionIndex;
import static java.util.Objects.requireNonNull;

import java.util.AbstractList;
import java.util.List;

/**
 * Read-only list of the elements of a backing list at or beyond a fixed
 * offset.
 *
 * <p>The list tracks its backing list. If elements are appended to the
 * backing list, the list grows.
 *
 * @param <E> Element type
 */
public class TailList<E> extends AbstractList<E> {
  private final List<E> list;
  private final int start;

  /** Creates a list of the elements of {@code list} from offset
   * {@code start}. */
  public TailList(List<E> list, int start) {
    this.list = requireNonNull(list, "list");
    this.start = checkPositionIndex(start, list.size(), "start");
  }

  /** Creates a list that will contain the elements that are appended to
   * {@code list} from now on. */
  public TailList(List<E> list) {
    this(list, list.size());
  }

  /** Returns the offset in the backing list of the first element. */
  public int start() {
    return start;
  }

  @Override public int size() {
    return list.size() - start;
  }

  @Override public E get(int index) {
    return list.get(start + checkElementIndex(index, size()));
  }
}

// End TailList.java
