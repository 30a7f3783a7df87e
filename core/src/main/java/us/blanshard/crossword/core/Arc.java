/*
Copyright 2013 Luke Blanshard

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

     http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/
package us.blanshard.crossword.core;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Objects;

import javax.annotation.concurrent.Immutable;

/**
 * An ordered pair of slots whose consistency is to be checked: every word of
 * {@link #from} must be supported by some word of {@link #to}.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Arc {
  public final Slot from;
  public final Slot to;

  public static Arc of(Slot from, Slot to) {
    return new Arc(from, to);
  }

  private Arc(Slot from, Slot to) {
    this.from = checkNotNull(from);
    this.to = checkNotNull(to);
  }

  @Override public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Arc)) return false;
    Arc that = (Arc) o;
    return this.from.equals(that.from) && this.to.equals(that.to);
  }

  @Override public int hashCode() {
    return Objects.hash(from, to);
  }

  @Override public String toString() {
    return from + " \u2192 " + to;  // That's a right arrow
  }
}
