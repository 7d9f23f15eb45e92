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
package net.hydromatic.quanta;

import net.hydromatic.quanta.compile.CompileException;
import org.hamcrest.CustomTypeSafeMatcher;
import org.hamcrest.Matcher;

/** Matchers for use in Quanta tests. */
public abstract class Matchers {
  private Matchers() {}

  /** Matches a throwable whose string contains a given message. */
  public static Matcher<Throwable> throwsA(String message) {
    return new CustomTypeSafeMatcher<Throwable>("throwable: " + message) {
      @Override protected boolean matchesSafely(Throwable item) {
        return item.toString().contains(message);
      }
    };
  }

  /** Matches a throwable of a given class whose message matches. */
  public static <T extends Throwable> Matcher<Throwable> throwsA(
      Class<T> clazz, Matcher<?> messageMatcher) {
    return new CustomTypeSafeMatcher<Throwable>(clazz + " with message "
        + messageMatcher) {
      @Override protected boolean matchesSafely(Throwable item) {
        return clazz.isInstance(item)
            && messageMatcher.matches(item.getMessage());
      }
    };
  }

  /** Matches a compile exception of a given kind whose message contains a
   * given string. */
  public static Matcher<Throwable> throwsKind(CompileException.Kind kind,
      String message) {
    return new CustomTypeSafeMatcher<Throwable>(kind + " error: "
        + message) {
      @Override protected boolean matchesSafely(Throwable item) {
        return item instanceof CompileException
            && ((CompileException) item).kind == kind
            && item.getMessage().contains(message);
      }
    };
  }

  /** Matches a compile exception whose position, as "line.column" or
   * "line.column-line.column", is as given. */
  public static Matcher<Throwable> isAt(String pos) {
    return new CustomTypeSafeMatcher<Throwable>("error at " + pos) {
      @Override protected boolean matchesSafely(Throwable item) {
        if (!(item instanceof CompileException)) {
          return false;
        }
        final String s = ((CompileException) item).pos().toString();
        return s.endsWith(":" + pos) || s.equals(pos);
      }
    };
  }
}

// End Matchers.java
