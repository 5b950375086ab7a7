/*
 * Copyright 2018 Davide Maestroni
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dm.loggia.util;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Utility class for verifying constant conditions.
 * <p>
 * Created by davide-maestroni on 03/27/2016.
 */
@SuppressWarnings("WeakerAccess")
public class ConstantConditions {

  /**
   * Avoid explicit instantiation.
   */
  protected ConstantConditions() {
    avoid();
  }

  /**
   * Asserts that the calling method is never invoked.
   *
   * @throws java.lang.AssertionError always.
   */
  public static void avoid() {
    throw new AssertionError("method should not be invoked");
  }

  /**
   * Asserts that the specified object is not null.
   *
   * @param name   the name of the parameter used to build the error message.
   * @param object the object.
   * @param <TYPE> the object type.
   * @return the object.
   * @throws java.lang.NullPointerException if the object is null.
   */
  @NotNull
  public static <TYPE> TYPE notNull(final String name, @Nullable final TYPE object) {
    if (object == null) {
      throw new NullPointerException("the " + name + " must not be null");
    }

    return object;
  }

  /**
   * Asserts that the specified iterable and all its elements are not null.
   *
   * @param name     the name of the parameter used to build the error message.
   * @param iterable the iterable.
   * @param <TYPE>   the iterable type.
   * @return the iterable.
   * @throws java.lang.NullPointerException if the iterable or one of its elements is null.
   */
  @NotNull
  public static <TYPE extends Iterable<?>> TYPE notNullElements(final String name,
      @Nullable final TYPE iterable) {
    for (final Object element : notNull(name, iterable)) {
      if (element == null) {
        throw new NullPointerException("the " + name + " must not contain null elements");
      }
    }

    return iterable;
  }
}
