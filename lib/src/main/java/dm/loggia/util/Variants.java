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
 * Utility class implementing the nominal equality shared by levels and sources.
 * <p>
 * Two tags are the same variant when they are the same enum constant or, for any other
 * implementation, when they are instances of the very same class. Any data embedded in the
 * instances is ignored.
 * <p>
 * Created by davide-maestroni on 03/28/2018.
 */
public class Variants {

  /**
   * Avoid explicit instantiation.
   */
  protected Variants() {
    ConstantConditions.avoid();
  }

  /**
   * Checks if the specified iterable contains an instance of the same variant of the specified
   * object.
   *
   * @param iterable the iterable instance.
   * @param object   the object to look for.
   * @return whether the variant is contained.
   */
  public static boolean containsVariant(@NotNull final Iterable<?> iterable,
      @Nullable final Object object) {
    for (final Object element : iterable) {
      if (isSameVariant(element, object)) {
        return true;
      }
    }

    return false;
  }

  /**
   * Checks if the specified objects are instances of the same variant.
   *
   * @param first  the first object.
   * @param second the second object.
   * @return whether the objects are the same variant.
   */
  public static boolean isSameVariant(@Nullable final Object first, @Nullable final Object second) {
    if (first == second) {
      return true;
    }

    if ((first == null) || (second == null) || (first instanceof Enum)
        || (second instanceof Enum)) {
      return false;
    }

    return first.getClass() == second.getClass();
  }

  /**
   * Returns a hash code consistent with {@link #isSameVariant(Object, Object)}.
   *
   * @param object the object.
   * @return the hash code.
   */
  public static int variantHashCode(@Nullable final Object object) {
    if (object == null) {
      return 0;
    }

    if (object instanceof Enum) {
      return System.identityHashCode(object);
    }

    return object.getClass().hashCode();
  }
}
