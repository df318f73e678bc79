/*
 * Copyright 2024 Roman Khlebnov
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

package io.github.suppierk.enrollment.directory;

/**
 * Seats of a course in one semester.
 *
 * @param max seats offered
 * @param current seats already taken
 */
public record CourseCapacity(int max, int current) {
  public CourseCapacity {
    if (max < 0 || current < 0) {
      throw new IllegalArgumentException("Capacity values cannot be negative");
    }
  }

  public boolean isFull() {
    return current >= max;
  }
}
