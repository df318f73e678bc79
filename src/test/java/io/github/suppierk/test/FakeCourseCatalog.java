package io.github.suppierk.test;

import io.github.suppierk.enrollment.directory.CourseCapacity;
import io.github.suppierk.enrollment.directory.CourseCatalog;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public final class FakeCourseCatalog implements CourseCatalog {
  private final Set<String> courses = new HashSet<>();
  private final Set<String> offerings = new HashSet<>();
  private final Map<String, CourseCapacity> capacities = new HashMap<>();

  public FakeCourseCatalog offering(
      final String courseId, final String semester, final CourseCapacity capacity) {
    courses.add(courseId);
    offerings.add(courseId + "@" + semester);
    if (capacity != null) {
      capacities.put(courseId + "@" + semester, capacity);
    }
    return this;
  }

  public FakeCourseCatalog course(final String courseId) {
    courses.add(courseId);
    return this;
  }

  @Override
  public boolean exists(final String courseId) {
    return courses.contains(courseId);
  }

  @Override
  public boolean isOfferedInSemester(final String courseId, final String semester) {
    return offerings.contains(courseId + "@" + semester);
  }

  @Override
  public Optional<CourseCapacity> capacity(final String courseId, final String semester) {
    return Optional.ofNullable(capacities.get(courseId + "@" + semester));
  }
}
