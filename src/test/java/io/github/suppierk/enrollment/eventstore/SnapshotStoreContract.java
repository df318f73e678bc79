package io.github.suppierk.enrollment.eventstore;

import static io.github.suppierk.test.Fixtures.ID;
import static io.github.suppierk.test.Fixtures.NOW;
import static io.github.suppierk.test.Fixtures.STREAM;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.enrollment.domain.Enrollment;
import org.junit.jupiter.api.Test;

abstract class SnapshotStoreContract {
  protected abstract SnapshotStore store();

  private static Snapshot approvedAt(final long version) {
    return new Snapshot(
        STREAM, version, new Enrollment.Approved(ID, version, NOW, NOW, "registrar"), NOW);
  }

  @Test
  void when_nothing_is_saved_then_no_latest() {
    assertTrue(store().latest(STREAM).isEmpty());
    assertEquals(0L, store().count());
  }

  @Test
  void when_several_are_saved_then_highest_version_is_latest() {
    store().save(approvedAt(20));
    store().save(approvedAt(40));
    store().save(approvedAt(10));

    assertEquals(approvedAt(40), store().latest(STREAM).orElseThrow());
    assertEquals(3L, store().count());
  }

  @Test
  void when_same_version_is_saved_twice_then_first_is_kept() {
    store().save(approvedAt(10));
    store()
        .save(
            new Snapshot(
                STREAM, 10, new Enrollment.Approved(ID, 10, NOW, NOW, "someone else"), NOW));

    final var latest = (Enrollment.Approved) store().latest(STREAM).orElseThrow().state();
    assertEquals("registrar", latest.approvedBy());
    assertEquals(1L, store().count());
  }

  @Test
  void when_snapshot_is_null_then_throws() {
    assertThrows(IllegalArgumentException.class, () -> store().save(null));
  }

  @Test
  void when_versions_disagree_then_snapshot_cannot_be_built() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new Snapshot(STREAM, 3, new Enrollment.Requested(ID, 1, NOW), NOW));
  }
}
