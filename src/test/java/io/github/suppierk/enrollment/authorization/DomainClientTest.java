package io.github.suppierk.enrollment.authorization;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.test.AnotherDomainClient;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DomainClientTest {
  @Nested
  class Anonymous {
    @Test
    void when_instance_is_requested_then_the_same_one_is_returned() {
      final DomainClient first = AnonymousDomainClient.getInstance();
      final DomainClient second = AnonymousDomainClient.getInstance();

      assertSame(first, second);
      assertTrue(first.isAnonymous());
      assertEquals("ANONYMOUS", first.domainRole());
    }

    @Test
    void when_deserialized_then_singleton_is_preserved() throws Exception {
      final DomainClient client = AnonymousDomainClient.getInstance();
      final var bytes = new ByteArrayOutputStream();
      try (var out = new ObjectOutputStream(bytes)) {
        out.writeObject(client);
      }

      try (var in = new ObjectInputStream(new ByteArrayInputStream(bytes.toByteArray()))) {
        assertSame(client, in.readObject());
      }
    }
  }

  @Nested
  class Staff {
    @Test
    void when_principal_is_given_then_staff_role_is_reported() {
      final var staff = new StaffDomainClient("registrar");

      assertEquals("STAFF", staff.domainRole());
      assertFalse(staff.isAnonymous());
    }

    @Test
    void when_principal_is_blank_then_throws() {
      assertThrows(IllegalArgumentException.class, () -> new StaffDomainClient(" "));
      assertThrows(IllegalArgumentException.class, () -> new StaffDomainClient(null));
    }
  }

  @Test
  void when_client_has_own_role_then_it_is_not_anonymous() {
    assertFalse(AnotherDomainClient.getInstance().isAnonymous());
  }
}
