package io.intellixity.strata.services.project;

import io.intellixity.strata.error.ConflictException;
import io.intellixity.strata.error.ValidationException;
import io.intellixity.strata.services.ServicesFixture;
import io.intellixity.strata.services.collection.CollectionSpec;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class ProjectServiceTest {
  @TempDir Path dir;

  @Test
  void createStoresRowAndProvisionsDatabase() {
    try (ServicesFixture fx = new ServicesFixture(dir)) {
      Project p = fx.projects.create(
          new ProjectSpec("Shop", "store front", null, List.of("https://shop.test"), Map.of("theme", "dark")), "admin-1");

      assertTrue(p.apiKey().matches("pk_[0-9a-f]{32}"));
      assertTrue(p.active());
      assertEquals("admin-1", p.ownerId());
      assertEquals(List.of("https://shop.test"), p.allowedOrigins());
      assertEquals("dark", p.settings().get("theme"));
      assertTrue(fx.locator.exists(p.id()));
      assertTrue(Files.isDirectory(fx.locator.paths().projectFilesDir(p.id())));
      assertEquals(p, fx.projects.get(p.id()));
    }
  }

  @Test
  void duplicateAndBlankNamesAreRejected() {
    try (ServicesFixture fx = new ServicesFixture(dir)) {
      fx.projects.create(ProjectSpec.named("Shop"), "admin");
      ConflictException dup = assertThrows(ConflictException.class,
          () -> fx.projects.create(ProjectSpec.named("Shop"), "admin"));
      assertEquals(ConflictException.DUPLICATE_PROJECT_NAME, dup.code());
      assertThrows(ValidationException.class, () -> fx.projects.create(ProjectSpec.named("  "), "admin"));
      assertEquals(1, fx.projects.list(true).size());
    }
  }

  @Test
  void deactivationHidesProjectFromActiveViews() {
    try (ServicesFixture fx = new ServicesFixture(dir)) {
      Project p = fx.projects.create(ProjectSpec.named("Shop"), "admin");
      assertEquals(p.id(), fx.projects.getByApiKey(p.apiKey()).id());

      Project off = fx.projects.update(p.id(), ProjectUpdate.active(false));
      assertFalse(off.active());
      assertNull(fx.projects.getByApiKey(p.apiKey()));
      assertTrue(fx.projects.list(false).isEmpty());
      assertEquals(1, fx.projects.list(true).size());
    }
  }

  @Test
  void updateRenamesAndGuardsAgainstClashes() {
    try (ServicesFixture fx = new ServicesFixture(dir)) {
      Project a = fx.projects.create(ProjectSpec.named("A"), "admin");
      fx.projects.create(ProjectSpec.named("B"), "admin");

      assertEquals("A2", fx.projects.update(a.id(), ProjectUpdate.rename("A2")).name());
      assertThrows(ConflictException.class, () -> fx.projects.update(a.id(), ProjectUpdate.rename("B")));
      assertNull(fx.projects.update("missing", ProjectUpdate.rename("C")));
    }
  }

  @Test
  void keysAndCountersAreMaintained() {
    try (ServicesFixture fx = new ServicesFixture(dir)) {
      Project p = fx.projects.create(ProjectSpec.named("Shop"), "admin");

      String key = fx.projects.regenerateApiKey(p.id());
      assertNotEquals(p.apiKey(), key);
      assertNull(fx.projects.getByApiKey(p.apiKey()));
      assertEquals(p.id(), fx.projects.getByApiKey(key).id());
      assertNull(fx.projects.regenerateApiKey("missing"));

      fx.projects.recordApiCall(p.id());
      fx.projects.recordApiCall(p.id());
      fx.projects.updateStorageUsed(p.id(), 2048);
      Project after = fx.projects.get(p.id());
      assertEquals(2, after.apiCallsCount());
      assertNotNull(after.lastApiCall());
      assertEquals(2048, after.storageUsed());
      assertThrows(ValidationException.class, () -> fx.projects.updateStorageUsed(p.id(), -1));
    }
  }

  @Test
  void deleteRemovesDatabaseAndRow() {
    try (ServicesFixture fx = new ServicesFixture(dir)) {
      Project p = fx.projects.create(ProjectSpec.named("Shop"), "admin");
      fx.collections.create(p.id(), "items", CollectionSpec.of(List.of()), "admin");

      assertTrue(fx.projects.delete(p.id()));
      assertFalse(fx.locator.exists(p.id()));
      assertFalse(fx.pool.isOpen(fx.locator.pathFor(p.id())));
      assertNull(fx.projects.get(p.id()));
      assertFalse(fx.projects.delete(p.id()));
    }
  }
}
