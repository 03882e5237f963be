package com.flamingo.imagelab.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.imagelab.config.ImageLabConfig;
import com.flamingo.imagelab.exception.PersistenceFailureException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

class ImageFileStorageTest {

  @TempDir Path tempDir;

  private ImageFileStorage storage;
  private UUID ownerId;

  @BeforeEach
  void setUp() {
    ImageLabConfig config = new ImageLabConfig();
    config.getStorage().setBasePath(tempDir.toString());
    storage = new ImageFileStorage(config);
    ownerId = UUID.randomUUID();
  }

  @AfterEach
  void tearDown() {
    if (TransactionSynchronizationManager.isSynchronizationActive()) {
      TransactionSynchronizationManager.clearSynchronization();
    }
  }

  @Test
  void shouldWriteUnderOwnerDirectory_withFreshNames() {
    String first = storage.write(ownerId, new byte[] {1, 2}, "image/png");
    String second = storage.write(ownerId, new byte[] {1, 2}, "image/png");

    assertThat(first).isNotEqualTo(second).endsWith(".png");
    assertThat(Path.of(first).getParent()).isEqualTo(tempDir.resolve(ownerId.toString()));
    assertThat(storage.read(first)).containsExactly(1, 2);
  }

  @Test
  void shouldThrowPersistenceFailure_whenReadingMissingFile() {
    String missing = tempDir.resolve("nope.png").toString();

    assertThatThrownBy(() -> storage.read(missing))
        .isInstanceOf(PersistenceFailureException.class);
  }

  @Test
  void shouldRemoveFile_whenTransactionRollsBack() {
    TransactionSynchronizationManager.initSynchronization();
    String path = storage.write(ownerId, new byte[] {9}, "image/jpeg");

    storage.deleteOnRollback(path);
    TransactionSynchronizationManager.getSynchronizations()
        .forEach(s -> s.afterCompletion(TransactionSynchronization.STATUS_ROLLED_BACK));

    assertThat(Files.exists(Path.of(path))).isFalse();
  }

  @Test
  void shouldKeepFile_whenTransactionCommits() {
    TransactionSynchronizationManager.initSynchronization();
    String path = storage.write(ownerId, new byte[] {9}, "image/png");

    storage.deleteOnRollback(path);
    TransactionSynchronizationManager.getSynchronizations()
        .forEach(s -> s.afterCompletion(TransactionSynchronization.STATUS_COMMITTED));

    assertThat(Files.exists(Path.of(path))).isTrue();
  }

  @Test
  void shouldDeleteImmediately_whenNoTransaction() {
    String path = storage.write(ownerId, new byte[] {9}, "image/png");

    storage.deleteAfterCommit(path);

    assertThat(Files.exists(Path.of(path))).isFalse();
  }
}
