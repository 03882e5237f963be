package com.flamingo.imagelab.service.image;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.imagelab.config.ImageLabConfig;
import com.flamingo.imagelab.domain.entity.Image;
import com.flamingo.imagelab.domain.repository.ImageRepository;
import com.flamingo.imagelab.exception.ImageAccessDeniedException;
import com.flamingo.imagelab.exception.ImageNotFoundException;
import com.flamingo.imagelab.exception.InvalidParameterException;
import com.flamingo.imagelab.exception.UnsupportedImageException;
import com.flamingo.imagelab.processing.PixelBuffer;
import com.flamingo.imagelab.processing.PixelBufferCodec;
import com.flamingo.imagelab.storage.ImageFileStorage;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.mock.web.MockMultipartFile;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ImageServiceImplTest {

  @Mock private ImageRepository imageRepository;
  @Mock private ImageFileStorage imageFileStorage;

  private final PixelBufferCodec codec = new PixelBufferCodec();
  private ImageLabConfig config;
  private SimpleMeterRegistry meterRegistry;
  private ImageServiceImpl imageService;
  private UUID ownerId;

  @BeforeEach
  void setUp() {
    config = new ImageLabConfig();
    meterRegistry = new SimpleMeterRegistry();
    imageService =
        new ImageServiceImpl(imageRepository, imageFileStorage, codec, config, meterRegistry);
    ownerId = UUID.randomUUID();

    when(imageRepository.save(any(Image.class)))
        .thenAnswer(
            invocation -> {
              Image image = invocation.getArgument(0);
              image.setId(UUID.randomUUID());
              return image;
            });
    when(imageFileStorage.write(any(), any(), any())).thenReturn("/data/images/stored.png");
  }

  @Test
  void shouldStoreRootImage_whenValidPng() {
    // Given
    byte[] png = codec.encode(PixelBuffer.blank(7, 3, PixelBuffer.RGB), "png");
    MockMultipartFile file = new MockMultipartFile("file", "cat.png", "image/png", png);

    // When
    Image result = imageService.uploadImage(ownerId, file);

    // Then
    assertThat(result.isRoot()).isTrue();
    assertThat(result.getOwnerId()).isEqualTo(ownerId);
    assertThat(result.getWidth()).isEqualTo(7);
    assertThat(result.getHeight()).isEqualTo(3);
    assertThat(result.getOriginalFilename()).isEqualTo("cat.png");
    assertThat(result.getFileSize()).isEqualTo((long) png.length);
    verify(imageFileStorage).write(eq(ownerId), any(), eq("image/png"));
    verify(imageFileStorage).deleteOnRollback("/data/images/stored.png");
    assertThat(meterRegistry.counter("image.uploaded", "type", "image/png").count())
        .isEqualTo(1.0);
  }

  @Test
  void shouldRejectUpload_whenTypeNotSupported() {
    MockMultipartFile file =
        new MockMultipartFile("file", "notes.txt", "text/plain", "hello".getBytes());

    assertThatThrownBy(() -> imageService.uploadImage(ownerId, file))
        .isInstanceOf(UnsupportedImageException.class);
    verify(imageFileStorage, never()).write(any(), any(), any());
  }

  @Test
  void shouldRejectUpload_whenBytesDoNotDecode() {
    MockMultipartFile file =
        new MockMultipartFile("file", "broken.png", "image/png", "garbage".getBytes());

    assertThatThrownBy(() -> imageService.uploadImage(ownerId, file))
        .isInstanceOf(UnsupportedImageException.class);
    verify(imageRepository, never()).save(any());
  }

  @Test
  void shouldRejectUpload_whenFileTooLarge() {
    config.getStorage().setMaxFileSizeBytes(4);
    MockMultipartFile file =
        new MockMultipartFile("file", "big.png", "image/png", new byte[] {1, 2, 3, 4, 5});

    assertThatThrownBy(() -> imageService.uploadImage(ownerId, file))
        .isInstanceOf(InvalidParameterException.class);
  }

  @Test
  void shouldRejectUpload_whenFileEmpty() {
    MockMultipartFile file = new MockMultipartFile("file", "empty.png", "image/png", new byte[0]);

    assertThatThrownBy(() -> imageService.uploadImage(ownerId, file))
        .isInstanceOf(InvalidParameterException.class);
  }

  @Test
  void shouldThrowAccessDenied_whenImageBelongsToAnotherOwner() {
    Image foreign = Image.builder().id(UUID.randomUUID()).ownerId(UUID.randomUUID()).build();
    when(imageRepository.findById(foreign.getId())).thenReturn(Optional.of(foreign));

    assertThatThrownBy(() -> imageService.getImage(ownerId, foreign.getId()))
        .isInstanceOf(ImageAccessDeniedException.class);
  }

  @Test
  void shouldThrowNotFound_whenImageMissing() {
    UUID missing = UUID.randomUUID();
    when(imageRepository.findById(missing)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> imageService.getImage(ownerId, missing))
        .isInstanceOf(ImageNotFoundException.class);
  }

  @Test
  void shouldClampLimitAndSortNewestFirst_byDefault() {
    // Given
    when(imageRepository.findByOwnerId(eq(ownerId), any(Pageable.class)))
        .thenAnswer(invocation -> new PageImpl<Image>(List.of(), invocation.getArgument(1), 0));

    // When
    ImagePage page = imageService.listImages(ownerId, 1000, 5, null);

    // Then
    ArgumentCaptor<Pageable> pageable = ArgumentCaptor.forClass(Pageable.class);
    verify(imageRepository).findByOwnerId(eq(ownerId), pageable.capture());
    assertThat(pageable.getValue().getPageSize()).isEqualTo(ImageServiceImpl.MAX_PAGE_SIZE);
    assertThat(pageable.getValue().getOffset()).isEqualTo(5);
    assertThat(pageable.getValue().getSort().getOrderFor("createdAt").getDirection())
        .isEqualTo(Sort.Direction.DESC);
    assertThat(page.limit()).isEqualTo(100);
  }

  @Test
  void shouldSortOldestFirst_whenAscendingRequested() {
    Page<Image> empty = Page.empty();
    when(imageRepository.findByOwnerId(eq(ownerId), any(Pageable.class))).thenReturn(empty);

    imageService.listImages(ownerId, 10, 0, "created_at_asc");

    ArgumentCaptor<Pageable> pageable = ArgumentCaptor.forClass(Pageable.class);
    verify(imageRepository).findByOwnerId(eq(ownerId), pageable.capture());
    assertThat(pageable.getValue().getSort().getOrderFor("createdAt").getDirection())
        .isEqualTo(Sort.Direction.ASC);
  }

  @Test
  void shouldRejectUnknownSort() {
    assertThatThrownBy(() -> imageService.listImages(ownerId, 10, 0, "width"))
        .isInstanceOf(InvalidParameterException.class)
        .extracting("parameter")
        .isEqualTo("sort");
  }

  @Test
  void shouldDeleteRowAndFile_whenOwned() {
    // Given
    Image image =
        Image.builder().id(UUID.randomUUID()).ownerId(ownerId).filePath("/data/x.png").build();
    when(imageRepository.findById(image.getId())).thenReturn(Optional.of(image));

    // When
    imageService.deleteImage(ownerId, image.getId());

    // Then
    verify(imageRepository).delete(image);
    verify(imageFileStorage).deleteAfterCommit("/data/x.png");
    assertThat(meterRegistry.counter("image.deleted").count()).isEqualTo(1.0);
  }
}
