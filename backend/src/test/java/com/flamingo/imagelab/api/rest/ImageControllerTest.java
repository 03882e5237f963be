package com.flamingo.imagelab.api.rest;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.imagelab.config.ImageLabConfig;
import com.flamingo.imagelab.domain.entity.Image;
import com.flamingo.imagelab.exception.ApiError;
import com.flamingo.imagelab.exception.GlobalExceptionHandler;
import com.flamingo.imagelab.exception.ImageAccessDeniedException;
import com.flamingo.imagelab.exception.InvalidParameterException;
import com.flamingo.imagelab.exception.UnsupportedImageException;
import com.flamingo.imagelab.service.auth.CurrentOwnerProvider;
import com.flamingo.imagelab.service.image.ImagePage;
import com.flamingo.imagelab.service.image.ImageService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("ImageController Tests")
class ImageControllerTest {

  @Mock private ImageService imageService;
  @Mock private CurrentOwnerProvider currentOwnerProvider;

  private MockMvc mockMvc;
  private UUID ownerId;
  private Image image;

  @BeforeEach
  void setUp() {
    ImageLabConfig config = new ImageLabConfig();
    config.getStorage().setPublicBaseUrl("https://img.example.com/");
    ImageController controller =
        new ImageController(imageService, currentOwnerProvider, new ImageUrlResolver(config));
    mockMvc =
        MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();

    ownerId = UUID.randomUUID();
    when(currentOwnerProvider.getCurrentOwnerId()).thenReturn(ownerId);
    image =
        Image.builder()
            .id(UUID.randomUUID())
            .ownerId(ownerId)
            .filePath("/data/images/a.jpg")
            .width(640)
            .height(480)
            .mimeType("image/jpeg")
            .originalFilename("a.jpg")
            .fileSize(1234L)
            .createdAt(LocalDateTime.now())
            .build();
  }

  @Test
  @DisplayName("Should upload and return 201 with metadata")
  void shouldUpload() throws Exception {
    MockMultipartFile file =
        new MockMultipartFile("file", "a.jpg", "image/jpeg", new byte[] {1, 2, 3});
    when(imageService.uploadImage(eq(ownerId), any())).thenReturn(image);

    mockMvc
        .perform(multipart("/images/upload").file(file))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.image.id").value(image.getId().toString()))
        .andExpect(jsonPath("$.image.user_id").value(ownerId.toString()))
        .andExpect(jsonPath("$.image.width").value(640))
        .andExpect(jsonPath("$.image.original_filename").value("a.jpg"))
        .andExpect(
            jsonPath("$.image.url")
                .value("https://img.example.com/images/" + image.getId() + "/download"));
  }

  @Test
  @DisplayName("Should map unsupported upload to 415")
  void shouldRejectUnsupportedUpload() throws Exception {
    MockMultipartFile file = new MockMultipartFile("file", "a.txt", "text/plain", new byte[] {1});
    when(imageService.uploadImage(eq(ownerId), any()))
        .thenThrow(new UnsupportedImageException("Unsupported image type: text/plain"));

    mockMvc
        .perform(multipart("/images/upload").file(file))
        .andExpect(status().isUnsupportedMediaType())
        .andExpect(jsonPath("$.code").value(ApiError.UNSUPPORTED_IMAGE));
  }

  @Test
  @DisplayName("Should list images with paging fields")
  void shouldListImages() throws Exception {
    when(imageService.listImages(ownerId, 10, 20, "created_at_asc"))
        .thenReturn(new ImagePage(List.of(image), 21, 10, 20));

    mockMvc
        .perform(
            get("/images")
                .param("limit", "10")
                .param("offset", "20")
                .param("sort", "created_at_asc"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.images.length()").value(1))
        .andExpect(jsonPath("$.total").value(21))
        .andExpect(jsonPath("$.limit").value(10))
        .andExpect(jsonPath("$.offset").value(20));
  }

  @Test
  @DisplayName("Should reject unknown sort with 400")
  void shouldRejectUnknownSort() throws Exception {
    when(imageService.listImages(ownerId, 50, 0, "size"))
        .thenThrow(new InvalidParameterException("sort", "bad sort"));

    mockMvc
        .perform(get("/images").param("sort", "size"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.details").value("sort"));
  }

  @Test
  @DisplayName("Should serve bytes with stored content type")
  void shouldDownload() throws Exception {
    when(imageService.getImage(ownerId, image.getId())).thenReturn(image);
    when(imageService.getImageBytes(ownerId, image.getId())).thenReturn(new byte[] {7, 8});

    mockMvc
        .perform(get("/images/{imageId}/download", image.getId()))
        .andExpect(status().isOk())
        .andExpect(content().contentType(MediaType.IMAGE_JPEG))
        .andExpect(content().bytes(new byte[] {7, 8}));
  }

  @Test
  @DisplayName("Should return 403 for another owner's image")
  void shouldForbidForeignImage() throws Exception {
    when(imageService.getImage(ownerId, image.getId()))
        .thenThrow(new ImageAccessDeniedException(image.getId(), ownerId));

    mockMvc
        .perform(get("/images/{imageId}", image.getId()))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.code").value(ApiError.IMAGE_ACCESS_DENIED));
  }

  @Test
  @DisplayName("Should delete and answer ok")
  void shouldDelete() throws Exception {
    mockMvc
        .perform(delete("/images/{imageId}", image.getId()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.ok").value(true));

    verify(imageService).deleteImage(ownerId, image.getId());
  }
}
