package com.scholary.chapters.api;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.redirectedUrl;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholary.chapters.objectstore.OutputArchiver;
import com.scholary.chapters.storage.OutputFile;
import com.scholary.chapters.storage.OutputFileRegistry;
import com.scholary.chapters.storage.StorageLayout;
import java.net.URI;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class OutputControllerTest {

  private static final String FILENAME = "Merged_GX0150_20240501T101530123Z_3f2a9c1e.mp4";

  @TempDir Path tempDir;

  @Mock private OutputArchiver archiver;

  private StorageLayout layout;
  private OutputFileRegistry outputs;
  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    layout =
        new StorageLayout(
            tempDir.resolve("uploads").toString(), tempDir.resolve("output").toString());
    outputs = new OutputFileRegistry(24);
    mockMvc =
        MockMvcBuilders.standaloneSetup(new OutputController(layout, outputs, archiver))
            .setControllerAdvice(new ApiExceptionHandler())
            .build();
  }

  @Test
  void listFiles_shouldShowRecordedOutputs() throws Exception {
    outputs.record(new OutputFile("s1", "GX0150", FILENAME, 2048, Instant.now(), null));

    mockMvc
        .perform(get("/api/files/s1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.sessionId").value("s1"))
        .andExpect(jsonPath("$.files[0].filename").value(FILENAME))
        .andExpect(jsonPath("$.files[0].groupId").value("GX0150"))
        .andExpect(jsonPath("$.files[0].size").value(2048))
        .andExpect(jsonPath("$.files[0].archived").value(false))
        .andExpect(jsonPath("$.files[0].downloadUrl").value("/api/download/s1/" + FILENAME));
  }

  @Test
  void listFiles_shouldBeEmptyForNewSession() throws Exception {
    mockMvc
        .perform(get("/api/files/s2"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.files.length()").value(0));
  }

  @Test
  void download_shouldStreamLocalFile() throws Exception {
    byte[] bytes = {1, 2, 3, 4};
    writeOutput(bytes);
    outputs.record(new OutputFile("s1", "GX0150", FILENAME, 4, Instant.now(), null));

    mockMvc
        .perform(get("/api/download/s1/" + FILENAME))
        .andExpect(status().isOk())
        .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION, containsString("attachment")))
        .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION, containsString(FILENAME)))
        .andExpect(content().contentType("video/mp4"))
        .andExpect(content().bytes(bytes));
  }

  @Test
  void download_shouldNotServeUnrecordedFile() throws Exception {
    writeOutput(new byte[] {1});

    mockMvc.perform(get("/api/download/s1/" + FILENAME)).andExpect(status().isNotFound());
  }

  @Test
  void download_shouldRedirectToArchiveWhenLocalCopyIsGone() throws Exception {
    outputs.record(new OutputFile("s1", "GX0150", FILENAME, 4, Instant.now(), "s1/" + FILENAME));
    URL presigned = URI.create("http://minio:9000/merged-videos/s1/" + FILENAME + "?sig=1").toURL();
    when(archiver.downloadUrl("s1/" + FILENAME)).thenReturn(Optional.of(presigned));

    mockMvc
        .perform(get("/api/download/s1/" + FILENAME))
        .andExpect(status().isFound())
        .andExpect(redirectedUrl(presigned.toString()));
  }

  @Test
  void download_shouldReturnNotFoundWhenNoCopyIsLeft() throws Exception {
    outputs.record(new OutputFile("s1", "GX0150", FILENAME, 4, Instant.now(), null));
    when(archiver.downloadUrl(null)).thenReturn(Optional.empty());

    mockMvc.perform(get("/api/download/s1/" + FILENAME)).andExpect(status().isNotFound());
  }

  @Test
  void download_shouldReturnNotFoundForUnknownSession() throws Exception {
    mockMvc.perform(get("/api/download/nobody/" + FILENAME)).andExpect(status().isNotFound());
  }

  private void writeOutput(byte[] bytes) throws Exception {
    Path path = layout.outputDir("s1").resolve(FILENAME);
    Files.createDirectories(path.getParent());
    Files.write(path, bytes);
  }
}
