package com.scholary.chapters.upload;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.chapters.config.MergerProperties;
import com.scholary.chapters.grouping.Chapter;
import com.scholary.chapters.grouping.DuplicateChapterException;
import com.scholary.chapters.grouping.SequenceGroup;
import com.scholary.chapters.grouping.SequenceGrouper;
import com.scholary.chapters.grouping.ValidationException;
import com.scholary.chapters.job.ConcatenationJob;
import com.scholary.chapters.job.GroupBusyException;
import com.scholary.chapters.job.JobError;
import com.scholary.chapters.job.JobRepository;
import com.scholary.chapters.naming.FilenameParser;
import com.scholary.chapters.storage.StorageLayout;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.web.multipart.MultipartFile;

class UploadServiceTest {

  @TempDir Path tempDir;

  private StorageLayout layout;
  private JobRepository jobs;
  private UploadService service;

  @BeforeEach
  void setUp() {
    layout =
        new StorageLayout(
            tempDir.resolve("uploads").toString(), tempDir.resolve("output").toString());
    SessionFileRegistry registry =
        new SessionFileRegistry(new SequenceGrouper(new FilenameParser()), 24);
    MergerProperties properties =
        new MergerProperties(
            tempDir.resolve("uploads").toString(),
            tempDir.resolve("output").toString(),
            tempDir.resolve("tmp").toString(),
            2,
            10,
            3,
            24,
            false,
            1000L,
            2000);
    jobs = new JobRepository(100, 60);
    service = new UploadService(layout, registry, jobs, properties);
  }

  @Test
  void upload_shouldStoreFilesAndReturnGroups() throws Exception {
    UploadResult result =
        service.upload("s1", List.of(file("GX020150.MP4", 7), file("GX010150.MP4", 5)));

    assertThat(result.sessionId()).isEqualTo("s1");
    assertThat(result.groups()).hasSize(1);
    SequenceGroup group = result.groups().get(0);
    assertThat(group.groupId()).isEqualTo("GX0150");
    assertThat(group.chapters()).extracting(Chapter::chapterNumber).containsExactly(1, 2);
    assertThat(group.totalSizeBytes()).isEqualTo(12);
    assertThat(layout.uploadPath("s1", "GX010150.MP4")).hasBinaryContent(new byte[5]);
  }

  @Test
  void upload_shouldStartNewSessionWithoutId() throws Exception {
    UploadResult result = service.upload(null, List.of(file("GX010150.MP4", 1)));

    assertThat(StorageLayout.isValidSessionId(result.sessionId())).isTrue();
    assertThat(Files.isDirectory(layout.uploadDir(result.sessionId()))).isTrue();
  }

  @Test
  void upload_shouldAccumulateChaptersAcrossUploads() throws Exception {
    service.upload("s1", List.of(file("GX010150.MP4", 1), file("GH010007.MP4", 1)));

    UploadResult second = service.upload("s1", List.of(file("GX020150.MP4", 1)));

    assertThat(second.groups())
        .extracting(SequenceGroup::groupId)
        .containsExactly("GX0150", "GH0007");
    assertThat(second.groups().get(0).chapterCount()).isEqualTo(2);
  }

  @Test
  void upload_shouldKeepProxiesOnDiskButOutOfGroups() throws Exception {
    UploadResult result =
        service.upload(
            "s1",
            List.of(file("GX010150.MP4", 1), file("GX010150.LRV", 1), file("GX010150.THM", 1)));

    assertThat(result.groups().get(0).chapterCount()).isEqualTo(1);
    assertThat(layout.uploadPath("s1", "GX010150.LRV")).exists();
  }

  @Test
  void upload_shouldRejectWholeRequestOnUnsupportedType() {
    List<MultipartFile> files = List.of(file("GX010150.MP4", 1), file("notes.txt", 1));

    assertThatThrownBy(() -> service.upload("s1", files))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("notes.txt");
    assertThat(layout.uploadDir("s1")).doesNotExist();
  }

  @Test
  void upload_shouldRejectEmptyRequest() {
    assertThatThrownBy(() -> service.upload("s1", List.of()))
        .isInstanceOf(ValidationException.class)
        .hasMessage("No files uploaded");
    assertThatThrownBy(() -> service.upload("s1", null)).isInstanceOf(ValidationException.class);
  }

  @Test
  void upload_shouldRejectTooManyFiles() {
    List<MultipartFile> files = new ArrayList<>();
    for (int chapter = 1; chapter <= 4; chapter++) {
      files.add(file(String.format("GX%02d0150.MP4", chapter), 1));
    }

    assertThatThrownBy(() -> service.upload("s1", files))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("at most 3");
  }

  @Test
  void upload_shouldFailWhenNoGroupCanBeFormed() {
    List<MultipartFile> files = List.of(file("GX010150.LRV", 1), file("holiday.mp4", 1));

    assertThatThrownBy(() -> service.upload("s1", files))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("No valid chapter groups");
  }

  @Test
  void upload_shouldRejectUnsafeSessionId() {
    List<MultipartFile> files = List.of(file("GX010150.MP4", 1));

    assertThatThrownBy(() -> service.upload("../escape", files))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void upload_shouldRejectSameNameTwiceInOneRequest() {
    List<MultipartFile> files = List.of(file("GX010150.MP4", 5), file("GX010150.MP4", 9));

    assertThatThrownBy(() -> service.upload("s1", files))
        .isInstanceOf(ValidationException.class)
        .hasMessage("Duplicate file in upload: GX010150.MP4");
    assertThat(layout.uploadDir("s1")).doesNotExist();
  }

  @Test
  void upload_shouldRejectNamesDifferingOnlyInCaseInOneRequest() {
    List<MultipartFile> files = List.of(file("GX010150.MP4", 5), file("gx010150.mp4", 9));

    assertThatThrownBy(() -> service.upload("s1", files))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("Duplicate file in upload");
    assertThat(layout.uploadDir("s1")).doesNotExist();
  }

  @Test
  void upload_shouldRejectChapterTheSessionHasUnderAnotherNameBeforeWriting() throws Exception {
    service.upload("s1", List.of(file("GX010150.MP4", 5)));
    List<MultipartFile> clash = List.of(file("gx010150.mp4", 9));

    assertThatThrownBy(() -> service.upload("s1", clash))
        .isInstanceOf(DuplicateChapterException.class)
        .hasMessageContaining("Duplicate chapter 1 in group GX0150");
    assertThat(layout.uploadDir("s1").resolve("gx010150.mp4")).doesNotExist();
    assertThat(layout.uploadPath("s1", "GX010150.MP4")).hasBinaryContent(new byte[5]);
  }

  @Test
  void upload_shouldRefuseToReplaceInputOfWaitingOrRunningJob() throws Exception {
    SequenceGroup group =
        service.upload("s1", List.of(file("GX010150.MP4", 5))).groups().get(0);
    jobs.save(ConcatenationJob.queued("job-1", "s1", group).activate());
    List<MultipartFile> replacement = List.of(file("GX010150.MP4", 9));

    assertThatThrownBy(() -> service.upload("s1", replacement))
        .isInstanceOf(GroupBusyException.class)
        .hasMessageContaining("job-1");
    assertThat(layout.uploadPath("s1", "GX010150.MP4")).hasBinaryContent(new byte[5]);
  }

  @Test
  void upload_shouldReplaceFileOnceItsJobHasFinished() throws Exception {
    SequenceGroup group =
        service.upload("s1", List.of(file("GX010150.MP4", 5))).groups().get(0);
    jobs.save(
        ConcatenationJob.queued("job-1", "s1", group)
            .activate()
            .fail(JobError.concatenationFailed("exit code 1")));

    UploadResult result = service.upload("s1", List.of(file("GX010150.MP4", 9)));

    assertThat(result.groups().get(0).chapterCount()).isEqualTo(1);
    assertThat(result.groups().get(0).totalSizeBytes()).isEqualTo(9);
    assertThat(layout.uploadPath("s1", "GX010150.MP4")).hasBinaryContent(new byte[9]);
  }

  @Test
  void isSupported_shouldAcceptCameraExtensionsInAnyCase() {
    assertThat(UploadService.isSupported("GX010150.MP4")).isTrue();
    assertThat(UploadService.isSupported("clip.mp4")).isTrue();
    assertThat(UploadService.isSupported("GX010150.lrv")).isTrue();
    assertThat(UploadService.isSupported("GX010150.Thm")).isTrue();
    assertThat(UploadService.isSupported("GX010150.MOV")).isFalse();
    assertThat(UploadService.isSupported("MP4")).isFalse();
    assertThat(UploadService.isSupported(null)).isFalse();
  }

  private static MockMultipartFile file(String name, int size) {
    return new MockMultipartFile("files", name, "application/octet-stream", new byte[size]);
  }
}
