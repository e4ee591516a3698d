package com.scholary.chapters.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.chapters.grouping.Chapter;
import com.scholary.chapters.grouping.FileDescriptor;
import com.scholary.chapters.grouping.SequenceGroup;
import com.scholary.chapters.naming.Encoding;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;

class InMemoryJobQueueTest {

  private static final SequenceGroup GROUP =
      new SequenceGroup(
          "GX0150",
          Encoding.X,
          150,
          List.of(new Chapter(1, new FileDescriptor("GX010150.MP4", Path.of("/u/a"), 10))));

  private JobRepository repository;

  @BeforeEach
  void setUp() {
    repository = new JobRepository(100, 60);
  }

  @Test
  void enqueue_shouldRunHandlerWithActiveJob() {
    InMemoryJobQueue queue = new InMemoryJobQueue(repository, new SyncTaskExecutor());
    queue.onJobPicked(
        job -> {
          assertThat(job.state()).isEqualTo(JobState.ACTIVE);
          queue.reportProgress(job.jobId(), 55, "processing");
        });

    ConcatenationJob queued = queue.enqueue("s1", GROUP);

    assertThat(queued.state()).isEqualTo(JobState.QUEUED);
    ConcatenationJob stored = queue.find(queued.jobId()).orElseThrow();
    assertThat(stored.state()).isEqualTo(JobState.ACTIVE);
    assertThat(stored.progress()).isEqualTo(55);
    assertThat(stored.stage()).isEqualTo("processing");
  }

  @Test
  void enqueue_shouldFailJobWhenHandlerCrashes() {
    InMemoryJobQueue queue = new InMemoryJobQueue(repository, new SyncTaskExecutor());
    queue.onJobPicked(
        job -> {
          throw new IllegalStateException("boom");
        });

    ConcatenationJob queued = queue.enqueue("s1", GROUP);

    ConcatenationJob stored = queue.find(queued.jobId()).orElseThrow();
    assertThat(stored.state()).isEqualTo(JobState.FAILED);
    assertThat(stored.error().kind()).isEqualTo(JobErrorKind.CONCATENATION_FAILED);
    assertThat(stored.error().message()).contains("boom");
  }

  @Test
  void enqueue_shouldRejectWhenPoolIsSaturated() {
    TaskExecutor saturated =
        task -> {
          throw new RejectedExecutionException("queue full");
        };
    InMemoryJobQueue queue = new InMemoryJobQueue(repository, saturated);
    queue.onJobPicked(job -> {});

    assertThatThrownBy(() -> queue.enqueue("s1", GROUP))
        .isInstanceOf(ChannelUnavailableException.class);
    assertThat(repository.findBySession("s1")).isEmpty();
  }

  @Test
  void enqueue_shouldRejectWithoutHandler() {
    InMemoryJobQueue queue = new InMemoryJobQueue(repository, new SyncTaskExecutor());

    assertThatThrownBy(() -> queue.enqueue("s1", GROUP))
        .isInstanceOf(ChannelUnavailableException.class);
  }

  @Test
  void enqueue_shouldRejectAfterShutdown() {
    InMemoryJobQueue queue = new InMemoryJobQueue(repository, new SyncTaskExecutor());
    queue.onJobPicked(job -> {});
    queue.shutdown();

    assertThatThrownBy(() -> queue.enqueue("s1", GROUP))
        .isInstanceOf(ChannelUnavailableException.class)
        .hasMessageContaining("shutting down");
  }

  @Test
  void enqueue_shouldAssignDistinctIds() {
    InMemoryJobQueue queue = new InMemoryJobQueue(repository, task -> {});
    queue.onJobPicked(job -> {});

    ConcatenationJob first = queue.enqueue("s1", GROUP);
    ConcatenationJob second = queue.enqueue("s1", GROUP);

    assertThat(first.jobId()).isNotEqualTo(second.jobId());
    assertThat(repository.findBySession("s1"))
        .extracting(ConcatenationJob::state)
        .containsOnly(JobState.QUEUED);
  }
}
