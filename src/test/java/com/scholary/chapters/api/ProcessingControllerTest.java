package com.scholary.chapters.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholary.chapters.grouping.Chapter;
import com.scholary.chapters.grouping.FileDescriptor;
import com.scholary.chapters.grouping.SequenceGroup;
import com.scholary.chapters.grouping.ValidationException;
import com.scholary.chapters.job.ChannelUnavailableException;
import com.scholary.chapters.job.ConcatenationJob;
import com.scholary.chapters.job.GroupBusyException;
import com.scholary.chapters.job.JobPipeline;
import com.scholary.chapters.naming.Encoding;
import com.scholary.chapters.upload.SessionFileRegistry;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class ProcessingControllerTest {

  private static final SequenceGroup GROUP =
      new SequenceGroup(
          "GX0150",
          Encoding.X,
          150,
          List.of(new Chapter(1, new FileDescriptor("GX010150.MP4", Path.of("/u/a"), 10))));

  @Mock private SessionFileRegistry sessionFiles;
  @Mock private JobPipeline pipeline;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new ProcessingController(sessionFiles, pipeline))
            .setControllerAdvice(new ApiExceptionHandler())
            .build();
  }

  @Test
  void process_shouldQueueOneJobPerGroup() throws Exception {
    when(sessionFiles.resolveGroups("s1", List.of("GX0150"))).thenReturn(List.of(GROUP));
    when(pipeline.submit("s1", List.of(GROUP)))
        .thenReturn(List.of(ConcatenationJob.queued("job-1", "s1", GROUP)));

    mockMvc
        .perform(
            post("/api/process")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"sessionId\":\"s1\",\"groupIds\":[\"GX0150\"]}"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.sessionId").value("s1"))
        .andExpect(jsonPath("$.jobs[0].jobId").value("job-1"))
        .andExpect(jsonPath("$.jobs[0].groupId").value("GX0150"))
        .andExpect(jsonPath("$.jobs[0].state").value("queued"));
  }

  @Test
  void process_shouldRejectMissingFields() throws Exception {
    mockMvc
        .perform(
            post("/api/process")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"sessionId\":\"\",\"groupIds\":[]}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.status").value(400))
        .andExpect(jsonPath("$.path").value("/api/process"));

    verifyNoInteractions(sessionFiles, pipeline);
  }

  @Test
  void process_shouldRejectMalformedBody() throws Exception {
    mockMvc
        .perform(post("/api/process").contentType(MediaType.APPLICATION_JSON).content("{nope"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("Invalid request data"));
  }

  @Test
  void process_shouldRejectUnknownGroup() throws Exception {
    when(sessionFiles.resolveGroups("s1", List.of("GH9999")))
        .thenThrow(new ValidationException("Unknown group GH9999 in session s1"));

    mockMvc
        .perform(
            post("/api/process")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"sessionId\":\"s1\",\"groupIds\":[\"GH9999\"]}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("Validation Error"))
        .andExpect(jsonPath("$.message").value("Unknown group GH9999 in session s1"));
  }

  @Test
  void process_shouldRejectUnsafeSessionId() throws Exception {
    mockMvc
        .perform(
            post("/api/process")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"sessionId\":\"../etc\",\"groupIds\":[\"GX0150\"]}"))
        .andExpect(status().isBadRequest());

    verifyNoInteractions(sessionFiles, pipeline);
  }

  @Test
  void process_shouldReportUnavailableQueue() throws Exception {
    when(sessionFiles.resolveGroups(any(), anyList())).thenReturn(List.of(GROUP));
    when(pipeline.submit(any(), anyList()))
        .thenThrow(new ChannelUnavailableException("Job queue is full, try again later"));

    mockMvc
        .perform(
            post("/api/process")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"sessionId\":\"s1\",\"groupIds\":[\"GX0150\"]}"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.message").value("Job queue is full, try again later"));
  }

  @Test
  void process_shouldConflictWhenGroupIsStillBeingProcessed() throws Exception {
    when(sessionFiles.resolveGroups("s1", List.of("GX0150"))).thenReturn(List.of(GROUP));
    when(pipeline.submit("s1", List.of(GROUP)))
        .thenThrow(
            new GroupBusyException(
                "GX0150", "job-1", "Group GX0150 is already being processed by job job-1"));

    mockMvc
        .perform(
            post("/api/process")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"sessionId\":\"s1\",\"groupIds\":[\"GX0150\"]}"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.status").value(409))
        .andExpect(jsonPath("$.error").value("Conflict"))
        .andExpect(jsonPath("$.groupId").value("GX0150"))
        .andExpect(jsonPath("$.jobId").value("job-1"));
  }
}
