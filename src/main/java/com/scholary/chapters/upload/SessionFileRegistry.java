package com.scholary.chapters.upload;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.chapters.grouping.FileDescriptor;
import com.scholary.chapters.grouping.SequenceGroup;
import com.scholary.chapters.grouping.SequenceGrouper;
import com.scholary.chapters.grouping.ValidationException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * Files and groups known for each session.
 *
 * <p>A session accumulates every file it has received. Each registration re-groups the whole
 * session, so chapters of one recording may arrive over several uploads. Re-uploading a file
 * replaces its earlier descriptor.
 */
@Repository
public class SessionFileRegistry {

  private final SequenceGrouper grouper;
  private final Cache<String, SessionFiles> cache;

  public SessionFileRegistry(
      SequenceGrouper grouper, @Value("${merger.fileRetentionHours}") int retentionHours) {
    this.grouper = grouper;
    this.cache =
        Caffeine.newBuilder().expireAfterAccess(Duration.ofHours(retentionHours)).build();
  }

  /**
   * Group a session as it would look with the given files added, without changing it.
   *
   * @return all groups the session would have after the merge
   * @throws com.scholary.chapters.grouping.DuplicateChapterException if the merged session would
   *     have two files for the same chapter
   */
  public List<SequenceGroup> preview(String sessionId, List<FileDescriptor> files) {
    return grouper.group(merge(cache.getIfPresent(sessionId), files));
  }

  /**
   * Add files to a session and re-group it.
   *
   * <p>If grouping fails the session keeps its previous state.
   *
   * @return all groups of the session after the merge
   * @throws com.scholary.chapters.grouping.DuplicateChapterException if the merged session has two
   *     files for the same chapter
   */
  public List<SequenceGroup> register(String sessionId, List<FileDescriptor> files) {
    SessionFiles updated =
        cache
            .asMap()
            .compute(
                sessionId,
                (id, existing) -> {
                  List<FileDescriptor> all = merge(existing, files);
                  return new SessionFiles(all, grouper.group(all));
                });
    return updated.groups();
  }

  private static List<FileDescriptor> merge(SessionFiles existing, List<FileDescriptor> files) {
    Map<Path, FileDescriptor> merged = new LinkedHashMap<>();
    if (existing != null) {
      existing.files().forEach(file -> merged.put(file.storedPath(), file));
    }
    files.forEach(file -> merged.put(file.storedPath(), file));
    return List.copyOf(merged.values());
  }

  public List<SequenceGroup> findGroups(String sessionId) {
    SessionFiles session = cache.getIfPresent(sessionId);
    return session == null ? List.of() : session.groups();
  }

  public Optional<SequenceGroup> findGroup(String sessionId, String groupId) {
    return findGroups(sessionId).stream()
        .filter(group -> group.groupId().equals(groupId))
        .findFirst();
  }

  /**
   * Look up the groups a client asked to process. Repeated ids are processed once.
   *
   * @throws ValidationException if the session is unknown or any id does not name one of its
   *     groups
   */
  public List<SequenceGroup> resolveGroups(String sessionId, List<String> groupIds) {
    if (cache.getIfPresent(sessionId) == null) {
      throw new ValidationException("Unknown session: " + sessionId);
    }

    List<SequenceGroup> resolved = new ArrayList<>();
    for (String groupId : new LinkedHashSet<>(groupIds)) {
      resolved.add(
          findGroup(sessionId, groupId)
              .orElseThrow(
                  () ->
                      new ValidationException(
                          "Unknown group " + groupId + " in session " + sessionId)));
    }
    return resolved;
  }

  private record SessionFiles(List<FileDescriptor> files, List<SequenceGroup> groups) {}
}
