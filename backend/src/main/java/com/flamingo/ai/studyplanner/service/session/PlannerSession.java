package com.flamingo.ai.studyplanner.service.session;

import com.flamingo.ai.studyplanner.domain.model.Exam;
import com.flamingo.ai.studyplanner.domain.model.LearnerProfile;
import com.flamingo.ai.studyplanner.domain.model.Schedule;
import com.flamingo.ai.studyplanner.domain.model.SourceDocument;
import com.flamingo.ai.studyplanner.domain.model.Topic;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * State of one learner's planning session: topics, documents, uploads, profile, exams and the
 * current schedule.
 *
 * <p>Every service operation reads and writes this state inside {@link #withLock(Supplier)}, so an
 * operation observes and replaces whole collections atomically. Sessions never share state.
 */
public class PlannerSession {

  private final UUID id;
  private final LocalDateTime createdAt;
  private final ReentrantLock lock = new ReentrantLock();

  private final List<Topic> topics = new ArrayList<>();
  private final Map<String, SourceDocument> documents = new LinkedHashMap<>();
  private final Map<String, byte[]> uploadedFiles = new LinkedHashMap<>();
  private final Map<String, Exam> exams = new LinkedHashMap<>();
  private LearnerProfile profile;
  private Schedule schedule;

  public PlannerSession(UUID id) {
    this.id = id;
    this.createdAt = LocalDateTime.now();
  }

  /** Runs {@code action} while holding this session's lock. */
  public <T> T withLock(Supplier<T> action) {
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }

  public UUID getId() {
    return id;
  }

  public LocalDateTime getCreatedAt() {
    return createdAt;
  }

  /** Topics in document order, then section order. */
  public List<Topic> getTopics() {
    return List.copyOf(topics);
  }

  public void addTopics(List<Topic> newTopics) {
    topics.addAll(newTopics);
  }

  public List<SourceDocument> getDocuments() {
    return List.copyOf(documents.values());
  }

  public void putDocument(SourceDocument document) {
    documents.put(document.id(), document);
  }

  /** Clears topics, the document index and uploaded files. Profile, exams and schedule stay. */
  public void resetTopics() {
    topics.clear();
    documents.clear();
    uploadedFiles.clear();
  }

  public Optional<byte[]> getUploadedFile(String fileName) {
    return Optional.ofNullable(uploadedFiles.get(fileName));
  }

  public void putUploadedFile(String fileName, byte[] content) {
    uploadedFiles.put(fileName, content);
  }

  public Optional<LearnerProfile> getProfile() {
    return Optional.ofNullable(profile);
  }

  public void setProfile(LearnerProfile profile) {
    this.profile = profile;
  }

  public List<Exam> getExams() {
    return List.copyOf(exams.values());
  }

  /**
   * Adds an exam, or moves the existing exam of the same subject to the new date.
   *
   * @return {@code true} if an existing exam was updated
   */
  public boolean upsertExam(Exam exam) {
    return exams.put(exam.subject(), exam) != null;
  }

  public Optional<Schedule> getSchedule() {
    return Optional.ofNullable(schedule);
  }

  public void setSchedule(Schedule schedule) {
    this.schedule = schedule;
  }
}
