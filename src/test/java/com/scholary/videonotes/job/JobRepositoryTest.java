package com.scholary.videonotes.job;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class JobRepositoryTest {

  private final JobRepository repository = new JobRepository(10, 5);

  @Test
  void save_shouldMakeJobFindable() {
    SynthesisJob job = new SynthesisJob("job-1", SynthesisJobTest.request());

    repository.save(job);

    assertThat(repository.findById("job-1")).containsSame(job);
  }

  @Test
  void findById_shouldBeEmptyForUnknownJob() {
    assertThat(repository.findById("nope")).isEmpty();
  }

  @Test
  void delete_shouldRemoveJob() {
    repository.save(new SynthesisJob("job-1", SynthesisJobTest.request()));

    repository.delete("job-1");

    assertThat(repository.findById("job-1")).isEmpty();
  }
}
