package com.scholary.videonotes.cache;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.videonotes.moment.Moment;
import com.scholary.videonotes.moment.NoteStyle;
import java.util.List;
import org.junit.jupiter.api.Test;

class InMemoryMomentCacheTest {

  private final InMemoryMomentCache cache = new InMemoryMomentCache(10, 1);

  @Test
  void get_shouldReturnStoredMoments() {
    List<Moment> moments = List.of(new Moment(5, "t", "c"));
    cache.put("key", moments);

    assertThat(cache.get("key")).contains(moments);
    assertThat(cache.get("other")).isEmpty();
  }

  @Test
  void getStats_shouldReportHitsAndSize() {
    cache.put("key", List.of(new Moment(1, "t", "")));
    cache.get("key");
    cache.get("missing");

    assertThat(cache.getStats()).startsWith("MomentCache[size=1").contains("hitRate=50");
  }

  @Test
  void generateKey_shouldDependOnEveryComponent() {
    String base = MomentCache.generateKey("m", null, NoteStyle.BLOG, "text");

    assertThat(MomentCache.generateKey("m", null, NoteStyle.BLOG, "text")).isEqualTo(base);
    assertThat(MomentCache.generateKey("m2", null, NoteStyle.BLOG, "text")).isNotEqualTo(base);
    assertThat(MomentCache.generateKey("m", "http://x", NoteStyle.BLOG, "text"))
        .isNotEqualTo(base);
    assertThat(MomentCache.generateKey("m", null, NoteStyle.TUTORIAL, "text")).isNotEqualTo(base);
    assertThat(MomentCache.generateKey("m", null, NoteStyle.BLOG, "text2")).isNotEqualTo(base);
  }
}
