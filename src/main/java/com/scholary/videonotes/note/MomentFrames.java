package com.scholary.videonotes.note;

import com.scholary.videonotes.frame.FrameResult;
import com.scholary.videonotes.moment.Moment;
import java.util.Map;

/**
 * A moment paired with the frames resolved for it.
 *
 * @param moment the merged moment
 * @param frame result for the moment's own timestamp
 * @param inlineFrames results for the inline markers of its content, keyed by marker
 */
public record MomentFrames(
    Moment moment, FrameResult frame, Map<String, FrameResult> inlineFrames) {

  public MomentFrames {
    inlineFrames = inlineFrames == null ? Map.of() : Map.copyOf(inlineFrames);
  }

  public MomentFrames(Moment moment, FrameResult frame) {
    this(moment, frame, Map.of());
  }
}
