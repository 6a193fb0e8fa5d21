package com.scholary.videonotes.frame;

import java.awt.image.BufferedImage;

/** A decoded still and the video time it was taken at. */
public record DecodedFrame(double seconds, BufferedImage image) {}
