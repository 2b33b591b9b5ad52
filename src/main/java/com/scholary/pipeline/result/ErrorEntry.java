package com.scholary.pipeline.result;

import java.time.Instant;

/** A failure recorded against a run: the message and when it happened. */
public record ErrorEntry(String error, Instant time) {}
