package com.scholary.intervals.api;

import com.scholary.intervals.merge.MergeMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.List;

/**
 * Request to merge a collection of intervals.
 *
 * <p>{@code mode} is optional; the configured default is used when it is absent.
 */
public record MergeRequest(@NotNull List<@Valid @NotNull IntervalPayload> intervals, MergeMode mode) {}
