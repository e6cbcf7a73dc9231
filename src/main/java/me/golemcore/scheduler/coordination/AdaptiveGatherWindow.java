package me.golemcore.scheduler.coordination;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.time.Duration;

/**
 * Gather window derived from an exponentially weighted moving average of
 * observed response latencies, clamped to the policy bounds.
 *
 * <p>
 * The window is recomputed for every new trigger, so one slow turn stretches
 * subsequent windows only in proportion to its weight in the average.
 */
public class AdaptiveGatherWindow {

    private final Duration minWindow;
    private final Duration maxWindow;
    private final double factor;
    private final double smoothing;

    private double smoothedLatencyMs;
    private long samples;

    public AdaptiveGatherWindow(CoordinationPolicy policy) {
        if (policy.getMinGatherWindow().compareTo(policy.getMaxGatherWindow()) > 0) {
            throw new IllegalArgumentException("Minimum gather window exceeds maximum");
        }
        if (policy.getLatencySmoothing() <= 0.0 || policy.getLatencySmoothing() > 1.0) {
            throw new IllegalArgumentException("Latency smoothing must be in (0, 1]");
        }
        this.minWindow = policy.getMinGatherWindow();
        this.maxWindow = policy.getMaxGatherWindow();
        this.factor = policy.getLatencyFactor();
        this.smoothing = policy.getLatencySmoothing();
        this.smoothedLatencyMs = policy.getInitialLatency().toMillis();
    }

    public synchronized void recordLatency(Duration latency) {
        if (latency == null || latency.isNegative()) {
            return;
        }
        smoothedLatencyMs = smoothing * latency.toMillis() + (1.0 - smoothing) * smoothedLatencyMs;
        samples++;
    }

    public synchronized Duration currentWindow() {
        long windowMs = Math.round(smoothedLatencyMs * factor);
        long clamped = Math.max(minWindow.toMillis(), Math.min(maxWindow.toMillis(), windowMs));
        return Duration.ofMillis(clamped);
    }

    public synchronized Duration getSmoothedLatency() {
        return Duration.ofMillis(Math.round(smoothedLatencyMs));
    }

    public synchronized long getSamples() {
        return samples;
    }
}
