package io.tstools.slotcorr.config;

/*
 * Copyright (c) tstools
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import io.tstools.slotcorr.ComputeMode;
import io.tstools.slotcorr.SlottedCorrentropy;
import io.tstools.slotcorr.estimate.SilvermanBandwidthSelector;
import io.tstools.slotcorr.estimate.SlotAverager;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON-serializable configuration for a {@link SlottedCorrentropy} estimator.
 *
 * <h2>JSON Schema</h2>
 *
 * <p>Every key is optional; absent keys keep their defaults:
 * <pre>{@code
 * {
 *   "lag_span_fraction": 0.2,      // (0, 1], share of the span covered by slots
 *   "slot_width_fraction": 0.1,    // slot width / mean sampling resolution
 *   "truncate_window": true,       // false weights every pair in every slot
 *   "window_truncation": 5.0,      // window half-width in slot widths
 *   "bandwidth_scale": 2.0,        // Silverman multiplier
 *   "fixed_bandwidth": 0.35,       // optional, overrides Silverman
 *   "compute_mode": "sequential",  // or "parallel"
 *   "parallelism": 8               // optional worker count for parallel mode
 * }
 * }</pre>
 *
 * @see SlottedCorrentropy
 */
public class EstimatorConfig {

    @SerializedName("lag_span_fraction")
    private double lagSpanFraction = SlottedCorrentropy.DEFAULT_LAG_SPAN_FRACTION;

    @SerializedName("slot_width_fraction")
    private double slotWidthFraction = SlottedCorrentropy.DEFAULT_SLOT_WIDTH_FRACTION;

    @SerializedName("truncate_window")
    private boolean truncateWindow = true;

    @SerializedName("window_truncation")
    private double windowTruncation = SlotAverager.DEFAULT_WINDOW_MULTIPLE;

    @SerializedName("bandwidth_scale")
    private double bandwidthScale = SilvermanBandwidthSelector.DEFAULT_SCALE;

    /** Fixed correntropy bandwidth; Silverman's rule applies when absent */
    @SerializedName("fixed_bandwidth")
    private Double fixedBandwidth;

    @SerializedName("compute_mode")
    private ComputeMode computeMode = ComputeMode.SEQUENTIAL;

    /** Worker count for parallel mode; a processor-based default applies when absent */
    @SerializedName("parallelism")
    private Integer parallelism;

    public EstimatorConfig() {
    }

    /**
     * Returns a configuration with every default.
     */
    public static EstimatorConfig defaults() {
        return new EstimatorConfig();
    }

    /**
     * Returns the spectrogram-style configuration, which covers 75% of the span.
     */
    public static EstimatorConfig spectrogram() {
        EstimatorConfig config = new EstimatorConfig();
        config.setLagSpanFraction(SlottedCorrentropy.SPECTROGRAM_LAG_SPAN_FRACTION);
        return config;
    }

    public double getLagSpanFraction() {
        return lagSpanFraction;
    }

    public void setLagSpanFraction(double lagSpanFraction) {
        this.lagSpanFraction = lagSpanFraction;
    }

    public double getSlotWidthFraction() {
        return slotWidthFraction;
    }

    public void setSlotWidthFraction(double slotWidthFraction) {
        this.slotWidthFraction = slotWidthFraction;
    }

    public boolean isTruncateWindow() {
        return truncateWindow;
    }

    public void setTruncateWindow(boolean truncateWindow) {
        this.truncateWindow = truncateWindow;
    }

    public double getWindowTruncation() {
        return windowTruncation;
    }

    public void setWindowTruncation(double windowTruncation) {
        this.windowTruncation = windowTruncation;
    }

    public double getBandwidthScale() {
        return bandwidthScale;
    }

    public void setBandwidthScale(double bandwidthScale) {
        this.bandwidthScale = bandwidthScale;
    }

    public Double getFixedBandwidth() {
        return fixedBandwidth;
    }

    public void setFixedBandwidth(Double fixedBandwidth) {
        this.fixedBandwidth = fixedBandwidth;
    }

    public ComputeMode getComputeMode() {
        return computeMode;
    }

    public void setComputeMode(ComputeMode computeMode) {
        this.computeMode = computeMode;
    }

    public Integer getParallelism() {
        return parallelism;
    }

    public void setParallelism(Integer parallelism) {
        this.parallelism = parallelism;
    }

    /**
     * Checks every value against its allowed range.
     *
     * @throws IllegalArgumentException naming the first offending key
     */
    public void validate() {
        if (!(lagSpanFraction > 0) || lagSpanFraction > 1) {
            throw new IllegalArgumentException("lag_span_fraction must be in (0, 1], got " + lagSpanFraction);
        }
        if (!(slotWidthFraction > 0) || Double.isInfinite(slotWidthFraction)) {
            throw new IllegalArgumentException("slot_width_fraction must be positive and finite, got " + slotWidthFraction);
        }
        if (truncateWindow && (!(windowTruncation > 0) || Double.isInfinite(windowTruncation))) {
            throw new IllegalArgumentException("window_truncation must be positive and finite, got " + windowTruncation);
        }
        if (!(bandwidthScale > 0) || Double.isInfinite(bandwidthScale)) {
            throw new IllegalArgumentException("bandwidth_scale must be positive and finite, got " + bandwidthScale);
        }
        if (fixedBandwidth != null && (!(fixedBandwidth > 0) || fixedBandwidth.isInfinite())) {
            throw new IllegalArgumentException("fixed_bandwidth must be positive and finite, got " + fixedBandwidth);
        }
        if (computeMode == null) {
            throw new IllegalArgumentException("compute_mode must be \"sequential\" or \"parallel\"");
        }
        if (parallelism != null && parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be positive, got " + parallelism);
        }
    }

    /**
     * Validates this configuration and builds the estimator it describes.
     *
     * @return the configured estimator
     * @throws IllegalArgumentException if a value is out of range
     */
    public SlottedCorrentropy toEstimator() {
        validate();
        SlottedCorrentropy.Builder builder = SlottedCorrentropy.builder()
            .lagSpanFraction(lagSpanFraction)
            .slotWidthFraction(slotWidthFraction)
            .computeMode(computeMode);

        if (truncateWindow) {
            builder.windowMultiple(windowTruncation);
        } else {
            builder.untruncatedWindow();
        }
        if (fixedBandwidth != null) {
            builder.fixedBandwidth(fixedBandwidth);
        } else {
            builder.bandwidthScale(bandwidthScale);
        }
        if (parallelism != null) {
            builder.parallelism(parallelism);
        }
        return builder.build();
    }

    /**
     * Loads an EstimatorConfig from JSON.
     *
     * @throws IllegalArgumentException if the JSON is malformed
     */
    public static EstimatorConfig fromJson(String json) {
        return parsed(() -> SlotCorrGsonConfig.gson().fromJson(json, EstimatorConfig.class));
    }

    /**
     * Loads an EstimatorConfig from a Reader.
     *
     * @throws IllegalArgumentException if the JSON is malformed
     */
    public static EstimatorConfig fromJson(Reader reader) {
        return parsed(() -> SlotCorrGsonConfig.gson().fromJson(reader, EstimatorConfig.class));
    }

    /**
     * Serializes this configuration to JSON.
     */
    public String toJson() {
        return SlotCorrGsonConfig.gson().toJson(this);
    }

    /**
     * Writes this configuration as JSON to a Writer.
     */
    public void toJson(Writer writer) {
        SlotCorrGsonConfig.gson().toJson(this, writer);
    }

    /**
     * Loads an EstimatorConfig from a JSON file.
     */
    public static EstimatorConfig loadFromFile(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path)) {
            return fromJson(reader);
        }
    }

    /**
     * Loads a JSON file and builds the estimator it describes.
     */
    public static SlottedCorrentropy loadEstimator(Path path) throws IOException {
        return loadFromFile(path).toEstimator();
    }

    /**
     * Saves this configuration to a JSON file.
     */
    public void saveToFile(Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path)) {
            toJson(writer);
        }
    }

    @Override
    public String toString() {
        return toJson();
    }

    private interface JsonSource {
        EstimatorConfig read();
    }

    private static EstimatorConfig parsed(JsonSource source) {
        EstimatorConfig config;
        try {
            config = source.read();
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("invalid estimator configuration: " + e.getMessage(), e);
        }
        if (config == null) {
            throw new IllegalArgumentException("estimator configuration is empty");
        }
        return config;
    }
}
