package io.tstools.slotcorr;

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

/// Thrown when a sample series cannot support a correntropy estimate at all.
///
/// The estimator rejects these inputs at the call boundary instead of
/// returning arrays full of undefined values. The [Reason] tells callers
/// which property of the series was at fault.
public class DegenerateSeriesException extends IllegalArgumentException {

    /// Why a series was rejected.
    public enum Reason {
        /// Fewer than two samples, so no lag can be formed.
        TOO_FEW_SAMPLES,
        /// All samples share one timestamp, so the slot width would be zero.
        ZERO_TIME_SPAN,
        /// All values are identical, so the bandwidth and the normalization are undefined.
        ZERO_VARIANCE,
        /// A time or value is NaN or infinite, or the values are so large that
        /// their variance or pairwise products overflow.
        NON_FINITE,
        /// The bandwidth selector returned zero, a negative value, NaN or infinity.
        INVALID_BANDWIDTH
    }

    private final Reason reason;

    public DegenerateSeriesException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
