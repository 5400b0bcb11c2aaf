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

/// # Slotted correntropy for irregularly sampled series
///
/// Estimates the correntropy and a normalized autocorrelation-like cross term of
/// one scalar series whose samples arrive at uneven times, without resampling
/// it onto a uniform grid.
///
/// ```text
///  SampleSeries ──► PairwiseDifferences ──► SlotAverager ──► CorrentropyResult
///   (t, x)          (lag, dx, x_i*x_j)      one estimate      lag, correntropy,
///                    sorted by lag          per lag slot      sigma, cross term
/// ```
///
/// [SlottedCorrentropy] is the entry point. [io.tstools.slotcorr.config.EstimatorConfig]
/// describes the same options as JSON.
package io.tstools.slotcorr;
