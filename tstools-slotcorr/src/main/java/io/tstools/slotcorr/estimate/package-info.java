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

/// Numerical building blocks of the estimator.
///
/// | Class | Role |
/// |-------|------|
/// | [SeriesStatistics] | value spread of a series |
/// | [BandwidthSelector] | correntropy bandwidth sigma |
/// | [SlotSizing] | slot width and slot count |
/// | [GaussianKernel] | lag weight and correntropy kernels |
/// | [SlotAverager] | Nadaraya-Watson averages per slot |
package io.tstools.slotcorr.estimate;
