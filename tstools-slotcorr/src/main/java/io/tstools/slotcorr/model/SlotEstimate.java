package io.tstools.slotcorr.model;

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

/**
 * The kernel-weighted averages computed for one defined lag slot.
 *
 * <p>A slot whose window holds no pair has no estimate at all; callers receive
 * {@link java.util.Optional#empty()} for it rather than an instance with NaN fields.
 *
 * @param slot slot index k
 * @param lag weighted mean of the pair lags in the window
 * @param correntropy weighted mean of the correntropy kernel values
 * @param crossTerm weighted mean of the raw value products, before normalization
 * @param support number of pairs inside the window
 */
public record SlotEstimate(
    int slot,
    double lag,
    double correntropy,
    double crossTerm,
    int support
) {
    public SlotEstimate {
        if (support <= 0) {
            throw new IllegalArgumentException("a slot estimate needs at least one pair, got " + support);
        }
    }
}
