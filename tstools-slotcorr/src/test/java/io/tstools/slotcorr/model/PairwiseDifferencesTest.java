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

import io.tstools.slotcorr.SyntheticSeries;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class PairwiseDifferencesTest {

    @Test
    void testEntriesAreSortedByLagInConstructionOrder() {
        // sorts to t = [0, 1, 2], x = [1, 2, 3]
        SampleSeries series = SampleSeries.of(new double[] {0, 2, 1}, new double[] {1, 3, 2});

        PairwiseDifferences pairs = PairwiseDifferences.of(series);

        assertEquals(6, pairs.size());
        double[] expectedLags = {0, 0, 0, 1, 1, 2};
        double[] expectedDiffs = {0, 0, 0, 1, 1, 2};
        double[] expectedProducts = {1, 4, 9, 2, 6, 3};
        for (int i = 0; i < pairs.size(); i++) {
            assertEquals(expectedLags[i], pairs.lag(i), "lag " + i);
            assertEquals(expectedDiffs[i], pairs.valueDifference(i), "dx " + i);
            assertEquals(expectedProducts[i], pairs.product(i), "product " + i);
        }
        assertEquals(2, pairs.maxLag());
    }

    @Test
    void testLowerBound() {
        SampleSeries series = SampleSeries.of(new double[] {0, 1, 2}, new double[] {1, 2, 3});
        PairwiseDifferences pairs = PairwiseDifferences.of(series);

        assertEquals(0, pairs.lowerBound(-1));
        assertEquals(0, pairs.lowerBound(0));
        assertEquals(3, pairs.lowerBound(0.5));
        assertEquals(3, pairs.lowerBound(1));
        assertEquals(5, pairs.lowerBound(2));
        assertEquals(6, pairs.lowerBound(3));
    }

    @Test
    void testDuplicateTimesGiveZeroLags() {
        SampleSeries series = SampleSeries.of(new double[] {0, 0, 1}, new double[] {1, 2, 3});
        PairwiseDifferences pairs = PairwiseDifferences.of(series);

        assertEquals(6, pairs.size());
        assertEquals(4, pairs.lowerBound(0.5), "three self pairs and one tied pair at lag 0");
    }

    @ParameterizedTest
    @ValueSource(ints = {2, 3, 17, 64, 150})
    void testSizeAndOrdering(int n) {
        SampleSeries series = SyntheticSeries.irregularSine(n, n, 10.0, 0.1);
        PairwiseDifferences pairs = PairwiseDifferences.of(series);

        assertEquals(PairwiseDifferences.pairCount(n), pairs.size());
        assertEquals((long) n * (n + 1) / 2, pairs.size());
        assertTrue(pairs.lag(0) >= 0);
        for (int i = 1; i < pairs.size(); i++) {
            assertTrue(pairs.lag(i) >= pairs.lag(i - 1), "lags must be sorted at " + i);
        }
        assertEquals(series.span(), pairs.maxLag(), 1e-12);
    }

    @Test
    void testPairCountOverflowIsRejectedBeforeAllocation() {
        assertTrue(PairwiseDifferences.pairCount(70_000) > PairwiseDifferences.MAX_PAIRS);
        assertTrue(PairwiseDifferences.pairCount(60_000) < PairwiseDifferences.MAX_PAIRS);

        int n = 70_000;
        double[] times = new double[n];
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            times[i] = i;
            values[i] = i % 7;
        }
        SampleSeries series = SampleSeries.of(times, values);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> PairwiseDifferences.of(series));
        assertTrue(e.getMessage().contains("70000 samples"), e.getMessage());
    }
}
