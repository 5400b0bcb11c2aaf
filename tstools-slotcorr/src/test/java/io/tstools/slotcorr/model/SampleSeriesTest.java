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

import io.tstools.slotcorr.DegenerateSeriesException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class SampleSeriesTest {

    @Test
    void testSortedByTimeMovesValuesWithTimes() {
        SampleSeries series = SampleSeries.of(
            new double[] {3.0, 0.5, 1.2},
            new double[] {30.0, 5.0, 12.0});

        SampleSeries sorted = series.sortedByTime();

        assertArrayEquals(new double[] {0.5, 1.2, 3.0}, sorted.times());
        assertArrayEquals(new double[] {5.0, 12.0, 30.0}, sorted.values());
        assertTrue(sorted.isTimeOrdered());
        assertFalse(series.isTimeOrdered());
    }

    @Test
    void testSortIsStableForTiedTimes() {
        SampleSeries series = SampleSeries.of(
            new double[] {2, 1, 2, 1},
            new double[] {10, 20, 30, 40});

        SampleSeries sorted = series.sortedByTime();

        assertArrayEquals(new double[] {1, 1, 2, 2}, sorted.times());
        assertArrayEquals(new double[] {20, 40, 10, 30}, sorted.values());
    }

    @Test
    void testSpan() {
        SampleSeries series = SampleSeries.of(new double[] {4, -1, 2}, new double[] {0, 0, 0});

        assertEquals(-1, series.minTime());
        assertEquals(4, series.maxTime());
        assertEquals(5, series.span());
        assertEquals(3, series.size());
    }

    @Test
    void testInputsAreCopied() {
        double[] times = {0, 1, 2};
        double[] values = {1, 2, 3};
        SampleSeries series = SampleSeries.of(times, values);

        times[0] = 99;
        values[0] = 99;
        series.values()[1] = 99;

        assertEquals(0, series.time(0));
        assertEquals(1, series.value(0));
        assertEquals(2, series.value(1));
    }

    @Test
    void testNullThrows() {
        assertThrows(NullPointerException.class, () -> SampleSeries.of(null, new double[0]));
        assertThrows(NullPointerException.class, () -> SampleSeries.of(new double[0], null));
    }

    @Test
    void testLengthMismatchThrows() {
        assertThrows(IllegalArgumentException.class,
            () -> SampleSeries.of(new double[] {0, 1}, new double[] {1}));
    }

    @Test
    void testNonFiniteThrows() {
        DegenerateSeriesException e = assertThrows(DegenerateSeriesException.class,
            () -> SampleSeries.of(new double[] {0, Double.POSITIVE_INFINITY}, new double[] {1, 2}));
        assertEquals(DegenerateSeriesException.Reason.NON_FINITE, e.getReason());
    }
}
