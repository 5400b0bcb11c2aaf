package io.tstools.slotcorr.estimate;

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

import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.moment.Variance;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class SeriesStatisticsTest {

    @Test
    void testBasicStatistics() {
        double[] values = {1, 2, 3, 4, 5};
        SeriesStatistics stats = SeriesStatistics.compute(values);

        assertEquals(5, stats.count());
        assertEquals(1, stats.min(), 1e-12);
        assertEquals(5, stats.max(), 1e-12);
        assertEquals(4, stats.range(), 1e-12);
        assertEquals(3, stats.mean(), 1e-12);
        assertEquals(2.0, stats.variance(), 1e-12);
        assertEquals(2.5, stats.sampleVariance(), 1e-12);
        assertEquals(Math.sqrt(2.5), stats.sampleStdDev(), 1e-12);
        assertFalse(stats.isConstant());
    }

    @Test
    void testMatchesCommonsMath() {
        Random random = new Random(12345);
        double[] values = new double[5000];
        for (int i = 0; i < values.length; i++) {
            values[i] = 3.0 + 2.0 * random.nextGaussian();
        }

        SeriesStatistics stats = SeriesStatistics.compute(values);

        assertEquals(new Variance().evaluate(values), stats.sampleVariance(), 1e-9);
        assertEquals(new Variance(false).evaluate(values), stats.variance(), 1e-9);
        assertEquals(new StandardDeviation().evaluate(values), stats.sampleStdDev(), 1e-9);
    }

    @Test
    void testConstantValues() {
        SeriesStatistics stats = SeriesStatistics.compute(new double[] {5, 5, 5, 5});

        assertTrue(stats.isConstant());
        assertEquals(0, stats.sampleVariance(), 1e-12);
        assertEquals(0, stats.stdDev(), 1e-12);
    }

    @Test
    void testSingleValue() {
        SeriesStatistics stats = SeriesStatistics.compute(new double[] {42});

        assertEquals(1, stats.count());
        assertEquals(42, stats.mean(), 1e-12);
        assertEquals(0, stats.sampleVariance(), 1e-12);
    }

    @Test
    void testNullThrows() {
        assertThrows(NullPointerException.class, () -> SeriesStatistics.compute(null));
    }

    @Test
    void testEmptyThrows() {
        assertThrows(IllegalArgumentException.class, () -> SeriesStatistics.compute(new double[0]));
    }
}
