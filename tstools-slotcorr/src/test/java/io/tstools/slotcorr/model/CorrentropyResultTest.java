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

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class CorrentropyResultTest {

    private static final KernelBandwidths BANDWIDTHS = new KernelBandwidths(0.4, 1.0, 0.1, 2);

    @Test
    void testFromSlotsDropsEmptySlotsAndNormalizes() {
        List<Optional<SlotEstimate>> slots = List.of(
            Optional.of(new SlotEstimate(0, 0.01, 1.0, 2.0, 10)),
            Optional.empty(),
            Optional.of(new SlotEstimate(2, 0.19, 0.8, -1.0, 4)));

        CorrentropyResult result = CorrentropyResult.fromSlots(slots, BANDWIDTHS, 2.0);

        assertEquals(2, result.size());
        assertEquals(3, result.slotsEvaluated());
        assertArrayEquals(new double[] {0.01, 0.19}, result.lag());
        assertArrayEquals(new double[] {1.0, 0.8}, result.correntropy());
        assertArrayEquals(new double[] {1.0, -0.5}, result.normalizedCrossTerm());
        assertArrayEquals(new int[] {10, 4}, result.support());
        assertEquals(0.4, result.bandwidth());
        assertEquals(0.1, result.slotWidth());
        assertEquals(2.0, result.variance());
    }

    @Test
    void testAllEmptySlotsGiveEmptyResult() {
        CorrentropyResult result = CorrentropyResult.fromSlots(
            List.of(Optional.empty(), Optional.empty()), BANDWIDTHS, 1.0);

        assertTrue(result.isEmpty());
        assertEquals(2, result.slotsEvaluated());
    }

    @Test
    void testNonPositiveVarianceThrows() {
        assertThrows(IllegalArgumentException.class,
            () -> CorrentropyResult.fromSlots(List.of(), BANDWIDTHS, 0.0));
    }

    @Test
    void testMisalignedArraysThrow() {
        assertThrows(IllegalArgumentException.class, () -> new CorrentropyResult(
            new double[] {0, 1}, new double[] {1}, 0.5, new double[] {1, 0}, 0.1, 1.0, 2, new int[] {1, 1}));
    }

    @Test
    void testArraysAreDefensiveCopies() {
        double[] lag = {0.0, 0.1};
        CorrentropyResult result = new CorrentropyResult(
            lag, new double[] {1, 0.9}, 0.5, new double[] {1, 0.5}, 0.1, 1.0, 2, new int[] {3, 3});

        lag[0] = 42;
        result.lag()[1] = 42;

        assertEquals(0.0, result.lagAt(0));
        assertEquals(0.1, result.lagAt(1));
    }

    @Test
    void testJsonContainsAlignedArrays() {
        CorrentropyResult result = new CorrentropyResult(
            new double[] {0.0, 0.1}, new double[] {1, 0.9}, 0.5, new double[] {1, 0.5}, 0.1, 1.0, 7, new int[] {3, 2});

        JsonObject json = JsonParser.parseString(result.toJson()).getAsJsonObject();

        assertEquals(2, json.getAsJsonArray("lag").size());
        assertEquals(2, json.getAsJsonArray("correntropy").size());
        assertEquals(2, json.getAsJsonArray("normalized_cross_term").size());
        assertEquals(0.5, json.get("bandwidth").getAsDouble());
        assertEquals(7, json.get("slots_evaluated").getAsInt());
    }

    @Test
    void testSlotEstimateRequiresSupport() {
        assertThrows(IllegalArgumentException.class, () -> new SlotEstimate(0, 0, 1, 1, 0));
    }
}
