/*
 * This file is part of BddSynth.
 * Copyright (c) 2026 The BddSynth authors.
 *
 * BddSynth is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * BddSynth is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with BddSynth. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.bddsynth;

import java.util.Collection;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.logging.Level;
import java.util.logging.Logger;

/*
 * Direct-mapped memo of if-then-else results. A colliding put simply overwrites the previous
 * entry, so a lookup may miss even though the triple was computed before.
 *
 * Possible improvements:
 *  - Keep entries when the node table grows instead of invalidating everything
 */
final class BddCache {
    private static final Logger logger = Logger.getLogger(BddCache.class.getName());

    @SuppressWarnings("StaticCollection")
    private static final Collection<BddCache> cacheShutdownHook = new ConcurrentLinkedDeque<>();

    private static final int[] EMPTY_INT_ARRAY = new int[0];
    // No lookup ever uses FALSE as condition, so an all-zero bin is never matched
    private static final int EMPTY_BIN = Bdd.FALSE_NODE;

    private final NodeTable associatedBdd;
    private final BddConfiguration configuration;
    private final CacheStatistics ternaryStatistics = new CacheStatistics();

    private int ternaryKeyCount = 0;
    private int[] ternaryCache = EMPTY_INT_ARRAY;

    private int lookupHash;
    private int lookupResult;

    BddCache(NodeTable associatedBdd, BddConfiguration configuration) {
        this.associatedBdd = associatedBdd;
        this.configuration = configuration;
        this.lookupHash = -1;
        this.lookupResult = -1;

        reallocateTernary(associatedBdd.tableSize());

        if (logger.isLoggable(Level.INFO) && configuration.logStatisticsOnShutdown()) {
            logger.log(Level.FINER, "Adding {0} to shutdown hook", this);
            addToShutdownHook(this);
        }
    }

    private static void addToShutdownHook(BddCache cache) {
        ShutdownHookLazyHolder.init();
        cacheShutdownHook.add(cache);
    }

    private static int mod(int value, int modulus) {
        int val = value % modulus;
        return val < 0 ? val + modulus : val;
    }

    private float ternaryLoadFactor() {
        int loadedTernaryBins = 0;
        for (int i = 0; i < ternaryKeyCount; i++) {
            if (ternaryCache[4 * i] != EMPTY_BIN) {
                loadedTernaryBins++;
            }
        }
        return (float) loadedTernaryBins / (float) ternaryKeyCount;
    }

    private int ternaryCachePosition(int hash) {
        return mod(hash, ternaryKeyCount);
    }

    void invalidate(int tableSize) {
        logger.log(Level.FINER, "Invalidating cache of {0}", associatedBdd);
        ternaryStatistics.invalidation();
        reallocateTernary(tableSize);
    }

    int lookupHash() {
        return lookupHash;
    }

    int lookupResult() {
        return lookupResult;
    }

    boolean lookupIfThenElse(int inputNode1, int inputNode2, int inputNode3) {
        assert associatedBdd.isNodeValid(inputNode1)
                && associatedBdd.isNodeValidOrLeaf(inputNode2)
                && associatedBdd.isNodeValidOrLeaf(inputNode3);

        int hash = HashUtil.hash(inputNode1, inputNode2, inputNode3);
        lookupHash = hash;
        if (!configuration.useIfThenElseCache()) {
            return false;
        }
        int[] ternaryCache = this.ternaryCache;

        int binStart = 4 * ternaryCachePosition(hash);
        if (inputNode1 == ternaryCache[binStart]
                && inputNode2 == ternaryCache[binStart + 1]
                && inputNode3 == ternaryCache[binStart + 2]) {
            int result = ternaryCache[binStart + 3];
            lookupResult = result;
            assert associatedBdd.isNodeValidOrLeaf(result);
            ternaryStatistics.cacheHit();
            return true;
        }
        return false;
    }

    void putIfThenElse(int hash, int inputNode1, int inputNode2, int inputNode3, int resultNode) {
        assert associatedBdd.isNodeValid(inputNode1)
                && associatedBdd.isNodeValidOrLeaf(inputNode2)
                && associatedBdd.isNodeValidOrLeaf(inputNode3)
                && associatedBdd.isNodeValidOrLeaf(resultNode);
        assert hash == HashUtil.hash(inputNode1, inputNode2, inputNode3);
        if (!configuration.useIfThenElseCache()) {
            return;
        }

        ternaryStatistics.put();
        int[] ternaryCache = this.ternaryCache;

        int binStart = 4 * ternaryCachePosition(hash);
        ternaryCache[binStart] = inputNode1;
        ternaryCache[binStart + 1] = inputNode2;
        ternaryCache[binStart + 2] = inputNode3;
        ternaryCache[binStart + 3] = resultNode;
    }

    private void reallocateTernary(int tableSize) {
        int keyCount = Primes.nextPrime(tableSize / configuration.cacheTernaryDivider());
        // Freshly allocated bins are all zero, i.e. empty
        ternaryCache = new int[keyCount * 4];
        ternaryKeyCount = keyCount;
    }

    public String getStatistics() {
        return String.format("Ternary: size: %d, load: %s%n %s",
                ternaryKeyCount, ternaryLoadFactor(), ternaryStatistics);
    }

    private static final class CacheStatistics {
        private int hitCount = 0;
        private int hitCountSinceInvalidation = 0;
        private int putCount = 0;
        private int putCountSinceInvalidation = 0;
        private int invalidationCount = 0;

        void cacheHit() {
            hitCount++;
            hitCountSinceInvalidation++;
        }

        void invalidation() {
            invalidationCount++;
            hitCountSinceInvalidation = 0;
            putCountSinceInvalidation = 0;
        }

        void put() {
            putCount++;
            putCountSinceInvalidation++;
        }

        @Override
        public String toString() {
            float hitToPutRatio = (float) hitCount / (float) Math.max(putCount, 1);
            return String.format(
                    "Cache access: put=%d, hit=%d, hit-to-put=%3.3f%n"
                            + "       invalidation: %d times, since last: put=%d, hit=%d",
                    putCount,
                    hitCount,
                    hitToPutRatio,
                    invalidationCount,
                    putCountSinceInvalidation,
                    hitCountSinceInvalidation);
        }
    }

    private static final class ShutdownHookLazyHolder {
        private static final Runnable shutdownHook = new ShutdownHookPrinter();

        static {
            Runtime.getRuntime().addShutdownHook(new Thread(shutdownHook));
        }

        static void init() {
            // bogus method to force static initialization
        }
    }

    private static final class ShutdownHookPrinter implements Runnable {
        @Override
        public void run() {
            if (!logger.isLoggable(Level.INFO)) {
                return;
            }
            for (BddCache cache : cacheShutdownHook) {
                logger.info(cache.associatedBdd.statistics());
            }
        }
    }
}
