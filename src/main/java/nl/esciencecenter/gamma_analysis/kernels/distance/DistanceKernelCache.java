/*
* Copyright 2015 Netherlands eScience Center, VU University Amsterdam, and Netherlands Forensic Institute
*
* Licensed under the Apache License, Version 2.0 (the "License");
* you may not use this file except in compliance withSupplier the License.
* You may obtain a copy of the License at
*
* http://www.apache.org/licenses/LICENSE-2.0
*
* Unless required by applicable law or agreed to in writing, software
* distributed under the License is distributed on an "AS IS" BASIS,
* WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
* See the License for the specific language governing permissions and
* limitations under the License.
*/
package nl.esciencecenter.gamma_analysis.kernels.distance;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Keeps one {@link DistanceKernel} per (distance criterion, resolution) pair so that sweeps over many dose
 * criteria build each kernel only once. Safe for use by multiple threads.
 */
public class DistanceKernelCache {
    protected static final Logger logger = LogManager.getLogger();

    private static class Key {
        private final double dta;
        private final double resolution;

        private Key(double dta, double resolution) {
            this.dta = dta;
            this.resolution = resolution;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Key key = (Key) o;
            return Double.compare(key.dta, dta) == 0 &&
                    Double.compare(key.resolution, resolution) == 0;
        }

        @Override
        public int hashCode() {
            return Objects.hash(dta, resolution);
        }

        @Override
        public String toString() {
            return "dta=" + dta + ", resolution=" + resolution;
        }
    }

    private final ConcurrentMap<Key, DistanceKernel> kernels = new ConcurrentHashMap<>();

    public DistanceKernel get(double dta, double resolution) {
        Key key = new Key(dta, resolution);
        DistanceKernel kernel = kernels.get(key);

        if (kernel != null) {
            logger.trace("kernel cache hit for {}", key);
            return kernel;
        }

        logger.trace("kernel cache miss for {}", key);
        return kernels.computeIfAbsent(key, k -> DistanceKernel.create(k.dta, k.resolution));
    }

    public int size() {
        return kernels.size();
    }

    public void clear() {
        kernels.clear();
    }
}
