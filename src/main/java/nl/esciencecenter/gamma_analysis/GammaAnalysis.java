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
package nl.esciencecenter.gamma_analysis;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import nl.esciencecenter.gamma_analysis.kernels.distance.DistanceKernel;
import nl.esciencecenter.gamma_analysis.kernels.distance.DistanceKernelCache;
import nl.esciencecenter.gamma_analysis.kernels.gamma.GammaEvaluation;
import nl.esciencecenter.gamma_analysis.kernels.gamma.GammaResult;
import nl.esciencecenter.gamma_analysis.kernels.resample.GridResampler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Entry point for gamma evaluations between a reference and an evaluated distribution.
 *
 * Distance kernels are cached across calls. With more than one thread, rows of a single evaluation and
 * criterion pairs of a sweep are processed concurrently; results are identical to a single threaded run.
 * Call {@link #cleanup()} when done to stop the worker threads.
 */
public class GammaAnalysis {
    protected static final Logger logger = LogManager.getLogger();

    private final DistanceKernelCache kernels;
    private final Optional<ThreadPoolExecutor> executor;
    private final int threads;

    static ThreadPoolExecutor newFixedThreadPool(String nameFormat, int size) {
        ThreadFactory factory = new ThreadFactoryBuilder().setNameFormat(nameFormat).build();
        return new ThreadPoolExecutor(size, size, 0, TimeUnit.SECONDS, new LinkedBlockingQueue<>(), factory);
    }

    public GammaAnalysis() {
        this(1);
    }

    public GammaAnalysis(GammaAnalysisArgs args) {
        this(args.threads);
    }

    /**
     * @param threads number of worker threads; one or less evaluates on the calling thread
     */
    public GammaAnalysis(int threads) {
        this.threads = Math.max(1, threads);
        this.kernels = new DistanceKernelCache();
        this.executor = this.threads > 1
                ? Optional.of(newFixedThreadPool("gamma-%d", this.threads))
                : Optional.empty();
    }

    public DistanceKernelCache getKernelCache() {
        return kernels;
    }

    /**
     * Computes the gamma index of every reference point and the overall pass rate.
     *
     * @param reference         distribution the gamma map is computed for, typically a measurement
     * @param evaluated         distribution searched for agreement, sampled at an integer multiple of the
     *                          reference resolution, typically the planned dose resampled onto the reference grid
     * @param doseCriterion     dose difference criterion, in %
     * @param distanceCriterion distance to agreement criterion, in mm
     * @param threshold         percentage of the maximum evaluated dose below which points are skipped
     * @param local             perform a local evaluation instead of a global (Van Dyk) one
     */
    public GammaResult evaluate(Distribution reference, Distribution evaluated, double doseCriterion,
                                double distanceCriterion, double threshold, boolean local) {
        GammaEvaluation evaluation = new GammaEvaluation(reference, evaluated);
        DistanceKernel kernel = kernels.get(distanceCriterion, evaluated.getResolution());
        evaluation.checkArguments(doseCriterion, kernel, threshold);

        int rows = reference.getRows();
        double[] output = new double[reference.getDimension().size()];

        if (executor.isEmpty()) {
            evaluation.applyCPU(doseCriterion, kernel, threshold, local, 0, rows, output);
        } else {
            List<Callable<Void>> tasks = new ArrayList<>();
            int bands = Math.min(rows, 4 * threads);

            for (int b = 0; b < bands; b++) {
                int rowBegin = (int) ((long) rows * b / bands);
                int rowEnd = (int) ((long) rows * (b + 1) / bands);

                tasks.add(() -> {
                    evaluation.applyCPU(doseCriterion, kernel, threshold, local, rowBegin, rowEnd, output);
                    return null;
                });
            }

            invokeAll(tasks);
        }

        GammaResult result = new GammaResult(new Distribution(output, reference.getResolution(), reference.getGrid()));
        logger.debug("gamma {}%/{} mm ({}): {} of {} points pass", doseCriterion, distanceCriterion,
                local ? "local" : "global", result.getPassingCount(), result.getCountableCount());
        return result;
    }

    /**
     * Computes the pass rate for every combination of dose and distance criteria without keeping gamma maps.
     * Each distance kernel is built once and reused for all dose criteria.
     *
     * @return pass rates in %, indexed [dose criterion][distance criterion]
     */
    public double[][] evaluatePassRates(Distribution reference, Distribution evaluated, double[] doseCriteria,
                                        double[] distanceCriteria, double threshold, boolean local) {
        if (doseCriteria.length == 0 || distanceCriteria.length == 0) {
            throw new IllegalArgumentException("need at least one dose and one distance criterion");
        }

        GammaEvaluation evaluation = new GammaEvaluation(reference, evaluated);

        // All kernels exist before any evaluation reads them
        DistanceKernel[] distanceKernels = new DistanceKernel[distanceCriteria.length];
        for (int x = 0; x < distanceCriteria.length; x++) {
            distanceKernels[x] = kernels.get(distanceCriteria[x], evaluated.getResolution());

            for (double doseCriterion : doseCriteria) {
                evaluation.checkArguments(doseCriterion, distanceKernels[x], threshold);
            }
        }

        double[][] passRates = new double[doseCriteria.length][distanceCriteria.length];

        if (executor.isEmpty()) {
            for (int x = 0; x < distanceCriteria.length; x++) {
                for (int y = 0; y < doseCriteria.length; y++) {
                    passRates[y][x] = evaluation.countCPU(doseCriteria[y], distanceKernels[x], threshold, local);
                }
            }
        } else {
            List<Callable<Void>> tasks = new ArrayList<>();

            for (int x = 0; x < distanceCriteria.length; x++) {
                for (int y = 0; y < doseCriteria.length; y++) {
                    int xi = x;
                    int yi = y;

                    tasks.add(() -> {
                        passRates[yi][xi] = evaluation.countCPU(doseCriteria[yi], distanceKernels[xi], threshold, local);
                        return null;
                    });
                }
            }

            invokeAll(tasks);
        }

        logger.debug("evaluated {} dose x {} distance criteria ({})", doseCriteria.length, distanceCriteria.length,
                local ? "local" : "global");
        return passRates;
    }

    public double[][] evaluatePassRates(Distribution reference, Distribution evaluated, double doseCriterion,
                                        double distanceCriterion, double threshold, boolean local) {
        return evaluatePassRates(reference, evaluated, new double[]{doseCriterion},
                new double[]{distanceCriterion}, threshold, local);
    }

    /**
     * Resamples the evaluated distribution onto the reference grid at the configured resolution and computes the
     * pass rates of the configured criteria.
     *
     * @return pass rates in %, indexed [dose criterion][distance criterion]
     */
    public double[][] compare(Distribution reference, Distribution evaluated, GammaAnalysisArgs args) {
        args.validate();

        Distribution aligned = GridResampler.applyCPU(evaluated, reference, args.resolution);
        return evaluatePassRates(reference, aligned, args.getDoseCriteria(), args.getDistanceCriteria(),
                args.threshold, args.local);
    }

    private void invokeAll(List<Callable<Void>> tasks) {
        List<Future<Void>> futures;

        try {
            futures = executor.get().invokeAll(tasks);

            for (Future<Void> future: futures) {
                future.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while waiting for gamma evaluation", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();

            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            } else if (cause instanceof Error) {
                throw (Error) cause;
            }

            throw new IllegalStateException("gamma evaluation failed", cause);
        }
    }

    public void cleanup() {
        executor.ifPresent(ThreadPoolExecutor::shutdown);
    }
}
