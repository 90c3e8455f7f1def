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

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;

import java.util.ArrayList;
import java.util.List;

public class GammaAnalysisArgs {
    private static final double DEFAULT_CRITERION = 3.0;

    @Parameter(names="--dose-criteria", description="Dose difference criteria in % (for example \"1,2,3\"). Defaults to 3.")
    public List<Double> doseCriteria = new ArrayList<>();

    @Parameter(names="--distance-criteria", description="Distance to agreement criteria in mm (for example \"1,2,3\"). Defaults to 3.")
    public List<Double> distanceCriteria = new ArrayList<>();

    @Parameter(names="--threshold", description="Percentage of the maximum evaluated dose below which reference points are skipped.", arity=1)
    public double threshold = 0.0;

    @Parameter(names="--local", description="Normalise dose differences by the local reference dose instead of the maximum evaluated dose.")
    public boolean local = false;

    @Parameter(names="--resolution", description="Resolution in points/mm at which the evaluated distribution is resampled. If zero, the reference resolution is used.", arity=1)
    public double resolution = 0.0;

    @Parameter(names="--threads", description="Number of threads used for evaluation. One evaluates on the calling thread.", arity=1)
    public int threads = 1;

    public static GammaAnalysisArgs parse(String... argv) {
        GammaAnalysisArgs args = new GammaAnalysisArgs();

        JCommander jcmd = new JCommander();
        jcmd.addObject(args);
        jcmd.parse(argv);

        args.validate();
        return args;
    }

    public void validate() {
        for (double v: getDoseCriteria()) {
            if (!(v > 0) || Double.isInfinite(v)) {
                throw new ParameterException("dose criteria must be positive, got " + v);
            }
        }

        for (double v: getDistanceCriteria()) {
            if (!(v > 0) || Double.isInfinite(v)) {
                throw new ParameterException("distance criteria must be positive, got " + v);
            }
        }

        if (!(threshold >= 0) || Double.isInfinite(threshold)) {
            throw new ParameterException("threshold must be a non-negative percentage, got " + threshold);
        }

        if (!(resolution >= 0) || Double.isInfinite(resolution)) {
            throw new ParameterException("resolution must be positive or zero, got " + resolution);
        }

        if (threads < 1) {
            throw new ParameterException("need at least one thread, got " + threads);
        }
    }

    public double[] getDoseCriteria() {
        return toArray(doseCriteria);
    }

    public double[] getDistanceCriteria() {
        return toArray(distanceCriteria);
    }

    private static double[] toArray(List<Double> values) {
        if (values == null || values.isEmpty()) {
            return new double[]{DEFAULT_CRITERION};
        }

        double[] output = new double[values.size()];
        for (int i = 0; i < output.length; i++) {
            output[i] = values.get(i);
        }

        return output;
    }
}
