/**
 * MIT License
 * <p>
 * Copyright (c) 2022 Justin Kunimune
 * <p>
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 * <p>
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 * <p>
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package xrd;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

import java.util.logging.Logger;

/**
 * the whole virtual experiment: sample the truth on a fine grid, scan it, and then try to get it
 * back on a coarser one.  each step only depends on what's passd to it, so steps can be rerun (with
 * a different cutoff, say) without redoing the ones before.
 */
public class ScanExperiment {

	private static final Logger logger = Logger.getLogger("root");

	public final ScanConfig config;

	public ScanExperiment(ScanConfig config) {
		this.config = config;
	}

	/**
	 * @return a random source seeded from the configuration, or from the clock if it has no seed
	 */
	public RandomGenerator newRandom() {
		return (config.seed != null) ? new Well19937c(config.seed) : new Well19937c();
	}

	public Grid fineGrid() {
		return new Grid(config.scanLength, config.fineResolution);
	}

	public Grid reconGrid() {
		return new Grid(config.scanLength, config.reconResolution);
	}

	public double[] centers() {
		return MeasurementPlanner.centers(config);
	}

	/**
	 * scan a profile.
	 * @param profile the true stress profile
	 * @param random the source of the measurement noise
	 */
	public ScanSimulation simulate(ContinuousProfile profile, RandomGenerator random) {
		Grid grid = fineGrid();
		double[] centers = centers();
		logger.info(String.format("building the simulation operator (%d beams over %s)...",
		                          centers.length, grid));
		Matrix operator = ForwardOperatorBuilder.build(
				grid, centers, config.beamDiameter, config.policy, config.threads);
		double[] truth = grid.sample(profile);
		double[] clean = MeasurementSimulator.clean(operator, truth);
		double[] noisy = MeasurementSimulator.addNoise(clean, config.noiseStdDev, random);
		logger.info(String.format("generated %d measurements.", noisy.length));
		return new ScanSimulation(grid, operator, truth, centers, clean, noisy);
	}

	/**
	 * recover the profile from a scan using the configured cutoff.
	 */
	public Reconstruction reconstruct(ScanSimulation simulation) {
		return reconstruct(simulation, config.rcond);
	}

	/**
	 * recover the profile from a scan on the reconstruction grid.
	 * @param simulation the scan whose noisy measurements are to be inverted
	 * @param rcond the relative singular value cutoff
	 */
	public Reconstruction reconstruct(ScanSimulation simulation, double rcond) {
		Grid grid = reconGrid();
		logger.info(String.format("building the reconstruction operator (%s)...", grid));
		Matrix operator = ForwardOperatorBuilder.build(
				grid, simulation.getCenters(), config.beamDiameter, config.policy, config.threads);
		logger.info("solving the inverse problem...");
		Reconstruction reconstruction = new Reconstruction(
				grid, operator, new Reconstructor(operator), simulation.getMeasurements(), rcond);
		logger.info(String.format("kept %d singular values (rcond = %.3g); the measurement residual is %.4g MPa.",
		                          reconstruction.rank, rcond, reconstruction.residual()));
		return reconstruction;
	}

	/**
	 * compare a reconstruction to the truth it came from, at the reconstruction nodes.  the truth is
	 * taken at the nearest fine node.
	 * @return the root-mean-square error (MPa)
	 */
	public static double rmsError(ScanSimulation simulation, Reconstruction reconstruction) {
		double[] truth = simulation.getTruth();
		double[] expected = new double[reconstruction.grid.size()];
		for (int j = 0; j < expected.length; j ++)
			expected[j] = truth[simulation.fineGrid.nearestIndex(reconstruction.grid.get(j))];
		return Math2.rms(reconstruction.getValues(), expected);
	}
}
