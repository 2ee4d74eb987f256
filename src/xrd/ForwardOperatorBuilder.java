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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Logger;

/**
 * builds the matrix that says how a scan sees a profile: row i holds the weights that beam i puts
 * on each grid node.  the same code builds the fine operator used to fake the measurements and the
 * coarse one that gets inverted.
 */
public class ForwardOperatorBuilder {

	private static final Logger logger = Logger.getLogger("root");

	/**
	 * build the forward operator on a single thread.
	 * @see #build(Grid, double[], double, AveragingPolicy, int)
	 */
	public static Matrix build(Grid grid, double[] centers, double beamDiameter,
	                           AveragingPolicy policy) {
		return build(grid, centers, beamDiameter, policy, 1);
	}

	/**
	 * build the forward operator.  the rows don't depend on each other, so they may be filld in on
	 * several threads; the result is the same either way.
	 * @param grid the nodes on which the profile is discretized
	 * @param centers the beam center of each measurement (mm)
	 * @param beamDiameter the diameter of the beam footprint (mm)
	 * @param policy how a footprint is averaged over the nodes
	 * @param numThreads how many threads to use (1 means do it all here)
	 * @return a centers.length × grid.size() matrix with sparse rows
	 * @throws InvalidConfigurationException if the beam has no width or there's nothing to build
	 */
	public static Matrix build(Grid grid, double[] centers, double beamDiameter,
	                           AveragingPolicy policy, int numThreads) {
		InvalidConfigurationException.requirePositive(beamDiameter, "beam diameter");
		if (grid == null || grid.size() == 0)
			throw new InvalidConfigurationException("the target grid is empty.");
		if (centers == null || centers.length == 0)
			throw new InvalidConfigurationException("there are no measurement centers.");
		if (policy == null)
			throw new InvalidConfigurationException("no averaging policy was given.");

		final int pointsPerBeam = pointsPerBeam(beamDiameter, grid.dx);
		final Vector[] rows = new Vector[centers.length];

		if (numThreads <= 1) {
			for (int i = 0; i < centers.length; i ++)
				rows[i] = buildRow(grid, centers[i], beamDiameter, policy, pointsPerBeam);
		}
		else {
			ExecutorService threads = Executors.newFixedThreadPool(
					Math.min(numThreads, centers.length));
			List<Future<Void>> results = new ArrayList<>(centers.length);
			for (int i_task = 0; i_task < centers.length; i_task ++) {
				final int i = i_task; // each task writes only its own row
				Callable<Void> task = () -> {
					rows[i] = buildRow(grid, centers[i], beamDiameter, policy, pointsPerBeam);
					return null;
				};
				results.add(threads.submit(task));
			}
			threads.shutdown(); // lock the Executor
			try {
				for (Future<Void> result: results)
					result.get(); // let all the threads finish, and pass on anything they threw
			} catch (InterruptedException ex) {
				threads.shutdownNow();
				Thread.currentThread().interrupt();
				throw new RuntimeException("the operator build was interrupted.", ex);
			} catch (ExecutionException ex) {
				threads.shutdownNow();
				if (ex.getCause() instanceof RuntimeException)
					throw (RuntimeException) ex.getCause();
				throw new RuntimeException("a row of the operator could not be built.", ex.getCause());
			}
		}

		Matrix operator = new Matrix(centers.length, grid.size(), rows);
		List<Integer> empty = operator.emptyRows();
		if (!empty.isEmpty())
			logger.warning(String.format(
					"%d of %d beams cover no node of %s (rows %s); the solve will have to make do.",
					empty.size(), centers.length, grid, empty));
		return operator;
	}

	/**
	 * compute the weights of one beam.
	 */
	static SparseVector buildRow(Grid grid, double center, double beamDiameter,
	                             AveragingPolicy policy, int pointsPerBeam) {
		switch (policy) {
			case WINDOWED_MASK:
				return windowedRow(grid, center, beamDiameter/2.);
			case REFLECTIVE_SYMMETRY:
				return reflectiveRow(grid, center, beamDiameter, pointsPerBeam);
			default:
				throw new IllegalArgumentException("unrecognized policy: "+policy);
		}
	}

	/**
	 * put an equal weight on every node in [center - radius, center + radius].
	 */
	static SparseVector windowedRow(Grid grid, double center, double radius) {
		double lower = center - radius, upper = center + radius;
		// only look at the nodes near the footprint; the exact test below decides the edges
		int start = (int) Math.max(0, Math.floor(lower/grid.dx) - 1);
		int end = (int) Math.min(grid.size() - 1, Math.ceil(upper/grid.dx) + 1);
		List<Integer> covered = new ArrayList<>();
		for (int j = start; j <= end; j ++)
			if (grid.get(j) >= lower && grid.get(j) <= upper)
				covered.add(j);

		SparseVector row = new SparseVector(grid.size());
		for (int j: covered)
			row.set(j, 1./covered.size());
		return row;
	}

	/**
	 * sample the footprint at evenly spaced points, fold each one about the origin, and add its
	 * weight to the nearest node.
	 */
	static SparseVector reflectiveRow(Grid grid, double center, double beamDiameter, int pointsPerBeam) {
		double weight = 1./pointsPerBeam;
		double start = center - beamDiameter/2.;
		SparseVector row = new SparseVector(grid.size());
		for (double p: Math2.linspace(start, start + beamDiameter, pointsPerBeam)) {
			long j = foldedIndex(p, grid.dx);
			if (j >= 0 && j < grid.size())
				row.increment((int) j, weight);
		}
		return row;
	}

	/**
	 * @return the number of samples per footprint for the reflective policy, which is the number of
	 * grid spacings in a beam diameter (but at least 1)
	 */
	static int pointsPerBeam(double beamDiameter, double dx) {
		return (int) Math.max(1, Math2.roundHalfEven(beamDiameter/dx));
	}

	/**
	 * @return the index of the node nearest to |p|.  it may be past the end of the grid.
	 */
	static long foldedIndex(double p, double dx) {
		return Math2.roundHalfEven(Math.abs(p)/dx);
	}
}
