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

/**
 * a profile recovered from a set of measurements, along with what it took to get it.
 */
public class Reconstruction {
	/** the grid the profile was recovered on */
	public final Grid grid;
	/** the operator that was inverted */
	public final Matrix operator;
	/** the cutoff that was used */
	public final double rcond;
	/** how many singular values survived the cutoff */
	public final int rank;
	private final double[] values;
	private final double[] measurements;
	private final Reconstructor solver;

	Reconstruction(Grid grid, Matrix operator, Reconstructor solver,
	               double[] measurements, double rcond) {
		this.grid = grid;
		this.operator = operator;
		this.solver = solver;
		this.measurements = measurements.clone();
		this.rcond = rcond;
		this.values = solver.solve(this.measurements, rcond);
		this.rank = solver.rank(rcond);
	}

	/** @return the recovered stress at each node (MPa) */
	public double[] getValues() {
		return values.clone();
	}

	/**
	 * @return what the recovered profile would read like, for comparison with the measurements (MPa)
	 */
	public double[] getPredictedMeasurements() {
		return operator.matmul(values).getValues();
	}

	/**
	 * @return the root-mean-square difference between the predicted and actual measurements (MPa)
	 */
	public double residual() {
		return Math2.rms(getPredictedMeasurements(), measurements);
	}

	/**
	 * solve the same measurements again with a different cutoff.  the operator and its
	 * decomposition are reused.
	 */
	public Reconstruction withRcond(double rcond) {
		return new Reconstruction(grid, operator, solver, measurements, rcond);
	}
}
