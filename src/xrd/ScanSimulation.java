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
 * the outcome of one virtual scan: the truth it was generated from and what the probe saw.
 */
public class ScanSimulation {
	/** the grid the truth was sampled on */
	public final Grid fineGrid;
	/** the operator that turned the truth into readings */
	public final Matrix fineOperator;
	private final double[] truth;
	private final double[] centers;
	private final double[] clean;
	private final double[] noisy;

	ScanSimulation(Grid fineGrid, Matrix fineOperator, double[] truth,
	               double[] centers, double[] clean, double[] noisy) {
		if (truth.length != fineGrid.size())
			throw new ShapeMismatchException(fineGrid.size(), truth.length, "ground truth");
		if (clean.length != centers.length)
			throw new ShapeMismatchException(centers.length, clean.length, "clean measurements");
		if (noisy.length != centers.length)
			throw new ShapeMismatchException(centers.length, noisy.length, "noisy measurements");
		this.fineGrid = fineGrid;
		this.fineOperator = fineOperator;
		this.truth = truth.clone();
		this.centers = centers.clone();
		this.clean = clean.clone();
		this.noisy = noisy.clone();
	}

	/** @return the true stress at each fine grid node (MPa) */
	public double[] getTruth() {
		return truth.clone();
	}

	/** @return the beam center of each measurement (mm) */
	public double[] getCenters() {
		return centers.clone();
	}

	/** @return the noiseless readings (MPa) */
	public double[] getCleanMeasurements() {
		return clean.clone();
	}

	/** @return the readings with noise (MPa) */
	public double[] getMeasurements() {
		return noisy.clone();
	}

	public int numMeasurements() {
		return centers.length;
	}
}
