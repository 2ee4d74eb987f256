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

import java.util.Arrays;

/**
 * a set of evenly spaced positions covering the half-open interval [0, length).  the profile is
 * discretized onto one of these, once finely to fake the measurements, and once more coarsely to
 * reconstruct it.
 */
public class Grid {
	/** the distance between adjacent nodes (mm) */
	public final double dx;
	/** the position of each node (mm) */
	private final double[] x;

	/**
	 * lay out nodes at 0, dx, 2dx, … up to but not including length.
	 * @param length the length of the scanned region (mm)
	 * @param dx the spacing between nodes (mm)
	 * @throws InvalidConfigurationException if either argument isn't positive or if fewer than two
	 *                                       nodes would fit
	 */
	public Grid(double length, double dx) {
		InvalidConfigurationException.requirePositive(length, "grid length");
		InvalidConfigurationException.requirePositive(dx, "grid spacing");
		this.dx = dx;
		this.x = Math2.arange(0, length, dx);
		if (this.x.length < 2)
			throw new InvalidConfigurationException(String.format(
					"a grid over %.4g mm with a spacing of %.4g mm would have %d node(s); it needs at least 2.",
					length, dx, this.x.length));
	}

	/**
	 * @return the number of nodes
	 */
	public int size() {
		return this.x.length;
	}

	public double get(int i) {
		return this.x[i];
	}

	/**
	 * @return a copy of all of the node positions
	 */
	public double[] getPositions() {
		return this.x.clone();
	}

	/**
	 * @return the index of the node closest to the given position, clamped onto the grid
	 */
	public int nearestIndex(double position) {
		long i = Math.round(position/this.dx);
		return (int) Math.max(0, Math.min(this.size() - 1, i));
	}

	/**
	 * sample a profile at every node of this grid.
	 * @throws ShapeMismatchException if the profile returns the rong number of values
	 */
	public double[] sample(ContinuousProfile profile) {
		double[] values = profile.evaluate(this.getPositions());
		if (values.length != this.size())
			throw new ShapeMismatchException(this.size(), values.length, "profile sampling");
		return values;
	}

	@Override
	public String toString() {
		return String.format("Grid(%d nodes, dx=%.4g mm)", this.size(), this.dx);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof Grid)) return false;
		Grid that = (Grid) o;
		return this.dx == that.dx && Arrays.equals(this.x, that.x);
	}

	@Override
	public int hashCode() {
		return 31*Double.hashCode(dx) + Arrays.hashCode(x);
	}
}
