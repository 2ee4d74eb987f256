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

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;

import java.util.logging.Logger;

/**
 * inverts a forward operator by truncated singular value decomposition.  the operator is decomposed
 * once when this is built, so the same measurements can be solved again with a different cutoff for
 * next to nothing.
 */
public class Reconstructor {

	private static final Logger logger = Logger.getLogger("root");

	private final int m;
	private final int n;
	/** the singular values, largest first */
	private final double[] σ;
	/** the left singular vectors, one per collum (m×p) */
	private final RealMatrix U;
	/** the rite singular vectors, one per collum (n×p) */
	private final RealMatrix V;

	/**
	 * decompose the operator.  an operator with no nonzero elements at all is allowd; every solution
	 * to it is zero.
	 * @param operator the forward operator built on the reconstruction grid
	 */
	public Reconstructor(Matrix operator) {
		this.m = operator.m;
		this.n = operator.n;
		if (operator.emptyRows().size() == operator.m) {
			this.σ = new double[0];
			this.U = null;
			this.V = null;
		}
		else {
			SingularValueDecomposition svd = new SingularValueDecomposition(operator.toRealMatrix());
			this.σ = svd.getSingularValues();
			this.U = svd.getU();
			this.V = svd.getV();
		}
	}

	/**
	 * solve the operator against one set of measurements, in one go.
	 * @see #solve(double[], double)
	 */
	public static double[] solve(Matrix operator, double[] measurements, double rcond) {
		if (operator.m != measurements.length)
			throw new ShapeMismatchException(operator.m, measurements.length, "reconstruction");
		return new Reconstructor(operator).solve(measurements, rcond);
	}

	/**
	 * find the x of least norm that minimizes |A x - b|, ignoring every singular value that is no
	 * bigger than rcond times the largest one.  singular and rank-deficient operators are fine; that's
	 * what the cutoff is for.
	 * @param measurements the noisy beam readings b (MPa)
	 * @param rcond the relative cutoff; 0 gives the plain least-squares solution
	 * @return the profile at each node of the reconstruction grid (MPa)
	 * @throws ShapeMismatchException if there isn't one measurement per operator row
	 * @throws InvalidConfigurationException if rcond is negative
	 */
	public double[] solve(double[] measurements, double rcond) {
		if (measurements.length != this.m)
			throw new ShapeMismatchException(this.m, measurements.length, "reconstruction");
		InvalidConfigurationException.requireNonnegative(rcond, "rcond");

		double[] x = new double[this.n];
		int rank = this.rank(rcond);
		for (int k = 0; k < rank; k ++) {
			double[] u_k = this.U.getColumn(k);
			double projection = 0; // project b onto the kth mode
			for (int i = 0; i < this.m; i ++)
				projection += u_k[i]*measurements[i];
			double coefficient = projection/this.σ[k];
			for (int j = 0; j < this.n; j ++)
				x[j] += coefficient*this.V.getEntry(j, k);
		}
		logger.fine(String.format("kept %d of %d singular values with rcond = %.3g", rank, σ.length, rcond));
		return x;
	}

	/**
	 * @return the number of singular values that survive the cutoff
	 */
	public int rank(double rcond) {
		if (this.σ.length == 0 || this.σ[0] == 0)
			return 0;
		double threshold = rcond*this.σ[0];
		int rank = 0;
		while (rank < this.σ.length && this.σ[rank] > threshold)
			rank ++;
		return rank;
	}

	/**
	 * @return a copy of the singular values, largest first
	 */
	public double[] getSingularValues() {
		return this.σ.clone();
	}

	/**
	 * @return the ratio of the largest singular value to the smallest (infinite if any is zero or
	 * the operator is wider than it is tall)
	 */
	public double conditionNumber() {
		if (this.σ.length < Math.min(this.m, this.n) || this.σ.length == 0)
			return Double.POSITIVE_INFINITY;
		if (this.m < this.n || this.σ[this.σ.length - 1] == 0)
			return Double.POSITIVE_INFINITY;
		return this.σ[0]/this.σ[this.σ.length - 1];
	}
}
