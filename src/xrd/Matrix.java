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

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;

import java.util.ArrayList;
import java.util.List;

/**
 * a row-major matrix whose rows can be sparse or dense.  once built, it is never changed; if any
 * of the things it was derived from change, build a new one.
 */
public class Matrix {
	/** the number of rows */
	public final int m;
	/** the number of collums */
	public final int n;
	/** the data */
	private final Vector[] rows;

	/**
	 * generate a new matrix by giving dimensions and a list of rows.  the rows are copied, so the
	 * caller is free to keep changing them.
	 */
	public Matrix(int m, int n, Vector[] rows) {
		this.m = m;
		if (rows.length != m)
			throw new IllegalArgumentException("the height doesn’t match the data.");
		this.n = n;
		this.rows = new Vector[m];
		for (int i = 0; i < m; i ++) {
			if (rows[i].getLength() != n)
				throw new IllegalArgumentException("do not accept jagged arrays.");
			this.rows[i] = rows[i].copy();
		}
	}

	/**
	 * generate a new matrix by specifying all of its values explicitly.
	 */
	public Matrix(double[][] values) {
		this.m = values.length;
		if (this.m == 0)
			throw new IllegalArgumentException("a matrix needs at least one row.");
		this.n = values[0].length;
		this.rows = new Vector[values.length];
		for (int i = 0; i < values.length; i ++) {
			if (values[i].length != n)
				throw new IllegalArgumentException("do not accept jagged arrays.");
			this.rows[i] = new DenseVector(values[i].clone());
		}
	}

	/**
	 * generate an identity matrix.
	 */
	public static Matrix identity(int n) {
		Vector[] rows = new Vector[n];
		for (int i = 0; i < n; i ++)
			rows[i] = new SparseVector(n, i, 1.);
		return new Matrix(n, n, rows);
	}

	/**
	 * generate a zero matrix.
	 */
	public static Matrix zeros(int m, int n) {
		Vector[] rows = new Vector[m];
		for (int i = 0; i < m; i ++)
			rows[i] = new SparseVector(n);
		return new Matrix(m, n, rows);
	}

	public Vector matmul(double... v) {
		return this.matmul(new DenseVector(v));
	}

	public Vector matmul(Vector v) {
		if (v.getLength() != this.n)
			throw new ShapeMismatchException(this.n, v.getLength(), "matrix-vector product");
		double[] product = new double[this.m];
		for (int i = 0; i < this.m; i ++)
			product[i] = this.rows[i].dot(v);
		return new DenseVector(product);
	}

	/**
	 * @return the sum of each row
	 */
	public double[] rowSums() {
		double[] sums = new double[this.m];
		for (int i = 0; i < this.m; i ++)
			sums[i] = this.rows[i].sum();
		return sums;
	}

	/**
	 * @return the indices of the rows that have no nonzero elements
	 */
	public List<Integer> emptyRows() {
		List<Integer> empty = new ArrayList<>();
		for (int i = 0; i < this.m; i ++)
			if (this.rows[i].isZero())
				empty.add(i);
		return empty;
	}

	/**
	 * @return the indices of the collums that are zero in every row
	 */
	public List<Integer> emptyColumns() {
		boolean[] covered = new boolean[this.n];
		for (Vector row: this.rows)
			for (int j: row.nonzero())
				covered[j] = true;
		List<Integer> empty = new ArrayList<>();
		for (int j = 0; j < this.n; j ++)
			if (!covered[j])
				empty.add(j);
		return empty;
	}

	public double get(int i, int j) {
		return this.rows[i].get(j);
	}

	/**
	 * @return a copy of the ith row
	 */
	public Vector getRow(int i) {
		return this.rows[i].copy();
	}

	public Vector getColumn(int j) {
		Vector result = new SparseVector(this.m);
		for (int i = 0; i < this.m; i ++)
			result.set(i, this.get(i, j));
		return result;
	}

	public double[][] getValues() {
		double[][] values = new double[this.m][];
		for (int i = 0; i < this.m; i ++)
			values[i] = this.rows[i].copy().getValues();
		return values;
	}

	/**
	 * copy this into the dense format that the commons-math decompositions take.
	 */
	public RealMatrix toRealMatrix() {
		return new Array2DRowRealMatrix(this.getValues(), false);
	}

	@Override
	public String toString() {
		if (this.m*this.n < 1000) {
			StringBuilder s = new StringBuilder(String.format("Matrix %d×%d [\n  ", m, n));
			for (int i = 0; i < this.m; i++) {
				for (int j = 0; j < this.n; j++) {
					s.append(String.format("%8.4g", this.get(i, j)));
					s.append("  ");
				}
				s.append("\n  ");
			}
			return s.toString();
		}
		else {
			return String.format("Matrix %d×%d [ … ]", m, n);
		}
	}

}
