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

import java.util.Set;

/**
 * a list of numbers that can be added, scaled, and dotted with other lists of numbers.
 * the operator rows and the measurement vectors are all Vectors.
 */
public abstract class Vector {
	public abstract Vector plus(Vector that);

	public Vector minus(Vector that) {
		return this.plus(that.times(-1));
	}

	public abstract Vector times(double scalar);

	public abstract double dot(Vector that);

	/**
	 * @return the sum of all of the elements
	 */
	public abstract double sum();

	public boolean isZero() {
		return this.nonzero().isEmpty();
	}

	public abstract Set<Integer> nonzero();

	public abstract int getLength();

	public abstract double get(int i);

	public abstract void set(int i, double value);

	/**
	 * add a value to one element in place.
	 */
	public void increment(int i, double value) {
		this.set(i, this.get(i) + value);
	}

	public abstract double[] getValues();

	public abstract Vector copy();

	@Override
	public String toString() {
		StringBuilder s = new StringBuilder("[");
		for (int i = 0; i < this.getLength(); i ++)
			s.append(String.format("  %8.4g", this.get(i)));
		s.append(" ]");
		return s.toString();
	}
}
