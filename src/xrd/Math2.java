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
 * a file with some useful numerical analysis stuff.
 *
 * @author Justin Kunimune
 */
public class Math2 {

	/** how far a ratio may be from a whole number while still counting as that whole number */
	private static final double ROUNDOFF_TOLERANCE = 1e-9;

	public static double sum(double[] arr) {
		double s = 0;
		for (double x: arr)
			s += x;
		return s;
	}

	/**
	 * the root-mean-square difference between two arrays of the same length
	 */
	public static double rms(double[] a, double[] b) {
		if (a.length != b.length)
			throw new ShapeMismatchException(a.length, b.length, "rms difference");
		if (a.length == 0)
			return 0;
		double s = 0;
		for (int i = 0; i < a.length; i ++)
			s += (a[i] - b[i])*(a[i] - b[i]);
		return Math.sqrt(s/a.length);
	}

	/**
	 * count the values <code>start + i*step</code> that are less than <code>stop</code>.  when
	 * (stop - start)/step comes out a hair above a whole number because of roundoff, it is taken to
	 * be that whole number, so that <code>stop</code> itself is never counted.
	 */
	public static int arangeLength(double start, double stop, double step) {
		if (!(step > 0))
			throw new IllegalArgumentException("the step must be positive, not "+step);
		if (stop <= start)
			return 0;
		double ratio = (stop - start)/step;
		long whole = Math.round(ratio);
		if (Math.abs(ratio - whole) <= ROUNDOFF_TOLERANCE*Math.max(1, whole))
			return (int) whole;
		else
			return (int) Math.ceil(ratio);
	}

	/**
	 * the values <code>start, start + step, start + 2*step, …</code> that are less than
	 * <code>stop</code>.  each value is computed by multiplication rather than accumulation so
	 * the roundoff doesn't grow along the array.
	 */
	public static double[] arange(double start, double stop, double step) {
		double[] values = new double[arangeLength(start, stop, step)];
		for (int i = 0; i < values.length; i ++)
			values[i] = start + i*step;
		return values;
	}

	/**
	 * n evenly spaced values from start to end, both ends included.  a single value sits at start.
	 */
	public static double[] linspace(double start, double end, int n) {
		if (n < 1)
			throw new IllegalArgumentException("I can't make "+n+" points.");
		double[] values = new double[n];
		if (n == 1) {
			values[0] = start;
			return values;
		}
		double step = (end - start)/(n - 1);
		for (int i = 0; i < n; i ++)
			values[i] = start + i*step;
		values[n - 1] = end;
		return values;
	}

	/**
	 * round to the nearest integer, breaking ties toward the even one.
	 */
	public static long roundHalfEven(double x) {
		return (long) Math.rint(x);
	}

	public static boolean allFinite(double[] arr) {
		for (double x: arr)
			if (!Double.isFinite(x))
				return false;
		return true;
	}

	/**
	 * look for the word "test" among the command-line arguments
	 */
	public static boolean containsTheWordTest(String[] args) {
		for (String arg: args)
			if (arg.equalsIgnoreCase("test"))
				return true;
		return false;
	}

}
