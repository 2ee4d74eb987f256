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

import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.interpolation.SplineInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;

/**
 * a profile given as a table of knots and an interpolation method, rather than as a formula.  this
 * is the form in which digitized curves are saved and loaded (see {@link ProfileFile}: the method
 * tag, a header, and then one position,stress row per knot).  past either end of the table, the
 * profile holds the value of the nearest knot; it does not extrapolate the end segments.
 */
public class TabulatedProfile implements ContinuousProfile {
	private final double[] knots;
	private final double[] values;
	private final InterpolationMethod method;
	private final PolynomialSplineFunction function;

	/**
	 * @param knots the positions of the knots (mm); they must strictly increase
	 * @param values the stress at each knot (MPa)
	 * @param method how to interpolate between them
	 * @throws ShapeMismatchException if there isn't one value per knot
	 * @throws InvalidConfigurationException if there are too few knots for the method, or they
	 *                                       aren't strictly increasing and finite
	 */
	public TabulatedProfile(double[] knots, double[] values, InterpolationMethod method) {
		if (knots.length != values.length)
			throw new ShapeMismatchException(knots.length, values.length, "tabulated profile");
		if (knots.length < method.minKnots)
			throw new InvalidConfigurationException(String.format(
					"%s interpolation needs at least %d knots, not %d.", method.tag, method.minKnots, knots.length));
		if (!Math2.allFinite(knots) || !Math2.allFinite(values))
			throw new InvalidConfigurationException("the knots and values must all be finite.");
		for (int i = 1; i < knots.length; i ++)
			if (knots[i] <= knots[i-1])
				throw new InvalidConfigurationException(String.format(
						"the knots must always increase, but %.4g comes after %.4g.", knots[i], knots[i-1]));

		this.knots = knots.clone();
		this.values = values.clone();
		this.method = method;
		switch (method) {
			case LINEAR:
				this.function = new LinearInterpolator().interpolate(this.knots, this.values);
				break;
			case NATURAL_CUBIC:
				if (this.knots.length == 2) // commons won't spline fewer than 3 points
					this.function = new LinearInterpolator().interpolate(this.knots, this.values);
				else
					this.function = new SplineInterpolator().interpolate(this.knots, this.values);
				break;
			default:
				throw new IllegalArgumentException("unrecognized method: "+method);
		}
	}

	@Override
	public double[] evaluate(double[] positions) {
		double[] stress = new double[positions.length];
		for (int i = 0; i < positions.length; i ++)
			stress[i] = this.evaluate(positions[i]);
		return stress;
	}

	public double evaluate(double position) {
		if (position <= knots[0])
			return values[0];
		else if (position >= knots[knots.length - 1])
			return values[values.length - 1];
		else
			return function.value(position);
	}

	public double[] getKnots() {
		return knots.clone();
	}

	public double[] getValues() {
		return values.clone();
	}

	public InterpolationMethod getMethod() {
		return method;
	}

	/**
	 * @return the range of positions the table was ritten for (mm)
	 */
	public double[] getDomain() {
		return new double[] {knots[0], knots[knots.length - 1]};
	}
}
