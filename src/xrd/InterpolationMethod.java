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
 * how a tabulated profile fills in the space between its knots.
 */
public enum InterpolationMethod {
	/** straight lines between the knots */
	LINEAR("linear", 2),
	/** a cubic spline with zero curvature at both ends; thru only two knots it's a straight line */
	NATURAL_CUBIC("natural-cubic", 2);

	/** the name of the method as it's ritten in a profile file */
	public final String tag;
	/** the fewest knots this method can work with */
	public final int minKnots;

	InterpolationMethod(String tag, int minKnots) {
		this.tag = tag;
		this.minKnots = minKnots;
	}

	/**
	 * look up a method by its tag (or its enum name).
	 * @throws InvalidConfigurationException if there's no such method
	 */
	public static InterpolationMethod parse(String tag) {
		String key = tag.trim().toLowerCase().replace('_', '-');
		for (InterpolationMethod method: values())
			if (method.tag.equals(key))
				return method;
		throw new InvalidConfigurationException("the interpolation method '"+tag+"' is not supported.");
	}
}
