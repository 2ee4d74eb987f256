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
 * thrown when a scan is configured in a way that makes no physical sense: a beam with no width,
 * an overlap so big that the probe never moves, a grid with fewer than two nodes, and so on.
 */
public class InvalidConfigurationException extends IllegalArgumentException {
	public InvalidConfigurationException(String message) {
		super(message);
	}

	public InvalidConfigurationException(String message, Throwable cause) {
		super(message, cause);
	}

	/**
	 * throw an InvalidConfigurationException unless the value is strictly positive (and finite).
	 * @return the value, for convenience
	 */
	static double requirePositive(double value, String name) {
		if (!(value > 0) || Double.isInfinite(value))
			throw new InvalidConfigurationException(String.format(
					"the %s must be positive, not %s.", name, value));
		return value;
	}

	/**
	 * throw an InvalidConfigurationException unless the value is zero or positive (and finite).
	 * @return the value, for convenience
	 */
	static double requireNonnegative(double value, String name) {
		if (!(value >= 0) || Double.isInfinite(value))
			throw new InvalidConfigurationException(String.format(
					"the %s must not be negative, not %s.", name, value));
		return value;
	}
}
