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

import org.apache.commons.math3.random.RandomGenerator;

/**
 * fakes what the diffractometer would read: the beam-averaged truth plus some gaussian noise.
 */
public class MeasurementSimulator {

	/**
	 * @param operator the forward operator built on the grid the profile was sampled on
	 * @param profile the true stress at each node of that grid (MPa)
	 * @return what each beam would read if the instrument were perfect (MPa)
	 * @throws ShapeMismatchException if the profile doesn't have one value per operator collum
	 */
	public static double[] clean(Matrix operator, double[] profile) {
		if (profile.length != operator.n)
			throw new ShapeMismatchException(operator.n, profile.length, "simulated measurement");
		return operator.matmul(profile).getValues();
	}

	/**
	 * add independent gaussian noise to each reading.  if the noise is zero the readings are passd
	 * back unchanged and the random source is not touched.
	 * @param clean the perfect readings (MPa)
	 * @param noiseStdDev the standard deviation of the noise (MPa)
	 * @param random the source of the noise; the caller owns it and decides how it's seeded
	 * @return a new array with the noisy readings
	 */
	public static double[] addNoise(double[] clean, double noiseStdDev, RandomGenerator random) {
		InvalidConfigurationException.requireNonnegative(noiseStdDev, "noise standard deviation");
		double[] noisy = clean.clone();
		if (noiseStdDev == 0)
			return noisy;
		if (random == null)
			throw new IllegalArgumentException("a random source is needed to make noise.");
		for (int i = 0; i < noisy.length; i ++)
			noisy[i] += noiseStdDev*random.nextGaussian();
		return noisy;
	}

	/**
	 * do both: average the truth and add noise.
	 */
	public static double[] measure(Matrix operator, double[] profile,
	                               double noiseStdDev, RandomGenerator random) {
		return addNoise(clean(operator, profile), noiseStdDev, random);
	}
}
