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
import java.util.Comparator;

/**
 * turns a curve that was digitized in normalized units (distance in spot radii, stress in units of
 * some reference stress) into a profile in millimeters and megapascals.
 */
public class ProfileCalibration {

	/**
	 * what the sign of the reference stress means.
	 */
	public enum SignConvention {
		/**
		 * only the magnitude of the reference stress counts; the digitized curve carries the sign.
		 * a curve drawn dipping to -1 with a reference of -400 MPa reaches -400 MPa.
		 */
		MAGNITUDE,
		/**
		 * the reference stress multiplies the curve as is.  a curve drawn dipping to -1 with a
		 * reference of -400 MPa reaches +400 MPa.
		 */
		SIGNED
	}

	private final double spotRadius;
	private final double referenceStress;
	private final SignConvention convention;

	/**
	 * @param spotRadius the spot radius r_spot that a normalized distance of 1 corresponds to (mm)
	 * @param referenceStress the reference stress σ_ref (MPa)
	 * @param convention how to treat the sign of σ_ref
	 */
	public ProfileCalibration(double spotRadius, double referenceStress, SignConvention convention) {
		this.spotRadius = InvalidConfigurationException.requirePositive(spotRadius, "spot radius");
		if (!Double.isFinite(referenceStress))
			throw new InvalidConfigurationException("the reference stress must be finite.");
		this.referenceStress = referenceStress;
		if (convention == null)
			throw new InvalidConfigurationException("no sign convention was given.");
		this.convention = convention;
	}

	/**
	 * @return the factor by which normalized stresses are multiplied (MPa)
	 */
	public double stressScale() {
		switch (convention) {
			case MAGNITUDE:
				return Math.abs(referenceStress);
			case SIGNED:
				return referenceStress;
			default:
				throw new IllegalArgumentException("unrecognized convention: "+convention);
		}
	}

	/**
	 * scale a set of digitized points into a profile.  the points may come in any order.
	 * @param points pairs of (r/r_spot, σ/σ_ref)
	 * @param method how to interpolate between the scaled points
	 * @throws InvalidConfigurationException if there are fewer than two points
	 */
	public TabulatedProfile calibrate(double[][] points, InterpolationMethod method) {
		if (points.length < 2)
			throw new InvalidConfigurationException(
					"you need to select at least two points, not "+points.length+".");
		double[][] sorted = new double[points.length][];
		for (int i = 0; i < points.length; i ++) {
			if (points[i].length != 2)
				throw new ShapeMismatchException(2, points[i].length, "digitized point");
			sorted[i] = points[i].clone();
		}
		Arrays.sort(sorted, Comparator.comparingDouble(point -> point[0]));

		double scale = this.stressScale();
		double[] x = new double[sorted.length];
		double[] y = new double[sorted.length];
		for (int i = 0; i < sorted.length; i ++) {
			x[i] = sorted[i][0]*spotRadius;
			y[i] = sorted[i][1]*scale;
		}
		return new TabulatedProfile(x, y, method);
	}
}
