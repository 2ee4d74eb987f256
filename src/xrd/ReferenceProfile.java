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
 * the radial residual stress left by a laser shock peening spot, as a sum of three gaussians in
 * normalized units: a broad compressive bowl, a sharp compressive ring just past the spot edge, and
 * a small tensile rebound further out.  it is scaled to physical units by the spot radius and a
 * reference stress.
 */
public class ReferenceProfile implements ContinuousProfile {
	private final double spotRadius;
	private final double referenceStress;

	/**
	 * @param spotRadius the radius of the peening spot (mm)
	 * @param referenceStress the stress that a normalized value of 1 corresponds to (MPa)
	 */
	public ReferenceProfile(double spotRadius, double referenceStress) {
		this.spotRadius = InvalidConfigurationException.requirePositive(spotRadius, "spot radius");
		if (!Double.isFinite(referenceStress))
			throw new InvalidConfigurationException("the reference stress must be finite.");
		this.referenceStress = referenceStress;
	}

	/**
	 * the normalized curve, σ/σ_ref as a function of r/r_spot
	 */
	public static double normalized(double u) {
		double t1 = -0.38*Math.exp(-Math.pow(u - 0.00, 2)/(2*1.2*1.2));
		double t2 = -0.75*Math.exp(-Math.pow(u - 1.05, 2)/(2*0.35*0.35));
		double t3 =  0.12*Math.exp(-Math.pow(u - 2.60, 2)/(2*0.7*0.7));
		return t1 + t2 + t3;
	}

	@Override
	public double[] evaluate(double[] positions) {
		double[] stress = new double[positions.length];
		for (int i = 0; i < positions.length; i ++)
			stress[i] = referenceStress*normalized(positions[i]/spotRadius);
		return stress;
	}
}
