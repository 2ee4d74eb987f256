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
 * works out where the probe stops during a scan.
 */
public class MeasurementPlanner {

	/**
	 * step the beam along the surface from the origin.  successive centers are one beam diameter
	 * apart, less the overlap.
	 * @param beamDiameter the diameter of the beam footprint (mm)
	 * @param overlapRatio the fraction of the footprint shared by successive measurements, in [0, 1)
	 * @param scanLength the length of the scanned region (mm); no center sits at or beyond it
	 * @return the beam centers (mm), starting at 0 and strictly increasing
	 * @throws InvalidConfigurationException if the beam has no width, if the overlap is outside
	 *                                       [0, 1), or if the scan length isn't positive
	 */
	public static double[] centers(double beamDiameter, double overlapRatio, double scanLength) {
		InvalidConfigurationException.requirePositive(beamDiameter, "beam diameter");
		InvalidConfigurationException.requirePositive(scanLength, "scan length");
		if (!(overlapRatio >= 0) || !(overlapRatio < 1))
			throw new InvalidConfigurationException(
					"the overlap ratio must be in [0, 1), not "+overlapRatio+".");
		double step = stepSize(beamDiameter, overlapRatio);
		if (!(step > 0))
			throw new InvalidConfigurationException(String.format(
					"a %.4g mm beam with %.4g overlap never moves.", beamDiameter, overlapRatio));
		return Math2.arange(0, scanLength, step);
	}

	/**
	 * @return the distance the probe moves between measurements (mm)
	 */
	public static double stepSize(double beamDiameter, double overlapRatio) {
		return beamDiameter*(1 - overlapRatio);
	}

	/**
	 * the measurement centers of a configured scan.
	 */
	public static double[] centers(ScanConfig config) {
		return centers(config.beamDiameter, config.overlapRatio, config.scanLength);
	}
}
