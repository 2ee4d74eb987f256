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

import java.util.Locale;
import java.util.Properties;

/**
 * everything that describes one virtual scan: the probe, the noise, the region, and the two grid
 * resolutions.  these are fixt once the scan is set up; to try something different, make a new
 * one (see {@link #withRcond(double)} and {@link #withReconResolution(double)}).
 */
public class ScanConfig {
	public static final String BEAM_DIAMETER = "beam_diameter_mm";
	public static final String OVERLAP_RATIO = "overlap_ratio";
	public static final String NOISE_STD_DEV = "noise_std_dev";
	public static final String SCAN_LENGTH = "scan_length_mm";
	public static final String FINE_RESOLUTION = "fine_resolution_mm";
	public static final String RECON_RESOLUTION = "recon_resolution_mm";
	public static final String RCOND = "rcond";
	public static final String POLICY = "policy";
	public static final String SEED = "seed";
	public static final String THREADS = "threads";

	/** the diameter of the beam footprint (mm) */
	public final double beamDiameter;
	/** the fraction of the footprint shared by successive measurements */
	public final double overlapRatio;
	/** the standard deviation of the measurement noise (MPa) */
	public final double noiseStdDev;
	/** the length of the scanned region (mm) */
	public final double scanLength;
	/** the node spacing of the grid used to fake the measurements (mm) */
	public final double fineResolution;
	/** the node spacing of the grid on which the profile is reconstructed (mm) */
	public final double reconResolution;
	/** singular values below this fraction of the largest are thrown out */
	public final double rcond;
	public final AveragingPolicy policy;
	/** the seed for the measurement noise, or null to seed it from the clock */
	public final Long seed;
	/** how many threads to use when building operators */
	public final int threads;

	/**
	 * @throws InvalidConfigurationException if any value is out of its allowd range
	 */
	public ScanConfig(double beamDiameter, double overlapRatio, double noiseStdDev,
	                  double scanLength, double fineResolution, double reconResolution,
	                  double rcond, AveragingPolicy policy, Long seed, int threads) {
		this.beamDiameter = InvalidConfigurationException.requirePositive(beamDiameter, "beam diameter");
		if (!(overlapRatio >= 0) || !(overlapRatio < 1))
			throw new InvalidConfigurationException(
					"the overlap ratio must be in [0, 1), not "+overlapRatio+".");
		this.overlapRatio = overlapRatio;
		this.noiseStdDev = InvalidConfigurationException.requireNonnegative(noiseStdDev, "noise standard deviation");
		this.scanLength = InvalidConfigurationException.requirePositive(scanLength, "scan length");
		this.fineResolution = InvalidConfigurationException.requirePositive(fineResolution, "fine resolution");
		this.reconResolution = InvalidConfigurationException.requirePositive(reconResolution, "reconstruction resolution");
		this.rcond = InvalidConfigurationException.requireNonnegative(rcond, "rcond");
		if (policy == null)
			throw new InvalidConfigurationException("no averaging policy was given.");
		this.policy = policy;
		this.seed = seed;
		if (threads < 1)
			throw new InvalidConfigurationException("I need at least one thread, not "+threads+".");
		this.threads = threads;
	}

	/**
	 * the scan the original bench experiment used: a 0.5 mm collimator stepping at 50% overlap over
	 * 3.5 mm, with 15 MPa of noise, simulated at 5 μm and reconstructed at 0.1 mm.
	 */
	public static ScanConfig defaults() {
		return new ScanConfig(0.5, 0.5, 15.0, 3.5, 0.005, 0.1,
		                      0.05, AveragingPolicy.REFLECTIVE_SYMMETRY, null, 1);
	}

	/**
	 * read a configuration, using the defaults for any key that isn't set.
	 * @throws InvalidConfigurationException if a value can't be parsed or is out of range
	 */
	public static ScanConfig fromProperties(Properties properties) {
		ScanConfig d = defaults();
		String seed = properties.getProperty(SEED);
		return new ScanConfig(
				parseDouble(properties, BEAM_DIAMETER, d.beamDiameter),
				parseDouble(properties, OVERLAP_RATIO, d.overlapRatio),
				parseDouble(properties, NOISE_STD_DEV, d.noiseStdDev),
				parseDouble(properties, SCAN_LENGTH, d.scanLength),
				parseDouble(properties, FINE_RESOLUTION, d.fineResolution),
				parseDouble(properties, RECON_RESOLUTION, d.reconResolution),
				parseDouble(properties, RCOND, d.rcond),
				properties.containsKey(POLICY) ?
						AveragingPolicy.parse(properties.getProperty(POLICY)) : d.policy,
				(seed == null || seed.isBlank()) ? null : (Long) parseLong(SEED, seed),
				(int) parseLong(THREADS, properties.getProperty(THREADS, Integer.toString(d.threads))));
	}

	private static double parseDouble(Properties properties, String key, double fallback) {
		String value = properties.getProperty(key);
		if (value == null)
			return fallback;
		try {
			return Double.parseDouble(value.trim());
		} catch (NumberFormatException e) {
			throw new InvalidConfigurationException(
					"the value of "+key+" should be a number, not '"+value+"'.", e);
		}
	}

	private static long parseLong(String key, String value) {
		try {
			return Long.parseLong(value.trim());
		} catch (NumberFormatException e) {
			throw new InvalidConfigurationException(
					"the value of "+key+" should be an integer, not '"+value+"'.", e);
		}
	}

	public ScanConfig withRcond(double rcond) {
		return new ScanConfig(beamDiameter, overlapRatio, noiseStdDev, scanLength,
		                      fineResolution, reconResolution, rcond, policy, seed, threads);
	}

	public ScanConfig withReconResolution(double reconResolution) {
		return new ScanConfig(beamDiameter, overlapRatio, noiseStdDev, scanLength,
		                      fineResolution, reconResolution, rcond, policy, seed, threads);
	}

	public ScanConfig withPolicy(AveragingPolicy policy) {
		return new ScanConfig(beamDiameter, overlapRatio, noiseStdDev, scanLength,
		                      fineResolution, reconResolution, rcond, policy, seed, threads);
	}

	/**
	 * write this back out with the same keys {@link #fromProperties(Properties)} reads.
	 */
	public Properties toProperties() {
		Properties properties = new Properties();
		properties.setProperty(BEAM_DIAMETER, Double.toString(beamDiameter));
		properties.setProperty(OVERLAP_RATIO, Double.toString(overlapRatio));
		properties.setProperty(NOISE_STD_DEV, Double.toString(noiseStdDev));
		properties.setProperty(SCAN_LENGTH, Double.toString(scanLength));
		properties.setProperty(FINE_RESOLUTION, Double.toString(fineResolution));
		properties.setProperty(RECON_RESOLUTION, Double.toString(reconResolution));
		properties.setProperty(RCOND, Double.toString(rcond));
		properties.setProperty(POLICY, policy.name());
		if (seed != null)
			properties.setProperty(SEED, Long.toString(seed));
		properties.setProperty(THREADS, Integer.toString(threads));
		return properties;
	}

	@Override
	public String toString() {
		return String.format(Locale.US,
				"ScanConfig(beam=%.4g mm, overlap=%.0f%%, noise=%.4g MPa, length=%.4g mm, " +
				"fine=%.4g mm, recon=%.4g mm, rcond=%.3g, policy=%s, seed=%s)",
				beamDiameter, overlapRatio*100, noiseStdDev, scanLength,
				fineResolution, reconResolution, rcond, policy, seed);
	}
}
