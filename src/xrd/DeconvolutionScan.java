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

import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.util.Properties;
import java.util.logging.Logger;

import static xrd.Math2.containsTheWordTest;

/**
 * run a virtual XRD surface scan of a residual stress profile and deconvolve it.
 */
public class DeconvolutionScan {

	private static final Logger logger = Logger.getLogger("root");

	/** the tabulated profile to scan */
	public static final String PROFILE = "profile";
	/** the directory where the results and the log go */
	public static final String OUTPUT = "output";
	/** the spot radius used to scale the reference curve in a test run (mm) */
	public static final String SPOT_RADIUS = "spot_radius_mm";
	/** the reference stress used to scale the reference curve in a test run (MPa) */
	public static final String REFERENCE_STRESS = "reference_stress_MPa";
	/** how the sign of the reference stress is treated, "magnitude" or "signed" */
	public static final String SIGN_CONVENTION = "sign_convention";

	/**
	 * read the arguments into a single set of properties.  an argument of the form key=value sets
	 * that key; any other argument (besides "test") is the path of a properties file, whose keys
	 * are overridden by the key=value arguments wherever they come.
	 * @throws MissingInputException if a properties file can't be read
	 */
	static Properties parseArguments(String[] args) throws MissingInputException {
		Properties fromFile = new Properties();
		Properties fromArgs = new Properties();
		for (String arg: args) {
			if (arg.equalsIgnoreCase("test"))
				continue;
			int equals = arg.indexOf('=');
			if (equals > 0) {
				fromArgs.setProperty(arg.substring(0, equals).trim(), arg.substring(equals + 1).trim());
			}
			else {
				try (Reader in = new FileReader(arg)) {
					fromFile.load(in);
				} catch (IOException e) {
					throw new MissingInputException("the configuration file "+arg+" could not be read.", e);
				}
			}
		}
		Properties properties = new Properties();
		properties.putAll(fromFile);
		properties.putAll(fromArgs);
		return properties;
	}

	/**
	 * digitize the reference curve at evenly spaced points and scale it the same way a hand-digitized
	 * curve would be, so that a test run goes thru the whole calibration.
	 */
	static TabulatedProfile referenceProfile(Properties properties) {
		double spotRadius, referenceStress;
		ProfileCalibration.SignConvention convention;
		try {
			spotRadius = Double.parseDouble(properties.getProperty(SPOT_RADIUS, "1.75"));
			referenceStress = Double.parseDouble(properties.getProperty(REFERENCE_STRESS, "-400"));
			convention = ProfileCalibration.SignConvention.valueOf(
					properties.getProperty(SIGN_CONVENTION, "magnitude").trim().toUpperCase());
		} catch (IllegalArgumentException e) {
			throw new InvalidConfigurationException("the reference curve settings could not be parsed.", e);
		}
		double[] u = Math2.linspace(0, 4.0, 41);
		double[][] points = new double[u.length][];
		for (int i = 0; i < u.length; i ++)
			points[i] = new double[] {u[i], ReferenceProfile.normalized(u[i])};
		return new ProfileCalibration(spotRadius, referenceStress, convention)
				.calibrate(points, InterpolationMethod.NATURAL_CUBIC);
	}

	/**
	 * @param args a properties file and/or key=value pairs (see {@link ScanConfig} for the keys, plus
	 *             "profile" and "output").  if one of the arguments is "test", the reference LSP
	 *             curve is scanned insted of a profile file.
	 * @throws IOException if the profile or configuration can't be read or the results can't be ritten
	 */
	public static void main(String[] args) throws IOException {
		boolean testing = containsTheWordTest(args);
		Properties properties = parseArguments(args);
		File output = new File(properties.getProperty(OUTPUT, "results"));

		Logging.configureLogger(logger, testing ? "scan-test" : "scan", output);
		logger.info("starting...");

		ScanConfig config = ScanConfig.fromProperties(properties);
		logger.info(config.toString());

		TabulatedProfile profile;
		if (testing) {
			profile = referenceProfile(properties);
			ProfileFile.write(profile, new File(output, "profile.csv"));
		}
		else {
			String filename = properties.getProperty(PROFILE);
			if (filename == null)
				throw new MissingInputException("please specify the profile to scan with profile=<file>, or run a test.");
			profile = ProfileFile.read(new File(filename));
		}
		logger.info(String.format("loaded a %s profile with %d knots over [%.4g, %.4g] mm",
		                          profile.getMethod().tag, profile.getKnots().length,
		                          profile.getDomain()[0], profile.getDomain()[1]));
		if (profile.getDomain()[1] < config.scanLength)
			logger.warning(String.format("the profile only goes out to %.4g mm; past that it will be held constant.",
			                             profile.getDomain()[1]));

		ScanExperiment experiment = new ScanExperiment(config);
		ScanSimulation simulation = experiment.simulate(profile, experiment.newRandom());
		Reconstruction reconstruction = experiment.reconstruct(simulation);
		logger.info(String.format("the reconstruction is off from the truth by %.4g MPa (rms)",
		                          ScanExperiment.rmsError(simulation, reconstruction)));

		CSV.writeColumns(new File(output, "truth.csv"),
		                 new String[] {"position_mm", "stress_MPa"},
		                 simulation.fineGrid.getPositions(), simulation.getTruth());
		CSV.writeColumns(new File(output, "measurements.csv"),
		                 new String[] {"center_mm", "clean_MPa", "measured_MPa"},
		                 simulation.getCenters(), simulation.getCleanMeasurements(), simulation.getMeasurements());
		CSV.writeColumns(new File(output, "reconstruction.csv"),
		                 new String[] {"position_mm", "stress_MPa"},
		                 reconstruction.grid.getPositions(), reconstruction.getValues());
		logger.info("saved the results to "+output);
	}
}
