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

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class ScanConfigTest {

	@Test
	void defaultsAreTheBenchExperiment() {
		ScanConfig config = ScanConfig.defaults();
		assertEquals(0.5, config.beamDiameter);
		assertEquals(0.5, config.overlapRatio);
		assertEquals(15.0, config.noiseStdDev);
		assertEquals(3.5, config.scanLength);
		assertEquals(0.005, config.fineResolution);
		assertEquals(0.1, config.reconResolution);
		assertEquals(0.05, config.rcond);
		assertEquals(AveragingPolicy.REFLECTIVE_SYMMETRY, config.policy);
		assertNull(config.seed);
		assertEquals(1, config.threads);
	}

	@Test
	void propertiesOverrideTheDefaults() {
		Properties properties = new Properties();
		properties.setProperty(ScanConfig.BEAM_DIAMETER, "0.3");
		properties.setProperty(ScanConfig.OVERLAP_RATIO, " 0.6 ");
		properties.setProperty(ScanConfig.POLICY, "A");
		properties.setProperty(ScanConfig.SEED, "1234");
		ScanConfig config = ScanConfig.fromProperties(properties);
		assertEquals(0.3, config.beamDiameter);
		assertEquals(0.6, config.overlapRatio);
		assertEquals(AveragingPolicy.WINDOWED_MASK, config.policy);
		assertEquals(1234L, config.seed);
		assertEquals(3.5, config.scanLength);
	}

	@Test
	void propertiesGoBothWays() {
		ScanConfig config = ScanConfig.defaults().withRcond(0.01).withPolicy(AveragingPolicy.WINDOWED_MASK);
		ScanConfig copy = ScanConfig.fromProperties(config.toProperties());
		assertEquals(config.toString(), copy.toString());
	}

	@Test
	void rejectsNonsense() {
		assertThrows(InvalidConfigurationException.class, () -> new ScanConfig(
				0, 0.5, 15, 3.5, 0.005, 0.1, 0.05, AveragingPolicy.WINDOWED_MASK, null, 1));
		assertThrows(InvalidConfigurationException.class, () -> new ScanConfig(
				0.5, 1.0, 15, 3.5, 0.005, 0.1, 0.05, AveragingPolicy.WINDOWED_MASK, null, 1));
		assertThrows(InvalidConfigurationException.class, () -> new ScanConfig(
				0.5, 0.5, -1, 3.5, 0.005, 0.1, 0.05, AveragingPolicy.WINDOWED_MASK, null, 1));
		assertThrows(InvalidConfigurationException.class, () -> new ScanConfig(
				0.5, 0.5, 15, 0, 0.005, 0.1, 0.05, AveragingPolicy.WINDOWED_MASK, null, 1));
		assertThrows(InvalidConfigurationException.class, () -> new ScanConfig(
				0.5, 0.5, 15, 3.5, 0, 0.1, 0.05, AveragingPolicy.WINDOWED_MASK, null, 1));
		assertThrows(InvalidConfigurationException.class, () -> new ScanConfig(
				0.5, 0.5, 15, 3.5, 0.005, -0.1, 0.05, AveragingPolicy.WINDOWED_MASK, null, 1));
		assertThrows(InvalidConfigurationException.class, () -> new ScanConfig(
				0.5, 0.5, 15, 3.5, 0.005, 0.1, -0.05, AveragingPolicy.WINDOWED_MASK, null, 1));
		assertThrows(InvalidConfigurationException.class, () -> new ScanConfig(
				0.5, 0.5, 15, 3.5, 0.005, 0.1, 0.05, null, null, 1));
		assertThrows(InvalidConfigurationException.class, () -> new ScanConfig(
				0.5, 0.5, 15, 3.5, 0.005, 0.1, 0.05, AveragingPolicy.WINDOWED_MASK, null, 0));
	}

	@Test
	void unparseableValuesAreInvalid() {
		Properties properties = new Properties();
		properties.setProperty(ScanConfig.NOISE_STD_DEV, "loud");
		assertThrows(InvalidConfigurationException.class, () -> ScanConfig.fromProperties(properties));
		properties.setProperty(ScanConfig.NOISE_STD_DEV, "15");
		properties.setProperty(ScanConfig.SEED, "1.5");
		assertThrows(InvalidConfigurationException.class, () -> ScanConfig.fromProperties(properties));
	}
}
