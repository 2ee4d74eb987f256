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
import org.apache.commons.math3.random.Well19937c;
import org.apache.commons.math3.stat.StatUtils;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class MeasurementSimulatorTest {

	private static Matrix benchOperator(Grid grid) {
		return ForwardOperatorBuilder.build(
				grid, MeasurementPlanner.centers(0.5, 0.5, 3.5), 0.5, AveragingPolicy.WINDOWED_MASK);
	}

	@Test
	void noNoiseMeansNoPerturbation() {
		Grid grid = new Grid(3.5, 0.01);
		double[] truth = new ReferenceProfile(1.75, 400).evaluate(grid.getPositions());
		Matrix operator = benchOperator(grid);

		RandomGenerator random = new Well19937c(7);
		double[] clean = MeasurementSimulator.clean(operator, truth);
		double[] noisy = MeasurementSimulator.addNoise(clean, 0, random);
		assertArrayEquals(clean, noisy);
		assertNotSame(clean, noisy);
		// and the random source was left alone
		assertEquals(new Well19937c(7).nextDouble(), random.nextDouble());
	}

	@Test
	void sameSeedSameNoise() {
		Grid grid = new Grid(3.5, 0.01);
		double[] truth = new ReferenceProfile(1.75, 400).evaluate(grid.getPositions());
		Matrix operator = benchOperator(grid);
		double[] first = MeasurementSimulator.measure(operator, truth, 15, new Well19937c(42));
		double[] second = MeasurementSimulator.measure(operator, truth, 15, new Well19937c(42));
		double[] third = MeasurementSimulator.measure(operator, truth, 15, new Well19937c(43));
		assertArrayEquals(first, second);
		assertFalse(java.util.Arrays.equals(first, third));
	}

	@Test
	void noiseHasTheRequestedSpread() {
		double[] clean = new double[20_000];
		double[] noisy = MeasurementSimulator.addNoise(clean, 15, new Well19937c(1));
		assertEquals(0, StatUtils.mean(noisy), 0.5);
		assertEquals(15, Math.sqrt(StatUtils.variance(noisy)), 0.5);
	}

	@Test
	void cleanMeasurementsAreTheOperatorTimesTheTruth() {
		Matrix operator = new Matrix(new double[][] {{0.5, 0.5, 0}, {0, 0.5, 0.5}});
		assertArrayEquals(new double[] {-300, -100},
		                  MeasurementSimulator.clean(operator, new double[] {-400, -200, 0}), 1e-12);
	}

	@Test
	void rejectsBadInputs() {
		Matrix operator = Matrix.identity(3);
		assertThrows(ShapeMismatchException.class, () -> MeasurementSimulator.clean(operator, new double[2]));
		assertThrows(InvalidConfigurationException.class,
		             () -> MeasurementSimulator.addNoise(new double[3], -1, new Well19937c(1)));
		assertThrows(IllegalArgumentException.class,
		             () -> MeasurementSimulator.addNoise(new double[3], 1, null));
	}
}
