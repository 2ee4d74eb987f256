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

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class ReconstructorTest {

	@Test
	void squareFullRankOperatorRecoversAConstantExactly() {
		// one node per beam center: 14 beams, 14 nodes
		Grid grid = new Grid(3.5, 0.25);
		double[] centers = MeasurementPlanner.centers(0.5, 0.5, 3.5);
		Matrix operator = ForwardOperatorBuilder.build(grid, centers, 0.5, AveragingPolicy.REFLECTIVE_SYMMETRY);
		assertEquals(operator.m, operator.n);

		double[] truth = new double[grid.size()];
		Arrays.fill(truth, -400);
		double[] measurements = MeasurementSimulator.measure(operator, truth, 0, null);
		double[] recovered = Reconstructor.solve(operator, measurements, 0);

		assertEquals(grid.size(), recovered.length);
		for (double value: recovered)
			assertEquals(-400, value, 1e-6);
	}

	@Test
	void identityOperatorIsItsOwnInverse() {
		Grid grid = new Grid(2.0, 0.2);
		double[] centers = MeasurementPlanner.centers(0.2, 0.0, 2.0);
		Matrix operator = ForwardOperatorBuilder.build(grid, centers, 0.2, AveragingPolicy.WINDOWED_MASK);
		assertArrayEquals(Matrix.identity(10).getValues(), operator.getValues());

		double[] measurements = {-400, -380, -350, -300, -200, -100, 0, 50, 80, 60};
		assertArrayEquals(measurements, Reconstructor.solve(operator, measurements, 0), 1e-9);
	}

	@Test
	void rankDeficientSystemsGetTheMinimumNormSolution() {
		Matrix operator = new Matrix(new double[][] {{1, 1}, {1, 1}});
		double[] x = Reconstructor.solve(operator, new double[] {2, 2}, 1e-10);
		assertArrayEquals(new double[] {1, 1}, x, 1e-12);
	}

	@Test
	void underdeterminedSystemsGetTheMinimumNormSolution() {
		Matrix operator = new Matrix(new double[][] {{0.5, 0.5, 0}});
		double[] x = Reconstructor.solve(operator, new double[] {3}, 0);
		assertArrayEquals(new double[] {3, 3, 0}, x, 1e-12);
	}

	@Test
	void overdeterminedSystemsGetTheLeastSquaresSolution() {
		Matrix operator = new Matrix(new double[][] {{1}, {1}, {1}});
		double[] x = Reconstructor.solve(operator, new double[] {1, 2, 6}, 0);
		assertArrayEquals(new double[] {3}, x, 1e-12);
	}

	@Test
	void zeroOperatorGivesZeros() {
		Matrix operator = Matrix.zeros(3, 5);
		double[] x = Reconstructor.solve(operator, new double[] {1, 2, 3}, 0.05);
		assertArrayEquals(new double[5], x);
		assertEquals(0, new Reconstructor(operator).rank(0));
	}

	@Test
	void cutoffDropsTheSmallSingularValues() {
		Matrix operator = new Matrix(new double[][] {{10, 0, 0}, {0, 1, 0}, {0, 0, 0.01}});
		Reconstructor solver = new Reconstructor(operator);
		assertArrayEquals(new double[] {10, 1, 0.01}, solver.getSingularValues(), 1e-12);
		assertEquals(3, solver.rank(0));
		assertEquals(2, solver.rank(0.01));
		assertEquals(1, solver.rank(0.5));
		assertEquals(1000, solver.conditionNumber(), 1e-6);

		double[] b = {10, 1, 0.01};
		assertArrayEquals(new double[] {1, 1, 1}, solver.solve(b, 0), 1e-9);
		assertArrayEquals(new double[] {1, 1, 0}, solver.solve(b, 0.01), 1e-9);
		assertArrayEquals(new double[] {1, 0, 0}, solver.solve(b, 0.5), 1e-9);
	}

	@Test
	void degenerateCoverageStaysFinite() {
		// no overlap and a fine reconstruction grid leaves plenty of nodes that no beam sees
		Grid grid = new Grid(3.5, 0.01);
		double[] centers = MeasurementPlanner.centers(0.5, 0.0, 3.5);
		for (AveragingPolicy policy: AveragingPolicy.values()) {
			Matrix operator = ForwardOperatorBuilder.build(grid, centers, 0.5, policy);
			double[] measurements = new double[centers.length];
			for (int i = 0; i < measurements.length; i ++)
				measurements[i] = -400 + 37*Math.sin(i);
			double[] x = Reconstructor.solve(operator, measurements, 0.05);
			assertEquals(grid.size(), x.length);
			assertTrue(Math2.allFinite(x), policy.toString());
		}
	}

	@Test
	void mismatchedMeasurementsAreRejected() {
		Matrix operator = Matrix.identity(4);
		assertThrows(ShapeMismatchException.class, () -> Reconstructor.solve(operator, new double[3], 0.05));
		assertThrows(ShapeMismatchException.class, () -> new Reconstructor(operator).solve(new double[5], 0.05));
		assertThrows(InvalidConfigurationException.class, () -> new Reconstructor(operator).solve(new double[4], -1));
	}
}
