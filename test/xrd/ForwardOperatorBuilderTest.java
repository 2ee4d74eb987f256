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

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class ForwardOperatorBuilderTest {

	private static final double BEAM = 0.5;
	private static final double LENGTH = 3.5;

	private static double[] benchCenters() {
		return MeasurementPlanner.centers(BEAM, 0.5, LENGTH);
	}

	private static double[] constant(int length, double value) {
		double[] values = new double[length];
		Arrays.fill(values, value);
		return values;
	}

	@Nested
	class WindowedMask {

		@Test
		void rowsSumToOneOrZero() {
			for (double dx: new double[] {0.005, 0.05, 0.1, 0.3, 0.7}) {
				Grid grid = new Grid(LENGTH, dx);
				Matrix operator = ForwardOperatorBuilder.build(
						grid, benchCenters(), BEAM, AveragingPolicy.WINDOWED_MASK);
				double[] sums = operator.rowSums();
				for (int i = 0; i < operator.m; i ++) {
					if (operator.getRow(i).isZero())
						assertEquals(0, sums[i]);
					else
						assertEquals(1, sums[i], 1e-12, "row "+i+" at dx = "+dx);
				}
			}
		}

		@Test
		void weightsAreUniformUnderTheFootprint() {
			Grid grid = new Grid(2.0, 0.1);
			Matrix operator = ForwardOperatorBuilder.build(
					grid, new double[] {1.05}, 0.5, AveragingPolicy.WINDOWED_MASK);
			// [0.8, 1.3] holds the nodes 0.8 … 1.3 (0.8 and 1.3 are a bit off in floating point, so only check the middle)
			for (int j = 9; j <= 12; j ++)
				assertEquals(operator.get(0, 9), operator.get(0, j));
			assertEquals(0, operator.get(0, 0));
			assertEquals(0, operator.get(0, 19));
		}

		@Test
		void beamNarrowerThanTheSpacingCanMissEverything() {
			Grid grid = new Grid(2.0, 0.5);
			Matrix operator = ForwardOperatorBuilder.build(
					grid, new double[] {0.0, 0.2, 0.5}, 0.1, AveragingPolicy.WINDOWED_MASK);
			assertEquals(1.0, operator.get(0, 0));
			assertTrue(operator.getRow(1).isZero());
			assertEquals(1.0, operator.get(2, 1));
			assertEquals(java.util.List.of(1), operator.emptyRows());
		}

		@Test
		void constantProfileReadsTheSameEverywhere() {
			Grid grid = new Grid(LENGTH, 0.005);
			Matrix operator = ForwardOperatorBuilder.build(
					grid, benchCenters(), BEAM, AveragingPolicy.WINDOWED_MASK);
			double[] clean = MeasurementSimulator.clean(operator, constant(grid.size(), -400));
			for (double reading: clean)
				assertEquals(-400, reading, 1e-9);
		}
	}

	@Nested
	class ReflectiveSymmetry {

		@Test
		void mirroredSamplesLandOnTheSameNode() {
			assertEquals(ForwardOperatorBuilder.foldedIndex(-0.1, 0.1),
			             ForwardOperatorBuilder.foldedIndex(0.1, 0.1));
			assertEquals(1, ForwardOperatorBuilder.foldedIndex(-0.1, 0.1));

			// a 0.2 mm beam at the origin samples -0.1 and +0.1, which both fold onto node 1
			Grid grid = new Grid(1.0, 0.1);
			Matrix operator = ForwardOperatorBuilder.build(
					grid, new double[] {0.0}, 0.2, AveragingPolicy.REFLECTIVE_SYMMETRY);
			assertEquals(0, operator.get(0, 0));
			assertEquals(1.0, operator.get(0, 1), 1e-15);
			assertEquals(1, operator.getRow(0).nonzero().size());
		}

		@Test
		void foldedWeightsAccumulate() {
			Grid grid = new Grid(LENGTH, 0.25);
			Matrix operator = ForwardOperatorBuilder.build(
					grid, benchCenters(), BEAM, AveragingPolicy.REFLECTIVE_SYMMETRY);
			// two samples per beam: c - 0.25 and c + 0.25
			assertEquals(1.0, operator.get(0, 1));
			assertEquals(0.5, operator.get(1, 0));
			assertEquals(0.5, operator.get(1, 2));
			// the last beam hangs off the end of the grid and loses half its weight
			assertEquals(0.5, operator.rowSums()[13]);
		}

		@Test
		void pointsPerBeamFollowsTheTargetGrid() {
			assertEquals(100, ForwardOperatorBuilder.pointsPerBeam(0.5, 0.005));
			assertEquals(5, ForwardOperatorBuilder.pointsPerBeam(0.5, 0.1));
			assertEquals(1, ForwardOperatorBuilder.pointsPerBeam(0.5, 2.0));
			assertEquals(2, ForwardOperatorBuilder.pointsPerBeam(0.5, 0.2)); // 2.5 rounds to even
		}

		@Test
		void constantProfileReadsTheSameAwayFromTheFarEnd() {
			Grid grid = new Grid(LENGTH, 0.005);
			double[] centers = benchCenters();
			Matrix operator = ForwardOperatorBuilder.build(
					grid, centers, BEAM, AveragingPolicy.REFLECTIVE_SYMMETRY);
			double[] clean = MeasurementSimulator.clean(operator, constant(grid.size(), -400));
			for (int i = 0; i < centers.length; i ++)
				if (centers[i] + BEAM/2 < LENGTH - grid.dx)
					assertEquals(-400, clean[i], 1e-9, "beam at "+centers[i]);
		}

		@Test
		void wideSpacingLeavesNodesUncovered() {
			Grid grid = new Grid(LENGTH, 0.01);
			Matrix operator = ForwardOperatorBuilder.build(
					grid, MeasurementPlanner.centers(BEAM, 0.0, LENGTH), BEAM,
					AveragingPolicy.REFLECTIVE_SYMMETRY);
			assertEquals(50, ForwardOperatorBuilder.pointsPerBeam(BEAM, grid.dx));
			assertTrue(operator.emptyColumns().size() > 0);
		}
	}

	@Test
	void resolutionOnlyChangesTheColumns() {
		double[] centers = benchCenters();
		for (AveragingPolicy policy: AveragingPolicy.values()) {
			for (double dx: new double[] {0.02, 0.05, 0.1, 0.25}) {
				Grid grid = new Grid(LENGTH, dx);
				Matrix operator = ForwardOperatorBuilder.build(grid, centers, BEAM, policy);
				assertEquals(centers.length, operator.m);
				assertEquals(grid.size(), operator.n);
			}
		}
	}

	@Test
	void threadsGiveTheSameOperator() {
		Grid grid = new Grid(LENGTH, 0.005);
		for (AveragingPolicy policy: AveragingPolicy.values()) {
			Matrix sequential = ForwardOperatorBuilder.build(grid, benchCenters(), BEAM, policy, 1);
			Matrix parallel = ForwardOperatorBuilder.build(grid, benchCenters(), BEAM, policy, 4);
			assertArrayEquals(sequential.getValues(), parallel.getValues());
		}
	}

	@Test
	void rejectsBadInputs() {
		Grid grid = new Grid(LENGTH, 0.1);
		assertThrows(InvalidConfigurationException.class, () -> ForwardOperatorBuilder.build(
				grid, benchCenters(), 0, AveragingPolicy.WINDOWED_MASK));
		assertThrows(InvalidConfigurationException.class, () -> ForwardOperatorBuilder.build(
				grid, new double[0], BEAM, AveragingPolicy.WINDOWED_MASK));
		assertThrows(InvalidConfigurationException.class, () -> ForwardOperatorBuilder.build(
				null, benchCenters(), BEAM, AveragingPolicy.REFLECTIVE_SYMMETRY));
		assertThrows(InvalidConfigurationException.class, () -> ForwardOperatorBuilder.build(
				grid, benchCenters(), BEAM, null));
	}

	@Test
	void policyNamesParse() {
		assertEquals(AveragingPolicy.WINDOWED_MASK, AveragingPolicy.parse("A"));
		assertEquals(AveragingPolicy.WINDOWED_MASK, AveragingPolicy.parse("windowed"));
		assertEquals(AveragingPolicy.REFLECTIVE_SYMMETRY, AveragingPolicy.parse("b"));
		assertEquals(AveragingPolicy.REFLECTIVE_SYMMETRY, AveragingPolicy.parse("REFLECTIVE_SYMMETRY"));
		assertThrows(InvalidConfigurationException.class, () -> AveragingPolicy.parse("gaussian"));
	}
}
