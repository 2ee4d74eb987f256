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

import static org.junit.jupiter.api.Assertions.*;

public class GridTest {

	@Test
	void coversTheHalfOpenInterval() {
		Grid grid = new Grid(3.5, 0.25);
		assertEquals(14, grid.size());
		assertEquals(0, grid.get(0));
		assertEquals(3.25, grid.get(13), 1e-12);
		assertEquals(0.25, grid.dx);
	}

	@Test
	void roundoffDoesNotAddANodeAtTheEnd() {
		assertEquals(700, new Grid(3.5, 0.005).size());
		assertEquals(35, new Grid(3.5, 0.1).size());
		assertEquals(10, new Grid(1.0, 0.1).size());
	}

	@Test
	void nearestIndexClampsOntoTheGrid() {
		Grid grid = new Grid(1.0, 0.1);
		assertEquals(0, grid.nearestIndex(-3));
		assertEquals(3, grid.nearestIndex(0.31));
		assertEquals(9, grid.nearestIndex(7));
	}

	@Test
	void positionsAreACopy() {
		Grid grid = new Grid(1.0, 0.5);
		grid.getPositions()[0] = 12;
		assertEquals(0, grid.get(0));
	}

	@Test
	void samplingChecksTheProfileLength() {
		Grid grid = new Grid(1.0, 0.25);
		assertArrayEquals(new double[] {0, 0.5, 1.0, 1.5}, grid.sample(x -> {
			double[] y = new double[x.length];
			for (int i = 0; i < x.length; i ++)
				y[i] = 2*x[i];
			return y;
		}), 1e-12);
		assertThrows(ShapeMismatchException.class, () -> grid.sample(x -> new double[1]));
	}

	@Test
	void needsAtLeastTwoNodes() {
		assertThrows(InvalidConfigurationException.class, () -> new Grid(1.0, 1.0));
		assertThrows(InvalidConfigurationException.class, () -> new Grid(1.0, 0));
		assertThrows(InvalidConfigurationException.class, () -> new Grid(0, 0.1));
		assertThrows(InvalidConfigurationException.class, () -> new Grid(-1.0, 0.1));
	}
}
