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
 * the two ways a beam reading can be turned into a weighted average of the profile nodes.
 */
public enum AveragingPolicy {
	/**
	 * every node under the footprint [c - r, c + r] gets the same weight, and the weights in a row
	 * add up to 1.  a beam that covers no nodes gives a row of zeros.
	 */
	WINDOWED_MASK,
	/**
	 * the footprint is sampled at a fixt number of evenly spaced points, each of which is folded
	 * about the origin and dropped onto the nearest node.  the profile is symmetric about x = 0, so
	 * the part of the beam that hangs off the left edge reads the stress on the rite side.  samples
	 * that land on the same node add up, so rows near the origin may not sum to 1.
	 */
	REFLECTIVE_SYMMETRY;

	/**
	 * read a policy from a configuration value.  "A" and "windowed" mean {@link #WINDOWED_MASK};
	 * "B" and "reflective" mean {@link #REFLECTIVE_SYMMETRY}.  the enum names themselves also work.
	 * @throws InvalidConfigurationException if the name isn't one of those
	 */
	public static AveragingPolicy parse(String name) {
		switch (name.trim().toLowerCase().replace('-', '_')) {
			case "a":
			case "windowed":
			case "windowed_mask":
				return WINDOWED_MASK;
			case "b":
			case "reflective":
			case "reflective_symmetry":
				return REFLECTIVE_SYMMETRY;
			default:
				throw new InvalidConfigurationException(
						"the averaging policy '"+name+"' is not one I kno (try A or B).");
		}
	}
}
