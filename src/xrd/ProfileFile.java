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
import java.io.IOException;

/**
 * saves and loads tabulated profiles.  the file is plain text: the first line is the interpolation
 * method tag (e.g. <code>natural-cubic</code>), the second is a column header, and every line after
 * that is a knot, ritten <code>position_mm,stress_MPa</code>.
 */
public class ProfileFile {

	public static final String HEADER = "position_mm,stress_MPa";

	/**
	 * @throws MissingInputException if the file doesn't exist or can't be read or parsed
	 * @throws InvalidConfigurationException if the file reads fine but the table in it is no good
	 */
	public static TabulatedProfile read(File file) throws MissingInputException {
		if (!file.isFile())
			throw new MissingInputException("the profile file "+file+" does not exist.  digitize one first.");
		String tag;
		double[][] table;
		try {
			tag = CSV.readFirstLine(file);
			table = CSV.read(file, ',', 2);
		} catch (IOException | NumberFormatException e) {
			throw new MissingInputException("the profile file "+file+" could not be read.", e);
		}
		if (tag == null || tag.isBlank())
			throw new MissingInputException("the profile file "+file+" is empty.");

		double[] knots = new double[table.length];
		double[] values = new double[table.length];
		for (int i = 0; i < table.length; i ++) {
			if (table[i].length != 2)
				throw new ShapeMismatchException(2, table[i].length, "knot on line "+(i + 3)+" of "+file);
			knots[i] = table[i][0];
			values[i] = table[i][1];
		}
		return new TabulatedProfile(knots, values, InterpolationMethod.parse(tag));
	}

	/**
	 * @throws IOException if the file cannot be ritten
	 */
	public static void write(TabulatedProfile profile, File file) throws IOException {
		double[] knots = profile.getKnots();
		double[] values = profile.getValues();
		double[][] table = new double[knots.length][];
		for (int i = 0; i < knots.length; i ++)
			table[i] = new double[] {knots[i], values[i]};
		CSV.write(table, file, ',', profile.getMethod().tag, HEADER);
	}
}
