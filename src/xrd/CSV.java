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

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.FileReader;
import java.io.FileWriter;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * a class for reading and riting the plain number tables that the scans go in and out as.
 *
 * @author Justin Kunimune
 */
public class CSV {

	/**
	 * read a simple CSV file, with any standard line break character, and return its contents
	 * as a double matrix. elements must be parsable as doubles (or be "nan", "inf", or "-inf").
	 * whitespace adjacent to delimiters will be stripped, and reading stops at the first blank line.
	 * @param file the CSV file to open
	 * @param delimiter the delimiting character, usually ',', sometimes '\t', occasionally '|'
	 * @param headerRows the number of initial rows to skip
	 * @return one array per row
	 * @throws IOException if file cannot be found or permission is denied
	 * @throws NumberFormatException if elements are not parsable as doubles
	 */
	public static double[][] read(File file, char delimiter, int headerRows)
			throws NumberFormatException, IOException {
		List<double[]> list = new ArrayList<>();
		try (BufferedReader in = new BufferedReader(new FileReader(file))) {
			String line;
			for (int i = 0; i < headerRows; i ++)
				in.readLine();
			while ((line = in.readLine()) != null) {
				line = line.trim();
				if (line.isEmpty())
					break;
				String[] elements = line.split("\\s*" + delimiter + "\\s*");
				double[] row = new double[elements.length];
				for (int j = 0; j < elements.length; j++) {
					row[j] = switch (elements[j]) {
						case "nan" -> Double.NaN;
						case "inf" -> Double.POSITIVE_INFINITY;
						case "-inf" -> Double.NEGATIVE_INFINITY;
						default -> Double.parseDouble(elements[j]);
					};
				}
				list.add(row);
			}
		}
		return list.toArray(new double[0][]);
	}

	/**
	 * read the first line of a text file, without the line break.
	 * @return the line, or null if the file is empty
	 * @throws IOException if file cannot be found or permission is denied
	 */
	public static String readFirstLine(File file) throws IOException {
		try (BufferedReader in = new BufferedReader(new FileReader(file))) {
			return in.readLine();
		}
	}

	/**
	 * save the given matrix as a simple CSV file, using the given delimiter character.
	 * @param data the numbers to be written
	 * @param file the file at which to save
	 * @param delimiter the delimiter character, usually ','
	 * @param header lines to put on top verbatim, one per element; may be null
	 * @throws IOException if the file cannot be found or permission is denied
	 */
	public static void write(double[][] data, File file, char delimiter, String... header)
			throws IOException {
		try (BufferedWriter out = new BufferedWriter(new FileWriter(file))) {
			if (header != null) {
				for (String line: header) {
					out.append(line);
					out.newLine();
				}
			}
			for (double[] datum: data) {
				for (int j = 0; j < datum.length; j++) {
					out.append(Double.toString(datum[j]));
					if (j < datum.length - 1)
						out.append(delimiter);
				}
				out.newLine();
			}
		}
	}

	/**
	 * save a set of equal-length arrays side by side as the columns of a comma-separated file.
	 * @param file the file at which to save
	 * @param names the name of each column, which go on the first line
	 * @param columns the values in each column
	 * @throws IOException if the file cannot be found or permission is denied
	 */
	public static void writeColumns(File file, String[] names, double[]... columns)
			throws IOException {
		if (names.length != columns.length)
			throw new ShapeMismatchException(columns.length, names.length, "column header");
		int length = (columns.length > 0) ? columns[0].length : 0;
		double[][] table = new double[length][columns.length];
		for (int j = 0; j < columns.length; j ++) {
			if (columns[j].length != length)
				throw new ShapeMismatchException(length, columns[j].length, "column "+names[j]);
			for (int i = 0; i < length; i ++)
				table[i][j] = columns[j][i];
		}
		write(table, file, ',', String.join(",", names));
	}

}
