/*
 * MIT License
 *
 * Copyright (c) 2022 Justin Kunimune
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package beamsmooth;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.FileReader;
import java.io.FileWriter;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * a class for reading and writing images as plain text tables.
 * 
 * @author Justin Kunimune
 */
public class CSV {
	
	/**
	 * read a simple CSV file, with any standard line break character, and return its contents
	 * as a double matrix. elements must be parsable as doubles, or be one of "nan", "inf", or
	 * "-inf". whitespace adjacent to delimiters will be stripped.
	 * @param file the CSV file to open
	 * @param delimiter the delimiting character, usually ',', sometimes '\t', occasionally '|'
	 * @return I think the return value is pretty self-explanatory.
	 * @throws IOException if file cannot be found or permission is denied
	 * @throws NumberFormatException if elements are not parsable as doubles
	 */
	public static double[][] read(File file, char delimiter)
			throws NumberFormatException, IOException {
		return read(file, delimiter, 0);
	}
	
	/**
	 * read a simple CSV file, with any standard line break character, and return its contents
	 * as a double matrix. elements must be parsable as doubles, or be one of "nan", "inf", or
	 * "-inf". whitespace adjacent to delimiters will be stripped.
	 * @param file the CSV file to open
	 * @param delimiter the delimiting character, usually ',', sometimes '\t', occasionally '|'
	 * @param headerRows the number of initial rows to skip
	 * @return I think the return value is pretty self-explanatory.
	 * @throws IOException if file cannot be found or permission is denied
	 * @throws NumberFormatException if elements are not parsable as doubles
	 */
	public static double[][] read(File file, char delimiter, int headerRows)
			throws NumberFormatException, IOException {
		List<double[]> list;
		try (BufferedReader in = new BufferedReader(new FileReader(file))) {
			list = new ArrayList<>();
			String line;
			for (int i = 0; i < headerRows; i ++)
				in.readLine();
			while ((line = in.readLine()) != null) {
				line = line.trim();
				if (line.isEmpty())
					break;
				String[] elements = line.split("\\s*" + Pattern.quote(String.valueOf(delimiter)) + "\\s*");
				double[] row = new double[elements.length];
				for (int j = 0; j < elements.length; j++) {
					row[j] = switch (elements[j].toLowerCase(Locale.ROOT)) {
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
	 * save the given matrix as a simple CSV file, using the given delimiter character.
	 * non-finite values are written as "nan", "inf", or "-inf".
	 * @param data the numbers to be written
	 * @param file the file at which to save
	 * @param delimiter the delimiter character, usually ','
	 * @throws IOException if the file cannot be found or permission is denied
	 */
	public static void write(float[][] data, File file, char delimiter)
			throws IOException {
		write(data, file, delimiter, null);
	}
	
	/**
	 * save the given matrix as a simple CSV file, using the given delimiter character.
	 * @param data the numbers to be written
	 * @param file the file at which to save
	 * @param delimiter the delimiter character, usually ','
	 * @param header the list of strings to put on top
	 * @throws IOException if the file cannot be found or permission is denied
	 */
	public static void write(float[][] data, File file, char delimiter, String[] header)
			throws IOException {
		try (BufferedWriter out = new BufferedWriter(new FileWriter(file))) {
			if (header != null) {
				for (int j = 0; j < header.length; j++) {
					out.append(header[j]);
					if (j < header.length - 1)
						out.append(delimiter);
					else
						out.newLine();
				}
			}
			for (float[] datum: data) {
				for (int j = 0; j < datum.length; j++) {
					out.append(format(datum[j]));
					if (j < datum.length - 1)
						out.append(delimiter);
					else
						out.newLine();
				}
			}
		}
	}

	private static String format(float value) {
		if (Float.isNaN(value))
			return "nan";
		else if (value == Float.POSITIVE_INFINITY)
			return "inf";
		else if (value == Float.NEGATIVE_INFINITY)
			return "-inf";
		else
			return Float.toString(value);
	}

}
