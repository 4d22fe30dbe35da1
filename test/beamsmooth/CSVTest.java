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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CSVTest {

	@TempDir
	Path directory;

	@Test
	void readsNonfiniteTokensAndStraySpaces() throws IOException {
		Path file = directory.resolve("image.csv");
		Files.writeString(file, "x,y,z\n1.5, NaN ,inf\n-inf,0,-2e3\n\nignored,after,blank\n", StandardCharsets.UTF_8);
		double[][] table = CSV.read(file.toFile(), ',', 1);
		assertThat(table).hasDimensions(2, 3);
		assertThat(table[0][0]).isEqualTo(1.5);
		assertThat(table[0][1]).isNaN();
		assertThat(table[0][2]).isEqualTo(Double.POSITIVE_INFINITY);
		assertThat(table[1][0]).isEqualTo(Double.NEGATIVE_INFINITY);
		assertThat(table[1][2]).isEqualTo(-2000.);
	}

	@Test
	void writesMissingValuesAsNan() throws IOException {
		File file = directory.resolve("out.tsv").toFile();
		CSV.write(new float[][] {{1, Float.NaN}, {Float.NEGATIVE_INFINITY, 0.25f}}, file, '\t',
		          new String[] {"a", "b"});
		assertThat(Files.readAllLines(file.toPath()))
				.containsExactly("a\tb", "1.0\tnan", "-inf\t0.25");
	}

	@Test
	void garbageIsRejected() throws IOException {
		Path file = directory.resolve("bad.csv");
		Files.writeString(file, "1,two,3\n", StandardCharsets.UTF_8);
		assertThatThrownBy(() -> CSV.read(file.toFile(), ','))
				.isInstanceOf(NumberFormatException.class);
	}
}
