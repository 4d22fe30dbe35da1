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

import java.io.File;
import java.io.IOException;
import java.util.logging.Logger;

/**
 * smooth an image stored as a CSV table from the command line.
 *
 * @author Justin Kunimune
 */
public class BeamSmooth {

	private static final Logger logger = Logger.getLogger("root");

	private static final String USAGE =
			"usage: BeamSmooth <in.csv> <out.csv> <pixel scale> <original major> <original minor> " +
			"<original PA> <target major> [<target minor> <target PA>]";

	public static void main(String[] args) throws IOException {
		if (args.length != 7 && args.length != 9)
			throw new IllegalArgumentException(USAGE);
		String logFile = Logging.configureLogger(logger, new File("results"), "smooth");
		logger.info("logging to `"+logFile+"`");

		File input = new File(args[0]);
		File output = new File(args[1]);
		double pixelScale = Double.parseDouble(args[2]);
		Beam original = new Beam(Double.parseDouble(args[3]),
		                         Double.parseDouble(args[4]),
		                         Double.parseDouble(args[5]));
		BeamSpec target;
		if (args.length == 9)
			target = BeamSpec.elliptical(Double.parseDouble(args[6]),
			                             Double.parseDouble(args[7]),
			                             Double.parseDouble(args[8]));
		else
			target = BeamSpec.isotropic(Double.parseDouble(args[6]));

		double[][] image = CSV.read(input, ',');
		logger.info(String.format("read a %d×%d image from %s", image.length, image[0].length, input));
		Header header = new Header(image[0].length, image.length, -pixelScale, 0,
		                           "Jy/beam", original);

		SmoothingResult result = new Smoother().smooth(Cube.of(image), header, target);
		if (!result.isFeasible())
			logger.warning("the image could not be smoothed to "+target+"; saving it unchanged");
		CSV.write(result.image(), output, ',');
		logger.info(String.format("saved the result to %s (%s, range [%.4g, %.4g])",
		                          output, result.header().unit(),
		                          result.header().dataMin(), result.header().dataMax()));
	}
}
