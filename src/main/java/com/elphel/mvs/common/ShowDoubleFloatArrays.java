/**
 ** -----------------------------------------------------------------------------**
 ** ShowDoubleFloatArrays.java
 **
 ** Conversion between ImageJ images and the double [][][] fields of the kernels
 **
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ShowDoubleFloatArrays.java is free software: you can redistribute it and/or modify
 **  it under the terms of the GNU General Public License as published by
 **  the Free Software Foundation, either version 3 of the License, or
 **  (at your option) any later version.
 **
 **  This program is distributed in the hope that it will be useful,
 **  but WITHOUT ANY WARRANTY; without even the implied warranty of
 **  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 **  GNU General Public License for more details.
 **
 **  You should have received a copy of the GNU General Public License
 **  along with this program.  If not, see <http://www.gnu.org/licenses/>.
 ** -----------------------------------------------------------------------------**
 **
 */
package com.elphel.mvs.common;

import ij.ImagePlus;
import ij.ImageStack;
import ij.process.ColorProcessor;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;

public class ShowDoubleFloatArrays {

	/**
	 * Convert ImageJ image to height x width x channels. RGB images give 3 channels (r, g, b),
	 * other types give one channel per stack slice.
	 * @param imp source image
	 * @return pixel values
	 */
	public static double [][][] imageFromImagePlus(ImagePlus imp) {
		if (imp == null) {
			throw new IllegalArgumentException("ImagePlus is null");
		}
		int width =  imp.getWidth();
		int height = imp.getHeight();
		if (imp.getType() == ImagePlus.COLOR_RGB) {
			ColorProcessor cp = (ColorProcessor) imp.getProcessor();
			double [][][] image = new double [height][width][3];
			for (int y = 0; y < height; y++) {
				for (int x = 0; x < width; x++) {
					int c = cp.get(x, y);
					image[y][x][0] = (c >> 16) & 0xff;
					image[y][x][1] = (c >>  8) & 0xff;
					image[y][x][2] =  c        & 0xff;
				}
			}
			return image;
		}
		ImageStack stack = imp.getStack();
		int channels = stack.getSize();
		double [][][] image = new double [height][width][channels];
		for (int chn = 0; chn < channels; chn++) {
			ImageProcessor ip = stack.getProcessor(chn + 1); // 1-based
			for (int y = 0; y < height; y++) {
				for (int x = 0; x < width; x++) {
					image[y][x][chn] = ip.getf(x, y);
				}
			}
		}
		return image;
	}

	/**
	 * Single-channel convenience version of {@link #imageFromImagePlus(ImagePlus)}
	 * for processors.
	 */
	public static double [][][] imageFromProcessor(ImageProcessor ip) {
		return imageFromImagePlus(new ImagePlus("", ip));
	}

	/**
	 * Make a float stack from a height x width x depth field, one slice per depth element
	 * (patch vector element, projection coordinate)
	 * @param field height x width x depth
	 * @param titles slice titles or null
	 * @return stack of depth slices
	 */
	public ImageStack makeStack(
			double [][][] field,
			String []     titles) {
		if ((field == null) || (field.length == 0) || (field[0] == null) || (field[0].length == 0) ||
				(field[0][0] == null)) {
			throw new IllegalArgumentException("Field is empty, can not make a stack");
		}
		int height = field.length;
		int width =  field[0].length;
		int depth =  field[0][0].length;
		ImageStack stack = new ImageStack(width, height);
		for (int n = 0; n < depth; n++) {
			float [] pixels = new float [width * height];
			for (int y = 0; y < height; y++) {
				for (int x = 0; x < width; x++) {
					pixels[y * width + x] = (float) field[y][x][n];
				}
			}
			String title = ((titles != null) && (n < titles.length)) ? titles[n] : ("chn-"+n);
			stack.addSlice(title, new FloatProcessor(width, height, pixels));
		}
		return stack;
	}

	/**
	 * @param scores height x width score field
	 * @return float processor with the scores, display range [-1, 1]
	 */
	public FloatProcessor makeScoreProcessor(double [][] scores) {
		if ((scores == null) || (scores.length == 0) || (scores[0] == null) || (scores[0].length == 0)) {
			throw new IllegalArgumentException("Score field is empty");
		}
		int height = scores.length;
		int width =  scores[0].length;
		float [] pixels = new float [width * height];
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				pixels[y * width + x] = (float) scores[y][x];
			}
		}
		FloatProcessor fp = new FloatProcessor(width, height, pixels);
		fp.setMinAndMax(-1.0, 1.0);
		return fp;
	}

	public ImagePlus makeImagePlus(
			double [][] scores,
			String      title) {
		return new ImagePlus(title, makeScoreProcessor(scores));
	}
}
