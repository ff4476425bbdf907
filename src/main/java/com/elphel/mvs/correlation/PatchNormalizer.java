/**
 ** -----------------------------------------------------------------------------**
 ** PatchNormalizer.java
 **
 ** Per-pixel mean-subtracted, unit-norm patch vectors for the normalized
 ** cross-correlation
 **
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  PatchNormalizer.java is free software: you can redistribute it and/or modify
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
package com.elphel.mvs.correlation;

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.elphel.mvs.cameras.MvsParameters;
import com.elphel.mvs.common.MultiThreading;

/**
 * Patch normalizer, run once per image before {@link NccCorrelator}.
 * <p>
 * For a window size n = 2*k+1 each pixel at least k pixels away from all image edges gets the
 * n x n window around it flattened into a vector of length channels*n*n, channel-major, then
 * window row, then window column:
 * <pre>
 * v[(chn * n + dy) * n + dx] = image[y - k + dy][x - k + dx][chn]
 * </pre>
 * The mean of each channel block is subtracted from that block only, then the whole vector is
 * divided by its (all-channel) L2 norm. Vectors are left zero for the pixels closer than k to an
 * edge and for the patches with the norm below the threshold (flat areas).
 */
public class PatchNormalizer {
	private static final Logger LOGGER =
			LoggerFactory.getLogger(PatchNormalizer.class);

	/**
	 * Normalize patches with the default 1e-6 norm threshold, single thread
	 * @param image height x width x channels pixel values
	 * @param windowSize patch side, positive odd
	 * @return height x width x (channels * windowSize^2) patch vectors
	 */
	public static double [][][] preprocessPatches(
			double [][][] image,
			int           windowSize) {
		return preprocessPatches(
				image,
				windowSize,
				MvsParameters.DEFAULT_MIN_NORM,
				1,  // threadsMax
				0); // debugLevel
	}

	public static double [][][] preprocessPatches(
			double [][][] image,
			MvsParameters mvsParameters) {
		mvsParameters.validate();
		return preprocessPatches(
				image,
				mvsParameters.ncc_size,
				mvsParameters.ncc_min_norm,
				mvsParameters.threads_max,
				mvsParameters.debug_level);
	}

	/**
	 * Normalize patches
	 * @param image height x width x channels pixel values
	 * @param windowSize patch side, positive odd
	 * @param minNorm patches with smaller norm (after mean subtraction) are set to zero
	 * @param threadsMax maximal number of threads to launch
	 * @param debugLevel debug level
	 * @return height x width x (channels * windowSize^2) patch vectors
	 * @throws IllegalArgumentException for an even or non-positive windowSize, a negative or NaN
	 * minNorm or a malformed image
	 */
	public static double [][][] preprocessPatches(
			final double [][][] image,
			final int           windowSize,
			final double        minNorm,
			final int           threadsMax,
			final int           debugLevel) {
		MvsParameters.checkWindowSize(windowSize);
		if (!(minNorm >= 0.0)) {
			throw new IllegalArgumentException("Minimal patch norm should be non-negative, got "+minNorm);
		}
		final int [] whc = checkImage(image);
		final int width =    whc[0];
		final int height =   whc[1];
		final int channels = whc[2];
		final int k =           windowSize / 2;
		final int patch_area =  windowSize * windowSize;
		final int patch_len =   getPatchLength(channels, windowSize);
		final double [][][] normalized = new double [height][width][patch_len];
		final AtomicInteger num_flat = new AtomicInteger(0);
		final long startTime = System.nanoTime();
		// rows [k, height - k) have patches inside the image, the rest stay zero
		final int inner_height = height - 2 * k;
		MultiThreading.forEachRow(
				inner_height,
				threadsMax,
				new MultiThreading.RowTask() {
					@Override
					public void processRow(int irow) {
						int y = irow + k;
						for (int x = k; x < (width - k); x++) {
							double [] v = normalized[y][x];
							// extract
							for (int chn = 0; chn < channels; chn++) {
								int indx = chn * patch_area;
								for (int dy = 0; dy < windowSize; dy++) {
									double [][] image_row = image[y - k + dy];
									for (int dx = 0; dx < windowSize; dx++) {
										v[indx++] = image_row[x - k + dx][chn];
									}
								}
							}
							if (!normalizePatch(v, channels, patch_area, minNorm)) {
								num_flat.getAndIncrement();
							}
						}
					}
				});
		if (debugLevel > 0) {
			int num_inner = Math.max(inner_height, 0) * Math.max(width - 2 * k, 0);
			LOGGER.debug("preprocessPatches(): "+width+"x"+height+"x"+channels+", window "+windowSize+
					", "+num_inner+" inner patches, "+num_flat.get()+" of them flat, "+
					String.format("%.3f", (System.nanoTime() - startTime) * 1e-6)+" ms");
		}
		return normalized;
	}

	/**
	 * Subtract per-channel means in place, then divide by the global norm
	 * @param v patch vector, channels blocks of patch_area values each
	 * @param channels number of channels
	 * @param patch_area window size squared
	 * @param minNorm norm threshold
	 * @return true if normalized, false if the norm was below minNorm and v was zeroed
	 */
	static boolean normalizePatch(
			double [] v,
			int       channels,
			int       patch_area,
			double    minNorm) {
		double s2 = 0.0;
		for (int chn = 0; chn < channels; chn++) {
			int start = chn * patch_area;
			int end =   start + patch_area;
			double s = 0.0;
			for (int i = start; i < end; i++) {
				s += v[i];
			}
			double mean = s / patch_area;
			for (int i = start; i < end; i++) {
				v[i] -= mean;
				s2 += v[i] * v[i];
			}
		}
		double norm = Math.sqrt(s2);
		if (!(norm >= minNorm) || (norm == 0.0)) {
			Arrays.fill(v, 0.0);
			return false;
		}
		for (int i = 0; i < v.length; i++) {
			v[i] /= norm;
		}
		return true;
	}

	public static int getPatchLength(
			int channels,
			int windowSize) {
		return channels * windowSize * windowSize;
	}

	/**
	 * Verify image is a dense height x width x channels array
	 * @return {width, height, channels}
	 */
	static int [] checkImage(double [][][] image) {
		if (image == null) {
			throw new IllegalArgumentException("image is null");
		}
		int height = image.length;
		if (height == 0) {
			throw new IllegalArgumentException("image has no rows");
		}
		if ((image[0] == null) || (image[0].length == 0) || (image[0][0] == null)) {
			throw new IllegalArgumentException("image has no columns");
		}
		int width =    image[0].length;
		int channels = image[0][0].length;
		if (channels == 0) {
			throw new IllegalArgumentException("image has no channels");
		}
		for (int y = 0; y < height; y++) {
			if ((image[y] == null) || (image[y].length != width)) {
				throw new IllegalArgumentException("image row "+y+" length differs from row 0 ("+width+")");
			}
			for (int x = 0; x < width; x++) {
				if ((image[y][x] == null) || (image[y][x].length != channels)) {
					throw new IllegalArgumentException("image pixel ["+y+"]["+x+"] should have "+channels+" channels");
				}
			}
		}
		return new int [] {width, height, channels};
	}
}
