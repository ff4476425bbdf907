/**
 ** -----------------------------------------------------------------------------**
 ** NccCorrelator.java
 **
 ** Normalized cross-correlation of two patch vector fields
 **
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  NccCorrelator.java is free software: you can redistribute it and/or modify
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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.elphel.mvs.common.MultiThreading;

public class NccCorrelator {
	private static final Logger LOGGER =
			LoggerFactory.getLogger(NccCorrelator.class);

	/**
	 * Per-pixel NCC of two patch vector fields (single thread)
	 * @param features1 height x width x length patch vectors
	 * @param features2 patch vectors of the same dimensions
	 * @return height x width scores, 0 where either vector is zero
	 * @throws IllegalArgumentException if the field dimensions differ
	 */
	public static double [][] correlate(
			double [][][] features1,
			double [][][] features2) {
		return correlate(features1, features2, 1, 0);
	}

	/**
	 * Same as {@link #correlate(double[][][], double[][][])}, additionally verifies that the
	 * vector length corresponds to channels square patches of an odd size
	 * @param features1 height x width x (channels * windowSize^2) patch vectors
	 * @param features2 patch vectors of the same dimensions
	 * @param channels number of image channels
	 * @return height x width scores
	 */
	public static double [][] correlate(
			double [][][] features1,
			double [][][] features2,
			int           channels) {
		int [] whl = checkFields(features1, features2);
		if ((whl[0] > 0) && (whl[1] > 0)) { // empty fields have no vectors to check
			getWindowSize(whl[2], channels);
		}
		return correlate(features1, features2, 1, 0);
	}

	/**
	 * Per-pixel NCC of two patch vector fields, rows are distributed between threads.
	 * numerator = sum(v1*v2), denominator = sqrt(sum(v1^2)*sum(v2^2)), the score is 0 when the
	 * denominator is 0. Vectors are not required to be unit.
	 * @param features1 height x width x length patch vectors
	 * @param features2 patch vectors of the same dimensions
	 * @param threadsMax maximal number of threads to launch
	 * @param debugLevel debug level
	 * @return height x width scores
	 */
	public static double [][] correlate(
			final double [][][] features1,
			final double [][][] features2,
			final int           threadsMax,
			final int           debugLevel) {
		final int [] whl = checkFields(features1, features2);
		final int width =  whl[0];
		final int height = whl[1];
		final double [][] ncc = new double [height][width];
		final long startTime = System.nanoTime();
		MultiThreading.forEachRow(
				height,
				threadsMax,
				new MultiThreading.RowTask() {
					@Override
					public void processRow(int row) {
						for (int col = 0; col < width; col++) {
							ncc[row][col] = ncc(features1[row][col], features2[row][col]);
						}
					}
				});
		if (debugLevel > 0) {
			LOGGER.debug("correlate(): "+width+"x"+height+", vector length "+whl[2]+" in "+
					String.format("%.3f", (System.nanoTime() - startTime) * 1e-6)+" ms");
		}
		return ncc;
	}

	static double ncc(
			double [] v1,
			double [] v2) {
		double s12 = 0.0, s11 = 0.0, s22 = 0.0;
		for (int i = 0; i < v1.length; i++) {
			s12 += v1[i] * v2[i];
			s11 += v1[i] * v1[i];
			s22 += v2[i] * v2[i];
		}
		double denominator = Math.sqrt(s11 * s22);
		if (denominator == 0.0) {
			return 0.0;
		}
		return s12 / denominator;
	}

	/**
	 * Recover the patch size from the vector length
	 * @param vectorLength channels * windowSize^2
	 * @param channels number of channels
	 * @return windowSize
	 * @throws IllegalArgumentException if the length is not channels times an odd square
	 */
	public static int getWindowSize(
			int vectorLength,
			int channels) {
		if (channels < 1) {
			throw new IllegalArgumentException("Number of channels should be positive, got "+channels);
		}
		if ((vectorLength % channels) != 0) {
			throw new IllegalArgumentException("Vector length "+vectorLength+" is not a multiple of "+channels+" channels");
		}
		int area = vectorLength / channels;
		int size = (int) Math.round(Math.sqrt(area));
		if ((size * size != area) || ((size & 1) == 0)) {
			throw new IllegalArgumentException("Vector length "+vectorLength+" does not match "+channels+
					" channels of an odd square window");
		}
		return size;
	}

	/**
	 * Verify both fields are dense and have the same height, width and vector length
	 * @return {width, height, vector length}
	 */
	static int [] checkFields(
			double [][][] features1,
			double [][][] features2) {
		if ((features1 == null) || (features2 == null)) {
			throw new IllegalArgumentException("Feature field is null");
		}
		if (features1.length != features2.length) {
			throw new IllegalArgumentException("Feature field heights differ: "+features1.length+" and "+features2.length);
		}
		int height = features1.length;
		if (height == 0) {
			return new int [] {0, 0, 0};
		}
		if ((features1[0] == null) || (features2[0] == null)) {
			throw new IllegalArgumentException("Feature field row 0 is null");
		}
		int width = features1[0].length;
		int length = ((width > 0) && (features1[0][0] != null)) ? features1[0][0].length : 0;
		for (int row = 0; row < height; row++) {
			if ((features1[row] == null) || (features2[row] == null) ||
					(features1[row].length != width) || (features2[row].length != width)) {
				throw new IllegalArgumentException("Feature field widths differ in row "+row+", expected "+width);
			}
			for (int col = 0; col < width; col++) {
				double [] v1 = features1[row][col];
				double [] v2 = features2[row][col];
				if ((v1 == null) || (v2 == null) || (v1.length != length) || (v2.length != length)) {
					throw new IllegalArgumentException("Feature vector lengths differ at ["+row+"]["+col+"], expected "+length+", got "+
							((v1 == null) ? "null" : v1.length)+" and "+((v2 == null) ? "null" : v2.length));
				}
			}
		}
		return new int [] {width, height, length};
	}
}
