/**
 ** -----------------------------------------------------------------------------**
 ** ProjectionKernel.java
 **
 ** Pinhole projection of world point fields and unprojection of the image corners
 **
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ProjectionKernel.java is free software: you can redistribute it and/or modify
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
package com.elphel.mvs.geometry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.elphel.mvs.cameras.CameraCalibration;
import com.elphel.mvs.common.MultiThreading;

import Jama.Matrix;

/**
 * Geometry kernel. World coordinates are converted to homogeneous {x, y, z, 1}, transformed
 * by Rt (world to camera) and K (camera to pixels), pixel coordinates are {u / w, v / w}.
 * <p>
 * Projection does not check the homogeneous w: points with zero camera z (after Rt) produce
 * infinite or NaN coordinates. Masking them would hide calibration errors, so they are returned
 * as is and it is the caller's responsibility to keep such points out of the field.
 */
public class ProjectionKernel {
	private static final Logger LOGGER =
			LoggerFactory.getLogger(ProjectionKernel.class);

	/**
	 * Project a field of world points into the camera pixel plane (single thread)
	 * @param intrinsics 3x3 camera intrinsics K
	 * @param extrinsics 3x4 camera extrinsics Rt
	 * @param points height x width x 3 world points
	 * @return height x width x 2 pixel coordinates {u (right), v (down)}
	 */
	public static double [][][] project(
			double [][]   intrinsics,
			double [][]   extrinsics,
			double [][][] points) {
		return project(
				new CameraCalibration(intrinsics, extrinsics),
				points,
				1,  // threadsMax
				0); // debugLevel
	}

	/**
	 * Project a field of world points into the camera pixel plane, rows are distributed
	 * between threads
	 * @param calibration camera K and Rt
	 * @param points height x width x 3 world points
	 * @param threadsMax maximal number of threads to launch
	 * @param debugLevel debug level
	 * @return height x width x 2 pixel coordinates {u (right), v (down)}
	 */
	public static double [][][] project(
			final CameraCalibration calibration,
			final double [][][]     points,
			final int               threadsMax,
			final int               debugLevel) {
		final int [] wh = checkField(points, 3, "point field");
		final int width =  wh[0];
		final int height = wh[1];
		// both are 3x4, rows {u, v, w}
		final double [][] projection = calibration.getProjectionMatrix().getArray();
		final double [][][] projections = new double [height][width][2];
		final long startTime = System.nanoTime();
		MultiThreading.forEachRow(
				height,
				threadsMax,
				new MultiThreading.RowTask() {
					@Override
					public void processRow(int row) {
						for (int col = 0; col < width; col++) {
							double [] uv = projectPoint(projection, points[row][col]);
							projections[row][col][0] = uv[0];
							projections[row][col][1] = uv[1];
						}
					}
				});
		if (debugLevel > 0) {
			LOGGER.debug("project(): "+width+"x"+height+" points in "+
					String.format("%.3f", (System.nanoTime() - startTime) * 1e-6)+" ms");
		}
		return projections;
	}

	/**
	 * Project a single world point
	 * @param calibration camera K and Rt
	 * @param xyz world point {x, y, z}
	 * @return pixel coordinates {u, v}, not finite if the point is in the camera plane z = 0
	 */
	public static double [] getImageCoordinates(
			CameraCalibration calibration,
			double []         xyz) {
		if ((xyz == null) || (xyz.length != 3)) {
			throw new IllegalArgumentException("world point should have 3 coordinates");
		}
		return projectPoint(calibration.getProjectionMatrix().getArray(), xyz);
	}

	/**
	 * Apply 3x4 matrix P = K * Rt to {x, y, z, 1} and divide by the homogeneous coordinate
	 */
	static double [] projectPoint(
			double [][] p,
			double []   xyz) {
		double u = p[0][0] * xyz[0] + p[0][1] * xyz[1] + p[0][2] * xyz[2] + p[0][3];
		double v = p[1][0] * xyz[0] + p[1][1] * xyz[1] + p[1][2] * xyz[2] + p[1][3];
		double w = p[2][0] * xyz[0] + p[2][1] * xyz[1] + p[2][2] * xyz[2] + p[2][3];
		return new double [] {u / w, v / w};
	}

	/**
	 * Unproject the four corners of the width x height image to the world coordinates at
	 * the specified depth (camera z)
	 * @param intrinsics 3x3 camera intrinsics K, should be invertible
	 * @param width image width in pixels
	 * @param height image height in pixels
	 * @param depth camera z of the unprojected points
	 * @param extrinsics 3x4 camera extrinsics Rt, extended with {0, 0, 0, 1} should be invertible
	 * @return 2 x 2 x 3 world points: [0][0] - pixel (0, 0), [1][0] - (0, height - 1),
	 * [0][1] - (width - 1, 0), [1][1] - (width - 1, height - 1)
	 * @throws IllegalArgumentException if K or the extended Rt is singular
	 */
	public static double [][][] unprojectCorners(
			double [][] intrinsics,
			int         width,
			int         height,
			double      depth,
			double [][] extrinsics) {
		return unprojectCorners(
				new CameraCalibration(intrinsics, extrinsics),
				width,
				height,
				depth);
	}

	public static double [][][] unprojectCorners(
			CameraCalibration calibration,
			int               width,
			int               height,
			double            depth) {
		if ((width < 1) || (height < 1)) {
			throw new IllegalArgumentException("Image should be at least 1x1, got "+width+"x"+height);
		}
		Matrix k_inv =   calibration.getIntrinsicsInverse();
		Matrix rt4_inv = calibration.getExtrinsicsInverse();
		double [][][] corners = new double [2][2][];
		for (int row = 0; row < 2; row++) {
			for (int col = 0; col < 2; col++) {
				corners[row][col] = unprojectPoint(
						k_inv,
						rt4_inv,
						col * (width - 1),  // px
						row * (height - 1), // py
						depth);
			}
		}
		return corners;
	}

	/**
	 * Unproject any pixel to the world coordinates at the specified depth
	 * @param calibration camera K and Rt, both invertible
	 * @param px horizontal pixel coordinate (right)
	 * @param py vertical pixel coordinate (down)
	 * @param depth camera z of the unprojected point
	 * @return world {x, y, z}
	 */
	public static double [] getWorldCoordinates(
			CameraCalibration calibration,
			double            px,
			double            py,
			double            depth) {
		return unprojectPoint(
				calibration.getIntrinsicsInverse(),
				calibration.getExtrinsicsInverse(),
				px,
				py,
				depth);
	}

	static double [] unprojectPoint(
			Matrix k_inv,   // 3x3
			Matrix rt4_inv, // 4x4
			double px,
			double py,
			double depth) {
		Matrix camera = k_inv.times(depth).times(new Matrix(new double [] {px, py, 1.0}, 3));
		Matrix world4 = rt4_inv.times(new Matrix(new double [] {
				camera.get(0, 0),
				camera.get(1, 0),
				camera.get(2, 0),
				1.0}, 4));
		double w = world4.get(3, 0);
		return new double [] {
				world4.get(0, 0) / w,
				world4.get(1, 0) / w,
				world4.get(2, 0) / w};
	}

	/**
	 * Verify field is a dense height x width x depth array
	 * @return {width, height}
	 */
	static int [] checkField(
			double [][][] field,
			int           depth,
			String        name) {
		if (field == null) {
			throw new IllegalArgumentException(name+" is null");
		}
		int height = field.length;
		int width =  (height > 0) ? ((field[0] == null) ? -1 : field[0].length) : 0;
		for (int row = 0; row < height; row++) {
			if ((field[row] == null) || (field[row].length != width)) {
				throw new IllegalArgumentException(name+" row "+row+" length differs from row 0 ("+width+")");
			}
			for (int col = 0; col < width; col++) {
				if ((field[row][col] == null) || (field[row][col].length != depth)) {
					throw new IllegalArgumentException(name+"["+row+"]["+col+"] should have "+depth+" elements");
				}
			}
		}
		return new int [] {width, height};
	}
}
