/**
 ** -----------------------------------------------------------------------------**
 ** CameraCalibration.java
 **
 ** Pinhole camera calibration: intrinsics K (3x3) and extrinsics Rt (3x4, world to camera)
 **
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  CameraCalibration.java is free software: you can redistribute it and/or modify
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
package com.elphel.mvs.cameras;

import java.util.Properties;

import com.elphel.mvs.common.EProperties;

import Jama.LUDecomposition;
import Jama.Matrix;

public class CameraCalibration {
	public static final int K_ROWS =  3;
	public static final int K_COLS =  3;
	public static final int RT_ROWS = 3;
	public static final int RT_COLS = 4;
	public static final String K_PREFIX =  "K_row";
	public static final String RT_PREFIX = "Rt_row";

	private final double [][] intrinsics; // K
	private final double [][] extrinsics; // Rt, world -> camera
	// lazily calculated, instance is immutable otherwise
	private Matrix intrinsics_inverse =  null;
	private Matrix extrinsics4_inverse = null;

	/**
	 * @param intrinsics 3x3 camera intrinsics matrix K
	 * @param extrinsics 3x4 camera extrinsics matrix Rt (world to camera)
	 */
	public CameraCalibration(
			double [][] intrinsics,
			double [][] extrinsics) {
		this.intrinsics = copyChecked(intrinsics, K_ROWS,  K_COLS,  "intrinsics K");
		this.extrinsics = copyChecked(extrinsics, RT_ROWS, RT_COLS, "extrinsics Rt");
	}

	/**
	 * Verify array is a dense rows x cols matrix of finite values and return its deep copy
	 * @param m matrix to check
	 * @param rows expected number of rows
	 * @param cols expected number of columns
	 * @param name matrix name for the exception message
	 * @return deep copy of m
	 */
	public static double [][] copyChecked(
			double [][] m,
			int         rows,
			int         cols,
			String      name) {
		if (m == null) {
			throw new IllegalArgumentException(name+" is null");
		}
		if (m.length != rows) {
			throw new IllegalArgumentException(name+" should have "+rows+" rows, got "+m.length);
		}
		double [][] copy = new double [rows][];
		for (int i = 0; i < rows; i++) {
			if ((m[i] == null) || (m[i].length != cols)) {
				throw new IllegalArgumentException(name+" row "+i+" should have "+cols+" elements, got "+
						((m[i] == null) ? "null" : m[i].length));
			}
			for (int j = 0; j < cols; j++) {
				if (!Double.isFinite(m[i][j])) {
					throw new IllegalArgumentException(name+"["+i+"]["+j+"] is not finite: "+m[i][j]);
				}
			}
			copy[i] = m[i].clone();
		}
		return copy;
	}

	public double [][] getIntrinsicsArray(){
		return new Matrix(intrinsics).getArrayCopy();
	}
	public double [][] getExtrinsicsArray(){
		return new Matrix(extrinsics).getArrayCopy();
	}

	public Matrix getIntrinsics() {
		return new Matrix(intrinsics).copy();
	}

	public Matrix getExtrinsics() {
		return new Matrix(extrinsics).copy();
	}

	/**
	 * Homogeneous extension of Rt: rows of Rt followed by {0, 0, 0, 1}
	 * @return 4x4 world to camera transformation
	 */
	public Matrix getExtrinsics4() {
		Matrix rt4 = new Matrix(4, 4);
		rt4.setMatrix(0, RT_ROWS - 1, 0, RT_COLS - 1, new Matrix(extrinsics));
		rt4.set(3, 3, 1.0);
		return rt4;
	}

	/**
	 * Combined 3x4 projection matrix P = K * Rt
	 * @return projection matrix
	 */
	public Matrix getProjectionMatrix() {
		return getIntrinsics().times(getExtrinsics());
	}

	public boolean isIntrinsicsInvertible() {
		return new LUDecomposition(new Matrix(intrinsics)).isNonsingular();
	}

	public boolean isExtrinsicsInvertible() {
		return new LUDecomposition(getExtrinsics4()).isNonsingular();
	}

	public boolean isInvertible() {
		return isIntrinsicsInvertible() && isExtrinsicsInvertible();
	}

	/**
	 * @return K^-1
	 * @throws IllegalArgumentException if K is singular
	 */
	public synchronized Matrix getIntrinsicsInverse() {
		if (intrinsics_inverse == null) {
			intrinsics_inverse = invertChecked(new Matrix(intrinsics), "intrinsics K");
		}
		return intrinsics_inverse.copy();
	}

	/**
	 * @return inverse of the 4x4 homogeneous extension of Rt (camera to world)
	 * @throws IllegalArgumentException if the extension is singular
	 */
	public synchronized Matrix getExtrinsicsInverse() {
		if (extrinsics4_inverse == null) {
			extrinsics4_inverse = invertChecked(getExtrinsics4(), "extended extrinsics Rt");
		}
		return extrinsics4_inverse.copy();
	}

	/**
	 * Camera center in world coordinates (the point mapped to the camera origin by Rt)
	 * @return {x, y, z}
	 */
	public double [] getCameraCenter() {
		Matrix center = getExtrinsicsInverse().times(new Matrix(new double [] {0.0, 0.0, 0.0, 1.0}, 4));
		double w = center.get(3, 0);
		return new double [] {center.get(0, 0) / w, center.get(1, 0) / w, center.get(2, 0) / w};
	}

	static Matrix invertChecked(
			Matrix m,
			String name) {
		LUDecomposition lu = new LUDecomposition(m);
		if (!lu.isNonsingular()) {
			throw new IllegalArgumentException(name+" is singular (det = "+lu.det()+"), can not invert");
		}
		return lu.solve(Matrix.identity(m.getRowDimension(), m.getColumnDimension()));
	}

	public void setProperties(String prefix,Properties properties){
		for (int i = 0; i < K_ROWS; i++) {
			properties.setProperty(prefix+K_PREFIX+i,  csvRow(intrinsics[i]));
		}
		for (int i = 0; i < RT_ROWS; i++) {
			properties.setProperty(prefix+RT_PREFIX+i, csvRow(extrinsics[i]));
		}
	}

	/**
	 * Restore calibration saved by {@link #setProperties(String, Properties)}
	 * @param prefix property name prefix
	 * @param properties properties to read
	 * @return calibration
	 * @throws IllegalArgumentException if any row is missing or has a wrong length
	 */
	public static CameraCalibration getProperties(String prefix, EProperties properties){
		double [][] k =  new double [K_ROWS][];
		double [][] rt = new double [RT_ROWS][];
		for (int i = 0; i < K_ROWS; i++) {
			k[i] =  properties.getProperty(prefix+K_PREFIX+i, (double []) null);
		}
		for (int i = 0; i < RT_ROWS; i++) {
			rt[i] = properties.getProperty(prefix+RT_PREFIX+i, (double []) null);
		}
		return new CameraCalibration(k, rt);
	}

	private static String csvRow(double [] row) {
		StringBuilder sb = new StringBuilder();
		for (int j = 0; j < row.length; j++) {
			if (j > 0) sb.append(", ");
			sb.append(row[j]); // full precision
		}
		return sb.toString();
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		sb.append("K = ");
		appendRows(sb, intrinsics);
		sb.append(", Rt = ");
		appendRows(sb, extrinsics);
		return sb.toString();
	}

	private static void appendRows(StringBuilder sb, double [][] m) {
		sb.append("{");
		for (int i = 0; i < m.length; i++) {
			if (i > 0) sb.append(", ");
			sb.append("{");
			for (int j = 0; j < m[i].length; j++) {
				if (j > 0) sb.append(", ");
				sb.append(String.format("%f", m[i][j]));
			}
			sb.append("}");
		}
		sb.append("}");
	}
}
