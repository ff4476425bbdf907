/**
 **
 ** CameraPose - camera position (world XYZ) and orientation (Azimuth, Tilt, Roll),
 ** converted to the 3x4 world to camera extrinsics matrix
 **
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  CameraPose.java is free software: you can redistribute it and/or modify
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

import org.apache.commons.math3.geometry.euclidean.threed.Rotation;
import org.apache.commons.math3.geometry.euclidean.threed.RotationConvention;
import org.apache.commons.math3.geometry.euclidean.threed.RotationOrder;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

public class CameraPose {
	static final RotationConvention ROT_CONV =  RotationConvention.FRAME_TRANSFORM;
	static final RotationOrder      ROT_ORDER = RotationOrder.YXZ; // azimuth, tilt, roll

	double [] xyz; // camera center in world coordinates
	double [] atr; // azimuth, tilt, roll (radians)

	public CameraPose() {
		xyz = new double[3];
		atr = new double[3];
	}

	public CameraPose(double [] xyz, double [] atr) {
		if ((xyz == null) || (xyz.length != 3) || (atr == null) || (atr.length != 3)) {
			throw new IllegalArgumentException("CameraPose needs 3 coordinates and 3 angles");
		}
		this.xyz = xyz.clone();
		this.atr = atr.clone();
	}

	/**
	 * Parse pose from "x, y, z, azimuth, tilt, roll" as written by {@link #toString()}
	 * @param s comma-separated six values
	 */
	public CameraPose(String s) {
		double [] d = parseDoublesCSV(s);
		if (d.length < 6) {
			throw new IllegalArgumentException("CameraPose needs 6 comma-separated values, got \""+s+"\"");
		}
		xyz = new double [] {d[0], d[1], d[2]};
		atr = new double [] {d[3], d[4], d[5]};
	}

	public static double [] parseDoublesCSV(String s) {
		String [] snumbers = s.split(",");
		double [] data = new double [snumbers.length];
		for (int i = 0; i < data.length; i++) {
			try {
				data[i] = Double.parseDouble(snumbers[i].trim());
			} catch (NumberFormatException e) {
				throw new IllegalArgumentException("Bad number \""+snumbers[i]+"\" in \""+s+"\"", e);
			}
		}
		return data;
	}

	public String toString() {
		return String.format("%f,  %f, %f, %f, %f, %f",xyz[0],xyz[1],xyz[2],atr[0],atr[1],atr[2]);
	}

	public double [] getXYZ() {
		return xyz.clone();
	}
	public double [] getATR() {
		return atr.clone();
	}
	public void setXYZ(double [] d) {
		xyz[0] = d[0];
		xyz[1] = d[1];
		xyz[2] = d[2];
	}
	public void setATR(double [] d) {
		atr[0] = d[0];
		atr[1] = d[1];
		atr[2] = d[2];
	}

	public Rotation getRotation() {
		return new Rotation(ROT_ORDER, ROT_CONV, atr[0], atr[1], atr[2]);
	}

	/**
	 * World to camera extrinsics: camera = R * (world - xyz)
	 * @return 3x4 matrix {R | -R*xyz}
	 */
	public double [][] toExtrinsics() {
		Rotation rotation = getRotation();
		double [][] r = rotation.getMatrix();
		Vector3D t = rotation.applyTo(new Vector3D(xyz)).negate();
		return new double [][] {
			{r[0][0], r[0][1], r[0][2], t.getX()},
			{r[1][0], r[1][1], r[1][2], t.getY()},
			{r[2][0], r[2][1], r[2][2], t.getZ()}};
	}

	/**
	 * Camera to world transformation of a point in camera coordinates
	 * @param camera_xyz point in camera coordinates
	 * @return point in world coordinates
	 */
	public double [] cameraToWorld(double [] camera_xyz) {
		Vector3D world = getRotation().applyInverseTo(new Vector3D(camera_xyz)).add(new Vector3D(xyz));
		return world.toArray();
	}
}
