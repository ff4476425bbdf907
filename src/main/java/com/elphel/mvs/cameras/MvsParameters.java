/**
 ** -----------------------------------------------------------------------------**
 ** MvsParameters.java
 **
 ** Parameters of the patch normalization / NCC kernels
 **
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  MvsParameters.java is free software: you can redistribute it and/or modify
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

public class MvsParameters {
	public static final double DEFAULT_MIN_NORM = 1e-6;

	public int        ncc_size =               3;    // side of the square NCC patch, odd
	public double     ncc_min_norm =           DEFAULT_MIN_NORM; // patches with lower norm after mean subtraction are zeroed
	public int        threads_max =            100;  // maximal number of threads to launch
	public int        debug_level =            0;

	public MvsParameters() {
	}

	public MvsParameters(
			int    ncc_size,
			double ncc_min_norm,
			int    threads_max,
			int    debug_level) {
		this.ncc_size =     ncc_size;
		this.ncc_min_norm = ncc_min_norm;
		this.threads_max =  threads_max;
		this.debug_level =  debug_level;
	}

	/**
	 * @throws IllegalArgumentException for an even or non-positive patch size, negative norm
	 * threshold or non-positive thread limit
	 */
	public void validate() {
		checkWindowSize(ncc_size);
		if (!(ncc_min_norm >= 0.0)) {
			throw new IllegalArgumentException("ncc_min_norm should be non-negative, got "+ncc_min_norm);
		}
		if (threads_max < 1) {
			throw new IllegalArgumentException("threads_max should be positive, got "+threads_max);
		}
	}

	public static void checkWindowSize(int window_size) {
		if ((window_size < 1) || ((window_size & 1) == 0)) {
			throw new IllegalArgumentException("NCC window size should be a positive odd number, got "+window_size);
		}
	}

	public void setProperties(String prefix,Properties properties){
		properties.setProperty(prefix+"ncc_size",        this.ncc_size+"");
		properties.setProperty(prefix+"ncc_min_norm",    this.ncc_min_norm+"");
		properties.setProperty(prefix+"threads_max",     this.threads_max+"");
		properties.setProperty(prefix+"debug_level",     this.debug_level+"");
	}

	public void getProperties(String prefix,Properties properties){
		if (properties.getProperty(prefix+"ncc_size")!=null)     this.ncc_size=Integer.parseInt(properties.getProperty(prefix+"ncc_size").trim());
		if (properties.getProperty(prefix+"ncc_min_norm")!=null) this.ncc_min_norm=Double.parseDouble(properties.getProperty(prefix+"ncc_min_norm").trim());
		if (properties.getProperty(prefix+"threads_max")!=null)  this.threads_max=Integer.parseInt(properties.getProperty(prefix+"threads_max").trim());
		if (properties.getProperty(prefix+"debug_level")!=null)  this.debug_level=Integer.parseInt(properties.getProperty(prefix+"debug_level").trim());
	}

	@Override
	public MvsParameters clone() {
		return new MvsParameters(
				ncc_size,
				ncc_min_norm,
				threads_max,
				debug_level);
	}
}
