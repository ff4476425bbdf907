/**
 ** -----------------------------------------------------------------------------**
 ** MultiViewNcc.java
 **
 ** Keeps normalized patch vectors of several views, so each image is normalized
 ** once and each pair is only correlated
 **
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  MultiViewNcc.java is free software: you can redistribute it and/or modify
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

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.elphel.mvs.cameras.MvsParameters;

public class MultiViewNcc {
	private static final Logger LOGGER =
			LoggerFactory.getLogger(MultiViewNcc.class);

	private final MvsParameters         mvsParameters;
	private final List<double [][][]>   features = new ArrayList<double [][][]>();
	private int width =    -1;
	private int height =   -1;
	private int channels = -1;

	public MultiViewNcc(MvsParameters mvsParameters) {
		mvsParameters.validate();
		this.mvsParameters = mvsParameters.clone();
	}

	/**
	 * Normalize patches of a new view and keep them
	 * @param image height x width x channels, same dimensions as the previously added views
	 * @return index of the view
	 * @throws IllegalArgumentException if dimensions differ from the first view
	 */
	public synchronized int addView(double [][][] image) {
		int [] whc = PatchNormalizer.checkImage(image);
		if (features.isEmpty()) {
			width =    whc[0];
			height =   whc[1];
			channels = whc[2];
		} else if ((whc[0] != width) || (whc[1] != height) || (whc[2] != channels)) {
			throw new IllegalArgumentException("View "+features.size()+" is "+whc[0]+"x"+whc[1]+"x"+whc[2]+
					", expected "+width+"x"+height+"x"+channels);
		}
		features.add(PatchNormalizer.preprocessPatches(image, mvsParameters));
		if (mvsParameters.debug_level > 0) {
			LOGGER.info("Added view "+(features.size() - 1)+" ("+width+"x"+height+"x"+channels+")");
		}
		return features.size() - 1;
	}

	public MvsParameters getParameters() {
		return mvsParameters.clone();
	}

	public synchronized int getNumViews() {
		return features.size();
	}

	/**
	 * @param nview view index
	 * @return normalized patch vectors of the view (shared, do not modify)
	 */
	public synchronized double [][][] getFeatures(int nview) {
		return features.get(nview);
	}

	/**
	 * NCC scores between two views
	 * @param nview1 first view index
	 * @param nview2 second view index
	 * @return height x width scores
	 * @throws IndexOutOfBoundsException for a view that was not added
	 */
	public double [][] getScores(
			int nview1,
			int nview2) {
		double [][][] f1, f2;
		synchronized (this) {
			f1 = features.get(nview1);
			f2 = features.get(nview2);
		}
		return NccCorrelator.correlate(
				f1,
				f2,
				mvsParameters.threads_max,
				mvsParameters.debug_level);
	}
}
