package com.elphel.mvs.correlation;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;

import org.junit.Test;

import com.elphel.mvs.cameras.MvsParameters;

public class TestMultiViewNcc {

	@Test
	public void viewsAreNormalizedOnce() {
		MultiViewNcc multiViewNcc = new MultiViewNcc(new MvsParameters(3, 1e-6, 2, 1));
		double [][][] image = TestPatchNormalizer.randomImage(16, 12, 3, 3);
		int v0 = multiViewNcc.addView(image);
		int v1 = multiViewNcc.addView(TestPatchNormalizer.randomImage(16, 12, 3, 4));
		assertEquals(0, v0);
		assertEquals(1, v1);
		assertEquals(2, multiViewNcc.getNumViews());
		assertSame(multiViewNcc.getFeatures(0), multiViewNcc.getFeatures(0));
		double [][] self = multiViewNcc.getScores(v0, v0);
		assertEquals(1.0, self[5][5], 1e-12);
		assertEquals(0.0, self[0][5], 0.0);
		double [][] expected = NccCorrelator.correlate(
				PatchNormalizer.preprocessPatches(image, 3),
				multiViewNcc.getFeatures(v1));
		double [][] scores = multiViewNcc.getScores(v0, v1);
		for (int y = 0; y < 12; y++) {
			for (int x = 0; x < 16; x++) {
				assertEquals(expected[y][x], scores[y][x], 0.0);
			}
		}
	}

	@Test
	public void shiftedViewMatchesAtShift() {
		double [][][] image = TestPatchNormalizer.randomImage(20, 10, 1, 9);
		double [][][] shifted = new double [10][20][1];
		for (int y = 0; y < 10; y++) {
			for (int x = 0; x < 20; x++) {
				shifted[y][x][0] = image[y][Math.min(x + 2, 19)][0];
			}
		}
		MultiViewNcc multiViewNcc = new MultiViewNcc(new MvsParameters());
		multiViewNcc.addView(image);
		multiViewNcc.addView(shifted);
		double [][][] f0 = multiViewNcc.getFeatures(0);
		double [][][] f1 = multiViewNcc.getFeatures(1);
		// patch at x in the shifted view is the patch at x + 2 in the original one
		assertEquals(1.0, NccCorrelator.ncc(f0[4][8], f1[4][6]), 1e-12);
	}

	@Test
	public void parametersAreCopied() {
		MvsParameters mvsParameters = new MvsParameters();
		MultiViewNcc multiViewNcc = new MultiViewNcc(mvsParameters);
		mvsParameters.ncc_size = 4;
		assertEquals(3, multiViewNcc.getParameters().ncc_size);
		multiViewNcc.addView(TestPatchNormalizer.randomImage(5, 5, 1, 1));
		assertEquals(9, multiViewNcc.getFeatures(0)[2][2].length);
	}

	@Test(expected = IllegalArgumentException.class)
	public void differentSizeRejected() {
		MultiViewNcc multiViewNcc = new MultiViewNcc(new MvsParameters());
		multiViewNcc.addView(TestPatchNormalizer.randomImage(8, 8, 1, 1));
		multiViewNcc.addView(TestPatchNormalizer.randomImage(8, 9, 1, 1));
	}

	@Test(expected = IllegalArgumentException.class)
	public void differentChannelsRejected() {
		MultiViewNcc multiViewNcc = new MultiViewNcc(new MvsParameters());
		multiViewNcc.addView(TestPatchNormalizer.randomImage(8, 8, 1, 1));
		multiViewNcc.addView(TestPatchNormalizer.randomImage(8, 8, 3, 1));
	}

	@Test(expected = IndexOutOfBoundsException.class)
	public void unknownViewRejected() {
		MultiViewNcc multiViewNcc = new MultiViewNcc(new MvsParameters());
		multiViewNcc.addView(TestPatchNormalizer.randomImage(8, 8, 1, 1));
		multiViewNcc.getScores(0, 1);
	}

	@Test(expected = IllegalArgumentException.class)
	public void invalidParametersRejected() {
		new MultiViewNcc(new MvsParameters(2, 1e-6, 1, 0));
	}
}
