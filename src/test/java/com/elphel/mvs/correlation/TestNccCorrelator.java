package com.elphel.mvs.correlation;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.Test;

public class TestNccCorrelator {

	static double [][][] features(long seed) {
		return PatchNormalizer.preprocessPatches(TestPatchNormalizer.randomImage(12, 10, 3, seed), 3);
	}

	@Test
	public void selfCorrelationIsOneWhereDefined() {
		double [][][] image = TestPatchNormalizer.randomImage(12, 10, 3, 21);
		// flat area in the middle gives zero vectors there
		for (int y = 3; y < 8; y++) {
			for (int x = 3; x < 9; x++) {
				image[y][x] = new double [] {7.0, 7.0, 7.0};
			}
		}
		double [][][] f = PatchNormalizer.preprocessPatches(image, 3);
		double [][] ncc = NccCorrelator.correlate(f, f);
		for (int y = 0; y < f.length; y++) {
			for (int x = 0; x < f[0].length; x++) {
				double expected = (TestPatchNormalizer.norm(f[y][x]) > 0.0) ? 1.0 : 0.0;
				assertEquals("pixel ("+x+","+y+")", expected, ncc[y][x], 1e-12);
			}
		}
		assertEquals(0.0, ncc[5][5], 0.0);
		assertEquals(1.0, ncc[1][1], 1e-12);
	}

	@Test
	public void symmetric() {
		double [][][] f1 = features(1);
		double [][][] f2 = features(2);
		double [][] ncc12 = NccCorrelator.correlate(f1, f2);
		double [][] ncc21 = NccCorrelator.correlate(f2, f1);
		for (int y = 0; y < ncc12.length; y++) {
			for (int x = 0; x < ncc12[0].length; x++) {
				assertEquals(ncc12[y][x], ncc21[y][x], 0.0);
				assertFalse(Double.isNaN(ncc12[y][x]));
				assertTrue(Math.abs(ncc12[y][x]) <= 1.0 + 1e-12);
			}
		}
	}

	@Test
	public void vectorsAreNotAssumedUnit() {
		double [][][] f1 = {{{3.0, 0.0, 4.0}, {1.0, 0.0, 0.0}}};
		double [][][] f2 = {{{6.0, 0.0, 8.0}, {2.0, 2.0, 0.0}}};
		double [][] ncc = NccCorrelator.correlate(f1, f2);
		assertEquals(1.0,                   ncc[0][0], 1e-15);
		assertEquals(1.0 / Math.sqrt(2.0),  ncc[0][1], 1e-15);
	}

	@Test
	public void negatedPatchAnticorrelates() {
		double [][][] image = TestPatchNormalizer.randomImage(6, 6, 1, 8);
		double [][][] negated = new double [6][6][1];
		for (int y = 0; y < 6; y++) {
			for (int x = 0; x < 6; x++) {
				negated[y][x][0] = 255.0 - image[y][x][0];
			}
		}
		double [][] ncc = NccCorrelator.correlate(
				PatchNormalizer.preprocessPatches(image, 3),
				PatchNormalizer.preprocessPatches(negated, 3));
		assertEquals(-1.0, ncc[2][3], 1e-12);
		assertEquals( 0.0, ncc[0][0], 0.0);
	}

	@Test
	public void contrastAndOffsetInvariant() {
		double [][][] image = TestPatchNormalizer.randomImage(7, 7, 2, 4);
		double [][][] scaled = new double [7][7][2];
		for (int y = 0; y < 7; y++) {
			for (int x = 0; x < 7; x++) {
				scaled[y][x][0] = 0.5 * image[y][x][0] + 20.0;
				scaled[y][x][1] = 0.5 * image[y][x][1] - 3.0;
			}
		}
		double [][] ncc = NccCorrelator.correlate(
				PatchNormalizer.preprocessPatches(image, 5),
				PatchNormalizer.preprocessPatches(scaled, 5),
				2); // channels
		assertEquals(1.0, ncc[3][3], 1e-12);
	}

	@Test
	public void zeroDenominatorGivesZero() {
		double [][][] zero = {{{0.0, 0.0, 0.0}}};
		double [][][] some = {{{1.0, 2.0, 3.0}}};
		assertEquals(0.0, NccCorrelator.correlate(zero, some)[0][0], 0.0);
		assertEquals(0.0, NccCorrelator.correlate(some, zero)[0][0], 0.0);
		assertEquals(0.0, NccCorrelator.correlate(zero, zero)[0][0], 0.0);
	}

	@Test
	public void threadedMatchesSingleThread() {
		double [][][] f1 = features(5);
		double [][][] f2 = features(6);
		double [][] single =   NccCorrelator.correlate(f1, f2, 1, 0);
		double [][] threaded = NccCorrelator.correlate(f1, f2, 6, 1);
		for (int y = 0; y < single.length; y++) {
			for (int x = 0; x < single[0].length; x++) {
				assertEquals(single[y][x], threaded[y][x], 0.0);
			}
		}
	}

	@Test
	public void windowSizeFromVectorLength() {
		assertEquals(3, NccCorrelator.getWindowSize(27, 3));
		assertEquals(5, NccCorrelator.getWindowSize(25, 1));
		assertEquals(1, NccCorrelator.getWindowSize(2, 2));
	}

	@Test(expected = IllegalArgumentException.class)
	public void evenWindowSizeRejected() {
		NccCorrelator.getWindowSize(12, 3);
	}

	@Test(expected = IllegalArgumentException.class)
	public void nonSquareLengthRejected() {
		NccCorrelator.getWindowSize(10, 2);
	}

	@Test(expected = IllegalArgumentException.class)
	public void wrongChannelsRejected() {
		NccCorrelator.correlate(features(1), features(2), 2);
	}

	@Test(expected = IllegalArgumentException.class)
	public void heightMismatchRejected() {
		double [][][] f1 = features(1);
		double [][][] f2 = Arrays.copyOf(features(2), 9);
		NccCorrelator.correlate(f1, f2);
	}

	@Test(expected = IllegalArgumentException.class)
	public void widthMismatchRejected() {
		double [][][] f1 = features(1);
		double [][][] f2 = features(2);
		f2[4] = Arrays.copyOf(f2[4], 11);
		NccCorrelator.correlate(f1, f2);
	}

	@Test(expected = IllegalArgumentException.class)
	public void vectorLengthMismatchRejected() {
		double [][][] f1 = features(1);
		double [][][] f2 = PatchNormalizer.preprocessPatches(TestPatchNormalizer.randomImage(12, 10, 1, 2), 3);
		NccCorrelator.correlate(f1, f2);
	}

	@Test(expected = IllegalArgumentException.class)
	public void singleVectorMismatchRejected() {
		double [][][] f1 = features(1);
		double [][][] f2 = features(2);
		f2[7][3] = new double [26];
		NccCorrelator.correlate(f1, f2);
	}

	@Test
	public void emptyFieldsWithChannels() {
		double [][] scores = NccCorrelator.correlate(new double [0][][], new double [0][][], 1);
		assertEquals(0, scores.length);
	}
}
