package com.elphel.mvs.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.concurrent.atomic.AtomicIntegerArray;

import org.junit.Test;

public class TestMultiThreading {

	@Test
	public void everyRowProcessedOnce() {
		final int height = 257;
		final AtomicIntegerArray counts = new AtomicIntegerArray(height);
		MultiThreading.forEachRow(height, 7, new MultiThreading.RowTask() {
			@Override
			public void processRow(int row) {
				counts.incrementAndGet(row);
			}
		});
		for (int row = 0; row < height; row++) {
			assertEquals("row "+row, 1, counts.get(row));
		}
	}

	@Test
	public void singleThreadRunsInCaller() {
		final Thread caller = Thread.currentThread();
		final boolean [] same = {true};
		MultiThreading.forEachRow(5, 1, new MultiThreading.RowTask() {
			@Override
			public void processRow(int row) {
				same[0] &= (Thread.currentThread() == caller);
			}
		});
		assertTrue(same[0]);
	}

	@Test
	public void threadArrayLimitedByItems() {
		assertEquals(1, MultiThreading.newThreadArray(100, 1).length);
		assertEquals(1, MultiThreading.newThreadArray(100, 0).length);
		assertTrue(MultiThreading.newThreadArray(2).length <= 2);
		assertTrue(MultiThreading.newThreadArray().length >= 1);
	}

	@Test(expected = IllegalStateException.class)
	public void workerExceptionPropagates() {
		MultiThreading.forEachRow(50, 4, new MultiThreading.RowTask() {
			@Override
			public void processRow(int row) {
				if (row == 17) {
					throw new IllegalStateException("row "+row);
				}
			}
		});
	}
}
