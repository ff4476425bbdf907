/**
 ** -----------------------------------------------------------------------------**
 ** MultiThreading.java
 **
 ** Thread fan-out helpers shared by the stereo kernels
 **
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  MultiThreading.java is free software: you can redistribute it and/or modify
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
package com.elphel.mvs.common;

import java.util.concurrent.atomic.AtomicInteger;

public class MultiThreading {
	public static int THREADS_MAX = 100;

	/**
	 * Per-row unit of work. Implementations must write only the output cells of the
	 * row they are given.
	 */
	public interface RowTask {
		void processRow(int row);
	}

	/* Create a Thread[] array as large as the number of processors available.
	 * From Stephan Preibisch's Multithreading.java class. See:
	 * http://repo.or.cz/w/trakem2.git?a=blob;f=mpi/fruitfly/general/MultiThreading.java;hb=HEAD
	 */
	public static Thread[] newThreadArray() {
		return newThreadArray (THREADS_MAX);
	}

	public static Thread[] newThreadArray(int maxCPUs) {
		return newThreadArray(maxCPUs, Integer.MAX_VALUE);
	}

	/**
	 * Thread array limited by the number of processors, maxCPUs and the number of
	 * independent work items (no idle threads for small images).
	 * @param maxCPUs maximal number of threads to launch
	 * @param numItems number of work items (rows) to distribute
	 * @return array of (not yet created) threads, at least one
	 */
	public static Thread[] newThreadArray(
			int maxCPUs,
			int numItems) {
		int n_cpus = Runtime.getRuntime().availableProcessors();
		if (n_cpus > maxCPUs) n_cpus = maxCPUs;
		if (n_cpus > numItems) n_cpus = numItems;
		if (n_cpus < 1) n_cpus = 1;
		return new Thread[n_cpus];
	}

	/* Start all given threads and wait on each of them until all are done.
	 * From Stephan Preibisch's Multithreading.java class. See:
	 * http://repo.or.cz/w/trakem2.git?a=blob;f=mpi/fruitfly/general/MultiThreading.java;hb=HEAD
	 */
	public static void startAndJoin(Thread[] threads)
	{
		for (int ithread = 0; ithread < threads.length; ++ithread)
		{
			threads[ithread].setPriority(Thread.NORM_PRIORITY);
			threads[ithread].start();
		}
		try
		{
			for (int ithread = 0; ithread < threads.length; ++ithread)
				threads[ithread].join();
		} catch (InterruptedException ie)
		{
			Thread.currentThread().interrupt();
			throw new RuntimeException(ie);
		}
	}

	/**
	 * Run task for each row in [0, height), rows are handed out to the threads one at a time.
	 * With threadsMax == 1 the rows are processed in the calling thread.
	 * @param height number of rows
	 * @param threadsMax maximal number of threads to launch
	 * @param task per-row work
	 */
	public static void forEachRow(
			final int      height,
			final int      threadsMax,
			final RowTask  task) {
		if (height <= 0) {
			return;
		}
		if (threadsMax <= 1) {
			for (int row = 0; row < height; row++) {
				task.processRow(row);
			}
			return;
		}
		final Thread[] threads = newThreadArray(threadsMax, height);
		final AtomicInteger ai = new AtomicInteger(0);
		final Throwable [] failure = new Throwable[1];
		for (int ithread = 0; ithread < threads.length; ithread++) {
			threads[ithread] = new Thread() {
				public void run() {
					try {
						for (int row = ai.getAndIncrement(); row < height; row = ai.getAndIncrement()) {
							task.processRow(row);
						}
					} catch (RuntimeException | Error e) {
						synchronized (failure) {
							if (failure[0] == null) failure[0] = e;
						}
						ai.set(height); // others stop at their next row
					}
				}
			};
		}
		startAndJoin(threads);
		if (failure[0] instanceof RuntimeException) {
			throw (RuntimeException) failure[0];
		} else if (failure[0] instanceof Error) {
			throw (Error) failure[0];
		}
	}
}
