package org.circfit.util;

import java.util.concurrent.atomic.AtomicReference;

import ij.Prefs;

/**
 * Starts a fixed set of worker threads, waits for them and hands back the
 * first failure on the calling thread.
 *
 * Thread count defaults to ImageJ's "Parallel threads" preference.
 *
 * @author circfit
 */
public class Multithreader {

	/**
	 * @return an empty thread array sized to ImageJ's thread preference
	 */
	public static Thread[] newThreads() {
		return newThreads(Prefs.getThreads());
	}

	/**
	 * @param numThreads
	 *            requested thread count, at least 1 is always returned
	 * @return an empty thread array
	 */
	public static Thread[] newThreads(final int numThreads) {
		return new Thread[Math.max(1, numThreads)];
	}

	/**
	 * Run the same task on every thread of a new thread array
	 *
	 * @param run
	 *            task, usually pulling work indices from a shared counter
	 * @param numThreads
	 */
	public static void startTask(final Runnable run, final int numThreads) {
		final Thread[] threads = newThreads(numThreads);
		for (int ithread = 0; ithread < threads.length; ++ithread)
			threads[ithread] = new Thread(run);
		startAndJoin(threads);
	}

	/**
	 * Start all threads and wait for them to finish. If any thread dies with
	 * an unchecked exception the first one is rethrown here once all threads
	 * have stopped.
	 *
	 * @param threads
	 */
	public static void startAndJoin(final Thread[] threads) {
		final AtomicReference<Throwable> failure = new AtomicReference<Throwable>();
		final Thread.UncaughtExceptionHandler handler = new Thread.UncaughtExceptionHandler() {
			public void uncaughtException(final Thread t, final Throwable e) {
				failure.compareAndSet(null, e);
			}
		};
		for (int ithread = 0; ithread < threads.length; ++ithread) {
			threads[ithread].setPriority(Thread.NORM_PRIORITY);
			threads[ithread].setUncaughtExceptionHandler(handler);
			threads[ithread].start();
		}

		try {
			for (int ithread = 0; ithread < threads.length; ++ithread)
				threads[ithread].join();
		} catch (final InterruptedException ie) {
			Thread.currentThread().interrupt();
			throw new RuntimeException(ie);
		}

		final Throwable t = failure.get();
		if (t instanceof RuntimeException)
			throw (RuntimeException) t;
		if (t instanceof Error)
			throw (Error) t;
		if (t != null)
			throw new RuntimeException(t);
	}
}
