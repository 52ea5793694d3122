package org.javai.fedquery;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Future;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Request-wide cancellation. Stages register the futures of their outstanding AI and database
 * calls, and work running on the caller's thread is wrapped in {@link #interruptible(Supplier)};
 * {@link #cancel()} interrupts every one of them.
 */
public final class CancellationSignal {

	private static final Logger logger = LoggerFactory.getLogger(CancellationSignal.class);

	private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
	private volatile boolean cancelled;

	public boolean isCancelled() {
		return cancelled;
	}

	public void cancel() {
		synchronized (this) {
			if (cancelled) {
				return;
			}
			cancelled = true;
		}
		logger.info("Cancelling request with {} outstanding tasks", listeners.size());
		for (Runnable listener : listeners) {
			try {
				listener.run();
			} catch (RuntimeException e) {
				logger.warn("Cancellation listener failed", e);
			}
		}
	}

	/**
	 * Run a callback on cancellation, immediately if already cancelled.
	 */
	public void onCancel(Runnable listener) {
		boolean runNow;
		synchronized (this) {
			listeners.add(listener);
			runNow = cancelled;
		}
		if (runNow) {
			listener.run();
		}
	}

	/**
	 * Cancel (with interruption) the future when this signal fires.
	 */
	public <F extends Future<?>> F track(F future) {
		onCancel(() -> future.cancel(true));
		return future;
	}

	/**
	 * Run work on the calling thread, interrupting that thread if this signal fires meanwhile.
	 *
	 * <p>The interrupt is delivered only while the work runs. If the signal fired, the interrupt
	 * status it caused is cleared and the call ends with a {@link CancellationException}, whatever
	 * the work returned or threw.</p>
	 */
	public <T> T interruptible(Supplier<T> work) {
		throwIfCancelled();
		StageInterrupter interrupter = new StageInterrupter(Thread.currentThread());
		onCancel(interrupter);
		try {
			T result = work.get();
			throwIfCancelled();
			return result;
		} catch (RuntimeException e) {
			if (cancelled && !(e instanceof CancellationException)) {
				CancellationException cancellation = new CancellationException("Request was cancelled");
				cancellation.initCause(e);
				throw cancellation;
			}
			throw e;
		} finally {
			listeners.remove(interrupter);
			if (interrupter.finish()) {
				Thread.interrupted();
			}
		}
	}

	private static final class StageInterrupter implements Runnable {

		private final Thread thread;
		private boolean active = true;
		private boolean fired;

		StageInterrupter(Thread thread) {
			this.thread = thread;
		}

		@Override
		public synchronized void run() {
			if (active) {
				fired = true;
				thread.interrupt();
			}
		}

		/**
		 * Stop delivering interrupts.
		 *
		 * @return whether an interrupt was delivered
		 */
		synchronized boolean finish() {
			active = false;
			return fired;
		}
	}

	public void throwIfCancelled() {
		if (cancelled) {
			throw new CancellationException("Request was cancelled");
		}
	}
}
