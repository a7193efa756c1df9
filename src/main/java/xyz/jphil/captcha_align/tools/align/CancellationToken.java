package xyz.jphil.captcha_align.tools.align;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag polled by long-running searches
 */
@FunctionalInterface
public interface CancellationToken {

    boolean isCancellationRequested();

    static CancellationToken none() {
        return () -> false;
    }

    /**
     * Token that the owner cancels explicitly
     */
    final class Source implements CancellationToken {
        private final AtomicBoolean cancelled = new AtomicBoolean(false);

        public void cancel() {
            cancelled.set(true);
        }

        @Override
        public boolean isCancellationRequested() {
            return cancelled.get();
        }
    }
}
