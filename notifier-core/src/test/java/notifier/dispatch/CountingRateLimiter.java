package notifier.dispatch;

import notifier.ratelimit.RateLimiter;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

class CountingRateLimiter implements RateLimiter {

    final AtomicInteger acquired = new AtomicInteger();
    final AtomicInteger starts = new AtomicInteger();
    final AtomicInteger shutdowns = new AtomicInteger();
    private boolean interrupt;

    CountingRateLimiter interruptOnAcquire() {
        this.interrupt = true;
        return this;
    }

    @Override
    public Duration acquire() throws InterruptedException {
        if (interrupt) {
            throw new InterruptedException("test");
        }
        acquired.incrementAndGet();
        return Duration.ZERO;
    }

    @Override
    public void start() {
        starts.incrementAndGet();
    }

    @Override
    public void shutdown() {
        shutdowns.incrementAndGet();
    }
}
