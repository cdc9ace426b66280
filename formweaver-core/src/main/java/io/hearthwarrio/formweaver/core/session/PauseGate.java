package io.hearthwarrio.formweaver.core.session;

/**
 * Gate the session worker waits on while paused.
 * <p>
 * The worker closes the gate before it reports the pause; resuming opens the same gate and the same worker
 * carries on.
 */
public final class PauseGate {

    private final Object monitor = new Object();
    private boolean open = true;

    public void close() {
        synchronized (monitor) {
            open = false;
        }
    }

    public void open() {
        synchronized (monitor) {
            open = true;
            monitor.notifyAll();
        }
    }

    public boolean isOpen() {
        synchronized (monitor) {
            return open;
        }
    }

    public void awaitOpen() throws InterruptedException {
        synchronized (monitor) {
            while (!open) {
                monitor.wait();
            }
        }
    }
}
