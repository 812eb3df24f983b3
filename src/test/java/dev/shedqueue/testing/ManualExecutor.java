package dev.shedqueue.testing;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.Executor;

/**
 * Collects submitted tasks and runs them only when the test says so, on the test thread.
 */
public class ManualExecutor implements Executor {
    private final Deque<Runnable> tasks = new ArrayDeque<>();

    @Override
    public synchronized void execute(Runnable command) {
        tasks.addLast(command);
    }

    /**
     * Runs queued tasks, including tasks they submit, until none are left.
     *
     * @return number of tasks run
     */
    public int runAll() {
        int ran = 0;
        Runnable next;
        while ((next = poll()) != null) {
            next.run();
            ran++;
        }
        return ran;
    }

    public synchronized int pending() {
        return tasks.size();
    }

    private synchronized Runnable poll() {
        return tasks.pollFirst();
    }
}
