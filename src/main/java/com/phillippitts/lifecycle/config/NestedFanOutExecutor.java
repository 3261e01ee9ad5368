package com.phillippitts.lifecycle.config;

import org.springframework.beans.factory.DisposableBean;

import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Executor that runs a task on the submitting thread when that thread is itself running a
 * task of any {@code NestedFanOutExecutor}.
 *
 * <p>Handlers and subscribers fan out and then join. When one of them triggers another
 * transition, the nested fan-out would otherwise queue behind the workers that are waiting
 * for it; with every worker joining, the pool never drains. Running nested work inline keeps
 * pool threads from ever waiting on their own pool.
 *
 * <p>Destroying this bean destroys the delegate when it is itself a {@link DisposableBean}.
 */
public final class NestedFanOutExecutor implements Executor, DisposableBean {

    private static final ThreadLocal<Boolean> IN_TASK = ThreadLocal.withInitial(() -> Boolean.FALSE);

    private final Executor delegate;

    public NestedFanOutExecutor(Executor delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public void execute(Runnable task) {
        Objects.requireNonNull(task, "task");
        if (IN_TASK.get()) {
            task.run();
            return;
        }
        delegate.execute(() -> {
            IN_TASK.set(Boolean.TRUE);
            try {
                task.run();
            } finally {
                IN_TASK.remove();
            }
        });
    }

    public Executor delegate() {
        return delegate;
    }

    @Override
    public void destroy() throws Exception {
        if (delegate instanceof DisposableBean disposable) {
            disposable.destroy();
        }
    }
}
