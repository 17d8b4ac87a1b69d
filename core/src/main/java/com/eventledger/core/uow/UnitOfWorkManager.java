package com.eventledger.core.uow;

import com.eventledger.core.event.RecordedEvent;
import com.eventledger.core.exception.UnitOfWorkAlreadyActiveException;
import com.eventledger.core.exception.VersionConflictException;
import com.eventledger.core.notification.NotificationSink;
import com.eventledger.core.store.EventSourcingRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.support.TransactionOperations;

import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Unit of Work Manager: scoped acquisition of a {@link UnitOfWork}.
 *
 * execute(work):
 *  1. Fails fast with UnitOfWorkAlreadyActive if the thread already holds a scope
 *  2. Binds a fresh unit of work to the thread
 *  3. Runs the work and flushes the buffers inside ONE storage transaction
 *  4. Unbinds on every exit path; on failure the buffers are discarded and the
 *     original exception is rethrown (the transaction rolls back)
 *  5. After commit, publishes each appended event to the notification sink
 *     (best-effort: sink failures are logged, never rethrown)
 *
 * No retries: a VersionConflict surfaces to the caller, which must redo the whole operation.
 */
@Slf4j
public class UnitOfWorkManager {

    private final TransactionOperations transactionOperations;
    private final EventSourcingRegistry registry;
    private final NotificationSink notificationSink;
    private final Counter committedCounter;
    private final Counter discardedCounter;
    private final Counter conflictCounter;
    private final Counter publishFailureCounter;
    private final Timer commitTimer;

    public UnitOfWorkManager(TransactionOperations transactionOperations,
                             EventSourcingRegistry registry,
                             NotificationSink notificationSink,
                             MeterRegistry meterRegistry) {
        this.transactionOperations = transactionOperations;
        this.registry = registry;
        this.notificationSink = notificationSink;
        this.committedCounter = Counter.builder("unit_of_work.completed")
                .tag("outcome", "committed")
                .description("Units of work committed")
                .register(meterRegistry);
        this.discardedCounter = Counter.builder("unit_of_work.completed")
                .tag("outcome", "discarded")
                .description("Units of work discarded after a failure")
                .register(meterRegistry);
        this.conflictCounter = Counter.builder("unit_of_work.completed")
                .tag("outcome", "conflict")
                .description("Units of work rejected by an optimistic-lock conflict")
                .register(meterRegistry);
        this.publishFailureCounter = Counter.builder("unit_of_work.publish.failures")
                .description("Committed events the notification sink failed to accept")
                .register(meterRegistry);
        this.commitTimer = Timer.builder("unit_of_work.commit.duration")
                .description("Time from scope entry to commit")
                .register(meterRegistry);
    }

    public <T> T execute(Function<UnitOfWork, T> work) {
        if (UnitOfWork.current().isPresent()) {
            throw new UnitOfWorkAlreadyActiveException();
        }
        UnitOfWork unitOfWork = new UnitOfWork();
        UnitOfWork.bind(unitOfWork);
        Timer.Sample sample = Timer.start();

        Outcome<T> outcome;
        try {
            outcome = transactionOperations.execute(status -> {
                T result = work.apply(unitOfWork);
                List<RecordedEvent> appended = unitOfWork.flush(registry);
                return new Outcome<>(result, appended);
            });
        } catch (VersionConflictException e) {
            unitOfWork.discard();
            conflictCounter.increment();
            log.warn("Unit of work rejected: unitOfWork={}, reason={}", unitOfWork.getId(), e.getMessage());
            throw e;
        } catch (RuntimeException | Error e) {
            unitOfWork.discard();
            discardedCounter.increment();
            log.warn("Unit of work discarded: unitOfWork={}, error={}", unitOfWork.getId(), e.toString());
            throw e;
        } finally {
            UnitOfWork.unbind();
        }

        unitOfWork.close();
        sample.stop(commitTimer);
        committedCounter.increment();
        log.info("Unit of work committed: unitOfWork={}, events={}", unitOfWork.getId(), outcome.events.size());

        publish(outcome.events);
        return outcome.result;
    }

    public void run(Consumer<UnitOfWork> work) {
        execute(unitOfWork -> {
            work.accept(unitOfWork);
            return null;
        });
    }

    public boolean isActive() {
        return UnitOfWork.current().isPresent();
    }

    private void publish(List<RecordedEvent> events) {
        for (RecordedEvent event : events) {
            try {
                notificationSink.publish(event);
            } catch (RuntimeException e) {
                publishFailureCounter.increment();
                log.warn("Failed to publish committed event: aggregateType={}, aggregateId={}, insertionId={}",
                        event.getAggregateType(), event.getAggregateId(), event.getInsertionId(), e);
            }
        }
    }

    private static final class Outcome<T> {
        private final T result;
        private final List<RecordedEvent> events;

        private Outcome(T result, List<RecordedEvent> events) {
            this.result = result;
            this.events = events;
        }
    }
}
